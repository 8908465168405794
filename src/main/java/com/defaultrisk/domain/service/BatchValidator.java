package com.defaultrisk.domain.service;

import com.defaultrisk.domain.exception.DatasetSchemaException;
import com.defaultrisk.domain.model.DatasetColumn;
import com.defaultrisk.domain.model.DatasetRecord;
import com.defaultrisk.domain.model.RawDataset;
import com.defaultrisk.domain.model.ValidatedDataset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks the shape of a dataset before any record is processed.
 *
 * Header cells are resolved to {@link DatasetColumn}s case-insensitively; unknown
 * headers are ignored and the first occurrence of a repeated header wins. A dataset
 * missing any required column is rejected as a whole.
 */
@Slf4j
@Component
public class BatchValidator {

    public ValidatedDataset validate(RawDataset dataset) {
        Map<DatasetColumn, Integer> positions = new EnumMap<>(DatasetColumn.class);
        List<String> headers = dataset.getHeaders();
        for (int i = 0; i < headers.size(); i++) {
            Optional<DatasetColumn> column = DatasetColumn.fromHeader(headers.get(i));
            if (column.isPresent()) {
                positions.putIfAbsent(column.get(), i);
            }
        }

        Set<String> missing = new TreeSet<>();
        for (DatasetColumn required : DatasetColumn.requiredColumns()) {
            if (!positions.containsKey(required)) {
                missing.add(required.getColumnName());
            }
        }
        if (!missing.isEmpty()) {
            log.warn("Dataset rejected, missing required columns {} (header: {})", missing, headers);
            throw new DatasetSchemaException(missing);
        }

        List<DatasetRecord> records = new ArrayList<>(dataset.getRows().size());
        int recordNumber = 0;
        for (List<String> row : dataset.getRows()) {
            recordNumber++;
            Map<DatasetColumn, String> cells = new EnumMap<>(DatasetColumn.class);
            positions.forEach((column, index) -> {
                if (index < row.size()) {
                    cells.put(column, row.get(index));
                }
            });
            records.add(new DatasetRecord(recordNumber, cells));
        }
        return new ValidatedDataset(records);
    }
}
