package com.defaultrisk.domain.service;

import com.defaultrisk.domain.exception.DatasetSchemaException;
import com.defaultrisk.domain.model.DatasetColumn;
import com.defaultrisk.domain.model.DatasetRecord;
import com.defaultrisk.domain.model.RawDataset;
import com.defaultrisk.domain.model.ValidatedDataset;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BatchValidatorTest {

    private final BatchValidator validator = new BatchValidator();

    @Test
    void validate_matchesHeadersIgnoringCaseAndWhitespace() {
        RawDataset raw = new RawDataset(
                List.of(" STOCK_SYMBOL ", "Company_Name", "Current_Ratio", "notes"),
                List.of(List.of("AAA", "Alpha", "1.25", "ignored")));

        ValidatedDataset dataset = validator.validate(raw);

        assertEquals(1, dataset.size());
        DatasetRecord record = dataset.getRecords().get(0);
        assertEquals(1, record.getRecordNumber());
        assertEquals("AAA", record.requiredText(DatasetColumn.STOCK_SYMBOL));
        assertEquals("Alpha", record.requiredText(DatasetColumn.COMPANY_NAME));
        assertEquals(Optional.of(new BigDecimal("1.25")), record.decimal(DatasetColumn.CURRENT_RATIO));
    }

    @Test
    void validate_missingRequiredColumns_reportsAllMissing() {
        RawDataset raw = new RawDataset(List.of("sector", "current_ratio"), List.of());

        DatasetSchemaException e = assertThrows(DatasetSchemaException.class, () -> validator.validate(raw));

        assertEquals(Set.of("stock_symbol", "company_name"), e.getMissingColumns());
        assertTrue(e.getMessage().contains("company_name"));
    }

    @Test
    void validate_missingOnlyNameColumn() {
        RawDataset raw = new RawDataset(List.of("stock_symbol"), List.of(List.of("AAA")));

        DatasetSchemaException e = assertThrows(DatasetSchemaException.class, () -> validator.validate(raw));

        assertEquals(Set.of("company_name"), e.getMissingColumns());
    }

    @Test
    void validate_shortRowsReadMissingCellsAsAbsent() {
        RawDataset raw = new RawDataset(
                List.of("stock_symbol", "company_name", "sector"),
                List.of(List.of("AAA", "Alpha")));

        DatasetRecord record = validator.validate(raw).getRecords().get(0);

        assertTrue(record.text(DatasetColumn.SECTOR).isEmpty());
    }

    @Test
    void validate_repeatedHeader_firstOccurrenceWins() {
        RawDataset raw = new RawDataset(
                List.of("stock_symbol", "company_name", "stock_symbol"),
                List.of(List.of("FIRST", "Alpha", "SECOND")));

        DatasetRecord record = validator.validate(raw).getRecords().get(0);

        assertEquals("FIRST", record.requiredText(DatasetColumn.STOCK_SYMBOL));
    }

    @Test
    void validate_numbersRecordsInInputOrder() {
        RawDataset raw = new RawDataset(
                List.of("stock_symbol", "company_name"),
                List.of(List.of("A", "a"), List.of("B", "b"), List.of("C", "c")));

        List<DatasetRecord> records = validator.validate(raw).getRecords();

        assertEquals(List.of(1, 2, 3), records.stream().map(DatasetRecord::getRecordNumber).collect(Collectors.toList()));
        assertEquals("C", records.get(2).requiredText(DatasetColumn.STOCK_SYMBOL));
    }
}
