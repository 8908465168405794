package com.defaultrisk.infrastructure.dataset;

import com.defaultrisk.domain.exception.DatasetReadException;
import com.defaultrisk.domain.model.DatasetRef;
import com.defaultrisk.domain.model.RawDataset;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads a staged dataset into a {@link RawDataset}.
 *
 * CSV files are parsed with OpenCSV, spreadsheets with Apache POI (first sheet only).
 * The first row is the header. Rows with no non-blank cell are skipped. Numeric
 * spreadsheet cells are rendered as plain decimals, so an integer cell reads as
 * {@code "42"} rather than {@code "42.0"}.
 */
@Slf4j
@Component
public class DatasetReader {

    private static final char UTF8_BOM = '\uFEFF';

    public RawDataset read(DatasetRef ref) {
        Path path = Path.of(ref.getPath());
        if (!Files.isRegularFile(path)) {
            throw new DatasetReadException("Staged dataset not found: " + ref.getPath());
        }

        String nameForFormat = ref.getOriginalFilename() != null ? ref.getOriginalFilename() : ref.getPath();
        DatasetFormat format = DatasetFormat.fromFilename(nameForFormat)
                .or(() -> DatasetFormat.fromFilename(ref.getPath()))
                .orElseThrow(() -> new DatasetReadException("Unsupported dataset format: " + nameForFormat));

        List<List<String>> table = format == DatasetFormat.EXCEL ? readWorkbook(path) : readCsv(path);

        if (table.isEmpty()) {
            throw new DatasetReadException("Dataset has no header row: " + nameForFormat);
        }

        List<String> headers = table.get(0);
        List<List<String>> rows = table.subList(1, table.size()).stream()
                .filter(DatasetReader::hasContent)
                .collect(Collectors.toList());

        log.debug("Read dataset {} ({}): {} columns, {} rows", nameForFormat, format, headers.size(), rows.size());
        return new RawDataset(headers, rows);
    }

    private List<List<String>> readCsv(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReaderBuilder(reader).build()) {
            List<List<String>> table = new ArrayList<>();
            for (String[] line : csv.readAll()) {
                table.add(new ArrayList<>(Arrays.asList(line)));
            }
            stripBom(table);
            return table;
        } catch (IOException | CsvException e) {
            throw new DatasetReadException("Failed to read CSV dataset: " + e.getMessage(), e);
        }
    }

    private static void stripBom(List<List<String>> table) {
        if (table.isEmpty() || table.get(0).isEmpty()) {
            return;
        }
        List<String> header = table.get(0);
        String first = header.get(0);
        if (first != null && !first.isEmpty() && first.charAt(0) == UTF8_BOM) {
            header.set(0, first.substring(1));
        }
    }

    private List<List<String>> readWorkbook(Path path) {
        try (Workbook workbook = WorkbookFactory.create(path.toFile(), null, true)) {
            if (workbook.getNumberOfSheets() == 0) {
                return List.of();
            }
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter();

            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null || headerRow.getLastCellNum() < 0) {
                return List.of();
            }
            int width = headerRow.getLastCellNum();

            List<List<String>> table = new ArrayList<>();
            for (int r = sheet.getFirstRowNum(); r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    continue;
                }
                List<String> cells = new ArrayList<>(width);
                for (int c = 0; c < width; c++) {
                    cells.add(cellText(row.getCell(c), formatter));
                }
                table.add(cells);
            }
            return table;
        } catch (IOException | RuntimeException e) {
            throw new DatasetReadException("Failed to read spreadsheet dataset: " + e.getMessage(), e);
        }
    }

    private static String cellText(Cell cell, DataFormatter formatter) {
        if (cell == null) {
            return "";
        }
        CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        if (type == CellType.NUMERIC) {
            if (DateUtil.isCellDateFormatted(cell)) {
                return formatter.formatCellValue(cell);
            }
            return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
        }
        if (type == CellType.STRING) {
            return cell.getStringCellValue();
        }
        if (type == CellType.BOOLEAN) {
            return String.valueOf(cell.getBooleanCellValue());
        }
        return "";
    }

    private static boolean hasContent(List<String> row) {
        return row.stream().anyMatch(cell -> cell != null && !cell.isBlank());
    }
}
