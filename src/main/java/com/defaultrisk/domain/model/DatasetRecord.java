package com.defaultrisk.domain.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One data row of a validated dataset, keyed by {@link DatasetColumn}.
 *
 * Blank cells and not-a-number markers read as absent. A non-blank cell that is not
 * a decimal fails the extraction with {@link IllegalArgumentException}. Commas are
 * accepted only as thousands separators ({@code 1,250,000.5}); {@code 0,75} is rejected.
 */
public final class DatasetRecord {

    private static final Set<String> ABSENT_TOKENS = Set.of("nan", "na", "n/a", "null", "none");
    private static final Pattern GROUPED_DECIMAL = Pattern.compile("^[-+]?\\d{1,3}(,\\d{3})+(\\.\\d+)?$");

    private final int recordNumber;
    private final Map<DatasetColumn, String> cells;

    public DatasetRecord(int recordNumber, Map<DatasetColumn, String> cells) {
        this.recordNumber = recordNumber;
        EnumMap<DatasetColumn, String> copy = new EnumMap<>(DatasetColumn.class);
        copy.putAll(cells);
        this.cells = Collections.unmodifiableMap(copy);
    }

    /**
     * 1-based position of the record among the data rows.
     */
    public int getRecordNumber() {
        return recordNumber;
    }

    public Optional<String> text(DatasetColumn column) {
        String raw = cells.get(column);
        if (isAbsent(raw)) {
            return Optional.empty();
        }
        return Optional.of(raw.trim());
    }

    public String requiredText(DatasetColumn column) {
        return text(column).orElseThrow(() ->
                new IllegalArgumentException("Missing value for column " + column.getColumnName()));
    }

    public Optional<BigDecimal> decimal(DatasetColumn column) {
        Optional<String> value = text(column);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        String raw = value.get();
        String digits = raw;
        if (raw.indexOf(',') >= 0) {
            if (!GROUPED_DECIMAL.matcher(raw).matches()) {
                throw invalidValue(raw, column, null);
            }
            digits = raw.replace(",", "");
        }
        try {
            return Optional.of(new BigDecimal(digits));
        } catch (NumberFormatException e) {
            throw invalidValue(raw, column, e);
        }
    }

    public FinancialRatios ratios() {
        FinancialRatios.Builder builder = FinancialRatios.builder();
        for (RatioField field : RatioField.values()) {
            builder.ratio(field, decimal(field.getColumn()));
        }
        return builder.build();
    }

    private static IllegalArgumentException invalidValue(String raw, DatasetColumn column, Throwable cause) {
        return new IllegalArgumentException(
                "Invalid value '" + raw + "' for column " + column.getColumnName(), cause);
    }

    private static boolean isAbsent(String raw) {
        if (raw == null || raw.isBlank()) {
            return true;
        }
        return ABSENT_TOKENS.contains(raw.trim().toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return "DatasetRecord{" + recordNumber + ", " + cells + "}";
    }
}
