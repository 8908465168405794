package com.defaultrisk.domain.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fixed schema of an uploaded prediction dataset.
 *
 * Header cells are matched against {@link #getColumnName()} case-insensitively,
 * so downstream code never touches raw header strings.
 */
public enum DatasetColumn {

    STOCK_SYMBOL("stock_symbol", true),
    COMPANY_NAME("company_name", true),
    MARKET_CAP("market_cap", false),
    SECTOR("sector", false),
    DEBT_TO_EQUITY_RATIO("debt_to_equity_ratio", false),
    CURRENT_RATIO("current_ratio", false),
    QUICK_RATIO("quick_ratio", false),
    RETURN_ON_EQUITY("return_on_equity", false),
    RETURN_ON_ASSETS("return_on_assets", false),
    PROFIT_MARGIN("profit_margin", false),
    INTEREST_COVERAGE("interest_coverage", false),
    FIXED_ASSET_TURNOVER("fixed_asset_turnover", false),
    TOTAL_DEBT_EBITDA("total_debt_ebitda", false);

    private final String columnName;
    private final boolean required;

    DatasetColumn(String columnName, boolean required) {
        this.columnName = columnName;
        this.required = required;
    }

    public String getColumnName() {
        return columnName;
    }

    public boolean isRequired() {
        return required;
    }

    public static Set<DatasetColumn> requiredColumns() {
        return Arrays.stream(values())
                .filter(DatasetColumn::isRequired)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(DatasetColumn.class)));
    }

    /**
     * Resolve a header cell to a known column. Unknown headers resolve to empty.
     */
    public static Optional<DatasetColumn> fromHeader(String header) {
        if (header == null) {
            return Optional.empty();
        }
        String normalized = header.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.columnName.equals(normalized))
                .findFirst();
    }
}
