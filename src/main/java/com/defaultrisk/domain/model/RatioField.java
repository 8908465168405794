package com.defaultrisk.domain.model;

/**
 * Numeric ratio inputs fed to the risk scorer, each backed by one dataset column.
 */
public enum RatioField {

    DEBT_TO_EQUITY_RATIO(DatasetColumn.DEBT_TO_EQUITY_RATIO),
    CURRENT_RATIO(DatasetColumn.CURRENT_RATIO),
    QUICK_RATIO(DatasetColumn.QUICK_RATIO),
    RETURN_ON_EQUITY(DatasetColumn.RETURN_ON_EQUITY),
    RETURN_ON_ASSETS(DatasetColumn.RETURN_ON_ASSETS),
    PROFIT_MARGIN(DatasetColumn.PROFIT_MARGIN),
    INTEREST_COVERAGE(DatasetColumn.INTEREST_COVERAGE),
    FIXED_ASSET_TURNOVER(DatasetColumn.FIXED_ASSET_TURNOVER),
    TOTAL_DEBT_EBITDA(DatasetColumn.TOTAL_DEBT_EBITDA);

    private final DatasetColumn column;

    RatioField(DatasetColumn column) {
        this.column = column;
    }

    public DatasetColumn getColumn() {
        return column;
    }
}
