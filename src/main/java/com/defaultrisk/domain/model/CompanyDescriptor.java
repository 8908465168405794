package com.defaultrisk.domain.model;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Identifying and descriptive fields of a company as read from one record.
 * {@code marketCap} and {@code sector} are null when the record leaves them blank.
 * The constraints mirror the company table's column sizes.
 */
@Value
public class CompanyDescriptor {

    public static final int SYMBOL_MAX_LENGTH = 50;
    public static final int NAME_MAX_LENGTH = 255;
    public static final int SECTOR_MAX_LENGTH = 100;
    public static final int MARKET_CAP_PRECISION = 20;
    public static final int MARKET_CAP_SCALE = 2;

    @Size(max = SYMBOL_MAX_LENGTH, message = "Value for column stock_symbol exceeds {max} characters")
    String symbol;

    @Size(max = NAME_MAX_LENGTH, message = "Value for column company_name exceeds {max} characters")
    String name;

    @Digits(integer = MARKET_CAP_PRECISION - MARKET_CAP_SCALE, fraction = MARKET_CAP_SCALE,
            message = "Value for column market_cap exceeds {integer} integer digits")
    BigDecimal marketCap;

    @Size(max = SECTOR_MAX_LENGTH, message = "Value for column sector exceeds {max} characters")
    String sector;
}
