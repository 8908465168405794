package com.defaultrisk.domain.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Point-in-time snapshot of the ratio inputs of one record.
 *
 * A ratio that was blank or not-a-number in the source is absent: {@link #get(RatioField)}
 * returns {@link Optional#empty()} for it. Absent ratios are never represented as zero.
 */
public final class FinancialRatios {

    private static final FinancialRatios EMPTY = new FinancialRatios(new EnumMap<>(RatioField.class));

    private final Map<RatioField, BigDecimal> values;

    private FinancialRatios(EnumMap<RatioField, BigDecimal> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static FinancialRatios empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<BigDecimal> get(RatioField field) {
        return Optional.ofNullable(values.get(field));
    }

    public int presentCount() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Present ratios only, in declaration order.
     */
    public Map<RatioField, BigDecimal> present() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FinancialRatios)) return false;
        return values.equals(((FinancialRatios) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "FinancialRatios" + values;
    }

    public static final class Builder {

        private final EnumMap<RatioField, BigDecimal> values = new EnumMap<>(RatioField.class);

        private Builder() {
        }

        public Builder ratio(RatioField field, Optional<BigDecimal> value) {
            value.ifPresentOrElse(v -> values.put(field, v), () -> values.remove(field));
            return this;
        }

        public Builder ratio(RatioField field, BigDecimal value) {
            return ratio(field, Optional.ofNullable(value));
        }

        public FinancialRatios build() {
            return new FinancialRatios(new EnumMap<>(values));
        }
    }
}
