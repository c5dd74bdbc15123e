package com.budgetam.ledger;

import com.budgetam.schema.AmountField;
import com.budgetam.schema.FieldShape;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Figures from the single grand-total row. A field that was never set is absent; a field set to
 * {@code null} is present but carries no data. The medium-term plan additionally lists the three
 * forecast years its figures belong to.
 */
public final class OverallTotals {
    private final FieldShape shape;
    private final Map<AmountField, Double> values;
    private final List<Integer> planYears;

    private OverallTotals(FieldShape shape, Map<AmountField, Double> values, List<Integer> planYears) {
        this.shape = shape;
        this.values = Collections.unmodifiableMap(values);
        this.planYears = planYears;
    }

    public static Builder builder(FieldShape shape) {
        return new Builder(shape);
    }

    public FieldShape getShape() {
        return shape;
    }

    public boolean contains(AmountField field) {
        return values.containsKey(field);
    }

    /** Value of the field, or {@code null} when absent or missing. */
    public Double get(AmountField field) {
        return values.get(field);
    }

    public Map<AmountField, Double> getValues() {
        return values;
    }

    /** Forecast years for plan workbooks; empty otherwise. */
    public List<Integer> getPlanYears() {
        return planYears;
    }

    /** Figures keyed by {@code overall_<field>} column name, in field order. */
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (Map.Entry<AmountField, Double> entry : values.entrySet()) {
            map.put("overall_" + entry.getKey().suffix(), entry.getValue());
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof OverallTotals that)) {
            return false;
        }
        return shape == that.shape && values.equals(that.values) && planYears.equals(that.planYears);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shape, values, planYears);
    }

    @Override
    public String toString() {
        return "OverallTotals{" + shape + ", " + values + (planYears.isEmpty() ? "" : ", years=" + planYears) + "}";
    }

    public static final class Builder {
        private final FieldShape shape;
        private final EnumMap<AmountField, Double> values = new EnumMap<>(AmountField.class);
        private List<Integer> planYears = List.of();

        private Builder(FieldShape shape) {
            this.shape = Objects.requireNonNull(shape, "shape");
        }

        public Builder put(AmountField field, Double value) {
            if (!shape.contains(field)) {
                throw new IllegalArgumentException(shape + " has no field " + field);
            }
            values.put(field, value);
            return this;
        }

        public Builder planYears(List<Integer> years) {
            this.planYears = List.copyOf(years);
            return this;
        }

        public OverallTotals build() {
            return new OverallTotals(shape, new EnumMap<>(values), planYears);
        }
    }
}
