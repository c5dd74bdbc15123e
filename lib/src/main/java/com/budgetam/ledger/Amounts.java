package com.budgetam.ledger;

import com.budgetam.schema.AmountField;
import com.budgetam.schema.FieldShape;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Financial figures of one hierarchy entity. Each implementation is a fixed set of fields matching
 * one {@link FieldShape}; a {@code null} value means the figure is missing, which the parser never
 * produces but data assembled elsewhere may.
 */
public sealed interface Amounts
        permits BudgetLawAmounts, PeriodSpendingAmounts, AnnualSpendingAmounts, PlanAmounts {

    FieldShape shape();

    /**
     * @throws IllegalArgumentException if the field is not part of this shape
     */
    Double get(AmountField field);

    static Amounts of(FieldShape shape, Map<AmountField, Double> values) {
        Objects.requireNonNull(shape, "shape");
        Objects.requireNonNull(values, "values");
        switch (shape) {
            case BUDGET_LAW:
                return new BudgetLawAmounts(values.get(AmountField.TOTAL));
            case SPENDING_WITH_PERIOD:
                return new PeriodSpendingAmounts(
                        values.get(AmountField.ANNUAL_PLAN),
                        values.get(AmountField.REV_ANNUAL_PLAN),
                        values.get(AmountField.PERIOD_PLAN),
                        values.get(AmountField.REV_PERIOD_PLAN),
                        values.get(AmountField.ACTUAL),
                        values.get(AmountField.ACTUAL_VS_REV_ANNUAL_PLAN),
                        values.get(AmountField.ACTUAL_VS_REV_PERIOD_PLAN));
            case SPENDING_ANNUAL:
                return new AnnualSpendingAmounts(
                        values.get(AmountField.ANNUAL_PLAN),
                        values.get(AmountField.REV_ANNUAL_PLAN),
                        values.get(AmountField.ACTUAL),
                        values.get(AmountField.ACTUAL_VS_REV_ANNUAL_PLAN));
            case PLAN:
                return new PlanAmounts(
                        values.get(AmountField.TOTAL_Y0),
                        values.get(AmountField.TOTAL_Y1),
                        values.get(AmountField.TOTAL_Y2));
            default:
                throw new IllegalArgumentException("Unsupported shape: " + shape);
        }
    }

    /** All figures zero; the parser starts each scan's context from this. */
    static Amounts zero(FieldShape shape) {
        EnumMap<AmountField, Double> values = new EnumMap<>(AmountField.class);
        for (AmountField field : shape.fields()) {
            values.put(field, 0.0);
        }
        return of(shape, values);
    }
}
