package com.budgetam.ledger;

import com.budgetam.schema.AmountField;
import com.budgetam.schema.FieldShape;
import java.util.Objects;

/** Three forecast-year totals of the medium-term expenditure plan. */
public final class PlanAmounts implements Amounts {
    private final Double totalY0;
    private final Double totalY1;
    private final Double totalY2;

    public PlanAmounts(Double totalY0, Double totalY1, Double totalY2) {
        this.totalY0 = totalY0;
        this.totalY1 = totalY1;
        this.totalY2 = totalY2;
    }

    public Double getTotalY0() {
        return totalY0;
    }

    public Double getTotalY1() {
        return totalY1;
    }

    public Double getTotalY2() {
        return totalY2;
    }

    @Override
    public FieldShape shape() {
        return FieldShape.PLAN;
    }

    @Override
    public Double get(AmountField field) {
        return switch (field) {
            case TOTAL_Y0 -> totalY0;
            case TOTAL_Y1 -> totalY1;
            case TOTAL_Y2 -> totalY2;
            default -> throw new IllegalArgumentException("Plan figures have no " + field);
        };
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PlanAmounts that)) {
            return false;
        }
        return Objects.equals(totalY0, that.totalY0)
                && Objects.equals(totalY1, that.totalY1)
                && Objects.equals(totalY2, that.totalY2);
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalY0, totalY1, totalY2);
    }

    @Override
    public String toString() {
        return "PlanAmounts{y0=" + totalY0 + ", y1=" + totalY1 + ", y2=" + totalY2 + "}";
    }
}
