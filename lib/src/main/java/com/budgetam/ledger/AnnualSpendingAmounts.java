package com.budgetam.ledger;

import com.budgetam.schema.AmountField;
import com.budgetam.schema.FieldShape;
import java.util.Objects;

/** Figures of a year-end spending report (Q1234). */
public final class AnnualSpendingAmounts implements Amounts {
    private final Double annualPlan;
    private final Double revAnnualPlan;
    private final Double actual;
    private final Double actualVsRevAnnualPlan;

    public AnnualSpendingAmounts(
            Double annualPlan, Double revAnnualPlan, Double actual, Double actualVsRevAnnualPlan) {
        this.annualPlan = annualPlan;
        this.revAnnualPlan = revAnnualPlan;
        this.actual = actual;
        this.actualVsRevAnnualPlan = actualVsRevAnnualPlan;
    }

    public Double getAnnualPlan() {
        return annualPlan;
    }

    public Double getRevAnnualPlan() {
        return revAnnualPlan;
    }

    public Double getActual() {
        return actual;
    }

    public Double getActualVsRevAnnualPlan() {
        return actualVsRevAnnualPlan;
    }

    @Override
    public FieldShape shape() {
        return FieldShape.SPENDING_ANNUAL;
    }

    @Override
    public Double get(AmountField field) {
        return switch (field) {
            case ANNUAL_PLAN -> annualPlan;
            case REV_ANNUAL_PLAN -> revAnnualPlan;
            case ACTUAL -> actual;
            case ACTUAL_VS_REV_ANNUAL_PLAN -> actualVsRevAnnualPlan;
            default -> throw new IllegalArgumentException("Year-end spending figures have no " + field);
        };
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof AnnualSpendingAmounts that)) {
            return false;
        }
        return Objects.equals(annualPlan, that.annualPlan)
                && Objects.equals(revAnnualPlan, that.revAnnualPlan)
                && Objects.equals(actual, that.actual)
                && Objects.equals(actualVsRevAnnualPlan, that.actualVsRevAnnualPlan);
    }

    @Override
    public int hashCode() {
        return Objects.hash(annualPlan, revAnnualPlan, actual, actualVsRevAnnualPlan);
    }

    @Override
    public String toString() {
        return "AnnualSpendingAmounts{annualPlan=" + annualPlan
                + ", revAnnualPlan=" + revAnnualPlan
                + ", actual=" + actual
                + ", actualVsRevAnnualPlan=" + actualVsRevAnnualPlan + "}";
    }
}
