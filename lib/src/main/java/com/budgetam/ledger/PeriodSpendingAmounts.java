package com.budgetam.ledger;

import com.budgetam.schema.AmountField;
import com.budgetam.schema.FieldShape;
import java.util.Objects;

/** Figures of a quarterly spending report (Q1, Q12, Q123), which also carries period plans. */
public final class PeriodSpendingAmounts implements Amounts {
    private final Double annualPlan;
    private final Double revAnnualPlan;
    private final Double periodPlan;
    private final Double revPeriodPlan;
    private final Double actual;
    private final Double actualVsRevAnnualPlan;
    private final Double actualVsRevPeriodPlan;

    public PeriodSpendingAmounts(
            Double annualPlan,
            Double revAnnualPlan,
            Double periodPlan,
            Double revPeriodPlan,
            Double actual,
            Double actualVsRevAnnualPlan,
            Double actualVsRevPeriodPlan) {
        this.annualPlan = annualPlan;
        this.revAnnualPlan = revAnnualPlan;
        this.periodPlan = periodPlan;
        this.revPeriodPlan = revPeriodPlan;
        this.actual = actual;
        this.actualVsRevAnnualPlan = actualVsRevAnnualPlan;
        this.actualVsRevPeriodPlan = actualVsRevPeriodPlan;
    }

    public Double getAnnualPlan() {
        return annualPlan;
    }

    public Double getRevAnnualPlan() {
        return revAnnualPlan;
    }

    public Double getPeriodPlan() {
        return periodPlan;
    }

    public Double getRevPeriodPlan() {
        return revPeriodPlan;
    }

    public Double getActual() {
        return actual;
    }

    public Double getActualVsRevAnnualPlan() {
        return actualVsRevAnnualPlan;
    }

    public Double getActualVsRevPeriodPlan() {
        return actualVsRevPeriodPlan;
    }

    @Override
    public FieldShape shape() {
        return FieldShape.SPENDING_WITH_PERIOD;
    }

    @Override
    public Double get(AmountField field) {
        return switch (field) {
            case ANNUAL_PLAN -> annualPlan;
            case REV_ANNUAL_PLAN -> revAnnualPlan;
            case PERIOD_PLAN -> periodPlan;
            case REV_PERIOD_PLAN -> revPeriodPlan;
            case ACTUAL -> actual;
            case ACTUAL_VS_REV_ANNUAL_PLAN -> actualVsRevAnnualPlan;
            case ACTUAL_VS_REV_PERIOD_PLAN -> actualVsRevPeriodPlan;
            default -> throw new IllegalArgumentException("Quarterly spending figures have no " + field);
        };
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PeriodSpendingAmounts that)) {
            return false;
        }
        return Objects.equals(annualPlan, that.annualPlan)
                && Objects.equals(revAnnualPlan, that.revAnnualPlan)
                && Objects.equals(periodPlan, that.periodPlan)
                && Objects.equals(revPeriodPlan, that.revPeriodPlan)
                && Objects.equals(actual, that.actual)
                && Objects.equals(actualVsRevAnnualPlan, that.actualVsRevAnnualPlan)
                && Objects.equals(actualVsRevPeriodPlan, that.actualVsRevPeriodPlan);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                annualPlan,
                revAnnualPlan,
                periodPlan,
                revPeriodPlan,
                actual,
                actualVsRevAnnualPlan,
                actualVsRevPeriodPlan);
    }

    @Override
    public String toString() {
        return "PeriodSpendingAmounts{annualPlan=" + annualPlan
                + ", revAnnualPlan=" + revAnnualPlan
                + ", periodPlan=" + periodPlan
                + ", revPeriodPlan=" + revPeriodPlan
                + ", actual=" + actual
                + ", actualVsRevAnnualPlan=" + actualVsRevAnnualPlan
                + ", actualVsRevPeriodPlan=" + actualVsRevPeriodPlan + "}";
    }
}
