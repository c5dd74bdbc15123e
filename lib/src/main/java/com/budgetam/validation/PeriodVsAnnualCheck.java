package com.budgetam.validation;

import com.budgetam.ledger.FlattenedRecord;
import com.budgetam.ledger.OverallTotals;
import com.budgetam.schema.AmountField;
import com.budgetam.schema.HierarchyLevel;
import com.budgetam.schema.SourceKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Period plans must stay within annual plans, for both the original and the revised pair.
 *
 * <p>A breach is strict when both operands are non-negative and, for the original pair, the revised
 * pair is breached as well. Any other breach (a negative operand, or an original breach the revision
 * already corrected) is reported as a warning. Each level yields one strict result and one warning
 * result.
 */
final class PeriodVsAnnualCheck implements ValidationCheck {
    static final String ID = "period_vs_annual";

    private enum Outcome {
        NONE,
        STRICT,
        DOWNGRADED
    }

    private final ValidationConfig config;

    PeriodVsAnnualCheck(ValidationConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean appliesTo(SourceKind kind) {
        return kind.hasPeriodFields();
    }

    @Override
    public List<CheckResult> validate(List<FlattenedRecord> records, OverallTotals overall, SourceKind kind) {
        List<CheckResult> results = new ArrayList<>();

        List<String> strict = new ArrayList<>();
        List<String> downgraded = new ArrayList<>();
        if (overall != null) {
            evaluate(
                    "Overall",
                    HierarchyLevel.OVERALL,
                    overall.get(AmountField.PERIOD_PLAN),
                    overall.get(AmountField.ANNUAL_PLAN),
                    overall.get(AmountField.REV_PERIOD_PLAN),
                    overall.get(AmountField.REV_ANNUAL_PLAN),
                    "",
                    strict,
                    downgraded);
        }
        addResults(results, HierarchyLevel.OVERALL, strict, downgraded);

        HierarchyView view = new HierarchyView(records);
        for (HierarchyLevel level : kind.shape().recordLevels()) {
            strict = new ArrayList<>();
            downgraded = new ArrayList<>();
            for (FlattenedRecord record : view.entities(level)) {
                evaluate(
                        HierarchyView.capitalize(level),
                        level,
                        HierarchyView.value(record, level, AmountField.PERIOD_PLAN),
                        HierarchyView.value(record, level, AmountField.ANNUAL_PLAN),
                        HierarchyView.value(record, level, AmountField.REV_PERIOD_PLAN),
                        HierarchyView.value(record, level, AmountField.REV_ANNUAL_PLAN),
                        " for " + HierarchyView.location(record),
                        strict,
                        downgraded);
            }
            addResults(results, level, strict, downgraded);
        }
        return results;
    }

    private void addResults(
            List<CheckResult> results, HierarchyLevel level, List<String> strict, List<String> downgraded) {
        results.add(CheckResult.of(ID, config.severity(ID, level), strict));
        results.add(CheckResult.of(ID, Severity.WARNING, downgraded));
    }

    private static void evaluate(
            String label,
            HierarchyLevel level,
            Double period,
            Double annual,
            Double revisedPeriod,
            Double revisedAnnual,
            String suffix,
            List<String> strict,
            List<String> downgraded) {
        boolean revisedBreached = breaches(revisedPeriod, revisedAnnual);

        Outcome original = Outcome.NONE;
        if (breaches(period, annual)) {
            original = period >= 0 && annual >= 0 && revisedBreached ? Outcome.STRICT : Outcome.DOWNGRADED;
        }
        record(original, label, level, AmountField.PERIOD_PLAN, AmountField.ANNUAL_PLAN, period, annual, suffix,
                strict, downgraded);

        Outcome revised = Outcome.NONE;
        if (revisedBreached) {
            revised = revisedPeriod >= 0 && revisedAnnual >= 0 ? Outcome.STRICT : Outcome.DOWNGRADED;
        }
        record(revised, label, level, AmountField.REV_PERIOD_PLAN, AmountField.REV_ANNUAL_PLAN, revisedPeriod,
                revisedAnnual, suffix, strict, downgraded);
    }

    /**
     * Non-negative limit: period above it. Negative limit: period below it. Mixed signs: any non-zero
     * period.
     */
    static boolean breaches(Double period, Double annual) {
        if (period == null || annual == null) {
            return false;
        }
        if (annual >= 0 && period >= 0) {
            return period > annual;
        }
        if (annual < 0 && period < 0) {
            return period < annual;
        }
        return period != 0.0;
    }

    private static void record(
            Outcome outcome,
            String label,
            HierarchyLevel level,
            AmountField periodField,
            AmountField annualField,
            Double period,
            Double annual,
            String suffix,
            List<String> strict,
            List<String> downgraded) {
        if (outcome == Outcome.NONE) {
            return;
        }
        String message = label + " violation: '" + level.column(periodField) + "' (" + HierarchyView.format(period)
                + ") exceeds limit '" + level.column(annualField) + "' (" + HierarchyView.format(annual)
                + ") by " + HierarchyView.format(Math.abs(period - annual)) + suffix;
        if (outcome == Outcome.STRICT) {
            strict.add(message);
        } else {
            downgraded.add(message);
        }
    }
}
