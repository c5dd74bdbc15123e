package com.budgetam.validation;

import com.budgetam.ledger.FlattenedRecord;
import com.budgetam.ledger.OverallTotals;
import com.budgetam.schema.AmountField;
import com.budgetam.schema.HierarchyLevel;
import com.budgetam.schema.SourceKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reported execution rates agree with {@code actual / revised plan}. A zero or missing denominator
 * skips the comparison.
 */
final class PercentageCalculationCheck implements ValidationCheck {
    static final String ID = "percentage_calculation";

    // absorbs binary rounding at the tolerance boundary
    private static final double EPSILON = 1e-9;

    private record Ratio(AmountField rate, AmountField numerator, AmountField denominator) {}

    private static final Ratio ANNUAL =
            new Ratio(AmountField.ACTUAL_VS_REV_ANNUAL_PLAN, AmountField.ACTUAL, AmountField.REV_ANNUAL_PLAN);
    private static final Ratio PERIOD =
            new Ratio(AmountField.ACTUAL_VS_REV_PERIOD_PLAN, AmountField.ACTUAL, AmountField.REV_PERIOD_PLAN);

    private final ValidationConfig config;

    PercentageCalculationCheck(ValidationConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean appliesTo(SourceKind kind) {
        return kind.isSpending();
    }

    @Override
    public List<CheckResult> validate(List<FlattenedRecord> records, OverallTotals overall, SourceKind kind) {
        List<Ratio> ratios = kind.hasPeriodFields() ? List.of(ANNUAL, PERIOD) : List.of(ANNUAL);
        double tolerance = config.percentageTolerance();
        List<CheckResult> results = new ArrayList<>();

        List<String> overallMessages = new ArrayList<>();
        if (overall != null) {
            for (Ratio ratio : ratios) {
                Double expected = expected(overall.get(ratio.numerator()), overall.get(ratio.denominator()));
                Double reported = overall.get(ratio.rate());
                if (mismatch(expected, reported, tolerance)) {
                    overallMessages.add(String.format(
                            Locale.ROOT,
                            "Overall %s: expected %.4f, reported %.4f, diff %.4f (tolerance %s)",
                            HierarchyLevel.OVERALL.column(ratio.rate()),
                            expected,
                            reported,
                            Math.abs(expected - reported),
                            tolerance));
                }
            }
        }
        results.add(CheckResult.of(ID, config.severity(ID, HierarchyLevel.OVERALL), overallMessages));

        HierarchyView view = new HierarchyView(records);
        for (HierarchyLevel level : kind.shape().recordLevels()) {
            List<String> messages = new ArrayList<>();
            for (FlattenedRecord record : view.entities(level)) {
                for (Ratio ratio : ratios) {
                    Double expected = expected(
                            HierarchyView.value(record, level, ratio.numerator()),
                            HierarchyView.value(record, level, ratio.denominator()));
                    Double reported = HierarchyView.value(record, level, ratio.rate());
                    if (mismatch(expected, reported, tolerance)) {
                        messages.add(String.format(
                                Locale.ROOT,
                                "Row %d: Mismatch for '%s'. Expected: %.4f, Reported: %.4f, Diff: %.4f in %s",
                                record.getSourceRow(),
                                level.column(ratio.rate()),
                                expected,
                                reported,
                                Math.abs(expected - reported),
                                HierarchyView.location(record)));
                    }
                }
            }
            results.add(CheckResult.of(ID, config.severity(ID, level), messages));
        }
        return results;
    }

    private static Double expected(Double numerator, Double denominator) {
        if (numerator == null || denominator == null || denominator == 0.0) {
            return null;
        }
        return numerator / denominator;
    }

    private static boolean mismatch(Double expected, Double reported, double tolerance) {
        return expected != null && reported != null && Math.abs(expected - reported) > tolerance + EPSILON;
    }
}
