package com.budgetam.validation;

import com.budgetam.ledger.FlattenedRecord;
import com.budgetam.ledger.OverallTotals;
import com.budgetam.schema.AmountField;
import com.budgetam.schema.HierarchyLevel;
import com.budgetam.schema.SourceKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.DoublePredicate;

/**
 * Execution rates outside a bound, counted per field. Shared by the negative-rate and over-100% checks,
 * which differ only in the predicate and wording.
 */
abstract class PercentageBoundsCheck implements ValidationCheck {
    private final String id;
    private final ValidationConfig config;
    private final DoublePredicate outOfBounds;

    PercentageBoundsCheck(String id, ValidationConfig config, DoublePredicate outOfBounds) {
        this.id = Objects.requireNonNull(id, "id");
        this.config = Objects.requireNonNull(config, "config");
        this.outOfBounds = Objects.requireNonNull(outOfBounds, "outOfBounds");
    }

    @Override
    public final String id() {
        return id;
    }

    @Override
    public final boolean appliesTo(SourceKind kind) {
        return kind.isSpending();
    }

    /** Message for the overall fields out of bounds, e.g. {@code Negative overall percentages: a, b}. */
    abstract String overallMessage(List<String> columns);

    /** Message for one field at one level, e.g. {@code Negative program percentages: x (3 rows)}. */
    abstract String levelMessage(HierarchyLevel level, String column, int rows);

    @Override
    public final List<CheckResult> validate(List<FlattenedRecord> records, OverallTotals overall, SourceKind kind) {
        List<AmountField> fields = kind.shape().percentageFields();
        List<CheckResult> results = new ArrayList<>();

        List<String> overallColumns = new ArrayList<>();
        for (AmountField field : fields) {
            Double value = overall == null ? null : overall.get(field);
            if (value != null && outOfBounds.test(value)) {
                overallColumns.add(HierarchyLevel.OVERALL.column(field));
            }
        }
        Severity overallSeverity = config.severity(id, HierarchyLevel.OVERALL);
        if (overallColumns.isEmpty()) {
            results.add(CheckResult.passed(id, overallSeverity));
        } else {
            results.add(CheckResult.failed(
                    id, overallSeverity, overallColumns.size(), List.of(overallMessage(overallColumns))));
        }

        HierarchyView view = new HierarchyView(records);
        for (HierarchyLevel level : kind.shape().recordLevels()) {
            List<String> messages = new ArrayList<>();
            int failures = 0;
            for (AmountField field : fields) {
                int rows = 0;
                for (FlattenedRecord record : view.entities(level)) {
                    Double value = HierarchyView.value(record, level, field);
                    if (value != null && outOfBounds.test(value)) {
                        rows++;
                    }
                }
                if (rows > 0) {
                    messages.add(levelMessage(level, level.column(field), rows));
                    failures += rows;
                }
            }
            Severity severity = config.severity(id, level);
            results.add(failures == 0
                    ? CheckResult.passed(id, severity)
                    : CheckResult.failed(id, severity, failures, messages));
        }
        return results;
    }
}
