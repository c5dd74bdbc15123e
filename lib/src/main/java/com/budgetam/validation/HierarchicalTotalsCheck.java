package com.budgetam.validation;

import com.budgetam.ledger.FlattenedRecord;
import com.budgetam.ledger.OverallTotals;
import com.budgetam.schema.AmountField;
import com.budgetam.schema.HierarchyLevel;
import com.budgetam.schema.SourceKind;
import com.budgetam.validation.HierarchyView.ProgramKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Each level's figure equals the sum of its children within the source kind's absolute tolerance:
 * overall against distinct state bodies, state bodies against distinct programs, programs against
 * their subprograms. Produces one result per level and amount field.
 */
final class HierarchicalTotalsCheck implements ValidationCheck {
    static final String ID = "hierarchical_totals";

    private final ValidationConfig config;

    HierarchicalTotalsCheck(ValidationConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean appliesTo(SourceKind kind) {
        return true;
    }

    @Override
    public List<CheckResult> validate(List<FlattenedRecord> records, OverallTotals overall, SourceKind kind) {
        double tolerance = config.tolerance(kind);
        HierarchyView view = new HierarchyView(records);
        List<CheckResult> results = new ArrayList<>();
        for (AmountField field : kind.shape().amountFields()) {
            results.add(checkOverall(view, overall, field, tolerance));
            results.add(checkStateBodies(view, field, tolerance));
            if (kind.shape().hasSubprogramLevel()) {
                results.add(checkPrograms(view, field, tolerance));
            }
        }
        return results;
    }

    private CheckResult checkOverall(HierarchyView view, OverallTotals overall, AmountField field, double tolerance) {
        Severity severity = config.severity(ID, HierarchyLevel.OVERALL);
        Double reported = overall == null ? null : overall.get(field);
        if (reported == null) {
            return CheckResult.passed(ID, severity);
        }
        double sum = 0.0;
        for (FlattenedRecord record : view.stateBodies().values()) {
            sum += valueOrZero(record, HierarchyLevel.STATE_BODY, field);
        }
        List<String> messages = new ArrayList<>();
        double diff = Math.abs(sum - reported);
        if (diff > tolerance) {
            messages.add("Overall overall_" + field.suffix() + ": expected " + HierarchyView.format(sum)
                    + ", got " + HierarchyView.format(reported) + ", diff " + HierarchyView.format(diff)
                    + " (tolerance " + tolerance + ")");
        }
        return CheckResult.of(ID, severity, messages);
    }

    private CheckResult checkStateBodies(HierarchyView view, AmountField field, double tolerance) {
        List<String> messages = new ArrayList<>();
        for (Map.Entry<String, Map<Integer, FlattenedRecord>> entry : view.programsByStateBody().entrySet()) {
            FlattenedRecord stateBody = view.stateBodies().get(entry.getKey());
            double reported = valueOrZero(stateBody, HierarchyLevel.STATE_BODY, field);
            double sum = 0.0;
            for (FlattenedRecord program : entry.getValue().values()) {
                sum += valueOrZero(program, HierarchyLevel.PROGRAM, field);
            }
            double diff = Math.abs(sum - reported);
            if (diff > tolerance) {
                messages.add(entry.getKey() + " [" + HierarchyLevel.STATE_BODY.column(field) + "]: expected "
                        + HierarchyView.format(sum) + ", got " + HierarchyView.format(reported)
                        + ", diff " + HierarchyView.format(diff));
            }
        }
        return CheckResult.of(ID, config.severity(ID, HierarchyLevel.STATE_BODY), messages);
    }

    private CheckResult checkPrograms(HierarchyView view, AmountField field, double tolerance) {
        List<String> messages = new ArrayList<>();
        for (Map.Entry<ProgramKey, List<FlattenedRecord>> entry : view.subprogramsByProgram().entrySet()) {
            FlattenedRecord program = view.programs().get(entry.getKey());
            double reported = valueOrZero(program, HierarchyLevel.PROGRAM, field);
            double sum = 0.0;
            for (FlattenedRecord subprogram : entry.getValue()) {
                sum += valueOrZero(subprogram, HierarchyLevel.SUBPROGRAM, field);
            }
            double diff = Math.abs(sum - reported);
            if (diff > tolerance) {
                messages.add(entry.getKey() + " [" + HierarchyLevel.PROGRAM.column(field) + "]: expected "
                        + HierarchyView.format(sum) + ", got " + HierarchyView.format(reported)
                        + ", diff " + HierarchyView.format(diff));
            }
        }
        return CheckResult.of(ID, config.severity(ID, HierarchyLevel.PROGRAM), messages);
    }

    private static double valueOrZero(FlattenedRecord record, HierarchyLevel level, AmountField field) {
        Double value = HierarchyView.value(record, level, field);
        return value == null ? 0.0 : value;
    }
}
