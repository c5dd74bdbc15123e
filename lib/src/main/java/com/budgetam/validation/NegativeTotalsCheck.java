package com.budgetam.validation;

import com.budgetam.ledger.FlattenedRecord;
import com.budgetam.ledger.OverallTotals;
import com.budgetam.schema.AmountField;
import com.budgetam.schema.HierarchyLevel;
import com.budgetam.schema.SourceKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Negative amounts per level. Leaf-level corrections are expected, so lower levels default to warnings. */
final class NegativeTotalsCheck implements ValidationCheck {
    static final String ID = "negative_totals";

    private final ValidationConfig config;

    NegativeTotalsCheck(ValidationConfig config) {
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
        List<AmountField> fields = kind.shape().amountFields();
        List<CheckResult> results = new ArrayList<>();

        List<String> overallMessages = new ArrayList<>();
        for (AmountField field : fields) {
            Double value = overall == null ? null : overall.get(field);
            if (value != null && value < 0) {
                overallMessages.add("Overall field 'overall_" + field.suffix() + "' has negative value: "
                        + HierarchyView.format(value));
            }
        }
        results.add(CheckResult.of(ID, config.severity(ID, HierarchyLevel.OVERALL), overallMessages));

        HierarchyView view = new HierarchyView(records);
        for (HierarchyLevel level : kind.shape().recordLevels()) {
            List<String> messages = new ArrayList<>();
            for (FlattenedRecord record : view.entities(level)) {
                for (AmountField field : fields) {
                    Double value = HierarchyView.value(record, level, field);
                    if (value != null && value < 0) {
                        messages.add(HierarchyView.capitalize(level) + " field '" + level.column(field)
                                + "' has negative value: " + HierarchyView.format(value) + " for "
                                + HierarchyView.location(record));
                    }
                }
            }
            results.add(CheckResult.of(ID, config.severity(ID, level), messages));
        }
        return results;
    }
}
