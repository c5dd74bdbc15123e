package com.budgetam.validation;

import com.budgetam.ledger.FlattenedRecord;
import com.budgetam.ledger.OverallTotals;
import com.budgetam.schema.AmountField;
import com.budgetam.schema.HierarchyLevel;
import com.budgetam.schema.SourceKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Figures that are missing altogether. Zero is data; only null counts. */
final class MissingFinancialDataCheck implements ValidationCheck {
    static final String ID = "missing_financial_data";

    private final ValidationConfig config;

    MissingFinancialDataCheck(ValidationConfig config) {
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
        List<AmountField> fields = kind.shape().fields();
        List<CheckResult> results = new ArrayList<>();

        List<String> missingOverall = new ArrayList<>();
        for (AmountField field : fields) {
            if (overall == null || overall.get(field) == null) {
                missingOverall.add("overall_" + field.suffix());
            }
        }
        Severity overallSeverity = config.severity(ID, HierarchyLevel.OVERALL);
        if (missingOverall.isEmpty()) {
            results.add(CheckResult.passed(ID, overallSeverity));
        } else {
            results.add(CheckResult.failed(
                    ID,
                    overallSeverity,
                    missingOverall.size(),
                    List.of("Missing overall fields: " + String.join(", ", missingOverall))));
        }

        HierarchyView view = new HierarchyView(records);
        for (HierarchyLevel level : kind.shape().recordLevels()) {
            List<String> messages = new ArrayList<>();
            for (FlattenedRecord record : view.entities(level)) {
                for (AmountField field : fields) {
                    if (HierarchyView.value(record, level, field) == null) {
                        messages.add("Row " + record.getSourceRow() + ": Missing data for '"
                                + level.column(field) + "' in " + HierarchyView.location(record));
                    }
                }
            }
            results.add(CheckResult.of(ID, config.severity(ID, level), messages));
        }
        return results;
    }
}
