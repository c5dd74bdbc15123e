package com.budgetam.validation;

import com.budgetam.ledger.FlattenedRecord;
import com.budgetam.ledger.OverallTotals;
import com.budgetam.schema.AmountField;
import com.budgetam.schema.FieldShape;
import com.budgetam.schema.HierarchyLevel;
import com.budgetam.schema.SourceKind;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Every column the source kind promises is present on the records and every overall field is
 * present on the grand total. A record assembled with a different shape than its source kind
 * carries only that shape's columns.
 */
final class RequiredFieldsCheck implements ValidationCheck {
    static final String ID = "required_fields";

    private static final List<String> COMMON = List.of("state_body", "program_code", "program_name");
    private static final List<String> DESCRIPTIVE = List.of(
            "program_goal",
            "program_result_desc",
            "subprogram_code",
            "subprogram_name",
            "subprogram_desc",
            "subprogram_type");

    private final ValidationConfig config;

    RequiredFieldsCheck(ValidationConfig config) {
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
        FieldShape shape = kind.shape();
        List<String> required = new ArrayList<>(COMMON);
        if (kind != SourceKind.MTEP) {
            required.addAll(DESCRIPTIVE);
        }
        required.addAll(shape.amountColumns());
        for (AmountField field : shape.fields()) {
            required.add("overall_" + field.suffix());
        }
        if (kind == SourceKind.MTEP) {
            required.add("plan_years");
        }

        Set<String> available = new LinkedHashSet<>(recordColumns(records, shape));
        if (overall != null) {
            available.addAll(overall.asMap().keySet());
            if (!overall.getPlanYears().isEmpty()) {
                available.add("plan_years");
            }
        }

        List<String> missing = new ArrayList<>();
        for (String column : required) {
            if (!available.contains(column)) {
                missing.add(column);
            }
        }
        Severity severity = config.severity(ID, HierarchyLevel.OVERALL);
        if (missing.isEmpty()) {
            return List.of(CheckResult.passed(ID, severity));
        }
        return List.of(CheckResult.failed(
                ID, severity, missing.size(), List.of("Missing fields: " + String.join(", ", missing))));
    }

    private static List<String> recordColumns(List<FlattenedRecord> records, FieldShape expected) {
        for (FlattenedRecord record : records) {
            if (record.getShape() != expected) {
                return record.getShape().recordColumns();
            }
        }
        return expected.recordColumns();
    }
}
