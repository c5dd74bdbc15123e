package com.budgetam.schema;

import java.util.ArrayList;
import java.util.List;

/**
 * The four financial field sets a workbook can carry. Every level of one workbook shares the same
 * shape.
 */
public enum FieldShape {
    BUDGET_LAW(true, AmountField.TOTAL),
    SPENDING_WITH_PERIOD(
            true,
            AmountField.ANNUAL_PLAN,
            AmountField.REV_ANNUAL_PLAN,
            AmountField.PERIOD_PLAN,
            AmountField.REV_PERIOD_PLAN,
            AmountField.ACTUAL,
            AmountField.ACTUAL_VS_REV_ANNUAL_PLAN,
            AmountField.ACTUAL_VS_REV_PERIOD_PLAN),
    SPENDING_ANNUAL(
            true,
            AmountField.ANNUAL_PLAN,
            AmountField.REV_ANNUAL_PLAN,
            AmountField.ACTUAL,
            AmountField.ACTUAL_VS_REV_ANNUAL_PLAN),
    PLAN(false, AmountField.TOTAL_Y0, AmountField.TOTAL_Y1, AmountField.TOTAL_Y2);

    private static final List<String> SUBPROGRAM_IDENTIFIERS = List.of(
            "state_body",
            "program_code",
            "program_code_ext",
            "program_name",
            "program_goal",
            "program_result_desc",
            "subprogram_code",
            "subprogram_name",
            "subprogram_desc",
            "subprogram_type");
    private static final List<String> PROGRAM_IDENTIFIERS =
            List.of("state_body", "program_code", "program_name", "program_goal", "program_result_desc");

    private final boolean subprogramLevel;
    private final List<AmountField> fields;

    FieldShape(boolean subprogramLevel, AmountField... fields) {
        this.subprogramLevel = subprogramLevel;
        this.fields = List.of(fields);
    }

    /** Fields in workbook column order. */
    public List<AmountField> fields() {
        return fields;
    }

    public List<AmountField> amountFields() {
        List<AmountField> result = new ArrayList<>();
        for (AmountField field : fields) {
            if (!field.isPercentage()) {
                result.add(field);
            }
        }
        return List.copyOf(result);
    }

    public List<AmountField> percentageFields() {
        List<AmountField> result = new ArrayList<>();
        for (AmountField field : fields) {
            if (field.isPercentage()) {
                result.add(field);
            }
        }
        return List.copyOf(result);
    }

    public boolean contains(AmountField field) {
        return fields.contains(field);
    }

    public boolean hasSubprogramLevel() {
        return subprogramLevel;
    }

    public List<HierarchyLevel> recordLevels() {
        return subprogramLevel
                ? List.of(HierarchyLevel.STATE_BODY, HierarchyLevel.PROGRAM, HierarchyLevel.SUBPROGRAM)
                : List.of(HierarchyLevel.STATE_BODY, HierarchyLevel.PROGRAM);
    }

    /** Identifier columns of the output record, in output order. */
    public List<String> identifierColumns() {
        return subprogramLevel ? SUBPROGRAM_IDENTIFIERS : PROGRAM_IDENTIFIERS;
    }

    /** Figure columns of the output record: every field at every record level, level by level. */
    public List<String> amountColumns() {
        List<String> columns = new ArrayList<>();
        for (HierarchyLevel level : recordLevels()) {
            for (AmountField field : fields) {
                columns.add(level.column(field));
            }
        }
        return List.copyOf(columns);
    }

    /** Full output column order: identifiers followed by figures. */
    public List<String> recordColumns() {
        List<String> columns = new ArrayList<>(identifierColumns());
        columns.addAll(amountColumns());
        return List.copyOf(columns);
    }
}
