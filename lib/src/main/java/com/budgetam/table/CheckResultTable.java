package com.budgetam.table;

import com.budgetam.validation.CheckResult;
import java.util.ArrayList;
import java.util.List;

/** Validation results, one row per check result, messages joined by newlines. */
public final class CheckResultTable {
    public static final String NAME = "check_results";

    private static final TableDefinition DEFINITION = new TableDefinition(
            NAME,
            "Validation check results",
            List.of(
                    ColumnDescriptor.varchar("check_id", false),
                    ColumnDescriptor.varchar("severity", false),
                    ColumnDescriptor.bool("passed", false),
                    ColumnDescriptor.integer("fail_count", false),
                    ColumnDescriptor.varchar("messages", true)));

    private CheckResultTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<CheckResult> results) {
        List<Object[]> rows = new ArrayList<>(results.size());
        for (CheckResult result : results) {
            rows.add(new Object[] {
                result.getCheckId(),
                result.getSeverity().label(),
                result.isPassed(),
                result.getFailCount(),
                result.getMessages().isEmpty() ? null : String.join("\n", result.getMessages())
            });
        }
        return rows;
    }
}
