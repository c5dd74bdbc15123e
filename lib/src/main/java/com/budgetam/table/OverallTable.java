package com.budgetam.table;

import com.budgetam.ledger.OverallTotals;
import com.budgetam.schema.AmountField;
import java.util.ArrayList;
import java.util.List;

/** Grand-total figures as {@code (field, value)} pairs, plus one row per forecast year for plans. */
public final class OverallTable {
    public static final String NAME = "overall";

    private static final TableDefinition DEFINITION = new TableDefinition(
            NAME,
            "Grand-total row",
            List.of(ColumnDescriptor.varchar("field", false), ColumnDescriptor.doubleColumn("value", true)));

    private OverallTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(OverallTotals overall) {
        List<Object[]> rows = new ArrayList<>();
        for (AmountField field : overall.getShape().fields()) {
            if (overall.contains(field)) {
                rows.add(new Object[] {"overall_" + field.suffix(), overall.get(field)});
            }
        }
        List<Integer> years = overall.getPlanYears();
        for (int i = 0; i < years.size(); i++) {
            rows.add(new Object[] {"plan_year_y" + i, years.get(i).doubleValue()});
        }
        return rows;
    }
}
