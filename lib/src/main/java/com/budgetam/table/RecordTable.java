package com.budgetam.table;

import com.budgetam.ledger.Amounts;
import com.budgetam.ledger.FlattenedRecord;
import com.budgetam.schema.AmountField;
import com.budgetam.schema.FieldShape;
import com.budgetam.schema.HierarchyLevel;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The flat output table: one row per record, identifier columns first, then every figure of every
 * record level. Column order depends only on the field shape.
 */
public final class RecordTable {
    public static final String NAME = "records";

    private static final Map<FieldShape, TableDefinition> DEFINITIONS = createDefinitions();

    private RecordTable() {}

    public static TableDefinition getDefinition(FieldShape shape) {
        return DEFINITIONS.get(shape);
    }

    public static List<Object[]> materializeRows(FieldShape shape, List<FlattenedRecord> records) {
        List<Object[]> rows = new ArrayList<>(records.size());
        int width = getDefinition(shape).getColumns().size();
        for (FlattenedRecord record : records) {
            Object[] row = new Object[width];
            int column = 0;
            row[column++] = record.getStateBody();
            row[column++] = record.getProgramCode();
            if (shape.hasSubprogramLevel()) {
                row[column++] = record.getProgramCodeExt();
            }
            row[column++] = record.getProgramName();
            row[column++] = record.getProgramGoal();
            row[column++] = record.getProgramResultDesc();
            if (shape.hasSubprogramLevel()) {
                row[column++] = record.getSubprogramCode();
                row[column++] = record.getSubprogramName();
                row[column++] = record.getSubprogramDesc();
                row[column++] = record.getSubprogramType();
            }
            for (HierarchyLevel level : shape.recordLevels()) {
                Amounts amounts = record.amounts(level);
                for (AmountField field : shape.fields()) {
                    row[column++] = amounts.get(field);
                }
            }
            rows.add(row);
        }
        return rows;
    }

    private static Map<FieldShape, TableDefinition> createDefinitions() {
        Map<FieldShape, TableDefinition> definitions = new EnumMap<>(FieldShape.class);
        for (FieldShape shape : FieldShape.values()) {
            List<ColumnDescriptor> columns = new ArrayList<>();
            for (String name : shape.identifierColumns()) {
                switch (name) {
                    case "program_code":
                        columns.add(ColumnDescriptor.integer(name, false));
                        break;
                    case "program_code_ext":
                        columns.add(ColumnDescriptor.integer(name, true));
                        break;
                    case "subprogram_code":
                        columns.add(ColumnDescriptor.integer(name, false));
                        break;
                    case "state_body":
                        columns.add(ColumnDescriptor.varchar(name, false));
                        break;
                    default:
                        columns.add(ColumnDescriptor.varchar(name, true));
                        break;
                }
            }
            for (String name : shape.amountColumns()) {
                columns.add(ColumnDescriptor.doubleColumn(name, true));
            }
            definitions.put(shape, new TableDefinition(NAME, "One row per " + leafName(shape), columns));
        }
        return definitions;
    }

    private static String leafName(FieldShape shape) {
        return shape.hasSubprogramLevel() ? "subprogram" : "program";
    }
}
