package com.budgetam.calcite;

import com.budgetam.ledger.BudgetDataset;
import com.budgetam.table.CheckResultTable;
import com.budgetam.table.OverallTable;
import com.budgetam.table.RecordTable;
import com.budgetam.validation.CheckResult;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.calcite.schema.Table;
import org.apache.calcite.schema.impl.AbstractSchema;

/**
 * Calcite schema over one parsed workbook: the flattened {@code records}, the grand-total
 * {@code overall} figures and the {@code check_results} of validating them.
 */
public final class BudgetSchema extends AbstractSchema {

    private final Map<String, Table> tables;

    public BudgetSchema(BudgetDataset dataset, List<CheckResult> checkResults) {
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(checkResults, "checkResults");
        Map<String, Table> map = new LinkedHashMap<>();
        map.put(
                RecordTable.NAME,
                new DefinitionCalciteTable(
                        RecordTable.getDefinition(dataset.getSourceKind().shape()),
                        RecordTable.materializeRows(dataset.getSourceKind().shape(), dataset.getRecords())));
        map.put(
                OverallTable.NAME,
                new DefinitionCalciteTable(
                        OverallTable.getDefinition(), OverallTable.materializeRows(dataset.getOverall())));
        map.put(
                CheckResultTable.NAME,
                new DefinitionCalciteTable(
                        CheckResultTable.getDefinition(), CheckResultTable.materializeRows(checkResults)));
        this.tables = Map.copyOf(map);
    }

    @Override
    protected Map<String, Table> getTableMap() {
        return tables;
    }
}
