package com.budgetam.loader;

import static com.budgetam.testing.TestWorkbooks.row;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.budgetam.ledger.BudgetDataset;
import com.budgetam.ledger.FlattenedRecord;
import com.budgetam.schema.AmountField;
import com.budgetam.schema.HierarchyLevel;
import com.budgetam.schema.SourceKind;
import com.budgetam.testing.TestWorkbooks;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class BudgetLoaderTest {

    @TempDir
    Path tempDir;

    private final BudgetLoader loader = new BudgetLoader();

    @Test
    void loadsLegacyBudgetLaw() throws Exception {
        Path file = TestWorkbooks.write(tempDir, "2023_budget.xlsx", TestWorkbooks.legacyBudgetLaw());

        BudgetDataset dataset = loader.load(file, SourceKind.BUDGET_LAW, 2023).getDataset();

        assertEquals(4, dataset.getRecords().size());
        assertEquals(1_000_000.0, dataset.getOverall().get(AmountField.TOTAL));
        FlattenedRecord last = dataset.getRecords().get(3);
        assertEquals("State Body 2", last.getStateBody());
        assertEquals(1003, last.getProgramCode());
        assertEquals(13001, last.getSubprogramCode());
        assertEquals(400_000.0, last.amounts(HierarchyLevel.STATE_BODY).get(AmountField.TOTAL));
        assertEquals("2023_budget.xlsx", dataset.getSourceName());
    }

    @Test
    void repeatedLoadsAreIdentical() throws Exception {
        Path file = TestWorkbooks.write(tempDir, "budget.xlsx", TestWorkbooks.legacyBudgetLaw());

        BudgetDataset first = loader.load(file, SourceKind.BUDGET_LAW, 2023).getDataset();
        BudgetDataset second = loader.load(file, SourceKind.BUDGET_LAW, 2023).getDataset();

        assertEquals(first.getRecords(), second.getRecords());
        assertEquals(first.getOverall(), second.getOverall());
    }

    @Test
    void loads2025BudgetLaw() throws Exception {
        Path file = TestWorkbooks.write(tempDir, "2025_budget.xlsx", TestWorkbooks.budgetLaw2025());

        BudgetDataset dataset = loader.load(file, SourceKind.BUDGET_LAW, 2025).getDataset();

        assertEquals(2, dataset.getRecords().size());
        FlattenedRecord record = dataset.getRecords().get(1);
        assertEquals("Ministry of Finance", record.getStateBody());
        assertEquals(1010, record.getProgramCode());
        assertEquals(1010, record.getProgramCodeExt());
        assertEquals(11002, record.getSubprogramCode());
        assertEquals("Fiscal policy", record.getProgramName());
        assertEquals("Debt management", record.getSubprogramName());
        assertEquals("Manage debt", record.getSubprogramDesc());
        assertEquals(200.0, record.amounts(HierarchyLevel.SUBPROGRAM).get(AmountField.TOTAL));
    }

    @Test
    void loadsPlanWithOneRecordPerProgram() throws Exception {
        Path file = TestWorkbooks.write(tempDir, "mtep.xlsx", TestWorkbooks.plan());

        BudgetDataset dataset = loader.load(file, SourceKind.MTEP, 2024).getDataset();

        assertEquals(3, dataset.getRecords().size());
        assertEquals(List.of(2024, 2025, 2026), dataset.getOverall().getPlanYears());
        assertEquals(660.0, dataset.getOverall().get(AmountField.TOTAL_Y1));
        FlattenedRecord primary = dataset.getRecords().get(0);
        assertEquals("Primary care services", primary.getProgramName());
        assertEquals("Improve access", primary.getProgramGoal());
        assertNull(primary.getSubprogramCode());
        assertNull(primary.amounts(HierarchyLevel.SUBPROGRAM));
        assertEquals("Hospitals", dataset.getRecords().get(1).getProgramName());
        assertEquals("Ministry of Education", dataset.getRecords().get(2).getStateBody());
        assertEquals(240.0, dataset.getRecords().get(2).amounts(HierarchyLevel.PROGRAM).get(AmountField.TOTAL_Y2));
    }

    @Test
    void loadsQuarterlySpendingWithPercentages() throws Exception {
        List<List<Object>> rows = new ArrayList<>();
        rows.add(row(null, null, TestWorkbooks.TOTAL, 1000, 1000, 500, 500, 250, 25, 50));
        rows.add(row(null, null, "Ministry", 1000, 1000, 500, 500, 250, 25, 50));
        TestWorkbooks.legacyProgram(rows, 1001, "Roads", 1000, 1000, 500, 500, 250, 25, 50);
        TestWorkbooks.legacySubprogram(rows, "11001", "Repairs", 1000, 1000, 500, 500, 250, "25%", "-");
        Path file = TestWorkbooks.write(tempDir, "q2.xlsx", rows);

        BudgetDataset dataset = loader.load(file, SourceKind.SPENDING_Q12, 2023).getDataset();

        FlattenedRecord record = dataset.getRecords().get(0);
        assertEquals(0.25, record.amounts(HierarchyLevel.SUBPROGRAM).get(AmountField.ACTUAL_VS_REV_ANNUAL_PLAN), 1e-12);
        assertEquals(0.0, record.amounts(HierarchyLevel.SUBPROGRAM).get(AmountField.ACTUAL_VS_REV_PERIOD_PLAN));
        assertEquals(0.5, dataset.getOverall().get(AmountField.ACTUAL_VS_REV_PERIOD_PLAN), 1e-12);
        assertEquals(250.0, record.amounts(HierarchyLevel.PROGRAM).get(AmountField.ACTUAL));
    }

    @Test
    void unreadableFileIsWrapped() {
        Path missing = tempDir.resolve("missing.xlsx");

        assertThrows(WorkbookReadException.class, () -> loader.load(missing, SourceKind.BUDGET_LAW, 2023));
    }

    @Test
    void budgetLawSubprogramsAddUpToTheirStateBody() throws Exception {
        Path legacy = TestWorkbooks.write(tempDir, "legacy.xlsx", TestWorkbooks.legacyBudgetLaw());
        Path layout2025 = TestWorkbooks.write(tempDir, "2025.xlsx", TestWorkbooks.budgetLaw2025());

        assertLeavesSumToStateBodies(loader.load(legacy, SourceKind.BUDGET_LAW, 2023).getDataset(), 2);
        assertLeavesSumToStateBodies(loader.load(layout2025, SourceKind.BUDGET_LAW, 2025).getDataset(), 1);
    }

    @Test
    void planProgramsAddUpToTheirStateBody() throws Exception {
        Path file = TestWorkbooks.write(tempDir, "mtep.xlsx", TestWorkbooks.plan());
        BudgetDataset dataset = loader.load(file, SourceKind.MTEP, 2024).getDataset();

        for (AmountField field : List.of(AmountField.TOTAL_Y0, AmountField.TOTAL_Y1, AmountField.TOTAL_Y2)) {
            Map<String, Double> sums = new LinkedHashMap<>();
            for (FlattenedRecord record : dataset.getRecords()) {
                sums.merge(record.getStateBody(), record.amounts(HierarchyLevel.PROGRAM).get(field), Double::sum);
            }
            for (FlattenedRecord record : dataset.getRecords()) {
                assertEquals(
                        record.amounts(HierarchyLevel.STATE_BODY).get(field), sums.get(record.getStateBody()), 0.5);
            }
        }
    }

    @Test
    void programCodesAndNamesCorrespondOneToOne() throws Exception {
        Path legacy = TestWorkbooks.write(tempDir, "legacy.xlsx", TestWorkbooks.legacyBudgetLaw());
        Path layout2025 = TestWorkbooks.write(tempDir, "2025.xlsx", TestWorkbooks.budgetLaw2025());
        Path plan = TestWorkbooks.write(tempDir, "mtep.xlsx", TestWorkbooks.plan());

        assertCodesMatchNames(loader.load(legacy, SourceKind.BUDGET_LAW, 2023).getDataset(), 3);
        assertCodesMatchNames(loader.load(layout2025, SourceKind.BUDGET_LAW, 2025).getDataset(), 1);
        assertCodesMatchNames(loader.load(plan, SourceKind.MTEP, 2024).getDataset(), 3);
    }

    private static void assertLeavesSumToStateBodies(BudgetDataset dataset, int stateBodies) {
        Map<String, Double> sums = new LinkedHashMap<>();
        for (FlattenedRecord record : dataset.getRecords()) {
            double total = record.amounts(HierarchyLevel.SUBPROGRAM).get(AmountField.TOTAL);
            sums.merge(record.getStateBody(), total, Double::sum);
        }
        assertEquals(stateBodies, sums.size());
        for (FlattenedRecord record : dataset.getRecords()) {
            assertEquals(
                    record.amounts(HierarchyLevel.STATE_BODY).get(AmountField.TOTAL),
                    sums.get(record.getStateBody()),
                    1.0,
                    record.getStateBody());
        }
    }

    private static void assertCodesMatchNames(BudgetDataset dataset, int programs) {
        Set<Integer> codes = new HashSet<>();
        Set<String> names = new HashSet<>();
        for (FlattenedRecord record : dataset.getRecords()) {
            codes.add(record.getProgramCode());
            names.add(record.getProgramName());
        }
        assertEquals(programs, codes.size());
        assertEquals(codes.size(), names.size());
    }
}
