package com.budgetam.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.budgetam.ledger.Amounts;
import com.budgetam.ledger.FlattenedRecord;
import com.budgetam.ledger.OverallTotals;
import com.budgetam.schema.AmountField;
import com.budgetam.schema.FieldShape;
import com.budgetam.schema.SourceKind;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class RecordChecksTest {

    private final ValidationConfig config = ValidationConfig.defaults();

    @Test
    void requiredFieldsPassForParsedShape() {
        List<CheckResult> results = new RequiredFieldsCheck(config).validate(
                List.of(Records.law("Ministry", 1, 1, 1, 1, 1)), Records.lawOverall(1), SourceKind.BUDGET_LAW);

        assertEquals(1, results.size());
        assertTrue(results.get(0).isPassed());
    }

    @Test
    void requiredFieldsReportEveryMissingColumn() {
        OverallTotals overall = OverallTotals.builder(FieldShape.PLAN)
                .put(AmountField.TOTAL_Y0, 1.0)
                .put(AmountField.TOTAL_Y1, 1.0)
                .build();

        CheckResult result = new RequiredFieldsCheck(config).validate(List.of(), overall, SourceKind.MTEP).get(0);

        assertFalse(result.isPassed());
        assertEquals(2, result.getFailCount());
        assertEquals(List.of("Missing fields: overall_total_y2, plan_years"), result.getMessages());
    }

    @Test
    void emptyIdentifiersAreCountedPerLevel() {
        FlattenedRecord unnamed = FlattenedRecord.builder()
                .stateBody(" ")
                .programCode(1)
                .programName("Program")
                .subprogramCode(2)
                .stateBodyAmounts(Records.total(1))
                .programAmounts(Records.total(1))
                .subprogramAmounts(Records.total(1))
                .build();

        List<CheckResult> results = new EmptyIdentifiersCheck(config)
                .validate(List.of(unnamed, unnamed), Records.lawOverall(2), SourceKind.BUDGET_LAW);

        assertEquals(List.of("Found 2 rows with empty state_body"), results.get(0).getMessages());
        assertTrue(results.get(1).isPassed());
        assertEquals(Severity.WARNING, results.get(2).getSeverity());
        assertEquals(List.of("Found 2 rows with empty subprogram_name"), results.get(2).getMessages());
    }

    @Test
    void missingFiguresAreNullNotZero() {
        Map<AmountField, Double> missing = new HashMap<>();
        missing.put(AmountField.TOTAL, null);
        Amounts nothing = Amounts.of(FieldShape.BUDGET_LAW, missing);
        FlattenedRecord record = FlattenedRecord.builder()
                .sourceRow(7)
                .stateBody("Ministry")
                .programCode(1001)
                .subprogramCode(11001)
                .stateBodyAmounts(Records.total(0))
                .programAmounts(Records.total(0))
                .subprogramAmounts(nothing)
                .build();
        OverallTotals overall = OverallTotals.builder(FieldShape.BUDGET_LAW).put(AmountField.TOTAL, null).build();

        List<CheckResult> results =
                new MissingFinancialDataCheck(config).validate(List.of(record), overall, SourceKind.BUDGET_LAW);

        assertEquals(List.of("Missing overall fields: overall_total"), results.get(0).getMessages());
        assertTrue(results.get(1).isPassed());
        assertTrue(results.get(2).isPassed());
        assertEquals(
                List.of("Row 7: Missing data for 'subprogram_total' in Ministry | 1001 | 11001"),
                results.get(3).getMessages());
    }

    @Test
    void negativeTotalsSeverityDependsOnLevel() {
        List<FlattenedRecord> records = List.of(
                Records.law("Ministry", -10, 1001, 5, 11001, -2),
                Records.law("Ministry", -10, 1001, 5, 11002, 7));

        List<CheckResult> results =
                new NegativeTotalsCheck(config).validate(records, Records.lawOverall(-5), SourceKind.BUDGET_LAW);

        assertEquals(List.of("Overall field 'overall_total' has negative value: -5.00"), results.get(0).getMessages());
        CheckResult stateBody = results.get(1);
        assertEquals(Severity.ERROR, stateBody.getSeverity());
        // the state body repeats on both records but is one entity
        assertEquals(1, stateBody.getFailCount());
        assertTrue(results.get(2).isPassed());
        CheckResult subprogram = results.get(3);
        assertEquals(Severity.WARNING, subprogram.getSeverity());
        assertEquals(
                List.of("Subprogram field 'subprogram_total' has negative value: -2.00 for Ministry | 1001 | 11001"),
                subprogram.getMessages());
    }

    @Test
    void structureSanityFlagsFlatHierarchies() {
        HierarchicalStructureSanityCheck check = new HierarchicalStructureSanityCheck(config);
        List<FlattenedRecord> flat = List.of(
                Records.law("A", 1, 1, 1, 1, 1),
                Records.law("B", 1, 2, 1, 2, 1));

        CheckResult result = check.validate(flat, Records.lawOverall(2), SourceKind.BUDGET_LAW).get(0);

        assertEquals(Severity.WARNING, result.getSeverity());
        assertEquals(2, result.getFailCount());
        assertTrue(result.getMessages().get(0).startsWith("All state bodies have identical program count (1)"));
    }

    @Test
    void structureSanityAcceptsVaryingProgramCounts() {
        HierarchicalStructureSanityCheck check = new HierarchicalStructureSanityCheck(config);
        List<FlattenedRecord> records = List.of(
                Records.law("State Body 1", 600_000, 1, 300_000, 1, 150_000),
                Records.law("State Body 1", 600_000, 1, 300_000, 2, 150_000),
                Records.law("State Body 1", 600_000, 2, 300_000, 3, 300_000),
                Records.law("State Body 2", 400_000, 3, 400_000, 4, 400_000));

        assertTrue(check.validate(records, Records.lawOverall(1_000_000), SourceKind.BUDGET_LAW).get(0).isPassed());
        assertFalse(check.validate(List.of(), Records.lawOverall(0), SourceKind.BUDGET_LAW).get(0).isPassed());
        assertFalse(check.appliesTo(SourceKind.SPENDING_Q1));
    }

    @Test
    void structureSanityFlagsSingleStateBodyAsIdenticalCounts() {
        HierarchicalStructureSanityCheck check = new HierarchicalStructureSanityCheck(config);
        List<FlattenedRecord> records = List.of(
                Records.law("Only", 2, 1, 1, 1, 1),
                Records.law("Only", 2, 2, 1, 2, 1));

        CheckResult result = check.validate(records, Records.lawOverall(2), SourceKind.BUDGET_LAW).get(0);

        assertFalse(result.isPassed());
        assertEquals(1, result.getFailCount());
        assertEquals(
                List.of("All state bodies have identical program count (2). "
                        + "This suggests degenerate hierarchy or parser failure."),
                result.getMessages());
    }
}
