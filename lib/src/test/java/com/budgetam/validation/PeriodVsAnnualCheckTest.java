package com.budgetam.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.budgetam.ledger.Amounts;
import com.budgetam.schema.SourceKind;
import java.util.List;
import org.junit.jupiter.api.Test;

final class PeriodVsAnnualCheckTest {

    private final PeriodVsAnnualCheck check = new PeriodVsAnnualCheck(ValidationConfig.defaults());

    @Test
    void appliesOnlyToPeriodReports() {
        assertTrue(check.appliesTo(SourceKind.SPENDING_Q1));
        assertTrue(check.appliesTo(SourceKind.SPENDING_Q123));
        assertFalse(check.appliesTo(SourceKind.SPENDING_Q1234));
        assertFalse(check.appliesTo(SourceKind.BUDGET_LAW));
    }

    @Test
    void breachRuleHandlesSigns() {
        assertTrue(PeriodVsAnnualCheck.breaches(120.0, 100.0));
        assertFalse(PeriodVsAnnualCheck.breaches(100.0, 100.0));
        assertTrue(PeriodVsAnnualCheck.breaches(-120.0, -100.0));
        assertFalse(PeriodVsAnnualCheck.breaches(-80.0, -100.0));
        assertTrue(PeriodVsAnnualCheck.breaches(-5.0, 100.0));
        assertTrue(PeriodVsAnnualCheck.breaches(5.0, -100.0));
        assertFalse(PeriodVsAnnualCheck.breaches(0.0, -100.0));
        assertFalse(PeriodVsAnnualCheck.breaches(null, 100.0));
    }

    @Test
    void positiveBreachOfBothPairsIsStrict() {
        Amounts amounts = Records.period(100, 100, 150, 150, 50, 0.5, 0.33);

        List<CheckResult> results =
                check.validate(List.of(Records.spending(amounts)), Records.periodOverall(amounts), SourceKind.SPENDING_Q1);

        // overall plus three record levels, one strict and one downgraded result each
        assertEquals(8, results.size());
        CheckResult overallStrict = results.get(0);
        assertEquals(Severity.ERROR, overallStrict.getSeverity());
        assertEquals(2, overallStrict.getFailCount());
        assertEquals(
                "Overall violation: 'overall_period_plan' (150.00) exceeds limit 'overall_annual_plan' (100.00) by 50.00",
                overallStrict.getMessages().get(0));
        assertTrue(results.get(1).isPassed());
        assertEquals(
                "Subprogram violation: 'subprogram_rev_period_plan' (150.00) exceeds limit "
                        + "'subprogram_rev_annual_plan' (100.00) by 50.00 for Ministry | 1001 | 11001",
                results.get(6).getMessages().get(1));
    }

    @Test
    void revisionThatFixesTheBreachDowngradesIt() {
        Amounts amounts = Records.period(100, 200, 150, 150, 50, 0.25, 0.33);

        List<CheckResult> results =
                check.validate(List.of(Records.spending(amounts)), Records.periodOverall(amounts), SourceKind.SPENDING_Q12);

        CheckResult strict = results.get(0);
        CheckResult downgraded = results.get(1);
        assertTrue(strict.isPassed());
        assertEquals(Severity.WARNING, downgraded.getSeverity());
        assertEquals(1, downgraded.getFailCount());
    }

    @Test
    void negativeOperandDowngradesTheBreach() {
        Amounts amounts = Records.period(-100, -100, -150, -80, 0, 0, 0);

        List<CheckResult> results =
                check.validate(List.of(Records.spending(amounts)), Records.periodOverall(amounts), SourceKind.SPENDING_Q12);

        assertTrue(results.get(0).isPassed());
        assertEquals(1, results.get(1).getFailCount());
    }
}
