package com.budgetam.validation;

import com.budgetam.ledger.BudgetDataset;
import com.budgetam.ledger.FlattenedRecord;
import com.budgetam.ledger.OverallTotals;
import com.budgetam.schema.SourceKind;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs every applicable check in registration order and concatenates their results. Checks are
 * independent, so a failing one never prevents the rest from running.
 */
public final class ValidationRegistry {
    private static final Logger LOGGER = Logger.getLogger(ValidationRegistry.class.getName());

    private final List<ValidationCheck> checks;

    public ValidationRegistry(List<ValidationCheck> checks) {
        this.checks = List.copyOf(Objects.requireNonNull(checks, "checks"));
    }

    public static ValidationRegistry defaultChecks() {
        return defaultChecks(ValidationConfig.defaults());
    }

    public static ValidationRegistry defaultChecks(ValidationConfig config) {
        return new ValidationRegistry(List.of(
                new RequiredFieldsCheck(config),
                new EmptyIdentifiersCheck(config),
                new MissingFinancialDataCheck(config),
                new HierarchicalTotalsCheck(config),
                new NegativeTotalsCheck(config),
                new PeriodVsAnnualCheck(config),
                new NegativePercentagesCheck(config),
                new ExecutionExceeds100Check(config),
                new PercentageCalculationCheck(config),
                new HierarchicalStructureSanityCheck(config)));
    }

    public List<ValidationCheck> getChecks() {
        return checks;
    }

    /**
     * @return results of all checks that apply to {@code kind}, in check order
     */
    public List<CheckResult> run(List<FlattenedRecord> records, OverallTotals overall, SourceKind kind) {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(kind, "kind");
        List<CheckResult> results = new ArrayList<>();
        for (ValidationCheck check : checks) {
            if (!check.appliesTo(kind)) {
                LOGGER.log(Level.FINE, "Skipping {0} for {1}", new Object[] {check.id(), kind});
                continue;
            }
            List<CheckResult> checkResults = check.validate(records, overall, kind);
            LOGGER.log(Level.FINE, "{0}: {1} results", new Object[] {check.id(), checkResults.size()});
            results.addAll(checkResults);
        }
        return results;
    }

    public ValidationReport validate(BudgetDataset dataset) {
        return validate(dataset, Clock.systemUTC());
    }

    public ValidationReport validate(BudgetDataset dataset, Clock clock) {
        Objects.requireNonNull(dataset, "dataset");
        List<CheckResult> results = run(dataset.getRecords(), dataset.getOverall(), dataset.getSourceKind());
        ReportMetadata metadata = new ReportMetadata(
                dataset.getSourceKind(), dataset.getYear(), dataset.getSourceName(), clock.instant());
        return new ValidationReport(metadata, results);
    }
}
