package com.budgetam.ledger;

import com.budgetam.schema.SourceKind;
import java.util.List;
import java.util.Objects;

/** Everything extracted from one workbook: its records and its grand total. */
public final class BudgetDataset {
    private final SourceKind sourceKind;
    private final int year;
    private final String sourceName;
    private final List<FlattenedRecord> records;
    private final OverallTotals overall;

    public BudgetDataset(
            SourceKind sourceKind,
            int year,
            String sourceName,
            List<FlattenedRecord> records,
            OverallTotals overall) {
        this.sourceKind = Objects.requireNonNull(sourceKind, "sourceKind");
        this.year = year;
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.records = List.copyOf(Objects.requireNonNull(records, "records"));
        this.overall = Objects.requireNonNull(overall, "overall");
    }

    public SourceKind getSourceKind() {
        return sourceKind;
    }

    public int getYear() {
        return year;
    }

    /** File name or other identity of the input. */
    public String getSourceName() {
        return sourceName;
    }

    public List<FlattenedRecord> getRecords() {
        return records;
    }

    public OverallTotals getOverall() {
        return overall;
    }
}
