package com.budgetam.loader;

import com.budgetam.ledger.BudgetDataset;
import java.util.List;
import java.util.Objects;

/** Outcome of loading one workbook: the dataset plus the diagnostics gathered along the way. */
public final class LoaderResult {
    private final BudgetDataset dataset;
    private final List<LoaderMessage> messages;
    private final ScanStatistics statistics;

    public LoaderResult(BudgetDataset dataset, List<LoaderMessage> messages, ScanStatistics statistics) {
        this.dataset = Objects.requireNonNull(dataset, "dataset");
        this.messages = List.copyOf(messages);
        this.statistics = Objects.requireNonNull(statistics, "statistics");
    }

    public BudgetDataset getDataset() {
        return dataset;
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }

    public ScanStatistics getStatistics() {
        return statistics;
    }
}
