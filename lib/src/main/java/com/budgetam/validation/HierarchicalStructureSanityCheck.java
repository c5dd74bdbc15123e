package com.budgetam.validation;

import com.budgetam.ledger.FlattenedRecord;
import com.budgetam.ledger.OverallTotals;
import com.budgetam.schema.HierarchyLevel;
import com.budgetam.schema.SourceKind;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Guards against a parser that silently misread an unfamiliar layout: identical program counts
 * across all state bodies are suspicious, and a hierarchy where no state body has more than one
 * program is flat.
 */
final class HierarchicalStructureSanityCheck implements ValidationCheck {
    static final String ID = "hierarchical_structure_sanity";

    private final ValidationConfig config;

    HierarchicalStructureSanityCheck(ValidationConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean appliesTo(SourceKind kind) {
        return kind == SourceKind.BUDGET_LAW;
    }

    @Override
    public List<CheckResult> validate(List<FlattenedRecord> records, OverallTotals overall, SourceKind kind) {
        Map<String, Map<Integer, FlattenedRecord>> programs = new HierarchyView(records).programsByStateBody();
        Set<Integer> distinctCounts = new LinkedHashSet<>();
        int maxCount = 0;
        for (Map<Integer, FlattenedRecord> byCode : programs.values()) {
            distinctCounts.add(byCode.size());
            maxCount = Math.max(maxCount, byCode.size());
        }

        List<String> messages = new ArrayList<>();
        if (distinctCounts.size() == 1) {
            messages.add("All state bodies have identical program count (" + distinctCounts.iterator().next()
                    + "). This suggests degenerate hierarchy or parser failure.");
        }
        if (maxCount <= 1) {
            messages.add("No state body has multiple programs. This suggests flat/broken hierarchical structure.");
        }
        return List.of(CheckResult.of(ID, config.severity(ID, HierarchyLevel.OVERALL), messages));
    }
}
