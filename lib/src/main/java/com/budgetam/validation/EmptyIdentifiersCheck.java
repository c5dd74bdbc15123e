package com.budgetam.validation;

import com.budgetam.ledger.FlattenedRecord;
import com.budgetam.ledger.OverallTotals;
import com.budgetam.schema.HierarchyLevel;
import com.budgetam.schema.SourceKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Rows whose state body, program or subprogram name is blank. */
final class EmptyIdentifiersCheck implements ValidationCheck {
    static final String ID = "empty_identifiers";

    private final ValidationConfig config;

    EmptyIdentifiersCheck(ValidationConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean appliesTo(SourceKind kind) {
        return true;
    }

    @Override
    public List<CheckResult> validate(List<FlattenedRecord> records, OverallTotals overall, SourceKind kind) {
        List<CheckResult> results = new ArrayList<>();
        for (HierarchyLevel level : kind.shape().recordLevels()) {
            int empty = 0;
            for (FlattenedRecord record : records) {
                String identifier = record.identifier(level);
                if (identifier == null || identifier.isBlank()) {
                    empty++;
                }
            }
            Severity severity = config.severity(ID, level);
            if (empty == 0) {
                results.add(CheckResult.passed(ID, severity));
            } else {
                results.add(CheckResult.failed(
                        ID, severity, empty, List.of("Found " + empty + " rows with empty " + column(level))));
            }
        }
        return results;
    }

    private static String column(HierarchyLevel level) {
        return level == HierarchyLevel.STATE_BODY ? "state_body" : level.key() + "_name";
    }
}
