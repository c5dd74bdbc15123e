package com.budgetam.validation;

import com.budgetam.ledger.FlattenedRecord;
import com.budgetam.ledger.OverallTotals;
import com.budgetam.schema.SourceKind;
import java.util.List;

/**
 * One independent consistency check over a parsed workbook. Checks are side-effect free and always
 * report, passing results included; a failing check never stops the others.
 */
public interface ValidationCheck {

    /** Stable identifier, e.g. {@code hierarchical_totals}. */
    String id();

    /**
     * @return one result per level (and field, where the check distinguishes fields) examined; never
     *     null
     */
    List<CheckResult> validate(List<FlattenedRecord> records, OverallTotals overall, SourceKind kind);

    boolean appliesTo(SourceKind kind);
}
