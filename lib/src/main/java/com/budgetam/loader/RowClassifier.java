package com.budgetam.loader;

import com.budgetam.schema.WorkbookLayout;
import com.budgetam.workbook.RawRow;

/**
 * Assigns a {@link RowType} to a raw row. Implementations evaluate their predicates in a fixed
 * precedence (empty, grand total, subprogram marker, state body, program, subprogram, detail line)
 * and return the first match, falling back to {@link RowType#UNKNOWN}. Classification looks at the
 * row alone.
 */
public interface RowClassifier {

    /** Armenian "total" label of the grand-total row, after label normalization. */
    String GRAND_TOTAL_MARKER = "ընդամենը";

    /** Armenian "program activities" row preceding subprogram blocks, after normalization. */
    String SUBPROGRAM_MARKER = "ծրագրիմիջոցառումներ";

    RowType classify(RawRow row);

    static RowClassifier forLayout(WorkbookLayout layout) {
        return switch (layout) {
            case LEGACY -> new LegacyRowClassifier();
            case LAYOUT_2025 -> new Layout2025RowClassifier();
            case PLAN -> new PlanRowClassifier();
        };
    }
}
