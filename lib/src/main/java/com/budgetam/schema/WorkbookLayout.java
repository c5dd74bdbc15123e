package com.budgetam.schema;

/**
 * Row grammars seen in published workbooks. The same source kind changed layout over the years, so
 * the layout is derived from both the kind and the fiscal year.
 */
public enum WorkbookLayout {
    /** 2019-2024 budget laws and all spending reports: label rows follow each header. */
    LEGACY,
    /** 2025+ budget laws: one row per entity, descriptions inline. */
    LAYOUT_2025,
    /** Medium-term expenditure plan: state body and program only, three forecast years. */
    PLAN;

    public static final int FIRST_2025_YEAR = 2025;

    public static WorkbookLayout of(SourceKind kind, int year) {
        if (kind == SourceKind.MTEP) {
            return PLAN;
        }
        if (kind == SourceKind.BUDGET_LAW && year >= FIRST_2025_YEAR) {
            return LAYOUT_2025;
        }
        return LEGACY;
    }
}
