package com.budgetam.schema;

/**
 * Logical financial fields that can appear at any hierarchy level. The column name of a field at a
 * given level is the level prefix followed by {@link #suffix()}, e.g. {@code program_annual_plan}.
 */
public enum AmountField {
    TOTAL("total", false),
    ANNUAL_PLAN("annual_plan", false),
    REV_ANNUAL_PLAN("rev_annual_plan", false),
    PERIOD_PLAN("period_plan", false),
    REV_PERIOD_PLAN("rev_period_plan", false),
    ACTUAL("actual", false),
    ACTUAL_VS_REV_ANNUAL_PLAN("actual_vs_rev_annual_plan", true),
    ACTUAL_VS_REV_PERIOD_PLAN("actual_vs_rev_period_plan", true),
    TOTAL_Y0("total_y0", false),
    TOTAL_Y1("total_y1", false),
    TOTAL_Y2("total_y2", false);

    private final String suffix;
    private final boolean percentage;

    AmountField(String suffix, boolean percentage) {
        this.suffix = suffix;
        this.percentage = percentage;
    }

    public String suffix() {
        return suffix;
    }

    /** Execution-rate fields, stored as fractions (0.712 for 71.2%). */
    public boolean isPercentage() {
        return percentage;
    }
}
