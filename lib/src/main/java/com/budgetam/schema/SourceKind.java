package com.budgetam.schema;

import java.util.Locale;

/** Report kinds published per fiscal year. */
public enum SourceKind {
    BUDGET_LAW(FieldShape.BUDGET_LAW),
    SPENDING_Q1(FieldShape.SPENDING_WITH_PERIOD),
    SPENDING_Q12(FieldShape.SPENDING_WITH_PERIOD),
    SPENDING_Q123(FieldShape.SPENDING_WITH_PERIOD),
    SPENDING_Q1234(FieldShape.SPENDING_ANNUAL),
    MTEP(FieldShape.PLAN);

    private final FieldShape shape;

    SourceKind(FieldShape shape) {
        this.shape = shape;
    }

    public FieldShape shape() {
        return shape;
    }

    public boolean isSpending() {
        return shape == FieldShape.SPENDING_WITH_PERIOD || shape == FieldShape.SPENDING_ANNUAL;
    }

    public boolean hasPeriodFields() {
        return shape == FieldShape.SPENDING_WITH_PERIOD;
    }

    /** Case-insensitive lookup used by the CLI and the JDBC URL. */
    public static SourceKind parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Source kind missing");
        }
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown source kind: " + text, ex);
        }
    }
}
