package com.budgetam.loader;

/** Structural role of a worksheet row, derived from which cells are blank, numeric or marked. */
public enum RowType {
    GRAND_TOTAL,
    STATE_BODY_HEADER,
    PROGRAM_HEADER,
    SUBPROGRAM_MARKER,
    SUBPROGRAM_HEADER,
    DETAIL_LINE,
    EMPTY,
    UNKNOWN;

    public boolean isHeader() {
        return this == GRAND_TOTAL
                || this == STATE_BODY_HEADER
                || this == PROGRAM_HEADER
                || this == SUBPROGRAM_MARKER
                || this == SUBPROGRAM_HEADER;
    }
}
