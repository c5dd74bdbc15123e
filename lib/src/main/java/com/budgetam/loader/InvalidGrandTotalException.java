package com.budgetam.loader;

/** The grand-total row was found but its budget figure is not a number. */
public final class InvalidGrandTotalException extends LoaderException {
    private final int row;
    private final String value;

    public InvalidGrandTotalException(int row, String value) {
        super("Grand total at row " + row + " is not numeric: '" + value + "'");
        this.row = row;
        this.value = value;
    }

    /** One-based row number. */
    public int getRow() {
        return row;
    }

    public String getValue() {
        return value;
    }
}
