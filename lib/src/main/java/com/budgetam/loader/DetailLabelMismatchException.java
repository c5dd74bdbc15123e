package com.budgetam.loader;

/**
 * A detail block following a program or subprogram header does not have the expected shape, which
 * means the workbook does not follow the assumed layout.
 */
public final class DetailLabelMismatchException extends LoaderException {
    private final int row;
    private final String expected;
    private final String found;

    public DetailLabelMismatchException(int row, String expected, String found) {
        super("Detail block mismatch at row " + row + ": expected '" + expected + "', found '" + found + "'");
        this.row = row;
        this.expected = expected;
        this.found = found;
    }

    /** One-based row number of the offending line. */
    public int getRow() {
        return row;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }
}
