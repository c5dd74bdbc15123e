package com.budgetam.loader;

/** The scan ended without reaching a grand-total row. */
public final class MissingGrandTotalException extends LoaderException {
    public MissingGrandTotalException(String sourceName) {
        super("Could not find the grand total ('ԸՆԴԱՄԵՆԸ') row in " + sourceName);
    }
}
