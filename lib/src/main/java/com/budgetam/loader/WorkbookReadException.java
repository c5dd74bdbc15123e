package com.budgetam.loader;

/** The workbook file could not be opened or read. */
public final class WorkbookReadException extends LoaderException {
    public WorkbookReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
