package com.budgetam.loader;

/**
 * Checked exception signalling that a workbook could not be turned into records. Each failure is
 * fatal for its own file only; callers processing several files continue with the rest.
 */
public class LoaderException extends Exception {
    public LoaderException(String message) {
        super(message);
    }

    public LoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
