package com.budgetam.loader;

/** A diagnostic produced while scanning a workbook, tied to the row it concerns. */
public final class LoaderMessage {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    private final Level level;
    private final String message;
    private final String sourceName;
    private final int row;

    public LoaderMessage(Level level, String message, String sourceName, int row) {
        this.level = level;
        this.message = message;
        this.sourceName = sourceName;
        this.row = row;
    }

    public static LoaderMessage warning(String message, String sourceName, int row) {
        return new LoaderMessage(Level.WARNING, message, sourceName, row);
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public String getSourceName() {
        return sourceName;
    }

    /** One-based row number, or 0 when the message concerns the whole file. */
    public int getRow() {
        return row;
    }

    @Override
    public String toString() {
        return level + " " + sourceName + (row > 0 ? ":" + row : "") + " " + message;
    }
}
