package com.budgetam.workbook;

import java.util.List;
import java.util.Objects;

/** Trimmed cell texts of one worksheet row. Cells beyond the stored ones read as empty. */
public final class RawRow {
    private final int index;
    private final List<String> cells;

    public RawRow(int index, List<String> cells) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0: " + index);
        }
        this.index = index;
        this.cells = List.copyOf(Objects.requireNonNull(cells, "cells"));
    }

    public static RawRow of(int index, String... cells) {
        return new RawRow(index, List.of(cells));
    }

    public static RawRow empty(int index) {
        return new RawRow(index, List.of());
    }

    /** Zero-based row index within the sheet. */
    public int getIndex() {
        return index;
    }

    /** One-based row number as spreadsheet applications display it. */
    public int getNumber() {
        return index + 1;
    }

    public String cell(int column) {
        if (column < 0 || column >= cells.size()) {
            return "";
        }
        return cells.get(column);
    }

    public boolean isBlank(int column) {
        return cell(column).isEmpty();
    }

    /** True when every cell in {@code [from, to)} is blank. */
    public boolean isBlank(int from, int to) {
        for (int column = from; column < to; column++) {
            if (!isBlank(column)) {
                return false;
            }
        }
        return true;
    }

    public List<String> getCells() {
        return cells;
    }

    @Override
    public String toString() {
        return "row " + getNumber() + " " + cells;
    }
}
