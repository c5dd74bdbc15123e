package com.budgetam.loader;

import java.util.List;

/** The five lines following a header and the index of the first row after them. */
public final class DetailBlock {
    private final List<String> lines;
    private final int nextIndex;
    private final List<Integer> emptyValueRows;

    DetailBlock(List<String> lines, int nextIndex, List<Integer> emptyValueRows) {
        if (lines.size() != DetailCollector.WINDOW) {
            throw new IllegalArgumentException("Expected " + DetailCollector.WINDOW + " lines, got " + lines.size());
        }
        this.lines = List.copyOf(lines);
        this.nextIndex = nextIndex;
        this.emptyValueRows = List.copyOf(emptyValueRows);
    }

    /** Text of all five lines, labels included, in sheet order. */
    public List<String> getLines() {
        return lines;
    }

    public String line(int offset) {
        return lines.get(offset);
    }

    /** First value line: the name. */
    public String name() {
        return lines.get(0);
    }

    /** Second value line: goal of a program, description of a subprogram. */
    public String secondValue() {
        return lines.get(2);
    }

    /** Third value line: result description of a program, type of a subprogram. */
    public String thirdValue() {
        return lines.get(4);
    }

    /** Zero-based index of the first row not consumed by this block. */
    public int getNextIndex() {
        return nextIndex;
    }

    /** One-based numbers of optional value lines that were empty. */
    public List<Integer> getEmptyValueRows() {
        return emptyValueRows;
    }
}
