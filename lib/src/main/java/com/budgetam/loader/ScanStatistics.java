package com.budgetam.loader;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counters accumulated over one scan: how many rows were classified as each type, how many rows
 * were processed in each state, how many subprogram rows were skipped and how many records were
 * emitted. Rows consumed as part of a detail block are not classified on their own.
 */
public final class ScanStatistics {
    private final EnumMap<RowType, Integer> rowTypes = new EnumMap<>(RowType.class);
    private final EnumMap<ProcessingState, Integer> states = new EnumMap<>(ProcessingState.class);
    private int skippedRows;
    private int emittedRecords;

    public ScanStatistics() {
        for (RowType type : RowType.values()) {
            rowTypes.put(type, 0);
        }
        for (ProcessingState state : ProcessingState.values()) {
            states.put(state, 0);
        }
    }

    void recordRow(RowType type, ProcessingState state) {
        rowTypes.merge(type, 1, Integer::sum);
        states.merge(state, 1, Integer::sum);
    }

    void recordSkipped() {
        skippedRows++;
    }

    void recordEmitted() {
        emittedRecords++;
    }

    public int count(RowType type) {
        return rowTypes.get(type);
    }

    public int count(ProcessingState state) {
        return states.get(state);
    }

    public Map<RowType, Integer> getRowTypeCounts() {
        return Collections.unmodifiableMap(rowTypes);
    }

    public Map<ProcessingState, Integer> getStateCounts() {
        return Collections.unmodifiableMap(states);
    }

    /** Rows classified by the main scan loop. */
    public int getClassifiedRows() {
        int total = 0;
        for (int count : rowTypes.values()) {
            total += count;
        }
        return total;
    }

    public int getSkippedRows() {
        return skippedRows;
    }

    public int getEmittedRecords() {
        return emittedRecords;
    }

    @Override
    public String toString() {
        return "ScanStatistics{rowTypes=" + rowTypes
                + ", states=" + states
                + ", skipped=" + skippedRows
                + ", emitted=" + emittedRecords + "}";
    }
}
