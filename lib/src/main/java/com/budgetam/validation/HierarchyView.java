package com.budgetam.validation;

import com.budgetam.ledger.Amounts;
import com.budgetam.ledger.FlattenedRecord;
import com.budgetam.schema.AmountField;
import com.budgetam.schema.HierarchyLevel;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Entity views over the denormalized records. State body and program figures repeat on every record
 * below them, so sums and per-entity checks look at the first record seen for each entity.
 */
final class HierarchyView {
    private final List<FlattenedRecord> records;
    private final Map<String, FlattenedRecord> stateBodies = new LinkedHashMap<>();
    private final Map<ProgramKey, FlattenedRecord> programs = new LinkedHashMap<>();
    private final Map<String, Map<Integer, FlattenedRecord>> programsByStateBody = new LinkedHashMap<>();
    private final Map<ProgramKey, List<FlattenedRecord>> subprogramsByProgram = new LinkedHashMap<>();

    HierarchyView(List<FlattenedRecord> records) {
        this.records = List.copyOf(records);
        for (FlattenedRecord record : this.records) {
            ProgramKey key = ProgramKey.of(record);
            stateBodies.putIfAbsent(record.getStateBody(), record);
            programs.putIfAbsent(key, record);
            programsByStateBody
                    .computeIfAbsent(record.getStateBody(), ignored -> new LinkedHashMap<>())
                    .putIfAbsent(record.getProgramCode(), record);
            subprogramsByProgram.computeIfAbsent(key, ignored -> new ArrayList<>()).add(record);
        }
    }

    /** One record per entity of the level: first-seen for state bodies and programs, all records otherwise. */
    List<FlattenedRecord> entities(HierarchyLevel level) {
        return switch (level) {
            case STATE_BODY -> List.copyOf(stateBodies.values());
            case PROGRAM -> List.copyOf(programs.values());
            case SUBPROGRAM -> records;
            case OVERALL -> throw new IllegalArgumentException("No record entities at the overall level");
        };
    }

    Map<String, FlattenedRecord> stateBodies() {
        return stateBodies;
    }

    Map<String, Map<Integer, FlattenedRecord>> programsByStateBody() {
        return programsByStateBody;
    }

    Map<ProgramKey, List<FlattenedRecord>> subprogramsByProgram() {
        return subprogramsByProgram;
    }

    Map<ProgramKey, FlattenedRecord> programs() {
        return programs;
    }

    /** Figure of the field at the level, or {@code null} when missing or not carried. */
    static Double value(FlattenedRecord record, HierarchyLevel level, AmountField field) {
        Amounts amounts = record.amounts(level);
        if (amounts == null || !amounts.shape().contains(field)) {
            return null;
        }
        return amounts.get(field);
    }

    /** {@code state body | program code | subprogram code}, the last part omitted for two-level records. */
    static String location(FlattenedRecord record) {
        StringBuilder builder = new StringBuilder();
        builder.append(record.getStateBody()).append(" | ").append(record.getProgramCode());
        if (record.getSubprogramCode() != null) {
            builder.append(" | ").append(record.getSubprogramCode());
        }
        return builder.toString();
    }

    static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    static String capitalize(HierarchyLevel level) {
        String words = level.key().replace('_', ' ');
        return Character.toUpperCase(words.charAt(0)) + words.substring(1);
    }

    record ProgramKey(String stateBody, Integer programCode) {
        static ProgramKey of(FlattenedRecord record) {
            return new ProgramKey(record.getStateBody(), record.getProgramCode());
        }

        ProgramKey {
            Objects.requireNonNull(stateBody, "stateBody");
        }

        @Override
        public String toString() {
            return stateBody + "/" + programCode;
        }
    }
}
