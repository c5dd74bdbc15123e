package com.budgetam.schema;

public enum HierarchyLevel {
    OVERALL("overall"),
    STATE_BODY("state_body"),
    PROGRAM("program"),
    SUBPROGRAM("subprogram");

    private final String key;

    HierarchyLevel(String key) {
        this.key = key;
    }

    /** Lower-case key used in column names, configuration keys and messages. */
    public String key() {
        return key;
    }

    public String column(AmountField field) {
        return key + "_" + field.suffix();
    }
}
