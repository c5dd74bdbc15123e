package com.budgetam.loader;

/**
 * Normalized Armenian label texts expected on the two label lines of a detail block. Line 2 of a
 * program block reads "program goal" and line 4 "final result description"; a subprogram block
 * reads "activity description" and "activity type".
 */
public enum DetailLabels {
    PROGRAM("ծրագրինպատակը", "վերջնականարդյունքինկարագրությունը"),
    SUBPROGRAM("միջոցառմաննկարագրությունը", "միջոցառմանտեսակը");

    private final String firstLabel;
    private final String secondLabel;

    DetailLabels(String firstLabel, String secondLabel) {
        this.firstLabel = firstLabel;
        this.secondLabel = secondLabel;
    }

    /** Expected label at block offset 1 or 3. */
    public String expectedAt(int offset) {
        return switch (offset) {
            case 1 -> firstLabel;
            case 3 -> secondLabel;
            default -> throw new IllegalArgumentException("Offset " + offset + " is not a label line");
        };
    }
}
