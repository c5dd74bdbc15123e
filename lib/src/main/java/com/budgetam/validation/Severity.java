package com.budgetam.validation;

import java.util.Locale;

public enum Severity {
    ERROR("error"),
    WARNING("warning");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    /** Lower-case name used in reports and configuration. */
    public String label() {
        return label;
    }

    public static Severity parse(String text) {
        String normalized = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.label.equals(normalized)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity '" + text + "', expected error or warning");
    }
}
