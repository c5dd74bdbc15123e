package com.budgetam;

public final class Version {
    static final int MAJOR = 0;
    static final int MINOR = 3;
    static final int PATCH = 0;
    private static final String QUALIFIER = "alpha";

    public static final String FULL = MAJOR + "." + MINOR + "." + PATCH + "-" + QUALIFIER;

    private Version() {}

    public static int major() {
        return MAJOR;
    }

    public static int minor() {
        return MINOR;
    }
}
