package com.lfunc.prelabel;

public final class Version {
    static final int MAJOR = 0;
    static final int MINOR = 1;
    static final int PATCH = 0;
    private static final String QUALIFIER = "beta";

    public static final String FULL = MAJOR + "." + MINOR + "." + PATCH + "-" + QUALIFIER;
    public static final String ANTLR_VERSION = "4.13.1";
    public static final String RUNTIME = FULL + " (ANTLR " + ANTLR_VERSION + ")";

    private Version() {}
}
