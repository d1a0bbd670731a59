package com.lfunc.prelabel.pipeline;

/** Runtime switches for batch runs, read from system properties with environment fallbacks. */
public final class PipelineOptions {
    static final String SKIP_INVALID_PROPERTY = "lfunc.prelabel.skipInvalid";
    private static final String SKIP_INVALID_ENV = "LFUNC_PRELABEL_SKIP_INVALID";

    private final boolean skipInvalid;

    public PipelineOptions(boolean skipInvalid) {
        this.skipInvalid = skipInvalid;
    }

    public static PipelineOptions fromEnvironment() {
        return new PipelineOptions(flag(SKIP_INVALID_PROPERTY, SKIP_INVALID_ENV));
    }

    /** Whether a record that fails to label is logged and dropped instead of aborting the run. */
    public boolean isSkipInvalid() {
        return skipInvalid;
    }

    private static boolean flag(String property, String env) {
        String value = System.getProperty(property);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(env));
    }
}
