package com.lfunc.prelabel.pipeline;

/** Counts of a finished batch run. */
public final class BatchResult {
    private final int labeled;
    private final int skipped;

    BatchResult(int labeled, int skipped) {
        this.labeled = labeled;
        this.skipped = skipped;
    }

    public int getLabeled() {
        return labeled;
    }

    public int getSkipped() {
        return skipped;
    }

    @Override
    public String toString() {
        return labeled + " labeled, " + skipped + " skipped";
    }
}
