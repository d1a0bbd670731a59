package com.lfunc.prelabel.gamma;

/** How a sorted spectral parameter appears in the label tail. */
public enum Pairing {
    /** Emitted on its own. */
    PLAIN,
    /** First of a conjugate pair; emitted once for both members. */
    CONJUGATE,
    /** Second of a conjugate pair; represented by its partner and skipped. */
    PAIRED
}
