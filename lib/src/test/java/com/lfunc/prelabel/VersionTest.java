package com.lfunc.prelabel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class VersionTest {

    @Test
    void runtimeStringNamesParserVersion() {
        assertEquals("0.1.0-beta", Version.FULL);
        assertTrue(Version.RUNTIME.contains("ANTLR " + Version.ANTLR_VERSION));
    }
}
