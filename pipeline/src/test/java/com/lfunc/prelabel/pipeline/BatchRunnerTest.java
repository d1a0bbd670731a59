package com.lfunc.prelabel.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.lfunc.prelabel.PrelabelException;
import java.io.BufferedReader;
import java.io.StringReader;
import java.io.StringWriter;
import org.junit.jupiter.api.Test;

final class BatchRunnerTest {
    private static final String GOOD = PrelabelPipelineTest.ELLIPTIC_CURVE;
    private static final String BAD = GOOD.replace("[[],[0]]", "[[0");
    private static final String INPUT =
            GOOD + "\n\n" + BAD + "\n" + GOOD.replace("1|Elliptic", "2|Elliptic") + "\n";

    @Test
    void skipsInvalidLinesWhenAsked() throws Exception {
        BatchRunner runner =
                new BatchRunner(PrelabelPipeline.withDefaults(), new PipelineOptions(true));
        StringWriter output = new StringWriter();
        BatchResult result = runner.run(reader(INPUT), output);
        assertEquals(2, result.getLabeled());
        assertEquals(1, result.getSkipped());
        String[] lines = output.toString().split("\n");
        assertEquals(2, lines.length);
        assertTrue(lines[1].startsWith("2|"));
    }

    @Test
    void skipsRecordsWithUncomputableSpectralData() throws Exception {
        String input =
                PrelabelPipelineTest.degreeOneLine("[[-0.5],[]]") + "\n"
                        + PrelabelPipelineTest.degreeOneLine("[[1e10],[]]") + "\n"
                        + GOOD.replace("1|Elliptic", "3|Elliptic") + "\n";
        BatchRunner runner =
                new BatchRunner(PrelabelPipeline.withDefaults(), new PipelineOptions(true));
        StringWriter output = new StringWriter();
        BatchResult result = runner.run(reader(input), output);
        assertEquals(1, result.getLabeled());
        assertEquals(2, result.getSkipped());
        assertTrue(output.toString().startsWith("3|"));
    }

    @Test
    void abortsOnFirstInvalidLineByDefault() {
        BatchRunner runner =
                new BatchRunner(PrelabelPipeline.withDefaults(), new PipelineOptions(false));
        PrelabelException ex =
                assertThrows(
                        PrelabelException.class,
                        () -> runner.run(reader(INPUT), new StringWriter()));
        assertTrue(ex.getMessage().startsWith("line 3: "));
    }

    @Test
    void readsSkipFlagFromSystemProperty() {
        String previous = System.getProperty(PipelineOptions.SKIP_INVALID_PROPERTY);
        try {
            System.setProperty(PipelineOptions.SKIP_INVALID_PROPERTY, "true");
            assertTrue(PipelineOptions.fromEnvironment().isSkipInvalid());
        } finally {
            if (previous == null) {
                System.clearProperty(PipelineOptions.SKIP_INVALID_PROPERTY);
            } else {
                System.setProperty(PipelineOptions.SKIP_INVALID_PROPERTY, previous);
            }
        }
    }

    private static BufferedReader reader(String text) {
        return new BufferedReader(new StringReader(text));
    }
}
