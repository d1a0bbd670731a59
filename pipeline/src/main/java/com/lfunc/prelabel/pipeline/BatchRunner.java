package com.lfunc.prelabel.pipeline;

import com.lfunc.prelabel.PrelabelException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.Objects;
import java.util.logging.Logger;

/** Streams input lines through a {@link PrelabelPipeline}, one output line per labeled record. */
public final class BatchRunner {
    private static final Logger LOGGER = Logger.getLogger(BatchRunner.class.getName());

    private final PrelabelPipeline pipeline;
    private final PipelineOptions options;

    public BatchRunner(PrelabelPipeline pipeline, PipelineOptions options) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Labels every non-blank line of {@code input}.
     *
     * @throws PrelabelException for the first failing line unless invalid records are skipped.
     */
    public BatchResult run(BufferedReader input, Writer output)
            throws IOException, PrelabelException {
        int labeled = 0;
        int skipped = 0;
        int lineNumber = 0;
        String line;
        while ((line = input.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            String enriched;
            try {
                enriched = pipeline.processLine(line);
            } catch (PrelabelException ex) {
                if (!options.isSkipInvalid()) {
                    throw new PrelabelException("line " + lineNumber + ": " + ex.getMessage(), ex);
                }
                LOGGER.warning("Skipping line " + lineNumber + ": " + ex.getMessage());
                skipped++;
                continue;
            }
            output.write(enriched);
            output.write('\n');
            labeled++;
        }
        output.flush();
        LOGGER.info("Batch finished: " + labeled + " labeled, " + skipped + " skipped");
        return new BatchResult(labeled, skipped);
    }
}
