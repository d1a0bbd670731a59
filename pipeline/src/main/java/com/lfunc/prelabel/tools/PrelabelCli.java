package com.lfunc.prelabel.tools;

import com.lfunc.prelabel.PrelabelException;
import com.lfunc.prelabel.Version;
import com.lfunc.prelabel.pipeline.BatchResult;
import com.lfunc.prelabel.pipeline.BatchRunner;
import com.lfunc.prelabel.pipeline.PipelineOptions;
import com.lfunc.prelabel.pipeline.PrelabelPipeline;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Labels a {@code |}-delimited dump of L-function records.
 *
 * <p>Usage: {@code PrelabelCli <input|-> [output]}. Without an output path the labeled lines go to
 * standard output. Set {@code -Dlfunc.prelabel.skipInvalid=true} to drop bad records instead of
 * stopping at the first one.</p>
 */
public final class PrelabelCli {
    private static final Logger LOGGER = Logger.getLogger(PrelabelCli.class.getName());

    private PrelabelCli() {}

    public static void main(String[] args) throws IOException {
        if (args.length < 1 || args.length > 2) {
            System.err.println("Usage: PrelabelCli <input|-> [output]");
            System.exit(1);
        }
        LOGGER.info("lfunc-prelabel " + Version.RUNTIME);
        BatchRunner runner =
                new BatchRunner(PrelabelPipeline.withDefaults(), PipelineOptions.fromEnvironment());
        try (BufferedReader input = openInput(args[0]);
                Writer output = openOutput(args.length == 2 ? args[1] : null)) {
            BatchResult result = runner.run(input, output);
            LOGGER.info("Prelabel run complete: " + result);
        } catch (PrelabelException ex) {
            LOGGER.severe("Prelabel run aborted: " + ex.getMessage());
            System.exit(1);
        }
    }

    private static BufferedReader openInput(String path) throws IOException {
        if ("-".equals(path)) {
            return new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        }
        Path input = Path.of(path).toAbsolutePath().normalize();
        if (!Files.exists(input)) {
            throw new IllegalStateException("Input file not found: " + input);
        }
        return Files.newBufferedReader(input, StandardCharsets.UTF_8);
    }

    private static Writer openOutput(String path) throws IOException {
        if (path == null) {
            return new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        }
        return Files.newBufferedWriter(Path.of(path), StandardCharsets.UTF_8);
    }
}
