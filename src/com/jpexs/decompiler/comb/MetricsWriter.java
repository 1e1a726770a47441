package com.jpexs.decompiler.comb;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes restructuring metrics as JSON, one file per function.
 *
 * @author JPEXS
 */
public class MetricsWriter {

    private static final Logger logger = LoggerFactory.getLogger(MetricsWriter.class);

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private final Path outputDir;

    public MetricsWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    public static String toJson(RestructureMetrics metrics) {
        return GSON.toJson(metrics);
    }

    public static RestructureMetrics fromJson(String json) {
        return GSON.fromJson(json, RestructureMetrics.class);
    }

    /**
     * Writes {@code <outputDir>/<function>.json}.
     *
     * @param metrics metrics of one function
     * @return the written file
     * @throws UncheckedIOException when the file cannot be written
     */
    public Path write(RestructureMetrics metrics) {
        Path file = outputDir.resolve(metrics.getFunction() + ".json");
        try {
            Files.createDirectories(outputDir);
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                GSON.toJson(metrics, writer);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot write metrics to " + file, ex);
        }
        logger.debug("Metrics of {} written to {}", metrics.getFunction(), file);
        return file;
    }
}
