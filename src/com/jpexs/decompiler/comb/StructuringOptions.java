package com.jpexs.decompiler.comb;

import com.google.common.base.Preconditions;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Immutable options of {@link CombRestructurer}.
 *
 * @author JPEXS
 */
public final class StructuringOptions {

    public static final String METRICS_OUTPUT_DIR = "restructure.metrics-output-dir";
    public static final String TARGET_FUNCTION = "restructure.target-function";
    public static final String DEBUG_GRAPHS_DIR = "restructure.debug-graphs-dir";
    public static final String SHORT_CIRCUIT_MAX_WEIGHT = "restructure.short-circuit-max-weight";

    public static final int DEFAULT_SHORT_CIRCUIT_MAX_WEIGHT = 1;

    private final Path metricsOutputDir;     // null when metrics are not written
    private final String targetFunction;     // null to process every function
    private final Path debugGraphsDir;       // null when no graphs are dumped
    private final int shortCircuitMaxWeight;

    private StructuringOptions(Builder builder) {
        this.metricsOutputDir = builder.metricsOutputDir;
        this.targetFunction = builder.targetFunction;
        this.debugGraphsDir = builder.debugGraphsDir;
        this.shortCircuitMaxWeight = builder.shortCircuitMaxWeight;
    }

    public static StructuringOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads options from properties. Missing keys keep their defaults.
     *
     * @param properties the properties
     * @return the options
     * @throws IllegalArgumentException when a value is malformed
     */
    public static StructuringOptions fromProperties(Properties properties) {
        Builder builder = builder();
        String metricsDir = properties.getProperty(METRICS_OUTPUT_DIR);
        if (metricsDir != null && !metricsDir.isBlank()) {
            builder.metricsOutputDir(Paths.get(metricsDir.trim()));
        }
        String target = properties.getProperty(TARGET_FUNCTION);
        if (target != null && !target.isBlank()) {
            builder.targetFunction(target.trim());
        }
        String debugDir = properties.getProperty(DEBUG_GRAPHS_DIR);
        if (debugDir != null && !debugDir.isBlank()) {
            builder.debugGraphsDir(Paths.get(debugDir.trim()));
        }
        String maxWeight = properties.getProperty(SHORT_CIRCUIT_MAX_WEIGHT);
        if (maxWeight != null && !maxWeight.isBlank()) {
            try {
                builder.shortCircuitMaxWeight(Integer.parseInt(maxWeight.trim()));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid " + SHORT_CIRCUIT_MAX_WEIGHT + ": " + maxWeight, ex);
            }
        }
        return builder.build();
    }

    public Path getMetricsOutputDir() {
        return metricsOutputDir;
    }

    public String getTargetFunction() {
        return targetFunction;
    }

    public Path getDebugGraphsDir() {
        return debugGraphsDir;
    }

    public int getShortCircuitMaxWeight() {
        return shortCircuitMaxWeight;
    }

    @Override
    public String toString() {
        return "StructuringOptions{metricsOutputDir=" + metricsOutputDir
                + ", targetFunction=" + targetFunction
                + ", debugGraphsDir=" + debugGraphsDir
                + ", shortCircuitMaxWeight=" + shortCircuitMaxWeight + "}";
    }

    public static final class Builder {

        private Path metricsOutputDir;
        private String targetFunction;
        private Path debugGraphsDir;
        private int shortCircuitMaxWeight = DEFAULT_SHORT_CIRCUIT_MAX_WEIGHT;

        private Builder() {
        }

        public Builder metricsOutputDir(Path metricsOutputDir) {
            this.metricsOutputDir = metricsOutputDir;
            return this;
        }

        public Builder targetFunction(String targetFunction) {
            this.targetFunction = targetFunction;
            return this;
        }

        public Builder debugGraphsDir(Path debugGraphsDir) {
            this.debugGraphsDir = debugGraphsDir;
            return this;
        }

        public Builder shortCircuitMaxWeight(int shortCircuitMaxWeight) {
            Preconditions.checkArgument(shortCircuitMaxWeight >= 0,
                    "Short-circuit weight limit must not be negative: %s", shortCircuitMaxWeight);
            this.shortCircuitMaxWeight = shortCircuitMaxWeight;
            return this;
        }

        public StructuringOptions build() {
            return new StructuringOptions(this);
        }
    }
}
