package com.jpexs.decompiler.comb;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.nio.file.Paths;
import java.util.Properties;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class StructuringOptionsTest {

    @Test
    public void defaultsWriteNothing() {
        StructuringOptions options = StructuringOptions.defaults();

        assertThat((Object) options.getMetricsOutputDir()).isNull();
        assertThat(options.getTargetFunction()).isNull();
        assertThat((Object) options.getDebugGraphsDir()).isNull();
        assertThat(options.getShortCircuitMaxWeight()).isEqualTo(StructuringOptions.DEFAULT_SHORT_CIRCUIT_MAX_WEIGHT);
    }

    @Test
    public void propertiesAreRead() {
        Properties properties = new Properties();
        properties.setProperty(StructuringOptions.METRICS_OUTPUT_DIR, "out/metrics");
        properties.setProperty(StructuringOptions.TARGET_FUNCTION, " main ");
        properties.setProperty(StructuringOptions.DEBUG_GRAPHS_DIR, "out/graphs");
        properties.setProperty(StructuringOptions.SHORT_CIRCUIT_MAX_WEIGHT, "3");

        StructuringOptions options = StructuringOptions.fromProperties(properties);

        assertThat((Object) options.getMetricsOutputDir()).isEqualTo(Paths.get("out/metrics"));
        assertThat(options.getTargetFunction()).isEqualTo("main");
        assertThat((Object) options.getDebugGraphsDir()).isEqualTo(Paths.get("out/graphs"));
        assertThat(options.getShortCircuitMaxWeight()).isEqualTo(3);
    }

    @Test
    public void blankPropertiesKeepDefaults() {
        Properties properties = new Properties();
        properties.setProperty(StructuringOptions.TARGET_FUNCTION, "  ");
        properties.setProperty(StructuringOptions.SHORT_CIRCUIT_MAX_WEIGHT, "");

        StructuringOptions options = StructuringOptions.fromProperties(properties);

        assertThat(options.getTargetFunction()).isNull();
        assertThat(options.getShortCircuitMaxWeight()).isEqualTo(1);
    }

    @Test
    public void malformedWeightIsRejected() {
        Properties properties = new Properties();
        properties.setProperty(StructuringOptions.SHORT_CIRCUIT_MAX_WEIGHT, "heavy");

        assertThrows(IllegalArgumentException.class, () -> StructuringOptions.fromProperties(properties));
    }

    @Test
    public void negativeWeightIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> StructuringOptions.builder().shortCircuitMaxWeight(-1));
    }
}
