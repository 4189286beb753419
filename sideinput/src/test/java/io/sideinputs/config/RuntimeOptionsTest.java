package io.sideinputs.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class RuntimeOptionsTest {
    @AfterEach
    void tearDown() {
        System.clearProperty("sideinputs.experiments");
        System.clearProperty("sideinputs.threads");
    }

    @Test
    void parses_comma_separated_experiments() {
        RuntimeOptions options = new RuntimeOptions(Map.of(RuntimeOptions.EXPERIMENTS, " sideinput_io_metrics, other,,"));
        assertEquals(Set.of("sideinput_io_metrics", "other"), options.experiments());
        assertTrue(options.hasExperiment(Experiments.SIDEINPUT_IO_METRICS));
        assertFalse(options.hasExperiment("sideinput"));
    }

    @Test
    void clear_removes_all_options() {
        RuntimeOptions options = new RuntimeOptions(Map.of(RuntimeOptions.EXPERIMENTS, "a", "k", "v"));
        assertEquals("v", options.get("k", "d"));
        options.clear();
        assertEquals("d", options.get("k", "d"));
        assertTrue(options.experiments().isEmpty());
    }

    @Test
    void experiments_from_system_property() {
        System.setProperty("sideinputs.experiments", "sideinput_io_metrics");
        assertTrue(RuntimeOptions.fromEnv().hasExperiment(Experiments.SIDEINPUT_IO_METRICS));
    }

    @Test
    void side_input_config_defaults_and_validation() {
        System.setProperty("sideinputs.threads", "3");
        SideInputConfig cfg = SideInputConfig.fromEnv();
        assertEquals(3, cfg.readerThreads());
        assertEquals(SideInputConfig.DEFAULT_QUEUE_CAPACITY, cfg.queueCapacity());
        assertThrows(IllegalArgumentException.class, () -> new SideInputConfig(cfg.inputDir(), 0, 10, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> new SideInputConfig(cfg.inputDir(), 1, 10, 0, 0));
    }
}
