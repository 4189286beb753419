package io.sideinputs.config;

import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Worker-wide runtime options. Set once when the worker starts and read by every merge; tests reset
 * them with {@link #clear()}.
 */
public class RuntimeOptions {
    public static final String EXPERIMENTS = "experiments";

    private volatile Map<String, String> options = Map.of();

    public RuntimeOptions() {}

    public RuntimeOptions(Map<String, String> options) {
        setRuntimeOptions(options);
    }

    /**
     * Seeds {@code experiments} from {@code -Dsideinputs.experiments} or {@code SIDEINPUTS_EXPERIMENTS}.
     */
    public static RuntimeOptions fromEnv() {
        String experiments = System.getProperty("sideinputs.experiments",
                System.getenv().getOrDefault("SIDEINPUTS_EXPERIMENTS", ""));
        return new RuntimeOptions(Map.of(EXPERIMENTS, experiments));
    }

    public void setRuntimeOptions(Map<String, String> newOptions) {
        this.options = Map.copyOf(newOptions);
    }

    public String get(String key, String defaultValue) {
        return options.getOrDefault(key, defaultValue);
    }

    /** Comma-separated {@code experiments} entries, trimmed, blanks dropped. */
    public Set<String> experiments() {
        return Arrays.stream(get(EXPERIMENTS, "").split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean hasExperiment(String name) {
        return experiments().contains(name);
    }

    public void clear() {
        this.options = Map.of();
    }

    @Override
    public String toString() {
        return "RuntimeOptions" + options;
    }
}
