package io.sideinputs.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;

public class Metrics {
    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = java.util.Objects.requireNonNull(registry, "registry");
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }

    /** Counter of bytes read for the named side input, e.g. {@code sideinput.lookup.bytes.read}. */
    public MetricsReadCounter readCounter(String sideInputName) {
        return new MetricsReadCounter(
                counter("sideinput." + sideInputName + ".bytes.read"),
                meter("sideinput." + sideInputName + ".read.rate"));
    }
}
