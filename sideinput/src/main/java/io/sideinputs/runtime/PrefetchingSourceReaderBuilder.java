package io.sideinputs.runtime;

import com.codahale.metrics.MetricRegistry;
import io.sideinputs.config.RuntimeOptions;
import io.sideinputs.config.SideInputConfig;
import io.sideinputs.core.Source;
import io.sideinputs.metrics.Metrics;
import io.sideinputs.metrics.ReadCounter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class PrefetchingSourceReaderBuilder<T> {
    private List<Source<?>> sources;
    private int maxReaderThreads = SideInputConfig.DEFAULT_READER_THREADS;
    private int queueCapacity = SideInputConfig.DEFAULT_QUEUE_CAPACITY;
    private ReadCounter readCounter;
    private RuntimeOptions runtimeOptions = new RuntimeOptions();
    private MetricRegistry metricRegistry = new MetricRegistry();

    public PrefetchingSourceReaderBuilder<T> sources(List<? extends Source<?>> s) { this.sources = new ArrayList<>(s); return this; }
    public PrefetchingSourceReaderBuilder<T> maxReaderThreads(int n) { this.maxReaderThreads = n; return this; }
    public PrefetchingSourceReaderBuilder<T> queueCapacity(int c) { this.queueCapacity = c; return this; }
    public PrefetchingSourceReaderBuilder<T> readCounter(ReadCounter c) { this.readCounter = c; return this; }
    public PrefetchingSourceReaderBuilder<T> runtimeOptions(RuntimeOptions o) { this.runtimeOptions = o; return this; }
    public PrefetchingSourceReaderBuilder<T> metrics(MetricRegistry r) { this.metricRegistry = r; return this; }

    public PrefetchingSourceReaderBuilder<T> config(SideInputConfig cfg) {
        this.maxReaderThreads = cfg.readerThreads();
        this.queueCapacity = cfg.queueCapacity();
        return this;
    }

    public PrefetchingSourceReader<T> build() {
        Objects.requireNonNull(sources, "sources");
        Objects.requireNonNull(runtimeOptions, "runtimeOptions");
        Objects.requireNonNull(metricRegistry, "metricRegistry");
        if (maxReaderThreads < 1) throw new IllegalArgumentException("maxReaderThreads must be >= 1: " + maxReaderThreads);
        if (queueCapacity < 1) throw new IllegalArgumentException("queueCapacity must be >= 1: " + queueCapacity);
        for (Source<?> s : sources) Objects.requireNonNull(s, "sources must not contain null");
        return new PrefetchingSourceReader<>(sources, maxReaderThreads, queueCapacity, readCounter, runtimeOptions, new Metrics(metricRegistry));
    }
}
