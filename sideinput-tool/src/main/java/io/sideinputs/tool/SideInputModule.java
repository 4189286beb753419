package io.sideinputs.tool;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.sideinputs.config.RuntimeOptions;
import io.sideinputs.config.SideInputConfig;
import io.sideinputs.core.Source;
import io.sideinputs.metrics.Metrics;
import io.sideinputs.metrics.MetricsReadCounter;
import io.sideinputs.runtime.PrefetchingSourceReader;
import io.sideinputs.source.LengthPrefixedFileSource;

import java.io.IOException;
import java.util.List;

public class SideInputModule extends AbstractModule {
    private final SideInputConfig config;
    private final RuntimeOptions runtimeOptions;

    public SideInputModule(SideInputConfig config, RuntimeOptions runtimeOptions) {
        this.config = config;
        this.runtimeOptions = runtimeOptions;
    }

    @Override
    protected void configure() {
        bind(SideInputConfig.class).toInstance(config);
        bind(RuntimeOptions.class).toInstance(runtimeOptions);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton MetricsReadCounter readCounter(Metrics metrics) { return metrics.readCounter("files"); }

    @Provides List<Source<byte[]>> sources() throws IOException { return LengthPrefixedFileSource.listDirectory(config.inputDir()); }

    @Provides @Singleton PrefetchingSourceReader<byte[]> reader(List<Source<byte[]>> sources, MetricsReadCounter counter, MetricRegistry registry) {
        return PrefetchingSourceReader.<byte[]>builder()
                .sources(sources)
                .config(config)
                .readCounter(counter)
                .runtimeOptions(runtimeOptions)
                .metrics(registry)
                .build();
    }

    @Provides SideInputReadJob job(PrefetchingSourceReader<byte[]> reader, MetricsReadCounter counter) {
        return new SideInputReadJob(reader, counter, config.passes());
    }
}
