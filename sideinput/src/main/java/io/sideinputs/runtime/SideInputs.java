package io.sideinputs.runtime;

import io.sideinputs.config.RuntimeOptions;
import io.sideinputs.config.SideInputConfig;
import io.sideinputs.core.Source;
import io.sideinputs.core.WindowedValue;
import io.sideinputs.metrics.ReadCounter;

import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;

/**
 * Entry points for reading side inputs.
 */
public final class SideInputs {
    private SideInputs() {}

    public static <T> Supplier<PrefetchingIterator<WindowedValue<T>>> iteratorFnForSources(List<? extends Source<?>> sources) {
        return iteratorFnForSources(sources, SideInputConfig.DEFAULT_READER_THREADS);
    }

    public static <T> Supplier<PrefetchingIterator<WindowedValue<T>>> iteratorFnForSources(List<? extends Source<?>> sources, int maxReaderThreads) {
        return iteratorFnForSources(sources, maxReaderThreads, null, new RuntimeOptions());
    }

    /**
     * Factory of iterators merging all {@code sources}. Bytes read are reported to {@code readCounter}
     * only when {@code options} enable the {@code sideinput_io_metrics} experiment. {@code T} is not
     * checked against the sources; use {@link #iteratorFnForValues} for sources of plain values.
     *
     * @param readCounter may be null
     */
    public static <T> Supplier<PrefetchingIterator<WindowedValue<T>>> iteratorFnForSources(List<? extends Source<?>> sources,
                                                                                             int maxReaderThreads,
                                                                                             ReadCounter readCounter,
                                                                                             RuntimeOptions options) {
        return PrefetchingSourceReader.<T>builder()
                .sources(sources)
                .maxReaderThreads(maxReaderThreads)
                .readCounter(readCounter)
                .runtimeOptions(options)
                .build()
                .iteratorFn();
    }

    /** Factory of iterators merging sources of plain {@code T} values, placed in the global window. */
    public static <T> Supplier<PrefetchingIterator<WindowedValue<T>>> iteratorFnForValues(List<? extends Source<? extends T>> sources,
                                                                                           int maxReaderThreads) {
        return SideInputs.<T>iteratorFnForSources(sources, maxReaderThreads);
    }

    /** A re-iterable view that calls {@code iteratorFn} for every traversal. */
    public static <T> Iterable<T> emulatedIterable(Supplier<? extends Iterator<T>> iteratorFn) {
        return EmulatedIterable.of(iteratorFn);
    }
}
