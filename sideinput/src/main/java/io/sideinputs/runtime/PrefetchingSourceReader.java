package io.sideinputs.runtime;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import io.sideinputs.config.Experiments;
import io.sideinputs.config.RuntimeOptions;
import io.sideinputs.core.Reader;
import io.sideinputs.core.Source;
import io.sideinputs.core.WindowedValue;
import io.sideinputs.metrics.ByteCountingObserver;
import io.sideinputs.metrics.Metrics;
import io.sideinputs.metrics.ReadCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.ref.Cleaner;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Reads a set of side-input sources with a bounded pool of reader threads and merges their values
 * into one prefetching iterator.
 *
 * <p>Each source is claimed by exactly one reader thread and read to completion before that thread
 * claims another. With a single reader thread the output is the concatenation of the sources in list
 * order. With more threads, values of one source keep their relative order but values of different
 * sources interleave arbitrarily.
 *
 * <p>Values are pushed onto a bounded channel, so reader threads run at most {@code queueCapacity}
 * values ahead of the consumer. Values from readers that do not return windowed values are placed in
 * the global window.
 *
 * <p>A failure while opening, reading or closing a source stops that reader thread, prevents any
 * further source from being claimed, and is rethrown to the consumer. Values that other threads
 * produce concurrently with the failure may or may not be delivered before it; a value a reader has
 * already returned is dropped once a failure or cancellation is seen. An interrupt of a reader thread
 * counts as a failure of the source it is reading.
 */
public class PrefetchingSourceReader<T> {
    private static final Logger logger = LoggerFactory.getLogger(PrefetchingSourceReader.class);
    private static final Cleaner CLEANER = Cleaner.create();
    private static final AtomicInteger RUNS = new AtomicInteger();
    private static final long OFFER_TIMEOUT_MILLIS = 100;

    private final List<Source<?>> sources;
    private final int maxReaderThreads;
    private final int queueCapacity;
    private final ReadCounter readCounter; // optional
    private final RuntimeOptions runtimeOptions;
    private final Counter itemsCounter;
    private final Counter sourcesCounter;
    private final Meter failureMeter;

    PrefetchingSourceReader(List<Source<?>> sources,
                            int maxReaderThreads,
                            int queueCapacity,
                            ReadCounter readCounter,
                            RuntimeOptions runtimeOptions,
                            Metrics metrics) {
        this.sources = List.copyOf(sources);
        this.maxReaderThreads = maxReaderThreads;
        this.queueCapacity = queueCapacity;
        this.readCounter = readCounter;
        this.runtimeOptions = runtimeOptions;
        this.itemsCounter = metrics.counter("sideinput.merge.items");
        this.sourcesCounter = metrics.counter("sideinput.merge.sources");
        this.failureMeter = metrics.meter("sideinput.merge.failures");
    }

    public static <T> PrefetchingSourceReaderBuilder<T> builder() {
        return new PrefetchingSourceReaderBuilder<>();
    }

    /** Number of reader threads a single merge starts. */
    public int readerThreads() {
        return Math.min(maxReaderThreads, sources.size());
    }

    /**
     * Returns a factory of merged iterators. Every call starts a new merge that re-opens all sources.
     */
    public Supplier<PrefetchingIterator<WindowedValue<T>>> iteratorFn() {
        return this::iterator;
    }

    public PrefetchingIterator<WindowedValue<T>> iterator() {
        Run run = new Run(RUNS.incrementAndGet());
        PrefetchingIterator<WindowedValue<T>> it =
                new PrefetchingIterator<>(run.channel, run.threads, run::cancel, itemsCounter);
        // a consumer that drops the iterator without closing it must not leave reader threads blocked
        CLEANER.register(it, run::cancel);
        run.start();
        return it;
    }

    /** State of one merge: work queue, channel and the flags shared by its reader threads. */
    private final class Run {
        private final int id;
        private final int threads = readerThreads();
        private final Queue<Source<?>> work = new ConcurrentLinkedQueue<>(sources);
        private final BlockingQueue<ChannelEntry<WindowedValue<T>>> channel = new ArrayBlockingQueue<>(queueCapacity);
        private final AtomicBoolean failed = new AtomicBoolean(false);
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final boolean countBytes;

        Run(int id) {
            this.id = id;
            this.countBytes = readCounter != null && runtimeOptions.hasExperiment(Experiments.SIDEINPUT_IO_METRICS);
        }

        void start() {
            if (threads == 0) return;
            logger.debug("Merge {}: reading {} side input sources with {} reader threads (byte metrics {})",
                    id, sources.size(), threads, countBytes ? "on" : "off");
            AtomicInteger n = new AtomicInteger();
            ThreadFactory tf = r -> {
                Thread t = new Thread(r, "sideinput-reader-" + id + "-" + n.incrementAndGet());
                t.setDaemon(true);
                return t;
            };
            ExecutorService pool = Executors.newFixedThreadPool(threads, tf);
            for (int i = 0; i < threads; i++) {
                pool.submit(this::runReader);
            }
            pool.shutdown();
        }

        void cancel() {
            if (cancelled.compareAndSet(false, true)) {
                channel.clear();
            }
        }

        private void runReader() {
            Source<?> source = null;
            try {
                while (!failed.get() && !cancelled.get() && (source = work.poll()) != null) {
                    if (!readSource(source)) break;
                    sourcesCounter.inc();
                }
            } catch (Throwable t) {
                failed.set(true);
                failureMeter.mark();
                logger.error("Merge {}: error reading side input source {}", id,
                        source == null ? "<none>" : source.describe(), t);
                putTerminal(ChannelEntry.failure(t));
            } finally {
                putTerminal(ChannelEntry.done());
            }
        }

        /** Reads one source to the end. Returns false if the merge stopped before the source was done. */
        private boolean readSource(Source<?> source) throws IOException, InterruptedException {
            try (Reader<?> reader = source.openReader()) {
                if (countBytes) {
                    reader.addObserver(new ByteCountingObserver(readCounter));
                }
                boolean windowed = reader.returnsWindowedValues();
                Optional<?> next;
                while ((next = reader.read()).isPresent()) {
                    if (failed.get() || cancelled.get()) return false;
                    if (!put(ChannelEntry.of(toWindowedValue(next.get(), windowed)))) return false;
                }
            }
            return true;
        }

        @SuppressWarnings("unchecked")
        private WindowedValue<T> toWindowedValue(Object item, boolean windowed) {
            if (windowed) {
                if (!(item instanceof WindowedValue<?>)) {
                    throw new IllegalStateException("Reader declared windowed values but produced " + item.getClass().getName());
                }
                return (WindowedValue<T>) item;
            }
            return WindowedValue.valueInGlobalWindow((T) item);
        }

        /** Blocks while the channel is full. Returns false once the consumer has gone away. */
        private boolean put(ChannelEntry<WindowedValue<T>> entry) throws InterruptedException {
            while (!cancelled.get()) {
                if (channel.offer(entry, OFFER_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) return true;
            }
            return false;
        }

        /**
         * Queues a failure or done entry unless the consumer has gone away. Interrupts do not stop it;
         * a pending interrupt is restored afterwards.
         */
        private void putTerminal(ChannelEntry<WindowedValue<T>> entry) {
            boolean interrupted = Thread.interrupted();
            try {
                while (!cancelled.get()) {
                    try {
                        if (channel.offer(entry, OFFER_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) return;
                    } catch (InterruptedException ie) {
                        interrupted = true;
                    }
                }
            } finally {
                if (interrupted) Thread.currentThread().interrupt();
            }
        }
    }
}
