package io.sideinputs.runtime;

import io.sideinputs.core.AbstractReader;
import io.sideinputs.core.Reader;
import io.sideinputs.core.Source;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Test source driven by a generator; counts opens, closes and items read.
 */
class FakeSource implements Source<Object> {
    interface Generator {
        Optional<Object> next() throws IOException;
    }

    private final String name;
    private final Supplier<Generator> generators;
    private IOException openFailure;
    private IOException closeFailure;
    private boolean windowed;

    final AtomicInteger opened = new AtomicInteger();
    final AtomicInteger closed = new AtomicInteger();
    final AtomicInteger produced = new AtomicInteger();

    FakeSource(String name, Supplier<Generator> generators) {
        this.name = name;
        this.generators = generators;
    }

    static FakeSource of(Object... items) {
        return of(List.of(items));
    }

    static FakeSource of(List<?> items) {
        return new FakeSource("list" + items, () -> {
            Iterator<?> it = items.iterator();
            return () -> it.hasNext() ? Optional.<Object>of(it.next()) : Optional.empty();
        });
    }

    /** Yields {@code value} forever, pausing {@code pauseMillis} between items. */
    static FakeSource perpetual(Object value, long pauseMillis) {
        return new FakeSource("perpetual-" + value, () -> () -> {
            sleep(pauseMillis);
            return Optional.of(value);
        });
    }

    FakeSource failingOnOpen(IOException e) { this.openFailure = e; return this; }
    FakeSource failingOnClose(IOException e) { this.closeFailure = e; return this; }
    FakeSource returningWindowedValues() { this.windowed = true; return this; }

    @Override
    public Reader<Object> openReader() throws IOException {
        if (openFailure != null) throw openFailure;
        opened.incrementAndGet();
        Generator g = generators.get();
        return new AbstractReader<>() {
            @Override
            protected Optional<Object> readNext() throws IOException {
                Optional<Object> next = g.next();
                next.ifPresent(v -> produced.incrementAndGet());
                return next;
            }

            @Override
            public boolean returnsWindowedValues() { return windowed; }

            @Override
            public void close() throws IOException {
                closed.incrementAndGet();
                if (closeFailure != null) throw closeFailure;
            }
        };
    }

    @Override
    public String describe() { return name; }

    static void sleep(long millis) {
        try { Thread.sleep(millis); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
    }
}
