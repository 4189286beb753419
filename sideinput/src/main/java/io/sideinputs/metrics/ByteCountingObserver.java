package io.sideinputs.metrics;

import io.sideinputs.core.ReadObserver;

import java.util.Objects;

/**
 * Forwards the length of every encoded {@code byte[]} item to a {@link ReadCounter}.
 * Structured items and encoded items of other types are not counted.
 */
public class ByteCountingObserver implements ReadObserver {
    private final ReadCounter counter;

    public ByteCountingObserver(ReadCounter counter) {
        this.counter = Objects.requireNonNull(counter, "counter");
    }

    @Override
    public void onRead(Object item, boolean encoded) {
        if (encoded && item instanceof byte[] bytes) {
            counter.addBytesRead(bytes.length);
        }
    }
}
