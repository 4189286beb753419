package io.sideinputs.core;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Base reader that notifies registered observers once for every produced item.
 */
public abstract class AbstractReader<T> implements Reader<T> {
    private final List<ReadObserver> observers = new CopyOnWriteArrayList<>();

    /** Produce the next item or empty at the end of the data. */
    protected abstract Optional<T> readNext() throws IOException;

    @Override
    public final Optional<T> read() throws IOException {
        Optional<T> next = readNext();
        next.ifPresent(item -> notifyObservers(item, isEncoded(item)));
        return next;
    }

    /** Items reported as encoded bytes to observers. Defaults to {@code byte[]} payloads. */
    protected boolean isEncoded(T item) {
        return item instanceof byte[];
    }

    protected void notifyObservers(Object item, boolean encoded) {
        for (ReadObserver o : observers) {
            o.onRead(item, encoded);
        }
    }

    @Override
    public void addObserver(ReadObserver observer) {
        observers.add(java.util.Objects.requireNonNull(observer, "observer"));
    }

    @Override
    public void close() throws IOException {}
}
