package io.sideinputs.core;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * Sequential reader bound to one {@link Source}. Opened by {@link Source#openReader()}, read until
 * {@link #read()} returns empty or throws, then closed exactly once.
 */
public interface Reader<T> extends Closeable {
    /**
     * Read the next raw item. Returns empty once the underlying data is exhausted.
     */
    Optional<T> read() throws IOException;

    /**
     * Whether items are already {@link WindowedValue}s and must be passed through untouched.
     */
    default boolean returnsWindowedValues() { return false; }

    /** Register a callback invoked synchronously for every item this reader produces. */
    void addObserver(ReadObserver observer);
}
