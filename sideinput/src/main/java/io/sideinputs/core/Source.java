package io.sideinputs.core;

import java.io.IOException;

/**
 * A re-readable side-input dataset. Each call to {@link #openReader()} starts an independent read
 * from the beginning; the returned reader must be closed by the caller.
 */
public interface Source<T> {
    Reader<T> openReader() throws IOException;

    /** Human readable description used in logs and error messages. */
    default String describe() { return getClass().getSimpleName(); }
}
