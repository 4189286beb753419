package io.sideinputs.metrics;

/**
 * Sink for bytes read from side-input sources. Called concurrently from reader threads.
 */
@FunctionalInterface
public interface ReadCounter {
    void addBytesRead(long bytes);
}
