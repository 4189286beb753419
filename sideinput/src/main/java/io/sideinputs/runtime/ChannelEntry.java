package io.sideinputs.runtime;

/**
 * One slot of the reader-to-consumer channel: a value, a reader thread finishing, or a failure.
 */
final class ChannelEntry<T> {
    private static final ChannelEntry<?> DONE = new ChannelEntry<>(null, null, true);

    private final T value;
    private final Throwable failure;
    private final boolean done;

    private ChannelEntry(T value, Throwable failure, boolean done) {
        this.value = value; this.failure = failure; this.done = done;
    }

    static <T> ChannelEntry<T> of(T value) { return new ChannelEntry<>(value, null, false); }
    static <T> ChannelEntry<T> failure(Throwable t) { return new ChannelEntry<>(null, t, false); }

    @SuppressWarnings("unchecked")
    static <T> ChannelEntry<T> done() { return (ChannelEntry<T>) DONE; }

    boolean isDone() { return done; }
    boolean isFailure() { return failure != null; }
    T value() { return value; }
    Throwable failure() { return failure; }
}
