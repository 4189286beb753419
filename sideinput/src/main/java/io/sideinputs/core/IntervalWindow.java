package io.sideinputs.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Half-open window {@code [start, end)}.
 */
public final class IntervalWindow implements BoundedWindow {
    private final Instant start;
    private final Instant end;

    public IntervalWindow(Instant start, Instant end) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("window end " + end + " is before start " + start);
        }
    }

    public Instant start() { return start; }
    public Instant end() { return end; }

    @Override
    public Instant maxTimestamp() { return end.minusMillis(1); }

    public boolean contains(Instant ts) {
        return !ts.isBefore(start) && ts.isBefore(end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntervalWindow that)) return false;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ".." + end + ")";
    }
}
