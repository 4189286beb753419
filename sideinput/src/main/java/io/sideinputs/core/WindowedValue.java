package io.sideinputs.core;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A value tagged with its event timestamp and the windows it belongs to.
 */
public final class WindowedValue<T> {
    private final T value;
    private final Instant timestamp;
    private final List<BoundedWindow> windows;

    private WindowedValue(T value, Instant timestamp, List<BoundedWindow> windows) {
        this.value = value;
        this.timestamp = timestamp;
        this.windows = windows;
    }

    public static <T> WindowedValue<T> of(T value, Instant timestamp, Collection<? extends BoundedWindow> windows) {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(windows, "windows");
        if (windows.isEmpty()) {
            throw new IllegalArgumentException("a windowed value needs at least one window");
        }
        return new WindowedValue<>(value, timestamp, List.copyOf(windows));
    }

    public static <T> WindowedValue<T> of(T value, Instant timestamp, BoundedWindow window) {
        return new WindowedValue<>(value, Objects.requireNonNull(timestamp, "timestamp"),
                List.of(Objects.requireNonNull(window, "window")));
    }

    /** Wraps a value with no window metadata: global window, minimum timestamp. */
    public static <T> WindowedValue<T> valueInGlobalWindow(T value) {
        return new WindowedValue<>(value, BoundedWindow.TIMESTAMP_MIN_VALUE, List.of(GlobalWindow.INSTANCE));
    }

    public T value() { return value; }
    public Instant timestamp() { return timestamp; }
    public List<BoundedWindow> windows() { return windows; }

    public <U> WindowedValue<U> withValue(U newValue) {
        return new WindowedValue<>(newValue, timestamp, windows);
    }

    public boolean isInGlobalWindow() {
        return windows.size() == 1 && windows.get(0) == GlobalWindow.INSTANCE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WindowedValue<?> that)) return false;
        return Objects.equals(value, that.value) && timestamp.equals(that.timestamp) && windows.equals(that.windows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, timestamp, windows);
    }

    @Override
    public String toString() {
        return "WindowedValue{" +
                "value=" + value +
                ", timestamp=" + timestamp +
                ", windows=" + windows +
                '}';
    }
}
