package io.sideinputs.core;

import java.time.Duration;
import java.time.Instant;

/**
 * The single window covering all of time. Values read without window metadata are assigned here.
 */
public final class GlobalWindow implements BoundedWindow {
    public static final GlobalWindow INSTANCE = new GlobalWindow();

    // one day before TIMESTAMP_MAX_VALUE
    private static final Instant END_OF_GLOBAL_WINDOW = TIMESTAMP_MAX_VALUE.minus(Duration.ofDays(1));

    private GlobalWindow() {}

    @Override
    public Instant maxTimestamp() { return END_OF_GLOBAL_WINDOW; }

    @Override
    public String toString() { return "GlobalWindow"; }
}
