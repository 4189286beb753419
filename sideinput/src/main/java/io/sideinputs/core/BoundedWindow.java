package io.sideinputs.core;

import java.time.Instant;

/**
 * A window with a finite upper bound on the timestamps it contains.
 */
public interface BoundedWindow {
    Instant TIMESTAMP_MIN_VALUE = Instant.ofEpochMilli(Long.MIN_VALUE / 1000);
    Instant TIMESTAMP_MAX_VALUE = Instant.ofEpochMilli(Long.MAX_VALUE / 1000);

    Instant maxTimestamp();
}
