package io.sideinputs.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;

/**
 * {@link ReadCounter} backed by a Dropwizard counter for total bytes and a meter for byte throughput.
 */
public class MetricsReadCounter implements ReadCounter {
    private final Counter bytesRead;
    private final Meter readRate;

    public MetricsReadCounter(Counter bytesRead, Meter readRate) {
        this.bytesRead = java.util.Objects.requireNonNull(bytesRead, "bytesRead");
        this.readRate = java.util.Objects.requireNonNull(readRate, "readRate");
    }

    @Override
    public void addBytesRead(long bytes) {
        bytesRead.inc(bytes);
        readRate.mark(bytes);
    }

    public long bytesRead() { return bytesRead.getCount(); }
}
