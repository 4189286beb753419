package io.sideinputs.tool;

import io.sideinputs.core.WindowedValue;
import io.sideinputs.metrics.MetricsReadCounter;
import io.sideinputs.runtime.EmulatedIterable;
import io.sideinputs.runtime.PrefetchingSourceReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Iterates a file-backed side input several times, re-reading every source on each pass.
 */
public class SideInputReadJob {
    private static final Logger logger = LoggerFactory.getLogger(SideInputReadJob.class);

    private final PrefetchingSourceReader<byte[]> reader;
    private final MetricsReadCounter readCounter;
    private final int passes;

    public SideInputReadJob(PrefetchingSourceReader<byte[]> reader, MetricsReadCounter readCounter, int passes) {
        this.reader = reader;
        this.readCounter = readCounter;
        this.passes = passes;
    }

    public record PassResult(int pass, long records, long payloadBytes, long countedBytes, long millis) {}

    public List<PassResult> run() {
        Iterable<WindowedValue<byte[]>> sideInput = EmulatedIterable.of(reader.iteratorFn());
        List<PassResult> results = new ArrayList<>();
        for (int pass = 1; pass <= passes; pass++) {
            long t0 = System.nanoTime();
            long countedBefore = readCounter.bytesRead();
            long records = 0;
            long bytes = 0;
            for (WindowedValue<byte[]> wv : sideInput) {
                records++;
                bytes += wv.value().length;
            }
            PassResult r = new PassResult(pass, records, bytes, readCounter.bytesRead() - countedBefore,
                    (System.nanoTime() - t0) / 1_000_000);
            logger.info("pass {}/{}: records={} payloadBytes={} countedBytes={} took={}ms",
                    pass, passes, r.records(), r.payloadBytes(), r.countedBytes(), r.millis());
            results.add(r);
        }
        return results;
    }
}
