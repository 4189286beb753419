package io.sideinputs.tool;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.TypeLiteral;
import io.sideinputs.config.RuntimeOptions;
import io.sideinputs.config.SideInputConfig;
import io.sideinputs.runtime.PrefetchingSourceReader;
import io.sideinputs.source.LengthPrefixedFileWriter;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SideInputModuleTest {
    @Test
    void wires_reader_over_every_file_and_reports_bytes() throws Exception {
        Path dir = Files.createTempDirectory("sideinput-module");
        for (String name : List.of("a.bin", "b.bin")) {
            try (LengthPrefixedFileWriter w = new LengthPrefixedFileWriter(dir.resolve(name))) {
                w.write(new byte[4]);
                w.write(new byte[6]);
            }
        }
        SideInputConfig cfg = new SideInputConfig(dir, 4, 10, 3, 0);
        RuntimeOptions options = new RuntimeOptions(Map.of(RuntimeOptions.EXPERIMENTS, "sideinput_io_metrics"));
        Injector injector = Guice.createInjector(new SideInputModule(cfg, options));

        PrefetchingSourceReader<byte[]> reader = injector.getInstance(Key.get(new TypeLiteral<PrefetchingSourceReader<byte[]>>() {}));
        assertSame(reader, injector.getInstance(Key.get(new TypeLiteral<PrefetchingSourceReader<byte[]>>() {})));
        assertEquals(2, reader.readerThreads());

        List<SideInputReadJob.PassResult> results = injector.getInstance(SideInputReadJob.class).run();
        assertEquals(3, results.size());
        for (SideInputReadJob.PassResult r : results) {
            assertEquals(4, r.records());
            assertEquals(20, r.countedBytes());
        }
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);
        assertEquals(60, registry.counter("sideinput.files.bytes.read").getCount());
        assertEquals(12, registry.counter("sideinput.merge.items").getCount());
    }
}
