package io.sideinputs.source;

import io.sideinputs.core.Reader;
import io.sideinputs.core.Source;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class LengthPrefixedFileSourceTest {
    @Test
    void reads_records_written_by_writer() throws Exception {
        Path dir = Files.createTempDirectory("lp");
        Path file = dir.resolve("a.bin");
        try (LengthPrefixedFileWriter w = new LengthPrefixedFileWriter(file)) {
            w.write("hello".getBytes(StandardCharsets.UTF_8));
            w.write(new byte[0]);
            w.write("world!".getBytes(StandardCharsets.UTF_8));
            assertEquals(3, w.records());
        }
        List<String> out = new ArrayList<>();
        List<Integer> observed = new ArrayList<>();
        try (Reader<byte[]> r = new LengthPrefixedFileSource(file).openReader()) {
            r.addObserver((item, encoded) -> { if (encoded) observed.add(((byte[]) item).length); });
            Optional<byte[]> next;
            while ((next = r.read()).isPresent()) out.add(new String(next.get(), StandardCharsets.UTF_8));
        }
        assertEquals(List.of("hello", "", "world!"), out);
        assertEquals(List.of(5, 0, 6), observed);
    }

    @Test
    void truncated_record_is_an_io_error() throws Exception {
        Path dir = Files.createTempDirectory("lp-trunc");
        Path file = dir.resolve("bad.bin");
        // header says 10 bytes, only 3 follow
        Files.write(file, new byte[]{0, 0, 0, 10, 'a', 'b', 'c'});
        try (Reader<byte[]> r = new LengthPrefixedFileSource(file).openReader()) {
            IOException e = assertThrows(IOException.class, r::read);
            assertTrue(e.getMessage().contains("bad.bin"), e.getMessage());
        }
    }

    @Test
    void missing_file_fails_on_open() {
        Source<byte[]> src = new LengthPrefixedFileSource(Path.of("does-not-exist-" + System.nanoTime()));
        assertThrows(IOException.class, src::openReader);
    }

    @Test
    void lists_directory_in_path_order() throws Exception {
        Path dir = Files.createTempDirectory("lp-dir");
        Files.write(dir.resolve("b.bin"), new byte[0]);
        Files.write(dir.resolve("a.bin"), new byte[0]);
        Files.createDirectories(dir.resolve("sub"));
        List<Source<byte[]>> sources = LengthPrefixedFileSource.listDirectory(dir);
        assertEquals(2, sources.size());
        assertTrue(sources.get(0).describe().endsWith("a.bin"));
        assertTrue(sources.get(1).describe().endsWith("b.bin"));
    }
}
