package io.sideinputs.source;

import io.sideinputs.core.Reader;
import io.sideinputs.core.WindowedValue;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InMemorySourceTest {
    @Test
    void notifies_observers_with_encoded_flag() throws Exception {
        InMemorySource<Object> src = InMemorySource.of(List.of("a", new byte[]{1, 2}));
        List<Boolean> flags = new ArrayList<>();
        try (Reader<Object> r = src.openReader()) {
            r.addObserver((item, encoded) -> flags.add(encoded));
            assertEquals("a", r.read().orElseThrow());
            assertArrayEquals(new byte[]{1, 2}, (byte[]) r.read().orElseThrow());
            assertTrue(r.read().isEmpty());
        }
        assertEquals(List.of(false, true), flags);
    }

    @Test
    void every_reader_starts_from_the_beginning() throws Exception {
        InMemorySource<String> src = InMemorySource.of("x", "y");
        try (Reader<String> r1 = src.openReader(); Reader<String> r2 = src.openReader()) {
            assertEquals("x", r1.read().orElseThrow());
            assertEquals("y", r1.read().orElseThrow());
            assertEquals("x", r2.read().orElseThrow());
        }
    }

    @Test
    void windowed_source_declares_windowed_values() throws Exception {
        WindowedValue<String> wv = WindowedValue.valueInGlobalWindow("w");
        InMemorySource<WindowedValue<String>> src = InMemorySource.windowed(List.of(wv));
        try (Reader<WindowedValue<String>> r = src.openReader()) {
            assertTrue(r.returnsWindowedValues());
            assertSame(wv, r.read().orElseThrow());
        }
        assertFalse(InMemorySource.of("plain").openReader().returnsWindowedValues());
    }
}
