package io.sideinputs.source;

import io.sideinputs.core.AbstractReader;
import io.sideinputs.core.Reader;
import io.sideinputs.core.Source;
import io.sideinputs.core.WindowedValue;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Source over a fixed list of items. {@code byte[]} items are reported to observers as encoded bytes.
 */
public class InMemorySource<T> implements Source<T> {
    private final List<T> items;
    private final boolean windowed;

    private InMemorySource(List<T> items, boolean windowed) {
        this.items = List.copyOf(items);
        this.windowed = windowed;
    }

    public static <T> InMemorySource<T> of(List<T> items) {
        return new InMemorySource<>(items, false);
    }

    @SafeVarargs
    public static <T> InMemorySource<T> of(T... items) {
        return new InMemorySource<>(List.of(items), false);
    }

    /** Source whose reader yields the given values as-is and declares them already windowed. */
    public static <T> InMemorySource<WindowedValue<T>> windowed(List<WindowedValue<T>> values) {
        return new InMemorySource<>(values, true);
    }

    public int size() { return items.size(); }

    @Override
    public Reader<T> openReader() {
        return new ListReader();
    }

    @Override
    public String describe() {
        return "InMemorySource[" + items.size() + " items]";
    }

    private final class ListReader extends AbstractReader<T> {
        private final Iterator<T> it = items.iterator();

        @Override
        protected Optional<T> readNext() {
            return it.hasNext() ? Optional.of(it.next()) : Optional.empty();
        }

        @Override
        public boolean returnsWindowedValues() { return windowed; }
    }
}
