package io.sideinputs.runtime;

import java.util.Iterator;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * An iterable that re-runs a production routine for every traversal instead of holding the values.
 *
 * <p>Side inputs too large for memory are exposed this way: each {@link #iterator()} call asks the
 * routine for a fresh iterator, so at most the in-flight value of each traversal is held. Nothing is
 * cached between traversals; if the underlying data changes, later traversals see the change.
 */
public final class EmulatedIterable<T> implements Iterable<T> {
    private final Supplier<? extends Iterator<T>> iteratorFn;

    private EmulatedIterable(Supplier<? extends Iterator<T>> iteratorFn) {
        this.iteratorFn = Objects.requireNonNull(iteratorFn, "iteratorFn");
    }

    public static <T> EmulatedIterable<T> of(Supplier<? extends Iterator<T>> iteratorFn) {
        return new EmulatedIterable<>(iteratorFn);
    }

    @Override
    public Iterator<T> iterator() {
        return Objects.requireNonNull(iteratorFn.get(), "iteratorFn returned null");
    }

    @Override
    public String toString() {
        return "EmulatedIterable";
    }
}
