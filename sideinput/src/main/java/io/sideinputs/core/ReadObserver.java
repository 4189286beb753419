package io.sideinputs.core;

/**
 * Per-item notification hook. {@code encoded} is true when the item is a raw encoded byte sequence.
 */
@FunctionalInterface
public interface ReadObserver {
    void onRead(Object item, boolean encoded);
}
