package io.sideinputs.error;

/**
 * Unchecked carrier for a checked failure raised while reading a side input. The original exception
 * is always the {@linkplain #getCause() cause}; unchecked failures are rethrown as-is and never wrapped.
 */
public class SideInputReadException extends RuntimeException {
    public SideInputReadException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns {@code t} itself when it is unchecked, otherwise wraps it. Errors are thrown directly.
     */
    public static RuntimeException propagate(Throwable t) {
        if (t instanceof RuntimeException re) return re;
        if (t instanceof Error err) throw err;
        return new SideInputReadException("Side input read failed: " + t, t);
    }
}
