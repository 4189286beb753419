package io.sideinputs.config;

/** Experiment names recognised by the side-input reader. */
public final class Experiments {
    /** Report bytes read from side-input sources to the configured {@code ReadCounter}. */
    public static final String SIDEINPUT_IO_METRICS = "sideinput_io_metrics";

    private Experiments() {}
}
