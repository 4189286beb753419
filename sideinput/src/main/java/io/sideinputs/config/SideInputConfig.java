package io.sideinputs.config;

import java.nio.file.Path;

public record SideInputConfig(
        Path inputDir,
        int readerThreads,
        int queueCapacity,
        int passes,
        int reportEverySeconds
) {
    public static final int DEFAULT_READER_THREADS = 15;
    public static final int DEFAULT_QUEUE_CAPACITY = 10;

    public SideInputConfig {
        if (readerThreads < 1) throw new IllegalArgumentException("readerThreads must be >= 1: " + readerThreads);
        if (queueCapacity < 1) throw new IllegalArgumentException("queueCapacity must be >= 1: " + queueCapacity);
        if (passes < 1) throw new IllegalArgumentException("passes must be >= 1: " + passes);
    }

    public static SideInputConfig fromEnv() {
        Path in = Path.of(System.getProperty("sideinputs.in", System.getenv().getOrDefault("SIDEINPUTS_IN", ".")));
        int threads = Integer.parseInt(System.getProperty("sideinputs.threads", System.getenv().getOrDefault("SIDEINPUTS_THREADS", String.valueOf(DEFAULT_READER_THREADS))));
        int queue = Integer.parseInt(System.getProperty("sideinputs.queue", System.getenv().getOrDefault("SIDEINPUTS_QUEUE", String.valueOf(DEFAULT_QUEUE_CAPACITY))));
        int passes = Integer.parseInt(System.getProperty("sideinputs.passes", System.getenv().getOrDefault("SIDEINPUTS_PASSES", "1")));
        int report = Integer.parseInt(System.getProperty("sideinputs.report", System.getenv().getOrDefault("SIDEINPUTS_REPORT", "0")));
        return new SideInputConfig(in, threads, queue, passes, report);
    }
}
