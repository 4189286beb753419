package io.sideinputs.tool;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.sideinputs.config.RuntimeOptions;
import io.sideinputs.config.SideInputConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * Reads every file of a directory as one side input, {@code passes} times.
 */
@CommandLine.Command(name = "read", mixinStandardHelpOptions = true, description = "Read a directory of length-prefixed files as a side input")
public final class ReadCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(ReadCommand.class);

    @CommandLine.Option(names = {"-i", "--input"}, required = true, description = "Directory of length-prefixed record files")
    Path input;

    @CommandLine.Option(names = {"-t", "--threads"}, description = "Maximum reader threads; defaults to SIDEINPUTS_THREADS or " + SideInputConfig.DEFAULT_READER_THREADS)
    Integer threads;

    @CommandLine.Option(names = {"-q", "--queue"}, description = "Prefetch queue capacity; defaults to SIDEINPUTS_QUEUE or " + SideInputConfig.DEFAULT_QUEUE_CAPACITY)
    Integer queue;

    @CommandLine.Option(names = {"-p", "--passes"}, description = "Number of full passes over the side input; defaults to SIDEINPUTS_PASSES or 1")
    Integer passes;

    @CommandLine.Option(names = {"-e", "--experiments"}, description = "Comma-separated experiments, e.g. sideinput_io_metrics; defaults to SIDEINPUTS_EXPERIMENTS", defaultValue = "")
    String experiments;

    @CommandLine.Option(names = {"-r", "--report-every"}, description = "Seconds between metric reports; 0 reports once at the end", defaultValue = "0")
    int reportEverySeconds;

    List<SideInputReadJob.PassResult> results = List.of();

    @Override
    public Integer call() throws Exception {
        if (!Files.isDirectory(input)) {
            logger.error("Input directory {} does not exist", input);
            return 2;
        }
        SideInputConfig cfg;
        try {
            SideInputConfig env = SideInputConfig.fromEnv();
            cfg = new SideInputConfig(input,
                    threads != null ? threads : env.readerThreads(),
                    queue != null ? queue : env.queueCapacity(),
                    passes != null ? passes : env.passes(),
                    reportEverySeconds);
        } catch (IllegalArgumentException e) {
            logger.error("Invalid arguments: {}", e.getMessage());
            return 2;
        }
        RuntimeOptions options = experiments.isBlank()
                ? RuntimeOptions.fromEnv()
                : new RuntimeOptions(Map.of(RuntimeOptions.EXPERIMENTS, experiments));
        Injector injector = Guice.createInjector(new SideInputModule(cfg, options));
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);

        Slf4jReporter reporter = Slf4jReporter.forRegistry(registry)
                .outputTo(LoggerFactory.getLogger("io.sideinputs.metrics"))
                .convertRatesTo(TimeUnit.SECONDS)
                .convertDurationsTo(TimeUnit.MILLISECONDS)
                .build();
        if (cfg.reportEverySeconds() > 0) reporter.start(cfg.reportEverySeconds(), TimeUnit.SECONDS);
        try {
            results = injector.getInstance(SideInputReadJob.class).run();
            return 0;
        } catch (RuntimeException e) {
            logger.error("Reading side input from {} failed", input, e);
            return 1;
        } finally {
            reporter.report();
            reporter.stop();
        }
    }
}
