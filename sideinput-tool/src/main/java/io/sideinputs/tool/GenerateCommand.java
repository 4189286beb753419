package io.sideinputs.tool;

import io.sideinputs.source.LengthPrefixedFileWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.concurrent.Callable;

/**
 * Writes sample side-input files: {@code part-NNNNN.bin}, each with {@code records} records.
 */
@CommandLine.Command(name = "generate", mixinStandardHelpOptions = true, description = "Write sample length-prefixed side-input files")
public final class GenerateCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(GenerateCommand.class);

    @CommandLine.Option(names = {"-o", "--out"}, required = true, description = "Output directory")
    Path out;

    @CommandLine.Option(names = {"-f", "--files"}, description = "Number of files", defaultValue = "4")
    int files;

    @CommandLine.Option(names = {"-n", "--records"}, description = "Records per file", defaultValue = "1000")
    int records;

    @CommandLine.Option(names = {"-s", "--record-size"}, description = "Minimum payload size in bytes", defaultValue = "64")
    int recordSize;

    @Override
    public Integer call() throws Exception {
        if (files < 0 || records < 0 || recordSize < 0) {
            logger.error("files, records and record-size must not be negative");
            return 2;
        }
        Files.createDirectories(out);
        for (int f = 0; f < files; f++) {
            Path file = out.resolve(String.format("part-%05d.bin", f));
            try (LengthPrefixedFileWriter w = new LengthPrefixedFileWriter(file)) {
                for (int r = 0; r < records; r++) {
                    w.write(payload(f, r, recordSize));
                }
            }
        }
        logger.info("Wrote {} files x {} records to {}", files, records, out);
        return 0;
    }

    /** {@code "<file>:<record>"} padded with '.' up to {@code size} bytes. */
    static byte[] payload(int file, int record, int size) {
        byte[] key = (file + ":" + record).getBytes(StandardCharsets.UTF_8);
        if (key.length >= size) return key;
        byte[] padded = Arrays.copyOf(key, size);
        Arrays.fill(padded, key.length, size, (byte) '.');
        return padded;
    }
}
