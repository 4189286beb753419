package io.sideinputs.source;

import io.sideinputs.core.AbstractReader;
import io.sideinputs.core.Reader;
import io.sideinputs.core.Source;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads one file of length-prefixed records (4-byte big-endian length, then payload) and yields each
 * payload as an encoded {@code byte[]}.
 */
public class LengthPrefixedFileSource implements Source<byte[]> {
    private static final int BUFFER_SIZE = 64 * 1024;

    private final Path file;

    public LengthPrefixedFileSource(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    /** One source per regular file in {@code dir}, path-sorted. */
    public static List<Source<byte[]>> listDirectory(Path dir) throws IOException {
        List<Source<byte[]>> sources = new ArrayList<>();
        try (var stream = Files.list(dir)) {
            stream.filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(Path::toString))
                    .forEach(p -> sources.add(new LengthPrefixedFileSource(p)));
        }
        return sources;
    }

    public Path file() { return file; }

    @Override
    public Reader<byte[]> openReader() throws IOException {
        return new RecordReader(new DataInputStream(new BufferedInputStream(Files.newInputStream(file), BUFFER_SIZE)));
    }

    @Override
    public String describe() {
        return file.toString();
    }

    private final class RecordReader extends AbstractReader<byte[]> {
        private final DataInputStream in;
        private long offset = 0;

        RecordReader(DataInputStream in) {
            this.in = in;
        }

        @Override
        protected Optional<byte[]> readNext() throws IOException {
            int b0 = in.read();
            if (b0 < 0) return Optional.empty();
            try {
                int len = (b0 << 24) | (in.readUnsignedByte() << 16) | (in.readUnsignedByte() << 8) | in.readUnsignedByte();
                if (len < 0) {
                    throw new IOException("negative record length " + len + " in " + file + " at offset " + offset);
                }
                byte[] payload = new byte[len];
                in.readFully(payload);
                offset += 4L + len;
                return Optional.of(payload);
            } catch (EOFException e) {
                throw new IOException("truncated record in " + file + " at offset " + offset, e);
            }
        }

        @Override
        public void close() throws IOException {
            in.close();
        }
    }
}
