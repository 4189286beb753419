package io.sideinputs.source;

import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes records in the format read by {@link LengthPrefixedFileSource}.
 */
public class LengthPrefixedFileWriter implements AutoCloseable {
    private final DataOutputStream out;
    private long records = 0;

    public LengthPrefixedFileWriter(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        this.out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(file)));
    }

    public void write(byte[] record) throws IOException {
        out.writeInt(record.length);
        out.write(record);
        records++;
    }

    public long records() { return records; }

    @Override
    public void close() throws IOException {
        out.close();
    }
}
