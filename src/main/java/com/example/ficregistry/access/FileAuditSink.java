package com.example.ficregistry.access;

import com.example.ficregistry.models.LookupAuditEntry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes audit lines to a UTF-8 text file opened in append mode. Retention and rotation
 * belong to external log tooling.
 */
public class FileAuditSink implements AuditSink {

    private final Path path;

    public FileAuditSink(Path path) {
        this.path = path;
    }

    @Override
    public synchronized void append(LookupAuditEntry entry) {
        byte[] line = (entry.toLogLine() + System.lineSeparator()).getBytes(StandardCharsets.UTF_8);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (FileChannel channel = FileChannel.open(path,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                ByteBuffer buffer = ByteBuffer.wrap(line);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to append audit entry to " + path, ex);
        }
    }

    public Path getPath() {
        return path;
    }
}
