package com.quorum.core.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Appends audit entries as JSON lines to a local file.
 *
 * <p>
 * The file is opened in append mode for every entry and never truncated.
 * Appends are serialized so that concurrent attempts cannot interleave bytes
 * within a line.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonLinesAuditSink implements AuditSink {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesAuditSink.class);

    private final Path file;
    private final ObjectMapper mapper;

    /**
     * @param file audit log path; parent directories are created on demand
     */
    public JsonLinesAuditSink(Path file) {
        this.file = Objects.requireNonNull(file, "Audit log path must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    @Override
    public synchronized void append(AuditEntry entry) {
        Objects.requireNonNull(entry, "Audit entry must not be null");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String line = mapper.writeValueAsString(entry) + "\n";
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append audit entry to " + file, e);
        }
    }

    /**
     * Read back every entry in file order.
     *
     * @return entries, empty if the file does not exist yet
     * @throws UncheckedIOException if the file cannot be read or parsed
     */
    public synchronized List<AuditEntry> readAll() {
        List<AuditEntry> entries = new ArrayList<>();
        if (!Files.exists(file)) {
            return entries;
        }
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    entries.add(mapper.readValue(line, AuditEntry.class));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read audit log " + file, e);
        }
        LOG.debug("Read {} audit entries from {}", entries.size(), file);
        return entries;
    }

    public Path getFile() {
        return file;
    }
}
