package com.portos.core.provider;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reads and writes the provider status snapshot as pretty-printed JSON.
 * <p>
 * Writes go to a temp file in the same directory and are moved into place, one writer at a
 * time. {@link #save} returns only after the file is in place.
 */
public class ProviderStatusStore {

    private static final Logger log = LoggerFactory.getLogger(ProviderStatusStore.class);

    private final Path file;
    private final ObjectMapper objectMapper;
    private final ReentrantLock writeLock = new ReentrantLock();

    public ProviderStatusStore(Path file) {
        this.file = file.toAbsolutePath();
        this.objectMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * Loads the snapshot. A missing or unreadable file yields an empty snapshot.
     */
    public ProviderStatusSnapshot load() {
        if (!Files.exists(file)) {
            log.debug("No provider status file at {}", file);
            return ProviderStatusSnapshot.empty();
        }
        try {
            ProviderStatusSnapshot snapshot = objectMapper.readValue(file.toFile(), ProviderStatusSnapshot.class);
            return snapshot != null ? snapshot : ProviderStatusSnapshot.empty();
        } catch (IOException e) {
            log.warn("Ignoring unreadable provider status file {}: {}", file, e.getMessage());
            return ProviderStatusSnapshot.empty();
        }
    }

    /**
     * @throws ProviderStatusPersistenceException if the snapshot cannot be written
     */
    public void save(ProviderStatusSnapshot snapshot) {
        writeLock.lock();
        try {
            Path dir = file.getParent();
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            try {
                objectMapper.writeValue(tmp.toFile(), snapshot);
                try {
                    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new ProviderStatusPersistenceException("Failed to write provider status to " + file, e);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Whether {@link #save} can be expected to succeed: the target directory, or its nearest
     * existing ancestor, is writable.
     */
    public boolean isWritable() {
        if (Files.exists(file)) {
            return Files.isWritable(file);
        }
        Path dir = file.getParent();
        while (dir != null && !Files.exists(dir)) {
            dir = dir.getParent();
        }
        return dir != null && Files.isDirectory(dir) && Files.isWritable(dir);
    }

    public Path location() {
        return file;
    }
}
