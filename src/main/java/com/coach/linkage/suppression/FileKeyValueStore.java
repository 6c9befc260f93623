package com.coach.linkage.suppression;

import com.coach.linkage.error.StoreException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * {@link KeyValueStore} persisted as a single JSON object file, so suppression lists
 * survive across sessions on the operator's machine.
 * Every write rewrites the file through a temporary sibling and an atomic move.
 */
public class FileKeyValueStore implements KeyValueStore {
    private static final Logger log = LoggerFactory.getLogger(FileKeyValueStore.class);
    private static final TypeReference<TreeMap<String, String>> MAP_TYPE = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;

    public FileKeyValueStore(Path file) {
        this(file, new ObjectMapper());
    }

    public FileKeyValueStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(read().get(key));
    }

    @Override
    public synchronized void set(String key, String value) {
        Map<String, String> values = read();
        values.put(key, value);
        write(values);
    }

    @Override
    public synchronized void remove(String key) {
        Map<String, String> values = read();
        if (values.remove(key) != null) {
            write(values);
        }
    }

    private Map<String, String> read() {
        if (!Files.exists(file)) {
            return new TreeMap<>();
        }
        try {
            return objectMapper.readValue(file.toFile(), MAP_TYPE);
        } catch (IOException e) {
            throw new StoreException("Failed to read key-value file " + file + ": " + e.getMessage(), e);
        }
    }

    private void write(Map<String, String> values) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), values);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Wrote {} keys to {}", values.size(), file);
        } catch (IOException e) {
            throw new StoreException("Failed to write key-value file " + file + ": " + e.getMessage(), e);
        }
    }
}
