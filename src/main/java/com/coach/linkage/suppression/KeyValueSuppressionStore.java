package com.coach.linkage.suppression;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * {@link SuppressionStore} kept as a JSON array of pair keys under one key of a
 * {@link KeyValueStore}. The list is read once and written back on every change.
 */
public class KeyValueSuppressionStore implements SuppressionStore {
    private static final Logger log = LoggerFactory.getLogger(KeyValueSuppressionStore.class);
    private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {};

    private final KeyValueStore keyValueStore;
    private final String storageKey;
    private final ObjectMapper objectMapper;
    private final Set<String> dismissed;

    public KeyValueSuppressionStore(KeyValueStore keyValueStore, String storageKey) {
        this(keyValueStore, storageKey, new ObjectMapper());
    }

    public KeyValueSuppressionStore(KeyValueStore keyValueStore, String storageKey, ObjectMapper objectMapper) {
        this.keyValueStore = keyValueStore;
        this.storageKey = storageKey;
        this.objectMapper = objectMapper;
        this.dismissed = load();
    }

    @Override
    public synchronized void dismiss(String idA, String idB) {
        String key = PairKey.of(idA, idB).value();
        if (!dismissed.add(key)) {
            return;
        }
        try {
            persist();
        } catch (RuntimeException e) {
            dismissed.remove(key);
            throw e;
        }
        log.info("suppression.dismissed key={} storageKey={}", key, storageKey);
    }

    @Override
    public synchronized boolean isDismissed(String idA, String idB) {
        return dismissed.contains(PairKey.of(idA, idB).value());
    }

    @Override
    public synchronized void clearAll() {
        int cleared = dismissed.size();
        keyValueStore.remove(storageKey);
        dismissed.clear();
        log.info("suppression.cleared count={} storageKey={}", cleared, storageKey);
    }

    @Override
    public synchronized Set<String> dismissedKeys() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(dismissed));
    }

    @Override
    public synchronized int size() {
        return dismissed.size();
    }

    private Set<String> load() {
        return keyValueStore.get(storageKey)
                .map(this::parse)
                .orElseGet(LinkedHashSet::new);
    }

    private Set<String> parse(String json) {
        try {
            return new LinkedHashSet<>(objectMapper.readValue(json, LIST_TYPE));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable suppression list under '{}': {}", storageKey, e.getOriginalMessage());
            return new LinkedHashSet<>();
        }
    }

    private void persist() {
        try {
            keyValueStore.set(storageKey, objectMapper.writeValueAsString(List.copyOf(dismissed)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize suppression list", e);
        }
    }
}
