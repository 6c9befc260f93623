package com.coach.linkage.suppression;

import java.util.Optional;

/**
 * String key-value persistence local to one operator.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void set(String key, String value);

    void remove(String key);
}
