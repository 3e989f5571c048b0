package com.cgraph.e2ee.client.store;

import java.util.Optional;

/**
 * Device-secure key/value storage (platform keystore, encrypted preferences and
 * the like). Implementations may block; callers move every call off the event
 * loop.
 */
public interface SecureStorage {

    Optional<String> get(String key);

    void put(String key, String value);

    /**
     * Stores {@code value} only when {@code key} is unset.
     *
     * @return {@code true} if the value was written
     */
    boolean putIfAbsent(String key, String value);

    void delete(String key);
}
