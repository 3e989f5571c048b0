package com.cgraph.e2ee.client.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Process-local {@link SecureStorage}. Everything is lost when the JVM exits. */
public class InMemorySecureStorage implements SecureStorage {

    private final ConcurrentHashMap<String, String> values = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void put(String key, String value) {
        values.put(key, value);
    }

    @Override
    public boolean putIfAbsent(String key, String value) {
        return values.putIfAbsent(key, value) == null;
    }

    @Override
    public void delete(String key) {
        values.remove(key);
    }

    public int size() {
        return values.size();
    }
}
