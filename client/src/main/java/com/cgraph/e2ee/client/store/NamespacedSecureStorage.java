package com.cgraph.e2ee.client.store;

import java.util.Optional;

/** Prefixes every key, so several users can share one device's storage. */
public class NamespacedSecureStorage implements SecureStorage {

    private final SecureStorage delegate;
    private final String prefix;

    public NamespacedSecureStorage(SecureStorage delegate, String namespace) {
        this.delegate = delegate;
        this.prefix = namespace + ":";
    }

    @Override
    public Optional<String> get(String key) {
        return delegate.get(prefix + key);
    }

    @Override
    public void put(String key, String value) {
        delegate.put(prefix + key, value);
    }

    @Override
    public boolean putIfAbsent(String key, String value) {
        return delegate.putIfAbsent(prefix + key, value);
    }

    @Override
    public void delete(String key) {
        delegate.delete(prefix + key);
    }
}
