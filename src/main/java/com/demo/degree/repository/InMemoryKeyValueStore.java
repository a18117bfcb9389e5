package com.demo.degree.repository;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryKeyValueStore<V> implements KeyValueStore<V> {

    private final ConcurrentHashMap<String, V> store = new ConcurrentHashMap<>();

    @Override
    public Optional<V> get(String key) {
        return Optional.ofNullable(store.get(key));
    }

    @Override
    public boolean putIfAbsent(String key, V value) {
        Objects.requireNonNull(value, "value");
        return store.putIfAbsent(key, value) == null;
    }

    @Override
    public boolean compareAndSet(String key, V expected, V replacement) {
        return store.replace(key, expected, replacement);
    }

    @Override
    public void remove(String key) { store.remove(key); }

    @Override
    public Collection<V> values() { return List.copyOf(store.values()); }
}
