package com.demo.degree.repository;

import java.util.Collection;
import java.util.Optional;

/**
 * Minimal key-value contract the registry is written against. Implementations may be
 * a local map, a database table or ledger world state; all operations are atomic per key.
 */
public interface KeyValueStore<V> {

    Optional<V> get(String key);

    /** @return true if the value was stored, false if the key was already taken */
    boolean putIfAbsent(String key, V value);

    /** @return true if the current value equalled {@code expected} and was replaced */
    boolean compareAndSet(String key, V expected, V replacement);

    void remove(String key);

    Collection<V> values();
}
