package com.demo.degree.repository;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryEventLog<E> implements EventLog<E> {

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<E>> streams = new ConcurrentHashMap<>();

    @Override
    public void append(String stream, E event) {
        Objects.requireNonNull(event, "event");
        streams.computeIfAbsent(stream, k -> new CopyOnWriteArrayList<>()).add(event);
    }

    @Override
    public List<E> read(String stream) {
        var events = streams.get(stream);
        return events == null ? List.of() : List.copyOf(events);
    }
}
