package com.demo.degree.repository;

import java.util.List;

/**
 * Append-only log partitioned into named streams (one per degree).
 */
public interface EventLog<E> {

    void append(String stream, E event);

    /** Events of one stream in append order; empty if the stream does not exist. */
    List<E> read(String stream);
}
