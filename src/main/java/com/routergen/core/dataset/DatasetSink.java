package com.routergen.core.dataset;

import com.routergen.core.example.Example;

/**
 * Destination for accepted examples. One write per example; a write either
 * lands completely or not at all.
 */
public interface DatasetSink extends AutoCloseable {

    /**
     * @param example  stripped, deduplicated example
     * @param rendered chat-template rendering of the same example
     * @throws DatasetIOException when the write fails
     */
    void write(Example example, String rendered);

    long written();

    @Override
    void close();
}
