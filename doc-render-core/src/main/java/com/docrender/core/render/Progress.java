package com.docrender.core.render;

/**
 * Receives render progress. Implementations must be thread-safe.
 */
public interface Progress extends AutoCloseable {

    void setTotal(int total);

    void setCurrent(int current);

    void increment();

    void setStatus(String status);

    void complete();

    void fail(Throwable error);

    @Override
    void close();
}
