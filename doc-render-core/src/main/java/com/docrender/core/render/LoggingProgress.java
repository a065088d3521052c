package com.docrender.core.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Progress sink that reports through SLF4J.
 */
public class LoggingProgress implements Progress {

    private static final Logger log = LoggerFactory.getLogger(LoggingProgress.class);

    private final AtomicInteger total = new AtomicInteger();
    private final AtomicInteger current = new AtomicInteger();

    @Override
    public void setTotal(int total) {
        this.total.set(total);
        log.debug("Render started: {} writes planned", total);
    }

    @Override
    public void setCurrent(int current) {
        this.current.set(current);
        log.debug("Render progress: {}/{}", current, total.get());
    }

    @Override
    public void increment() {
        setCurrent(current.incrementAndGet());
    }

    @Override
    public void setStatus(String status) {
        log.info(status);
    }

    @Override
    public void complete() {
        log.info("Render complete: {}/{} writes", current.get(), total.get());
    }

    @Override
    public void fail(Throwable error) {
        log.warn("Render failed after {}/{} writes: {}", current.get(), total.get(), error.getMessage());
    }

    @Override
    public void close() {
    }

    public int current() {
        return current.get();
    }

    public int total() {
        return total.get();
    }
}
