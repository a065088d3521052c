package com.docrender.core.render;

/**
 * Progress sink that ignores every update.
 */
public final class NoOpProgress implements Progress {

    public static final NoOpProgress INSTANCE = new NoOpProgress();

    private NoOpProgress() {
    }

    @Override
    public void setTotal(int total) {
    }

    @Override
    public void setCurrent(int current) {
    }

    @Override
    public void increment() {
    }

    @Override
    public void setStatus(String status) {
    }

    @Override
    public void complete() {
    }

    @Override
    public void fail(Throwable error) {
    }

    @Override
    public void close() {
    }
}
