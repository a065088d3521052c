package com.docrender.core.error;

import java.util.concurrent.TimeoutException;

/**
 * Work stopped because the cancellation token fired between two steps. The cause is the token's
 * cause: a {@link java.util.concurrent.CancellationException} for explicit cancellation or a
 * {@link TimeoutException} for an expired deadline.
 */
public class CancelledException extends DocRenderException {

    private static final long serialVersionUID = 1L;

    /** What was being processed when cancellation was observed. */
    public enum Scope {
        CONTENT,
        FORMAT
    }

    private final Scope scope;
    private final String name;

    public CancelledException(Scope scope, String name, Throwable cause) {
        super("cancelled while processing " + scope.name().toLowerCase() + " '" + name + "': " + cause, cause);
        this.scope = scope;
        this.name = name;
    }

    public static CancelledException forContent(String contentId, Throwable cause) {
        return new CancelledException(Scope.CONTENT, contentId, cause);
    }

    public static CancelledException forFormat(String format, Throwable cause) {
        return new CancelledException(Scope.FORMAT, format, cause);
    }

    public Scope scope() {
        return scope;
    }

    /** Content identifier or format name, depending on {@link #scope()}. */
    public String name() {
        return name;
    }

    /** True when the token fired because its deadline passed. */
    public boolean isDeadlineExceeded() {
        return getCause() instanceof TimeoutException;
    }
}
