package com.docrender.core.error;

/**
 * Abstract base for all DocRender exceptions. Never thrown directly; use one of the concrete
 * subclasses in this package.
 *
 * <p>All exceptions are unchecked. Callers that want to react to a specific failure class catch
 * the subclass; callers that only need to report catch this type.
 */
public abstract class DocRenderException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected DocRenderException(String message) {
        super(message);
    }

    protected DocRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
