package com.docrender.core.error;

/**
 * A user-supplied function (predicate, comparator, aggregate, derived column or field formatter)
 * threw while being invoked. The original exception is the cause.
 */
public class CallbackException extends DocRenderException {

    private static final long serialVersionUID = 1L;

    private final String operationName;
    private final String callback;

    public CallbackException(String operationName, String callback, Throwable cause) {
        super(operationName + " " + callback + " failed: " + cause, cause);
        this.operationName = operationName;
        this.callback = callback;
    }

    public String operationName() {
        return operationName;
    }

    /** Which callback failed, e.g. {@code "predicate"} or {@code "aggregate 'total'"}. */
    public String callback() {
        return callback;
    }
}
