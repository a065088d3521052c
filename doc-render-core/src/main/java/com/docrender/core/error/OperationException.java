package com.docrender.core.error;

/**
 * Thrown by {@code Operation.apply()} when a precondition depends on data only known at execution
 * time, such as a sort column that is absent from the table schema.
 */
public class OperationException extends DocRenderException {

    private static final long serialVersionUID = 1L;

    private final String operationName;

    public OperationException(String operationName, String message) {
        super(message);
        this.operationName = operationName;
    }

    /** Name of the operation that failed. */
    public String operationName() {
        return operationName;
    }
}
