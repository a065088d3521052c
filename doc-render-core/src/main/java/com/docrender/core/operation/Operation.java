package com.docrender.core.operation;

import com.docrender.core.cancel.CancellationToken;
import com.docrender.core.model.Content;

/**
 * A stateless transformation step attached to a {@link Content} and run at render time.
 *
 * <p>Implementations must never modify their input: {@link #apply} returns new content whose
 * collections are fresh copies. Operations hold no mutable state and may be invoked concurrently
 * over different content.
 *
 * <p><b>Contract:</b>
 * <ul>
 *   <li>{@link #validate()} checks structure only and throws
 *       {@link com.docrender.core.error.ValidationException}</li>
 *   <li>{@link #apply} throws {@link com.docrender.core.error.OperationException} for data
 *       dependent failures, {@link com.docrender.core.error.CallbackException} when a user
 *       function throws and {@link com.docrender.core.error.CancelledException} when the token
 *       fires mid-operation</li>
 * </ul>
 */
public interface Operation {

    /**
     * Returns the short name used in diagnostics, e.g. {@code "filter"}.
     *
     * @return operation name
     */
    String name();

    /**
     * Checks that this operation is structurally valid. Never touches data.
     */
    void validate();

    /**
     * Applies this operation and returns the result.
     *
     * @param content input content, left untouched
     * @param token cancellation token polled between rows
     * @return new content
     */
    Content apply(Content content, CancellationToken token);

    /**
     * Advisory hint that this operation could be fused with {@code other}.
     *
     * @param other the following operation
     * @return true if fusion is possible
     */
    default boolean canOptimize(Operation other) {
        return false;
    }
}
