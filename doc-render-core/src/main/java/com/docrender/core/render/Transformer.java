package com.docrender.core.render;

import com.docrender.core.cancel.CancellationToken;

/**
 * Post-processes rendered bytes of selected formats, e.g. minification or signing.
 */
public interface Transformer {

    String name();

    /**
     * Returns the execution priority; lower values run first.
     *
     * @return priority
     */
    int priority();

    boolean canTransform(String format);

    /**
     * Transforms rendered bytes.
     *
     * @param token cancellation token
     * @param data rendered bytes
     * @param format format name
     * @return transformed bytes
     */
    byte[] transform(CancellationToken token, byte[] data, String format);
}
