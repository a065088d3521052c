package com.docrender.core.render;

import com.docrender.core.cancel.CancellationToken;

/**
 * Persists or transmits rendered bytes.
 *
 * <p>The orchestrator calls writers from one thread per format, so a writer registered once and
 * shared across formats must be thread-safe.
 */
public interface OutputWriter {

    /**
     * Returns the writer name used in diagnostics.
     *
     * @return writer name, defaults to the simple class name
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Writes the bytes of one format.
     *
     * @param token cancellation token
     * @param format format name
     * @param data rendered bytes
     */
    void write(CancellationToken token, String format, byte[] data);
}
