package com.docrender.core.error;

/**
 * Component in which a render failure originated.
 */
public enum ErrorComponent {
    /** Serializing the document for a format */
    RENDERER,

    /** Post-processing rendered bytes */
    TRANSFORMER,

    /** Persisting or transmitting rendered bytes */
    WRITER,

    /** Work skipped because the cancellation token fired */
    CANCELLATION
}
