package com.docrender.core.render;

import com.docrender.core.cancel.CancellationToken;
import com.docrender.core.model.Document;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Serializes a {@link Document} into the bytes of one output format.
 *
 * <p>Implementations must run the transformation pipeline on every content item before
 * serializing it and must stop once the token is cancelled. They must not modify the document.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI), see
 * {@link RendererRegistry}.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.docrender.core.render.Renderer}
 */
public interface Renderer {

    /**
     * Returns the format name, lowercase (e.g. "json", "markdown").
     *
     * @return format name
     */
    String format();

    /**
     * Renders the document into a byte array.
     *
     * @param token cancellation token
     * @param document document to render
     * @return rendered bytes
     */
    byte[] render(CancellationToken token, Document document);

    /**
     * Renders the document into a stream.
     *
     * @param token cancellation token
     * @param document document to render
     * @param out target stream, not closed
     * @throws IOException if writing to the stream fails
     */
    default void renderTo(CancellationToken token, Document document, OutputStream out) throws IOException {
        out.write(render(token, document));
    }

    /**
     * Returns whether {@link #renderTo} streams incrementally instead of buffering.
     *
     * @return true for streaming renderers
     */
    default boolean supportsStreaming() {
        return false;
    }
}
