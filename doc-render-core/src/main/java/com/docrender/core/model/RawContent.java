package com.docrender.core.model;

import com.docrender.core.util.IdGenerator;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Format-specific bytes that a renderer for {@link #format()} emits verbatim.
 *
 * <p>The byte array is copied on the way in and on the way out.
 *
 * @param id stable identifier; generated when null
 * @param format target format name, e.g. "html"
 * @param data raw bytes
 */
public record RawContent(String id, String format, byte[] data) implements Content {

    /**
     * Compact constructor with validation.
     */
    public RawContent {
        if (id == null) {
            id = IdGenerator.randomContentId();
        }
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(data, "data must not be null");
        data = data.clone();
    }

    public static RawContent of(String format, String text) {
        return new RawContent(null, format, text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public ContentType type() {
        return ContentType.RAW;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof RawContent raw
            && id.equals(raw.id)
            && format.equals(raw.format)
            && Arrays.equals(data, raw.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, format) * 31 + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "RawContent[id=" + id + ", format=" + format + ", data=" + data.length + " bytes]";
    }
}
