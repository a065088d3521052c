package com.docrender.core.util;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Generates identifiers for content items that were created without one.
 *
 * <p>Ids use the {@code content-<16 hex>} form.
 */
public final class IdGenerator {

    private static final String PREFIX = "content-";
    private static final int RANDOM_BYTES = 8;
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    private IdGenerator() {
    }

    /**
     * Generates a random content id of the form {@code content-<16 hex>}.
     *
     * @return random content id
     */
    public static String randomContentId() {
        byte[] bytes = new byte[RANDOM_BYTES];
        RANDOM.nextBytes(bytes);
        return PREFIX + HEX.formatHex(bytes);
    }
}
