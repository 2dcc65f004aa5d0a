package org.flowvault.codec;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Reversible byte-to-text transforms for binary values embedded in JSON chunk payloads.
 * <p>
 * JSON strings cannot carry arbitrary bytes. Two encodings are used:
 * <ul>
 *   <li><strong>Latin-1</strong> for header names/values and ALPN: one char per byte, so any
 *       byte sequence maps to a unique string and back, and ASCII headers stay readable
 *       (and regex-searchable) inside the stored document.</li>
 *   <li><strong>Base64</strong> for certificates, which are opaque DER blobs.</li>
 * </ul>
 * Payloads written before schema version 2 stored these values as UTF-8 text;
 * {@link #fromLegacyText(String)} reads them back.
 */
public final class ByteText {

    private ByteText() {
    }

    public static String toText(byte[] bytes) {
        return bytes == null ? null : new String(bytes, StandardCharsets.ISO_8859_1);
    }

    public static byte[] fromText(String text) {
        return text == null ? null : text.getBytes(StandardCharsets.ISO_8859_1);
    }

    public static String toBase64(byte[] bytes) {
        return bytes == null ? null : Base64.getEncoder().encodeToString(bytes);
    }

    /**
     * Decodes a Base64 value.
     *
     * @param text Base64 text, may be null
     * @return the bytes, or null for null input
     * @throws IllegalArgumentException if the text is not valid Base64
     */
    public static byte[] fromBase64(String text) {
        return text == null ? null : Base64.getDecoder().decode(text);
    }

    public static byte[] fromLegacyText(String text) {
        return text == null ? null : text.getBytes(StandardCharsets.UTF_8);
    }
}
