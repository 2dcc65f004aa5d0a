package org.flowvault.api.flow;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A single header field as raw bytes.
 * <p>
 * HTTP header fields are not guaranteed to be valid UTF-8, so both name and value are kept
 * as the bytes seen on the wire.
 *
 * @param name  Raw header name.
 * @param value Raw header value.
 */
public record Header(byte[] name, byte[] value) {

    /**
     * Creates a header from ASCII text, the common case in tests and fixtures.
     *
     * @param name  Header name.
     * @param value Header value.
     * @return the header
     */
    public static Header of(String name, String value) {
        return new Header(name.getBytes(StandardCharsets.ISO_8859_1), value.getBytes(StandardCharsets.ISO_8859_1));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Header other)) {
            return false;
        }
        return Arrays.equals(name, other.name) && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(name) + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return new String(name, StandardCharsets.ISO_8859_1) + ": " + new String(value, StandardCharsets.ISO_8859_1);
    }
}
