package org.flowvault.api.store;

/**
 * Encoding of a chunk payload.
 */
public enum PayloadFormat {
    /** UTF-8 encoded JSON document. */
    JSON,
    /** Raw bytes, stored as-is. */
    BINARY
}
