package org.flowvault.api.store;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Kinds of chunks a flow is split into.
 * <p>
 * The wire name is what gets stored in the {@code kind} column and must never change for an
 * existing constant; new kinds may be appended.
 */
public enum ChunkKind {
    HTTP_FLOW("http_flow", PayloadFormat.JSON),
    CLIENT_CONN("client_conn", PayloadFormat.JSON),
    SERVER_CONN("server_conn", PayloadFormat.JSON),
    REQUEST_CONTENT("request_content", PayloadFormat.BINARY),
    RESPONSE_CONTENT("response_content", PayloadFormat.BINARY);

    private static final Map<String, ChunkKind> BY_WIRE_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(ChunkKind::wireName, Function.identity()));

    private final String wireName;
    private final PayloadFormat format;

    ChunkKind(String wireName, PayloadFormat format) {
        this.wireName = wireName;
        this.format = format;
    }

    public String wireName() {
        return wireName;
    }

    public PayloadFormat format() {
        return format;
    }

    /**
     * Resolves a stored kind name.
     *
     * @param wireName the value of the {@code kind} column
     * @return the kind
     * @throws IllegalArgumentException if the name is not a known kind
     */
    public static ChunkKind fromWireName(String wireName) {
        ChunkKind kind = BY_WIRE_NAME.get(wireName);
        if (kind == null) {
            throw new IllegalArgumentException("Unknown chunk kind: " + wireName);
        }
        return kind;
    }
}
