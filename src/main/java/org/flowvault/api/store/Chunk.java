package org.flowvault.api.store;

import java.util.Arrays;
import java.util.Objects;

/**
 * One independently stored unit of a flow's persisted state.
 * <p>
 * At most one chunk exists per {@code (flowId, kind)}; writing another one replaces it.
 *
 * @param flowId  Id of the flow this chunk belongs to.
 * @param kind    What part of the flow the payload holds.
 * @param payload UTF-8 JSON for metadata kinds, raw bytes for content kinds.
 */
public record Chunk(String flowId, ChunkKind kind, byte[] payload) {

    public Chunk {
        Objects.requireNonNull(flowId, "flowId cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(payload, "payload cannot be null");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Chunk other)) {
            return false;
        }
        return flowId.equals(other.flowId) && kind == other.kind && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(flowId, kind) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Chunk[" + flowId + "/" + kind.wireName() + ", " + payload.length + " bytes]";
    }
}
