package org.flowvault.api.flow;

/**
 * Closed set of flow kinds a capture engine can deliver.
 * <p>
 * Only {@link #HTTP} flows have a chunk layout; every other kind is rejected by the codec
 * as an unsupported flow type.
 */
public enum FlowKind {
    HTTP,
    TCP,
    UDP,
    DNS
}
