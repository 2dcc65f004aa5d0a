package org.flowvault.api.store;

/**
 * A chunk row exactly as read from the {@code chunk} table, before its kind is resolved.
 * <p>
 * The read path hands these to the codec so that a row with an unknown kind surfaces as a
 * decode failure of that one flow instead of failing the whole read.
 *
 * @param flowId  value of the {@code flow_id} column
 * @param kind    value of the {@code kind} column
 * @param payload value of the {@code payload} column
 */
public record RawChunk(String flowId, String kind, byte[] payload) {}
