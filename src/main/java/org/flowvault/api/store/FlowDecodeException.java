package org.flowvault.api.store;

/**
 * Thrown when a set of chunks cannot be reconstructed into a flow.
 * <p>
 * Typical causes are a missing {@code http_flow} chunk, an unknown chunk kind, a payload
 * from a newer schema version, or malformed JSON.
 * <p>
 * <strong>Error Handling Pattern:</strong> when rendering a page of flows, callers log the
 * failure at WARN (message only) and skip the affected flow; one corrupt flow never fails
 * the whole page.
 */
public class FlowDecodeException extends Exception {

    private final String flowId;

    public FlowDecodeException(String flowId, String message) {
        super(message);
        this.flowId = flowId;
    }

    public FlowDecodeException(String flowId, String message, Throwable cause) {
        super(message, cause);
        this.flowId = flowId;
    }

    /**
     * Returns the id of the flow that failed to decode.
     *
     * @return the flow id, or null if unknown
     */
    public String getFlowId() {
        return flowId;
    }
}
