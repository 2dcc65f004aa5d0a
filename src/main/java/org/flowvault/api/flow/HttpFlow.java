package org.flowvault.api.flow;

/**
 * A captured HTTP request/response exchange.
 * <p>
 * Instances are snapshots: the capture engine hands a new one to the store on every event,
 * and the store reconstructs them from chunks only when a page of flows is displayed.
 *
 * @param id               Stable flow id.
 * @param request          The request, never null.
 * @param response         The response, or null if none was recorded (yet).
 * @param error            Error that ended the flow, or null.
 * @param clientConnection Client-side connection.
 * @param serverConnection Server-side connection.
 * @param marked           Marker string; empty means unmarked.
 * @param comment          Free-form user comment, empty if none.
 * @param isReplay         {@code "request"} or {@code "response"} for replayed flows, otherwise null.
 * @param timestampCreated Epoch seconds when the flow was created.
 * @param live             Whether the flow is still attached to a live connection.
 */
public record HttpFlow(String id,
                       HttpRequest request,
                       HttpResponse response,
                       FlowError error,
                       ClientConnection clientConnection,
                       ServerConnection serverConnection,
                       String marked,
                       String comment,
                       String isReplay,
                       double timestampCreated,
                       boolean live) implements Flow {

    @Override
    public FlowKind kind() {
        return FlowKind.HTTP;
    }

    /**
     * Returns a copy of this flow with the given response.
     *
     * @param newResponse the response, may be null
     * @return the modified copy
     */
    public HttpFlow withResponse(HttpResponse newResponse) {
        return new HttpFlow(id, request, newResponse, error, clientConnection, serverConnection,
            marked, comment, isReplay, timestampCreated, live);
    }
}
