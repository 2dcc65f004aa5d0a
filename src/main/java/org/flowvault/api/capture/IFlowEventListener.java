package org.flowvault.api.capture;

import java.util.List;

import org.flowvault.api.flow.Flow;

/**
 * Event hooks a capture engine invokes as flows progress.
 * <p>
 * The engine delivers events for a given flow serially. Each hook carries one or more flow
 * snapshots; a listener must not keep references to them beyond the call.
 */
public interface IFlowEventListener {

    /**
     * Called when the request headers (and possibly body) of new flows have been read.
     *
     * @param flows snapshots of the new flows
     */
    void onRequest(List<? extends Flow> flows);

    /**
     * Called when a response has been received.
     *
     * @param flows snapshots of the flows that received a response
     */
    void onResponse(List<? extends Flow> flows);

    /**
     * Called when flows were modified outside the request/response cycle (marked,
     * commented, edited, replayed).
     *
     * @param flows snapshots of the modified flows
     */
    void onUpdate(List<? extends Flow> flows);

    /**
     * Called when flows ended with an error.
     *
     * @param flows snapshots of the failed flows
     */
    void onError(List<? extends Flow> flows);
}
