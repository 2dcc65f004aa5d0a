package org.flowvault.api.store;

import org.flowvault.api.flow.FlowKind;

/**
 * Thrown when a flow of a kind without a chunk layout is offered for storage.
 * <p>
 * This is not a failure of the capture pipeline: the recorder logs it and drops the event.
 */
public class UnsupportedFlowTypeException extends Exception {

    private final FlowKind kind;

    public UnsupportedFlowTypeException(String flowId, FlowKind kind) {
        super("Cannot store flow " + flowId + " of kind " + kind);
        this.kind = kind;
    }

    public FlowKind getKind() {
        return kind;
    }
}
