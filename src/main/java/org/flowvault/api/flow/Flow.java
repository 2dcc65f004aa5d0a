package org.flowvault.api.flow;

/**
 * A flow snapshot as delivered by the capture engine.
 * <p>
 * The engine owns the flow lifecycle; this store only sees immutable snapshots of it.
 */
public interface Flow {

    /**
     * Returns the stable identifier assigned by the capture engine.
     *
     * @return the flow id, never null
     */
    String id();

    /**
     * Returns the kind of exchange this flow captured.
     *
     * @return the flow kind, never null
     */
    FlowKind kind();
}
