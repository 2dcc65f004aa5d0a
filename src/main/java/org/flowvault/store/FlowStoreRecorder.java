package org.flowvault.store;

import java.util.List;

import org.flowvault.api.capture.IFlowEventListener;
import org.flowvault.api.flow.Flow;
import org.flowvault.api.store.StoreException;
import org.flowvault.api.store.UnsupportedFlowTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists every flow event the capture engine reports.
 * <p>
 * All four hooks do the same thing: each flow snapshot is written in its own transaction,
 * overwriting the chunks of the previous snapshot. A later event for a flow whose request
 * body was already stored keeps that body chunk even if the new snapshot has none.
 * <p>
 * <strong>Error Handling:</strong> flows of kinds that cannot be stored are logged at WARN
 * and dropped. A failed write aborts the event with an {@link UncheckedStoreException};
 * flows earlier in the same event stay stored.
 */
public class FlowStoreRecorder implements IFlowEventListener {

    private static final Logger log = LoggerFactory.getLogger(FlowStoreRecorder.class);

    private final FlowStore store;

    public FlowStoreRecorder(FlowStore store) {
        this.store = store;
    }

    @Override
    public void onRequest(List<? extends Flow> flows) {
        recordAll("request", flows);
    }

    @Override
    public void onResponse(List<? extends Flow> flows) {
        recordAll("response", flows);
    }

    @Override
    public void onUpdate(List<? extends Flow> flows) {
        recordAll("update", flows);
    }

    @Override
    public void onError(List<? extends Flow> flows) {
        recordAll("error", flows);
    }

    private void recordAll(String event, List<? extends Flow> flows) {
        for (Flow flow : flows) {
            try {
                store.record(flow);
            } catch (UnsupportedFlowTypeException e) {
                log.warn("Dropping {} event: {}", event, e.getMessage());
            } catch (StoreException e) {
                throw new UncheckedStoreException("Failed to record " + event + " of flow " + flow.id(), e);
            }
        }
    }
}
