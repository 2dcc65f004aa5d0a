package org.flowvault.store.h2;

import java.sql.Connection;
import java.util.List;
import java.util.Map;

import org.flowvault.api.store.RawChunk;
import org.flowvault.api.store.StoreException;
import org.flowvault.filter.CompiledPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies the chunks of matching flows from one database into another.
 * <p>
 * Chunk rows are copied verbatim, including kinds this version does not know, so the target
 * holds exactly what the source holds for those flows. The target's derived rows are refreshed
 * as the chunks arrive. All writes happen in a single target transaction: the copy is applied
 * completely or not at all.
 */
public class FlowCopier {

    private static final Logger log = LoggerFactory.getLogger(FlowCopier.class);

    private FlowCopier() {
    }

    /**
     * Copies every flow of {@code source} that matches {@code predicate} into {@code target}.
     * <p>
     * Flows already in the target are overwritten chunk by chunk.
     *
     * @param source    database to read from
     * @param predicate compiled filter selecting the flows
     * @param target    database to write to; must not be the source
     * @return number of flows copied
     * @throws StoreException if reading or writing fails; the target is left unchanged
     */
    public static int copy(H2FlowDatabase source, CompiledPredicate predicate, H2FlowDatabase target)
            throws StoreException {
        if (source == target) {
            throw new IllegalArgumentException("Cannot copy a flow database into itself");
        }
        List<String> flowIds = new FlowQueryExecutor(source).selectAll(predicate);
        if (flowIds.isEmpty()) {
            log.debug("No flows match, nothing copied from '{}' to '{}'", source.getName(), target.getName());
            return 0;
        }

        int batchSize = source.getCopyBatchSize();
        int writeBatchSize = target.getWriteBatchSize();
        int copied = target.inTransaction(targetConn -> {
            int flows = 0;
            try (Connection sourceConn = source.borrowConnection()) {
                for (int from = 0; from < flowIds.size(); from += batchSize) {
                    List<String> batch = flowIds.subList(from, Math.min(from + batchSize, flowIds.size()));
                    Map<String, List<RawChunk>> rows = ChunkStore.read(sourceConn, batch);
                    for (List<RawChunk> flowRows : rows.values()) {
                        ChunkStore.upsertRaw(targetConn, flowRows, writeBatchSize);
                    }
                    DerivedSchema.refresh(targetConn, rows.keySet());
                    flows += rows.size();
                }
            }
            return flows;
        });
        log.info("Copied {} flows from '{}' to '{}'", copied, source.getName(), target.getName());
        return copied;
    }
}
