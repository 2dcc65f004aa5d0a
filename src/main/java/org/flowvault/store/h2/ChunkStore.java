package org.flowvault.store.h2;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.flowvault.api.store.Chunk;
import org.flowvault.api.store.ChunkKind;
import org.flowvault.api.store.RawChunk;
import org.flowvault.api.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable storage of chunks in the permanent {@code chunk} table.
 * <p>
 * Each chunk is one row keyed by {@code (flow_id, kind)}; writing a chunk for an existing key
 * replaces its payload. Every write runs in one transaction that also refreshes the derived
 * rows of the touched flows, so readers never see chunks and derived rows out of step.
 * <p>
 * The connection-level methods ({@link #upsert}, {@link #read}) run inside a caller's
 * transaction and are shared with {@link FlowCopier}.
 */
public class ChunkStore {

    private static final Logger log = LoggerFactory.getLogger(ChunkStore.class);

    private static final String MERGE_SQL =
        "MERGE INTO chunk (flow_id, kind, payload) KEY (flow_id, kind) VALUES (?, ?, ?)";

    private static final int READ_BATCH_SIZE = 500;

    private final H2FlowDatabase database;

    public ChunkStore(H2FlowDatabase database) {
        this.database = database;
    }

    /**
     * Inserts or replaces chunks atomically.
     * <p>
     * Either all chunks are stored and all touched flows refreshed, or nothing changes.
     *
     * @param chunks chunks to store, possibly of several flows
     * @throws StoreException if the write fails; the transaction is rolled back
     */
    public void put(List<Chunk> chunks) throws StoreException {
        put(chunks, Collections.emptySet());
    }

    /**
     * Inserts or replaces chunks and deletes chunks of the given kinds, atomically.
     * <p>
     * The retracted kinds are deleted for every flow that has a chunk in {@code chunks}, so a
     * snapshot can drop a chunk that an earlier snapshot of the same flow stored.
     *
     * @param chunks         chunks to store, possibly of several flows
     * @param retractedKinds kinds to delete for the touched flows; must not overlap the kinds
     *                       being stored
     * @throws StoreException if the write fails; the transaction is rolled back
     */
    public void put(List<Chunk> chunks, Set<ChunkKind> retractedKinds) throws StoreException {
        if (chunks.isEmpty()) {
            return;
        }
        int batchSize = database.getWriteBatchSize();
        database.inTransaction(conn -> {
            Set<String> flowIds = upsert(conn, chunks, batchSize);
            if (!retractedKinds.isEmpty()) {
                retract(conn, flowIds, retractedKinds);
            }
            DerivedSchema.refresh(conn, flowIds);
            return null;
        });
        log.debug("Stored {} chunks", chunks.size());
    }

    /**
     * Deletes all chunks and derived rows of the given flows.
     *
     * @param flowIds flows to delete; unknown ids are ignored
     * @return number of chunk rows deleted
     * @throws StoreException if the delete fails; the transaction is rolled back
     */
    public int remove(Collection<String> flowIds) throws StoreException {
        if (flowIds.isEmpty()) {
            return 0;
        }
        Set<String> unique = new LinkedHashSet<>(flowIds);
        int deleted = database.inTransaction(conn -> {
            int rows = 0;
            try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM chunk WHERE flow_id = ?")) {
                for (String flowId : unique) {
                    stmt.setString(1, flowId);
                    rows += stmt.executeUpdate();
                }
            }
            DerivedSchema.refresh(conn, unique);
            return rows;
        });
        log.debug("Removed {} flows ({} chunks)", unique.size(), deleted);
        return deleted;
    }

    /**
     * Deletes every chunk and every derived row.
     *
     * @throws StoreException if the delete fails; the transaction is rolled back
     */
    public void truncate() throws StoreException {
        database.inTransaction(conn -> {
            try (Statement stmt = conn.createStatement()) {
                stmt.executeUpdate("DELETE FROM chunk");
            }
            DerivedSchema.clear(conn);
            return null;
        });
        log.debug("Truncated chunk store");
    }

    /**
     * Reads the stored chunk rows of the given flows.
     *
     * @param flowIds flows to read
     * @return rows grouped by flow id, in the order of {@code flowIds}; flows without chunks
     *         are absent
     * @throws StoreException if the read fails
     */
    public Map<String, List<RawChunk>> readChunks(Collection<String> flowIds) throws StoreException {
        if (flowIds.isEmpty()) {
            return Collections.emptyMap();
        }
        return database.withConnection(conn -> read(conn, flowIds));
    }

    /**
     * Counts the stored flows, i.e. distinct flow ids with at least one chunk.
     *
     * @return number of flows
     * @throws StoreException if the query fails
     */
    public long size() throws StoreException {
        return database.withConnection(conn -> {
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT COUNT(DISTINCT flow_id) FROM chunk")) {
                rs.next();
                return rs.getLong(1);
            }
        });
    }

    // ========================================================================
    // Connection-level operations
    // ========================================================================

    /**
     * Upserts chunks on a connection without committing.
     *
     * @param conn      connection holding an open transaction
     * @param chunks    chunks to write
     * @param batchSize rows per JDBC batch
     * @return ids of the flows touched, in first-seen order
     * @throws SQLException if a statement fails
     */
    static Set<String> upsert(Connection conn, List<Chunk> chunks, int batchSize) throws SQLException {
        List<RawChunk> rows = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            rows.add(new RawChunk(chunk.flowId(), chunk.kind().wireName(), chunk.payload()));
        }
        return upsertRaw(conn, rows, batchSize);
    }

    /**
     * Upserts raw rows as read from another store, keeping their kind names verbatim.
     */
    static Set<String> upsertRaw(Connection conn, Collection<RawChunk> rows, int batchSize) throws SQLException {
        Set<String> flowIds = new LinkedHashSet<>();
        try (PreparedStatement stmt = conn.prepareStatement(MERGE_SQL)) {
            int pending = 0;
            for (RawChunk row : rows) {
                stmt.setString(1, row.flowId());
                stmt.setString(2, row.kind());
                stmt.setBytes(3, row.payload());
                stmt.addBatch();
                flowIds.add(row.flowId());
                if (++pending == batchSize) {
                    stmt.executeBatch();
                    pending = 0;
                }
            }
            if (pending > 0) {
                stmt.executeBatch();
            }
        }
        return flowIds;
    }

    private static void retract(Connection conn, Set<String> flowIds, Set<ChunkKind> kinds) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM chunk WHERE flow_id = ? AND kind = ?")) {
            for (String flowId : flowIds) {
                for (ChunkKind kind : kinds) {
                    stmt.setString(1, flowId);
                    stmt.setString(2, kind.wireName());
                    stmt.addBatch();
                }
            }
            stmt.executeBatch();
        }
    }

    static Map<String, List<RawChunk>> read(Connection conn, Collection<String> flowIds) throws SQLException {
        Map<String, List<RawChunk>> byFlow = new LinkedHashMap<>();
        for (String flowId : flowIds) {
            byFlow.put(flowId, null);
        }
        List<String> ids = new ArrayList<>(byFlow.keySet());
        for (int from = 0; from < ids.size(); from += READ_BATCH_SIZE) {
            List<String> batch = ids.subList(from, Math.min(from + READ_BATCH_SIZE, ids.size()));
            String placeholders = String.join(", ", Collections.nCopies(batch.size(), "?"));
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT flow_id, kind, payload FROM chunk WHERE flow_id IN (" + placeholders + ")")) {
                for (int i = 0; i < batch.size(); i++) {
                    stmt.setString(i + 1, batch.get(i));
                }
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        String flowId = rs.getString(1);
                        List<RawChunk> rows = byFlow.get(flowId);
                        if (rows == null) {
                            rows = new ArrayList<>(5);
                            byFlow.put(flowId, rows);
                        }
                        rows.add(new RawChunk(flowId, rs.getString(2), rs.getBytes(3)));
                    }
                }
            }
        }
        byFlow.values().removeIf(rows -> rows == null);
        return byFlow;
    }
}
