package org.flowvault.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.flowvault.api.flow.Flow;
import org.flowvault.api.flow.HttpFlow;
import org.flowvault.api.store.FlowDecodeException;
import org.flowvault.api.store.FlowPage;
import org.flowvault.api.store.FlowSortKey;
import org.flowvault.api.store.RawChunk;
import org.flowvault.api.store.StoreException;
import org.flowvault.api.store.UnsupportedFlowTypeException;
import org.flowvault.codec.ChunkCodec;
import org.flowvault.filter.CompiledPredicate;
import org.flowvault.filter.parser.FilterParseException;
import org.flowvault.filter.parser.FilterParser;
import org.flowvault.store.h2.ChunkStore;
import org.flowvault.store.h2.FlowCopier;
import org.flowvault.store.h2.FlowQueryExecutor;
import org.flowvault.store.h2.H2FlowDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Entry point to a flow database: records flows, answers filtered list queries, and loads
 * the flows of a visible page.
 * <p>
 * Each instance owns one {@link H2FlowDatabase}; there is no global state, so several stores
 * can be open side by side (for example a source and a target of {@link #copyTo}).
 * <p>
 * Filters are written in the flow filter language ({@code ~marked ~c 200}, ...). A null filter
 * matches every flow; empty or blank text is rejected like any malformed expression.
 */
public class FlowStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FlowStore.class);

    private final H2FlowDatabase database;
    private final ChunkStore chunks;
    private final FlowQueryExecutor executor;
    private final ChunkCodec codec;

    FlowStore(H2FlowDatabase database, ChunkCodec codec) {
        this.database = database;
        this.chunks = new ChunkStore(database);
        this.executor = new FlowQueryExecutor(database);
        this.codec = codec;
    }

    /**
     * Opens a flow store.
     *
     * @param name    store name, used for the connection pool and in log messages
     * @param options store options, i.e. the {@code flowvault.store} block
     * @return the opened store
     * @throws StoreException if the database cannot be opened
     */
    public static FlowStore open(String name, Config options) throws StoreException {
        return new FlowStore(H2FlowDatabase.open(name, options), new ChunkCodec());
    }

    /**
     * Opens a flow store named {@code flowvault}.
     *
     * @param options store options, i.e. the {@code flowvault.store} block
     * @return the opened store
     * @throws StoreException if the database cannot be opened
     */
    public static FlowStore open(Config options) throws StoreException {
        return open("flowvault", options);
    }

    // ========================================================================
    // Writes
    // ========================================================================

    /**
     * Stores the current state of a flow, replacing chunks of an earlier snapshot.
     * <p>
     * A snapshot without a response also deletes the response body an earlier snapshot
     * stored. A null body on a message that is present keeps the body stored earlier.
     *
     * @param flow the flow snapshot
     * @throws UnsupportedFlowTypeException if the flow kind cannot be stored
     * @throws StoreException               if the write fails; nothing was applied then
     */
    public void record(Flow flow) throws UnsupportedFlowTypeException, StoreException {
        chunks.put(codec.encode(flow), codec.retractedKinds(flow));
    }

    /**
     * Removes flows.
     *
     * @param flowIds ids of the flows to remove
     * @throws StoreException if the delete fails
     */
    public void remove(Collection<String> flowIds) throws StoreException {
        chunks.remove(flowIds);
    }

    /**
     * Removes all flows.
     *
     * @throws StoreException if the delete fails
     */
    public void clear() throws StoreException {
        chunks.truncate();
    }

    // ========================================================================
    // Queries
    // ========================================================================

    /**
     * Returns one page of matching flow ids and the total number of matches.
     *
     * @param filter     filter expression, or null for all flows
     * @param sortKey    sort order
     * @param descending whether to sort descending
     * @param limit      page size
     * @param offset     number of matching flows before the page
     * @return the page
     * @throws FilterParseException if the filter is malformed
     * @throws StoreException       if the query fails
     */
    public FlowPage query(String filter, FlowSortKey sortKey, boolean descending, int limit, int offset)
            throws FilterParseException, StoreException {
        CompiledPredicate predicate = compile(filter);
        List<String> ids = executor.select(predicate, sortKey, descending, limit, offset);
        long total = executor.count(predicate);
        return new FlowPage(ids, total);
    }

    /**
     * Counts matching flows.
     *
     * @param filter filter expression, or null for all flows
     * @return number of matches
     * @throws FilterParseException if the filter is malformed
     * @throws StoreException       if the query fails
     */
    public long count(String filter) throws FilterParseException, StoreException {
        return executor.count(compile(filter));
    }

    /**
     * Number of stored flows.
     *
     * @return the number of flows
     * @throws StoreException if the query fails
     */
    public long size() throws StoreException {
        return chunks.size();
    }

    /**
     * Reconstructs flows from their chunks.
     * <p>
     * Flows that are not stored are left out. Flows whose chunks fail to decode are logged
     * and left out too, so one corrupt flow does not hide the rest of a page.
     *
     * @param flowIds ids of the flows to load
     * @return the flows, in the order of {@code flowIds}
     * @throws StoreException if reading the chunks fails
     */
    public List<HttpFlow> load(Collection<String> flowIds) throws StoreException {
        Map<String, List<RawChunk>> rows = chunks.readChunks(flowIds);
        List<HttpFlow> flows = new ArrayList<>(rows.size());
        for (Map.Entry<String, List<RawChunk>> entry : rows.entrySet()) {
            try {
                flows.add(codec.decodeRows(entry.getKey(), entry.getValue()));
            } catch (FlowDecodeException e) {
                log.warn("Skipping flow '{}' that cannot be decoded: {}", entry.getKey(), e.getMessage());
            }
        }
        return flows;
    }

    /**
     * Copies all matching flows into another store.
     *
     * @param target store to copy into
     * @param filter filter expression, or null for all flows
     * @return number of flows copied
     * @throws FilterParseException if the filter is malformed
     * @throws StoreException       if the copy fails; the target is left unchanged then
     */
    public int copyTo(FlowStore target, String filter) throws FilterParseException, StoreException {
        return FlowCopier.copy(database, compile(filter), target.database);
    }

    @Override
    public void close() {
        database.close();
    }

    private static CompiledPredicate compile(String filter) throws FilterParseException {
        if (filter == null) {
            return CompiledPredicate.ALL;
        }
        return FilterParser.parse(filter).compile();
    }
}
