package org.flowvault.store.h2;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import org.flowvault.api.store.FlowSortKey;
import org.flowvault.api.store.StoreException;
import org.flowvault.filter.CompiledPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs compiled filters against the flow view.
 * <p>
 * The compiled fragment is embedded verbatim into the {@code WHERE} clause and its parameters
 * are bound positionally, followed by the paging parameters. Sorting always ends with
 * {@code flow_id} so that pages are stable when the sort column has ties.
 */
public class FlowQueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(FlowQueryExecutor.class);

    private final H2FlowDatabase database;

    public FlowQueryExecutor(H2FlowDatabase database) {
        this.database = database;
    }

    /**
     * Selects the ids of matching flows.
     *
     * @param predicate  compiled filter
     * @param sortKey    sort column
     * @param descending sort direction of the sort column
     * @param limit      maximum number of ids to return
     * @param offset     number of matching flows to skip
     * @return matching flow ids in sort order
     * @throws StoreException if the query fails
     */
    public List<String> select(CompiledPredicate predicate, FlowSortKey sortKey, boolean descending,
                               int limit, int offset) throws StoreException {
        if (limit < 0 || offset < 0) {
            throw new IllegalArgumentException("limit and offset must not be negative");
        }
        String direction = descending ? "DESC" : "ASC";
        String sql = "SELECT v.flow_id FROM flow_view v WHERE " + predicate.fragment()
            + " ORDER BY v." + sortKey.column() + " " + direction + " NULLS LAST, v.flow_id " + direction
            + " LIMIT ? OFFSET ?";
        log.debug("Selecting flows: {} {}", sql, predicate.params());

        return database.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                int index = bind(stmt, predicate.params());
                stmt.setInt(index++, limit);
                stmt.setInt(index, offset);
                List<String> ids = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        ids.add(rs.getString(1));
                    }
                }
                return ids;
            }
        });
    }

    /**
     * Counts matching flows.
     *
     * @param predicate compiled filter
     * @return number of matching flows
     * @throws StoreException if the query fails
     */
    public long count(CompiledPredicate predicate) throws StoreException {
        String sql = "SELECT COUNT(*) FROM flow_view v WHERE " + predicate.fragment();
        log.debug("Counting flows: {} {}", sql, predicate.params());

        return database.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                bind(stmt, predicate.params());
                try (ResultSet rs = stmt.executeQuery()) {
                    rs.next();
                    return rs.getLong(1);
                }
            }
        });
    }

    /**
     * Selects all matching ids in creation order, unpaged.
     */
    List<String> selectAll(CompiledPredicate predicate) throws StoreException {
        String sql = "SELECT v.flow_id FROM flow_view v WHERE " + predicate.fragment()
            + " ORDER BY v.timestamp_created, v.flow_id";
        return database.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                bind(stmt, predicate.params());
                List<String> ids = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        ids.add(rs.getString(1));
                    }
                }
                return ids;
            }
        });
    }

    private static int bind(PreparedStatement stmt, List<Object> params) throws SQLException {
        int index = 1;
        for (Object param : params) {
            stmt.setObject(index++, param);
        }
        return index;
    }
}
