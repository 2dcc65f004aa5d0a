package org.flowvault.store.h2;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns every database object derived from the {@code chunk} table.
 * <p>
 * Derived objects are the SQL function aliases backed by {@link SqlFunctions}, the
 * {@code flow_view} and {@code flow_header} tables, their indexes, and the
 * {@code derived_schema} version marker. All of them are disposable: they can be dropped at
 * any time and rebuilt from the chunks alone. Only the {@code chunk} table is permanent.
 * <p>
 * <strong>Materialization:</strong> H2 cannot index expressions, so the flow view is a real
 * table populated by extracting fields from the chunk payloads in-database. Writers keep it
 * current by calling {@link #refresh} in the same transaction that changed the chunks.
 * <p>
 * <strong>Versioning:</strong> {@link #VERSION} identifies the layout of all derived objects.
 * It must be incremented whenever a derived object changes. On open, a missing or different
 * marker triggers a full {@link #rebuild}; the marker is written last so an interrupted
 * rebuild is simply redone on the next open.
 */
public final class DerivedSchema {

    private static final Logger log = LoggerFactory.getLogger(DerivedSchema.class);

    /** Layout version of the derived objects. */
    public static final int VERSION = 3;

    static final String CHUNK_TABLE = "CHUNK";

    private static final String FUNCTIONS_CLASS = SqlFunctions.class.getName();

    private static final String[][] ALIASES = {
        {"SEARCH", "search"},
        {"SEARCH_BYTES", "searchBytes"},
        {"JSON_PATH_TEXT", "jsonPathText"},
        {"JSON_PATH_NUMBER", "jsonPathNumber"},
        {"JSON_PATH_EXISTS", "jsonPathExists"},
        {"HEADER_LINES", "headerLines"},
        {"MEDIA_TYPE", "mediaType"},
        {"ADDRESS_TEXT", "addressText"},
        {"REQUEST_URL", "requestUrl"},
    };

    private static final String CREATE_FLOW_VIEW = """
        CREATE TABLE flow_view (
          flow_id VARCHAR(255) PRIMARY KEY,
          method VARCHAR,
          scheme VARCHAR,
          host VARCHAR,
          port INT,
          path VARCHAR,
          url VARCHAR,
          status_code INT,
          reason VARCHAR,
          request_content_type VARCHAR,
          response_content_type VARCHAR,
          timestamp_created DOUBLE PRECISION,
          duration DOUBLE PRECISION,
          size BIGINT NOT NULL,
          marked VARCHAR NOT NULL,
          comment VARCHAR,
          is_replay VARCHAR,
          has_response BOOLEAN NOT NULL,
          has_error BOOLEAN NOT NULL,
          error_msg VARCHAR,
          client_address VARCHAR,
          server_address VARCHAR
        )
        """;

    private static final String CREATE_FLOW_HEADER = """
        CREATE TABLE flow_header (
          flow_id VARCHAR(255) NOT NULL,
          side VARCHAR(16) NOT NULL,
          lines VARCHAR,
          CONSTRAINT flow_header_pk PRIMARY KEY (flow_id, side)
        )
        """;

    private static final String[] CREATE_INDEXES = {
        "CREATE INDEX idx_flow_view_status ON flow_view (status_code)",
        "CREATE INDEX idx_flow_view_method ON flow_view (method)",
        "CREATE INDEX idx_flow_view_created ON flow_view (timestamp_created)",
        "CREATE INDEX idx_flow_view_size ON flow_view (size)",
        "CREATE INDEX idx_flow_header_flow ON flow_header (flow_id)",
    };

    private static final String SELECT_FLOW_VIEW_ROWS = """
        INSERT INTO flow_view (flow_id, method, scheme, host, port, path, url, status_code, reason,
          request_content_type, response_content_type, timestamp_created, duration, size, marked,
          comment, is_replay, has_response, has_error, error_msg, client_address, server_address)
        SELECT f.flow_id,
          JSON_PATH_TEXT(f.payload, 'request.method'),
          JSON_PATH_TEXT(f.payload, 'request.scheme'),
          JSON_PATH_TEXT(f.payload, 'request.host'),
          CAST(JSON_PATH_NUMBER(f.payload, 'request.port') AS INT),
          JSON_PATH_TEXT(f.payload, 'request.path'),
          REQUEST_URL(f.payload),
          CAST(JSON_PATH_NUMBER(f.payload, 'response.status_code') AS INT),
          JSON_PATH_TEXT(f.payload, 'response.reason'),
          MEDIA_TYPE(f.payload, 'request.headers'),
          MEDIA_TYPE(f.payload, 'response.headers'),
          JSON_PATH_NUMBER(f.payload, 'timestamp_created'),
          JSON_PATH_NUMBER(f.payload, 'response.timestamp_end') - JSON_PATH_NUMBER(f.payload, 'request.timestamp_start'),
          COALESCE((SELECT SUM(OCTET_LENGTH(b.payload)) FROM chunk b
                    WHERE b.flow_id = f.flow_id AND b.kind IN ('request_content', 'response_content')), 0),
          COALESCE(JSON_PATH_TEXT(f.payload, 'marked'), ''),
          JSON_PATH_TEXT(f.payload, 'comment'),
          JSON_PATH_TEXT(f.payload, 'is_replay'),
          JSON_PATH_EXISTS(f.payload, 'response'),
          JSON_PATH_EXISTS(f.payload, 'error'),
          JSON_PATH_TEXT(f.payload, 'error.msg'),
          (SELECT ADDRESS_TEXT(cc.payload, 'peername') FROM chunk cc
            WHERE cc.flow_id = f.flow_id AND cc.kind = 'client_conn'),
          (SELECT ADDRESS_TEXT(sc.payload, 'address') FROM chunk sc
            WHERE sc.flow_id = f.flow_id AND sc.kind = 'server_conn')
        FROM chunk f
        WHERE f.kind = 'http_flow'
        """;

    private static final String SELECT_FLOW_HEADER_ROWS = """
        INSERT INTO flow_header (flow_id, side, lines)
        SELECT f.flow_id, 'request', HEADER_LINES(f.payload, 'request.headers')
        FROM chunk f
        WHERE f.kind = 'http_flow'%1$s
        UNION ALL
        SELECT f.flow_id, 'response', HEADER_LINES(f.payload, 'response.headers')
        FROM chunk f
        WHERE f.kind = 'http_flow' AND JSON_PATH_EXISTS(f.payload, 'response')%1$s
        """;

    private static final String POPULATE_FLOW_VIEW = SELECT_FLOW_VIEW_ROWS;
    private static final String REFRESH_FLOW_VIEW = SELECT_FLOW_VIEW_ROWS + " AND f.flow_id = ?";
    private static final String POPULATE_FLOW_HEADER = String.format(SELECT_FLOW_HEADER_ROWS, "");
    private static final String REFRESH_FLOW_HEADER = String.format(SELECT_FLOW_HEADER_ROWS, " AND f.flow_id = ?");

    private DerivedSchema() {
    }

    /**
     * Rebuilds all derived objects unless the stored marker matches {@link #VERSION}.
     *
     * @param conn connection in auto-commit mode (H2 commits DDL implicitly)
     * @return true if a rebuild was performed
     * @throws SQLException if reading the marker or rebuilding fails
     */
    public static boolean ensureCurrent(Connection conn) throws SQLException {
        Integer stored = readVersion(conn);
        if (stored != null && stored == VERSION) {
            log.debug("Derived schema is current (version {})", VERSION);
            return false;
        }
        if (stored == null) {
            log.debug("No derived schema marker found, building derived objects");
        } else {
            log.info("Derived schema version {} differs from expected {}, rebuilding", stored, VERSION);
        }
        rebuild(conn);
        return true;
    }

    /**
     * Reads the stored derived schema version.
     *
     * @param conn an open connection
     * @return the version, or null if no marker exists
     * @throws SQLException if the query fails
     */
    public static Integer readVersion(Connection conn) throws SQLException {
        if (!tableExists(conn, "DERIVED_SCHEMA")) {
            return null;
        }
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT MAX(version) FROM derived_schema")) {
            if (rs.next()) {
                int version = rs.getInt(1);
                return rs.wasNull() ? null : version;
            }
            return null;
        }
    }

    /**
     * Drops every derived object and recreates and repopulates them from the chunks.
     * <p>
     * Drops all views, all tables other than {@code chunk} and all function aliases of the
     * current schema, so objects left behind by older layouts disappear as well.
     *
     * @param conn connection in auto-commit mode
     * @throws SQLException if any DDL or population statement fails
     */
    public static void rebuild(Connection conn) throws SQLException {
        long start = System.currentTimeMillis();
        dropDerivedObjects(conn);

        try (Statement stmt = conn.createStatement()) {
            for (String[] alias : ALIASES) {
                stmt.execute("CREATE ALIAS " + alias[0] + " DETERMINISTIC FOR '"
                    + FUNCTIONS_CLASS + "." + alias[1] + "'");
            }
            stmt.execute(CREATE_FLOW_VIEW);
            stmt.execute(CREATE_FLOW_HEADER);
            for (String index : CREATE_INDEXES) {
                stmt.execute(index);
            }

            int flows = stmt.executeUpdate(POPULATE_FLOW_VIEW);
            stmt.executeUpdate(POPULATE_FLOW_HEADER);

            // Marker last: a rebuild interrupted before this point is redone on next open.
            stmt.execute("CREATE TABLE derived_schema (version INT NOT NULL)");
            stmt.executeUpdate("INSERT INTO derived_schema (version) VALUES (" + VERSION + ")");

            log.info("Rebuilt derived schema version {} with {} flows in {} ms",
                VERSION, flows, System.currentTimeMillis() - start);
        }
    }

    /**
     * Recomputes the derived rows of the given flows from their current chunks.
     * <p>
     * Flows without an {@code http_flow} chunk end up with no derived rows, so this also
     * serves removal. Runs inside the caller's transaction.
     *
     * @param conn    connection holding the caller's open transaction
     * @param flowIds flows whose chunks changed
     * @throws SQLException if a statement fails
     */
    public static void refresh(Connection conn, Collection<String> flowIds) throws SQLException {
        if (flowIds.isEmpty()) {
            return;
        }
        try (PreparedStatement deleteView = conn.prepareStatement("DELETE FROM flow_view WHERE flow_id = ?");
             PreparedStatement deleteHeader = conn.prepareStatement("DELETE FROM flow_header WHERE flow_id = ?");
             PreparedStatement insertView = conn.prepareStatement(REFRESH_FLOW_VIEW);
             PreparedStatement insertHeader = conn.prepareStatement(REFRESH_FLOW_HEADER)) {
            for (String flowId : flowIds) {
                deleteView.setString(1, flowId);
                deleteView.addBatch();
                deleteHeader.setString(1, flowId);
                deleteHeader.addBatch();
                insertView.setString(1, flowId);
                insertView.addBatch();
                insertHeader.setString(1, flowId);
                insertHeader.setString(2, flowId);
                insertHeader.addBatch();
            }
            deleteView.executeBatch();
            deleteHeader.executeBatch();
            insertView.executeBatch();
            insertHeader.executeBatch();
        }
    }

    /**
     * Deletes all derived rows, keeping the derived objects themselves.
     *
     * @param conn connection holding the caller's open transaction
     * @throws SQLException if a statement fails
     */
    public static void clear(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("DELETE FROM flow_header");
            stmt.executeUpdate("DELETE FROM flow_view");
        }
    }

    // ========================================================================
    // Catalog helpers
    // ========================================================================

    private static void dropDerivedObjects(Connection conn) throws SQLException {
        List<String> views = listTables(conn, "VIEW");
        List<String> tables = listTables(conn, "BASE TABLE");
        List<String> routines = listRoutines(conn);

        try (Statement stmt = conn.createStatement()) {
            for (String view : views) {
                stmt.execute("DROP VIEW IF EXISTS " + quote(view) + " CASCADE");
                log.debug("Dropped derived view {}", view);
            }
            for (String table : tables) {
                if (CHUNK_TABLE.equals(table)) {
                    continue;
                }
                stmt.execute("DROP TABLE IF EXISTS " + quote(table) + " CASCADE");
                log.debug("Dropped derived table {}", table);
            }
            for (String routine : routines) {
                stmt.execute("DROP ALIAS IF EXISTS " + quote(routine));
                log.debug("Dropped function alias {}", routine);
            }
        }
    }

    private static boolean tableExists(Connection conn, String table) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT COUNT(*) FROM INFORMATION_SCHEMA.TABLES "
                    + "WHERE TABLE_SCHEMA = CURRENT_SCHEMA AND TABLE_NAME = ?")) {
            stmt.setString(1, table);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() && rs.getInt(1) > 0;
            }
        }
    }

    private static List<String> listTables(Connection conn, String tableType) throws SQLException {
        List<String> names = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT TABLE_NAME FROM INFORMATION_SCHEMA.TABLES "
                    + "WHERE TABLE_SCHEMA = CURRENT_SCHEMA AND TABLE_TYPE = ?")) {
            stmt.setString(1, tableType);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    names.add(rs.getString(1));
                }
            }
        }
        return names;
    }

    private static List<String> listRoutines(Connection conn) throws SQLException {
        List<String> names = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                 "SELECT DISTINCT ROUTINE_NAME FROM INFORMATION_SCHEMA.ROUTINES "
                     + "WHERE ROUTINE_SCHEMA = CURRENT_SCHEMA")) {
            while (rs.next()) {
                names.add(rs.getString(1));
            }
        }
        return names;
    }

    private static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
