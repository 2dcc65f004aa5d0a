package org.flowvault.store.h2;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.flowvault.TestFlows;
import org.flowvault.api.store.RawChunk;
import org.flowvault.api.store.StoreException;
import org.flowvault.codec.ChunkCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Integration tests for the versioned derived schema: derived objects are rebuilt from the
 * chunk table whenever the stored version marker is missing or stale, and the chunk table
 * survives every rebuild unchanged.
 */
@Tag("integration")
class DerivedSchemaTest {

    @TempDir
    Path tempDir;

    private final ChunkCodec codec = new ChunkCodec();

    private Config options;
    private H2FlowDatabase database;

    @BeforeEach
    void setUp() throws Exception {
        String path = tempDir.resolve("flows").toAbsolutePath().toString().replace("\\", "/");
        options = ConfigFactory.parseString("jdbcUrl = \"jdbc:h2:file:" + path + "\"");
        database = H2FlowDatabase.open("test-derived", options);
    }

    @AfterEach
    void tearDown() {
        if (database != null) {
            database.close();
        }
    }

    @Test
    void open_createsDerivedObjectsAndMarker() throws Exception {
        assertThat(database.withConnection(DerivedSchema::readVersion)).isEqualTo(DerivedSchema.VERSION);
        assertThat(tables()).contains("CHUNK", "FLOW_VIEW", "FLOW_HEADER", "DERIVED_SCHEMA");
    }

    @Test
    void ensureCurrent_withCurrentMarker_doesNothing() throws Exception {
        assertThat(database.withConnection(DerivedSchema::ensureCurrent)).isFalse();
    }

    @Test
    void reopen_withStaleMarker_rebuildsAndKeepsChunks() throws Exception {
        ChunkStore store = new ChunkStore(database);
        store.put(codec.encode(TestFlows.http("f1").status(200, "OK").build()));
        store.put(codec.encode(TestFlows.http("f2").status(404, "Not Found").requestBody("q").build()));
        Map<String, List<RawChunk>> before = store.readChunks(List.of("f1", "f2"));

        execute("UPDATE derived_schema SET version = 1");
        execute("CREATE TABLE legacy_cache (id INT)");
        execute("CREATE VIEW legacy_view AS SELECT flow_id FROM chunk");
        execute("DELETE FROM flow_view");
        database.close();

        database = H2FlowDatabase.open("test-derived", options);
        store = new ChunkStore(database);

        assertThat(database.withConnection(DerivedSchema::readVersion)).isEqualTo(DerivedSchema.VERSION);
        assertThat(tables()).doesNotContain("LEGACY_CACHE", "LEGACY_VIEW");
        assertThat(countRows("flow_view")).isEqualTo(2);
        assertThat(countRows("flow_header")).isEqualTo(4);

        Map<String, List<RawChunk>> after = store.readChunks(List.of("f1", "f2"));
        assertThat(after.keySet()).isEqualTo(before.keySet());
        for (String flowId : before.keySet()) {
            assertThat(after.get(flowId))
                .usingRecursiveFieldByFieldElementComparator()
                .containsExactlyInAnyOrderElementsOf(before.get(flowId));
        }
    }

    @Test
    void reopen_withoutMarker_rebuilds() throws Exception {
        new ChunkStore(database).put(codec.encode(TestFlows.http("f1").build()));
        execute("DROP TABLE derived_schema");
        execute("DROP TABLE flow_header");
        database.close();

        database = H2FlowDatabase.open("test-derived", options);

        assertThat(database.withConnection(DerivedSchema::readVersion)).isEqualTo(DerivedSchema.VERSION);
        assertThat(countRows("flow_header")).isEqualTo(2);
    }

    @Test
    void rebuild_recreatesDroppedFunctions() throws Exception {
        execute("DROP ALIAS SEARCH");

        database.withConnection(conn -> {
            DerivedSchema.rebuild(conn);
            return null;
        });

        assertThat(queryBoolean("SELECT SEARCH('b+', 'abbc', 0)")).isTrue();
    }

    @Test
    void flowView_exposesExtractedFields() throws Exception {
        new ChunkStore(database).put(codec.encode(TestFlows.http("f1")
            .method("POST")
            .url("https", "api.example.com", 8443, "/items")
            .requestBody("12345")
            .responseBody("abc")
            .contentType("application/json")
            .clientAddress("192.168.1.5", 51000)
            .build()));

        String row = queryString("SELECT method || '|' || url || '|' || size || '|' || response_content_type"
            + " || '|' || client_address || '|' || server_address FROM flow_view");

        assertThat(row).isEqualTo("POST|https://api.example.com:8443/items|8|application/json"
            + "|192.168.1.5:51000|api.example.com:8443");
    }

    private List<String> tables() throws StoreException {
        return database.withConnection(conn -> {
            List<String> names = new ArrayList<>();
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery(
                     "SELECT TABLE_NAME FROM INFORMATION_SCHEMA.TABLES WHERE TABLE_SCHEMA = CURRENT_SCHEMA")) {
                while (rs.next()) {
                    names.add(rs.getString(1));
                }
            }
            return names;
        });
    }

    private void execute(String sql) throws StoreException {
        database.withConnection(conn -> {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(sql);
            }
            return null;
        });
    }

    private long countRows(String table) throws StoreException {
        return database.withConnection(conn -> {
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
                rs.next();
                return rs.getLong(1);
            }
        });
    }

    private String queryString(String sql) throws StoreException {
        return database.withConnection(conn -> {
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery(sql)) {
                return rs.next() ? rs.getString(1) : null;
            }
        });
    }

    private boolean queryBoolean(String sql) throws StoreException {
        return database.withConnection(conn -> {
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery(sql)) {
                rs.next();
                return rs.getBoolean(1);
            }
        });
    }
}
