package org.flowvault.store.h2;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.flowvault.TestFlows;
import org.flowvault.api.flow.HttpFlow;
import org.flowvault.api.store.FlowSortKey;
import org.flowvault.api.store.RawChunk;
import org.flowvault.api.store.StoreException;
import org.flowvault.codec.ChunkCodec;
import org.flowvault.filter.CompiledPredicate;
import org.flowvault.filter.parser.FilterParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Integration tests for {@link FlowCopier} between two in-memory databases.
 */
@Tag("integration")
class FlowCopierTest {

    private final ChunkCodec codec = new ChunkCodec();

    private H2FlowDatabase source;
    private H2FlowDatabase target;

    @BeforeEach
    void setUp() throws Exception {
        source = H2FlowDatabase.open("copy-source", memoryOptions("copy-source"));
        target = H2FlowDatabase.open("copy-target", memoryOptions("copy-target"));
    }

    @AfterEach
    void tearDown() {
        if (source != null) {
            source.close();
        }
        if (target != null) {
            target.close();
        }
    }

    @Test
    void copy_withFilter_copiesOnlyMatchingFlows() throws Exception {
        put(source, TestFlows.http("f1").marked("x").build());
        put(source, TestFlows.http("f2").build());
        put(source, TestFlows.http("f3").marked("y").build());

        int copied = FlowCopier.copy(source, predicate("~marked"), target);

        assertThat(copied).isEqualTo(2);
        assertThat(new ChunkStore(target).size()).isEqualTo(2);
        assertThat(new FlowQueryExecutor(target).select(CompiledPredicate.ALL, FlowSortKey.CREATED, false, 10, 0))
            .containsExactlyInAnyOrder("f1", "f3");
    }

    @Test
    void copy_copiesChunkRowsVerbatimAndAcrossBatches() throws Exception {
        for (int i = 1; i <= 5; i++) {
            put(source, TestFlows.http("f" + i).build());
        }
        source.inTransaction(conn -> ChunkStore.upsertRaw(conn,
            List.of(new RawChunk("f2", "websocket_messages", "[]".getBytes(StandardCharsets.UTF_8))), 10));

        int copied = FlowCopier.copy(source, CompiledPredicate.ALL, target);

        List<String> ids = List.of("f1", "f2", "f3", "f4", "f5");
        Map<String, List<RawChunk>> expected = new ChunkStore(source).readChunks(ids);
        Map<String, List<RawChunk>> actual = new ChunkStore(target).readChunks(ids);
        assertThat(copied).isEqualTo(5);
        assertThat(actual.keySet()).containsExactlyElementsOf(ids);
        for (String id : ids) {
            assertThat(actual.get(id))
                .usingRecursiveFieldByFieldElementComparator()
                .containsExactlyInAnyOrderElementsOf(expected.get(id));
        }
        assertThat(new FlowQueryExecutor(target).count(CompiledPredicate.ALL)).isEqualTo(5);
    }

    @Test
    void copy_overwritesFlowsAlreadyInTarget() throws Exception {
        put(target, TestFlows.http("f1").status(500, "Internal Server Error").build());
        put(source, TestFlows.http("f1").status(204, "No Content").build());

        FlowCopier.copy(source, CompiledPredicate.ALL, target);

        assertThat(new FlowQueryExecutor(target).count(predicate("~c 204"))).isEqualTo(1);
        assertThat(new FlowQueryExecutor(target).count(predicate("~c 500"))).isZero();
    }

    @Test
    void copy_failureLeavesTargetUnchanged() throws Exception {
        put(target, TestFlows.http("f1").comment("original").build());
        for (int i = 1; i <= 4; i++) {
            put(source, TestFlows.http("f" + i).comment("copied").build());
        }
        target.inTransaction(conn -> {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("ALTER TABLE chunk ADD CONSTRAINT no_f3 CHECK (flow_id <> 'f3')");
            }
            return null;
        });

        assertThatThrownBy(() -> FlowCopier.copy(source, CompiledPredicate.ALL, target))
            .isInstanceOf(StoreException.class);

        assertThat(new ChunkStore(target).size()).isEqualTo(1);
        assertThat(new FlowQueryExecutor(target).count(predicate("~comment original"))).isEqualTo(1);
        assertThat(new FlowQueryExecutor(target).count(predicate("~comment copied"))).isZero();
    }

    @Test
    void copy_noMatches_returnsZero() throws Exception {
        put(source, TestFlows.http("f1").build());

        assertThat(FlowCopier.copy(source, predicate("~e"), target)).isZero();
        assertThat(new ChunkStore(target).size()).isZero();
    }

    @Test
    void copy_intoItself_throws() {
        assertThatThrownBy(() -> FlowCopier.copy(source, CompiledPredicate.ALL, source))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private void put(H2FlowDatabase database, HttpFlow flow) throws Exception {
        new ChunkStore(database).put(codec.encode(flow));
    }

    private static CompiledPredicate predicate(String filter) throws Exception {
        return FilterParser.parse(filter).compile();
    }

    private static Config memoryOptions(String name) {
        return ConfigFactory.parseString(
            "jdbcUrl = \"jdbc:h2:mem:" + name + "-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1\"\n"
                + "copyBatchSize = 2\n"
                + "writeBatchSize = 3");
    }
}
