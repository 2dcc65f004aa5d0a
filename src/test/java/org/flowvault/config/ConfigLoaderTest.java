package org.flowvault.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Unit tests for {@link ConfigLoader}: reference defaults, file overrides and system property
 * overrides.
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("flowvault.store.copyBatchSize");
        System.clearProperty("flowvault.store.writeBatchSize");
        ConfigFactory.invalidateCaches();
    }

    @Test
    void loadDefaults_providesStoreDefaults() {
        Config store = ConfigLoader.storeOptions(ConfigLoader.loadDefaults());

        assertThat(store.getString("jdbcUrl")).isEqualTo("jdbc:h2:./data/flowvault");
        assertThat(store.getInt("maxPoolSize")).isEqualTo(1);
        assertThat(store.getInt("writeBatchSize")).isEqualTo(500);
        assertThat(store.getInt("copyBatchSize")).isEqualTo(200);
        assertThat(store.getLong("patternCacheSize")).isEqualTo(256);
    }

    @Test
    void loadFromFile_overridesDefaultsAndKeepsTheRest() throws Exception {
        Config store = ConfigLoader.storeOptions(ConfigLoader.loadFromFile(testResource("test-flowvault.conf")));

        assertThat(store.getString("jdbcUrl")).isEqualTo("jdbc:h2:mem:from-file");
        assertThat(store.getInt("writeBatchSize")).isEqualTo(50);
        assertThat(store.getInt("copyBatchSize")).isEqualTo(200);
    }

    @Test
    void loadFromFile_systemPropertyWins() throws Exception {
        System.setProperty("flowvault.store.writeBatchSize", "7");
        ConfigFactory.invalidateCaches();

        Config store = ConfigLoader.storeOptions(ConfigLoader.loadFromFile(testResource("test-flowvault.conf")));

        assertThat(store.getInt("writeBatchSize")).isEqualTo(7);
    }

    @Test
    void resolve_explicitFile_isUsed() throws Exception {
        Config store = ConfigLoader.storeOptions(ConfigLoader.resolve(testResource("test-flowvault.conf")));

        assertThat(store.getString("jdbcUrl")).isEqualTo("jdbc:h2:mem:from-file");
    }

    @Test
    void resolve_missingExplicitFile_throws(@TempDir File tempDir) {
        File missing = new File(tempDir, "absent.conf");

        assertThatThrownBy(() -> ConfigLoader.resolve(missing))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("absent.conf");
    }

    private static File testResource(String name) throws URISyntaxException {
        URL url = ConfigLoaderTest.class.getClassLoader().getResource(name);
        assertThat(url).as("test resource %s", name).isNotNull();
        return new File(url.toURI());
    }
}
