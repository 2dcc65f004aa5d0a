package org.flowvault.store.h2;

import java.io.File;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import org.flowvault.api.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Embedded H2 database holding the chunk table and its derived objects, accessed through a
 * HikariCP connection pool.
 * <p>
 * Opening the database creates the {@code chunk} table if needed and brings the derived
 * objects up to date via {@link DerivedSchema#ensureCurrent}. All other access goes through
 * {@link #inTransaction} or {@link #withConnection}.
 * <p>
 * <strong>Configuration</strong> (all optional except {@code jdbcUrl}):
 * <ul>
 *   <li>{@code jdbcUrl}: H2 JDBC URL, e.g. {@code jdbc:h2:./data/flows} or {@code jdbc:h2:mem:flows}</li>
 *   <li>{@code username} / {@code password}: default {@code sa} / empty</li>
 *   <li>{@code maxPoolSize} / {@code minIdle}: default 1 / 1</li>
 *   <li>{@code connectionTimeoutMs}: default 30000</li>
 *   <li>{@code writeBatchSize}: rows per JDBC batch on write, default 500</li>
 *   <li>{@code copyBatchSize}: flows per read batch during copy, default 200</li>
 *   <li>{@code patternCacheSize}: compiled regexes kept by {@link SqlFunctions}, default 256.
 *       The cache is shared by every database in the JVM, so the value of the most recently
 *       opened database applies to all of them.</li>
 * </ul>
 */
public class H2FlowDatabase implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(H2FlowDatabase.class);

    private static final String CREATE_CHUNK_TABLE = """
        CREATE TABLE IF NOT EXISTS chunk (
          flow_id VARCHAR(255) NOT NULL,
          kind VARCHAR(64) NOT NULL,
          payload VARBINARY NOT NULL,
          CONSTRAINT chunk_pk PRIMARY KEY (flow_id, kind)
        )
        """;

    /** H2 error code: database is already closed. */
    private static final int DATABASE_CALLED_AT_SHUTDOWN = 90121;

    private final String name;
    private final HikariDataSource dataSource;
    private final int writeBatchSize;
    private final int copyBatchSize;

    private H2FlowDatabase(String name, HikariDataSource dataSource, Config options) {
        this.name = name;
        this.dataSource = dataSource;
        this.writeBatchSize = options.hasPath("writeBatchSize") ? options.getInt("writeBatchSize") : 500;
        this.copyBatchSize = options.hasPath("copyBatchSize") ? options.getInt("copyBatchSize") : 200;
        if (writeBatchSize <= 0 || copyBatchSize <= 0) {
            throw new IllegalArgumentException("writeBatchSize and copyBatchSize must be positive");
        }
    }

    /**
     * Opens the database, creating the chunk table and rebuilding derived objects as needed.
     *
     * @param name    name of the database, used as pool name and in log messages
     * @param options store options (see class documentation)
     * @return the opened database
     * @throws StoreException if the pool cannot be started or the schema cannot be prepared
     */
    public static H2FlowDatabase open(String name, Config options) throws StoreException {
        if (!options.hasPath("jdbcUrl")) {
            throw new IllegalArgumentException("'jdbcUrl' must be configured for flow database '" + name + "'");
        }
        final String jdbcUrl = options.getString("jdbcUrl");
        final String username = options.hasPath("username") ? options.getString("username") : "sa";
        final String password = options.hasPath("password") ? options.getString("password") : "";

        if (options.hasPath("patternCacheSize")) {
            SqlFunctions.setPatternCacheSize(options.getLong("patternCacheSize"));
        }

        ensureParentDirectory(name, jdbcUrl);

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setDriverClassName("org.h2.Driver");
        hikariConfig.setMaximumPoolSize(options.hasPath("maxPoolSize") ? options.getInt("maxPoolSize") : 1);
        hikariConfig.setMinimumIdle(options.hasPath("minIdle") ? options.getInt("minIdle") : 1);
        hikariConfig.setConnectionTimeout(
            options.hasPath("connectionTimeoutMs") ? options.getLong("connectionTimeoutMs") : 30_000L);
        hikariConfig.setUsername(username);
        hikariConfig.setPassword(password);
        hikariConfig.setPoolName(name);

        HikariDataSource dataSource;
        try {
            dataSource = new HikariDataSource(hikariConfig);
            log.debug("H2 flow database '{}' connection pool started (max={}, minIdle={})",
                name, hikariConfig.getMaximumPoolSize(), hikariConfig.getMinimumIdle());
        } catch (RuntimeException e) {
            Throwable cause = e;
            while (cause.getCause() != null && cause.getCause() != cause) {
                cause = cause.getCause();
            }
            String causeMsg = cause.getMessage() != null ? cause.getMessage() : "";
            if (causeMsg.contains("already in use") || causeMsg.contains("file is locked")) {
                throw new StoreException(String.format(
                    "Cannot open flow database '%s': file already in use by another process (%s)",
                    name, jdbcUrl), e);
            }
            throw new StoreException("Cannot open flow database '" + name + "': " + causeMsg, e);
        }

        H2FlowDatabase database = new H2FlowDatabase(name, dataSource, options);
        try (Connection conn = dataSource.getConnection()) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(CREATE_CHUNK_TABLE);
            }
            DerivedSchema.ensureCurrent(conn);
        } catch (SQLException e) {
            database.close();
            throw new StoreException("Failed to prepare schema of flow database '" + name + "'", e);
        }
        log.debug("H2 flow database '{}' opened", name);
        return database;
    }

    /**
     * Runs work in a single transaction, committing on success and rolling back on failure.
     *
     * @param work the work to run
     * @param <T>  result type
     * @return the work's result
     * @throws StoreException if the work or the commit fails; nothing has been applied then
     */
    public <T> T inTransaction(SqlWork<T> work) throws StoreException {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                // Rollback to keep connection clean for pool reuse
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    log.warn("Rollback failed (connection may be closed): {}", rollbackEx.getMessage());
                }
                throw e;
            } finally {
                try {
                    conn.setAutoCommit(true);
                } catch (SQLException resetEx) {
                    log.warn("Restoring auto-commit failed (connection may be closed): {}", resetEx.getMessage());
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Transaction on flow database '" + name + "' failed: " + e.getMessage(), e);
        }
    }

    /**
     * Runs read-only work on a pooled connection in auto-commit mode.
     *
     * @param work the work to run
     * @param <T>  result type
     * @return the work's result
     * @throws StoreException if the work fails
     */
    public <T> T withConnection(SqlWork<T> work) throws StoreException {
        try (Connection conn = dataSource.getConnection()) {
            return work.execute(conn);
        } catch (SQLException e) {
            throw new StoreException("Query on flow database '" + name + "' failed: " + e.getMessage(), e);
        }
    }

    /**
     * Borrows a raw pooled connection; the caller must close it.
     */
    Connection borrowConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public String getName() {
        return name;
    }

    public int getWriteBatchSize() {
        return writeBatchSize;
    }

    public int getCopyBatchSize() {
        return copyBatchSize;
    }

    /**
     * Shuts the database down and closes the pool.
     * <p>
     * A SQL {@code SHUTDOWN} runs first so that H2 flushes all pages to disk; closing the pool
     * alone only releases connections.
     */
    @Override
    public void close() {
        if (dataSource.isClosed()) {
            return;
        }
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute("SHUTDOWN");
            log.debug("H2 flow database '{}' shutdown command executed", name);
        } catch (SQLException e) {
            if (e.getErrorCode() == DATABASE_CALLED_AT_SHUTDOWN) {
                log.debug("H2 flow database '{}' already closed", name);
            } else {
                log.warn("H2 flow database '{}' shutdown command failed: {}", name, e.getMessage());
            }
        }
        dataSource.close();
        log.debug("H2 flow database '{}' connection pool closed", name);
    }

    /**
     * Creates the directory of a file-based database so that H2 fails with a clear error
     * instead of a stack trace when the location is unusable.
     */
    private static void ensureParentDirectory(String name, String jdbcUrl) throws StoreException {
        if (!jdbcUrl.startsWith("jdbc:h2:")) {
            return;
        }
        String dbPath = jdbcUrl.substring("jdbc:h2:".length());
        if (dbPath.startsWith("mem:") || dbPath.startsWith("tcp:") || dbPath.startsWith("ssl:")
                || dbPath.startsWith("~")) {
            return;
        }
        if (dbPath.startsWith("file:")) {
            dbPath = dbPath.substring("file:".length());
        }
        int semicolon = dbPath.indexOf(';');
        if (semicolon > 0) {
            dbPath = dbPath.substring(0, semicolon);
        }
        File parentDir = new File(dbPath).getAbsoluteFile().getParentFile();
        if (parentDir != null && !parentDir.exists() && !parentDir.mkdirs()) {
            throw new StoreException(String.format(
                "Cannot create flow database '%s': failed to create directory %s",
                name, parentDir.getAbsolutePath()));
        }
    }
}
