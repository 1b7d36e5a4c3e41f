package contimg.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import contimg.coordinator.config.PipelineConfig;
import org.h2.api.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Durable store on an embedded H2 database.
 * Uses HikariCP for connection pooling; every transaction runs on one pooled connection
 * with auto-commit disabled. H2's write delay is switched off at startup so a commit has
 * reached the database file when {@link #transact} returns.
 */
public final class JdbcDurableStore implements DurableStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcDurableStore.class);

    private static final String COLUMNS = "record_key, payload, version, updated_at";

    private final HikariDataSource dataSource;
    private final Clock clock;
    private final boolean h2;

    public JdbcDurableStore(PipelineConfig config, Clock clock) {
        this(config.storeUrl(), config.storePoolSize(), config.storeWaitTimeout(), clock);
    }

    public JdbcDurableStore(String jdbcUrl, int poolSize, Duration waitTimeout, Clock clock) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(Math.max(250, waitTimeout.toMillis()));
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("contimg-store-pool");
        hikariConfig.setAutoCommit(false);

        // Bounded row-lock wait
        if (jdbcUrl.contains("h2:")) {
            hikariConfig.setConnectionInitSql("SET LOCK_TIMEOUT " + waitTimeout.toMillis());
        }

        this.dataSource = new HikariDataSource(hikariConfig);
        this.clock = clock;
        this.h2 = jdbcUrl.contains("h2:");

        log.info("Durable store pool initialized: {}", jdbcUrl);

        initSchema();
    }

    @Override
    public long put(String key, String payload, long expectedVersion) {
        return transact(tx -> tx.put(key, payload, expectedVersion));
    }

    @Override
    public Optional<StoredRecord> get(String key) {
        try (Connection conn = dataSource.getConnection()) {
            try {
                return selectOne(conn, key, false);
            } finally {
                conn.rollback();
            }
        } catch (SQLException e) {
            throw translate("Failed to read " + key, e);
        }
    }

    @Override
    public List<StoredRecord> scan(String prefix) {
        try (Connection conn = dataSource.getConnection()) {
            try {
                return selectPrefix(conn, prefix);
            } finally {
                conn.rollback();
            }
        } catch (SQLException e) {
            throw translate("Failed to scan " + prefix, e);
        }
    }

    @Override
    public List<StoredRecord> scan(String prefix, String fromKey) {
        try (Connection conn = dataSource.getConnection()) {
            try {
                return selectRange(conn, prefix, fromKey);
            } finally {
                conn.rollback();
            }
        } catch (SQLException e) {
            throw translate("Failed to scan " + prefix + " from " + fromKey, e);
        }
    }

    @Override
    public <T> T transact(StoreWork<T> work) {
        JdbcTransaction tx;
        T result;
        try (Connection conn = dataSource.getConnection()) {
            tx = new JdbcTransaction(conn);
            try {
                result = work.execute(tx);
                conn.commit();
            } catch (RuntimeException e) {
                rollbackQuietly(conn, e);
                throw e;
            } catch (SQLException e) {
                rollbackQuietly(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw translate("Transaction failed", e);
        }

        for (Runnable action : tx.afterCommit) {
            try {
                action.run();
            } catch (RuntimeException e) {
                log.error("After-commit action failed", e);
            }
        }
        return result;
    }

    @Override
    public boolean isHealthy() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Store health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Durable store pool closed");
        }
    }

    private void initSchema() {
        try (Connection conn = dataSource.getConnection();
                Statement st = conn.createStatement()) {

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS store_records (
                            record_key      VARCHAR(512) PRIMARY KEY,
                            namespace       VARCHAR(32) NOT NULL,
                            payload         CLOB NOT NULL,
                            version         BIGINT NOT NULL,
                            updated_at      TIMESTAMP NOT NULL
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS store_locks (
                            scope           VARCHAR(128) PRIMARY KEY
                        );
                    """);

            st.addBatch("CREATE INDEX IF NOT EXISTS idx_store_records_namespace ON store_records(namespace);");

            // Persistent database setting, flush on every commit
            if (h2) {
                st.addBatch("SET WRITE_DELAY 0");
            }

            st.executeBatch();
            conn.commit();

            log.info("Store schema initialized");
        } catch (SQLException e) {
            throw translate("Failed to initialize store schema", e);
        }
    }

    private Optional<StoredRecord> selectOne(Connection conn, String key, boolean forUpdate) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM store_records WHERE record_key = ?"
                + (forUpdate ? " FOR UPDATE" : "");
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        }
        return Optional.empty();
    }

    private List<StoredRecord> selectPrefix(Connection conn, String prefix) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM store_records WHERE record_key LIKE ? ESCAPE '\\' ORDER BY record_key";
        List<StoredRecord> records = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, escapeLike(prefix) + "%");
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(mapRow(rs));
                }
            }
        }
        return records;
    }

    private List<StoredRecord> selectRange(Connection conn, String prefix, String fromKey) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM store_records WHERE record_key LIKE ? ESCAPE '\\'"
                + " AND record_key >= ? ORDER BY record_key";
        List<StoredRecord> records = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, escapeLike(prefix) + "%");
            ps.setString(2, fromKey);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(mapRow(rs));
                }
            }
        }
        return records;
    }

    private StoredRecord mapRow(ResultSet rs) throws SQLException {
        return new StoredRecord(
                rs.getString("record_key"),
                rs.getString("payload"),
                rs.getLong("version"),
                rs.getTimestamp("updated_at").toInstant());
    }

    static String namespaceOf(String key) {
        int slash = key.indexOf('/');
        return slash > 0 ? key.substring(0, slash) : key;
    }

    private static String escapeLike(String prefix) {
        return prefix.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static void rollbackQuietly(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    static StoreException translate(String message, SQLException e) {
        if (isTransient(e)) {
            return new StoreUnavailableException(message + ": " + e.getMessage(), e);
        }
        return new StoreException(message, e);
    }

    private static boolean isTransient(SQLException e) {
        if (e instanceof SQLTransientException) {
            return true;
        }
        int code = e.getErrorCode();
        return code == ErrorCode.LOCK_TIMEOUT_1
                || code == ErrorCode.DEADLOCK_1
                || code == ErrorCode.DATABASE_ALREADY_OPEN_1;
    }

    /**
     * Transaction bound to one connection.
     */
    private final class JdbcTransaction implements StoreTransaction {

        private final Connection conn;
        private final List<Runnable> afterCommit = new ArrayList<>();

        private JdbcTransaction(Connection conn) {
            this.conn = conn;
        }

        @Override
        public Optional<StoredRecord> get(String key) {
            try {
                return selectOne(conn, key, false);
            } catch (SQLException e) {
                throw translate("Failed to read " + key, e);
            }
        }

        @Override
        public Optional<StoredRecord> getForUpdate(String key) {
            try {
                return selectOne(conn, key, true);
            } catch (SQLException e) {
                throw translate("Failed to lock " + key, e);
            }
        }

        @Override
        public List<StoredRecord> scan(String prefix) {
            try {
                return selectPrefix(conn, prefix);
            } catch (SQLException e) {
                throw translate("Failed to scan " + prefix, e);
            }
        }

        @Override
        public long put(String key, String payload, long expectedVersion) {
            if (expectedVersion < 0) {
                throw new IllegalArgumentException("expectedVersion must not be negative");
            }
            try {
                return expectedVersion == 0 ? insert(key, payload) : update(key, payload, expectedVersion);
            } catch (SQLException e) {
                if (e.getErrorCode() == ErrorCode.DUPLICATE_KEY_1 && expectedVersion == 0) {
                    throw new VersionConflictException(key, 0, currentVersion(key));
                }
                if (e.getErrorCode() == ErrorCode.CONCURRENT_UPDATE_1) {
                    throw new VersionConflictException(key, expectedVersion, currentVersion(key));
                }
                throw translate("Failed to write " + key, e);
            }
        }

        @Override
        public void delete(String key, long expectedVersion) {
            String sql = "DELETE FROM store_records WHERE record_key = ? AND version = ?";
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, key);
                ps.setLong(2, expectedVersion);
                if (ps.executeUpdate() == 0) {
                    throw new VersionConflictException(key, expectedVersion, currentVersion(key));
                }
            } catch (SQLException e) {
                throw translate("Failed to delete " + key, e);
            }
        }

        @Override
        public void lockScope(String scope) {
            try {
                for (int attempt = 0; attempt < 2; attempt++) {
                    try (PreparedStatement ps = conn.prepareStatement(
                            "SELECT scope FROM store_locks WHERE scope = ? FOR UPDATE")) {
                        ps.setString(1, scope);
                        try (ResultSet rs = ps.executeQuery()) {
                            if (rs.next()) {
                                return;
                            }
                        }
                    }
                    try (PreparedStatement ps = conn.prepareStatement("INSERT INTO store_locks (scope) VALUES (?)")) {
                        ps.setString(1, scope);
                        ps.executeUpdate();
                        return;
                    } catch (SQLException e) {
                        if (e.getErrorCode() != ErrorCode.DUPLICATE_KEY_1) {
                            throw e;
                        }
                        // Created concurrently; lock the existing row instead
                    }
                }
                throw new StoreException("Could not acquire lock scope " + scope);
            } catch (SQLException e) {
                throw translate("Failed to lock scope " + scope, e);
            }
        }

        @Override
        public void afterCommit(Runnable action) {
            afterCommit.add(action);
        }

        private long insert(String key, String payload) throws SQLException {
            String sql = "INSERT INTO store_records (record_key, namespace, payload, version, updated_at) VALUES (?, ?, ?, 1, ?)";
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, key);
                ps.setString(2, namespaceOf(key));
                ps.setString(3, payload);
                ps.setTimestamp(4, Timestamp.from(clock.instant()));
                ps.executeUpdate();
            }
            return 1;
        }

        private long update(String key, String payload, long expectedVersion) throws SQLException {
            String sql = "UPDATE store_records SET payload = ?, version = version + 1, updated_at = ? "
                    + "WHERE record_key = ? AND version = ?";
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, payload);
                ps.setTimestamp(2, Timestamp.from(clock.instant()));
                ps.setString(3, key);
                ps.setLong(4, expectedVersion);
                if (ps.executeUpdate() == 0) {
                    throw new VersionConflictException(key, expectedVersion, currentVersion(key));
                }
            }
            return expectedVersion + 1;
        }

        private long currentVersion(String key) {
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT version FROM store_records WHERE record_key = ?")) {
                ps.setString(1, key);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getLong(1) : 0;
                }
            } catch (SQLException e) {
                throw translate("Failed to read version of " + key, e);
            }
        }
    }
}
