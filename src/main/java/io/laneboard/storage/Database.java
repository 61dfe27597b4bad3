package io.laneboard.storage;

import io.laneboard.config.LaneBoardConfig;
import io.laneboard.util.Hashing;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * SQLite file of one namespace: board snapshots, the task archive and lock leases. Connections
 * are short-lived; WAL mode lets readers run alongside the single writer.
 */
public final class Database {
    private static final int BUSY_TIMEOUT_MS = 5_000;

    private static final List<String> BASE_SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS boards (
                board_id TEXT PRIMARY KEY,
                namespace TEXT NOT NULL DEFAULT 'default',
                snapshot TEXT NOT NULL,
                task_count INTEGER NOT NULL DEFAULT 0,
                version INTEGER NOT NULL,
                created_at_ms INTEGER NOT NULL,
                updated_at_ms INTEGER NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS archived_tasks (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                namespace TEXT NOT NULL DEFAULT 'default',
                board_id TEXT NOT NULL,
                task_id TEXT NOT NULL,
                from_column TEXT NOT NULL,
                payload TEXT NOT NULL,
                archived_at_ms INTEGER NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS board_locks (
                lock_key TEXT PRIMARY KEY,
                lock_owner TEXT,
                lock_token TEXT,
                fencing_epoch INTEGER NOT NULL DEFAULT 0,
                acquired_at_ms INTEGER,
                expires_at_ms INTEGER,
                updated_at_ms INTEGER NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS schema_migrations (
                version TEXT PRIMARY KEY,
                description TEXT NOT NULL,
                checksum TEXT NOT NULL,
                applied_at_ms INTEGER NOT NULL,
                success INTEGER NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_boards_namespace_updated ON boards(namespace, updated_at_ms)",
            "CREATE INDEX IF NOT EXISTS idx_archived_board_time ON archived_tasks(board_id, archived_at_ms)"
    );

    // Append only; a shipped migration must never change.
    private static final List<Migration> MIGRATIONS = List.of(
            new Migration("20261001_001_archive_task_lookup",
                    "Index archived tasks by task id",
                    List.of("CREATE INDEX IF NOT EXISTS idx_archived_task ON archived_tasks(board_id, task_id)")),
            new Migration("20261001_002_archive_purge_scan",
                    "Index archive rows by time for retention purges",
                    List.of("CREATE INDEX IF NOT EXISTS idx_archived_time ON archived_tasks(namespace, archived_at_ms)"))
    );

    private static final Map<String, String> PRAGMAS = Map.of(
            "journal_mode", "wal",
            "synchronous", "1"
    );

    private final LaneBoardConfig config;
    private final String jdbcUrl;

    public Database(LaneBoardConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile();
    }

    public String namespace() {
        return config.namespace();
    }

    /**
     * Creates the data directories, the base schema and any pending migrations. Safe to call on
     * every start.
     */
    public void init() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to create data directories under " + config.rootDir(), e);
        }
        try (Connection conn = openConnection()) {
            try (Statement st = conn.createStatement()) {
                for (String ddl : BASE_SCHEMA) {
                    st.execute(ddl);
                }
            }
            for (Migration migration : MIGRATIONS) {
                if (!isApplied(conn, migration.version())) {
                    apply(conn, migration);
                }
            }
            enableWal(conn);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite database " + config.dbFile(), e);
        }
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MS);
        }
        return conn;
    }

    private static boolean isApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT success FROM schema_migrations WHERE version=?")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getInt(1) == 1;
            }
        }
    }

    private static void apply(Connection conn, Migration migration) throws SQLException {
        conn.setAutoCommit(false);
        try (Statement st = conn.createStatement();
             PreparedStatement record = conn.prepareStatement(
                     "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            for (String sql : migration.statements()) {
                st.execute(sql);
            }
            record.setString(1, migration.version());
            record.setString(2, migration.description());
            record.setString(3, migration.checksum());
            record.setLong(4, System.currentTimeMillis());
            record.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw new SQLException("Migration " + migration.version() + " failed", e);
        } finally {
            conn.setAutoCommit(true);
        }
    }

    private static void enableWal(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            for (Map.Entry<String, String> pragma : PRAGMAS.entrySet()) {
                try (ResultSet rs = st.executeQuery("PRAGMA " + pragma.getKey())) {
                    String actual = rs.next() ? rs.getString(1) : null;
                    if (!pragma.getValue().equalsIgnoreCase(actual)) {
                        throw new IllegalStateException("PRAGMA " + pragma.getKey() + " is " + actual
                                + ", expected " + pragma.getValue());
                    }
                }
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = "SELECT version,description,checksum,applied_at_ms,success FROM schema_migrations ORDER BY version DESC LIMIT ?";
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            List<SchemaMigrationRow> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SchemaMigrationRow(
                            rs.getString("version"),
                            rs.getString("description"),
                            rs.getString("checksum"),
                            rs.getLong("applied_at_ms"),
                            rs.getInt("success") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    private record Migration(String version, String description, List<String> statements) {
        String checksum() {
            return Hashing.sha256Hex(version + "|" + String.join(";", statements)).substring(0, 16);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
