package io.agentwarden.storage;

import io.agentwarden.config.WardenConfig;
import io.agentwarden.error.StorageException;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * Embedded SQLite store shared by the queue and the governance tables. Every connection uses
 * IMMEDIATE transactions so that concurrent writers serialise on the write lock instead of
 * failing on a lock upgrade.
 */
public final class Database {
    private static final int BUSY_TIMEOUT_MS = 10_000;

    private final WardenConfig config;
    private final String jdbcUrl;
    private final Properties connectionProperties;

    public Database(WardenConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setBusyTimeout(BUSY_TIMEOUT_MS);
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        sqlite.enforceForeignKeys(true);
        this.connectionProperties = sqlite.toProperties();
    }

    public void init() {
        initDirectories();
        applyAndValidatePragmas();
        initSchema();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.activityRoot());
        } catch (IOException e) {
            throw new StorageException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS tasks (
                        task_id TEXT PRIMARY KEY,
                        seq INTEGER NOT NULL UNIQUE,
                        task_type TEXT NOT NULL,
                        priority_rank INTEGER NOT NULL,
                        payload_json TEXT NOT NULL,
                        status TEXT NOT NULL,
                        attempt_count INTEGER NOT NULL DEFAULT 0,
                        max_attempts INTEGER NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        claimed_at_ms INTEGER,
                        completed_at_ms INTEGER,
                        lease_owner TEXT,
                        lease_token TEXT,
                        lease_expires_at_ms INTEGER,
                        next_retry_at_ms INTEGER,
                        cancel_requested INTEGER NOT NULL DEFAULT 0,
                        result TEXT,
                        error_json TEXT
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS pending_updates (
                        update_id TEXT PRIMARY KEY,
                        target_path TEXT NOT NULL,
                        proposed_content TEXT NOT NULL,
                        proposed_sha256 TEXT NOT NULL,
                        base_sha256 TEXT,
                        origin_task_id TEXT,
                        protected_target INTEGER NOT NULL,
                        status TEXT NOT NULL,
                        backup_ref TEXT,
                        reason TEXT,
                        created_at_ms INTEGER NOT NULL,
                        decided_at_ms INTEGER,
                        decided_by TEXT,
                        applied_at_ms INTEGER,
                        rolled_back_at_ms INTEGER
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS backups (
                        backup_id TEXT PRIMARY KEY,
                        update_id TEXT NOT NULL UNIQUE,
                        target_path TEXT NOT NULL,
                        target_existed INTEGER NOT NULL,
                        original_content BLOB,
                        original_sha256 TEXT,
                        taken_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(update_id) REFERENCES pending_updates(update_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS update_change_log (
                        seq INTEGER PRIMARY KEY AUTOINCREMENT,
                        update_id TEXT NOT NULL,
                        at_ms INTEGER NOT NULL,
                        actor TEXT NOT NULL,
                        action TEXT NOT NULL,
                        from_status TEXT,
                        to_status TEXT NOT NULL,
                        before_ref TEXT,
                        after_ref TEXT,
                        FOREIGN KEY(update_id) REFERENCES pending_updates(update_id)
                    )
                    """);
            st.execute("""
                    CREATE TRIGGER IF NOT EXISTS trg_backups_immutable
                    BEFORE UPDATE ON backups
                    BEGIN
                        SELECT RAISE(ABORT, 'backups are immutable');
                    END
                    """);
            st.execute("""
                    CREATE TRIGGER IF NOT EXISTS trg_backups_no_delete
                    BEFORE DELETE ON backups
                    BEGIN
                        SELECT RAISE(ABORT, 'backups are immutable');
                    END
                    """);
            st.execute("""
                    CREATE TRIGGER IF NOT EXISTS trg_change_log_append_only
                    BEFORE UPDATE ON update_change_log
                    BEGIN
                        SELECT RAISE(ABORT, 'change log is append-only');
                    END
                    """);
            st.execute("""
                    CREATE TRIGGER IF NOT EXISTS trg_change_log_no_delete
                    BEFORE DELETE ON update_change_log
                    BEGIN
                        SELECT RAISE(ABORT, 'change log is append-only');
                    END
                    """);

            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_claim ON tasks(status, priority_rank DESC, created_at_ms, seq)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_retry_due ON tasks(status, next_retry_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_lease_expiry ON tasks(status, lease_expires_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_updates_status ON pending_updates(status, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_change_log_update ON update_change_log(update_id, seq)");
        } catch (SQLException e) {
            throw new StorageException("Failed to initialize SQLite schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new StorageException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
