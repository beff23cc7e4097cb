package io.thinmesh.storage;

import io.thinmesh.error.TransientStorageException;
import io.thinmesh.util.Retries;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * SQLite file shared by the single-host router, manifest and ledger. Every
 * operation opens its own connection; write transactions start IMMEDIATE so
 * that a check-and-update inside one transaction cannot interleave with
 * another process.
 */
public final class Database {
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    private final Path dbFile;
    private final String jdbcUrl;
    private final Properties connectionProperties;
    private final Retries.Policy retryPolicy;

    public Database(Path dbFile) {
        this(dbFile, Retries.Policy.DEFAULT);
    }

    public Database(Path dbFile, Retries.Policy retryPolicy) {
        this.dbFile = dbFile;
        this.jdbcUrl = "jdbc:sqlite:" + dbFile.toString();
        this.retryPolicy = retryPolicy;
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(5_000);
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        config.enforceForeignKeys(true);
        this.connectionProperties = config.toProperties();
    }

    public Path dbFile() {
        return dbFile;
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    /**
     * Runs {@code work} in one transaction, committing on return and rolling
     * back on any exception. Busy/locked failures are retried with backoff.
     */
    public <T> T inTransaction(String operation, SqlWork<T> work) {
        return Retries.call(operation, retryPolicy, () -> {
            try (Connection c = openConnection()) {
                c.setAutoCommit(false);
                try {
                    T result = work.apply(c);
                    c.commit();
                    return result;
                } catch (Exception e) {
                    c.rollback();
                    throw e;
                } finally {
                    c.setAutoCommit(true);
                }
            } catch (SQLException e) {
                throw translate(operation, e);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new RuntimeException("Failed " + operation, e);
            }
        });
    }

    /**
     * Runs a read without an explicit transaction.
     */
    public <T> T read(String operation, SqlWork<T> work) {
        return Retries.call(operation, retryPolicy, () -> {
            try (Connection c = openConnection()) {
                return work.apply(c);
            } catch (SQLException e) {
                throw translate(operation, e);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new RuntimeException("Failed " + operation, e);
            }
        });
    }

    static RuntimeException translate(String operation, SQLException e) {
        int primary = e.getErrorCode() & 0xff;
        if (primary == SQLITE_BUSY || primary == SQLITE_LOCKED) {
            return new TransientStorageException(operation + ": database busy", e);
        }
        return new RuntimeException("Failed " + operation, e);
    }

    private void initDirectories() {
        try {
            Path parent = dbFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS runs (
                        run_id TEXT PRIMARY KEY,
                        spec_hash TEXT NOT NULL,
                        status TEXT NOT NULL,
                        cancelled INTEGER NOT NULL DEFAULT 0,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS manifest (
                        seq INTEGER PRIMARY KEY AUTOINCREMENT,
                        run_id TEXT NOT NULL,
                        entry_json TEXT NOT NULL,
                        recorded_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(run_id) REFERENCES runs(run_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS resolutions (
                        run_id TEXT NOT NULL,
                        task_key TEXT NOT NULL,
                        task_type TEXT NOT NULL,
                        artifact_hash TEXT NOT NULL,
                        cost_micros INTEGER NOT NULL DEFAULT 0,
                        recorded_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(run_id, task_key)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS global_resolutions (
                        task_key TEXT PRIMARY KEY,
                        artifact_hash TEXT NOT NULL,
                        recorded_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS messages (
                        seq INTEGER PRIMARY KEY AUTOINCREMENT,
                        msg_id TEXT NOT NULL UNIQUE,
                        consumer_group TEXT NOT NULL,
                        run_id TEXT NOT NULL,
                        task_key TEXT NOT NULL,
                        task_type TEXT NOT NULL,
                        envelope_json TEXT NOT NULL,
                        state TEXT NOT NULL,
                        attempt INTEGER NOT NULL DEFAULT 0,
                        charged_micros INTEGER NOT NULL DEFAULT 0,
                        available_at_ms INTEGER NOT NULL,
                        lease_owner TEXT,
                        lease_token TEXT,
                        lease_expires_at_ms INTEGER,
                        dead_status TEXT,
                        last_error TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS completions (
                        seq INTEGER PRIMARY KEY AUTOINCREMENT,
                        run_id TEXT NOT NULL,
                        task_key TEXT NOT NULL,
                        task_type TEXT NOT NULL,
                        outcome TEXT NOT NULL,
                        artifact_hash TEXT,
                        cost_micros INTEGER NOT NULL DEFAULT 0,
                        detail TEXT,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS ledgers (
                        scope TEXT PRIMARY KEY,
                        spent_micros INTEGER NOT NULL DEFAULT 0,
                        in_flight_micros INTEGER NOT NULL DEFAULT 0,
                        ceiling_micros INTEGER NOT NULL DEFAULT -1,
                        halted INTEGER NOT NULL DEFAULT 0,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS reservations (
                        reservation_id TEXT PRIMARY KEY,
                        scope TEXT NOT NULL,
                        amount_micros INTEGER NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_manifest_run_seq ON manifest(run_id, seq)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_messages_claim ON messages(consumer_group, state, task_type, available_at_ms, seq)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_messages_lease ON messages(state, lease_expires_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_messages_run_state ON messages(run_id, state)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_messages_dead ON messages(state, run_id, updated_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_completions_run_seq ON completions(run_id, seq)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_reservations_scope ON reservations(scope)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
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

    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection connection) throws Exception;
    }
}
