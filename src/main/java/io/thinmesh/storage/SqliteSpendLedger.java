package io.thinmesh.storage;

import io.thinmesh.cost.SpendLedger;
import io.thinmesh.model.LedgerSnapshot;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

/**
 * Spend ledger rows in {@code ledgers} and open reservations in
 * {@code reservations}. Each operation is one IMMEDIATE transaction, which
 * holds the database write lock from its first statement.
 */
public final class SqliteSpendLedger implements SpendLedger {
    private final Database database;

    public SqliteSpendLedger(Database database) {
        this.database = database;
    }

    @Override
    public boolean reserve(String runId, String reservationId, long amountMicros, long globalCeilingMicros) {
        return database.inTransaction("reserve " + reservationId, c -> {
            long now = Instant.now().toEpochMilli();
            ensureLedger(c, runId, now);
            ensureLedger(c, GLOBAL_SCOPE, now);
            long previous = reservedAmount(c, reservationId);
            long delta = amountMicros - previous;

            // Grant check and in-flight increment are one conditional UPDATE.
            // A ledger already at its ceiling grants nothing, not even a zero estimate.
            try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE ledgers SET in_flight_micros=in_flight_micros+?, updated_at_ms=?
                    WHERE scope=? AND halted=0
                      AND (ceiling_micros < 0
                           OR (spent_micros + in_flight_micros - ? < ceiling_micros
                               AND spent_micros + in_flight_micros + ? <= ceiling_micros))
                    """)) {
                ps.setLong(1, delta);
                ps.setLong(2, now);
                ps.setString(3, runId);
                ps.setLong(4, previous);
                ps.setLong(5, delta);
                if (ps.executeUpdate() == 0) {
                    halt(c, runId, now);
                    return false;
                }
            }
            try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE ledgers SET in_flight_micros=in_flight_micros+?, ceiling_micros=?, updated_at_ms=?
                    WHERE scope=?
                      AND (? < 0
                           OR (spent_micros + in_flight_micros - ? < ?
                               AND spent_micros + in_flight_micros + ? <= ?))
                    """)) {
                ps.setLong(1, delta);
                ps.setLong(2, globalCeilingMicros);
                ps.setLong(3, now);
                ps.setString(4, GLOBAL_SCOPE);
                ps.setLong(5, globalCeilingMicros);
                ps.setLong(6, previous);
                ps.setLong(7, globalCeilingMicros);
                ps.setLong(8, delta);
                ps.setLong(9, globalCeilingMicros);
                if (ps.executeUpdate() == 0) {
                    // undo the run increment, then record the halt
                    c.rollback();
                    halt(c, runId, now);
                    return false;
                }
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT OR REPLACE INTO reservations(reservation_id,scope,amount_micros,created_at_ms) VALUES(?,?,?,?)")) {
                ps.setString(1, reservationId);
                ps.setString(2, runId);
                ps.setLong(3, amountMicros);
                ps.setLong(4, now);
                ps.executeUpdate();
            }
            return true;
        });
    }

    @Override
    public boolean settle(String runId, String reservationId, long actualMicros) {
        return database.inTransaction("settle " + reservationId, c -> close(c, runId, reservationId, actualMicros));
    }

    @Override
    public boolean release(String runId, String reservationId) {
        return database.inTransaction("release " + reservationId, c -> close(c, runId, reservationId, 0L));
    }

    private boolean close(Connection c, String runId, String reservationId, long chargeMicros) throws SQLException {
        long reserved;
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT amount_micros FROM reservations WHERE reservation_id=? AND scope=?")) {
            ps.setString(1, reservationId);
            ps.setString(2, runId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return false;
                }
                reserved = rs.getLong(1);
            }
        }
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM reservations WHERE reservation_id=?")) {
            ps.setString(1, reservationId);
            ps.executeUpdate();
        }
        long now = Instant.now().toEpochMilli();
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE ledgers SET in_flight_micros=MAX(0, in_flight_micros-?), spent_micros=spent_micros+?, updated_at_ms=?
                WHERE scope IN (?, ?)
                """)) {
            ps.setLong(1, reserved);
            ps.setLong(2, chargeMicros);
            ps.setLong(3, now);
            ps.setString(4, runId);
            ps.setString(5, GLOBAL_SCOPE);
            ps.executeUpdate();
        }
        return true;
    }

    @Override
    public void setCeiling(String runId, long ceilingMicros) {
        database.inTransaction("set ceiling " + runId, c -> {
            long now = Instant.now().toEpochMilli();
            ensureLedger(c, runId, now);
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE ledgers SET ceiling_micros=?, halted=0, updated_at_ms=? WHERE scope=?")) {
                ps.setLong(1, ceilingMicros);
                ps.setLong(2, now);
                ps.setString(3, runId);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public Optional<LedgerSnapshot> snapshot(String scope) {
        return database.read("ledger snapshot " + scope, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT scope,spent_micros,in_flight_micros,ceiling_micros,halted,updated_at_ms FROM ledgers WHERE scope=?")) {
                ps.setString(1, scope);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.<LedgerSnapshot>empty();
                    }
                    return Optional.of(new LedgerSnapshot(
                            rs.getString("scope"),
                            rs.getLong("spent_micros"),
                            rs.getLong("in_flight_micros"),
                            rs.getLong("ceiling_micros"),
                            rs.getInt("halted") == 1,
                            rs.getLong("updated_at_ms")
                    ));
                }
            }
        });
    }

    private void ensureLedger(Connection c, String scope, long now) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT OR IGNORE INTO ledgers(scope,spent_micros,in_flight_micros,ceiling_micros,halted,updated_at_ms) VALUES(?,0,0,-1,0,?)")) {
            ps.setString(1, scope);
            ps.setLong(2, now);
            ps.executeUpdate();
        }
    }

    private void halt(Connection c, String runId, long now) throws SQLException {
        ensureLedger(c, runId, now);
        try (PreparedStatement ps = c.prepareStatement("UPDATE ledgers SET halted=1, updated_at_ms=? WHERE scope=?")) {
            ps.setLong(1, now);
            ps.setString(2, runId);
            ps.executeUpdate();
        }
    }

    private long reservedAmount(Connection c, String reservationId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT amount_micros FROM reservations WHERE reservation_id=?")) {
            ps.setString(1, reservationId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }
}
