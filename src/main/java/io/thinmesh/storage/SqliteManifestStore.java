package io.thinmesh.storage;

import io.thinmesh.error.IntegrityException;
import io.thinmesh.manifest.ManifestEntries;
import io.thinmesh.manifest.ManifestStore;
import io.thinmesh.model.ManifestEntry;
import io.thinmesh.model.RecordResult;
import io.thinmesh.model.RunRecord;
import io.thinmesh.model.RunStatus;
import io.thinmesh.util.Hashing;
import io.thinmesh.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Manifest log in the {@code manifest} table, with {@code resolutions} as the
 * derived per-run index that makes record-if-absent a single transaction.
 */
public final class SqliteManifestStore implements ManifestStore {
    private final Database database;

    public SqliteManifestStore(Database database) {
        this.database = database;
    }

    @Override
    public RunRecord createRunIfAbsent(String runId, String specHash) {
        return database.inTransaction("create run " + runId, c -> {
            long now = Instant.now().toEpochMilli();
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT OR IGNORE INTO runs(run_id,spec_hash,status,cancelled,created_at_ms,updated_at_ms) VALUES(?,?,?,0,?,?)")) {
                ps.setString(1, runId);
                ps.setString(2, specHash);
                ps.setString(3, RunStatus.RUNNING.name());
                ps.setLong(4, now);
                ps.setLong(5, now);
                ps.executeUpdate();
            }
            return readRun(c, runId).orElseThrow();
        });
    }

    @Override
    public Optional<RunRecord> findRun(String runId) {
        return database.read("find run " + runId, c -> readRun(c, runId));
    }

    @Override
    public List<RunRecord> listRuns() {
        return database.read("list runs", c -> {
            List<RunRecord> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT run_id,spec_hash,status,cancelled,created_at_ms,updated_at_ms FROM runs ORDER BY created_at_ms");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapRun(rs));
                }
            }
            return out;
        });
    }

    @Override
    public void updateRunStatus(String runId, RunStatus status) {
        database.inTransaction("update run status " + runId, c -> {
            try (PreparedStatement ps = c.prepareStatement("UPDATE runs SET status=?,updated_at_ms=? WHERE run_id=?")) {
                ps.setString(1, status.name());
                ps.setLong(2, Instant.now().toEpochMilli());
                ps.setString(3, runId);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public boolean markCancelled(String runId) {
        return database.inTransaction("cancel run " + runId, c -> {
            try (PreparedStatement ps = c.prepareStatement("UPDATE runs SET cancelled=1,updated_at_ms=? WHERE run_id=?")) {
                ps.setLong(1, Instant.now().toEpochMilli());
                ps.setString(2, runId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public boolean isCancelled(String runId) {
        return findRun(runId).map(RunRecord::cancelled).orElse(false);
    }

    @Override
    public RecordResult recordDone(String runId, String taskKey, String taskType, String artifactHash, long costMicros) {
        Hashing.requireSha256Hex(artifactHash);
        return database.inTransaction("record done " + taskKey, c -> {
            Optional<ManifestEntry> existing = readResolved(c, runId, taskKey);
            if (existing.isPresent()) {
                return RecordResult.existing(existing.get().artifactHash(), existing.get().costChargedMicros());
            }
            long now = Instant.now().toEpochMilli();
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO resolutions(run_id,task_key,task_type,artifact_hash,cost_micros,recorded_at_ms) VALUES(?,?,?,?,?,?)")) {
                ps.setString(1, runId);
                ps.setString(2, taskKey);
                ps.setString(3, taskType);
                ps.setString(4, artifactHash);
                ps.setLong(5, costMicros);
                ps.setLong(6, now);
                ps.executeUpdate();
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT OR IGNORE INTO global_resolutions(task_key,artifact_hash,recorded_at_ms) VALUES(?,?,?)")) {
                ps.setString(1, taskKey);
                ps.setString(2, artifactHash);
                ps.setLong(3, now);
                ps.executeUpdate();
            }
            append(c, runId, ManifestEntry.done(taskKey, taskType, artifactHash, costMicros, now));
            return RecordResult.recorded(artifactHash, costMicros);
        });
    }

    @Override
    public void recordFailed(String runId, String taskKey, String taskType, String detail, long costMicros) {
        database.inTransaction("record failed " + taskKey, c -> {
            append(c, runId, ManifestEntry.failed(taskKey, taskType, detail, costMicros, Instant.now().toEpochMilli()));
            return null;
        });
    }

    @Override
    public void invalidate(String runId, String taskKey, String taskType, String artifactHash, String reason) {
        database.inTransaction("invalidate " + taskKey, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "DELETE FROM resolutions WHERE run_id=? AND task_key=? AND artifact_hash=?")) {
                ps.setString(1, runId);
                ps.setString(2, taskKey);
                ps.setString(3, artifactHash);
                if (ps.executeUpdate() == 0) {
                    return null;
                }
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "DELETE FROM global_resolutions WHERE task_key=? AND artifact_hash=?")) {
                ps.setString(1, taskKey);
                ps.setString(2, artifactHash);
                ps.executeUpdate();
            }
            append(c, runId, ManifestEntry.invalidated(taskKey, taskType, artifactHash, reason, Instant.now().toEpochMilli()));
            return null;
        });
    }

    @Override
    public List<ManifestEntry> replay(String runId) {
        return database.read("replay manifest " + runId, c -> {
            List<ManifestEntry> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT seq,entry_json FROM manifest WHERE run_id=? ORDER BY seq")) {
                ps.setString(1, runId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(ManifestEntries.parse(rs.getString("entry_json"), runId + "#" + rs.getLong("seq")));
                    }
                }
            }
            return out;
        });
    }

    @Override
    public Optional<ManifestEntry> resolved(String runId, String taskKey) {
        return database.read("resolve " + taskKey, c -> readResolved(c, runId, taskKey));
    }

    @Override
    public Optional<String> globalResolution(String taskKey) {
        return database.read("global resolve " + taskKey, c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT artifact_hash FROM global_resolutions WHERE task_key=?")) {
                ps.setString(1, taskKey);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(rs.getString(1)) : Optional.<String>empty();
                }
            }
        });
    }

    private void append(Connection c, String runId, ManifestEntry entry) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO manifest(run_id,entry_json,recorded_at_ms) VALUES(?,?,?)")) {
            ps.setString(1, runId);
            ps.setString(2, Jsons.toCompactJson(entry));
            ps.setLong(3, entry.recordedAtMs());
            ps.executeUpdate();
        }
    }

    private Optional<ManifestEntry> readResolved(Connection c, String runId, String taskKey) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT task_type,artifact_hash,cost_micros,recorded_at_ms FROM resolutions WHERE run_id=? AND task_key=?")) {
            ps.setString(1, runId);
            ps.setString(2, taskKey);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                String hash = rs.getString("artifact_hash");
                if (!Hashing.isSha256Hex(hash)) {
                    throw new IntegrityException("resolution of " + taskKey + " in run " + runId + " has malformed hash " + hash);
                }
                return Optional.of(ManifestEntry.done(taskKey, rs.getString("task_type"), hash,
                        rs.getLong("cost_micros"), rs.getLong("recorded_at_ms")));
            }
        }
    }

    private Optional<RunRecord> readRun(Connection c, String runId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT run_id,spec_hash,status,cancelled,created_at_ms,updated_at_ms FROM runs WHERE run_id=?")) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRun(rs)) : Optional.empty();
            }
        }
    }

    private RunRecord mapRun(ResultSet rs) throws SQLException {
        return new RunRecord(
                rs.getString("run_id"),
                rs.getString("spec_hash"),
                RunStatus.valueOf(rs.getString("status")),
                rs.getInt("cancelled") == 1,
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }
}
