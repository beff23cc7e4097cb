package io.thinmesh.storage;

import io.thinmesh.model.CompletionBatch;
import io.thinmesh.model.CompletionEvent;
import io.thinmesh.model.DeadLetter;
import io.thinmesh.model.MessageState;
import io.thinmesh.model.NackResult;
import io.thinmesh.model.TaskEnvelope;
import io.thinmesh.model.TaskOutcome;
import io.thinmesh.router.RedeliveryPolicy;
import io.thinmesh.router.TaskRouter;
import io.thinmesh.util.Jsons;
import io.thinmesh.util.Retries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.ToLongFunction;

/**
 * Task router over the {@code messages} and {@code completions} tables.
 *
 * <p>Claims are compare-and-set updates on {@code state}; acks and nacks
 * additionally match {@code lease_token}, so a worker whose lease was reclaimed
 * updates zero rows. Blocking calls poll the tables at a short fixed interval
 * until their timeout.
 */
public final class SqliteTaskRouter implements TaskRouter {
    private static final Logger log = LoggerFactory.getLogger(SqliteTaskRouter.class);
    private static final long POLL_INTERVAL_MS = 25L;
    private static final int CLAIM_CANDIDATES = 16;

    private final Database database;
    private final ToLongFunction<String> leaseMsForType;
    private final RedeliveryPolicy retryPolicy;
    private final String defaultConsumerGroup;

    public SqliteTaskRouter(Database database, String consumerGroup, ToLongFunction<String> leaseMsForType, RedeliveryPolicy retryPolicy) {
        this.database = database;
        this.defaultConsumerGroup = consumerGroup;
        this.leaseMsForType = leaseMsForType;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public String enqueue(TaskEnvelope envelope) {
        String msgId = "msg_" + UUID.randomUUID();
        String json = Jsons.toCompactJson(envelope.undelivered());
        database.inTransaction("enqueue " + envelope.taskKey(), c -> {
            long now = Instant.now().toEpochMilli();
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO messages(msg_id,consumer_group,run_id,task_key,task_type,envelope_json,state,attempt,
                                         available_at_ms,created_at_ms,updated_at_ms)
                    VALUES(?,?,?,?,?,?,?,0,?,?,?)
                    """)) {
                ps.setString(1, msgId);
                ps.setString(2, defaultConsumerGroup);
                ps.setString(3, envelope.runId());
                ps.setString(4, envelope.taskKey());
                ps.setString(5, envelope.taskType());
                ps.setString(6, json);
                ps.setString(7, MessageState.QUEUED.name());
                ps.setLong(8, now);
                ps.setLong(9, now);
                ps.setLong(10, now);
                return ps.executeUpdate();
            }
        });
        log.debug("Enqueued {} {} for run {}", envelope.taskType(), envelope.taskKey(), envelope.runId());
        return msgId;
    }

    @Override
    public Optional<TaskEnvelope> claim(String consumerGroup, String workerId, Collection<String> taskTypes, Duration timeout) {
        if (taskTypes == null || taskTypes.isEmpty()) {
            throw new IllegalArgumentException("a worker must declare at least one task type");
        }
        List<String> types = List.copyOf(new LinkedHashSet<>(taskTypes));
        long deadline = System.currentTimeMillis() + Math.max(0L, timeout.toMillis());
        while (true) {
            reclaimExpired(consumerGroup, types);
            Optional<TaskEnvelope> claimed = tryClaim(consumerGroup, workerId, types);
            if (claimed.isPresent()) {
                return claimed;
            }
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0L) {
                return Optional.empty();
            }
            if (!pause(Math.min(POLL_INTERVAL_MS, remaining))) {
                return Optional.empty();
            }
        }
    }

    private Optional<TaskEnvelope> tryClaim(String consumerGroup, String workerId, List<String> types) {
        return database.inTransaction("claim", c -> {
            long now = Instant.now().toEpochMilli();
            String sql = "SELECT seq,msg_id,task_type,envelope_json,attempt FROM messages"
                    + " WHERE consumer_group=? AND state=? AND available_at_ms<=? AND task_type IN (" + placeholders(types.size()) + ")"
                    + " ORDER BY seq LIMIT " + CLAIM_CANDIDATES;
            List<Candidate> candidates = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                int i = 1;
                ps.setString(i++, consumerGroup);
                ps.setString(i++, MessageState.QUEUED.name());
                ps.setLong(i++, now);
                for (String type : types) {
                    ps.setString(i++, type);
                }
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(new Candidate(rs.getLong("seq"), rs.getString("msg_id"), rs.getString("task_type"),
                                rs.getString("envelope_json"), rs.getInt("attempt")));
                    }
                }
            }
            for (Candidate cnd : candidates) {
                String leaseToken = "lease_" + UUID.randomUUID();
                long leaseExpires = now + leaseMsForType.applyAsLong(cnd.taskType());
                try (PreparedStatement ps = c.prepareStatement("""
                        UPDATE messages SET state=?,attempt=attempt+1,lease_owner=?,lease_token=?,lease_expires_at_ms=?,updated_at_ms=?
                        WHERE seq=? AND state=?
                        """)) {
                    ps.setString(1, MessageState.CLAIMED.name());
                    ps.setString(2, workerId);
                    ps.setString(3, leaseToken);
                    ps.setLong(4, leaseExpires);
                    ps.setLong(5, now);
                    ps.setLong(6, cnd.seq());
                    ps.setString(7, MessageState.QUEUED.name());
                    if (ps.executeUpdate() == 1) {
                        TaskEnvelope stored = Jsons.fromJson(cnd.envelopeJson(), TaskEnvelope.class);
                        return Optional.of(stored.delivered(cnd.msgId(), cnd.attempt() + 1, leaseToken));
                    }
                }
            }
            return Optional.<TaskEnvelope>empty();
        });
    }

    /**
     * Returns claimed messages with expired leases to the queue, or
     * dead-letters them when their last allowed attempt was the one that expired.
     */
    private void reclaimExpired(String consumerGroup, List<String> types) {
        database.inTransaction("reclaim expired leases", c -> {
            long now = Instant.now().toEpochMilli();
            String sql = "SELECT msg_id,run_id,task_key,task_type,attempt,charged_micros,lease_owner,lease_token FROM messages"
                    + " WHERE consumer_group=? AND state=? AND lease_expires_at_ms<=? AND task_type IN (" + placeholders(types.size()) + ")";
            List<Expired> expired = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                int i = 1;
                ps.setString(i++, consumerGroup);
                ps.setString(i++, MessageState.CLAIMED.name());
                ps.setLong(i++, now);
                for (String type : types) {
                    ps.setString(i++, type);
                }
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        expired.add(new Expired(rs.getString("msg_id"), rs.getString("run_id"), rs.getString("task_key"),
                                rs.getString("task_type"), rs.getInt("attempt"), rs.getLong("charged_micros"),
                                rs.getString("lease_owner"),
                                rs.getString("lease_token")));
                    }
                }
            }
            for (Expired e : expired) {
                String error = "lease expired (holder " + e.leaseOwner() + ", attempt " + e.attempt() + ")";
                if (e.attempt() >= retryPolicy.maxAttempts()) {
                    if (deadLetter(c, e.msgId(), e.leaseToken(), "failed", error, now) == 1) {
                        insertCompletion(c, e.runId(), e.taskKey(), e.taskType(), TaskOutcome.failed(error, e.chargedMicros()), now);
                        log.warn("Dead-lettered {} of run {} after {} attempts: {}", e.taskKey(), e.runId(), e.attempt(), error);
                    }
                } else if (requeue(c, e.msgId(), e.leaseToken(), error, now, false) == 1) {
                    log.info("Reclaimed {} of run {} from {}", e.taskKey(), e.runId(), e.leaseOwner());
                }
            }
            return expired.size();
        });
    }

    @Override
    public boolean ack(TaskEnvelope delivery, TaskOutcome outcome) {
        return database.inTransaction("ack " + delivery.messageId(), c -> {
            long now = Instant.now().toEpochMilli();
            int updated;
            if (outcome.deadLetters()) {
                updated = deadLetter(c, delivery.messageId(), delivery.leaseToken(), outcome.deadStatus(), outcome.detail(), now);
            } else {
                try (PreparedStatement ps = c.prepareStatement("""
                        UPDATE messages SET state=?,lease_owner=NULL,lease_token=NULL,lease_expires_at_ms=NULL,
                                            last_error=?,updated_at_ms=?
                        WHERE msg_id=? AND state=? AND lease_token=?
                        """)) {
                    ps.setString(1, MessageState.ACKED.name());
                    ps.setString(2, outcome.detail());
                    ps.setLong(3, now);
                    ps.setString(4, delivery.messageId());
                    ps.setString(5, MessageState.CLAIMED.name());
                    ps.setString(6, delivery.leaseToken());
                    updated = ps.executeUpdate();
                }
            }
            if (updated == 0) {
                log.warn("Rejected ack of {} for {}: lease no longer held", delivery.messageId(), delivery.taskKey());
                return false;
            }
            insertCompletion(c, delivery.runId(), delivery.taskKey(), delivery.taskType(), outcome, now);
            return true;
        });
    }

    @Override
    public NackResult nack(TaskEnvelope delivery, String error, long chargedMicros) {
        return database.inTransaction("nack " + delivery.messageId(), c -> {
            long now = Instant.now().toEpochMilli();
            Held held = held(c, delivery);
            if (held == null) {
                log.warn("Rejected nack of {} for {}: lease no longer held", delivery.messageId(), delivery.taskKey());
                return NackResult.STALE_LEASE;
            }
            long totalCharged = held.chargedMicros() + Math.max(0L, chargedMicros);
            if (held.attempt() >= retryPolicy.maxAttempts()) {
                deadLetter(c, delivery.messageId(), delivery.leaseToken(), "failed", error, now);
                insertCompletion(c, delivery.runId(), delivery.taskKey(), delivery.taskType(),
                        TaskOutcome.failed(error, totalCharged), now);
                return NackResult.DEAD_LETTERED;
            }
            long availableAt = now + Retries.backoffMs(held.attempt(), retryPolicy.baseBackoffMs(), retryPolicy.maxBackoffMs());
            try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE messages SET state=?,available_at_ms=?,charged_micros=?,lease_owner=NULL,lease_token=NULL,
                                        lease_expires_at_ms=NULL,last_error=?,updated_at_ms=?
                    WHERE msg_id=? AND state=? AND lease_token=?
                    """)) {
                ps.setString(1, MessageState.QUEUED.name());
                ps.setLong(2, availableAt);
                ps.setLong(3, totalCharged);
                ps.setString(4, error);
                ps.setLong(5, now);
                ps.setString(6, delivery.messageId());
                ps.setString(7, MessageState.CLAIMED.name());
                ps.setString(8, delivery.leaseToken());
                ps.executeUpdate();
            }
            return NackResult.REQUEUED;
        });
    }

    @Override
    public boolean release(TaskEnvelope delivery, String reason) {
        return database.inTransaction("release " + delivery.messageId(), c ->
                requeue(c, delivery.messageId(), delivery.leaseToken(), reason, Instant.now().toEpochMilli(), true) == 1);
    }

    private Held held(Connection c, TaskEnvelope delivery) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT attempt,charged_micros FROM messages WHERE msg_id=? AND state=? AND lease_token=?")) {
            ps.setString(1, delivery.messageId());
            ps.setString(2, MessageState.CLAIMED.name());
            ps.setString(3, delivery.leaseToken());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? new Held(rs.getInt(1), rs.getLong(2)) : null;
            }
        }
    }

    private int requeue(Connection c, String msgId, String leaseToken, String reason, long now, boolean refundAttempt) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE messages SET state=?,attempt=MAX(0, attempt-?),available_at_ms=?,lease_owner=NULL,lease_token=NULL,
                                    lease_expires_at_ms=NULL,last_error=?,updated_at_ms=?
                WHERE msg_id=? AND state=? AND lease_token=?
                """)) {
            ps.setString(1, MessageState.QUEUED.name());
            ps.setInt(2, refundAttempt ? 1 : 0);
            ps.setLong(3, now);
            ps.setString(4, reason);
            ps.setLong(5, now);
            ps.setString(6, msgId);
            ps.setString(7, MessageState.CLAIMED.name());
            ps.setString(8, leaseToken);
            return ps.executeUpdate();
        }
    }

    private int deadLetter(Connection c, String msgId, String leaseToken, String status, String error, long now) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE messages SET state=?,dead_status=?,last_error=?,lease_owner=NULL,lease_token=NULL,
                                    lease_expires_at_ms=NULL,updated_at_ms=?
                WHERE msg_id=? AND state=? AND lease_token=?
                """)) {
            ps.setString(1, MessageState.DEAD_LETTER.name());
            ps.setString(2, status);
            ps.setString(3, error);
            ps.setLong(4, now);
            ps.setString(5, msgId);
            ps.setString(6, MessageState.CLAIMED.name());
            ps.setString(7, leaseToken);
            return ps.executeUpdate();
        }
    }

    private void insertCompletion(Connection c, String runId, String taskKey, String taskType, TaskOutcome outcome, long now) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO completions(run_id,task_key,task_type,outcome,artifact_hash,cost_micros,detail,created_at_ms)
                VALUES(?,?,?,?,?,?,?,?)
                """)) {
            ps.setString(1, runId);
            ps.setString(2, taskKey);
            ps.setString(3, taskType);
            ps.setString(4, outcome.kind().name());
            ps.setString(5, outcome.artifactHash());
            ps.setLong(6, outcome.costMicros());
            ps.setString(7, outcome.detail());
            ps.setLong(8, now);
            ps.executeUpdate();
        }
    }

    @Override
    public CompletionBatch pollCompletions(String runId, String cursor, int max, Duration timeout) {
        long after = parseCursor(cursor);
        long deadline = System.currentTimeMillis() + Math.max(0L, timeout.toMillis());
        while (true) {
            List<CompletionEvent> events = readCompletions(runId, after, Math.max(1, max));
            if (!events.isEmpty()) {
                return new CompletionBatch(events, events.get(events.size() - 1).cursor());
            }
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0L || !pause(Math.min(POLL_INTERVAL_MS, remaining))) {
                return CompletionBatch.empty(Long.toString(after));
            }
        }
    }

    private List<CompletionEvent> readCompletions(String runId, long after, int max) {
        return database.read("poll completions " + runId, c -> {
            List<CompletionEvent> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT seq,run_id,task_key,task_type,outcome,artifact_hash,cost_micros,detail,created_at_ms
                    FROM completions WHERE run_id=? AND seq>? ORDER BY seq LIMIT ?
                    """)) {
                ps.setString(1, runId);
                ps.setLong(2, after);
                ps.setInt(3, max);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new CompletionEvent(
                                Long.toString(rs.getLong("seq")),
                                rs.getString("run_id"),
                                rs.getString("task_key"),
                                rs.getString("task_type"),
                                TaskOutcome.Kind.valueOf(rs.getString("outcome")),
                                rs.getString("artifact_hash"),
                                rs.getLong("cost_micros"),
                                rs.getString("detail"),
                                rs.getLong("created_at_ms")
                        ));
                    }
                }
            }
            return out;
        });
    }

    @Override
    public String completionCursor(String runId) {
        return database.read("completion cursor " + runId, c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT COALESCE(MAX(seq),0) FROM completions WHERE run_id=?")) {
                ps.setString(1, runId);
                try (ResultSet rs = ps.executeQuery()) {
                    return Long.toString(rs.next() ? rs.getLong(1) : 0L);
                }
            }
        });
    }

    @Override
    public Set<String> outstandingTaskKeys(String runId) {
        return database.read("outstanding keys " + runId, c -> {
            Set<String> out = new LinkedHashSet<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT DISTINCT task_key FROM messages WHERE run_id=? AND state IN (?,?)")) {
                ps.setString(1, runId);
                ps.setString(2, MessageState.QUEUED.name());
                ps.setString(3, MessageState.CLAIMED.name());
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(rs.getString(1));
                    }
                }
            }
            return out;
        });
    }

    @Override
    public List<DeadLetter> deadLetters(String runId) {
        return database.read("dead letters", c -> {
            List<DeadLetter> out = new ArrayList<>();
            String sql = "SELECT msg_id,run_id,task_key,task_type,dead_status,attempt,last_error,updated_at_ms FROM messages WHERE state=?"
                    + (runId == null ? "" : " AND run_id=?") + " ORDER BY updated_at_ms, seq";
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, MessageState.DEAD_LETTER.name());
                if (runId != null) {
                    ps.setString(2, runId);
                }
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new DeadLetter(
                                rs.getString("msg_id"),
                                rs.getString("run_id"),
                                rs.getString("task_key"),
                                rs.getString("task_type"),
                                rs.getString("dead_status"),
                                rs.getInt("attempt"),
                                rs.getString("last_error"),
                                rs.getLong("updated_at_ms")
                        ));
                    }
                }
            }
            return out;
        });
    }

    @Override
    public Map<String, Long> queueDepths() {
        return database.read("queue depths", c -> {
            Map<String, Long> out = new LinkedHashMap<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT task_type, COUNT(*) FROM messages WHERE state IN (?,?) GROUP BY task_type ORDER BY task_type")) {
                ps.setString(1, MessageState.QUEUED.name());
                ps.setString(2, MessageState.CLAIMED.name());
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.put(rs.getString(1), rs.getLong(2));
                    }
                }
            }
            return out;
        });
    }

    private static long parseCursor(String cursor) {
        if (cursor == null || cursor.isBlank()) {
            return 0L;
        }
        try {
            return Long.parseLong(cursor.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid completion cursor: " + cursor, e);
        }
    }

    private static String placeholders(int n) {
        return String.join(",", Collections.nCopies(n, "?"));
    }

    private static boolean pause(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private record Candidate(long seq, String msgId, String taskType, String envelopeJson, int attempt) {
    }

    private record Expired(String msgId, String runId, String taskKey, String taskType, int attempt,
                           long chargedMicros, String leaseOwner, String leaseToken) {
    }

    private record Held(int attempt, long chargedMicros) {
    }
}
