package io.thinmesh.redis;

import io.thinmesh.model.CompletionBatch;
import io.thinmesh.model.CompletionEvent;
import io.thinmesh.model.DeadLetter;
import io.thinmesh.model.NackResult;
import io.thinmesh.model.TaskEnvelope;
import io.thinmesh.model.TaskOutcome;
import io.thinmesh.router.RedeliveryPolicy;
import io.thinmesh.router.TaskRouter;
import io.thinmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.RedisStreamCommands;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.PendingMessage;
import org.springframework.data.redis.connection.stream.PendingMessages;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.ToLongFunction;

/**
 * Task router over Redis streams: one stream per task type read through a
 * consumer group, a dead-letter stream, and one completion stream per run.
 *
 * <p>A message is acknowledged with {@code XACK} + {@code XDEL}, so a stream's
 * length is its queued plus claimed messages. The lease token is
 * {@code group|consumer|deliveryCount}; every ack, nack and release runs as one Lua
 * script that first checks the pending entry still has that owner and count.
 *
 * <p>Nacked messages are re-added at the tail immediately; this backend does
 * not delay redelivery.
 */
public final class RedisTaskRouter implements TaskRouter {
    private static final Logger log = LoggerFactory.getLogger(RedisTaskRouter.class);
    private static final long MAX_BLOCK_MS = 1_000L;
    private static final int RECLAIM_SCAN = 32;

    private static final String FENCE = """
            local p = redis.call('XPENDING', KEYS[1], ARGV[1], ARGV[2], ARGV[2], 1, ARGV[3])
            if #p == 0 or tonumber(p[1][4]) ~= tonumber(ARGV[4]) then
              return false
            end
            redis.call('XACK', KEYS[1], ARGV[1], ARGV[2])
            redis.call('XDEL', KEYS[1], ARGV[2])
            if redis.call('HGET', KEYS[2], ARGV[5]) == ARGV[2] then
              redis.call('HDEL', KEYS[2], ARGV[5])
            end
            """;

    /** KEYS: queue, outstanding, events, dead. ARGV: group, id, consumer, count, taskKey, then event and dead-letter fields. */
    private static final DefaultRedisScript<String> FINISH = new DefaultRedisScript<>(FENCE + """
            redis.call('XADD', KEYS[3], '*', 'run_id', ARGV[6], 'task_key', ARGV[5], 'task_type', ARGV[7],
              'outcome', ARGV[8], 'artifact_hash', ARGV[9], 'cost_micros', ARGV[10], 'detail', ARGV[11],
              'created_at_ms', ARGV[12])
            if ARGV[13] ~= '' then
              redis.call('XADD', KEYS[4], '*', 'message_id', ARGV[2], 'run_id', ARGV[6], 'task_key', ARGV[5],
                'task_type', ARGV[7], 'status', ARGV[13], 'attempt', ARGV[14], 'last_error', ARGV[11],
                'dead_at_ms', ARGV[12])
            end
            return 'ok'
            """, String.class);

    /** KEYS: queue, outstanding. ARGV: group, id, consumer, count, taskKey, envelope, attempts, runId, taskType, charged. */
    private static final DefaultRedisScript<String> REQUEUE = new DefaultRedisScript<>(FENCE + """
            local id = redis.call('XADD', KEYS[1], '*', 'envelope', ARGV[6], 'attempts', ARGV[7],
              'run_id', ARGV[8], 'task_key', ARGV[5], 'task_type', ARGV[9], 'charged', ARGV[10])
            redis.call('HSET', KEYS[2], ARGV[5], id)
            return id
            """, String.class);

    /** KEYS: queue, queues, outstanding. ARGV: group, taskType, envelope, runId, taskKey. */
    private static final DefaultRedisScript<String> ENQUEUE = new DefaultRedisScript<>("""
            pcall(redis.call, 'XGROUP', 'CREATE', KEYS[1], ARGV[1], '0', 'MKSTREAM')
            redis.call('SADD', KEYS[2], ARGV[2])
            local id = redis.call('XADD', KEYS[1], '*', 'envelope', ARGV[3], 'attempts', '0',
              'run_id', ARGV[4], 'task_key', ARGV[5], 'task_type', ARGV[2])
            redis.call('HSET', KEYS[3], ARGV[5], id)
            return id
            """, String.class);

    /** KEYS: queue, queues. ARGV: group, taskType. */
    private static final DefaultRedisScript<Long> ENSURE_GROUP = new DefaultRedisScript<>("""
            pcall(redis.call, 'XGROUP', 'CREATE', KEYS[1], ARGV[1], '0', 'MKSTREAM')
            redis.call('SADD', KEYS[2], ARGV[2])
            return 1
            """, Long.class);

    private static final DefaultRedisScript<String> LAST_ID = new DefaultRedisScript<>("""
            local r = redis.call('XREVRANGE', KEYS[1], '+', '-', 'COUNT', 1)
            if #r == 0 then
              return '0-0'
            end
            return r[1][1]
            """, String.class);

    private final RedisConnections redis;
    private final StringRedisTemplate template;
    private final RedisKeys keys;
    private final String defaultConsumerGroup;
    private final ToLongFunction<String> leaseMsForType;
    private final RedeliveryPolicy policy;
    private final Set<String> knownGroups = ConcurrentHashMap.newKeySet();

    public RedisTaskRouter(RedisConnections redis, String consumerGroup, ToLongFunction<String> leaseMsForType,
                           RedeliveryPolicy policy) {
        this.redis = redis;
        this.template = redis.template();
        this.keys = redis.keys();
        this.defaultConsumerGroup = consumerGroup;
        this.leaseMsForType = leaseMsForType;
        this.policy = policy;
    }

    @Override
    public String enqueue(TaskEnvelope envelope) {
        String json = Jsons.toCompactJson(envelope.undelivered());
        String id = redis.call("enqueue " + envelope.taskKey(), () -> template.execute(ENQUEUE,
                List.of(keys.queue(envelope.taskType()), keys.queues(), keys.outstanding(envelope.runId())),
                defaultConsumerGroup, envelope.taskType(), json, envelope.runId(), envelope.taskKey()));
        knownGroups.add(defaultConsumerGroup + "|" + envelope.taskType());
        log.debug("Enqueued {} {} for run {} as {}", envelope.taskType(), envelope.taskKey(), envelope.runId(), id);
        return id;
    }

    @Override
    public Optional<TaskEnvelope> claim(String consumerGroup, String workerId, Collection<String> taskTypes, Duration timeout) {
        if (taskTypes == null || taskTypes.isEmpty()) {
            throw new IllegalArgumentException("a worker must declare at least one task type");
        }
        List<String> types = List.copyOf(new LinkedHashSet<>(taskTypes));
        for (String type : types) {
            ensureGroup(consumerGroup, type);
        }
        long deadline = System.currentTimeMillis() + Math.max(0L, timeout.toMillis());
        while (true) {
            for (String type : types) {
                Optional<TaskEnvelope> reclaimed = reclaim(consumerGroup, workerId, type);
                if (reclaimed.isPresent()) {
                    return reclaimed;
                }
            }
            long remaining = deadline - System.currentTimeMillis();
            Optional<TaskEnvelope> read = readNew(consumerGroup, workerId, types,
                    Math.max(1L, Math.min(MAX_BLOCK_MS, remaining)), remaining > 0L);
            if (read.isPresent() || deadline - System.currentTimeMillis() <= 0L) {
                return read;
            }
        }
    }

    @SuppressWarnings("unchecked")
    private Optional<TaskEnvelope> readNew(String group, String workerId, List<String> types, long blockMs, boolean block) {
        StreamOffset<String>[] offsets = new StreamOffset[types.size()];
        for (int i = 0; i < types.size(); i++) {
            offsets[i] = StreamOffset.create(keys.queue(types.get(i)), ReadOffset.lastConsumed());
        }
        StreamReadOptions options = StreamReadOptions.empty().count(1);
        if (block) {
            options = options.block(Duration.ofMillis(blockMs));
        }
        StreamReadOptions readOptions = options;
        List<MapRecord<String, String, String>> records = redis.call("claim", () ->
                streams().read(Consumer.from(group, workerId), readOptions, offsets));
        if (records == null || records.isEmpty()) {
            return Optional.empty();
        }
        MapRecord<String, String, String> record = records.get(0);
        return Optional.of(deliver(record.getId().getValue(), record.getValue(), group, workerId, 1L));
    }

    /**
     * Takes over at most one expired message of the type, dead-lettering
     * those whose attempts are used up.
     */
    private Optional<TaskEnvelope> reclaim(String group, String workerId, String type) {
        String queue = keys.queue(type);
        long leaseMs = leaseMsForType.applyAsLong(type);
        PendingMessages pending = redis.call("scan pending " + type, () ->
                streams().pending(queue, group, Range.unbounded(), RECLAIM_SCAN));
        if (pending == null) {
            return Optional.empty();
        }
        for (PendingMessage message : pending) {
            if (message.getElapsedTimeSinceLastDelivery().toMillis() < leaseMs) {
                continue;
            }
            String id = message.getIdAsString();
            Map<String, String> fields = readMessage(queue, id);
            if (fields == null) {
                continue;
            }
            long delivered = message.getTotalDeliveryCount();
            int attempt = attemptsOf(fields) + (int) delivered;
            TaskEnvelope stored = Jsons.fromJson(fields.get("envelope"), TaskEnvelope.class);
            if (attempt >= policy.maxAttempts()) {
                String error = "lease expired (holder " + message.getConsumerName() + ", attempt " + attempt + ")";
                TaskEnvelope held = stored.delivered(id, attempt, token(group, message.getConsumerName(), delivered));
                if (finish(held, TaskOutcome.failed(error, parseLong(fields.get("charged"))))) {
                    log.warn("Dead-lettered {} of run {} after {} attempts: {}", held.taskKey(), held.runId(), attempt, error);
                }
                continue;
            }
            List<MapRecord<String, String, String>> claimed = redis.call("reclaim " + id, () -> streams().claim(queue, group,
                    workerId, RedisStreamCommands.XClaimOptions.minIdle(Duration.ofMillis(leaseMs)).ids(id)));
            if (claimed != null && !claimed.isEmpty() && claimed.get(0).getValue() != null) {
                log.info("Reclaimed {} of run {} from {}", stored.taskKey(), stored.runId(), message.getConsumerName());
                return Optional.of(deliver(id, claimed.get(0).getValue(), group, workerId, delivered + 1L));
            }
        }
        return Optional.empty();
    }

    private TaskEnvelope deliver(String id, Map<String, String> fields, String group, String consumer, long deliveryCount) {
        TaskEnvelope stored = Jsons.fromJson(fields.get("envelope"), TaskEnvelope.class);
        int attempt = attemptsOf(fields) + (int) deliveryCount;
        return stored.delivered(id, attempt, token(group, consumer, deliveryCount));
    }

    @Override
    public boolean ack(TaskEnvelope delivery, TaskOutcome outcome) {
        boolean ok = finish(delivery, outcome);
        if (!ok) {
            log.warn("Rejected ack of {} for {}: lease no longer held", delivery.messageId(), delivery.taskKey());
        }
        return ok;
    }

    @Override
    public NackResult nack(TaskEnvelope delivery, String error, long chargedMicros) {
        long totalCharged = chargedSoFar(delivery) + Math.max(0L, chargedMicros);
        if (delivery.attempt() >= policy.maxAttempts()) {
            if (!finish(delivery, TaskOutcome.failed(error, totalCharged))) {
                log.warn("Rejected nack of {} for {}: lease no longer held", delivery.messageId(), delivery.taskKey());
                return NackResult.STALE_LEASE;
            }
            return NackResult.DEAD_LETTERED;
        }
        if (!requeue(delivery, delivery.attempt(), totalCharged)) {
            log.warn("Rejected nack of {} for {}: lease no longer held", delivery.messageId(), delivery.taskKey());
            return NackResult.STALE_LEASE;
        }
        return NackResult.REQUEUED;
    }

    @Override
    public boolean release(TaskEnvelope delivery, String reason) {
        boolean ok = requeue(delivery, Math.max(0, delivery.attempt() - 1), chargedSoFar(delivery));
        if (ok) {
            log.debug("Released {} of run {}: {}", delivery.taskKey(), delivery.runId(), reason);
        }
        return ok;
    }

    private long chargedSoFar(TaskEnvelope delivery) {
        Map<String, String> fields = readMessage(keys.queue(delivery.taskType()), delivery.messageId());
        return fields == null ? 0L : parseLong(fields.get("charged"));
    }

    private boolean requeue(TaskEnvelope delivery, int countedAttempts, long chargedMicros) {
        Lease lease = Lease.parse(delivery.leaseToken());
        String json = Jsons.toCompactJson(delivery.undelivered());
        String newId = redis.call("requeue " + delivery.messageId(), () -> template.execute(REQUEUE,
                List.of(keys.queue(delivery.taskType()), keys.outstanding(delivery.runId())),
                lease.group(), delivery.messageId(), lease.consumer(), Long.toString(lease.deliveryCount()),
                delivery.taskKey(), json, Integer.toString(countedAttempts), delivery.runId(), delivery.taskType(),
                Long.toString(chargedMicros)));
        return newId != null;
    }

    private boolean finish(TaskEnvelope delivery, TaskOutcome outcome) {
        Lease lease = Lease.parse(delivery.leaseToken());
        String deadStatus = outcome.deadLetters() ? outcome.deadStatus() : "";
        String result = redis.call("finish " + delivery.messageId(), () -> template.execute(FINISH,
                List.of(keys.queue(delivery.taskType()), keys.outstanding(delivery.runId()),
                        keys.events(delivery.runId()), keys.dead()),
                lease.group(), delivery.messageId(), lease.consumer(), Long.toString(lease.deliveryCount()),
                delivery.taskKey(), delivery.runId(), delivery.taskType(), outcome.kind().name(),
                nullToEmpty(outcome.artifactHash()), Long.toString(outcome.costMicros()), nullToEmpty(outcome.detail()),
                Long.toString(Instant.now().toEpochMilli()), deadStatus, Integer.toString(delivery.attempt())));
        return result != null;
    }

    @Override
    public CompletionBatch pollCompletions(String runId, String cursor, int max, Duration timeout) {
        String after = cursor == null || cursor.isBlank() ? "0-0" : cursor.trim();
        StreamReadOptions options = StreamReadOptions.empty().count(Math.max(1, max));
        if (timeout.toMillis() > 0L) {
            options = options.block(timeout);
        }
        StreamReadOptions readOptions = options;
        List<MapRecord<String, String, String>> records = redis.call("poll completions " + runId, () ->
                streams().read(readOptions, StreamOffset.create(keys.events(runId), ReadOffset.from(after))));
        if (records == null || records.isEmpty()) {
            return CompletionBatch.empty(after);
        }
        List<CompletionEvent> events = new ArrayList<>(records.size());
        for (MapRecord<String, String, String> record : records) {
            Map<String, String> f = record.getValue();
            events.add(new CompletionEvent(
                    record.getId().getValue(),
                    f.get("run_id"),
                    f.get("task_key"),
                    f.get("task_type"),
                    TaskOutcome.Kind.valueOf(f.get("outcome")),
                    emptyToNull(f.get("artifact_hash")),
                    parseLong(f.get("cost_micros")),
                    emptyToNull(f.get("detail")),
                    parseLong(f.get("created_at_ms"))
            ));
        }
        return new CompletionBatch(events, events.get(events.size() - 1).cursor());
    }

    @Override
    public String completionCursor(String runId) {
        return redis.call("completion cursor " + runId, () -> template.execute(LAST_ID, List.of(keys.events(runId))));
    }

    @Override
    public Set<String> outstandingTaskKeys(String runId) {
        Set<String> out = redis.call("outstanding keys " + runId, () ->
                template.<String, String>opsForHash().keys(keys.outstanding(runId)));
        return out == null ? Set.of() : new LinkedHashSet<>(out);
    }

    @Override
    public List<DeadLetter> deadLetters(String runId) {
        List<MapRecord<String, String, String>> records = redis.call("dead letters", () ->
                streams().range(keys.dead(), Range.unbounded()));
        List<DeadLetter> out = new ArrayList<>();
        if (records == null) {
            return out;
        }
        for (MapRecord<String, String, String> record : records) {
            Map<String, String> f = record.getValue();
            if (runId != null && !runId.equals(f.get("run_id"))) {
                continue;
            }
            out.add(new DeadLetter(
                    f.get("message_id"),
                    f.get("run_id"),
                    f.get("task_key"),
                    f.get("task_type"),
                    f.get("status"),
                    (int) parseLong(f.get("attempt")),
                    emptyToNull(f.get("last_error")),
                    parseLong(f.get("dead_at_ms"))
            ));
        }
        return out;
    }

    @Override
    public Map<String, Long> queueDepths() {
        Set<String> types = redis.call("queue types", () -> template.opsForSet().members(keys.queues()));
        Map<String, Long> out = new TreeMap<>();
        if (types == null) {
            return out;
        }
        for (String type : types) {
            Long size = redis.call("queue depth " + type, () -> streams().size(keys.queue(type)));
            if (size != null && size > 0L) {
                out.put(type, size);
            }
        }
        return new LinkedHashMap<>(out);
    }

    private void ensureGroup(String group, String type) {
        if (knownGroups.add(group + "|" + type)) {
            redis.call("create group " + type, () ->
                    template.execute(ENSURE_GROUP, List.of(keys.queue(type), keys.queues()), group, type));
        }
    }

    private Map<String, String> readMessage(String queue, String id) {
        List<MapRecord<String, String, String>> records = redis.call("read " + id, () ->
                streams().range(queue, Range.closed(id, id)));
        if (records == null || records.isEmpty()) {
            return null;
        }
        return records.get(0).getValue();
    }

    private StreamOperations<String, String, String> streams() {
        return template.opsForStream();
    }

    private static String token(String group, String consumer, long deliveryCount) {
        return group + "|" + consumer + "|" + deliveryCount;
    }

    private static int attemptsOf(Map<String, String> fields) {
        return (int) parseLong(fields.get("attempts"));
    }

    private static long parseLong(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0L;
        }
        return Long.parseLong(raw.trim());
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    private record Lease(String group, String consumer, long deliveryCount) {
        static Lease parse(String token) {
            int first = token == null ? -1 : token.indexOf('|');
            int last = token == null ? -1 : token.lastIndexOf('|');
            if (first <= 0 || last <= first + 1) {
                throw new IllegalArgumentException("not a Redis lease token: " + token);
            }
            return new Lease(token.substring(0, first), token.substring(first + 1, last),
                    Long.parseLong(token.substring(last + 1)));
        }
    }
}
