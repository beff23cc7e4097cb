package io.thinmesh.redis;

import io.thinmesh.manifest.ManifestEntries;
import io.thinmesh.manifest.ManifestStore;
import io.thinmesh.model.ManifestEntry;
import io.thinmesh.model.RecordResult;
import io.thinmesh.model.RunRecord;
import io.thinmesh.model.RunStatus;
import io.thinmesh.util.Hashing;
import io.thinmesh.util.Jsons;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Run registry and manifest in Redis. Per run: an info hash, the manifest
 * list, and a {@code resolved} hash holding the current {@code done} entry per
 * key. Every write that touches more than one key is a Lua script.
 */
public final class RedisManifestStore implements ManifestStore {
    private static final DefaultRedisScript<Long> CREATE_RUN = new DefaultRedisScript<>("""
            if redis.call('EXISTS', KEYS[1]) == 1 then
              return 0
            end
            redis.call('HSET', KEYS[1], 'spec_hash', ARGV[1], 'status', 'RUNNING', 'cancelled', '0',
              'created_at_ms', ARGV[2], 'updated_at_ms', ARGV[2])
            redis.call('SADD', KEYS[2], ARGV[3])
            return 1
            """, Long.class);

    /** KEYS: info. ARGV: field, value, now. */
    private static final DefaultRedisScript<Long> UPDATE_RUN = new DefaultRedisScript<>("""
            if redis.call('EXISTS', KEYS[1]) == 0 then
              return 0
            end
            redis.call('HSET', KEYS[1], ARGV[1], ARGV[2], 'updated_at_ms', ARGV[3])
            return 1
            """, Long.class);

    /** KEYS: resolved, manifest, global. ARGV: taskKey, entry, hash. Returns the earlier entry, if any. */
    private static final DefaultRedisScript<String> RECORD_DONE = new DefaultRedisScript<>("""
            local existing = redis.call('HGET', KEYS[1], ARGV[1])
            if existing then
              return existing
            end
            redis.call('HSET', KEYS[1], ARGV[1], ARGV[2])
            redis.call('RPUSH', KEYS[2], ARGV[2])
            redis.call('HSETNX', KEYS[3], ARGV[1], ARGV[3])
            return false
            """, String.class);

    /** KEYS: resolved, manifest, global. ARGV: taskKey, hash, entry. */
    private static final DefaultRedisScript<Long> INVALIDATE = new DefaultRedisScript<>("""
            local existing = redis.call('HGET', KEYS[1], ARGV[1])
            if not existing or cjson.decode(existing)['artifact_hash'] ~= ARGV[2] then
              return 0
            end
            redis.call('HDEL', KEYS[1], ARGV[1])
            if redis.call('HGET', KEYS[3], ARGV[1]) == ARGV[2] then
              redis.call('HDEL', KEYS[3], ARGV[1])
            end
            redis.call('RPUSH', KEYS[2], ARGV[3])
            return 1
            """, Long.class);

    private final RedisConnections redis;
    private final StringRedisTemplate template;
    private final RedisKeys keys;

    public RedisManifestStore(RedisConnections redis) {
        this.redis = redis;
        this.template = redis.template();
        this.keys = redis.keys();
    }

    @Override
    public RunRecord createRunIfAbsent(String runId, String specHash) {
        redis.call("create run " + runId, () -> template.execute(CREATE_RUN, List.of(keys.runInfo(runId), keys.runs()),
                specHash, Long.toString(Instant.now().toEpochMilli()), runId));
        return findRun(runId).orElseThrow(() -> new IllegalStateException("run " + runId + " vanished after create"));
    }

    @Override
    public Optional<RunRecord> findRun(String runId) {
        Map<String, String> info = redis.call("find run " + runId, () -> hashes().entries(keys.runInfo(runId)));
        if (info == null || info.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new RunRecord(
                runId,
                info.get("spec_hash"),
                RunStatus.valueOf(info.getOrDefault("status", RunStatus.RUNNING.name())),
                "1".equals(info.get("cancelled")),
                Long.parseLong(info.getOrDefault("created_at_ms", "0")),
                Long.parseLong(info.getOrDefault("updated_at_ms", "0"))
        ));
    }

    @Override
    public List<RunRecord> listRuns() {
        Set<String> ids = redis.call("list runs", () -> template.opsForSet().members(keys.runs()));
        List<RunRecord> out = new ArrayList<>();
        if (ids != null) {
            for (String id : ids) {
                findRun(id).ifPresent(out::add);
            }
        }
        out.sort(Comparator.comparingLong(RunRecord::createdAtMs));
        return out;
    }

    @Override
    public void updateRunStatus(String runId, RunStatus status) {
        updateRun(runId, "status", status.name());
    }

    @Override
    public boolean markCancelled(String runId) {
        return updateRun(runId, "cancelled", "1");
    }

    private boolean updateRun(String runId, String field, String value) {
        Long updated = redis.call("update run " + runId, () -> template.execute(UPDATE_RUN, List.of(keys.runInfo(runId)),
                field, value, Long.toString(Instant.now().toEpochMilli())));
        return updated != null && updated == 1L;
    }

    @Override
    public boolean isCancelled(String runId) {
        String flag = redis.call("cancel flag " + runId, () -> hashes().get(keys.runInfo(runId), "cancelled"));
        return "1".equals(flag);
    }

    @Override
    public RecordResult recordDone(String runId, String taskKey, String taskType, String artifactHash, long costMicros) {
        Hashing.requireSha256Hex(artifactHash);
        String entry = Jsons.toCompactJson(ManifestEntry.done(taskKey, taskType, artifactHash, costMicros,
                Instant.now().toEpochMilli()));
        String existing = redis.call("record done " + taskKey, () -> template.execute(RECORD_DONE,
                List.of(keys.resolved(runId), keys.manifest(runId), keys.resolutions()), taskKey, entry, artifactHash));
        if (existing == null) {
            return RecordResult.recorded(artifactHash, costMicros);
        }
        ManifestEntry earlier = ManifestEntries.parse(existing, runId + "/" + taskKey);
        return RecordResult.existing(earlier.artifactHash(), earlier.costChargedMicros());
    }

    @Override
    public void recordFailed(String runId, String taskKey, String taskType, String detail, long costMicros) {
        String entry = Jsons.toCompactJson(ManifestEntry.failed(taskKey, taskType, detail, costMicros,
                Instant.now().toEpochMilli()));
        redis.call("record failed " + taskKey, () -> template.opsForList().rightPush(keys.manifest(runId), entry));
    }

    @Override
    public void invalidate(String runId, String taskKey, String taskType, String artifactHash, String reason) {
        String entry = Jsons.toCompactJson(ManifestEntry.invalidated(taskKey, taskType, artifactHash, reason,
                Instant.now().toEpochMilli()));
        redis.call("invalidate " + taskKey, () -> template.execute(INVALIDATE,
                List.of(keys.resolved(runId), keys.manifest(runId), keys.resolutions()), taskKey, artifactHash, entry));
    }

    @Override
    public List<ManifestEntry> replay(String runId) {
        List<String> rows = redis.call("replay manifest " + runId, () -> template.opsForList().range(keys.manifest(runId), 0, -1));
        List<ManifestEntry> out = new ArrayList<>();
        if (rows == null) {
            return out;
        }
        for (int i = 0; i < rows.size(); i++) {
            out.add(ManifestEntries.parse(rows.get(i), runId + "#" + i));
        }
        return out;
    }

    @Override
    public Optional<ManifestEntry> resolved(String runId, String taskKey) {
        String raw = redis.call("resolve " + taskKey, () -> hashes().get(keys.resolved(runId), taskKey));
        return raw == null ? Optional.empty() : Optional.of(ManifestEntries.parse(raw, runId + "/" + taskKey));
    }

    @Override
    public Optional<String> globalResolution(String taskKey) {
        return Optional.ofNullable(redis.call("global resolve " + taskKey, () -> hashes().get(keys.resolutions(), taskKey)));
    }

    private HashOperations<String, String, String> hashes() {
        return template.opsForHash();
    }
}
