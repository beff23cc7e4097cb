package io.thinmesh.cache;

import io.thinmesh.artifact.ArtifactStore;
import io.thinmesh.manifest.ManifestStore;
import io.thinmesh.model.DeadLetter;
import io.thinmesh.model.ManifestEntry;
import io.thinmesh.router.TaskRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory view of one run's manifest, used by the planner to decide which
 * ready tasks need dispatching. {@link #load(String)} must run before the first
 * {@link #resolve}.
 *
 * <p>Not thread-safe; the planner owns it.
 */
public final class ResumeCacheManager {
    private static final Logger log = LoggerFactory.getLogger(ResumeCacheManager.class);
    private static final String SHARED_TYPE = "shared";
    private static final String FAILED_STATUS = "failed";

    private final ManifestStore manifest;
    private final ArtifactStore artifacts;
    private final TaskRouter router;
    private final boolean shareAcrossRuns;

    private final Map<String, ManifestEntry> resolved = new HashMap<>();
    private final Map<String, ManifestEntry> failed = new HashMap<>();
    private final Set<String> pending = new HashSet<>();
    private String runId;

    public ResumeCacheManager(ManifestStore manifest, ArtifactStore artifacts, TaskRouter router, boolean shareAcrossRuns) {
        this.manifest = manifest;
        this.artifacts = artifacts;
        this.router = router;
        this.shareAcrossRuns = shareAcrossRuns;
    }

    public LoadSummary load(String runId) {
        return load(runId, false);
    }

    /**
     * Replays the run's manifest and seeds {@code Pending} from the router's
     * outstanding messages for the run. Dead letters that never reached the
     * manifest (no planner was polling when the router produced them) are
     * recorded as failed, unless {@code readOnly}.
     */
    public LoadSummary load(String runId, boolean readOnly) {
        this.runId = runId;
        resolved.clear();
        failed.clear();
        pending.clear();
        List<ManifestEntry> entries = manifest.replay(runId);
        for (ManifestEntry entry : entries) {
            switch (entry.resolution()) {
                case DONE -> {
                    resolved.putIfAbsent(entry.taskKey(), entry);
                    failed.remove(entry.taskKey());
                }
                case FAILED -> {
                    if (!resolved.containsKey(entry.taskKey())) {
                        failed.put(entry.taskKey(), entry);
                    }
                }
                case INVALIDATED -> {
                    ManifestEntry current = resolved.get(entry.taskKey());
                    if (current != null && current.artifactHash().equals(entry.artifactHash())) {
                        resolved.remove(entry.taskKey());
                    }
                }
            }
        }
        int recovered = 0;
        for (DeadLetter dead : router.deadLetters(runId)) {
            String key = dead.taskKey();
            if (!FAILED_STATUS.equals(dead.status()) || resolved.containsKey(key) || failed.containsKey(key)) {
                continue;
            }
            ManifestEntry entry = ManifestEntry.failed(key, dead.taskType(), dead.lastError(), 0L, dead.deadAtMs());
            if (!readOnly) {
                manifest.recordFailed(runId, key, dead.taskType(), dead.lastError(), 0L);
            }
            failed.put(key, entry);
            recovered++;
        }
        if (recovered > 0) {
            log.warn("Run {} had {} dead letters missing from its manifest", runId, recovered);
        }
        for (String key : router.outstandingTaskKeys(runId)) {
            if (!resolved.containsKey(key) && !failed.containsKey(key)) {
                pending.add(key);
            }
        }
        log.info("Loaded manifest of run {}: {} entries, {} resolved, {} failed, {} pending",
                runId, entries.size(), resolved.size(), failed.size(), pending.size());
        return new LoadSummary(entries.size(), resolved.size(), failed.size(), pending.size());
    }

    public Resolution resolve(String taskKey) {
        return resolve(taskKey, SHARED_TYPE);
    }

    /**
     * @param taskType recorded when a cross-run hit is copied into this run
     */
    public Resolution resolve(String taskKey, String taskType) {
        if (runId == null) {
            throw new IllegalStateException("load(runId) must be called before resolve");
        }
        ManifestEntry entry = resolved.get(taskKey);
        if (entry != null) {
            if (artifacts.exists(entry.artifactHash())) {
                return Resolution.resolved(entry.artifactHash());
            }
            log.warn("Artifact {} recorded for task {} of run {} is missing; recomputing",
                    entry.artifactHash(), taskKey, runId);
            manifest.invalidate(runId, taskKey, entry.taskType(), entry.artifactHash(), "artifact missing from store");
            resolved.remove(taskKey);
        }
        if (pending.contains(taskKey)) {
            return Resolution.pending();
        }
        if (shareAcrossRuns) {
            Optional<String> shared = manifest.globalResolution(taskKey);
            if (shared.isPresent() && artifacts.exists(shared.get())) {
                String hash = manifest.recordDone(runId, taskKey, taskType, shared.get(), 0L).artifactHash();
                markResolved(taskKey, taskType, hash, 0L);
                log.debug("Task {} resolved from another run as {}", taskKey, hash);
                return Resolution.resolved(hash);
            }
        }
        return Resolution.absent();
    }

    /**
     * Like {@link #resolve(String)} but without touching the artifact store or
     * the manifest; used for read-only status views.
     */
    public Resolution peek(String taskKey) {
        ManifestEntry entry = resolved.get(taskKey);
        if (entry != null) {
            return Resolution.resolved(entry.artifactHash());
        }
        return pending.contains(taskKey) ? Resolution.pending() : Resolution.absent();
    }

    public boolean isResolved(String taskKey) {
        return resolved.containsKey(taskKey);
    }

    public void markPending(String taskKey) {
        pending.add(taskKey);
    }

    public void markResolved(String taskKey, String taskType, String artifactHash, long costMicros) {
        pending.remove(taskKey);
        failed.remove(taskKey);
        resolved.putIfAbsent(taskKey, ManifestEntry.done(taskKey, taskType, artifactHash, costMicros, System.currentTimeMillis()));
    }

    public void markSettled(String taskKey) {
        pending.remove(taskKey);
    }

    public boolean isFailed(String taskKey) {
        return failed.containsKey(taskKey);
    }

    public void markFailed(String taskKey, String taskType, String detail, long costMicros) {
        pending.remove(taskKey);
        if (!resolved.containsKey(taskKey)) {
            failed.putIfAbsent(taskKey, ManifestEntry.failed(taskKey, taskType, detail, costMicros, System.currentTimeMillis()));
        }
    }

    public Map<String, ManifestEntry> failedEntries() {
        return Map.copyOf(failed);
    }

    public int resolvedCount() {
        return resolved.size();
    }

    public record LoadSummary(int entries, int resolved, int failed, int pending) {
    }
}
