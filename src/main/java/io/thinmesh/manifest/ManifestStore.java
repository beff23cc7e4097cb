package io.thinmesh.manifest;

import io.thinmesh.model.ManifestEntry;
import io.thinmesh.model.RecordResult;
import io.thinmesh.model.RunRecord;
import io.thinmesh.model.RunStatus;

import java.util.List;
import java.util.Optional;

/**
 * Run registry plus each run's append-only manifest log.
 *
 * <p>A {@code done} resolution is final for its key: {@link #recordDone} is an
 * atomic record-if-absent, and the first recorded hash wins. {@code failed}
 * entries are informational and never resolve a key.
 */
public interface ManifestStore extends AutoCloseable {

    /**
     * Creates the run, or returns the existing record untouched when the id is
     * already registered.
     */
    RunRecord createRunIfAbsent(String runId, String specHash);

    Optional<RunRecord> findRun(String runId);

    List<RunRecord> listRuns();

    void updateRunStatus(String runId, RunStatus status);

    /**
     * @return false if the run does not exist
     */
    boolean markCancelled(String runId);

    boolean isCancelled(String runId);

    RecordResult recordDone(String runId, String taskKey, String taskType, String artifactHash, long costMicros);

    void recordFailed(String runId, String taskKey, String taskType, String detail, long costMicros);

    /**
     * Drops a {@code done} resolution whose artifact can no longer be read, so
     * that the task may be recomputed.
     */
    void invalidate(String runId, String taskKey, String taskType, String artifactHash, String reason);

    /**
     * The run's log in append order.
     *
     * @throws io.thinmesh.error.IntegrityException on an unreadable entry
     */
    List<ManifestEntry> replay(String runId);

    /**
     * The current {@code done} entry for one key of the run.
     */
    Optional<ManifestEntry> resolved(String runId, String taskKey);

    /**
     * Cross-run {@code task_key -> artifact_hash} index.
     */
    Optional<String> globalResolution(String taskKey);

    @Override
    default void close() {
    }
}
