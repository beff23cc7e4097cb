package io.thinmesh.worker;

import io.thinmesh.artifact.ArtifactRef;
import io.thinmesh.artifact.ArtifactStore;
import io.thinmesh.cache.TaskKeys;
import io.thinmesh.cost.CostGuard;
import io.thinmesh.cost.Reservation;
import io.thinmesh.error.IntegrityException;
import io.thinmesh.error.TaskCancelledException;
import io.thinmesh.error.TaskExecutionException;
import io.thinmesh.error.TransientStorageException;
import io.thinmesh.manifest.ManifestStore;
import io.thinmesh.model.ManifestEntry;
import io.thinmesh.model.NackResult;
import io.thinmesh.model.RecordResult;
import io.thinmesh.model.TaskEnvelope;
import io.thinmesh.model.TaskOutcome;
import io.thinmesh.observability.AuditLogger;
import io.thinmesh.router.TaskRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Stateless worker harness: claim one envelope, execute it with the matching
 * {@link TaskExecutor}, store the output, record it in the manifest and
 * acknowledge. Everything a worker knows about a task comes from the envelope,
 * so any number of agents may share a queue.
 *
 * <p>The manifest is recorded before the ack, and the cost is settled between
 * the two. A crash after the record leaves an unacknowledged message whose
 * redelivery finds the key resolved and acks without executing again.
 */
public final class WorkerAgent {
    private static final Logger log = LoggerFactory.getLogger(WorkerAgent.class);
    private static final long CANCEL_CHECK_INTERVAL_MS = 500L;

    private final String workerId;
    private final String consumerGroup;
    private final ExecutorRegistry executors;
    private final TaskRouter router;
    private final ArtifactStore artifacts;
    private final ManifestStore manifest;
    private final CostGuard costGuard;
    private final AuditLogger audit;
    private final Duration pollTimeout;

    public WorkerAgent(String workerId, String consumerGroup, ExecutorRegistry executors, TaskRouter router,
                       ArtifactStore artifacts, ManifestStore manifest, CostGuard costGuard, AuditLogger audit,
                       Duration pollTimeout) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("worker id must not be blank");
        }
        if (executors.taskTypes().isEmpty()) {
            throw new IllegalArgumentException("worker " + workerId + " declares no task types");
        }
        this.workerId = workerId;
        this.consumerGroup = consumerGroup;
        this.executors = executors;
        this.router = router;
        this.artifacts = artifacts;
        this.manifest = manifest;
        this.costGuard = costGuard;
        this.audit = audit;
        this.pollTimeout = pollTimeout;
    }

    public String workerId() {
        return workerId;
    }

    /**
     * Claim cycles until {@code running} turns false. Transient storage errors
     * are logged and the loop continues after the next poll.
     */
    public void runLoop(AtomicBoolean running) {
        log.info("Worker {} started for task types {}", workerId, executors.taskTypes());
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                runOnce();
            } catch (TransientStorageException e) {
                log.warn("Worker {} hit a storage outage, backing off: {}", workerId, e.getMessage());
                sleepQuietly(pollTimeout.toMillis());
            }
        }
        log.info("Worker {} stopped", workerId);
    }

    public WorkerOutcome runOnce() {
        Optional<TaskEnvelope> claimed = router.claim(consumerGroup, workerId, executors.taskTypes(), pollTimeout);
        if (claimed.isEmpty()) {
            return WorkerOutcome.idle();
        }
        TaskEnvelope delivery = claimed.get();
        try {
            return process(delivery);
        } catch (TransientStorageException e) {
            // Backends were retried already; give the message back uncounted.
            log.warn("Worker {} releasing task {} after storage failure: {}", workerId, delivery.taskKey(), e.getMessage());
            releaseReservationQuietly(delivery);
            router.release(delivery, "storage unavailable: " + e.getMessage());
            return outcome(WorkerOutcome.Disposition.RELEASED, delivery, e.getMessage());
        }
    }

    private WorkerOutcome process(TaskEnvelope delivery) {
        String runId = delivery.runId();
        String taskKey = delivery.taskKey();
        String reservationId = Reservation.idFor(runId, taskKey);

        if (manifest.isCancelled(runId)) {
            costGuard.release(runId, reservationId);
            return acknowledge(delivery, TaskOutcome.cancelled("run cancelled"), WorkerOutcome.Disposition.CANCELLED);
        }

        Optional<ManifestEntry> recorded = manifest.resolved(runId, taskKey);
        if (recorded.isPresent() && artifacts.exists(recorded.get().artifactHash())) {
            // A previous holder recorded the result but never acknowledged.
            costGuard.settle(runId, reservationId, recorded.get().costChargedMicros());
            log.info("Task {} of run {} already resolved as {}, acknowledging without execution",
                    taskKey, runId, recorded.get().artifactHash());
            return acknowledge(delivery, TaskOutcome.done(recorded.get().artifactHash(), 0L),
                    WorkerOutcome.Disposition.ALREADY_DONE);
        }

        TaskExecutor executor = executors.find(delivery.taskType()).orElse(null);
        if (executor == null) {
            return failAttempt(delivery, reservationId, "no executor for task type " + delivery.taskType(), 0L);
        }

        if (!TaskKeys.derive(delivery.taskType(), delivery.inputHashes(), delivery.params()).equals(taskKey)) {
            return abort(delivery, "task key does not derive from the declared inputs");
        }

        List<byte[]> inputs = new ArrayList<>(delivery.inputHashes().size());
        for (String hash : delivery.inputHashes()) {
            Optional<byte[]> bytes;
            try {
                bytes = artifacts.get(hash);
            } catch (IntegrityException e) {
                return abort(delivery, "input " + hash + " is corrupt: " + e.getMessage());
            }
            if (bytes.isEmpty()) {
                log.warn("Input artifact {} of task {} is missing", hash, taskKey);
                releaseReservationQuietly(delivery);
                return acknowledge(delivery, TaskOutcome.failed("input artifact missing: " + hash, 0L),
                        WorkerOutcome.Disposition.DEAD_LETTERED);
            }
            inputs.add(bytes.get());
        }

        TaskContext context = new TaskContext(runId, taskKey, delivery.taskType(), delivery.attempt(),
                delivery.inputHashes(), inputs, delivery.params(), cancellationCheck(runId));

        if (executor.paid()) {
            long estimate;
            try {
                estimate = Math.max(0L, executor.estimateCostMicros(context));
            } catch (TaskExecutionException e) {
                return failAttempt(delivery, reservationId, "cost estimate failed: " + e.getMessage(), e.costChargedMicros());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                router.release(delivery, "worker interrupted");
                return outcome(WorkerOutcome.Disposition.RELEASED, delivery, "interrupted");
            } catch (Exception e) {
                return failAttempt(delivery, reservationId, "cost estimate failed: " + e.getMessage(), 0L);
            }
            Reservation reservation = costGuard.reserve(runId, taskKey, estimate);
            if (!reservation.granted()) {
                // a holder that crashed earlier may have left a reservation under this id
                costGuard.release(runId, reservationId);
                audit.log(AuditLogger.AuditEvent.of("cost.halt", workerId, "task/" + taskKey, "denied",
                        runId, taskKey, Map.of("estimate_micros", estimate)));
                return acknowledge(delivery, TaskOutcome.halted("cost ceiling reached"), WorkerOutcome.Disposition.HALTED);
            }
        }

        TaskResult result;
        try {
            result = executor.execute(context);
        } catch (TaskCancelledException e) {
            costGuard.release(runId, reservationId);
            router.release(delivery, "run cancelled during execution");
            log.info("Task {} of run {} stopped early: run cancelled", taskKey, runId);
            return outcome(WorkerOutcome.Disposition.RELEASED, delivery, "cancelled during execution");
        } catch (TaskExecutionException e) {
            return failAttempt(delivery, reservationId, e.getMessage(), e.costChargedMicros());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            costGuard.release(runId, reservationId);
            router.release(delivery, "worker interrupted");
            return outcome(WorkerOutcome.Disposition.RELEASED, delivery, "interrupted");
        } catch (TransientStorageException e) {
            throw e;
        } catch (Exception e) {
            return failAttempt(delivery, reservationId, e.getClass().getSimpleName() + ": " + e.getMessage(), 0L);
        }

        ArtifactRef stored = artifacts.put(result.output(), result.contentType());
        RecordResult record = manifest.recordDone(runId, taskKey, delivery.taskType(), stored.hash(), result.costMicros());
        if (!record.recorded()) {
            log.info("Task {} of run {} was recorded concurrently as {}; keeping the first result",
                    taskKey, runId, record.artifactHash());
        }
        costGuard.settle(runId, reservationId, record.recorded() ? result.costMicros() : record.costChargedMicros());
        return acknowledge(delivery, TaskOutcome.done(record.artifactHash(), record.recorded() ? result.costMicros() : 0L),
                WorkerOutcome.Disposition.DONE);
    }

    private WorkerOutcome failAttempt(TaskEnvelope delivery, String reservationId, String error, long chargedMicros) {
        costGuard.settle(delivery.runId(), reservationId, chargedMicros);
        NackResult result = router.nack(delivery, error, chargedMicros);
        log.warn("Task {} of run {} failed on attempt {}: {} ({})",
                delivery.taskKey(), delivery.runId(), delivery.attempt(), error, result);
        return switch (result) {
            case REQUEUED -> outcome(WorkerOutcome.Disposition.RETRY, delivery, error);
            case DEAD_LETTERED -> {
                audit.log(AuditLogger.AuditEvent.of("task.dead_letter", workerId, "task/" + delivery.taskKey(),
                        "failed", delivery.runId(), delivery.taskKey(),
                        Map.of("attempt", delivery.attempt(), "error", error == null ? "" : error)));
                yield outcome(WorkerOutcome.Disposition.DEAD_LETTERED, delivery, error);
            }
            case STALE_LEASE -> outcome(WorkerOutcome.Disposition.STALE_LEASE, delivery, error);
        };
    }

    private WorkerOutcome abort(TaskEnvelope delivery, String reason) {
        log.error("Integrity violation on task {} of run {}: {}", delivery.taskKey(), delivery.runId(), reason);
        audit.log(AuditLogger.AuditEvent.of("task.integrity", workerId, "task/" + delivery.taskKey(), "aborted",
                delivery.runId(), delivery.taskKey(), Map.of("reason", reason)));
        releaseReservationQuietly(delivery);
        return acknowledge(delivery, TaskOutcome.aborted(reason), WorkerOutcome.Disposition.ABORTED);
    }

    private WorkerOutcome acknowledge(TaskEnvelope delivery, TaskOutcome taskOutcome, WorkerOutcome.Disposition disposition) {
        if (!router.ack(delivery, taskOutcome)) {
            log.warn("Lease on task {} of run {} was lost before the ack", delivery.taskKey(), delivery.runId());
            return outcome(WorkerOutcome.Disposition.STALE_LEASE, delivery, "lease lost before ack");
        }
        log.debug("Worker {} acknowledged task {} as {}", workerId, delivery.taskKey(), taskOutcome.kind());
        return outcome(disposition, delivery, taskOutcome.detail());
    }

    private void releaseReservationQuietly(TaskEnvelope delivery) {
        try {
            costGuard.release(delivery.runId(), Reservation.idFor(delivery.runId(), delivery.taskKey()));
        } catch (TransientStorageException e) {
            // The next delivery re-reserves under the same id and replaces the amount.
            log.warn("Could not release reservation of task {}: {}", delivery.taskKey(), e.getMessage());
        }
    }

    private BooleanSupplier cancellationCheck(String runId) {
        long[] lastCheck = {0L};
        boolean[] cancelled = {false};
        return () -> {
            long now = System.currentTimeMillis();
            if (!cancelled[0] && now - lastCheck[0] >= CANCEL_CHECK_INTERVAL_MS) {
                lastCheck[0] = now;
                cancelled[0] = manifest.isCancelled(runId);
            }
            return cancelled[0];
        };
    }

    private WorkerOutcome outcome(WorkerOutcome.Disposition disposition, TaskEnvelope delivery, String message) {
        return new WorkerOutcome(disposition, delivery.runId(), delivery.taskKey(), delivery.messageId(), message);
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(Math.max(1L, millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
