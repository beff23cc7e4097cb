package io.thinmesh.planner;

import io.thinmesh.artifact.ArtifactStore;
import io.thinmesh.cache.Resolution;
import io.thinmesh.cache.ResumeCacheManager;
import io.thinmesh.cache.TaskKeys;
import io.thinmesh.cost.CostGuard;
import io.thinmesh.cost.Reservation;
import io.thinmesh.error.RunSpecException;
import io.thinmesh.manifest.ManifestStore;
import io.thinmesh.model.CompletionBatch;
import io.thinmesh.model.CompletionEvent;
import io.thinmesh.model.LedgerSnapshot;
import io.thinmesh.model.NodeState;
import io.thinmesh.model.RunRecord;
import io.thinmesh.model.RunStatus;
import io.thinmesh.model.TaskEnvelope;
import io.thinmesh.model.TaskOutcome;
import io.thinmesh.observability.AuditLogger;
import io.thinmesh.router.TaskRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Drives one run's DAG: dispatches ready tasks that the manifest does not
 * already resolve and reacts to completion events keyed by task key, in
 * whatever order they arrive. The planner is the only component with
 * cross-task knowledge; workers see single envelopes.
 */
public final class Planner {
    private static final Logger log = LoggerFactory.getLogger(Planner.class);
    private static final int POLL_BATCH = 256;
    private static final String ACTOR = "planner";

    private final ManifestStore manifest;
    private final ArtifactStore artifacts;
    private final TaskRouter router;
    private final CostGuard costGuard;
    private final AuditLogger audit;
    private final RunSpecLoader specs;
    private final Options options;

    public Planner(ManifestStore manifest, ArtifactStore artifacts, TaskRouter router, CostGuard costGuard,
                   AuditLogger audit, Options options) {
        this.manifest = manifest;
        this.artifacts = artifacts;
        this.router = router;
        this.costGuard = costGuard;
        this.audit = audit;
        this.specs = new RunSpecLoader(artifacts);
        this.options = options;
    }

    /**
     * Stores the spec's inputs and the resolved spec, and registers the run.
     * Submitting the same spec again under the same id is a no-op.
     *
     * @throws RunSpecException if the spec is invalid or the id is taken by a different spec
     */
    public RunRecord submit(String runId, RunSpec spec, Path baseDir) {
        if (runId == null || runId.isBlank()) {
            throw new RunSpecException("run id must not be blank");
        }
        TaskGraph.build(resolvedShape(spec), options.paidType());
        RunSpec resolved = specs.resolveInputs(spec, baseDir);
        TaskGraph.build(resolved, options.paidType());
        String specHash = specs.store(resolved);
        RunRecord record = manifest.createRunIfAbsent(runId, specHash);
        if (!record.specHash().equals(specHash)) {
            throw new RunSpecException("run " + runId + " already exists with a different spec ("
                    + record.specHash() + "); use resume to continue it");
        }
        audit.log(AuditLogger.AuditEvent.ofRun("run.submit", ACTOR, "accepted", runId,
                Map.of("spec_hash", specHash, "tasks", resolved.tasks().size())));
        log.info("Run {} registered with spec {} ({} tasks)", runId, specHash, resolved.tasks().size());
        return record;
    }

    /**
     * Plans and waits until the graph drains, the run is cancelled or halted,
     * or the configured max wait elapses. Safe to call again on the same run:
     * that is a resume.
     */
    public RunOutcome run(String runId) {
        RunRecord record = manifest.findRun(runId)
                .orElseThrow(() -> new RunSpecException("unknown run " + runId));
        TaskGraph graph = TaskGraph.build(specs.loadStored(record.specHash()), options.paidType());
        if (record.cancelled()) {
            manifest.updateRunStatus(runId, RunStatus.CANCELLED);
            return new RunState(runId, graph).outcome(RunStatus.CANCELLED, true, null);
        }
        manifest.updateRunStatus(runId, RunStatus.RUNNING);

        // Cursor first: events landing while the manifest loads are then seen twice, never missed.
        String cursor = router.completionCursor(runId);
        ResumeCacheManager cache = new ResumeCacheManager(manifest, artifacts, router, options.shareAcrossRuns());
        ResumeCacheManager.LoadSummary loaded = cache.load(runId);
        for (String failedKey : cache.failedEntries().keySet()) {
            costGuard.release(runId, Reservation.idFor(runId, failedKey));
        }
        audit.log(AuditLogger.AuditEvent.ofRun("run.start", ACTOR, "running", runId,
                Map.of("resolved", loaded.resolved(), "pending", loaded.pending(), "tasks", graph.size())));

        RunState state = new RunState(runId, graph);
        long deadline = options.maxWait() == null ? Long.MAX_VALUE
                : System.currentTimeMillis() + options.maxWait().toMillis();
        boolean cancelled = false;
        boolean timedOut = false;
        boolean halted = false;
        String abortReason = null;
        while (true) {
            if (manifest.isCancelled(runId)) {
                cancelled = true;
                break;
            }
            halted = costGuard.isHalted(runId);
            state.advance(cache, halted, false);
            if (state.count(NodeState.DISPATCHED) == 0) {
                break;
            }
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0L) {
                timedOut = true;
                break;
            }
            Duration wait = Duration.ofMillis(Math.min(options.pollTimeout().toMillis(), remaining));
            CompletionBatch batch = router.pollCompletions(runId, cursor, POLL_BATCH, wait);
            cursor = batch.cursor();
            for (CompletionEvent event : batch.events()) {
                String reason = state.apply(event, cache);
                if (reason != null && abortReason == null) {
                    abortReason = reason;
                }
            }
            if (abortReason != null) {
                break;
            }
        }

        RunStatus status;
        if (abortReason != null) {
            status = RunStatus.FAILED;
        } else if (cancelled) {
            status = RunStatus.CANCELLED;
        } else if (timedOut) {
            status = RunStatus.RUNNING;
        } else if (halted && !state.allDone()) {
            status = RunStatus.HALTED;
        } else if (state.allDone()) {
            status = RunStatus.COMPLETED;
        } else {
            status = RunStatus.FAILED;
        }
        if (status != RunStatus.RUNNING) {
            manifest.updateRunStatus(runId, status);
        }
        RunOutcome outcome = state.outcome(status, !timedOut, abortReason);
        audit.log(AuditLogger.AuditEvent.ofRun("run.finish", ACTOR, status.name().toLowerCase(), runId,
                Map.of("dispatched", outcome.dispatched(), "cache_hits", outcome.cacheHits(),
                        "unfinished", outcome.unfinishedTasks().size(), "finished", outcome.finished())));
        log.info("Run {} ended planning session as {} (dispatched={}, cache_hits={}, unfinished={})",
                runId, status, outcome.dispatched(), outcome.cacheHits(), outcome.unfinishedTasks());
        return outcome;
    }

    /**
     * Node states as the manifest and queue see them, without dispatching,
     * invalidating or copying anything.
     */
    public RunReport inspect(String runId) {
        RunRecord record = manifest.findRun(runId)
                .orElseThrow(() -> new RunSpecException("unknown run " + runId));
        TaskGraph graph = TaskGraph.build(specs.loadStored(record.specHash()), options.paidType());
        ResumeCacheManager cache = new ResumeCacheManager(manifest, artifacts, router, false);
        cache.load(runId, true);
        RunState state = new RunState(runId, graph);
        state.advance(cache, false, true);
        LedgerSnapshot ledger = costGuard.snapshot(runId).orElse(null);
        return new RunReport(record, Map.copyOf(state.states), state.counts(), Map.copyOf(state.keys), ledger);
    }

    /**
     * Validation before input resolution: literal inputs count as artifact
     * references so that structure errors surface before anything is stored.
     */
    private static RunSpec resolvedShape(RunSpec spec) {
        List<RunSpec.TaskSpec> tasks = new ArrayList<>();
        for (RunSpec.TaskSpec task : spec.tasks()) {
            List<RunSpec.InputSpec> inputs = new ArrayList<>();
            for (RunSpec.InputSpec input : task.inputs()) {
                if (input == null || input.kinds() != 1) {
                    throw new RunSpecException("task " + task.id() + ": each input needs exactly one of text, file, artifact");
                }
                inputs.add(RunSpec.InputSpec.ofArtifact("0".repeat(64)));
            }
            tasks.add(task.withInputs(inputs));
        }
        return new RunSpec(tasks);
    }

    private final class RunState {
        private final String runId;
        private final TaskGraph graph;
        private final Map<String, NodeState> states = new LinkedHashMap<>();
        private final Map<String, String> keys = new HashMap<>();
        private final Map<String, String> outputs = new HashMap<>();
        private final Map<String, List<String>> nodesByKey = new HashMap<>();
        private final Set<String> held = new HashSet<>();
        private int dispatched;
        private int cacheHits;

        RunState(String runId, TaskGraph graph) {
            this.runId = runId;
            this.graph = graph;
            for (TaskGraph.Node node : graph.topologicalOrder()) {
                states.put(node.id(), NodeState.BLOCKED);
            }
        }

        /**
         * Moves nodes forward until nothing changes. In {@code readOnly} mode
         * absent keys stay READY (or FAILED when the manifest says so) and
         * nothing is enqueued.
         */
        void advance(ResumeCacheManager cache, boolean halted, boolean readOnly) {
            held.clear();
            boolean changed = true;
            while (changed) {
                changed = false;
                for (TaskGraph.Node node : graph.topologicalOrder()) {
                    NodeState current = states.get(node.id());
                    if (current == NodeState.BLOCKED) {
                        NodeState next = unblock(node);
                        if (next != current) {
                            states.put(node.id(), next);
                            changed = true;
                            current = next;
                        }
                    }
                    if (current == NodeState.READY && !held.contains(node.id())) {
                        NodeState next = readOnly ? peek(node, cache) : dispatch(node, cache, halted);
                        if (next != NodeState.READY) {
                            states.put(node.id(), next);
                            changed = true;
                        }
                    }
                }
            }
        }

        private NodeState unblock(TaskGraph.Node node) {
            boolean allDone = true;
            for (String dep : node.dependsOn()) {
                NodeState depState = states.get(dep);
                if (depState == NodeState.FAILED || depState == NodeState.SKIPPED) {
                    return node.bestEffort() ? NodeState.SKIPPED : NodeState.BLOCKED;
                }
                if (depState != NodeState.DONE) {
                    allDone = false;
                }
            }
            return allDone ? NodeState.READY : NodeState.BLOCKED;
        }

        private String keyOf(TaskGraph.Node node) {
            return keys.computeIfAbsent(node.id(), id -> {
                List<String> inputs = new ArrayList<>(node.literalInputs());
                for (String dep : node.dependsOn()) {
                    inputs.add(outputs.get(dep));
                }
                String key = TaskKeys.derive(node.type(), inputs, node.params());
                nodesByKey.computeIfAbsent(key, k -> new ArrayList<>()).add(id);
                return key;
            });
        }

        private List<String> inputsOf(TaskGraph.Node node) {
            List<String> inputs = new ArrayList<>(node.literalInputs());
            for (String dep : node.dependsOn()) {
                inputs.add(outputs.get(dep));
            }
            return inputs;
        }

        private NodeState dispatch(TaskGraph.Node node, ResumeCacheManager cache, boolean halted) {
            String key = keyOf(node);
            Resolution resolution = cache.resolve(key, node.type());
            switch (resolution.kind()) {
                case RESOLVED -> {
                    outputs.put(node.id(), resolution.artifactHash());
                    cacheHits++;
                    log.debug("Task {} ({}) of run {} already resolved", node.id(), key, runId);
                    return NodeState.DONE;
                }
                case PENDING -> {
                    return NodeState.DISPATCHED;
                }
                default -> {
                    if (cache.isFailed(key)) {
                        return NodeState.FAILED;
                    }
                    if (halted && node.paid()) {
                        held.add(node.id());
                        return NodeState.READY;
                    }
                    router.enqueue(TaskEnvelope.of(runId, key, node.type(), inputsOf(node), node.params()));
                    cache.markPending(key);
                    dispatched++;
                    audit.log(AuditLogger.AuditEvent.of("task.dispatch", ACTOR, "task/" + key, "enqueued",
                            runId, key, Map.of("node", node.id(), "task_type", node.type())));
                    log.debug("Dispatched task {} ({}) of run {}", node.id(), key, runId);
                    return NodeState.DISPATCHED;
                }
            }
        }

        private NodeState peek(TaskGraph.Node node, ResumeCacheManager cache) {
            String key = keyOf(node);
            Resolution resolution = cache.peek(key);
            switch (resolution.kind()) {
                case RESOLVED -> {
                    outputs.put(node.id(), resolution.artifactHash());
                    return NodeState.DONE;
                }
                case PENDING -> {
                    return NodeState.DISPATCHED;
                }
                default -> {
                    if (cache.isFailed(key)) {
                        return NodeState.FAILED;
                    }
                    held.add(node.id());
                    return NodeState.READY;
                }
            }
        }

        /**
         * @return an abort reason for integrity violations, else null
         */
        String apply(CompletionEvent event, ResumeCacheManager cache) {
            List<String> ids = nodesByKey.get(event.taskKey());
            if (ids == null) {
                log.debug("Ignoring completion for unplanned key {} of run {}", event.taskKey(), runId);
                return null;
            }
            switch (event.outcome()) {
                case DONE -> {
                    cache.markResolved(event.taskKey(), event.taskType(), event.artifactHash(), event.costMicros());
                    for (String id : ids) {
                        NodeState current = states.get(id);
                        if (current == NodeState.DISPATCHED || current == NodeState.FAILED) {
                            outputs.put(id, event.artifactHash());
                            states.put(id, NodeState.DONE);
                        }
                    }
                }
                case FAILED, ABORTED -> {
                    cache.markSettled(event.taskKey());
                    costGuard.release(runId, Reservation.idFor(runId, event.taskKey()));
                    if (cache.isResolved(event.taskKey())) {
                        // a late dead letter for a key that did finish
                        return null;
                    }
                    if (!cache.isFailed(event.taskKey())) {
                        manifest.recordFailed(runId, event.taskKey(), event.taskType(), event.detail(), event.costMicros());
                        cache.markFailed(event.taskKey(), event.taskType(), event.detail(), event.costMicros());
                    }
                    moveAll(ids, NodeState.DISPATCHED, NodeState.FAILED);
                    audit.log(AuditLogger.AuditEvent.of("task.failed", ACTOR, "task/" + event.taskKey(),
                            event.outcome().name().toLowerCase(), runId, event.taskKey(),
                            Map.of("detail", event.detail() == null ? "" : event.detail())));
                    log.warn("Task {} of run {} failed: {}", ids, runId, event.detail());
                    if (event.outcome() == TaskOutcome.Kind.ABORTED) {
                        return event.detail() == null ? "integrity violation" : event.detail();
                    }
                }
                case CANCELLED, HALTED -> {
                    cache.markSettled(event.taskKey());
                    if (event.outcome() == TaskOutcome.Kind.CANCELLED) {
                        costGuard.release(runId, Reservation.idFor(runId, event.taskKey()));
                    }
                    moveAll(ids, NodeState.DISPATCHED, NodeState.READY);
                }
            }
            return null;
        }

        private void moveAll(List<String> ids, NodeState from, NodeState to) {
            for (String id : ids) {
                if (states.get(id) == from) {
                    states.put(id, to);
                }
            }
        }

        int count(NodeState state) {
            int n = 0;
            for (NodeState s : states.values()) {
                if (s == state) {
                    n++;
                }
            }
            return n;
        }

        boolean allDone() {
            return count(NodeState.DONE) == states.size();
        }

        Map<NodeState, Integer> counts() {
            Map<NodeState, Integer> out = new EnumMap<>(NodeState.class);
            for (NodeState s : NodeState.values()) {
                out.put(s, count(s));
            }
            return out;
        }

        RunOutcome outcome(RunStatus status, boolean finished, String abortReason) {
            List<String> unfinished = new ArrayList<>();
            for (Map.Entry<String, NodeState> e : states.entrySet()) {
                if (e.getValue() != NodeState.DONE) {
                    unfinished.add(e.getKey() + ":" + e.getValue().name().toLowerCase());
                }
            }
            return new RunOutcome(runId, status, finished, counts(), dispatched, cacheHits, unfinished, abortReason);
        }
    }

    /**
     * @param paidType   whether a task type makes paid calls, for nodes that do not say
     * @param maxWait    null waits until the graph drains
     */
    public record Options(boolean shareAcrossRuns, Duration pollTimeout, Duration maxWait, Predicate<String> paidType) {
        public Options {
            pollTimeout = pollTimeout == null ? Duration.ofSeconds(1) : pollTimeout;
            paidType = paidType == null ? type -> false : paidType;
        }
    }
}
