package io.thinmesh.runtime;

import io.thinmesh.artifact.ArtifactRef;
import io.thinmesh.artifact.ArtifactServer;
import io.thinmesh.config.TaskTypeSettings;
import io.thinmesh.config.ThinMeshConfig;
import io.thinmesh.model.DeadLetter;
import io.thinmesh.model.LedgerSnapshot;
import io.thinmesh.model.NodeState;
import io.thinmesh.model.RunRecord;
import io.thinmesh.observability.AuditLogger;
import io.thinmesh.observability.PrometheusFormatter;
import io.thinmesh.planner.Planner;
import io.thinmesh.planner.RunOutcome;
import io.thinmesh.planner.RunReport;
import io.thinmesh.planner.RunSpec;
import io.thinmesh.planner.RunSpecLoader;
import io.thinmesh.util.CostUnits;
import io.thinmesh.worker.EchoExecutor;
import io.thinmesh.worker.ExecutorRegistry;
import io.thinmesh.worker.FailExecutor;
import io.thinmesh.worker.HttpModelGateway;
import io.thinmesh.worker.ModelGatewayExecutor;
import io.thinmesh.worker.ScriptExecutor;
import io.thinmesh.worker.WorkerAgent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * Entry point used by the CLI: one planner plus, optionally, in-process
 * workers over a single {@link OrchestratorContext}.
 */
public final class ThinMeshRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ThinMeshRuntime.class);
    private static final Duration GATEWAY_TIMEOUT = Duration.ofMinutes(5);
    private static final long WORKER_JOIN_MS = 30_000L;
    private static final String ACTOR = "cli";

    private final OrchestratorContext context;
    private final ExecutorRegistry executors;
    private final Predicate<String> paidType;

    public ThinMeshRuntime(OrchestratorContext context, ExecutorRegistry executors) {
        this.context = context;
        this.executors = executors;
        this.paidType = paidTypes(context.config());
    }

    public static ThinMeshRuntime open(ThinMeshConfig config) {
        return new ThinMeshRuntime(Backends.open(config), executorRegistry(config));
    }

    /**
     * Built-in executors plus the script and gateway executors the
     * configuration declares.
     */
    public static ExecutorRegistry executorRegistry(ThinMeshConfig config) {
        ExecutorRegistry registry = new ExecutorRegistry()
                .register(new EchoExecutor())
                .register(new FailExecutor());
        if (config.gatewayUrl() != null && !config.gatewayUrl().isBlank()) {
            registry.register(new ModelGatewayExecutor(new HttpModelGateway(config.gatewayUrl(), GATEWAY_TIMEOUT)));
        }
        for (Map.Entry<String, TaskTypeSettings> e : config.taskTypes().entrySet()) {
            TaskTypeSettings settings = e.getValue();
            if (!settings.isScript()) {
                continue;
            }
            long timeoutMs = settings.maxDurationMs() == null ? config.leaseTimeoutMs() : settings.maxDurationMs();
            long costMicros = 0L;
            if (settings.isPaid()) {
                costMicros = settings.estimatedCost() == null
                        ? config.defaultEstimateMicros()
                        : CostUnits.parseMicros(settings.estimatedCost());
            }
            registry.register(new ScriptExecutor(e.getKey(), settings.command(), timeoutMs, settings.isPaid(), costMicros));
            log.debug("Registered script executor for task type {}", e.getKey());
        }
        return registry;
    }

    private static Predicate<String> paidTypes(ThinMeshConfig config) {
        return type -> {
            TaskTypeSettings settings = config.taskTypes().get(type);
            if (settings != null && settings.paid() != null) {
                return settings.isPaid();
            }
            return ModelGatewayExecutor.TYPE.equals(type);
        };
    }

    public OrchestratorContext context() {
        return context;
    }

    public ExecutorRegistry executors() {
        return executors;
    }

    public Planner planner(Duration maxWait) {
        ThinMeshConfig config = context.config();
        Planner.Options options = new Planner.Options(config.shareAcrossRuns(),
                Duration.ofMillis(config.pollTimeoutMs()), maxWait, paidType);
        return new Planner(context.manifest(), context.artifacts(), context.router(), context.costGuard(),
                context.audit(), options);
    }

    /**
     * Registers the run (or confirms the same spec is already registered)
     * and plans it.
     *
     * @param ceilingMicros null keeps the configured default for a new run
     */
    public RunOutcome run(String runId, Path specFile, Long ceilingMicros, int localWorkers, Duration maxWait) {
        Planner planner = planner(maxWait);
        RunSpec spec = new RunSpecLoader(context.artifacts()).read(specFile);
        Path baseDir = specFile.toAbsolutePath().getParent();
        boolean fresh = context.manifest().findRun(runId).isEmpty();
        planner.submit(runId, spec, baseDir);
        if (ceilingMicros != null) {
            context.costGuard().setCeiling(runId, ceilingMicros);
        } else if (fresh && context.config().costCeilingMicros() >= 0L) {
            context.costGuard().setCeiling(runId, context.config().costCeilingMicros());
        }
        return plan(planner, runId, localWorkers);
    }

    /**
     * Continues a registered run from its manifest. A new ceiling also clears
     * a cost halt.
     */
    public RunOutcome resume(String runId, Long ceilingMicros, int localWorkers, Duration maxWait) {
        Planner planner = planner(maxWait);
        if (ceilingMicros != null) {
            context.costGuard().setCeiling(runId, ceilingMicros);
        }
        context.audit().log(AuditLogger.AuditEvent.ofRun("run.resume", ACTOR, "requested", runId,
                Map.of("ceiling_micros", ceilingMicros == null ? "unchanged" : Long.toString(ceilingMicros))));
        return plan(planner, runId, localWorkers);
    }

    private RunOutcome plan(Planner planner, String runId, int localWorkers) {
        AtomicBoolean running = new AtomicBoolean(true);
        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < localWorkers; i++) {
            WorkerAgent agent = worker("local-" + runId + "-" + i, List.of());
            Thread thread = new Thread(() -> agent.runLoop(running), "thinmesh-worker-" + i);
            thread.setDaemon(true);
            thread.start();
            threads.add(thread);
        }
        try {
            return planner.run(runId);
        } finally {
            running.set(false);
            joinAll(threads);
        }
    }

    private static void joinAll(List<Thread> threads) {
        long deadline = System.currentTimeMillis() + WORKER_JOIN_MS;
        for (Thread thread : threads) {
            long remaining = deadline - System.currentTimeMillis();
            try {
                thread.join(Math.max(1L, remaining));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (thread.isAlive()) {
                log.warn("Local worker {} did not stop within {} ms", thread.getName(), WORKER_JOIN_MS);
            }
        }
    }

    /**
     * @param taskTypes empty means every registered executor
     */
    public WorkerAgent worker(String workerId, Collection<String> taskTypes) {
        ExecutorRegistry registry = taskTypes == null || taskTypes.isEmpty() ? executors : executors.restrictTo(taskTypes);
        ThinMeshConfig config = context.config();
        return new WorkerAgent(workerId, config.consumerGroup(), registry, context.router(), context.artifacts(),
                context.manifest(), context.costGuard(), context.audit(), Duration.ofMillis(config.pollTimeoutMs()));
    }

    public RunReport status(String runId) {
        return planner(null).inspect(runId);
    }

    public CancelOutcome cancel(String runId) {
        boolean cancelled = context.manifest().markCancelled(runId);
        context.audit().log(AuditLogger.AuditEvent.ofRun("run.cancel", ACTOR, cancelled ? "cancelled" : "not_found",
                runId, Map.of()));
        if (cancelled) {
            log.info("Run {} flagged as cancelled", runId);
            return new CancelOutcome(runId, true, "cancel flag set; planner and workers stop at their next check");
        }
        return new CancelOutcome(runId, false, "run not found");
    }

    public List<DeadLetter> deadLetters(String runId) {
        return context.router().deadLetters(runId);
    }

    /**
     * @param runId null reports every registered run
     */
    public StatsOutcome stats(String runId) {
        List<RunStats> runs = new ArrayList<>();
        List<RunRecord> records = runId == null
                ? context.manifest().listRuns()
                : context.manifest().findRun(runId).map(List::of).orElse(List.of());
        Planner planner = planner(null);
        for (RunRecord record : records) {
            RunReport report = planner.inspect(record.runId());
            runs.add(new RunStats(record.runId(), record.status().name(), report.nodeCounts(), report.ledger()));
        }
        return new StatsOutcome(
                context.router().queueDepths(),
                context.router().deadLetters(runId).size(),
                runs,
                context.costGuard().globalSnapshot().orElse(null)
        );
    }

    public String metricsText(String runId) {
        return PrometheusFormatter.format(stats(runId));
    }

    public ArtifactRef putArtifact(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        ArtifactRef ref = context.artifacts().put(bytes, null);
        context.audit().log(AuditLogger.AuditEvent.of("artifact.put", ACTOR, "artifact/" + ref.hash(), "stored",
                null, null, Map.of("size", ref.size(), "source", file.toString())));
        return ref;
    }

    public Optional<byte[]> getArtifact(String hash) {
        return context.artifacts().get(hash);
    }

    public ArtifactServer serveArtifacts(String host, int port, int threads) throws IOException {
        return new ArtifactServer(context.artifacts(), host, port, threads).start();
    }

    @Override
    public void close() {
        context.close();
    }

    public record CancelOutcome(String runId, boolean cancelled, String message) {
    }

    public record RunStats(String runId, String status, Map<NodeState, Integer> nodeCounts, LedgerSnapshot ledger) {
    }

    public record StatsOutcome(
            Map<String, Long> queueDepths,
            int deadLetters,
            List<RunStats> runs,
            LedgerSnapshot globalLedger
    ) {
    }
}
