package io.thinmesh.cli;

import io.thinmesh.artifact.ArtifactRef;
import io.thinmesh.artifact.ArtifactServer;
import io.thinmesh.config.ThinMeshConfig;
import io.thinmesh.error.IntegrityException;
import io.thinmesh.error.RunSpecException;
import io.thinmesh.model.DeadLetter;
import io.thinmesh.planner.RunOutcome;
import io.thinmesh.planner.RunReport;
import io.thinmesh.runtime.ThinMeshRuntime;
import io.thinmesh.util.CostUnits;
import io.thinmesh.util.Jsons;
import io.thinmesh.worker.WorkerAgent;
import io.thinmesh.worker.WorkerOutcome;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "thinmesh",
        mixinStandardHelpOptions = true,
        description = "ThinMesh run orchestration CLI",
        subcommands = {
                ThinMeshCommand.RunCommand.class,
                ThinMeshCommand.ResumeCommand.class,
                ThinMeshCommand.WorkerCommand.class,
                ThinMeshCommand.StatusCommand.class,
                ThinMeshCommand.CancelCommand.class,
                ThinMeshCommand.DeadLettersCommand.class,
                ThinMeshCommand.ServeArtifactsCommand.class,
                ThinMeshCommand.ArtifactCommand.class,
                ThinMeshCommand.MetricsCommand.class
        }
)
public final class ThinMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--queue-url"}, description = "Queue backend: sqlite:[file] or redis://host:port[/db]")
    String queueUrl;

    @Option(names = {"--artifact-url"}, description = "Artifact backend: file:[dir] or http://host:port")
    String artifactUrl;

    @Override
    public void run() {
        System.out.println("Use subcommands: run | resume | worker | status | cancel | dead-letters | serve-artifacts | artifact | metrics");
    }

    /**
     * A command line whose exceptions map to the documented exit codes.
     */
    public static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new ThinMeshCommand());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            int code = exitCodeFor(ex);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("error", ex.getClass().getSimpleName());
            payload.put("message", String.valueOf(ex.getMessage()));
            payload.put("exit_code", code);
            System.err.println(Jsons.toJson(payload));
            return code;
        });
        return cmd;
    }

    static int exitCodeFor(Exception ex) {
        if (ex instanceof IntegrityException) {
            return RunOutcome.EXIT_FATAL;
        }
        if (ex instanceof RunSpecException || ex instanceof IllegalArgumentException) {
            return RunOutcome.EXIT_USAGE;
        }
        return RunOutcome.EXIT_FAILED;
    }

    ThinMeshConfig config() {
        ThinMeshConfig.Builder b = ThinMeshConfig.load(root, System.getenv()).toBuilder();
        if (queueUrl != null && !queueUrl.isBlank()) {
            b.queueUrl(queueUrl.trim());
        }
        if (artifactUrl != null && !artifactUrl.isBlank()) {
            b.artifactUrl(artifactUrl.trim());
        }
        return b.build();
    }

    ThinMeshRuntime runtime() {
        return ThinMeshRuntime.open(config());
    }

    private static Long parseCeiling(String raw) {
        return raw == null || raw.isBlank() ? null : CostUnits.parseMicros(raw);
    }

    private static Duration maxWait(Long maxWaitMs) {
        return maxWaitMs == null || maxWaitMs <= 0L ? null : Duration.ofMillis(maxWaitMs);
    }

    @Command(name = "run", description = "Register a run from a spec file and plan it")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        ThinMeshCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Option(names = {"--spec"}, required = true, description = "Run spec JSON file")
        Path spec;

        @Option(names = {"--cost-ceiling"}, description = "Spend ceiling for the run, e.g. 25.00")
        String costCeiling;

        @Option(names = {"--local-workers"}, defaultValue = "0", description = "Workers to run inside this process")
        int localWorkers;

        @Option(names = {"--max-wait-ms"}, description = "Stop planning after this long; the run stays resumable")
        Long maxWaitMs;

        @Override
        public Integer call() {
            try (ThinMeshRuntime runtime = parent.runtime()) {
                RunOutcome outcome = runtime.run(runId, spec, parseCeiling(costCeiling), localWorkers, maxWait(maxWaitMs));
                System.out.println(Jsons.toJson(outcome));
                return outcome.exitCode();
            }
        }
    }

    @Command(name = "resume", description = "Continue a registered run from its manifest")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        ThinMeshCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Option(names = {"--cost-ceiling"}, description = "New spend ceiling; also clears a cost halt")
        String costCeiling;

        @Option(names = {"--local-workers"}, defaultValue = "0", description = "Workers to run inside this process")
        int localWorkers;

        @Option(names = {"--max-wait-ms"}, description = "Stop planning after this long; the run stays resumable")
        Long maxWaitMs;

        @Override
        public Integer call() {
            try (ThinMeshRuntime runtime = parent.runtime()) {
                RunOutcome outcome = runtime.resume(runId, parseCeiling(costCeiling), localWorkers, maxWait(maxWaitMs));
                System.out.println(Jsons.toJson(outcome));
                return outcome.exitCode();
            }
        }
    }

    @Command(name = "worker", description = "Run worker loop or a single claim cycle")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        ThinMeshCommand parent;

        @Option(names = {"--worker-id"}, required = true, description = "Worker identity")
        String workerId;

        @Option(names = {"--types"}, split = ",", description = "Task types to claim; default all registered")
        List<String> types;

        @Option(names = {"--once"}, defaultValue = "false", description = "Run only one claim cycle")
        boolean once;

        @Override
        public Integer call() throws Exception {
            try (ThinMeshRuntime runtime = parent.runtime()) {
                WorkerAgent agent = runtime.worker(workerId, types == null ? List.of() : types);
                if (once) {
                    WorkerOutcome outcome = agent.runOnce();
                    System.out.println(Jsons.toJson(outcome));
                    return 0;
                }
                AtomicBoolean running = new AtomicBoolean(true);
                Thread main = Thread.currentThread();
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    running.set(false);
                    try {
                        main.join(runtime.context().config().pollTimeoutMs() * 2L);
                    } catch (InterruptedException ignored) {
                        Thread.currentThread().interrupt();
                    }
                }, "thinmesh-shutdown-hook"));
                agent.runLoop(running);
                return 0;
            }
        }
    }

    @Command(name = "status", description = "Show run status, node states and spend")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        ThinMeshCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Override
        public Integer call() {
            try (ThinMeshRuntime runtime = parent.runtime()) {
                RunReport report = runtime.status(runId);
                System.out.println(Jsons.toJson(report));
                return 0;
            }
        }
    }

    @Command(name = "cancel", description = "Flag a run as cancelled")
    static final class CancelCommand implements Callable<Integer> {
        @ParentCommand
        ThinMeshCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Override
        public Integer call() {
            try (ThinMeshRuntime runtime = parent.runtime()) {
                ThinMeshRuntime.CancelOutcome out = runtime.cancel(runId);
                System.out.println(Jsons.toJson(out));
                return out.cancelled() ? 0 : 1;
            }
        }
    }

    @Command(name = "dead-letters", description = "List dead-lettered messages")
    static final class DeadLettersCommand implements Callable<Integer> {
        @ParentCommand
        ThinMeshCommand parent;

        @Parameters(index = "0", arity = "0..1", description = "Run id; all runs when omitted")
        String runId;

        @Override
        public Integer call() {
            try (ThinMeshRuntime runtime = parent.runtime()) {
                List<DeadLetter> dead = runtime.deadLetters(runId);
                System.out.println(Jsons.toJson(dead));
                return 0;
            }
        }
    }

    @Command(name = "serve-artifacts", description = "Serve the artifact store over HTTP")
    static final class ServeArtifactsCommand implements Callable<Integer> {
        @ParentCommand
        ThinMeshCommand parent;

        @Option(names = {"--host"}, defaultValue = "0.0.0.0", description = "Bind address")
        String host;

        @Option(names = {"--port"}, defaultValue = "8780", description = "Bind port")
        int port;

        @Option(names = {"--threads"}, defaultValue = "8", description = "Request handler threads")
        int threads;

        @Override
        public Integer call() throws Exception {
            try (ThinMeshRuntime runtime = parent.runtime();
                 ArtifactServer server = runtime.serveArtifacts(host, port, threads)) {
                System.out.println(Jsons.toJson(Map.of("listening", server.baseUrl())));
                Thread.currentThread().join();
                return 0;
            }
        }
    }

    @Command(name = "artifact", description = "Store or fetch artifacts",
            subcommands = {ArtifactPutCommand.class, ArtifactGetCommand.class})
    static final class ArtifactCommand implements Runnable {
        @ParentCommand
        ThinMeshCommand parent;

        @Override
        public void run() {
            System.out.println("Use subcommands: put | get");
        }
    }

    @Command(name = "put", description = "Store a file and print its hash")
    static final class ArtifactPutCommand implements Callable<Integer> {
        @ParentCommand
        ArtifactCommand parent;

        @Parameters(index = "0", description = "File to store")
        Path file;

        @Override
        public Integer call() throws Exception {
            try (ThinMeshRuntime runtime = parent.parent.runtime()) {
                ArtifactRef ref = runtime.putArtifact(file);
                System.out.println(Jsons.toJson(ref));
                return 0;
            }
        }
    }

    @Command(name = "get", description = "Fetch an artifact by hash")
    static final class ArtifactGetCommand implements Callable<Integer> {
        @ParentCommand
        ArtifactCommand parent;

        @Parameters(index = "0", description = "Artifact hash")
        String hash;

        @Option(names = {"--out"}, required = true, description = "Destination file")
        Path out;

        @Override
        public Integer call() throws Exception {
            try (ThinMeshRuntime runtime = parent.parent.runtime()) {
                Optional<byte[]> bytes = runtime.getArtifact(hash);
                if (bytes.isEmpty()) {
                    System.out.println(Jsons.toJson(Map.of("error", "artifact not found", "hash", hash)));
                    return 1;
                }
                Path parentDir = out.toAbsolutePath().getParent();
                if (parentDir != null) {
                    Files.createDirectories(parentDir);
                }
                Files.write(out, bytes.get());
                System.out.println(Jsons.toJson(Map.of("hash", hash, "size", bytes.get().length, "out", out.toString())));
                return 0;
            }
        }
    }

    @Command(name = "metrics", description = "Print Prometheus metrics text")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        ThinMeshCommand parent;

        @Parameters(index = "0", arity = "0..1", description = "Run id; all runs when omitted")
        String runId;

        @Override
        public Integer call() {
            try (ThinMeshRuntime runtime = parent.runtime()) {
                System.out.print(runtime.metricsText(runId));
                return 0;
            }
        }
    }
}
