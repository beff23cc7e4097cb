package io.thinmesh.worker;

import io.thinmesh.artifact.FileArtifactStore;
import io.thinmesh.cache.TaskKeys;
import io.thinmesh.cost.CostGuard;
import io.thinmesh.cost.Reservation;
import io.thinmesh.error.TaskExecutionException;
import io.thinmesh.model.CompletionEvent;
import io.thinmesh.model.LedgerSnapshot;
import io.thinmesh.model.TaskEnvelope;
import io.thinmesh.model.TaskOutcome;
import io.thinmesh.observability.AuditLogger;
import io.thinmesh.router.RedeliveryPolicy;
import io.thinmesh.storage.Database;
import io.thinmesh.storage.SqliteManifestStore;
import io.thinmesh.storage.SqliteSpendLedger;
import io.thinmesh.storage.SqliteTaskRouter;
import io.thinmesh.util.Hashing;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

final class WorkerAgentTest {

    @Test
    void executesStoresRecordsAndAcks() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-worker-done-");
        try {
            Fixture f = new Fixture(root, 3);
            TaskEnvelope task = f.enqueue("echo", List.of("alpha", "beta"));
            WorkerAgent agent = f.agent(new ExecutorRegistry().register(new EchoExecutor()));

            WorkerOutcome outcome = agent.runOnce();

            Assertions.assertEquals(WorkerOutcome.Disposition.DONE, outcome.disposition());
            String hash = f.manifest.resolved("run-1", task.taskKey()).orElseThrow().artifactHash();
            Assertions.assertEquals("alpha\nbeta", new String(f.artifacts.get(hash).orElseThrow(), StandardCharsets.UTF_8));
            Assertions.assertTrue(f.router.outstandingTaskKeys("run-1").isEmpty());
            Assertions.assertFalse(agent.runOnce().processed());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void redeliveryOfRecordedTaskSkipsExecution() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-worker-redelivery-");
        try {
            Fixture f = new Fixture(root, 3);
            TaskEnvelope task = f.enqueue("count", List.of("x"));
            String earlier = f.artifacts.put("earlier".getBytes(StandardCharsets.UTF_8)).hash();
            f.manifest.recordDone("run-1", task.taskKey(), "count", earlier, 0L);
            CountingExecutor counting = new CountingExecutor();

            WorkerOutcome outcome = f.agent(new ExecutorRegistry().register(counting)).runOnce();

            Assertions.assertEquals(WorkerOutcome.Disposition.ALREADY_DONE, outcome.disposition());
            Assertions.assertEquals(0, counting.calls.get());
            Assertions.assertEquals(earlier, f.router.pollCompletions("run-1", null, 10, Duration.ofMillis(100))
                    .events().get(0).artifactHash());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failuresRetryThenDeadLetter() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-worker-fail-");
        try {
            Fixture f = new Fixture(root, 2);
            f.enqueue("fail", List.of("x"));
            WorkerAgent agent = f.agent(new ExecutorRegistry().register(new FailExecutor()));

            Assertions.assertEquals(WorkerOutcome.Disposition.RETRY, agent.runOnce().disposition());
            WorkerOutcome second = agent.runOnce();
            for (int i = 0; i < 10 && !second.processed(); i++) {
                second = agent.runOnce();
            }

            Assertions.assertEquals(WorkerOutcome.Disposition.DEAD_LETTERED, second.disposition());
            Assertions.assertEquals(1, f.router.deadLetters("run-1").size());
            Assertions.assertTrue(f.audit.tail(10).stream().anyMatch(line -> line.contains("task.dead_letter")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void paidTaskHaltsWhenCeilingDeniesAndSettlesActualCostOtherwise() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-worker-cost-");
        try {
            Fixture f = new Fixture(root, 3);
            f.guard.setCeiling("run-1", 1_000_000L);
            TaskEnvelope cheap = f.enqueue("llm", List.of("cheap"));
            f.enqueue("llm", List.of("costly"));
            FixedGateway gateway = new FixedGateway(700_000L, 400_000L);
            WorkerAgent agent = f.agent(new ExecutorRegistry().register(new ModelGatewayExecutor(gateway)));

            Assertions.assertEquals(WorkerOutcome.Disposition.DONE, agent.runOnce().disposition());
            LedgerSnapshot afterFirst = f.guard.snapshot("run-1").orElseThrow();
            Assertions.assertEquals(400_000L, afterFirst.spentMicros());
            Assertions.assertEquals(0L, afterFirst.inFlightMicros());
            Assertions.assertEquals(400_000L,
                    f.manifest.resolved("run-1", cheap.taskKey()).orElseThrow().costChargedMicros());

            Assertions.assertEquals(WorkerOutcome.Disposition.HALTED, agent.runOnce().disposition());
            Assertions.assertEquals(1, gateway.invocations.get());
            Assertions.assertTrue(f.guard.isHalted("run-1"));
            Assertions.assertTrue(f.router.deadLetters("run-1").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void deadLetterCarriesCostChargedAcrossAttempts() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-worker-charged-");
        try {
            Fixture f = new Fixture(root, 2);
            TaskEnvelope task = f.enqueue("charge", List.of("x"));
            WorkerAgent agent = f.agent(new ExecutorRegistry().register(new ChargingFailExecutor(250_000L)));

            Assertions.assertEquals(WorkerOutcome.Disposition.RETRY, agent.runOnce().disposition());
            WorkerOutcome second = agent.runOnce();
            for (int i = 0; i < 10 && !second.processed(); i++) {
                second = agent.runOnce();
            }
            Assertions.assertEquals(WorkerOutcome.Disposition.DEAD_LETTERED, second.disposition());

            List<CompletionEvent> events = f.router.pollCompletions("run-1", null, 10, Duration.ofMillis(100)).events();
            Assertions.assertEquals(1, events.size());
            Assertions.assertEquals(task.taskKey(), events.get(0).taskKey());
            Assertions.assertEquals(TaskOutcome.Kind.FAILED, events.get(0).outcome());
            Assertions.assertEquals(500_000L, events.get(0).costMicros());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void denialReleasesAReservationLeftByAnEarlierHolder() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-worker-denied-");
        try {
            Fixture f = new Fixture(root, 3);
            f.guard.setCeiling("run-1", 1_000_000L);
            Reservation spent = f.guard.reserve("run-1", "earlier", 500_000L);
            Assertions.assertTrue(f.guard.settle(spent, 500_000L));
            TaskEnvelope task = f.enqueue("llm", List.of("leftover"));
            Assertions.assertTrue(f.guard.reserve("run-1", task.taskKey(), 400_000L).granted());
            FixedGateway gateway = new FixedGateway(700_000L, 700_000L);

            WorkerOutcome outcome = f.agent(new ExecutorRegistry().register(new ModelGatewayExecutor(gateway))).runOnce();

            Assertions.assertEquals(WorkerOutcome.Disposition.HALTED, outcome.disposition());
            Assertions.assertEquals(0, gateway.invocations.get());
            LedgerSnapshot snap = f.guard.snapshot("run-1").orElseThrow();
            Assertions.assertEquals(500_000L, snap.spentMicros());
            Assertions.assertEquals(0L, snap.inFlightMicros());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cancelledRunIsAcknowledgedWithoutExecution() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-worker-cancel-");
        try {
            Fixture f = new Fixture(root, 3);
            f.enqueue("count", List.of("x"));
            f.manifest.markCancelled("run-1");
            CountingExecutor counting = new CountingExecutor();

            WorkerOutcome outcome = f.agent(new ExecutorRegistry().register(counting)).runOnce();

            Assertions.assertEquals(WorkerOutcome.Disposition.CANCELLED, outcome.disposition());
            Assertions.assertEquals(0, counting.calls.get());
            Assertions.assertEquals("cancelled", f.router.deadLetters("run-1").get(0).status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tamperedEnvelopeAborts() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-worker-abort-");
        try {
            Fixture f = new Fixture(root, 3);
            String input = f.artifacts.put("x".getBytes(StandardCharsets.UTF_8)).hash();
            f.router.enqueue(TaskEnvelope.of("run-1", Hashing.sha256Hex("forged"), "count", List.of(input), new byte[0]));
            CountingExecutor counting = new CountingExecutor();

            WorkerOutcome outcome = f.agent(new ExecutorRegistry().register(counting)).runOnce();

            Assertions.assertEquals(WorkerOutcome.Disposition.ABORTED, outcome.disposition());
            Assertions.assertEquals(0, counting.calls.get());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingInputDeadLettersImmediately() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-worker-missing-");
        try {
            Fixture f = new Fixture(root, 3);
            String absent = Hashing.sha256Hex("never stored");
            String key = TaskKeys.derive("count", List.of(absent), new byte[0]);
            f.router.enqueue(TaskEnvelope.of("run-1", key, "count", List.of(absent), new byte[0]));

            WorkerOutcome outcome = f.agent(new ExecutorRegistry().register(new CountingExecutor())).runOnce();

            Assertions.assertEquals(WorkerOutcome.Disposition.DEAD_LETTERED, outcome.disposition());
            Assertions.assertTrue(f.router.deadLetters("run-1").get(0).lastError().contains(absent));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void registryRestrictionRejectsUnknownTypes() {
        ExecutorRegistry registry = new ExecutorRegistry().register(new EchoExecutor()).register(new FailExecutor());

        Assertions.assertEquals(List.of("echo"), List.copyOf(registry.restrictTo(List.of("echo")).taskTypes()));
        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.restrictTo(List.of("llm")));
    }

    private static final class CountingExecutor implements TaskExecutor {
        final AtomicInteger calls = new AtomicInteger();

        @Override
        public String taskType() {
            return "count";
        }

        @Override
        public TaskResult execute(TaskContext context) {
            return TaskResult.of(("call " + calls.incrementAndGet()).getBytes(StandardCharsets.UTF_8));
        }
    }

    private static final class ChargingFailExecutor implements TaskExecutor {
        private final long chargePerAttempt;

        ChargingFailExecutor(long chargePerAttempt) {
            this.chargePerAttempt = chargePerAttempt;
        }

        @Override
        public String taskType() {
            return "charge";
        }

        @Override
        public TaskResult execute(TaskContext context) throws TaskExecutionException {
            throw new TaskExecutionException("upstream rejected attempt " + context.attempt(), chargePerAttempt);
        }
    }

    private static final class FixedGateway implements ModelGateway {
        final AtomicInteger invocations = new AtomicInteger();
        private final long estimate;
        private final long actual;

        FixedGateway(long estimate, long actual) {
            this.estimate = estimate;
            this.actual = actual;
        }

        @Override
        public long estimateMicros(TaskContext context) {
            return estimate;
        }

        @Override
        public Invocation invoke(TaskContext context) throws TaskExecutionException {
            invocations.incrementAndGet();
            return new Invocation(context.input(0), "text/plain", actual);
        }
    }

    private static final class Fixture {
        final FileArtifactStore artifacts;
        final SqliteManifestStore manifest;
        final SqliteTaskRouter router;
        final CostGuard guard;
        final AuditLogger audit;

        Fixture(Path root, int maxAttempts) {
            Database db = new Database(root.resolve("thinmesh.db"));
            db.init();
            this.artifacts = new FileArtifactStore(root.resolve("artifacts"));
            this.manifest = new SqliteManifestStore(db);
            this.router = new SqliteTaskRouter(db, "workers", type -> 60_000L, new RedeliveryPolicy(maxAttempts, 10L, 20L));
            this.guard = new CostGuard(new SqliteSpendLedger(db), -1L);
            this.audit = new AuditLogger(root.resolve("audit.log"));
            manifest.createRunIfAbsent("run-1", "spec");
        }

        TaskEnvelope enqueue(String type, List<String> texts) {
            List<String> hashes = texts.stream()
                    .map(t -> artifacts.put(t.getBytes(StandardCharsets.UTF_8)).hash())
                    .toList();
            TaskEnvelope envelope = TaskEnvelope.of("run-1", TaskKeys.derive(type, hashes, new byte[0]), type, hashes, new byte[0]);
            router.enqueue(envelope);
            return envelope;
        }

        WorkerAgent agent(ExecutorRegistry registry) {
            return new WorkerAgent("w-test", "workers", registry, router, artifacts, manifest, guard, audit,
                    Duration.ofMillis(300));
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
