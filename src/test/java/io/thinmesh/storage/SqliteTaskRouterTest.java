package io.thinmesh.storage;

import io.thinmesh.cache.TaskKeys;
import io.thinmesh.model.CompletionBatch;
import io.thinmesh.model.DeadLetter;
import io.thinmesh.model.NackResult;
import io.thinmesh.model.TaskEnvelope;
import io.thinmesh.model.TaskOutcome;
import io.thinmesh.router.RedeliveryPolicy;
import io.thinmesh.util.Hashing;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

final class SqliteTaskRouterTest {
    private static final String GROUP = "workers";
    private static final Duration SHORT = Duration.ofMillis(200);

    @Test
    void claimIsFifoPerTypeAndFilteredByDeclaredTypes() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-router-fifo-");
        try {
            SqliteTaskRouter router = router(root, 60_000L, 3);
            TaskEnvelope first = envelope("run-1", "echo", "one");
            TaskEnvelope second = envelope("run-1", "echo", "two");
            TaskEnvelope other = envelope("run-1", "llm", "three");
            router.enqueue(first);
            router.enqueue(other);
            router.enqueue(second);

            TaskEnvelope a = router.claim(GROUP, "w1", List.of("echo"), SHORT).orElseThrow();
            TaskEnvelope b = router.claim(GROUP, "w1", List.of("echo"), SHORT).orElseThrow();

            Assertions.assertEquals(first.taskKey(), a.taskKey());
            Assertions.assertEquals(second.taskKey(), b.taskKey());
            Assertions.assertEquals(1, a.attempt());
            Assertions.assertNotNull(a.leaseToken());
            Assertions.assertTrue(router.claim(GROUP, "w1", List.of("echo"), SHORT).isEmpty());
            Assertions.assertEquals(Long.valueOf(1L), router.queueDepths().get("llm"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void expiredLeaseIsRedeliveredAndStaleHolderIsFenced() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-router-lease-");
        try {
            SqliteTaskRouter router = router(root, 100L, 3);
            TaskEnvelope task = envelope("run-1", "echo", "slow");
            router.enqueue(task);

            TaskEnvelope stale = router.claim(GROUP, "w1", List.of("echo"), SHORT).orElseThrow();
            Thread.sleep(250L);
            TaskEnvelope fresh = router.claim(GROUP, "w2", List.of("echo"), Duration.ofSeconds(2)).orElseThrow();

            Assertions.assertEquals(stale.messageId(), fresh.messageId());
            Assertions.assertEquals(2, fresh.attempt());
            Assertions.assertNotEquals(stale.leaseToken(), fresh.leaseToken());

            String output = Hashing.sha256Hex("out");
            Assertions.assertFalse(router.ack(stale, TaskOutcome.done(output, 0L)));
            Assertions.assertEquals(NackResult.STALE_LEASE, router.nack(stale, "late failure"));
            Assertions.assertTrue(router.ack(fresh, TaskOutcome.done(output, 0L)));

            CompletionBatch batch = router.pollCompletions("run-1", null, 10, SHORT);
            Assertions.assertEquals(1, batch.events().size());
            Assertions.assertEquals(TaskOutcome.Kind.DONE, batch.events().get(0).outcome());
            Assertions.assertEquals(output, batch.events().get(0).artifactHash());
            Assertions.assertTrue(router.outstandingTaskKeys("run-1").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void nackDeadLettersAtTheAttemptBound() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-router-dead-");
        try {
            SqliteTaskRouter router = router(root, 60_000L, 2);
            TaskEnvelope task = envelope("run-1", "fail", "x");
            router.enqueue(task);

            TaskEnvelope first = router.claim(GROUP, "w1", List.of("fail"), SHORT).orElseThrow();
            Assertions.assertEquals(NackResult.REQUEUED, router.nack(first, "boom 1"));
            TaskEnvelope second = router.claim(GROUP, "w1", List.of("fail"), Duration.ofSeconds(2)).orElseThrow();
            Assertions.assertEquals(2, second.attempt());
            Assertions.assertEquals(NackResult.DEAD_LETTERED, router.nack(second, "boom 2"));

            Assertions.assertTrue(router.claim(GROUP, "w1", List.of("fail"), SHORT).isEmpty());
            List<DeadLetter> dead = router.deadLetters("run-1");
            Assertions.assertEquals(1, dead.size());
            Assertions.assertEquals("failed", dead.get(0).status());
            Assertions.assertEquals("boom 2", dead.get(0).lastError());
            Assertions.assertTrue(router.deadLetters("other-run").isEmpty());

            CompletionBatch batch = router.pollCompletions("run-1", "0", 10, SHORT);
            Assertions.assertEquals(1, batch.events().size());
            Assertions.assertEquals(TaskOutcome.Kind.FAILED, batch.events().get(0).outcome());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void crashedHolderOnLastAttemptIsDeadLetteredAtReclaim() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-router-crash-");
        try {
            SqliteTaskRouter router = router(root, 80L, 1);
            router.enqueue(envelope("run-1", "echo", "crash"));

            Assertions.assertTrue(router.claim(GROUP, "w1", List.of("echo"), SHORT).isPresent());
            Thread.sleep(200L);

            Optional<TaskEnvelope> again = router.claim(GROUP, "w2", List.of("echo"), SHORT);
            Assertions.assertTrue(again.isEmpty());
            Assertions.assertEquals(1, router.deadLetters("run-1").size());
            CompletionBatch batch = router.pollCompletions("run-1", "0", 10, SHORT);
            Assertions.assertEquals(TaskOutcome.Kind.FAILED, batch.events().get(0).outcome());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void releaseDoesNotCountTheAttempt() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-router-release-");
        try {
            SqliteTaskRouter router = router(root, 60_000L, 3);
            TaskEnvelope task = envelope("run-1", "echo", "r");
            router.enqueue(task);

            TaskEnvelope first = router.claim(GROUP, "w1", List.of("echo"), SHORT).orElseThrow();
            Assertions.assertTrue(router.release(first, "storage unavailable"));
            TaskEnvelope second = router.claim(GROUP, "w1", List.of("echo"), SHORT).orElseThrow();

            Assertions.assertEquals(1, second.attempt());
            Assertions.assertEquals(Set.of(task.taskKey()), router.outstandingTaskKeys("run-1"));
            Assertions.assertTrue(router.ack(second, TaskOutcome.halted("ceiling")));
            Assertions.assertTrue(router.outstandingTaskKeys("run-1").isEmpty());
            Assertions.assertTrue(router.deadLetters("run-1").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void completionCursorSkipsEarlierEvents() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-router-cursor-");
        try {
            SqliteTaskRouter router = router(root, 60_000L, 3);
            router.enqueue(envelope("run-1", "echo", "a"));
            TaskEnvelope a = router.claim(GROUP, "w1", List.of("echo"), SHORT).orElseThrow();
            router.ack(a, TaskOutcome.done(Hashing.sha256Hex("a"), 0L));

            String cursor = router.completionCursor("run-1");
            router.enqueue(envelope("run-1", "echo", "b"));
            TaskEnvelope b = router.claim(GROUP, "w1", List.of("echo"), SHORT).orElseThrow();
            router.ack(b, TaskOutcome.done(Hashing.sha256Hex("b"), 0L));

            CompletionBatch batch = router.pollCompletions("run-1", cursor, 10, SHORT);
            Assertions.assertEquals(1, batch.events().size());
            Assertions.assertEquals(b.taskKey(), batch.events().get(0).taskKey());
            Assertions.assertTrue(router.pollCompletions("run-1", batch.cursor(), 10, Duration.ofMillis(50)).events().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    static SqliteTaskRouter router(Path root, long leaseMs, int maxAttempts) {
        Database db = new Database(root.resolve("thinmesh.db"));
        db.init();
        return new SqliteTaskRouter(db, GROUP, type -> leaseMs, new RedeliveryPolicy(maxAttempts, 10L, 20L));
    }

    static TaskEnvelope envelope(String runId, String type, String text) {
        String input = Hashing.sha256Hex(text);
        byte[] params = text.getBytes(StandardCharsets.UTF_8);
        return TaskEnvelope.of(runId, TaskKeys.derive(type, List.of(input), params), type, List.of(input), params);
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
