package io.thinmesh.cache;

import io.thinmesh.artifact.ArtifactRef;
import io.thinmesh.artifact.FileArtifactStore;
import io.thinmesh.model.ManifestEntry;
import io.thinmesh.model.NackResult;
import io.thinmesh.model.TaskEnvelope;
import io.thinmesh.router.RedeliveryPolicy;
import io.thinmesh.storage.Database;
import io.thinmesh.storage.SqliteManifestStore;
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
import java.util.stream.Stream;

final class ResumeCacheManagerTest {

    @Test
    void replayedDoneEntryResolvesWhileArtifactExists() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-cache-hit-");
        try {
            Fixture f = new Fixture(root);
            ArtifactRef out = f.artifacts.put("output".getBytes(StandardCharsets.UTF_8));
            String key = Hashing.sha256Hex("task");
            f.manifest.recordDone("run-1", key, "echo", out.hash(), 0L);

            ResumeCacheManager cache = f.cache(false);
            ResumeCacheManager.LoadSummary summary = cache.load("run-1");

            Assertions.assertEquals(1, summary.resolved());
            Assertions.assertEquals(Resolution.resolved(out.hash()), cache.resolve(key, "echo"));
            Assertions.assertEquals(Resolution.absent(), cache.resolve(Hashing.sha256Hex("other"), "echo"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingArtifactInvalidatesTheEntry() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-cache-missing-");
        try {
            Fixture f = new Fixture(root);
            String key = Hashing.sha256Hex("task");
            String vanished = Hashing.sha256Hex("never stored");
            f.manifest.recordDone("run-1", key, "echo", vanished, 0L);

            ResumeCacheManager cache = f.cache(false);
            cache.load("run-1");

            Assertions.assertEquals(Resolution.Kind.ABSENT, cache.resolve(key, "echo").kind());
            Assertions.assertFalse(cache.isResolved(key));
            Assertions.assertTrue(f.manifest.resolved("run-1", key).isEmpty());
            List<ManifestEntry> log = f.manifest.replay("run-1");
            Assertions.assertEquals(ManifestEntry.Resolution.INVALIDATED, log.get(log.size() - 1).resolution());

            cache.load("run-1");
            Assertions.assertEquals(Resolution.Kind.ABSENT, cache.resolve(key, "echo").kind());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void outstandingMessagesLoadAsPending() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-cache-pending-");
        try {
            Fixture f = new Fixture(root);
            String input = Hashing.sha256Hex("in");
            String key = TaskKeys.derive("echo", List.of(input), new byte[0]);
            f.router.enqueue(TaskEnvelope.of("run-1", key, "echo", List.of(input), new byte[0]));

            ResumeCacheManager cache = f.cache(false);
            Assertions.assertEquals(1, cache.load("run-1").pending());
            Assertions.assertEquals(Resolution.pending(), cache.resolve(key, "echo"));

            ArtifactRef out = f.artifacts.put("done".getBytes(StandardCharsets.UTF_8));
            cache.markResolved(key, "echo", out.hash(), 0L);
            Assertions.assertEquals(Resolution.resolved(out.hash()), cache.peek(key));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedEntryDoesNotResolveButIsReported() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-cache-failed-");
        try {
            Fixture f = new Fixture(root);
            String key = Hashing.sha256Hex("task");
            f.manifest.recordFailed("run-1", key, "fail", "boom", 0L);

            ResumeCacheManager cache = f.cache(false);
            cache.load("run-1");

            Assertions.assertEquals(Resolution.Kind.ABSENT, cache.resolve(key, "fail").kind());
            Assertions.assertEquals("boom", cache.failedEntries().get(key).detail());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void deadLetterMissingFromTheManifestIsRecordedAsFailed() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-cache-dead-");
        try {
            Fixture f = new Fixture(root, 1);
            String input = Hashing.sha256Hex("in");
            String key = TaskKeys.derive("fail", List.of(input), new byte[0]);
            f.router.enqueue(TaskEnvelope.of("run-1", key, "fail", List.of(input), new byte[0]));
            TaskEnvelope claimed = f.router.claim("workers", "w1", List.of("fail"), Duration.ofMillis(200)).orElseThrow();
            Assertions.assertEquals(NackResult.DEAD_LETTERED, f.router.nack(claimed, "boom"));

            ResumeCacheManager inspector = f.cache(false);
            Assertions.assertEquals(1, inspector.load("run-1", true).failed());
            Assertions.assertTrue(f.manifest.replay("run-1").isEmpty());

            ResumeCacheManager cache = f.cache(false);
            ResumeCacheManager.LoadSummary summary = cache.load("run-1");
            Assertions.assertEquals(1, summary.failed());
            Assertions.assertEquals(0, summary.pending());
            Assertions.assertTrue(cache.isFailed(key));
            Assertions.assertEquals("boom", cache.failedEntries().get(key).detail());

            cache.load("run-1");
            List<ManifestEntry> log = f.manifest.replay("run-1");
            Assertions.assertEquals(1, log.size());
            Assertions.assertEquals(ManifestEntry.Resolution.FAILED, log.get(0).resolution());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void sharedResolutionIsCopiedOnlyWhenEnabled() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-cache-shared-");
        try {
            Fixture f = new Fixture(root);
            f.manifest.createRunIfAbsent("run-2", "spec");
            ArtifactRef out = f.artifacts.put("shared".getBytes(StandardCharsets.UTF_8));
            String key = Hashing.sha256Hex("task");
            f.manifest.recordDone("run-1", key, "echo", out.hash(), 0L);

            ResumeCacheManager isolated = f.cache(false);
            isolated.load("run-2");
            Assertions.assertEquals(Resolution.Kind.ABSENT, isolated.resolve(key, "echo").kind());

            ResumeCacheManager shared = f.cache(true);
            shared.load("run-2");
            Assertions.assertEquals(Resolution.resolved(out.hash()), shared.resolve(key, "echo"));
            Assertions.assertEquals(out.hash(), f.manifest.resolved("run-2", key).orElseThrow().artifactHash());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void resolveBeforeLoadIsRejected() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-cache-order-");
        try {
            ResumeCacheManager cache = new Fixture(root).cache(false);
            Assertions.assertThrows(IllegalStateException.class, () -> cache.resolve(Hashing.sha256Hex("x")));
        } finally {
            deleteRecursively(root);
        }
    }

    private static final class Fixture {
        final FileArtifactStore artifacts;
        final SqliteManifestStore manifest;
        final SqliteTaskRouter router;

        Fixture(Path root) {
            this(root, 3);
        }

        Fixture(Path root, int maxAttempts) {
            Database db = new Database(root.resolve("thinmesh.db"));
            db.init();
            this.artifacts = new FileArtifactStore(root.resolve("artifacts"));
            this.manifest = new SqliteManifestStore(db);
            this.router = new SqliteTaskRouter(db, "workers", type -> 60_000L, new RedeliveryPolicy(maxAttempts, 10L, 20L));
            manifest.createRunIfAbsent("run-1", "spec");
        }

        ResumeCacheManager cache(boolean shareAcrossRuns) {
            return new ResumeCacheManager(manifest, artifacts, router, shareAcrossRuns);
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
