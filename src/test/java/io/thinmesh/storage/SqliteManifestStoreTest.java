package io.thinmesh.storage;

import io.thinmesh.error.IntegrityException;
import io.thinmesh.model.ManifestEntry;
import io.thinmesh.model.RecordResult;
import io.thinmesh.model.RunRecord;
import io.thinmesh.model.RunStatus;
import io.thinmesh.util.Hashing;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.util.List;
import java.util.stream.Stream;

final class SqliteManifestStoreTest {
    private static final String K1 = Hashing.sha256Hex("task one");
    private static final String K2 = Hashing.sha256Hex("task two");

    @Test
    void runRegistrationIsIdempotent() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-manifest-run-");
        try {
            SqliteManifestStore store = store(root);
            RunRecord created = store.createRunIfAbsent("run-1", "spec-a");
            store.updateRunStatus("run-1", RunStatus.HALTED);
            RunRecord again = store.createRunIfAbsent("run-1", "spec-b");

            Assertions.assertEquals("spec-a", created.specHash());
            Assertions.assertEquals("spec-a", again.specHash());
            Assertions.assertEquals(RunStatus.HALTED, again.status());
            Assertions.assertFalse(store.markCancelled("missing"));
            Assertions.assertTrue(store.markCancelled("run-1"));
            Assertions.assertTrue(store.isCancelled("run-1"));
            Assertions.assertEquals(1, store.listRuns().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void firstDoneRecordWins() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-manifest-done-");
        try {
            SqliteManifestStore store = store(root);
            store.createRunIfAbsent("run-1", "spec");
            String first = Hashing.sha256Hex("first");
            String second = Hashing.sha256Hex("second");

            RecordResult a = store.recordDone("run-1", K1, "echo", first, 10L);
            RecordResult b = store.recordDone("run-1", K1, "echo", second, 20L);
            store.recordFailed("run-1", K2, "fail", "boom", 0L);

            Assertions.assertTrue(a.recorded());
            Assertions.assertFalse(b.recorded());
            Assertions.assertEquals(first, b.artifactHash());
            Assertions.assertEquals(10L, b.costChargedMicros());
            Assertions.assertEquals(first, store.resolved("run-1", K1).orElseThrow().artifactHash());
            Assertions.assertTrue(store.resolved("run-1", K2).isEmpty());
            Assertions.assertEquals(first, store.globalResolution(K1).orElseThrow());

            List<ManifestEntry> log = store.replay("run-1");
            Assertions.assertEquals(2, log.size());
            Assertions.assertEquals(ManifestEntry.Resolution.DONE, log.get(0).resolution());
            Assertions.assertEquals(ManifestEntry.Resolution.FAILED, log.get(1).resolution());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidateDropsOnlyTheMatchingResolution() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-manifest-invalidate-");
        try {
            SqliteManifestStore store = store(root);
            store.createRunIfAbsent("run-1", "spec");
            String hash = Hashing.sha256Hex("lost");
            store.recordDone("run-1", K1, "echo", hash, 0L);

            store.invalidate("run-1", K1, "echo", Hashing.sha256Hex("other"), "stale");
            Assertions.assertTrue(store.resolved("run-1", K1).isPresent());

            store.invalidate("run-1", K1, "echo", hash, "artifact missing");
            Assertions.assertTrue(store.resolved("run-1", K1).isEmpty());
            Assertions.assertTrue(store.globalResolution(K1).isEmpty());
            Assertions.assertEquals(ManifestEntry.Resolution.INVALIDATED, store.replay("run-1").get(1).resolution());

            String recomputed = Hashing.sha256Hex("recomputed");
            Assertions.assertTrue(store.recordDone("run-1", K1, "echo", recomputed, 0L).recorded());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unreadableLogEntryIsAnIntegrityViolation() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-manifest-corrupt-");
        try {
            Database db = new Database(root.resolve("thinmesh.db"));
            db.init();
            SqliteManifestStore store = new SqliteManifestStore(db);
            store.createRunIfAbsent("run-1", "spec");
            try (Connection c = db.openConnection();
                 PreparedStatement ps = c.prepareStatement("INSERT INTO manifest(run_id,entry_json,recorded_at_ms) VALUES(?,?,?)")) {
                ps.setString(1, "run-1");
                ps.setString(2, "{not json");
                ps.setLong(3, 0L);
                ps.executeUpdate();
            }

            Assertions.assertThrows(IntegrityException.class, () -> store.replay("run-1"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static SqliteManifestStore store(Path root) {
        Database db = new Database(root.resolve("thinmesh.db"));
        db.init();
        return new SqliteManifestStore(db);
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
