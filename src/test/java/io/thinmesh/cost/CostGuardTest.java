package io.thinmesh.cost;

import io.thinmesh.model.LedgerSnapshot;
import io.thinmesh.storage.Database;
import io.thinmesh.storage.SqliteSpendLedger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class CostGuardTest {

    @Test
    void concurrentReservationsNeverOvershootTheCeiling() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-cost-race-");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            CostGuard guard = guard(root, -1L);
            guard.setCeiling("run-1", 10_000_000L);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Reservation>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                String key = "task-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return guard.reserve("run-1", key, 1_000_000L);
                }));
            }
            start.countDown();
            int granted = 0;
            for (Future<Reservation> f : futures) {
                if (f.get(30, TimeUnit.SECONDS).granted()) {
                    granted++;
                }
            }

            LedgerSnapshot snap = guard.snapshot("run-1").orElseThrow();
            Assertions.assertEquals(10, granted);
            Assertions.assertEquals(10_000_000L, snap.inFlightMicros());
            Assertions.assertTrue(snap.halted());
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void denialHaltsUntilTheCeilingIsRaised() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-cost-halt-");
        try {
            CostGuard guard = guard(root, -1L);
            guard.setCeiling("run-1", 1_500_000L);

            Reservation first = guard.reserve("run-1", "a", 1_000_000L);
            Assertions.assertTrue(first.granted());
            Assertions.assertTrue(guard.settle(first, 900_000L));
            Assertions.assertFalse(guard.reserve("run-1", "b", 1_000_000L).granted());
            Assertions.assertTrue(guard.isHalted("run-1"));
            // halted stays set even for an estimate that would fit
            Assertions.assertFalse(guard.reserve("run-1", "c", 1L).granted());

            guard.setCeiling("run-1", 5_000_000L);
            Assertions.assertFalse(guard.isHalted("run-1"));
            Assertions.assertTrue(guard.reserve("run-1", "b", 1_000_000L).granted());

            LedgerSnapshot snap = guard.snapshot("run-1").orElseThrow();
            Assertions.assertEquals(900_000L, snap.spentMicros());
            Assertions.assertEquals(1_000_000L, snap.inFlightMicros());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void settleAndReleaseAreIdempotent() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-cost-settle-");
        try {
            CostGuard guard = guard(root, -1L);
            Reservation r = guard.reserve("run-1", "a", 2_000_000L);

            Assertions.assertTrue(guard.settle(r, 1_250_000L));
            Assertions.assertFalse(guard.settle(r, 1_250_000L));
            Assertions.assertFalse(guard.release("run-1", r.reservationId()));
            Assertions.assertFalse(guard.settle("run-1", Reservation.idFor("run-1", "never"), 5L));

            Reservation released = guard.reserve("run-1", "b", 3_000_000L);
            Assertions.assertTrue(guard.release("run-1", released.reservationId()));

            LedgerSnapshot snap = guard.snapshot("run-1").orElseThrow();
            Assertions.assertEquals(1_250_000L, snap.spentMicros());
            Assertions.assertEquals(0L, snap.inFlightMicros());
            Assertions.assertTrue(snap.unlimited());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void redeliveredTaskReservesUnderTheSameId() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-cost-redelivery-");
        try {
            CostGuard guard = guard(root, -1L);
            guard.setCeiling("run-1", 1_000_000L);

            Assertions.assertTrue(guard.reserve("run-1", "a", 800_000L).granted());
            Reservation again = guard.reserve("run-1", "a", 900_000L);

            Assertions.assertTrue(again.granted());
            Assertions.assertEquals(900_000L, guard.snapshot("run-1").orElseThrow().inFlightMicros());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void zeroEstimateIsDeniedOnceTheCeilingIsReached() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-cost-zero-");
        try {
            CostGuard guard = guard(root, -1L);
            guard.setCeiling("run-1", 1_000_000L);
            Assertions.assertTrue(guard.reserve("run-1", "zero-below", 0L).granted());
            Reservation full = guard.reserve("run-1", "a", 1_000_000L);
            Assertions.assertTrue(guard.settle(full, 1_000_000L));

            Assertions.assertFalse(guard.reserve("run-1", "b", 0L).granted());
            Assertions.assertTrue(guard.isHalted("run-1"));

            CostGuard global = guard(root.resolve("global"), 500_000L);
            Reservation spent = global.reserve("run-2", "a", 500_000L);
            Assertions.assertTrue(global.settle(spent, 500_000L));
            Assertions.assertFalse(global.reserve("run-3", "b", 0L).granted());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void globalCeilingSpansRuns() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-cost-global-");
        try {
            CostGuard guard = guard(root, 1_000_000L);

            Assertions.assertTrue(guard.reserve("run-1", "a", 700_000L).granted());
            Assertions.assertFalse(guard.reserve("run-2", "a", 700_000L).granted());
            Assertions.assertTrue(guard.isHalted("run-2"));
            Assertions.assertFalse(guard.isHalted("run-1"));
            Assertions.assertEquals(0L, guard.snapshot("run-2").orElseThrow().inFlightMicros());
            Assertions.assertEquals(700_000L, guard.globalSnapshot().orElseThrow().inFlightMicros());
        } finally {
            deleteRecursively(root);
        }
    }

    private static CostGuard guard(Path root, long globalCeilingMicros) {
        Database db = new Database(root.resolve("thinmesh.db"));
        db.init();
        return new CostGuard(new SqliteSpendLedger(db), globalCeilingMicros);
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
