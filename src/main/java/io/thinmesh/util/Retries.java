package io.thinmesh.util;

import io.thinmesh.error.TransientStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Local retry loop for {@link TransientStorageException}. Every other exception
 * propagates on the first occurrence.
 */
public final class Retries {
    private static final Logger log = LoggerFactory.getLogger(Retries.class);

    private Retries() {
    }

    public static <T> T call(String operation, Policy policy, Supplier<T> work) {
        TransientStorageException last = null;
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            try {
                return work.get();
            } catch (TransientStorageException e) {
                last = e;
                if (attempt == policy.maxAttempts()) {
                    break;
                }
                long sleepMs = backoffMs(attempt, policy.baseBackoffMs(), policy.maxBackoffMs());
                log.warn("{} failed transiently (attempt {}/{}), retrying in {} ms: {}",
                        operation, attempt, policy.maxAttempts(), sleepMs, e.getMessage());
                sleep(operation, sleepMs);
            }
        }
        throw new TransientStorageException(operation + " failed after " + policy.maxAttempts() + " attempts", last);
    }

    public static void run(String operation, Policy policy, Runnable work) {
        call(operation, policy, () -> {
            work.run();
            return null;
        });
    }

    /**
     * Exponential backoff capped at {@code maxBackoffMs}, plus up to 250 ms of jitter.
     */
    public static long backoffMs(int attempt, long baseBackoffMs, long maxBackoffMs) {
        long backoff = Math.max(1L, baseBackoffMs);
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxBackoffMs);
        long jitter = ThreadLocalRandom.current().nextLong(0L, 251L);
        return Math.min(maxBackoffMs, backoff + jitter);
    }

    private static void sleep(String operation, long sleepMs) {
        try {
            Thread.sleep(sleepMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientStorageException(operation + " interrupted while backing off", e);
        }
    }

    public record Policy(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
        public static final Policy DEFAULT = new Policy(5, 100L, 5_000L);

        public Policy {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
        }
    }
}
