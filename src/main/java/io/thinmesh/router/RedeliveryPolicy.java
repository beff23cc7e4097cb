package io.thinmesh.router;

/**
 * Bound on counted delivery attempts and the backoff before a nacked message
 * becomes claimable again.
 */
public record RedeliveryPolicy(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
    public RedeliveryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
    }
}
