package io.thinmesh.redis;

/**
 * Key layout under one prefix. Run-scoped keys share the
 * {@code {prefix}:run:{runId}:} stem.
 */
final class RedisKeys {
    private final String prefix;

    RedisKeys(String prefix) {
        this.prefix = prefix == null || prefix.isBlank() ? "thinmesh" : prefix.trim();
    }

    String queue(String taskType) {
        return prefix + ":queue:" + taskType;
    }

    String queues() {
        return prefix + ":queues";
    }

    String dead() {
        return prefix + ":dead";
    }

    String runs() {
        return prefix + ":runs";
    }

    String runInfo(String runId) {
        return run(runId) + ":info";
    }

    String events(String runId) {
        return run(runId) + ":events";
    }

    String outstanding(String runId) {
        return run(runId) + ":outstanding";
    }

    String manifest(String runId) {
        return run(runId) + ":manifest";
    }

    String resolved(String runId) {
        return run(runId) + ":resolved";
    }

    String resolutions() {
        return prefix + ":resolutions";
    }

    String ledger(String scope) {
        return prefix + ":ledger:" + scope;
    }

    String reservations(String runId) {
        return ledger(runId) + ":reservations";
    }

    private String run(String runId) {
        return prefix + ":run:" + runId;
    }
}
