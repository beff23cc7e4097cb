package io.thinmesh.planner;

import io.thinmesh.model.NodeState;
import io.thinmesh.model.RunStatus;

import java.util.List;
import java.util.Map;

/**
 * Result of one planner session over a run.
 *
 * @param finished     false when the session stopped on its max wait with work still in flight
 * @param unfinishedTasks nodes not DONE, as {@code id:state}
 * @param abortReason  set when an integrity violation aborted the run
 */
public record RunOutcome(
        String runId,
        RunStatus status,
        boolean finished,
        Map<NodeState, Integer> nodeCounts,
        int dispatched,
        int cacheHits,
        List<String> unfinishedTasks,
        String abortReason
) {
    public static final int EXIT_COMPLETED = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_HALTED = 3;
    public static final int EXIT_CANCELLED = 4;
    public static final int EXIT_FATAL = 5;
    public static final int EXIT_STILL_RUNNING = 6;

    public RunOutcome {
        nodeCounts = Map.copyOf(nodeCounts);
        unfinishedTasks = List.copyOf(unfinishedTasks);
    }

    public int exitCode() {
        if (abortReason != null) {
            return EXIT_FATAL;
        }
        if (!finished) {
            return EXIT_STILL_RUNNING;
        }
        return switch (status) {
            case COMPLETED -> EXIT_COMPLETED;
            case HALTED -> EXIT_HALTED;
            case CANCELLED -> EXIT_CANCELLED;
            case FAILED, RUNNING -> EXIT_FAILED;
        };
    }
}
