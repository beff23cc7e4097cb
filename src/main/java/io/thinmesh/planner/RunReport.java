package io.thinmesh.planner;

import io.thinmesh.model.LedgerSnapshot;
import io.thinmesh.model.NodeState;
import io.thinmesh.model.RunRecord;

import java.util.Map;

/**
 * Read-only view of a run for {@code status} and {@code metrics}.
 *
 * @param ledger null until the run has reserved or been given a ceiling
 */
public record RunReport(
        RunRecord run,
        Map<String, NodeState> nodes,
        Map<NodeState, Integer> nodeCounts,
        Map<String, String> taskKeys,
        LedgerSnapshot ledger
) {
}
