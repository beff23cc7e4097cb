package io.thinmesh.observability;

import io.thinmesh.model.LedgerSnapshot;
import io.thinmesh.model.NodeState;
import io.thinmesh.runtime.ThinMeshRuntime;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(ThinMeshRuntime.StatsOutcome stats) {
        StringBuilder sb = new StringBuilder();
        appendMapGauge(sb, "thinmesh_queue_depth", "Messages waiting or leased per task type", "task_type",
                new TreeMap<>(stats.queueDepths()));
        appendGauge(sb, "thinmesh_dead_letters_total", "Dead-lettered messages", null, null, stats.deadLetters());
        for (ThinMeshRuntime.RunStats run : stats.runs()) {
            for (Map.Entry<NodeState, Integer> e : run.nodeCounts().entrySet()) {
                appendRunGauge(sb, "thinmesh_run_nodes", "Run graph nodes grouped by state", run.runId(),
                        "state", e.getKey().name().toLowerCase(), e.getValue());
            }
        }
        for (ThinMeshRuntime.RunStats run : stats.runs()) {
            appendRunGauge(sb, "thinmesh_run_info", "Run status marker", run.runId(), "status",
                    run.status().toLowerCase(), 1L);
        }

        // each metric family must stay contiguous
        Map<String, LedgerSnapshot> ledgers = new LinkedHashMap<>();
        for (ThinMeshRuntime.RunStats run : stats.runs()) {
            if (run.ledger() != null) {
                ledgers.put(run.runId(), run.ledger());
            }
        }
        if (stats.globalLedger() != null) {
            ledgers.put("_global", stats.globalLedger());
        }
        ledgers.forEach((scope, l) -> appendGauge(sb, "thinmesh_spent_micros", "Settled spend in micro-units",
                "scope", scope, l.spentMicros()));
        ledgers.forEach((scope, l) -> appendGauge(sb, "thinmesh_in_flight_micros",
                "Reserved, unsettled spend in micro-units", "scope", scope, l.inFlightMicros()));
        ledgers.forEach((scope, l) -> appendGauge(sb, "thinmesh_ceiling_micros",
                "Spend ceiling in micro-units (-1 = unlimited)", "scope", scope, l.ceilingMicros()));
        ledgers.forEach((scope, l) -> appendGauge(sb, "thinmesh_halted", "Cost guard halt flag (1=halted,0=ok)",
                "scope", scope, l.halted() ? 1L : 0L));
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Long> values) {
        appendHeader(sb, metric, help);
        for (Map.Entry<String, Long> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendRunGauge(StringBuilder sb, String metric, String help, String runId,
                                       String label, String labelValue, long value) {
        appendHeader(sb, metric, help);
        sb.append(metric).append("{run_id=\"").append(escapeLabel(runId)).append("\",")
                .append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}")
                .append(' ').append(value).append('\n');
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        appendHeader(sb, metric, help);
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static void appendHeader(StringBuilder sb, String metric, String help) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
