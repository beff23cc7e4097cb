package io.thinmesh.planner;

import io.thinmesh.error.RunSpecException;
import io.thinmesh.util.Jsons;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Validated DAG of a resolved {@link RunSpec}, nodes in topological order.
 */
public final class TaskGraph {
    private final Map<String, Node> nodes;
    private final List<Node> ordered;
    private final Map<String, List<String>> dependents;

    private TaskGraph(Map<String, Node> nodes, List<Node> ordered, Map<String, List<String>> dependents) {
        this.nodes = nodes;
        this.ordered = ordered;
        this.dependents = dependents;
    }

    /**
     * @param paidType decides paid-ness for nodes that do not say
     * @throws RunSpecException on blank or duplicate ids, blank types, unknown
     *                          dependencies, unresolved inputs or a cycle
     */
    public static TaskGraph build(RunSpec spec, Predicate<String> paidType) {
        if (spec.tasks().isEmpty()) {
            throw new RunSpecException("run spec declares no tasks");
        }
        Map<String, Node> nodes = new LinkedHashMap<>();
        for (RunSpec.TaskSpec task : spec.tasks()) {
            if (task.id() == null || task.id().isBlank()) {
                throw new RunSpecException("task id must not be blank");
            }
            if (task.type() == null || task.type().isBlank()) {
                throw new RunSpecException("task " + task.id() + " has no type");
            }
            List<String> literal = new ArrayList<>(task.inputs().size());
            for (RunSpec.InputSpec input : task.inputs()) {
                if (input == null || input.artifact() == null || input.kinds() != 1) {
                    throw new RunSpecException("task " + task.id() + " has an input that is not an artifact reference");
                }
                literal.add(input.artifact());
            }
            boolean paid = task.paid() != null ? task.paid() : paidType.test(task.type());
            Node node = new Node(task.id(), task.type(), List.copyOf(literal), Jsons.canonicalBytes(task.params()),
                    task.dependsOn(), task.isBestEffort(), paid);
            if (nodes.putIfAbsent(task.id(), node) != null) {
                throw new RunSpecException("duplicate task id " + task.id());
            }
        }
        Map<String, List<String>> dependents = new HashMap<>();
        Map<String, Integer> indegree = new HashMap<>();
        for (Node node : nodes.values()) {
            indegree.putIfAbsent(node.id(), 0);
            for (String dep : node.dependsOn()) {
                if (!nodes.containsKey(dep)) {
                    throw new RunSpecException("task " + node.id() + " depends on unknown task " + dep);
                }
                if (dep.equals(node.id())) {
                    throw new RunSpecException("task " + node.id() + " depends on itself");
                }
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(node.id());
                indegree.merge(node.id(), 1, Integer::sum);
            }
        }
        // Kahn's algorithm in declaration order
        Deque<String> ready = new ArrayDeque<>();
        for (Node node : nodes.values()) {
            if (indegree.get(node.id()) == 0) {
                ready.add(node.id());
            }
        }
        List<Node> ordered = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            ordered.add(nodes.get(id));
            for (String child : dependents.getOrDefault(id, List.of())) {
                if (indegree.merge(child, -1, Integer::sum) == 0) {
                    ready.add(child);
                }
            }
        }
        if (ordered.size() != nodes.size()) {
            List<String> cyclic = new ArrayList<>();
            for (Node node : nodes.values()) {
                if (indegree.get(node.id()) > 0) {
                    cyclic.add(node.id());
                }
            }
            throw new RunSpecException("run spec has a dependency cycle through " + cyclic);
        }
        return new TaskGraph(Collections.unmodifiableMap(nodes), List.copyOf(ordered), dependents);
    }

    public Node node(String id) {
        Node node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("unknown task id " + id);
        }
        return node;
    }

    public List<Node> topologicalOrder() {
        return ordered;
    }

    public List<String> dependentsOf(String id) {
        return List.copyOf(dependents.getOrDefault(id, List.of()));
    }

    public int size() {
        return nodes.size();
    }

    /**
     * {@code literalInputs} are the node's own stored inputs; outputs of
     * {@code dependsOn} are appended in declared order when the node becomes ready.
     */
    public record Node(String id, String type, List<String> literalInputs, byte[] params, List<String> dependsOn,
                       boolean bestEffort, boolean paid) {
    }
}
