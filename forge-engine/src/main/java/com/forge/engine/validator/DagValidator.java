package com.forge.engine.validator;

import com.forge.graph.model.Workflow;
import com.forge.graph.model.WorkflowEdge;
import com.forge.graph.model.WorkflowNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural checks on a workflow graph: non-empty, unique node ids, edges referencing existing
 * nodes, no cycles. Nodes unreachable from trigger nodes produce a warning only. Stateless.
 */
public final class DagValidator {

    /** Validates the workflow's definition. Never throws for malformed graphs; problems are reported as errors. */
    public DagValidationResult validate(Workflow workflow) {
        List<WorkflowNode> nodes = workflow.getDefinition().getNodes();
        List<WorkflowEdge> edges = workflow.getDefinition().getEdges();
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (nodes.isEmpty()) {
            errors.add("Workflow must have at least one node");
            return new DagValidationResult(errors, warnings, null, null);
        }

        Set<String> nodeIds = new LinkedHashSet<>();
        for (int i = 0; i < nodes.size(); i++) {
            String id = nodes.get(i).getId();
            if (id == null || id.isBlank()) {
                errors.add("Node " + i + ": id is required");
            } else if (!nodeIds.add(id)) {
                errors.add("Duplicate node ID: " + id);
            }
        }
        for (int i = 0; i < edges.size(); i++) {
            WorkflowEdge e = edges.get(i);
            if (!nodeIds.contains(e.getSourceNodeId())) {
                errors.add("Edge " + i + ": source node '" + e.getSourceNodeId() + "' not found");
            }
            if (!nodeIds.contains(e.getTargetNodeId())) {
                errors.add("Edge " + i + ": target node '" + e.getTargetNodeId() + "' not found");
            }
        }

        Map<String, List<String>> adjacency = adjacency(nodeIds, edges);
        List<List<String>> cycles = detectCycles(adjacency);
        if (!cycles.isEmpty()) {
            errors.add("Workflow contains cycles: " + cycles.stream()
                    .map(c -> String.join(" -> ", c))
                    .collect(Collectors.joining(", ")));
        }

        List<String> unreachable = findUnreachableNodes(nodes, adjacency);
        if (!unreachable.isEmpty()) {
            warnings.add("Found " + unreachable.size() + " unreachable nodes");
        }
        return new DagValidationResult(errors, warnings, cycles, unreachable);
    }

    /** Successor lists in edge order; edges with an unknown endpoint are left out. */
    private static Map<String, List<String>> adjacency(Set<String> nodeIds, List<WorkflowEdge> edges) {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        for (String id : nodeIds) {
            graph.put(id, new ArrayList<>());
        }
        for (WorkflowEdge e : edges) {
            if (nodeIds.contains(e.getSourceNodeId()) && nodeIds.contains(e.getTargetNodeId())) {
                graph.get(e.getSourceNodeId()).add(e.getTargetNodeId());
            }
        }
        return graph;
    }

    private static List<List<String>> detectCycles(Map<String, List<String>> graph) {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String root : graph.keySet()) {
            if (!visited.contains(root)) {
                dfs(root, graph, visited, new HashSet<>(), new ArrayList<>(), cycles);
            }
        }
        return cycles;
    }

    /** @return true when a cycle was found below {@code nodeId}; the search of this root stops there */
    private static boolean dfs(String nodeId, Map<String, List<String>> graph, Set<String> visited,
                               Set<String> onStack, List<String> path, List<List<String>> cycles) {
        visited.add(nodeId);
        onStack.add(nodeId);
        path.add(nodeId);
        for (String next : graph.get(nodeId)) {
            if (!visited.contains(next)) {
                if (dfs(next, graph, visited, onStack, path, cycles)) return true;
            } else if (onStack.contains(next)) {
                cycles.add(new ArrayList<>(path.subList(path.indexOf(next), path.size())));
                return true;
            }
        }
        path.remove(path.size() - 1);
        onStack.remove(nodeId);
        return false;
    }

    private static List<String> findUnreachableNodes(List<WorkflowNode> nodes, Map<String, List<String>> graph) {
        Deque<String> queue = new ArrayDeque<>();
        for (WorkflowNode n : nodes) {
            if (n.isTrigger() && graph.containsKey(n.getId())) {
                queue.add(n.getId());
            }
        }
        if (queue.isEmpty()) return List.of();

        Set<String> reachable = new HashSet<>();
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!reachable.add(current)) continue;
            for (String next : graph.get(current)) {
                if (!reachable.contains(next)) {
                    queue.add(next);
                }
            }
        }
        List<String> out = new ArrayList<>();
        for (String id : graph.keySet()) {
            if (!reachable.contains(id)) {
                out.add(id);
            }
        }
        return out;
    }
}
