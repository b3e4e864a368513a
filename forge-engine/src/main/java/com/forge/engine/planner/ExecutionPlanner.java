package com.forge.engine.planner;

import com.forge.graph.model.Workflow;
import com.forge.graph.model.WorkflowEdge;
import com.forge.graph.model.WorkflowNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds an {@link ExecutionPlan} with Kahn's algorithm by waves. Group 0 holds the in-degree-0
 * nodes in definition order; each following group holds the successors whose in-degree dropped to
 * zero, in edge order. Expects a validated (acyclic) workflow: nodes on a cycle are never scheduled.
 */
public final class ExecutionPlanner {

    public static final long STEP_ESTIMATE_MILLIS = 1000L;

    public ExecutionPlan buildExecutionPlan(Workflow workflow) {
        List<WorkflowNode> nodes = workflow.getDefinition().getNodes();
        List<WorkflowEdge> edges = workflow.getDefinition().getEdges();

        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, Set<String>> dependencies = new HashMap<>();
        for (WorkflowNode n : nodes) {
            inDegree.put(n.getId(), 0);
            dependencies.put(n.getId(), new LinkedHashSet<>());
        }
        for (WorkflowEdge e : edges) {
            inDegree.merge(e.getTargetNodeId(), 1, Integer::sum);
            dependencies.computeIfAbsent(e.getTargetNodeId(), k -> new LinkedHashSet<>()).add(e.getSourceNodeId());
        }

        List<String> current = new ArrayList<>();
        for (WorkflowNode n : nodes) {
            if (inDegree.get(n.getId()) == 0) {
                current.add(n.getId());
            }
        }

        List<List<String>> groups = new ArrayList<>();
        List<ExecutionStep> steps = new ArrayList<>();
        while (!current.isEmpty()) {
            groups.add(current);
            boolean parallel = current.size() > 1;
            for (String nodeId : current) {
                steps.add(new ExecutionStep(nodeId, new ArrayList<>(dependencies.get(nodeId)), parallel, STEP_ESTIMATE_MILLIS));
            }
            Set<String> inGroup = Set.copyOf(current);
            Set<String> next = new LinkedHashSet<>();
            for (WorkflowEdge e : edges) {
                if (!inGroup.contains(e.getSourceNodeId())) continue;
                int degree = inDegree.merge(e.getTargetNodeId(), -1, Integer::sum);
                if (degree == 0) {
                    next.add(e.getTargetNodeId());
                }
            }
            current = new ArrayList<>(next);
        }
        return new ExecutionPlan(groups, steps);
    }
}
