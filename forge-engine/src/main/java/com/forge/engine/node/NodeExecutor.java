package com.forge.engine.node;

import com.forge.engine.error.ErrorData;
import com.forge.graph.model.Workflow;
import com.forge.graph.model.WorkflowEdge;
import com.forge.graph.model.WorkflowNode;
import com.forge.handler.CancellationToken;
import com.forge.handler.NodeExecutionContext;
import com.forge.handler.NodeHandler;
import com.forge.handler.NodeHandlerException;
import com.forge.handler.NodeHandlerRegistry;
import com.forge.ledger.NodeExecutionLog;
import com.forge.ledger.NodeLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs a single node: wires its input from upstream outputs, dispatches to the registered handler,
 * times the call and converts any handler exception into a failed result. Writes exactly one node
 * log record per run. Safe to call concurrently for different nodes.
 */
public final class NodeExecutor {

    private static final Logger log = LoggerFactory.getLogger(NodeExecutor.class);

    private final NodeHandlerRegistry registry;
    private final NodeLog nodeLog;
    private final List<NodeExecutionObserver> observers;

    public NodeExecutor(NodeHandlerRegistry registry, NodeLog nodeLog, List<NodeExecutionObserver> observers) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.nodeLog = Objects.requireNonNull(nodeLog, "nodeLog");
        this.observers = observers != null ? List.copyOf(observers) : List.of();
    }

    /**
     * Executes one node. Never throws for handler failures, including {@link Error}s raised by the
     * handler; those become a failed result like any exception.
     *
     * @param previousOutputs read-only snapshot of outputs recorded by earlier groups
     */
    public NodeExecutionResult executeNode(Workflow workflow, WorkflowNode node, Map<String, Object> workflowInput,
                                           Map<String, Object> previousOutputs, String executionId,
                                           CancellationToken cancellation) {
        Map<String, Object> input = buildInput(workflow, node, workflowInput, previousOutputs);
        NodeExecutionContext context = new NodeExecutionContext(workflow.getId(), executionId, node.getId(),
                node.getNodeType(), input, node.getConfig(), previousOutputs, cancellation);
        notifyBefore(context);

        NodeHandler handler = registry.resolve(node.getNodeType());
        long start = System.nanoTime();
        NodeExecutionResult result;
        Map<String, Object> errorData = null;
        try {
            Object output = handler.execute(context);
            result = NodeExecutionResult.success(node.getId(), output, elapsedMillis(start));
            log.debug("Node completed | executionId={} | nodeId={} | nodeType={} | latencyMs={}",
                    executionId, node.getId(), node.getNodeType(), result.getLatencyMs());
        } catch (Throwable e) {
            long latency = elapsedMillis(start);
            errorData = ErrorData.of(e);
            result = NodeExecutionResult.failure(node.getId(), toNodeError(e), latency);
            log.warn("Node failed | executionId={} | nodeId={} | nodeType={} | latencyMs={} | code={} | error={}",
                    executionId, node.getId(), node.getNodeType(), latency, result.getError().getCode(),
                    result.getError().getMessage(), e);
        }

        nodeLog.append(new NodeExecutionLog(executionId, node.getId(), node.getNodeKey(), node.getNodeType(),
                result.isSuccess() ? NodeExecutionLog.STATUS_COMPLETED : NodeExecutionLog.STATUS_FAILED,
                result.getOutput(), errorData, result.getLatencyMs(), Instant.now()));
        notifyAfter(context, result);
        return result;
    }

    /**
     * Input map keyed by target port (source node id when the port is blank), holding the recorded
     * non-null output of each upstream node. Falls back to the workflow input when nothing was wired.
     */
    static Map<String, Object> buildInput(Workflow workflow, WorkflowNode node, Map<String, Object> workflowInput,
                                          Map<String, Object> previousOutputs) {
        Map<String, Object> input = new LinkedHashMap<>();
        for (WorkflowEdge edge : workflow.getDefinition().incomingEdges(node.getId())) {
            Object upstream = previousOutputs != null ? previousOutputs.get(edge.getSourceNodeId()) : null;
            if (upstream == null) continue;
            String port = edge.getTargetPort();
            input.put(port != null && !port.isBlank() ? port : edge.getSourceNodeId(), upstream);
        }
        if (input.isEmpty()) {
            return workflowInput != null ? workflowInput : Map.of();
        }
        return input;
    }

    private static NodeError toNodeError(Throwable e) {
        String code = e instanceof NodeHandlerException nhe && nhe.getCode() != null
                ? nhe.getCode()
                : e.getClass().getName();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("exception", e.getClass().getName());
        details.put("stack", ErrorData.stackTrace(e));
        return new NodeError(ErrorData.messageOf(e), code, details);
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private void notifyBefore(NodeExecutionContext context) {
        for (NodeExecutionObserver o : observers) {
            try {
                o.beforeNode(context);
            } catch (RuntimeException e) {
                log.warn("Node observer failed before node | nodeId={} | observer={} | error={}",
                        context.getNodeId(), o.getClass().getName(), e.getMessage(), e);
            }
        }
    }

    private void notifyAfter(NodeExecutionContext context, NodeExecutionResult result) {
        for (NodeExecutionObserver o : observers) {
            try {
                o.afterNode(context, result);
            } catch (RuntimeException e) {
                log.warn("Node observer failed after node | nodeId={} | observer={} | error={}",
                        context.getNodeId(), o.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
