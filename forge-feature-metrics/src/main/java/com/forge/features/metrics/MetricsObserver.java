package com.forge.features.metrics;

import com.forge.engine.node.NodeExecutionObserver;
import com.forge.engine.node.NodeExecutionResult;
import com.forge.events.ExecutionEvent;
import com.forge.events.ExecutionEventListener;
import com.forge.handler.NodeExecutionContext;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Records node and workflow execution metrics:
 * <ul>
 *   <li>{@code forge.node.executions} counter tagged nodeType, outcome (success|failure)</li>
 *   <li>{@code forge.node.latency} timer tagged nodeType, outcome</li>
 *   <li>{@code forge.workflow.executions} counter tagged event (started|completed|failed)</li>
 * </ul>
 * Register as a node observer on the orchestrator and as a listener on the event bus.
 */
public final class MetricsObserver implements NodeExecutionObserver, ExecutionEventListener {

    static final String NODE_EXECUTIONS = "forge.node.executions";
    static final String NODE_LATENCY = "forge.node.latency";
    static final String WORKFLOW_EXECUTIONS = "forge.workflow.executions";

    private final MeterRegistry registry;

    public MetricsObserver() {
        this(new SimpleMeterRegistry());
    }

    public MetricsObserver(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public void afterNode(NodeExecutionContext context, NodeExecutionResult result) {
        String nodeType = nullToUnknown(context.getNodeType());
        String outcome = result.isSuccess() ? "success" : "failure";

        registry.counter(NODE_EXECUTIONS, "nodeType", nodeType, "outcome", outcome).increment();
        Timer.builder(NODE_LATENCY)
                .tag("nodeType", nodeType)
                .tag("outcome", outcome)
                .register(registry)
                .record(result.getLatencyMs(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void onEvent(ExecutionEvent event) {
        String name = event.getType().name().toLowerCase();
        registry.counter(WORKFLOW_EXECUTIONS, "event", name).increment();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    private static String nullToUnknown(String s) {
        return s != null && !s.isBlank() ? s : "unknown";
    }
}
