package com.forge.bootstrap;

import com.forge.config.ForgeConfig;
import com.forge.engine.WorkflowOrchestrator;
import com.forge.events.ExecutionEventBus;
import com.forge.features.metrics.MetricsObserver;
import com.forge.handler.NodeHandlerRegistry;
import com.forge.ledger.ExecutionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Everything wired by {@link ForgeBootstrap}. Closing it stops the node worker pool and releases
 * external connections.
 */
public final class WorkflowRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRuntime.class);
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final ForgeConfig config;
    private final WorkflowOrchestrator orchestrator;
    private final NodeHandlerRegistry handlerRegistry;
    private final ExecutionStore executionStore;
    private final ExecutionEventBus eventBus;
    private final MetricsObserver metrics;
    private final ExecutorService nodeExecutor;
    private final List<AutoCloseable> closeables;

    WorkflowRuntime(ForgeConfig config, WorkflowOrchestrator orchestrator, NodeHandlerRegistry handlerRegistry,
                    ExecutionStore executionStore, ExecutionEventBus eventBus, MetricsObserver metrics,
                    ExecutorService nodeExecutor, List<AutoCloseable> closeables) {
        this.config = config;
        this.orchestrator = orchestrator;
        this.handlerRegistry = handlerRegistry;
        this.executionStore = executionStore;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.nodeExecutor = nodeExecutor;
        this.closeables = List.copyOf(closeables);
    }

    public ForgeConfig getConfig() {
        return config;
    }

    public WorkflowOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public NodeHandlerRegistry getHandlerRegistry() {
        return handlerRegistry;
    }

    public ExecutionStore getExecutionStore() {
        return executionStore;
    }

    public ExecutionEventBus getEventBus() {
        return eventBus;
    }

    public MetricsObserver getMetrics() {
        return metrics;
    }

    @Override
    public void close() {
        nodeExecutor.shutdown();
        try {
            if (!nodeExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                nodeExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            nodeExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        for (AutoCloseable c : closeables) {
            try {
                c.close();
            } catch (Exception e) {
                log.warn("Error closing {}: {}", c.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
        log.info("Workflow runtime stopped");
    }
}
