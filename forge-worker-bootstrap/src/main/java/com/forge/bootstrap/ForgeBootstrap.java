package com.forge.bootstrap;

import com.forge.config.ForgeConfig;
import com.forge.engine.WorkflowOrchestrator;
import com.forge.events.ExecutionEventBus;
import com.forge.events.RedisExecutionEventPublisher;
import com.forge.features.metrics.MetricsObserver;
import com.forge.handler.NodeHandlerRegistry;
import com.forge.ledger.ExecutionStore;
import com.forge.ledger.FileWorkflowStore;
import com.forge.ledger.NoOpNodeLogSink;
import com.forge.ledger.NodeLogSink;
import com.forge.ledger.WorkflowStore;
import com.forge.ledger.memory.InMemoryExecutionStore;
import com.forge.ledger.schema.LedgerSchemaBootstrapper;
import com.forge.ledger.store.JdbcConnectionProvider;
import com.forge.ledger.store.JdbcExecutionStore;
import com.forge.ledger.store.JdbcNodeLogSink;
import com.forge.ledger.store.JdbcWorkflowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds a {@link WorkflowRuntime} from {@link ForgeConfig}: discovers node handlers, picks the
 * stores (PostgreSQL when the run ledger is enabled, otherwise workflow files plus in-memory
 * executions), wires metrics and the optional Redis event publisher, and creates the node pool.
 */
public final class ForgeBootstrap {

    private static final Logger log = LoggerFactory.getLogger(ForgeBootstrap.class);

    private ForgeBootstrap() {
    }

    public static WorkflowRuntime initialize() {
        log.info("Bootstrap: loading configuration from environment");
        return initialize(ForgeConfig.fromEnvironment());
    }

    public static WorkflowRuntime initialize(ForgeConfig config) {
        NodeHandlerRegistry registry = new NodeHandlerRegistry();
        int discovered = registry.registerDiscovered(ForgeBootstrap.class.getClassLoader());
        if (discovered == 0) {
            log.warn("No node handlers discovered; every node type will resolve to the not-implemented handler. "
                    + "Add providers via META-INF/services/com.forge.handler.NodeHandlerProvider");
        } else {
            log.info("Bootstrap: registered {} node handler(s): {}", discovered, registry.getNodeTypes());
        }

        WorkflowStore workflowStore;
        ExecutionStore executionStore;
        NodeLogSink nodeLogSink;
        if (config.isRunLedgerEnabled()) {
            JdbcConnectionProvider connections = new JdbcConnectionProvider(config);
            new LedgerSchemaBootstrapper(connections).ensureSchema();
            workflowStore = new JdbcWorkflowStore(connections);
            executionStore = new JdbcExecutionStore(connections);
            nodeLogSink = new JdbcNodeLogSink(connections);
            log.info("Bootstrap: run ledger enabled; using PostgreSQL at {}", config.getJdbcUrl());
        } else {
            Path dir = Path.of(config.getWorkflowDir());
            workflowStore = new FileWorkflowStore(dir);
            executionStore = new InMemoryExecutionStore();
            nodeLogSink = new NoOpNodeLogSink();
            log.info("Bootstrap: run ledger disabled; workflows from {}, executions kept in memory", dir.toAbsolutePath());
        }

        MetricsObserver metrics = new MetricsObserver();
        ExecutionEventBus eventBus = new ExecutionEventBus().subscribe(metrics);
        List<AutoCloseable> closeables = new ArrayList<>();
        if (config.isEventsEnabled()) {
            RedisExecutionEventPublisher publisher = new RedisExecutionEventPublisher(config);
            eventBus.subscribe(publisher);
            closeables.add(publisher);
        }

        ExecutorService nodeExecutor = Executors.newFixedThreadPool(config.getGroupParallelism(), nodeThreadFactory());
        WorkflowOrchestrator orchestrator = WorkflowOrchestrator.builder()
                .workflowStore(workflowStore)
                .executionStore(executionStore)
                .handlerRegistry(registry)
                .nodeLogSink(nodeLogSink)
                .eventBus(eventBus)
                .observer(metrics)
                .executor(nodeExecutor)
                .failOnNodeError(config.isFailOnNodeError())
                .build();
        log.info("Bootstrap: orchestrator ready; groupParallelism={} failOnNodeError={} eventsEnabled={}",
                config.getGroupParallelism(), config.isFailOnNodeError(), config.isEventsEnabled());
        return new WorkflowRuntime(config, orchestrator, registry, executionStore, eventBus, metrics, nodeExecutor, closeables);
    }

    private static ThreadFactory nodeThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "forge-node-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
