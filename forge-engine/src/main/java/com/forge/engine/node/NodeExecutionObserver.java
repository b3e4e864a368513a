package com.forge.engine.node;

import com.forge.handler.NodeExecutionContext;

/**
 * Hook around each node run (metrics, tracing). Called on the thread running the node;
 * exceptions are logged and ignored.
 */
public interface NodeExecutionObserver {

    default void beforeNode(NodeExecutionContext context) {
    }

    void afterNode(NodeExecutionContext context, NodeExecutionResult result);
}
