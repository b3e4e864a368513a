package com.forge.events;

/**
 * Receives lifecycle events synchronously on the orchestrator thread. Keep implementations fast;
 * exceptions are logged by the bus and never reach the execution.
 */
@FunctionalInterface
public interface ExecutionEventListener {

    void onEvent(ExecutionEvent event);
}
