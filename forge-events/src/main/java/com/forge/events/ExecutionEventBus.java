package com.forge.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process fan-out of lifecycle events to registered listeners, in registration order.
 * A failing listener is logged at WARN and does not stop delivery to the others.
 */
public final class ExecutionEventBus {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEventBus.class);

    private final List<ExecutionEventListener> listeners = new CopyOnWriteArrayList<>();

    public ExecutionEventBus subscribe(ExecutionEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        return this;
    }

    public boolean unsubscribe(ExecutionEventListener listener) {
        return listeners.remove(listener);
    }

    public void publish(ExecutionEvent event) {
        log.debug("Publishing event | event={} | workflowId={} | executionId={} | listeners={}",
                event.getName(), event.getWorkflowId(), event.getExecutionId(), listeners.size());
        for (ExecutionEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Event listener failed | event={} | executionId={} | listener={} | error={}",
                        event.getName(), event.getExecutionId(), listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }
}
