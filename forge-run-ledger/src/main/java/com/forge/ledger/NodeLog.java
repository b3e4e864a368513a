package com.forge.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fail-safe facade for the node log. All writes delegate to {@link NodeLogSink}; any exception
 * from the sink is caught, logged, and not rethrown so node execution never fails because of it.
 */
public final class NodeLog {

    private static final Logger log = LoggerFactory.getLogger(NodeLog.class);

    private final NodeLogSink sink;

    public NodeLog(NodeLogSink sink) {
        this.sink = sink != null ? sink : new NoOpNodeLogSink();
    }

    /** @return true when the sink accepted the record */
    public boolean append(NodeExecutionLog record) {
        try {
            sink.append(record);
            return true;
        } catch (Throwable t) {
            log.warn("Node log append failed (executionId={}, nodeId={}); execution continues. Error: {}",
                    record.getExecutionId(), record.getNodeId(), t.getMessage(), t);
            return false;
        }
    }
}
