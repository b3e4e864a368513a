package com.forge.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** No-op sink when the run ledger is disabled. Logs at debug so the node-log path stays visible. */
public final class NoOpNodeLogSink implements NodeLogSink {

    private static final Logger log = LoggerFactory.getLogger(NoOpNodeLogSink.class);

    @Override
    public void append(NodeExecutionLog record) {
        log.debug("Node log (no-op) | executionId={} | nodeId={} | status={} | latencyMs={}",
                record.getExecutionId(), record.getNodeId(), record.getStatus(), record.getLatencyMs());
    }
}
