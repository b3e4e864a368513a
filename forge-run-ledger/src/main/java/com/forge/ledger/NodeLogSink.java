package com.forge.ledger;

/**
 * Append-only sink for node run records. Use through {@link NodeLog} so a failing sink never fails
 * an execution.
 */
@FunctionalInterface
public interface NodeLogSink {

    void append(NodeExecutionLog record);
}
