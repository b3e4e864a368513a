package com.forge.ledger.memory;

import com.forge.ledger.NodeExecutionLog;
import com.forge.ledger.NodeLogSink;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Collects node run records in append order. */
public final class InMemoryNodeLogSink implements NodeLogSink {

    private final List<NodeExecutionLog> records = new CopyOnWriteArrayList<>();

    @Override
    public void append(NodeExecutionLog record) {
        records.add(record);
    }

    public List<NodeExecutionLog> getRecords() {
        return List.copyOf(records);
    }

    public List<NodeExecutionLog> forExecution(String executionId) {
        List<NodeExecutionLog> out = new ArrayList<>();
        for (NodeExecutionLog r : records) {
            if (executionId.equals(r.getExecutionId())) {
                out.add(r);
            }
        }
        return out;
    }
}
