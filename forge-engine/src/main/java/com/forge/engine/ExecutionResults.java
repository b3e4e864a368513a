package com.forge.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Node id → output map scoped to one execution. Each node id can be recorded once; outputs may be
 * null (failed nodes). Written only by the orchestrating thread between group joins, so no locking.
 */
public final class ExecutionResults {

    private final Map<String, Object> outputs = new LinkedHashMap<>();

    /**
     * @throws IllegalStateException when the node already has a recorded output
     */
    public void record(String nodeId, Object output) {
        if (outputs.containsKey(nodeId)) {
            throw new IllegalStateException("Output already recorded for node " + nodeId);
        }
        outputs.put(nodeId, output);
    }

    public boolean contains(String nodeId) {
        return outputs.containsKey(nodeId);
    }

    public Object get(String nodeId) {
        return outputs.get(nodeId);
    }

    /** Read-only copy handed to node runs of the next group. */
    public Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    public int size() {
        return outputs.size();
    }
}
