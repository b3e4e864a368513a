package com.forge.handler;

import java.util.Map;

/**
 * Handler used for node types nobody registered. Does not fail: returns a placeholder output
 * {@code {"output": "Node type <type> not implemented yet"}}.
 */
public final class NotImplementedNodeHandler implements NodeHandler {

    static final String OUTPUT_KEY = "output";

    private final String nodeType;

    public NotImplementedNodeHandler(String nodeType) {
        this.nodeType = nodeType;
    }

    @Override
    public Object execute(NodeExecutionContext context) {
        return Map.of(OUTPUT_KEY, "Node type " + nodeType + " not implemented yet");
    }

    public String getNodeType() {
        return nodeType;
    }
}
