package com.forge.bootstrap;

import com.forge.handler.NodeHandler;
import com.forge.handler.NodeHandlerException;
import com.forge.handler.NodeHandlerProvider;

import java.util.Map;

/** Test provider discovered through META-INF/services: upper-cases input "text". */
public final class UpperCaseNodeHandlerProvider implements NodeHandlerProvider {

    @Override
    public String getNodeType() {
        return "test_upper";
    }

    @Override
    public NodeHandler getHandler() {
        return ctx -> {
            String text = ctx.getInputValue("text", String.class);
            if (text == null) {
                throw new NodeHandlerException("MISSING_TEXT", "input 'text' is required");
            }
            return Map.of("text", text.toUpperCase());
        };
    }
}
