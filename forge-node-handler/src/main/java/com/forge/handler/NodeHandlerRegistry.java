package com.forge.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of node handlers by node type. Register implementations so the engine can resolve
 * {@code nodeType} from workflow nodes. Unregistered types resolve to a {@link NotImplementedNodeHandler}
 * instead of failing.
 */
public final class NodeHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(NodeHandlerRegistry.class);

    /** nodeType → handler */
    private final Map<String, NodeHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Registers a handler under the given node type.
     *
     * @param nodeType node type (trimmed; must be non-blank)
     * @param handler  implementation
     * @throws IllegalArgumentException if nodeType is blank or a handler is already registered for it
     */
    public void register(String nodeType, NodeHandler handler) {
        Objects.requireNonNull(handler, "handler");
        String type = Objects.requireNonNull(nodeType, "nodeType").trim();
        if (type.isEmpty()) {
            throw new IllegalArgumentException("Node type must be non-blank");
        }
        if (handlers.putIfAbsent(type, handler) != null) {
            throw new IllegalArgumentException("Handler already registered for node type: " + type);
        }
    }

    /** Registers the provider's handler under its node type; skipped when the provider is disabled. */
    public boolean register(NodeHandlerProvider provider) {
        Objects.requireNonNull(provider, "provider");
        if (!provider.isEnabled()) {
            log.info("Node handler provider disabled, skipping | nodeType={}", provider.getNodeType());
            return false;
        }
        register(provider.getNodeType(), provider.getHandler());
        log.info("Registered node handler | nodeType={} version={}", provider.getNodeType(), provider.getVersion());
        return true;
    }

    /**
     * Discovers {@link NodeHandlerProvider}s with {@link ServiceLoader} and registers each enabled one.
     * A provider that fails to load or register is logged and skipped.
     *
     * @return number of handlers registered
     */
    public int registerDiscovered(ClassLoader classLoader) {
        int count = 0;
        ServiceLoader<NodeHandlerProvider> loader = ServiceLoader.load(NodeHandlerProvider.class,
                classLoader != null ? classLoader : Thread.currentThread().getContextClassLoader());
        for (ServiceLoader.Provider<NodeHandlerProvider> p : loader.stream().toList()) {
            try {
                if (register(p.get())) count++;
            } catch (RuntimeException | ServiceConfigurationError e) {
                log.error("Node handler provider failed to register (skipping): provider={}, error={}",
                        p.type().getName(), e.getMessage(), e);
            }
        }
        return count;
    }

    /**
     * Returns the handler registered for the node type, or a {@link NotImplementedNodeHandler}
     * when none is registered. Never null.
     */
    public NodeHandler resolve(String nodeType) {
        NodeHandler handler = nodeType != null ? handlers.get(nodeType.trim()) : null;
        return handler != null ? handler : new NotImplementedNodeHandler(nodeType);
    }

    public boolean isRegistered(String nodeType) {
        return nodeType != null && handlers.containsKey(nodeType.trim());
    }

    /** Registered node types, sorted. Unmodifiable. */
    public Set<String> getNodeTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
    }
}
