package com.forge.handler;

/**
 * SPI for pluggable node handlers. Implementations are discovered via {@link java.util.ServiceLoader}
 * (META-INF/services/com.forge.handler.NodeHandlerProvider) and registered under
 * {@link #getNodeType()}; no engine code changes are required for new node types.
 */
public interface NodeHandlerProvider {

    /** Node type this provider handles (e.g. "data_supabase_query"). Must match {@code nodeType} in workflow definitions. */
    String getNodeType();

    /** Handler instance; called once at registration. */
    NodeHandler getHandler();

    /** Handler version for audit (e.g. "1.0"). */
    default String getVersion() {
        return "1.0";
    }

    /** Whether this provider should be registered. Override to skip registration when env is unset. */
    default boolean isEnabled() {
        return true;
    }
}
