package com.forge.handler;

/**
 * Contract for the code that runs one workflow node type. The engine resolves a handler by the
 * node's {@code nodeType} from {@link NodeHandlerRegistry} and calls {@link #execute} once per
 * node run.
 * <p>
 * <b>Threading:</b> nodes of the same parallel group run concurrently, so one handler instance
 * may be invoked from several threads at once. Implementations with mutable state must be
 * thread-safe.
 */
@FunctionalInterface
public interface NodeHandler {

    /**
     * Runs the node.
     *
     * @param context node identity, wired input, node config and upstream outputs; never null
     * @return node output (any JSON-serializable value; may be null)
     * @throws Exception on failure; the engine records it as a failed node result
     */
    Object execute(NodeExecutionContext context) throws Exception;
}
