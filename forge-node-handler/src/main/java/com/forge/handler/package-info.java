/**
 * Node handler contracts and registry. Handlers implement {@link com.forge.handler.NodeHandler}
 * and are registered with {@link com.forge.handler.NodeHandlerRegistry} by node type so the engine
 * can dispatch workflow nodes.
 * <ul>
 *   <li>{@link com.forge.handler.NodeHandler} – execute(NodeExecutionContext) → output</li>
 *   <li>{@link com.forge.handler.NodeHandlerProvider} – SPI for discovery (ServiceLoader)</li>
 *   <li>{@link com.forge.handler.NotImplementedNodeHandler} – placeholder for unregistered types</li>
 *   <li>{@link com.forge.handler.CancellationToken} – cooperative cancellation per execution</li>
 * </ul>
 */
package com.forge.handler;
