/**
 * Workflow graph model and JSON serialization.
 *
 * <ul>
 *   <li>{@link com.forge.graph.model} – {@link com.forge.graph.model.Workflow},
 *       {@link com.forge.graph.model.WorkflowDefinition}, {@link com.forge.graph.model.WorkflowNode},
 *       {@link com.forge.graph.model.WorkflowEdge}, {@link com.forge.graph.model.NodeCategory}</li>
 *   <li>{@link com.forge.graph.WorkflowGraphConfig} – {@code fromJson}/{@code toJson} for workflows
 *       and definitions</li>
 * </ul>
 */
package com.forge.graph;
