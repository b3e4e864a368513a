/**
 * Persistence for workflows, execution records and node run records.
 * <p>
 * {@link com.forge.ledger.WorkflowStore}, {@link com.forge.ledger.ExecutionStore} and
 * {@link com.forge.ledger.NodeLogSink} have in-memory, file and PostgreSQL implementations.
 * Node records go through the fail-safe {@link com.forge.ledger.NodeLog} facade.
 */
package com.forge.ledger;
