package com.forge.ledger.store;

import com.forge.graph.WorkflowGraphConfig;
import com.forge.graph.model.Workflow;
import com.forge.ledger.PersistenceException;
import com.forge.ledger.WorkflowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

/**
 * Workflows in table forge_workflow; the definition column holds the node/edge graph as JSONB.
 */
public final class JdbcWorkflowStore implements WorkflowStore {

    private static final String TABLE = "forge_workflow";
    private static final Logger log = LoggerFactory.getLogger(JdbcWorkflowStore.class);

    private final ConnectionProvider connections;

    public JdbcWorkflowStore(ConnectionProvider connections) {
        this.connections = Objects.requireNonNull(connections, "connections");
    }

    @Override
    public Optional<Workflow> findById(String workflowId) {
        String sql = "SELECT id, name, definition FROM " + TABLE + " WHERE id=?";
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, workflowId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                String definitionJson = rs.getString("definition");
                return Optional.of(new Workflow(rs.getString("id"), rs.getString("name"),
                        WorkflowGraphConfig.definitionFromJson(definitionJson)));
            }
        } catch (SQLException e) {
            throw new PersistenceException("findWorkflow", "workflowId=" + workflowId + " error=" + e.getMessage(), e);
        } catch (UncheckedIOException e) {
            throw new PersistenceException("findWorkflow", "workflowId=" + workflowId + " has an unreadable definition", e);
        }
    }

    /** Inserts or replaces a workflow (upsert on id). */
    public void save(Workflow workflow) {
        String sql = "INSERT INTO " + TABLE + " (id, name, definition) VALUES (?,?,?) "
                + "ON CONFLICT (id) DO UPDATE SET name=EXCLUDED.name, definition=EXCLUDED.definition";
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, workflow.getId());
            ps.setString(2, LedgerSqlUtils.toName(workflow.getName(), LedgerSqlUtils.NAME_MAX_LEN));
            ps.setObject(3, LedgerSqlUtils.toJsonbPgObject(WorkflowGraphConfig.toJson(workflow.getDefinition())));
            ps.executeUpdate();
            log.info("Workflow saved | {} | workflowId={} nodes={}", TABLE, workflow.getId(),
                    workflow.getDefinition().getNodes().size());
        } catch (SQLException e) {
            throw new PersistenceException("saveWorkflow", "workflowId=" + workflow.getId() + " error=" + e.getMessage(), e);
        }
    }
}
