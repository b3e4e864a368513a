package com.forge.ledger.store;

import com.forge.ledger.ExecutionStatus;
import com.forge.ledger.ExecutionStore;
import com.forge.ledger.PersistenceException;
import com.forge.ledger.WorkflowExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Execution records in table forge_workflow_execution. Ids are random UUIDs assigned on create.
 * Terminal updates only apply to rows that are not yet terminal.
 */
public final class JdbcExecutionStore implements ExecutionStore {

    private static final String TABLE = "forge_workflow_execution";
    private static final String COLUMNS = "id, workflow_id, status, triggered_by, input_data, result_data, error_data, "
            + "partial_failure, failed_node_ids, started_at, completed_at";
    private static final Logger log = LoggerFactory.getLogger(JdbcExecutionStore.class);

    private final ConnectionProvider connections;

    public JdbcExecutionStore(ConnectionProvider connections) {
        this.connections = Objects.requireNonNull(connections, "connections");
    }

    @Override
    public WorkflowExecution create(WorkflowExecution execution) {
        UUID id = UUID.randomUUID();
        String sql = "INSERT INTO " + TABLE + " (id, workflow_id, status, triggered_by, input_data, started_at) VALUES (?,?,?,?,?,?)";
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, id);
            ps.setString(2, execution.getWorkflowId());
            ps.setString(3, execution.getStatus().toValue());
            ps.setString(4, LedgerSqlUtils.toName(execution.getTriggeredBy(), LedgerSqlUtils.NAME_MAX_LEN));
            ps.setObject(5, LedgerSqlUtils.toJsonb(execution.getInputData()));
            ps.setTimestamp(6, LedgerSqlUtils.toTimestamp(execution.getStartedAt()));
            ps.executeUpdate();
            log.info("Execution created | {} | executionId={} workflowId={} status={}", TABLE, id,
                    execution.getWorkflowId(), execution.getStatus().toValue());
            return execution.withId(id.toString());
        } catch (SQLException e) {
            throw new PersistenceException("createExecution", "workflowId=" + execution.getWorkflowId() + " error=" + e.getMessage(), e);
        }
    }

    @Override
    public void update(WorkflowExecution execution) {
        String sql = "UPDATE " + TABLE + " SET status=?, result_data=?, error_data=?, partial_failure=?, failed_node_ids=?, "
                + "completed_at=? WHERE id=? AND status NOT IN ('completed','failed')";
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, execution.getStatus().toValue());
            ps.setObject(2, LedgerSqlUtils.toJsonb(execution.getResultData()));
            ps.setObject(3, LedgerSqlUtils.toJsonb(execution.getErrorData()));
            ps.setBoolean(4, execution.isPartialFailure());
            ps.setObject(5, LedgerSqlUtils.toJsonb(execution.getFailedNodeIds()));
            ps.setTimestamp(6, LedgerSqlUtils.toTimestamp(execution.getCompletedAt()));
            ps.setObject(7, LedgerSqlUtils.toUuid(execution.getId()));
            int rows = ps.executeUpdate();
            if (rows != 1) {
                throw new PersistenceException("updateExecution",
                        "executionId=" + execution.getId() + " not found or already terminal");
            }
            log.info("Execution updated | {} | executionId={} status={} partialFailure={}", TABLE, execution.getId(),
                    execution.getStatus().toValue(), execution.isPartialFailure());
        } catch (SQLException e) {
            throw new PersistenceException("updateExecution", "executionId=" + execution.getId() + " error=" + e.getMessage(), e);
        }
    }

    @Override
    public Optional<WorkflowExecution> findById(String executionId) {
        String sql = "SELECT " + COLUMNS + " FROM " + TABLE + " WHERE id=?";
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, LedgerSqlUtils.toUuid(executionId));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new PersistenceException("findExecution", "executionId=" + executionId + " error=" + e.getMessage(), e);
        }
    }

    @Override
    public List<WorkflowExecution> findByWorkflowId(String workflowId) {
        String sql = "SELECT " + COLUMNS + " FROM " + TABLE + " WHERE workflow_id=? ORDER BY started_at";
        List<WorkflowExecution> out = new ArrayList<>();
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, workflowId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readRow(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new PersistenceException("listExecutions", "workflowId=" + workflowId + " error=" + e.getMessage(), e);
        }
    }

    private static WorkflowExecution readRow(ResultSet rs) throws SQLException {
        Object id = rs.getObject("id");
        return new WorkflowExecution(
                id != null ? id.toString() : null,
                rs.getString("workflow_id"),
                ExecutionStatus.fromValue(rs.getString("status")),
                rs.getString("triggered_by"),
                LedgerSqlUtils.toMap(rs.getString("input_data")),
                LedgerSqlUtils.toMap(rs.getString("result_data")),
                LedgerSqlUtils.toMap(rs.getString("error_data")),
                rs.getBoolean("partial_failure"),
                LedgerSqlUtils.toStringList(rs.getString("failed_node_ids")),
                LedgerSqlUtils.toInstant(rs.getTimestamp("started_at")),
                LedgerSqlUtils.toInstant(rs.getTimestamp("completed_at")));
    }
}
