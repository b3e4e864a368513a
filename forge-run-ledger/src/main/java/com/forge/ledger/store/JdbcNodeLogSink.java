package com.forge.ledger.store;

import com.forge.ledger.NodeExecutionLog;
import com.forge.ledger.NodeLogSink;
import com.forge.ledger.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Appends node run records to forge_workflow_execution_log. One INSERT per record; never updates.
 */
public final class JdbcNodeLogSink implements NodeLogSink {

    private static final String TABLE = "forge_workflow_execution_log";
    private static final Logger log = LoggerFactory.getLogger(JdbcNodeLogSink.class);

    private final ConnectionProvider connections;

    public JdbcNodeLogSink(ConnectionProvider connections) {
        this.connections = Objects.requireNonNull(connections, "connections");
    }

    @Override
    public void append(NodeExecutionLog record) {
        String sql = "INSERT INTO " + TABLE + " (execution_id, node_id, node_key, node_type, status, output_data, error_data, "
                + "latency_ms, completed_at) VALUES (?,?,?,?,?,?,?,?,?)";
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, LedgerSqlUtils.toUuid(record.getExecutionId()));
            ps.setString(2, record.getNodeId());
            ps.setString(3, LedgerSqlUtils.toName(record.getNodeKey(), LedgerSqlUtils.NAME_MAX_LEN));
            ps.setString(4, LedgerSqlUtils.toName(record.getNodeType(), LedgerSqlUtils.NAME_MAX_LEN));
            ps.setString(5, record.getStatus());
            ps.setObject(6, LedgerSqlUtils.toJsonb(record.getOutputData()));
            ps.setObject(7, LedgerSqlUtils.toJsonb(record.getErrorData()));
            ps.setLong(8, record.getLatencyMs());
            ps.setTimestamp(9, LedgerSqlUtils.toTimestamp(record.getCompletedAt()));
            ps.executeUpdate();
            log.debug("Node log appended | {} | executionId={} nodeId={} status={}", TABLE, record.getExecutionId(),
                    record.getNodeId(), record.getStatus());
        } catch (SQLException e) {
            throw new PersistenceException("appendNodeLog", "executionId=" + record.getExecutionId()
                    + " nodeId=" + record.getNodeId() + " error=" + e.getMessage(), e);
        }
    }
}
