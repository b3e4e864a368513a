package com.forge.ledger.schema;

import com.forge.ledger.PersistenceException;
import com.forge.ledger.store.ConnectionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Loads and executes the ledger schema script (forge_workflow, forge_workflow_execution,
 * forge_workflow_execution_log). Idempotent; safe to call at bootstrap.
 */
public final class LedgerSchemaBootstrapper {

    static final String SCHEMA_RESOURCE = "schema/forge-ledger.sql";
    private static final Logger log = LoggerFactory.getLogger(LedgerSchemaBootstrapper.class);

    private final ConnectionProvider connections;
    private final AtomicBoolean schemaInitialized = new AtomicBoolean(false);

    public LedgerSchemaBootstrapper(ConnectionProvider connections) {
        this.connections = Objects.requireNonNull(connections, "connections");
    }

    /** Creates tables and indexes if they do not exist. Runs at most once per instance. */
    public void ensureSchema() {
        if (!schemaInitialized.compareAndSet(false, true)) {
            log.debug("Ledger schema already initialized; skipping");
            return;
        }
        List<String> statements = statements(loadSchemaScript());
        log.info("Ledger schema: executing {} statement(s) from {}", statements.size(), SCHEMA_RESOURCE);
        try (Connection c = connections.getConnection(); Statement st = c.createStatement()) {
            int index = 0;
            for (String stmt : statements) {
                index++;
                String preview = stmt.length() > 60 ? stmt.substring(0, 60) + "..." : stmt;
                log.debug("Ledger schema: statement {}/{}: {}", index, statements.size(), preview);
                try {
                    st.execute(stmt);
                } catch (SQLException e) {
                    log.error("Ledger schema: statement {}/{} failed. SQL: {} | Error: {} | SQLState: {}",
                            index, statements.size(), preview, e.getMessage(), e.getSQLState(), e);
                    throw new PersistenceException("ensureSchema", "statement " + index + ": " + e.getMessage(), e);
                }
            }
            log.info("Ledger schema: all {} statement(s) executed successfully", statements.size());
        } catch (SQLException e) {
            schemaInitialized.set(false);
            throw new PersistenceException("ensureSchema", e.getMessage(), e);
        }
    }

    /** Splits a script on ';' after dropping full-line "--" comments. */
    static List<String> statements(String sql) {
        List<String> out = new ArrayList<>();
        for (String raw : sql.split(";")) {
            String stmt = raw.replaceAll("(?m)^\\s*--[^\n]*\n?", "").trim();
            if (!stmt.isEmpty()) {
                out.add(stmt);
            }
        }
        return out;
    }

    static String loadSchemaScript() {
        try (InputStream in = LedgerSchemaBootstrapper.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new PersistenceException("ensureSchema", "schema resource not found: " + SCHEMA_RESOURCE);
            }
            return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)).lines()
                    .collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new PersistenceException("ensureSchema", "cannot read " + SCHEMA_RESOURCE + ": " + e.getMessage(), e);
        }
    }
}
