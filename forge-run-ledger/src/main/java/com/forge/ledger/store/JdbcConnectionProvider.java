package com.forge.ledger.store;

import com.forge.config.ForgeConfig;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.TimeZone;

/**
 * JDBC connections to the workflow database (PostgreSQL, UTC).
 */
public final class JdbcConnectionProvider implements ConnectionProvider {

    private final ForgeConfig config;

    public JdbcConnectionProvider(ForgeConfig config) {
        this.config = Objects.requireNonNull(config, "ForgeConfig");
    }

    @Override
    public Connection getConnection() throws SQLException {
        TimeZone prev = TimeZone.getDefault();
        try {
            TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
            return DriverManager.getConnection(config.getJdbcUrl(), config.getDbUser(),
                    config.getDbPassword() != null ? config.getDbPassword() : "");
        } finally {
            TimeZone.setDefault(prev);
        }
    }
}
