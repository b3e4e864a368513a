package com.forge.ledger.store;

import java.sql.Connection;
import java.sql.SQLException;

/** Source of JDBC connections shared by the JDBC stores and the schema bootstrapper. */
@FunctionalInterface
public interface ConnectionProvider {
    Connection getConnection() throws SQLException;
}
