package com.medreferral.messaging.store;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Source of JDBC connections for the store.
 */
@FunctionalInterface
public interface ConnectionProvider {

    Connection getConnection() throws SQLException;

    static ConnectionProvider driverManager(String url, String user, String password) {
        return () -> DriverManager.getConnection(url, user, password);
    }
}
