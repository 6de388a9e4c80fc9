/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.jdbc;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.logrepl.annotation.NotThreadSafe;

/**
 * A lazily established JDBC connection with helpers for executing statements and mapping query results.
 */
@NotThreadSafe
public class JdbcConnection implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcConnection.class);

    /**
     * Establishes JDBC connections.
     */
    @FunctionalInterface
    public interface ConnectionFactory {
        /**
         * Establish a new connection to the database.
         *
         * @return the JDBC connection; may not be null
         * @throws SQLException if there is an error connecting to the database
         */
        Connection connect() throws SQLException;
    }

    /**
     * Applies a series of operations to a JDBC statement.
     */
    @FunctionalInterface
    public interface Operations {
        void apply(Statement statement) throws SQLException;
    }

    @FunctionalInterface
    public interface ResultSetMapper<T> {
        T apply(ResultSet rs) throws SQLException;
    }

    /**
     * Create a {@link ConnectionFactory} that connects to the given JDBC URL through {@link DriverManager}.
     *
     * @param url the JDBC URL, which may carry the credentials as parameters; may not be null
     */
    public static ConnectionFactory urlBasedFactory(String url) {
        return () -> {
            LOGGER.trace("Connecting to '{}'", maskPassword(url));
            return DriverManager.getConnection(url);
        };
    }

    private final ConnectionFactory factory;
    private Connection conn;

    public JdbcConnection(ConnectionFactory factory) {
        this.factory = factory;
    }

    /**
     * Ensure a connection to the database is established.
     *
     * @return this object for chaining methods together
     */
    public JdbcConnection connect() throws SQLException {
        connection();
        return this;
    }

    /**
     * Execute a series of SQL statements as a single transaction.
     *
     * @return this object for chaining methods together
     * @throws SQLException if there is an error connecting to the database or executing the statements
     */
    public JdbcConnection execute(String... sqlStatements) throws SQLException {
        return execute(statement -> {
            for (String sqlStatement : sqlStatements) {
                if (sqlStatement != null) {
                    if (LOGGER.isTraceEnabled()) {
                        LOGGER.trace("executing '{}'", sqlStatement);
                    }
                    statement.execute(sqlStatement);
                }
            }
        });
    }

    /**
     * Execute a series of operations as a single transaction.
     *
     * @return this object for chaining methods together
     */
    public JdbcConnection execute(Operations operations) throws SQLException {
        Connection conn = connection();
        try (Statement statement = conn.createStatement()) {
            operations.apply(statement);
            commit();
        }
        return this;
    }

    /**
     * Execute a SQL query and map its result set.
     */
    public <T> T queryAndMap(String query, ResultSetMapper<T> mapper) throws SQLException {
        Connection conn = connection();
        try (Statement statement = conn.createStatement();
                ResultSet resultSet = statement.executeQuery(query)) {
            return mapper.apply(resultSet);
        }
    }

    public JdbcConnection commit() throws SQLException {
        Connection conn = connection();
        if (!conn.getAutoCommit()) {
            conn.commit();
        }
        return this;
    }

    public boolean isConnected() throws SQLException {
        return conn != null && !conn.isClosed();
    }

    public Connection connection() throws SQLException {
        if (!isConnected()) {
            conn = factory.connect();
            if (!isConnected()) {
                throw new SQLException("Unable to obtain a JDBC connection");
            }
        }
        return conn;
    }

    @Override
    public void close() throws SQLException {
        if (conn != null) {
            try {
                LOGGER.trace("Closing database connection");
                conn.close();
            }
            finally {
                conn = null;
            }
        }
    }

    static String maskPassword(String url) {
        return url.replaceAll("(?i)(password=)[^&;]*", "$1***");
    }
}
