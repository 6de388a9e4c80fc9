/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql.connection;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.logrepl.jdbc.JdbcConnection;

/**
 * An in-memory stand-in for the replication slot and publication catalogs of a PostgreSQL server, reachable through
 * a mocked JDBC {@link Connection}. Failures are reported with the server's error messages.
 */
public class FakeCatalog {

    private static final Pattern CREATE_PUBLICATION = Pattern.compile("CREATE PUBLICATION \"(.+)\" FOR TABLE (.+?)(?: WITH \\((.*)\\))?");
    private static final Pattern DROP_PUBLICATION = Pattern.compile("DROP PUBLICATION (IF EXISTS )?\"(.+)\"");
    private static final Pattern CREATE_SLOT = Pattern.compile("SELECT \\* FROM pg_create_logical_replication_slot\\('(.+)', '(.+)'\\)");
    private static final Pattern DROP_SLOT = Pattern.compile("SELECT pg_drop_replication_slot\\('(.+)'\\)");
    private static final Pattern SLOT_EXISTS = Pattern.compile("SELECT 1 FROM pg_replication_slots WHERE slot_name = '(.+)'");
    private static final Pattern PUBLICATION_EXISTS = Pattern.compile("SELECT 1 FROM pg_publication WHERE pubname = '(.+)'");

    private final Map<String, String> publications = new LinkedHashMap<>();
    private final Map<String, String> slots = new LinkedHashMap<>();
    private final Set<String> failingPrefixes = new LinkedHashSet<>();
    private final List<String> statements = new ArrayList<>();
    private int connects;

    /**
     * @return a connection whose statements operate on this catalog; the database is contacted lazily
     */
    public JdbcConnection jdbcConnection() {
        return new JdbcConnection(this::connect);
    }

    private Connection connect() throws SQLException {
        connects++;
        Connection connection = mock(Connection.class);
        Statement statement = mock(Statement.class);
        when(connection.createStatement()).thenReturn(statement);
        when(connection.getAutoCommit()).thenReturn(true);
        when(connection.isClosed()).thenReturn(false);
        when(statement.execute(anyString())).thenAnswer(invocation -> execute(invocation.getArgument(0)));
        when(statement.executeQuery(anyString())).thenAnswer(invocation -> query(invocation.getArgument(0)));
        return connection;
    }

    /**
     * Fail every statement starting with the given prefix with a permission error.
     */
    public FakeCatalog failOn(String statementPrefix) {
        failingPrefixes.add(statementPrefix);
        return this;
    }

    public FakeCatalog withPublication(String name, String tables) {
        publications.put(name, tables);
        return this;
    }

    public FakeCatalog withSlot(String name) {
        slots.put(name, "pgoutput");
        return this;
    }

    public Set<String> publications() {
        return Collections.unmodifiableSet(publications.keySet());
    }

    public Set<String> slots() {
        return Collections.unmodifiableSet(slots.keySet());
    }

    public String pluginOf(String slot) {
        return slots.get(slot);
    }

    public List<String> statements() {
        return Collections.unmodifiableList(statements);
    }

    public int connects() {
        return connects;
    }

    private boolean execute(String sql) throws SQLException {
        statements.add(sql);
        for (String prefix : failingPrefixes) {
            if (sql.startsWith(prefix)) {
                throw new SQLException("ERROR: permission denied", "42501");
            }
        }

        Matcher m = CREATE_PUBLICATION.matcher(sql);
        if (m.matches()) {
            String name = m.group(1);
            if (publications.containsKey(name)) {
                throw new SQLException("ERROR: publication \"" + name + "\" already exists", "42710");
            }
            publications.put(name, m.group(2));
            return false;
        }
        m = DROP_PUBLICATION.matcher(sql);
        if (m.matches()) {
            String name = m.group(2);
            if (publications.remove(name) == null && m.group(1) == null) {
                throw new SQLException("ERROR: publication \"" + name + "\" does not exist", "42704");
            }
            return false;
        }
        m = CREATE_SLOT.matcher(sql);
        if (m.matches()) {
            String name = m.group(1);
            if (slots.containsKey(name)) {
                throw new SQLException("ERROR: replication slot \"" + name + "\" already exists", "42710");
            }
            slots.put(name, m.group(2));
            return true;
        }
        m = DROP_SLOT.matcher(sql);
        if (m.matches()) {
            String name = m.group(1);
            if (slots.remove(name) == null) {
                throw new SQLException("ERROR: replication slot \"" + name + "\" does not exist", "42704");
            }
            return true;
        }
        throw new SQLException("ERROR: unsupported statement: " + sql, "42601");
    }

    private ResultSet query(String sql) throws SQLException {
        statements.add(sql);
        boolean found;
        Matcher m = SLOT_EXISTS.matcher(sql);
        if (m.matches()) {
            found = slots.containsKey(m.group(1));
        }
        else {
            m = PUBLICATION_EXISTS.matcher(sql);
            if (!m.matches()) {
                throw new SQLException("ERROR: unsupported query: " + sql, "42601");
            }
            found = publications.containsKey(m.group(1).replace("''", "'"));
        }
        ResultSet rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(found, false);
        return rs;
    }
}
