/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Before;
import org.junit.Test;
import org.mockito.InOrder;

public class JdbcConnectionTest {

    private Connection connection;
    private Statement statement;
    private AtomicInteger connects;
    private JdbcConnection jdbc;

    @Before
    public void beforeEach() throws SQLException {
        connection = mock(Connection.class);
        statement = mock(Statement.class);
        when(connection.createStatement()).thenReturn(statement);
        when(connection.isClosed()).thenReturn(false);
        connects = new AtomicInteger();
        jdbc = new JdbcConnection(() -> {
            connects.incrementAndGet();
            return connection;
        });
    }

    @Test
    public void shouldConnectLazilyAndOnlyOnce() throws SQLException {
        assertThat(jdbc.isConnected()).isFalse();
        assertThat(connects).hasValue(0);

        jdbc.execute("SELECT 1");
        jdbc.execute("SELECT 2");

        assertThat(connects).hasValue(1);
        assertThat(jdbc.isConnected()).isTrue();
    }

    @Test
    public void shouldExecuteStatementsInOrderAndCommit() throws SQLException {
        when(connection.getAutoCommit()).thenReturn(false);

        jdbc.execute("CREATE TABLE a (id int)", null, "INSERT INTO a VALUES (1)");

        InOrder order = inOrder(statement, connection);
        order.verify(statement).execute("CREATE TABLE a (id int)");
        order.verify(statement).execute("INSERT INTO a VALUES (1)");
        order.verify(connection).commit();
        verify(statement).close();
    }

    @Test
    public void shouldNotCommitInAutoCommitMode() throws SQLException {
        when(connection.getAutoCommit()).thenReturn(true);

        jdbc.execute("SELECT 1");

        verify(connection, never()).commit();
    }

    @Test
    public void shouldMapQueryResults() throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(statement.executeQuery("SELECT slot_name FROM pg_replication_slots")).thenReturn(rs);
        when(rs.next()).thenReturn(true, false);
        when(rs.getString(1)).thenReturn("s1");

        String slot = jdbc.queryAndMap("SELECT slot_name FROM pg_replication_slots", r -> r.next() ? r.getString(1) : null);

        assertThat(slot).isEqualTo("s1");
        verify(rs).close();
    }

    @Test
    public void shouldCloseAndReconnect() throws SQLException {
        jdbc.connect();
        jdbc.close();
        verify(connection, times(1)).close();
        assertThat(jdbc.isConnected()).isFalse();

        jdbc.connect();
        assertThat(connects).hasValue(2);
    }

    @Test
    public void shouldMaskPasswordInUrl() {
        assertThat(JdbcConnection.maskPassword("jdbc:postgresql://localhost/db?user=u&password=secret&ssl=true"))
                .isEqualTo("jdbc:postgresql://localhost/db?user=u&password=***&ssl=true");
    }
}
