/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql.connection;

import java.sql.SQLException;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.logrepl.annotation.NotThreadSafe;
import io.logrepl.config.InvalidConfigurationException;
import io.logrepl.connector.postgresql.PostgresConnectorConfig;
import io.logrepl.jdbc.JdbcConnection;
import io.logrepl.util.Strings;

/**
 * Creates and drops the replication slot and the publication a replication session streams from.
 * <p>
 * Dropping is deliberately asymmetric, following PostgreSQL: a publication can be dropped with {@code IF EXISTS},
 * whereas {@code pg_drop_replication_slot} has no such variant and fails for a missing slot. {@link #cleanup(PostgresConnectorConfig)}
 * relies on this so that a missing slot is always reported to the caller, even when the publication was already gone.
 */
@NotThreadSafe
public class ReplicationEndpoints implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReplicationEndpoints.class);

    private final JdbcConnection connection;
    private final String pluginName;

    public ReplicationEndpoints(JdbcConnection connection, String pluginName) {
        this.connection = connection;
        this.pluginName = pluginName;
    }

    /**
     * Create endpoints which connect to the configured database on first use.
     */
    public static ReplicationEndpoints forConfig(PostgresConnectorConfig config) {
        return new ReplicationEndpoints(new JdbcConnection(JdbcConnection.urlBasedFactory(config.databaseUrl())), config.pluginName());
    }

    /**
     * Create a publication for the given tables.
     *
     * @throws InvalidConfigurationException if no table is given; the database is not contacted in that case
     * @throws EndpointException if the server rejects the statement
     */
    public void createPublication(String name, PublicationOptions options) {
        requireName(name, "publication");
        if (options.tables().isEmpty()) {
            throw new InvalidConfigurationException("Publication \"" + name + "\" requires at least one table");
        }

        StringBuilder sql = new StringBuilder("CREATE PUBLICATION ")
                .append(quoteIdentifier(name))
                .append(" FOR TABLE ")
                .append(Strings.join(", ", options.tables()));
        if (!options.params().isEmpty()) {
            sql.append(" WITH (").append(Strings.join(", ", options.params())).append(')');
        }

        LOGGER.info("Creating publication '{}' for tables {}", name, options.tables());
        execute(sql.toString(), "create publication", name);
    }

    /**
     * Drop a publication.
     *
     * @param ifExists whether a missing publication is silently accepted
     * @throws EndpointException if the server rejects the statement
     */
    public void dropPublication(String name, boolean ifExists) {
        requireName(name, "publication");
        String sql = "DROP PUBLICATION " + (ifExists ? "IF EXISTS " : "") + quoteIdentifier(name);

        LOGGER.info("Dropping publication '{}'", name);
        execute(sql, "drop publication", name);
    }

    /**
     * Create a logical replication slot using the configured decoding plugin.
     *
     * @throws InvalidConfigurationException if the name is not a valid slot name
     * @throws EndpointException if the server rejects the statement, e.g. because the slot exists
     */
    public void createReplicationSlot(String name) {
        requireSlotName(name);
        String sql = "SELECT * FROM pg_create_logical_replication_slot('" + name + "', '" + pluginName + "')";

        LOGGER.info("Creating replication slot '{}' with plugin '{}'", name, pluginName);
        execute(sql, "create replication slot", name);
    }

    /**
     * Drop a replication slot. There is no idempotent variant: a missing slot is reported as failure.
     *
     * @throws EndpointException if the server rejects the statement, including when the slot does not exist
     */
    public void dropReplicationSlot(String name) {
        requireSlotName(name);
        String sql = "SELECT pg_drop_replication_slot('" + name + "')";

        LOGGER.info("Dropping replication slot '{}'", name);
        execute(sql, "drop replication slot", name);
    }

    public boolean replicationSlotExists(String name) {
        requireSlotName(name);
        return exists("SELECT 1 FROM pg_replication_slots WHERE slot_name = '" + name + "'", "look up replication slot", name);
    }

    public boolean publicationExists(String name) {
        requireName(name, "publication");
        return exists("SELECT 1 FROM pg_publication WHERE pubname = " + quoteLiteral(name), "look up publication", name);
    }

    /**
     * Remove the endpoints of a replication session.
     * <p>
     * The configured publication is dropped first, tolerating its absence. The configured slot is dropped next, and
     * strictly, so a missing slot fails the cleanup. A failure to drop the publication aborts the cleanup before the
     * slot is touched. Nothing is done if neither is configured.
     *
     * @throws EndpointException if dropping the publication or the slot fails
     */
    public void cleanup(PostgresConnectorConfig config) {
        Optional<String> publication = config.publicationName();
        Optional<String> slot = config.slotName();
        if (!publication.isPresent() && !slot.isPresent()) {
            LOGGER.debug("Neither publication nor replication slot configured, nothing to clean up");
            return;
        }
        publication.ifPresent(name -> dropPublication(name, true));
        slot.ifPresent(this::dropReplicationSlot);
    }

    @Override
    public void close() {
        try {
            connection.close();
        }
        catch (SQLException e) {
            throw new EndpointException("close connection", "replication endpoints", e);
        }
    }

    private void execute(String sql, String operation, String name) {
        try {
            connection.execute(sql);
        }
        catch (SQLException e) {
            throw new EndpointException(operation, name, e);
        }
    }

    private boolean exists(String query, String operation, String name) {
        try {
            return connection.queryAndMap(query, rs -> rs.next());
        }
        catch (SQLException e) {
            throw new EndpointException(operation, name, e);
        }
    }

    private static void requireName(String name, String kind) {
        if (Strings.isNullOrBlank(name)) {
            throw new InvalidConfigurationException("The " + kind + " name must not be blank");
        }
    }

    private static void requireSlotName(String name) {
        if (!PostgresConnectorConfig.isValidSlotName(name)) {
            throw new InvalidConfigurationException("Invalid replication slot name '" + name
                    + "': must contain only digits, lowercase characters and underscores with length <= 63");
        }
    }

    static String quoteIdentifier(String name) {
        return '"' + name.replace("\"", "\"\"") + '"';
    }

    static String quoteLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
