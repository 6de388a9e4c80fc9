/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;

import io.logrepl.config.Configuration;
import io.logrepl.config.Field;
import io.logrepl.util.Strings;

/**
 * The configuration properties of a PostgreSQL replication session.
 */
public class PostgresConnectorConfig {

    public static final String DEFAULT_PLUGIN_NAME = "pgoutput";
    public static final String DEFAULT_TOPIC_PREFIX = "logrepl";

    private static final String SLOT_NAME_PATTERN = "[a-z0-9_]{1,63}";

    public static final Field DATABASE_URL = Field.create("database.url")
            .withDisplayName("Database URL")
            .withType(Type.STRING)
            .withImportance(Importance.HIGH)
            .required()
            .withDescription("The JDBC URL of the PostgreSQL database, including the credentials.");

    public static final Field SLOT_NAME = Field.create("slot.name")
            .withDisplayName("Slot")
            .withType(Type.STRING)
            .withImportance(Importance.MEDIUM)
            .withValidation(PostgresConnectorConfig::validateReplicationSlotName)
            .withDescription("The name of the Postgres logical decoding slot used for streaming changes. "
                    + "When unset, no slot is created or dropped.");

    public static final Field PUBLICATION_NAME = Field.create("publication.name")
            .withDisplayName("Publication")
            .withType(Type.STRING)
            .withImportance(Importance.MEDIUM)
            .withDescription("The name of the Postgres publication used for streaming changes. "
                    + "When unset, no publication is created or dropped.");

    public static final Field PUBLICATION_TABLES = Field.create("publication.tables")
            .withDisplayName("Publication tables")
            .withType(Type.LIST)
            .withImportance(Importance.HIGH)
            .withDescription("A comma-separated list of the tables added to the publication.");

    public static final Field PUBLICATION_PARAMS = Field.create("publication.params")
            .withDisplayName("Publication parameters")
            .withType(Type.STRING)
            .withImportance(Importance.LOW)
            .withDescription("A semicolon-separated list of publication parameters, e.g. \"publish = 'insert, update'\".");

    public static final Field TABLE_KEYS = Field.create("table.keys")
            .withDisplayName("Table keys")
            .withType(Type.STRING)
            .withImportance(Importance.MEDIUM)
            .withValidation(PostgresConnectorConfig::validateTableKeys)
            .withDescription("A semicolon-separated list of 'table:column' pairs naming the key column of each table. "
                    + "Only single column keys are supported.");

    public static final Field PLUGIN_NAME = Field.create("plugin.name")
            .withDisplayName("Plugin")
            .withType(Type.STRING)
            .withImportance(Importance.MEDIUM)
            .withDefault(DEFAULT_PLUGIN_NAME)
            .withDescription("The name of the Postgres logical decoding plugin installed on the server. "
                    + "Defaults to '" + DEFAULT_PLUGIN_NAME + "'.");

    public static final Field TOPIC_PREFIX = Field.create("topic.prefix")
            .withDisplayName("Topic prefix")
            .withType(Type.STRING)
            .withImportance(Importance.MEDIUM)
            .withDefault(DEFAULT_TOPIC_PREFIX)
            .withDescription("The prefix of the Kafka topics change records are converted for.");

    public static final Field MAX_QUEUE_SIZE = Field.create("max.queue.size")
            .withDisplayName("Change event buffer size")
            .withType(Type.INT)
            .withImportance(Importance.MEDIUM)
            .withDefault(8192)
            .withValidation(Field::isPositiveInteger, PostgresConnectorConfig::validateMaxQueueSize)
            .withDescription("Maximum size of the queue of change records waiting for the consumer. Defaults to 8192, "
                    + "and should always be larger than the maximum batch size.");

    public static final Field MAX_BATCH_SIZE = Field.create("max.batch.size")
            .withDisplayName("Change event batch size")
            .withType(Type.INT)
            .withImportance(Importance.MEDIUM)
            .withDefault(2048)
            .withValidation(Field::isPositiveInteger)
            .withDescription("Maximum number of change records returned by a single poll. Defaults to 2048.");

    public static final Field POLL_INTERVAL_MS = Field.create("poll.interval.ms")
            .withDisplayName("Poll interval (ms)")
            .withType(Type.LONG)
            .withImportance(Importance.MEDIUM)
            .withDefault(500L)
            .withValidation(Field::isPositiveLong)
            .withDescription("Time in milliseconds to wait for new change records to appear after receiving no events. "
                    + "Also bounds how long a blocked producer waits before re-checking for cancellation. Defaults to 500ms.");

    public static final Field.Set ALL_FIELDS = Field.setOf(DATABASE_URL, SLOT_NAME, PUBLICATION_NAME, PUBLICATION_TABLES,
            PUBLICATION_PARAMS, TABLE_KEYS, PLUGIN_NAME, TOPIC_PREFIX, MAX_QUEUE_SIZE, MAX_BATCH_SIZE, POLL_INTERVAL_MS);

    private final Configuration config;
    private final Map<String, String> tableKeys;

    public PostgresConnectorConfig(Configuration config) {
        this.config = config;
        this.tableKeys = parseTableKeys(config.getString(TABLE_KEYS));
    }

    /**
     * Validate all fields of this configuration.
     *
     * @throws io.logrepl.config.InvalidConfigurationException if any field is invalid
     */
    public PostgresConnectorConfig validateAndThrow() {
        config.validateAndThrow(ALL_FIELDS);
        return this;
    }

    public Configuration getConfig() {
        return config;
    }

    public String databaseUrl() {
        return config.getString(DATABASE_URL);
    }

    /**
     * @return the slot name, or empty if no slot is managed
     */
    public Optional<String> slotName() {
        return optional(SLOT_NAME);
    }

    /**
     * @return the publication name, or empty if no publication is managed
     */
    public Optional<String> publicationName() {
        return optional(PUBLICATION_NAME);
    }

    public List<String> publicationTables() {
        return config.getList(PUBLICATION_TABLES);
    }

    public List<String> publicationParams() {
        return config.getList(PUBLICATION_PARAMS, ';', Function.identity());
    }

    /**
     * @return the key column of each table, keyed by table name
     */
    public Map<String, String> tableKeys() {
        return tableKeys;
    }

    public String pluginName() {
        return Strings.defaultIfBlank(config.getString(PLUGIN_NAME), DEFAULT_PLUGIN_NAME);
    }

    public String topicPrefix() {
        return Strings.defaultIfBlank(config.getString(TOPIC_PREFIX), DEFAULT_TOPIC_PREFIX);
    }

    public int maxQueueSize() {
        return config.getInteger(MAX_QUEUE_SIZE);
    }

    public int maxBatchSize() {
        return config.getInteger(MAX_BATCH_SIZE);
    }

    public Duration pollInterval() {
        return config.getDurationMillis(POLL_INTERVAL_MS);
    }

    private Optional<String> optional(Field field) {
        String value = config.getString(field);
        return Strings.isNullOrBlank(value) ? Optional.empty() : Optional.of(value.trim());
    }

    private static Map<String, String> parseTableKeys(String value) {
        Map<String, String> keys = new LinkedHashMap<>();
        for (String pair : Strings.listOfTrimmed(value, ';', Function.identity())) {
            int separator = pair.indexOf(':');
            if (separator > 0 && separator < pair.length() - 1) {
                keys.put(pair.substring(0, separator).trim(), pair.substring(separator + 1).trim());
            }
        }
        return Collections.unmodifiableMap(keys);
    }

    private static int validateReplicationSlotName(Configuration config, Field field, Field.ValidationOutput problems) {
        final String name = config.getString(field);
        int errors = 0;
        if (name != null) {
            if (!isValidSlotName(name)) {
                problems.accept(field, name, "Valid replication slot name must contain only digits, lowercase characters and underscores with length <= 63");
                ++errors;
            }
        }
        return errors;
    }

    /**
     * @return whether the name may be used for a replication slot
     */
    public static boolean isValidSlotName(String name) {
        return name != null && name.matches(SLOT_NAME_PATTERN);
    }

    private static int validateTableKeys(Configuration config, Field field, Field.ValidationOutput problems) {
        int errors = 0;
        for (String pair : Strings.listOfTrimmed(config.getString(field), ';', Function.identity())) {
            int separator = pair.indexOf(':');
            if (separator <= 0 || separator == pair.length() - 1 || pair.indexOf(':', separator + 1) >= 0) {
                problems.accept(field, pair, "Table key must be given as 'table:column'");
                ++errors;
            }
            else if (pair.indexOf(',', separator) >= 0) {
                problems.accept(field, pair, "Composite keys are not supported");
                ++errors;
            }
        }
        return errors;
    }

    private static int validateMaxQueueSize(Configuration config, Field field, Field.ValidationOutput problems) {
        int errors = 0;
        Integer maxQueueSize;
        Integer maxBatchSize;
        try {
            maxQueueSize = config.getInteger(field);
            maxBatchSize = config.getInteger(MAX_BATCH_SIZE);
        }
        catch (NumberFormatException e) {
            // reported by the type validators
            return 0;
        }
        if (maxQueueSize != null && maxBatchSize != null && maxQueueSize <= maxBatchSize) {
            problems.accept(field, maxQueueSize, "Must be larger than the maximum batch size");
            ++errors;
        }
        return errors;
    }
}
