/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.apache.kafka.common.config.ConfigDef.Type;
import org.junit.Before;
import org.junit.Test;

public class ConfigurationTest {

    private static final Field URL = Field.create("database.url").required();
    private static final Field QUEUE_SIZE = Field.create("max.queue.size")
            .withType(Type.INT)
            .withDefault(8192)
            .withValidation(Field::isPositiveInteger);
    private static final Field INTERVAL = Field.create("poll.interval.ms")
            .withType(Type.LONG)
            .withDefault(500L);
    private static final Field TABLES = Field.create("publication.tables");

    private Configuration config;

    @Before
    public void beforeEach() {
        config = Configuration.create().with("A", "a")
                .with("B", "b")
                .with("1", 1)
                .build();
    }

    @Test
    public void shouldConvertFromProperties() {
        Properties props = new Properties();
        props.setProperty("A", "a");
        props.setProperty("B", "b");
        config = Configuration.from(props);
        assertThat(config.getString("A")).isEqualTo("a");
        assertThat(config.getString("B")).isEqualTo("b");
        assertThat(config.keys()).containsOnly("A", "B");
    }

    @Test
    public void shouldNotBeModifiedAfterCreation() {
        Properties props = new Properties();
        props.setProperty("A", "a");
        config = Configuration.from(props);
        props.setProperty("A", "changed");
        props.setProperty("B", "b");

        assertThat(config.getString("A")).isEqualTo("a");
        assertThat(config.hasKey("B")).isFalse();
    }

    @Test
    public void shouldRemoveKeyWhenBuilderValueIsNull() {
        Configuration copy = Configuration.copy(config).with("A", null).build();
        assertThat(copy.hasKey("A")).isFalse();
        assertThat(copy.getString("B")).isEqualTo("b");
        assertThat(config.getString("A")).isEqualTo("a");
    }

    @Test
    public void shouldFallBackToFieldDefaults() {
        assertThat(config.getInteger(QUEUE_SIZE)).isEqualTo(8192);
        assertThat(config.getDurationMillis(INTERVAL)).isEqualTo(Duration.ofMillis(500));
        assertThat(config.getString(URL)).isNull();

        Configuration withValues = Configuration.create().with(QUEUE_SIZE, 10).with(INTERVAL, "250").build();
        assertThat(withValues.getInteger(QUEUE_SIZE)).isEqualTo(10);
        assertThat(withValues.getLong(INTERVAL)).isEqualTo(250L);
    }

    @Test
    public void shouldNotOverrideExistingValueWithDefault() {
        Configuration built = Configuration.create().with(QUEUE_SIZE, 5).withDefault(QUEUE_SIZE, 7).build();
        assertThat(built.getInteger(QUEUE_SIZE)).isEqualTo(5);
    }

    @Test
    public void shouldSplitListsIgnoringBlankItems() {
        config = Configuration.create().with(TABLES, " users , ,orders,").build();
        assertThat(config.getList(TABLES)).containsExactly("users", "orders");
        assertThat(Configuration.empty().getList(TABLES)).isEmpty();
    }

    @Test
    public void shouldRecordEachInvalidField() {
        config = Configuration.create().with(QUEUE_SIZE, "-3").with(INTERVAL, "soon").build();
        List<String> problems = new ArrayList<>();

        boolean valid = config.validateAndRecord(Field.setOf(URL, QUEUE_SIZE, INTERVAL), problems::add);

        assertThat(valid).isFalse();
        assertThat(problems).hasSize(3);
        assertThat(problems.get(0)).contains("database.url");
        assertThat(problems.get(1)).contains("'-3'");
        assertThat(problems.get(2)).contains("'soon'");
    }

    @Test
    public void shouldThrowWithConfigValuesForInvalidFields() {
        assertThatThrownBy(() -> Configuration.empty().validateAndThrow(Field.setOf(URL, QUEUE_SIZE)))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("database.url")
                .satisfies(e -> {
                    InvalidConfigurationException ice = (InvalidConfigurationException) e;
                    assertThat(ice.invalidConfigValues()).containsOnlyKeys("database.url");
                    assertThat(ice.invalidConfigValues().get("database.url").errorMessages()).containsExactly("A value is required");
                });
    }

    @Test
    public void shouldAcceptValidConfiguration() {
        config = Configuration.create().with(URL, "jdbc:postgresql://localhost/db").build();
        config.validateAndThrow(Field.setOf(URL, QUEUE_SIZE, INTERVAL));
        assertThat(config.asMap()).containsEntry("database.url", "jdbc:postgresql://localhost/db");
    }

    @Test
    public void shouldRejectOverflowingInteger() {
        config = Configuration.create().with(QUEUE_SIZE, "99999999999").build();
        assertThat(config.validate(Field.setOf(QUEUE_SIZE), (f, v, p) -> {
        })).isFalse();
    }
}
