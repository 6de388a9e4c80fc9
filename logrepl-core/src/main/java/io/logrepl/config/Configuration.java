/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

import org.apache.kafka.common.config.ConfigValue;

import io.logrepl.annotation.Immutable;
import io.logrepl.util.Strings;

/**
 * An immutable representation of a configuration, made up of string keys and string values. Typed accessors
 * take a {@link Field} and fall back to its default value.
 */
@Immutable
public interface Configuration {

    /**
     * A builder of {@link Configuration} instances.
     */
    class Builder {
        private final Map<String, String> props = new LinkedHashMap<>();

        protected Builder() {
        }

        public Builder with(String key, Object value) {
            if (value == null) {
                props.remove(key);
            }
            else {
                props.put(key, value.toString());
            }
            return this;
        }

        public Builder with(Field field, Object value) {
            return with(field.name(), value);
        }

        public Builder withDefault(Field field, Object value) {
            if (!props.containsKey(field.name())) {
                with(field, value);
            }
            return this;
        }

        public Builder with(Configuration other) {
            other.keys().forEach(key -> props.put(key, other.getString(key)));
            return this;
        }

        public Configuration build() {
            return Configuration.from(props);
        }
    }

    static Builder create() {
        return new Builder();
    }

    static Builder copy(Configuration config) {
        return new Builder().with(config);
    }

    static Configuration empty() {
        return from(Collections.emptyMap());
    }

    /**
     * Create a configuration holding a copy of the supplied properties.
     */
    static Configuration from(Properties properties) {
        Map<String, String> props = new LinkedHashMap<>();
        properties.stringPropertyNames().forEach(key -> props.put(key, properties.getProperty(key)));
        return from(props);
    }

    /**
     * Create a configuration holding a copy of the supplied map; values are converted with {@link Object#toString()}.
     */
    static Configuration from(Map<String, ?> properties) {
        Map<String, String> props = new LinkedHashMap<>();
        properties.forEach((key, value) -> {
            if (value != null) {
                props.put(key, value.toString());
            }
        });
        Map<String, String> copy = Collections.unmodifiableMap(props);
        return new Configuration() {
            @Override
            public String getString(String key) {
                return copy.get(key);
            }

            @Override
            public Set<String> keys() {
                return copy.keySet();
            }

            @Override
            public String toString() {
                return copy.toString();
            }
        };
    }

    /**
     * Get the raw string value for the key.
     *
     * @return the value, or {@code null} if the key is not set
     */
    String getString(String key);

    /**
     * Get the set of keys in this configuration.
     */
    Set<String> keys();

    default boolean hasKey(String key) {
        return getString(key) != null;
    }

    default boolean hasKey(Field field) {
        return hasKey(field.name());
    }

    default String getString(Field field) {
        String value = getString(field.name());
        return value != null ? value : field.defaultValueAsString();
    }

    default Integer getInteger(Field field) {
        String value = getString(field);
        return value != null ? Integer.valueOf(value.trim()) : null;
    }

    default Long getLong(Field field) {
        String value = getString(field);
        return value != null ? Long.valueOf(value.trim()) : null;
    }

    default Duration getDurationMillis(Field field) {
        Long millis = getLong(field);
        return millis != null ? Duration.ofMillis(millis) : null;
    }

    /**
     * Get the comma-separated value of the field as a list of trimmed, non-blank items.
     */
    default List<String> getList(Field field) {
        return getList(field, ',', Function.identity());
    }

    default <T> List<T> getList(Field field, char delimiter, Function<String, T> converter) {
        return Strings.listOfTrimmed(getString(field), delimiter, converter);
    }

    default Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        keys().forEach(key -> map.put(key, getString(key)));
        return map;
    }

    /**
     * Validate the supplied fields in this configuration.
     *
     * @param fields the fields to validate
     * @param problems receives each problem
     * @return {@code true} if all fields are valid
     */
    default boolean validate(Iterable<Field> fields, Field.ValidationOutput problems) {
        boolean valid = true;
        for (Field field : fields) {
            if (!field.validate(this, problems)) {
                valid = false;
            }
        }
        return valid;
    }

    default boolean validateAndRecord(Iterable<Field> fields, Consumer<String> problems) {
        return validate(fields, (f, v, problem) -> {
            if (v == null) {
                problems.accept("The '" + f.name() + "' value is invalid: " + problem);
            }
            else {
                problems.accept("The '" + f.name() + "' value '" + v + "' is invalid: " + problem);
            }
        });
    }

    /**
     * Validate the supplied fields and throw if any of them is invalid.
     *
     * @throws InvalidConfigurationException carrying one {@link ConfigValue} per invalid field
     */
    default void validateAndThrow(Field.Set fields) {
        Map<String, ConfigValue> results = new LinkedHashMap<>();
        List<String> messages = new ArrayList<>();
        validate(fields, (f, v, problem) -> {
            results.computeIfAbsent(f.name(), ConfigValue::new).addErrorMessage(problem);
            messages.add("The '" + f.name() + "' value is invalid: " + problem);
        });
        if (!messages.isEmpty()) {
            throw new InvalidConfigurationException("Error configuring an instance: " + Strings.join("; ", messages), results.values());
        }
    }
}
