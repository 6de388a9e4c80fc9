/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.kafka.common.config.ConfigValue;

import io.logrepl.LogreplException;

/**
 * Raised when a {@link Configuration}, or an argument derived from it, cannot be used.
 *
 * @see Configuration#validateAndThrow(Field.Set)
 */
public class InvalidConfigurationException extends LogreplException {

    private static final long serialVersionUID = 1L;

    private final Map<String, ConfigValue> invalidConfigValues;

    public InvalidConfigurationException(String message) {
        super(message);
        this.invalidConfigValues = Collections.emptyMap();
    }

    /**
     * Create an exception with a message and the validated configuration values.
     *
     * @param message the message; may not be null
     * @param configValues the configuration values, at least one of which has errors; may not be null
     */
    public InvalidConfigurationException(String message, Iterable<ConfigValue> configValues) {
        super(message);
        Map<String, ConfigValue> invalidConfigValuesByName = new LinkedHashMap<>();
        configValues.forEach(configValue -> {
            List<String> errorMsgs = configValue.errorMessages();
            if (errorMsgs != null && !errorMsgs.isEmpty()) {
                invalidConfigValuesByName.put(configValue.name(), configValue);
            }
        });
        this.invalidConfigValues = Collections.unmodifiableMap(invalidConfigValuesByName);
    }

    /**
     * Get the configuration values that have errors.
     *
     * @return the immutable map of invalid configuration values keyed by field name; never null
     */
    public Map<String, ConfigValue> invalidConfigValues() {
        return invalidConfigValues;
    }
}
