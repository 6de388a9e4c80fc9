/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.config;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;

import io.logrepl.annotation.Immutable;

/**
 * An immutable definition of a field that may appear within a {@link Configuration}.
 */
@Immutable
public final class Field {

    private static final Pattern NUMBER = Pattern.compile("[-+]?\\d+");

    /**
     * Create a set of fields.
     * @param fields the fields to include
     * @return the field set; never null
     */
    public static Set setOf(Field... fields) {
        return new Set(Arrays.asList(fields));
    }

    /**
     * An ordered set of fields, keyed by name.
     */
    @Immutable
    public static final class Set implements Iterable<Field> {
        private final Map<String, Field> fieldsByName;

        private Set(Iterable<Field> fields) {
            Map<String, Field> all = new LinkedHashMap<>();
            fields.forEach(field -> {
                if (field != null) {
                    all.put(field.name(), field);
                }
            });
            this.fieldsByName = Collections.unmodifiableMap(all);
        }

        public Field fieldWithName(String name) {
            return fieldsByName.get(name);
        }

        @Override
        public Iterator<Field> iterator() {
            return fieldsByName.values().iterator();
        }
    }

    /**
     * Receives the problems found while validating a field.
     */
    @FunctionalInterface
    public interface ValidationOutput {
        void accept(Field field, Object value, String problemMessage);
    }

    /**
     * Validates the value of a field.
     */
    @FunctionalInterface
    public interface Validator {

        /**
         * Validate the field's value in the configuration and report each problem to the output.
         *
         * @return the number of problems found, or 0 if the value is valid
         */
        int validate(Configuration config, Field field, ValidationOutput problems);

        default Validator and(Validator other) {
            if (other == null || other == this) {
                return this;
            }
            return (config, field, problems) -> validate(config, field, problems) + other.validate(config, field, problems);
        }
    }

    public static Field create(String name) {
        return new Field(name, null, null, Type.STRING, Importance.MEDIUM, null, null);
    }

    private final String name;
    private final String displayName;
    private final String description;
    private final Type type;
    private final Importance importance;
    private final Object defaultValue;
    private final Validator validator;

    private Field(String name, String displayName, String description, Type type, Importance importance, Object defaultValue,
                  Validator validator) {
        Objects.requireNonNull(name, "The field name is required");
        this.name = name;
        this.displayName = displayName;
        this.description = description;
        this.type = type;
        this.importance = importance;
        this.defaultValue = defaultValue;
        this.validator = validator;
    }

    public String name() {
        return name;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    public Type type() {
        return type;
    }

    public Importance importance() {
        return importance;
    }

    public Object defaultValue() {
        return defaultValue;
    }

    public String defaultValueAsString() {
        return defaultValue != null ? defaultValue.toString() : null;
    }

    /**
     * Validate this field's value in the configuration, applying the type check before any custom validator.
     *
     * @return {@code true} if the value is valid
     */
    public boolean validate(Configuration config, ValidationOutput problems) {
        int errors = 0;
        Validator typeValidator = validatorForType(type);
        if (typeValidator != null) {
            errors += typeValidator.validate(config, this, problems);
        }
        if (validator != null) {
            errors += validator.validate(config, this, problems);
        }
        return errors == 0;
    }

    public Field withDisplayName(String displayName) {
        return new Field(name, displayName, description, type, importance, defaultValue, validator);
    }

    public Field withDescription(String description) {
        return new Field(name, displayName, description, type, importance, defaultValue, validator);
    }

    public Field withType(Type type) {
        return new Field(name, displayName, description, type, importance, defaultValue, validator);
    }

    public Field withImportance(Importance importance) {
        return new Field(name, displayName, description, type, importance, defaultValue, validator);
    }

    public Field withDefault(String defaultValue) {
        return new Field(name, displayName, description, type, importance, defaultValue, validator);
    }

    public Field withDefault(int defaultValue) {
        return new Field(name, displayName, description, type, importance, defaultValue, validator);
    }

    public Field withDefault(long defaultValue) {
        return new Field(name, displayName, description, type, importance, defaultValue, validator);
    }

    public Field required() {
        return withValidation(Field::isRequired);
    }

    public Field withValidation(Validator... validators) {
        Validator combined = this.validator;
        for (Validator other : validators) {
            combined = combined == null ? other : combined.and(other);
        }
        return new Field(name, displayName, description, type, importance, defaultValue, combined);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Field) {
            return name.equals(((Field) obj).name);
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }

    public static Validator validatorForType(Type type) {
        switch (type) {
            case INT:
                return Field::isInteger;
            case LONG:
                return Field::isLong;
            default:
                return null;
        }
    }

    public static int isRequired(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value != null && value.trim().length() > 0) {
            return 0;
        }
        problems.accept(field, value, "A value is required");
        return 1;
    }

    public static int isInteger(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null || parseLong(value, Integer.MIN_VALUE, Integer.MAX_VALUE) != null) {
            return 0;
        }
        problems.accept(field, value, "An integer is expected");
        return 1;
    }

    public static int isLong(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null || parseLong(value, Long.MIN_VALUE, Long.MAX_VALUE) != null) {
            return 0;
        }
        problems.accept(field, value, "A long value is expected");
        return 1;
    }

    public static int isPositiveInteger(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null || parseLong(value, 1, Integer.MAX_VALUE) != null) {
            return 0;
        }
        problems.accept(field, value, "A positive, non-zero integer value is expected");
        return 1;
    }

    public static int isPositiveLong(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null || parseLong(value, 1, Long.MAX_VALUE) != null) {
            return 0;
        }
        problems.accept(field, value, "A positive, non-zero long value is expected");
        return 1;
    }

    private static Long parseLong(String value, long min, long max) {
        String trimmed = value.trim();
        if (!NUMBER.matcher(trimmed).matches()) {
            return null;
        }
        try {
            long parsed = Long.parseLong(trimmed);
            return parsed >= min && parsed <= max ? parsed : null;
        }
        catch (NumberFormatException e) {
            // only reachable on overflow
            return null;
        }
    }
}
