/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import io.logrepl.annotation.Immutable;
import io.logrepl.data.Envelope.Operation;

/**
 * A captured row change, as handed to the consumer of a replication session.
 * <p>
 * The key holds at most one column. A {@code null} before or after image means that no image is available, which is
 * different from an image of a row without columns.
 */
@Immutable
public final class ChangeRecord {

    /**
     * Keys of the record metadata.
     */
    public static final class Metadata {
        /**
         * The name of the table the change belongs to.
         */
        public static final String COLLECTION = "collection";
        /**
         * The namespace (schema) of the table the change belongs to.
         */
        public static final String SCHEMA = "schema";
        /**
         * Milliseconds since the epoch at which the change was read from the replication stream.
         */
        public static final String READ_AT = "readAt";

        private Metadata() {
        }
    }

    private final Operation operation;
    private final String position;
    private final Map<String, String> metadata;
    private final Map<String, Object> key;
    private final Map<String, Object> before;
    private final Map<String, Object> after;

    private ChangeRecord(Operation operation, String position, Map<String, String> metadata, Map<String, Object> key,
                         Map<String, Object> before, Map<String, Object> after) {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.position = Objects.requireNonNull(position, "position");
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.key = Collections.unmodifiableMap(new LinkedHashMap<>(key));
        this.before = copyOf(before);
        this.after = copyOf(after);
    }

    public static ChangeRecord create(String position, Map<String, String> metadata, Map<String, Object> key, Map<String, Object> after) {
        return new ChangeRecord(Operation.CREATE, position, metadata, key, null, after);
    }

    public static ChangeRecord update(String position, Map<String, String> metadata, Map<String, Object> key, Map<String, Object> before,
                                      Map<String, Object> after) {
        return new ChangeRecord(Operation.UPDATE, position, metadata, key, before, after);
    }

    public static ChangeRecord delete(String position, Map<String, String> metadata, Map<String, Object> key) {
        return new ChangeRecord(Operation.DELETE, position, metadata, key, null, null);
    }

    private static Map<String, Object> copyOf(Map<String, Object> values) {
        return values != null ? Collections.unmodifiableMap(new LinkedHashMap<>(values)) : null;
    }

    public Operation operation() {
        return operation;
    }

    /**
     * @return the opaque token from which streaming can be resumed after this record
     */
    public String position() {
        return position;
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    public String collection() {
        return metadata.get(Metadata.COLLECTION);
    }

    public Map<String, Object> key() {
        return key;
    }

    /**
     * @return the row before the change, or {@code null} if it is not available
     */
    public Map<String, Object> before() {
        return before;
    }

    /**
     * @return the row after the change, or {@code null} for deletes
     */
    public Map<String, Object> after() {
        return after;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ChangeRecord that = (ChangeRecord) o;
        return operation == that.operation
                && position.equals(that.position)
                && metadata.equals(that.metadata)
                && key.equals(that.key)
                && Objects.equals(before, that.before)
                && Objects.equals(after, that.after);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operation, position, metadata, key, before, after);
    }

    @Override
    public String toString() {
        return "ChangeRecord [operation=" + operation + ", position=" + position + ", metadata=" + metadata + ", key=" + key
                + ", before=" + before + ", after=" + after + "]";
    }
}
