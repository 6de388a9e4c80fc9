/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.data;

/**
 * Names and codes shared by every change event envelope.
 */
public final class Envelope {

    /**
     * The kind of change described by an event.
     */
    public enum Operation {
        /**
         * The current state of a row, read during an initial snapshot.
         */
        READ("r"),
        /**
         * A row was inserted.
         */
        CREATE("c"),
        /**
         * An existing row was updated.
         */
        UPDATE("u"),
        /**
         * An existing row was deleted.
         */
        DELETE("d");

        private final String code;

        Operation(String code) {
            this.code = code;
        }

        /**
         * @return the operation with the given code, or {@code null} if there is none
         */
        public static Operation forCode(String code) {
            for (Operation op : Operation.values()) {
                if (op.code().equalsIgnoreCase(code)) {
                    return op;
                }
            }
            return null;
        }

        public String code() {
            return code;
        }
    }

    /**
     * The names of the fields in the envelope.
     */
    public static final class FieldName {
        /**
         * The state of the row before the change.
         */
        public static final String BEFORE = "before";
        /**
         * The state of the row after the change.
         */
        public static final String AFTER = "after";
        /**
         * The {@link Operation#code() operation code}.
         */
        public static final String OPERATION = "op";
        /**
         * Information about the origin of the change.
         */
        public static final String SOURCE = "source";
        /**
         * Milliseconds since the epoch at which the change was read.
         */
        public static final String TIMESTAMP = "ts_ms";

        private FieldName() {
        }
    }

    private Envelope() {
    }
}
