/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql.connection;

/**
 * A logical replication message as received from the pgoutput plugin. Only the kinds which affect change capture
 * carry a dedicated model; all others are surfaced as {@link OtherMessage} so that callers may skip them.
 */
public interface ReplicationMessage {

    /**
     * The kind of a replication message, identified by its leading tag byte.
     */
    enum Type {
        BEGIN('B'),
        COMMIT('C'),
        RELATION('R'),
        INSERT('I'),
        UPDATE('U'),
        DELETE('D'),
        TRUNCATE('T'),
        TYPE('Y'),
        ORIGIN('O'),
        MESSAGE('M'),
        OTHER('?');

        private final char tag;

        Type(char tag) {
            this.tag = tag;
        }

        public char tag() {
            return tag;
        }

        /**
         * @return the type for the given tag byte, or {@link #OTHER} if the tag is not known
         */
        public static Type forTag(char tag) {
            for (Type type : values()) {
                if (type != OTHER && type.tag == tag) {
                    return type;
                }
            }
            return OTHER;
        }
    }

    Type type();
}
