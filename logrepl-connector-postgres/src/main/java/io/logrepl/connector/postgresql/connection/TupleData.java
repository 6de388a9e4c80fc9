/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql.connection;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import io.logrepl.annotation.Immutable;

/**
 * The raw column values of a row as carried by insert, update and delete messages. Values are interpreted only
 * against the {@link RelationMessage} describing their relation.
 */
@Immutable
public final class TupleData {

    /**
     * How a column value is represented on the wire.
     */
    public enum Kind {
        NULL('n'),
        /**
         * An unchanged TOASTed value whose content was not sent.
         */
        UNCHANGED('u'),
        TEXT('t'),
        BINARY('b');

        private final char code;

        Kind(char code) {
            this.code = code;
        }

        public char code() {
            return code;
        }

        /**
         * @return the kind for the given code, or {@code null} if the code is not known
         */
        public static Kind forCode(char code) {
            for (Kind kind : values()) {
                if (kind.code == code) {
                    return kind;
                }
            }
            return null;
        }
    }

    /**
     * A single raw column value.
     */
    @Immutable
    public static final class Column {

        private static final Column NULL = new Column(Kind.NULL, null);
        private static final Column UNCHANGED = new Column(Kind.UNCHANGED, null);

        private final Kind kind;
        private final byte[] data;

        private Column(Kind kind, byte[] data) {
            this.kind = kind;
            this.data = data;
        }

        public static Column nullValue() {
            return NULL;
        }

        public static Column unchanged() {
            return UNCHANGED;
        }

        public static Column text(byte[] data) {
            return new Column(Kind.TEXT, data.clone());
        }

        public static Column text(String value) {
            return new Column(Kind.TEXT, value.getBytes(StandardCharsets.UTF_8));
        }

        public static Column binary(byte[] data) {
            return new Column(Kind.BINARY, data.clone());
        }

        public Kind kind() {
            return kind;
        }

        /**
         * @return a copy of the raw bytes, or {@code null} for {@link Kind#NULL} and {@link Kind#UNCHANGED}
         */
        public byte[] data() {
            return data != null ? data.clone() : null;
        }

        /**
         * @return the raw bytes decoded as UTF-8, or {@code null} if there are none
         */
        public String asText() {
            return data != null ? new String(data, StandardCharsets.UTF_8) : null;
        }

        @Override
        public String toString() {
            switch (kind) {
                case TEXT:
                    return "'" + asText() + "'";
                case BINARY:
                    return Arrays.toString(data);
                default:
                    return kind.name();
            }
        }
    }

    private final List<Column> columns;

    public TupleData(List<Column> columns) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    public static TupleData of(Column... columns) {
        return new TupleData(Arrays.asList(columns));
    }

    public List<Column> columns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }

    @Override
    public String toString() {
        return columns.toString();
    }
}
