/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql;

import java.util.Arrays;

import io.logrepl.connector.postgresql.connection.RelationMessage;
import io.logrepl.connector.postgresql.connection.TupleData;

/**
 * Builders for the messages used across tests.
 */
public final class TestHelper {

    public static final int USERS_ID = 16384;
    public static final String USERS = "users";

    private TestHelper() {
    }

    /**
     * @return a relation {@code public.users(id int4 key, name text, active bool)}
     */
    public static RelationMessage usersRelation() {
        return new RelationMessage(USERS_ID, "public", USERS, 'd', Arrays.asList(
                new RelationMessage.Column(RelationMessage.Column.FLAG_KEY, "id", PgOid.INT4, -1),
                new RelationMessage.Column(0, "name", PgOid.TEXT, -1),
                new RelationMessage.Column(0, "active", PgOid.BOOL, -1)));
    }

    public static TupleData userTuple(int id, String name, boolean active) {
        return TupleData.of(
                TupleData.Column.text(Integer.toString(id)),
                name != null ? TupleData.Column.text(name) : TupleData.Column.nullValue(),
                TupleData.Column.text(active ? "t" : "f"));
    }

    public static TupleData keyOnlyTuple(int id) {
        return TupleData.of(
                TupleData.Column.text(Integer.toString(id)),
                TupleData.Column.nullValue(),
                TupleData.Column.nullValue());
    }
}
