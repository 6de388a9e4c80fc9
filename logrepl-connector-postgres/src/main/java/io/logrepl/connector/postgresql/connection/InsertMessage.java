/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql.connection;

import java.util.Objects;

import io.logrepl.annotation.Immutable;

@Immutable
public final class InsertMessage implements ReplicationMessage {

    private final int relationId;
    private final TupleData newTuple;

    public InsertMessage(int relationId, TupleData newTuple) {
        this.relationId = relationId;
        this.newTuple = Objects.requireNonNull(newTuple, "newTuple");
    }

    @Override
    public Type type() {
        return Type.INSERT;
    }

    public int relationId() {
        return relationId;
    }

    public TupleData newTuple() {
        return newTuple;
    }

    @Override
    public String toString() {
        return "InsertMessage [relationId=" + relationId + ", newTuple=" + newTuple + "]";
    }
}
