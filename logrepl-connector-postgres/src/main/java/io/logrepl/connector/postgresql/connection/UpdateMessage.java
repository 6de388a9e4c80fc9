/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql.connection;

import java.util.Objects;

import io.logrepl.annotation.Immutable;

/**
 * An updated row. The old tuple is only present when the relation's replica identity makes PostgreSQL log it:
 * as the old key columns ({@code K}) or as the full old row ({@code O}).
 */
@Immutable
public final class UpdateMessage implements ReplicationMessage {

    private final int relationId;
    private final char oldTupleType;
    private final TupleData oldTuple;
    private final TupleData newTuple;

    public UpdateMessage(int relationId, TupleData newTuple) {
        this(relationId, (char) 0, null, newTuple);
    }

    public UpdateMessage(int relationId, char oldTupleType, TupleData oldTuple, TupleData newTuple) {
        this.relationId = relationId;
        this.oldTupleType = oldTupleType;
        this.oldTuple = oldTuple;
        this.newTuple = Objects.requireNonNull(newTuple, "newTuple");
    }

    @Override
    public Type type() {
        return Type.UPDATE;
    }

    public int relationId() {
        return relationId;
    }

    /**
     * @return {@code K}, {@code O} or {@code 0} if no old tuple was sent
     */
    public char oldTupleType() {
        return oldTupleType;
    }

    /**
     * @return the old tuple, or {@code null} if it was not sent
     */
    public TupleData oldTuple() {
        return oldTuple;
    }

    public TupleData newTuple() {
        return newTuple;
    }

    @Override
    public String toString() {
        return "UpdateMessage [relationId=" + relationId + ", oldTuple=" + oldTuple + ", newTuple=" + newTuple + "]";
    }
}
