/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql.connection;

import io.logrepl.annotation.Immutable;

@Immutable
public final class DeleteMessage implements ReplicationMessage {

    private final int relationId;
    private final char oldTupleType;
    private final TupleData oldTuple;

    public DeleteMessage(int relationId, char oldTupleType, TupleData oldTuple) {
        this.relationId = relationId;
        this.oldTupleType = oldTupleType;
        this.oldTuple = oldTuple;
    }

    @Override
    public Type type() {
        return Type.DELETE;
    }

    public int relationId() {
        return relationId;
    }

    /**
     * @return {@code K} if only the key columns were logged, {@code O} for the full row
     */
    public char oldTupleType() {
        return oldTupleType;
    }

    public TupleData oldTuple() {
        return oldTuple;
    }

    @Override
    public String toString() {
        return "DeleteMessage [relationId=" + relationId + ", oldTupleType=" + oldTupleType + ", oldTuple=" + oldTuple + "]";
    }
}
