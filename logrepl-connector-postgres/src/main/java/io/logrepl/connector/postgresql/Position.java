/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql;

import java.util.Objects;

import io.logrepl.annotation.Immutable;
import io.logrepl.connector.postgresql.connection.Lsn;

/**
 * The point from which a replication session can be resumed.
 */
@Immutable
public final class Position implements Comparable<Position> {

    public enum Type {
        /**
         * Produced while taking the initial snapshot of the captured tables.
         */
        INITIAL,
        /**
         * Produced while streaming changes from the write-ahead log.
         */
        CDC
    }

    private final Type type;
    private final Lsn lastLsn;

    private Position(Type type, Lsn lastLsn) {
        this.type = Objects.requireNonNull(type, "type");
        this.lastLsn = Objects.requireNonNull(lastLsn, "lastLsn");
    }

    public static Position cdc(Lsn lastLsn) {
        return new Position(Type.CDC, lastLsn);
    }

    public static Position initial(Lsn lastLsn) {
        return new Position(Type.INITIAL, lastLsn);
    }

    public static Position of(Type type, Lsn lastLsn) {
        return new Position(type, lastLsn);
    }

    public Type type() {
        return type;
    }

    public Lsn lastLsn() {
        return lastLsn;
    }

    /**
     * Positions are ordered by their LSN only.
     */
    @Override
    public int compareTo(Position o) {
        return lastLsn.compareTo(o.lastLsn);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Position that = (Position) o;
        return type == that.type && lastLsn.equals(that.lastLsn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, lastLsn);
    }

    @Override
    public String toString() {
        return "Position [type=" + type + ", lastLSN=" + lastLsn.asString() + "]";
    }
}
