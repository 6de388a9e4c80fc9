/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql.connection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.logrepl.annotation.Immutable;

/**
 * Describes the schema of a relation. PostgreSQL sends one before the first data message referencing the relation
 * within a session, and again whenever the relation's definition changes.
 */
@Immutable
public final class RelationMessage implements ReplicationMessage {

    /**
     * A column of a relation, in the order the columns appear in tuples.
     */
    @Immutable
    public static final class Column {

        /**
         * Set in {@link #flags()} when the column is part of the replica identity.
         */
        public static final int FLAG_KEY = 1;

        private final int flags;
        private final String name;
        private final int typeOid;
        private final int typeModifier;

        public Column(int flags, String name, int typeOid, int typeModifier) {
            this.flags = flags;
            this.name = Objects.requireNonNull(name, "name");
            this.typeOid = typeOid;
            this.typeModifier = typeModifier;
        }

        public int flags() {
            return flags;
        }

        public boolean isKey() {
            return (flags & FLAG_KEY) != 0;
        }

        public String name() {
            return name;
        }

        public int typeOid() {
            return typeOid;
        }

        public int typeModifier() {
            return typeModifier;
        }

        @Override
        public String toString() {
            return name + " (oid=" + typeOid + (isKey() ? ", key" : "") + ")";
        }
    }

    private final int relationId;
    private final String namespace;
    private final String name;
    private final char replicaIdentity;
    private final List<Column> columns;

    public RelationMessage(int relationId, String namespace, String name, char replicaIdentity, List<Column> columns) {
        this.relationId = relationId;
        this.namespace = namespace;
        this.name = Objects.requireNonNull(name, "name");
        this.replicaIdentity = replicaIdentity;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    @Override
    public Type type() {
        return Type.RELATION;
    }

    public int relationId() {
        return relationId;
    }

    public String namespace() {
        return namespace;
    }

    public String name() {
        return name;
    }

    /**
     * @return the replica identity setting, one of {@code d} (default), {@code n} (nothing), {@code f} (full)
     *         or {@code i} (index)
     */
    public char replicaIdentity() {
        return replicaIdentity;
    }

    public List<Column> columns() {
        return columns;
    }

    @Override
    public String toString() {
        return "RelationMessage [relationId=" + relationId + ", namespace=" + namespace + ", name=" + name
                + ", replicaIdentity=" + replicaIdentity + ", columns=" + columns + "]";
    }
}
