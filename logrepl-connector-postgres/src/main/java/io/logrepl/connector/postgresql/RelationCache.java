/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.logrepl.annotation.NotThreadSafe;
import io.logrepl.connector.postgresql.connection.RelationMessage;
import io.logrepl.connector.postgresql.connection.TupleData;

/**
 * Keeps the relations announced during a replication session and decodes tuples against them.
 * <p>
 * A cache belongs to a single session and is read and written only by the thread processing that session's messages.
 */
@NotThreadSafe
public class RelationCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelationCache.class);

    private final Map<Integer, RelationMessage> relations = new HashMap<>();
    private final PgTypeDecoder typeDecoder;

    public RelationCache() {
        this(new PgTypeDecoder());
    }

    public RelationCache(PgTypeDecoder typeDecoder) {
        this.typeDecoder = typeDecoder;
    }

    /**
     * Register a relation, replacing any earlier definition with the same id.
     */
    public void add(RelationMessage relation) {
        RelationMessage previous = relations.put(relation.relationId(), relation);
        if (previous != null) {
            LOGGER.debug("Refreshed relation {} '{}.{}'", relation.relationId(), relation.namespace(), relation.name());
        }
        else {
            LOGGER.debug("Registered relation {} '{}.{}'", relation.relationId(), relation.namespace(), relation.name());
        }
    }

    /**
     * @throws RelationNotFoundException if no relation with the given id was registered
     */
    public RelationMessage get(int relationId) {
        RelationMessage relation = relations.get(relationId);
        if (relation == null) {
            throw new RelationNotFoundException(relationId);
        }
        return relation;
    }

    public int size() {
        return relations.size();
    }

    /**
     * Decode a tuple of the given relation into column values, keyed by column name in column order.
     * A SQL {@code NULL} is present in the result with a {@code null} value.
     *
     * @return an unmodifiable map of column values; never null
     * @throws RelationNotFoundException if the relation is not known
     * @throws TupleDecodingException if the tuple is missing, holds an unchanged TOAST value or does not match the relation
     */
    public Map<String, Object> decode(int relationId, TupleData tuple) {
        final RelationMessage relation = get(relationId);
        if (tuple == null) {
            throw new TupleDecodingException("No tuple data for relation '" + relation.name() + "'");
        }
        final List<RelationMessage.Column> columns = relation.columns();
        if (tuple.size() != columns.size()) {
            throw new TupleDecodingException("Tuple has " + tuple.size() + " columns but relation '" + relation.name()
                    + "' has " + columns.size());
        }

        final Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            final RelationMessage.Column column = columns.get(i);
            values.put(column.name(), decodeColumn(relation, column, tuple.columns().get(i)));
        }
        return Collections.unmodifiableMap(values);
    }

    /**
     * Same as {@link #decode(int, TupleData)} for tuples which are optional, such as the old tuple of an update.
     * A tuple that cannot be decoded is logged and yields an empty result.
     *
     * @throws RelationNotFoundException if the relation is not known
     */
    public Optional<Map<String, Object>> tryDecode(int relationId, TupleData tuple) {
        try {
            return Optional.of(decode(relationId, tuple));
        }
        catch (TupleDecodingException e) {
            LOGGER.trace("Could not decode optional tuple of relation {}", relationId, e);
            return Optional.empty();
        }
    }

    private Object decodeColumn(RelationMessage relation, RelationMessage.Column column, TupleData.Column value) {
        try {
            switch (value.kind()) {
                case NULL:
                    return null;
                case TEXT:
                    return typeDecoder.decodeText(column.typeOid(), value.asText());
                case BINARY:
                    return typeDecoder.decodeBinary(column.typeOid(), value.data());
                case UNCHANGED:
                default:
                    throw new TupleDecodingException("Unchanged TOAST value without content");
            }
        }
        catch (TupleDecodingException e) {
            throw new TupleDecodingException("Failed to decode column '" + column.name() + "' of relation '" + relation.name()
                    + "': " + e.getMessage(), e);
        }
    }
}
