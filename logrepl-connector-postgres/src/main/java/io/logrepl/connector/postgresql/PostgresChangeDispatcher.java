/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql;

import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.logrepl.annotation.NotThreadSafe;
import io.logrepl.connector.base.ChangeEventQueue;
import io.logrepl.connector.postgresql.connection.DeleteMessage;
import io.logrepl.connector.postgresql.connection.InsertMessage;
import io.logrepl.connector.postgresql.connection.Lsn;
import io.logrepl.connector.postgresql.connection.RelationMessage;
import io.logrepl.connector.postgresql.connection.ReplicationMessage;
import io.logrepl.connector.postgresql.connection.TupleData;
import io.logrepl.connector.postgresql.connection.UpdateMessage;
import io.logrepl.connector.postgresql.connection.pgoutput.PgOutputMessageDecoder;
import io.logrepl.pipeline.StreamCancelledException;
import io.logrepl.pipeline.source.spi.ChangeEventSourceContext;
import io.logrepl.util.Clock;
import io.logrepl.util.LoggingContext;

/**
 * Turns the messages of a logical replication session into {@link ChangeRecord}s and hands them to the
 * {@link ChangeEventQueue}.
 * <p>
 * Messages must be passed in the order the server sent them, from a single thread. Relation messages update the
 * {@link RelationCache}; insert, update and delete messages each produce one record; all other messages are skipped.
 * <p>
 * Handing a record to the queue is the only point at which the dispatcher blocks, and the only point at which it
 * observes cancellation of its context. Once cancellation is observed, a {@link StreamCancelledException} carrying the
 * cancellation cause is raised and the record is not enqueued.
 */
@NotThreadSafe
public class PostgresChangeDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresChangeDispatcher.class);

    private static final String CONNECTOR_TYPE = "postgres";
    private static final String STREAMING_CONTEXT = "streaming";

    private final Map<String, String> tableKeys;
    private final RelationCache relationCache;
    private final ChangeEventQueue<ChangeRecord> queue;
    private final PositionCodec positionCodec;
    private final Clock clock;
    private final PgOutputMessageDecoder messageDecoder = new PgOutputMessageDecoder();

    public PostgresChangeDispatcher(PostgresConnectorConfig connectorConfig, ChangeEventQueue<ChangeRecord> queue) {
        this(connectorConfig.tableKeys(), new RelationCache(), queue, new PositionCodec(), Clock.system());
    }

    public PostgresChangeDispatcher(Map<String, String> tableKeys, RelationCache relationCache, ChangeEventQueue<ChangeRecord> queue,
                                    PositionCodec positionCodec, Clock clock) {
        this.tableKeys = tableKeys;
        this.relationCache = relationCache;
        this.queue = queue;
        this.positionCodec = positionCodec;
        this.clock = clock;
    }

    /**
     * Create the queue change records are handed over through, sized as configured.
     */
    public static ChangeEventQueue<ChangeRecord> createQueue(PostgresConnectorConfig connectorConfig) {
        return new ChangeEventQueue.Builder<ChangeRecord>()
                .pollInterval(connectorConfig.pollInterval())
                .maxQueueSize(connectorConfig.maxQueueSize())
                .maxBatchSize(connectorConfig.maxBatchSize())
                .loggingContextSupplier(() -> LoggingContext.forConnector(CONNECTOR_TYPE, connectorConfig.topicPrefix(), STREAMING_CONTEXT))
                .build();
    }

    /**
     * Decode a raw pgoutput message and handle it.
     *
     * @see #handle(ChangeEventSourceContext, ReplicationMessage, Lsn)
     */
    public void handle(ChangeEventSourceContext context, ByteBuffer rawMessage, Lsn lsn) throws InterruptedException {
        handle(context, messageDecoder.decode(rawMessage), lsn);
    }

    /**
     * Handle one replication message.
     *
     * @param context the context of the replication session; checked for cancellation while a record is handed over
     * @param message the message; may not be null
     * @param lsn the LSN at which the message was received
     * @throws RelationNotFoundException if a data message references a relation that was not announced before
     * @throws TupleDecodingException if a tuple required for the record cannot be decoded
     * @throws StreamCancelledException if the context was cancelled before the record was handed over
     * @throws InterruptedException if the thread was interrupted while waiting for the queue
     */
    public void handle(ChangeEventSourceContext context, ReplicationMessage message, Lsn lsn) throws InterruptedException {
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Received {} message at LSN {}", message.type(), lsn.asString());
        }

        if (message instanceof RelationMessage) {
            // relations must be known to decode the data messages which follow
            relationCache.add((RelationMessage) message);
        }
        else if (message instanceof InsertMessage) {
            handleInsert(context, (InsertMessage) message, lsn);
        }
        else if (message instanceof UpdateMessage) {
            handleUpdate(context, (UpdateMessage) message, lsn);
        }
        else if (message instanceof DeleteMessage) {
            handleDelete(context, (DeleteMessage) message, lsn);
        }
        else {
            LOGGER.trace("Skipping {} message", message.type());
        }
    }

    private void handleInsert(ChangeEventSourceContext context, InsertMessage message, Lsn lsn) throws InterruptedException {
        final RelationMessage relation = resolve(message.relationId(), "insert", lsn);
        final Map<String, Object> newValues = decode(relation, message.newTuple(), "new", "insert", lsn);

        send(context, ChangeRecord.create(
                positionCodec.encode(lsn),
                buildMetadata(relation),
                buildKey(newValues, relation.name()),
                buildPayload(newValues)));
    }

    private void handleUpdate(ChangeEventSourceContext context, UpdateMessage message, Lsn lsn) throws InterruptedException {
        final RelationMessage relation = resolve(message.relationId(), "update", lsn);
        final Map<String, Object> newValues = decode(relation, message.newTuple(), "new", "update", lsn);
        // the old row is only logged for some replica identities, its absence is not an error
        final Map<String, Object> oldValues = relationCache.tryDecode(relation.relationId(), message.oldTuple()).orElse(null);

        send(context, ChangeRecord.update(
                positionCodec.encode(lsn),
                buildMetadata(relation),
                buildKey(newValues, relation.name()),
                buildPayload(oldValues),
                buildPayload(newValues)));
    }

    private void handleDelete(ChangeEventSourceContext context, DeleteMessage message, Lsn lsn) throws InterruptedException {
        final RelationMessage relation = resolve(message.relationId(), "delete", lsn);
        final Map<String, Object> oldValues = decode(relation, message.oldTuple(), "old", "delete", lsn);

        send(context, ChangeRecord.delete(
                positionCodec.encode(lsn),
                buildMetadata(relation),
                buildKey(oldValues, relation.name())));
    }

    private RelationMessage resolve(int relationId, String operation, Lsn lsn) {
        try {
            return relationCache.get(relationId);
        }
        catch (RelationNotFoundException e) {
            throw new RelationNotFoundException("Failed to handle " + operation + " at LSN " + lsn.asString() + ": " + e.getMessage(), e);
        }
    }

    private Map<String, Object> decode(RelationMessage relation, TupleData tuple, String image,
                                       String operation, Lsn lsn) {
        try {
            return relationCache.decode(relation.relationId(), tuple);
        }
        catch (TupleDecodingException e) {
            throw new TupleDecodingException("Failed to decode " + image + " values of " + operation + " on '" + relation.name()
                    + "' at LSN " + lsn.asString() + ": " + e.getMessage(), e);
        }
    }

    /**
     * The single exit point towards the consumer.
     */
    private void send(ChangeEventSourceContext context, ChangeRecord record) throws InterruptedException {
        queue.enqueue(record, context);
    }

    private Map<String, String> buildMetadata(RelationMessage relation) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(ChangeRecord.Metadata.COLLECTION, relation.name());
        if (relation.namespace() != null) {
            metadata.put(ChangeRecord.Metadata.SCHEMA, relation.namespace());
        }
        metadata.put(ChangeRecord.Metadata.READ_AT, Long.toString(clock.currentTimeInMillis()));
        return metadata;
    }

    /**
     * Copy the configured key column of the table from the values. The key is empty if no key column is configured
     * or the column is not among the values.
     */
    private Map<String, Object> buildKey(Map<String, Object> values, String table) {
        final String keyColumn = tableKeys.get(table);
        if (keyColumn == null || !values.containsKey(keyColumn)) {
            return Collections.emptyMap();
        }
        // TODO support composite keys once table.keys accepts more than one column per table
        Map<String, Object> key = new LinkedHashMap<>();
        key.put(keyColumn, values.get(keyColumn));
        return key;
    }

    /**
     * @return the values, or {@code null} if there are none
     */
    private static Map<String, Object> buildPayload(Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values;
    }
}
