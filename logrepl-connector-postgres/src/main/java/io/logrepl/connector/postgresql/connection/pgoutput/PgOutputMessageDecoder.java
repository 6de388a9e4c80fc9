/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql.connection.pgoutput;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.logrepl.LogreplException;
import io.logrepl.connector.postgresql.connection.DeleteMessage;
import io.logrepl.connector.postgresql.connection.InsertMessage;
import io.logrepl.connector.postgresql.connection.Lsn;
import io.logrepl.connector.postgresql.connection.OtherMessage;
import io.logrepl.connector.postgresql.connection.RelationMessage;
import io.logrepl.connector.postgresql.connection.ReplicationMessage;
import io.logrepl.connector.postgresql.connection.ReplicationMessage.Type;
import io.logrepl.connector.postgresql.connection.TransactionMessage;
import io.logrepl.connector.postgresql.connection.TupleData;
import io.logrepl.connector.postgresql.connection.UpdateMessage;

/**
 * Decodes messages of the pgoutput logical decoding plugin, protocol version 1.
 * <p>
 * Each message starts with a one byte tag. Integers are in network byte order and strings are null terminated.
 * Messages that change capture does not need are returned as {@link OtherMessage} without reading their body.
 */
public class PgOutputMessageDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(PgOutputMessageDecoder.class);

    private static final Instant PG_EPOCH = LocalDate.of(2000, 1, 1).atStartOfDay().toInstant(ZoneOffset.UTC);

    private static final char NEW_TUPLE = 'N';
    private static final char OLD_KEY_TUPLE = 'K';
    private static final char OLD_TUPLE = 'O';

    /**
     * Decode the message held by the buffer's remaining bytes.
     *
     * @param buffer the raw message; its position is advanced past the decoded content
     * @return the decoded message; never null
     * @throws LogreplException if the message is truncated or malformed
     */
    public ReplicationMessage decode(ByteBuffer buffer) {
        if (!buffer.hasRemaining()) {
            throw new LogreplException("Received an empty pgoutput message");
        }
        final char tag = (char) buffer.get();
        final Type type = Type.forTag(tag);
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Message Type: {}", type);
        }
        try {
            switch (type) {
                case BEGIN:
                    return decodeBegin(buffer);
                case COMMIT:
                    return decodeCommit(buffer);
                case RELATION:
                    return decodeRelation(buffer);
                case INSERT:
                    return decodeInsert(buffer);
                case UPDATE:
                    return decodeUpdate(buffer);
                case DELETE:
                    return decodeDelete(buffer);
                default:
                    LOGGER.trace("Message type '{}' skipped, not processed", tag);
                    return new OtherMessage(tag);
            }
        }
        catch (BufferUnderflowException | IndexOutOfBoundsException e) {
            throw new LogreplException("Truncated pgoutput message of type " + type, e);
        }
    }

    private TransactionMessage decodeBegin(ByteBuffer buffer) {
        final Lsn finalLsn = Lsn.valueOf(buffer.getLong());
        final Instant commitTime = readTimestamp(buffer);
        final long transactionId = Integer.toUnsignedLong(buffer.getInt());
        LOGGER.trace("Begin LSN: {}, commit time: {}, transaction id: {}", finalLsn, commitTime, transactionId);
        return TransactionMessage.begin(finalLsn, commitTime, transactionId);
    }

    private TransactionMessage decodeCommit(ByteBuffer buffer) {
        buffer.get(); // flags, currently unused
        final Lsn commitLsn = Lsn.valueOf(buffer.getLong());
        final Lsn endLsn = Lsn.valueOf(buffer.getLong());
        final Instant commitTime = readTimestamp(buffer);
        LOGGER.trace("Commit LSN: {}, end LSN: {}, commit time: {}", commitLsn, endLsn, commitTime);
        return TransactionMessage.commit(commitLsn, commitTime);
    }

    private RelationMessage decodeRelation(ByteBuffer buffer) {
        final int relationId = buffer.getInt();
        final String namespace = readString(buffer);
        final String name = readString(buffer);
        final char replicaIdentity = (char) buffer.get();
        final short columnCount = buffer.getShort();

        LOGGER.trace("Event: {}, RelationId: {}, Replica Identity: {}, Columns: {}", Type.RELATION, relationId, replicaIdentity, columnCount);

        List<RelationMessage.Column> columns = new ArrayList<>(columnCount);
        for (short i = 0; i < columnCount; ++i) {
            final int flags = buffer.get();
            final String columnName = readString(buffer);
            final int typeOid = buffer.getInt();
            final int typeModifier = buffer.getInt();
            columns.add(new RelationMessage.Column(flags, columnName, typeOid, typeModifier));
        }
        return new RelationMessage(relationId, namespace, name, replicaIdentity, columns);
    }

    private InsertMessage decodeInsert(ByteBuffer buffer) {
        final int relationId = buffer.getInt();
        expectTupleType(buffer, NEW_TUPLE, Type.INSERT);
        return new InsertMessage(relationId, readTuple(buffer));
    }

    private UpdateMessage decodeUpdate(ByteBuffer buffer) {
        final int relationId = buffer.getInt();
        char tupleType = (char) buffer.get();
        if (tupleType == OLD_KEY_TUPLE || tupleType == OLD_TUPLE) {
            final TupleData oldTuple = readTuple(buffer);
            expectTupleType(buffer, NEW_TUPLE, Type.UPDATE);
            return new UpdateMessage(relationId, tupleType, oldTuple, readTuple(buffer));
        }
        if (tupleType != NEW_TUPLE) {
            throw new LogreplException("Unexpected tuple type '" + tupleType + "' in " + Type.UPDATE + " message");
        }
        return new UpdateMessage(relationId, readTuple(buffer));
    }

    private DeleteMessage decodeDelete(ByteBuffer buffer) {
        final int relationId = buffer.getInt();
        final char tupleType = (char) buffer.get();
        if (tupleType != OLD_KEY_TUPLE && tupleType != OLD_TUPLE) {
            throw new LogreplException("Unexpected tuple type '" + tupleType + "' in " + Type.DELETE + " message");
        }
        return new DeleteMessage(relationId, tupleType, readTuple(buffer));
    }

    private static void expectTupleType(ByteBuffer buffer, char expected, Type messageType) {
        final char tupleType = (char) buffer.get();
        if (tupleType != expected) {
            throw new LogreplException("Unexpected tuple type '" + tupleType + "' in " + messageType + " message, expected '" + expected + "'");
        }
    }

    private static TupleData readTuple(ByteBuffer buffer) {
        final short columnCount = buffer.getShort();
        List<TupleData.Column> columns = new ArrayList<>(columnCount);
        for (short i = 0; i < columnCount; ++i) {
            final char code = (char) buffer.get();
            final TupleData.Kind kind = TupleData.Kind.forCode(code);
            if (kind == null) {
                throw new LogreplException("Unsupported tuple column kind '" + code + "'");
            }
            switch (kind) {
                case NULL:
                    columns.add(TupleData.Column.nullValue());
                    break;
                case UNCHANGED:
                    columns.add(TupleData.Column.unchanged());
                    break;
                case TEXT:
                    columns.add(TupleData.Column.text(readBytes(buffer)));
                    break;
                case BINARY:
                    columns.add(TupleData.Column.binary(readBytes(buffer)));
                    break;
                default:
                    throw new LogreplException("Unsupported tuple column kind '" + code + "'");
            }
        }
        return new TupleData(columns);
    }

    private static byte[] readBytes(ByteBuffer buffer) {
        final int length = buffer.getInt();
        if (length < 0 || length > buffer.remaining()) {
            throw new LogreplException("Invalid tuple column length " + length);
        }
        final byte[] bytes = new byte[length];
        buffer.get(bytes);
        return bytes;
    }

    private static Instant readTimestamp(ByteBuffer buffer) {
        // microseconds since 2000-01-01 00:00:00 UTC
        return PG_EPOCH.plus(buffer.getLong(), ChronoUnit.MICROS);
    }

    /**
     * Reads a null-terminated string from the buffer.
     */
    private static String readString(ByteBuffer buffer) {
        final int start = buffer.position();
        int end = start;
        while (buffer.get(end) != 0) {
            end++;
        }
        final byte[] bytes = new byte[end - start];
        buffer.get(bytes);
        buffer.get(); // terminator
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
