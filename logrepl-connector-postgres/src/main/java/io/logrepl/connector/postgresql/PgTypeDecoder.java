/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.util.UUID;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.logrepl.annotation.ThreadSafe;

/**
 * Converts column values sent by the pgoutput plugin into Java values, based on the column's type OID.
 * <p>
 * Text format values are converted as follows; all other types are kept as {@link String}:
 * <ul>
 * <li>{@code bool} to {@link Boolean}</li>
 * <li>{@code int2}, {@code int4}, {@code int8} and {@code oid} to {@link Short}, {@link Integer} and {@link Long}</li>
 * <li>{@code float4} and {@code float8} to {@link Float} and {@link Double}</li>
 * <li>{@code numeric} to {@link BigDecimal}, or {@link Double} for the special values {@code NaN} and {@code Infinity}</li>
 * <li>{@code date}, {@code time}, {@code timestamp} and {@code timestamptz} to {@code LocalDate}, {@code LocalTime},
 * {@code LocalDateTime} and {@code OffsetDateTime}, see {@link PgTemporalParser}</li>
 * <li>{@code uuid} to {@link UUID}, {@code bytea} to {@code byte[]}</li>
 * <li>{@code json} and {@code jsonb} to maps, lists and scalars as parsed by Jackson</li>
 * </ul>
 * Binary format values are converted for the boolean, integer, floating point, uuid and character types and kept as
 * raw {@code byte[]} otherwise.
 */
@ThreadSafe
public class PgTypeDecoder {

    private final ObjectMapper mapper;

    public PgTypeDecoder() {
        this(new ObjectMapper());
    }

    public PgTypeDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Convert a value sent in text format.
     *
     * @param typeOid the OID of the column type
     * @param text the textual value; may not be null
     * @throws TupleDecodingException if the value is not valid for the type
     */
    public Object decodeText(int typeOid, String text) {
        try {
            switch (typeOid) {
                case PgOid.BOOL:
                    return decodeBoolean(text);
                case PgOid.INT2:
                    return Short.valueOf(text);
                case PgOid.INT4:
                    return Integer.valueOf(text);
                case PgOid.INT8:
                case PgOid.OID:
                    return Long.valueOf(text);
                case PgOid.FLOAT4:
                    return Float.valueOf(text);
                case PgOid.FLOAT8:
                    return Double.valueOf(text);
                case PgOid.NUMERIC:
                    return decodeNumeric(text);
                case PgOid.DATE:
                    return PgTemporalParser.toLocalDate(text);
                case PgOid.TIME:
                    return PgTemporalParser.toLocalTime(text);
                case PgOid.TIMESTAMP:
                    return PgTemporalParser.toLocalDateTime(text);
                case PgOid.TIMESTAMPTZ:
                    return PgTemporalParser.toOffsetDateTime(text);
                case PgOid.UUID:
                    return UUID.fromString(text);
                case PgOid.BYTEA:
                    return decodeByteArray(text);
                case PgOid.JSON:
                case PgOid.JSONB_OID:
                    return mapper.readValue(text, Object.class);
                default:
                    return text;
            }
        }
        catch (IllegalArgumentException | DateTimeException | IOException e) {
            throw new TupleDecodingException("Cannot convert value '" + text + "' of type " + typeOid + ": " + e.getMessage(), e);
        }
    }

    /**
     * Convert a value sent in binary format.
     *
     * @param typeOid the OID of the column type
     * @param data the value in the type's binary send format; may not be null
     * @throws TupleDecodingException if the value does not have the size required by the type
     */
    public Object decodeBinary(int typeOid, byte[] data) {
        final ByteBuffer buffer = ByteBuffer.wrap(data);
        try {
            switch (typeOid) {
                case PgOid.BOOL:
                    return exactly(buffer, 1).get() != 0;
                case PgOid.INT2:
                    return exactly(buffer, 2).getShort();
                case PgOid.INT4:
                    return exactly(buffer, 4).getInt();
                case PgOid.INT8:
                    return exactly(buffer, 8).getLong();
                case PgOid.OID:
                    return Integer.toUnsignedLong(exactly(buffer, 4).getInt());
                case PgOid.FLOAT4:
                    return exactly(buffer, 4).getFloat();
                case PgOid.FLOAT8:
                    return exactly(buffer, 8).getDouble();
                case PgOid.UUID:
                    exactly(buffer, 16);
                    return new UUID(buffer.getLong(), buffer.getLong());
                case PgOid.TEXT:
                case PgOid.VARCHAR:
                case PgOid.BPCHAR:
                case PgOid.NAME:
                case PgOid.CHAR:
                    return new String(data, StandardCharsets.UTF_8);
                default:
                    return data.clone();
            }
        }
        catch (BufferUnderflowException e) {
            throw new TupleDecodingException("Binary value of type " + typeOid + " is too short", e);
        }
    }

    private static ByteBuffer exactly(ByteBuffer buffer, int size) {
        if (buffer.remaining() != size) {
            throw new TupleDecodingException("Binary value of " + buffer.remaining() + " bytes where " + size + " bytes are expected");
        }
        return buffer;
    }

    private static Boolean decodeBoolean(String text) {
        switch (text) {
            case "t":
            case "true":
                return Boolean.TRUE;
            case "f":
            case "false":
                return Boolean.FALSE;
            default:
                throw new IllegalArgumentException("not a boolean");
        }
    }

    private static Object decodeNumeric(String text) {
        switch (text) {
            case "NaN":
                return Double.NaN;
            case "Infinity":
                return Double.POSITIVE_INFINITY;
            case "-Infinity":
                return Double.NEGATIVE_INFINITY;
            default:
                return new BigDecimal(text);
        }
    }

    private static byte[] decodeByteArray(String text) {
        if (!text.startsWith("\\x")) {
            throw new IllegalArgumentException("only the hex output format of bytea is supported");
        }
        final String hex = text.substring(2);
        if (hex.length() % 2 != 0) {
            throw new IllegalArgumentException("odd number of hex digits");
        }
        final byte[] bytes = new byte[hex.length() / 2];
        for (int i = 0; i < bytes.length; i++) {
            final int high = Character.digit(hex.charAt(2 * i), 16);
            final int low = Character.digit(hex.charAt(2 * i + 1), 16);
            if (high < 0 || low < 0) {
                throw new IllegalArgumentException("invalid hex digit");
            }
            bytes[i] = (byte) ((high << 4) | low);
        }
        return bytes;
    }
}
