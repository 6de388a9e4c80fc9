/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql.connection;

import org.postgresql.replication.LogSequenceNumber;

import io.logrepl.annotation.Immutable;

/**
 * Abstraction of PostgreSQL log sequence number, adapted from
 * {@link LogSequenceNumber}. The textual form is two hexadecimal halves separated by a slash, e.g. {@code 0/16B3748}.
 */
@Immutable
public final class Lsn implements Comparable<Lsn> {

    /**
     * Zero is used inside PostgreSQL as invalid LSN.
     */
    public static final Lsn INVALID_LSN = new Lsn(0);

    private final long value;

    private Lsn(long value) {
        this.value = value;
    }

    /**
     * @param value numeric represent position in the write-ahead log stream
     * @return not null LSN instance
     */
    public static Lsn valueOf(long value) {
        if (value == 0) {
            return INVALID_LSN;
        }
        return new Lsn(value);
    }

    /**
     * @param strValue textual representation in form {@code XXXXXXXX/XXXXXXXX}
     * @return the LSN, or {@link #INVALID_LSN} if the value is null or not in the expected form
     */
    public static Lsn valueOf(String strValue) {
        if (strValue == null) {
            return INVALID_LSN;
        }
        int slashIndex = strValue.indexOf('/');
        if (slashIndex <= 0 || slashIndex != strValue.lastIndexOf('/')) {
            return INVALID_LSN;
        }
        String high = strValue.substring(0, slashIndex);
        String low = strValue.substring(slashIndex + 1);
        if (!isHexWord(high) || !isHexWord(low)) {
            return INVALID_LSN;
        }
        return valueOf(LogSequenceNumber.valueOf(strValue).asLong());
    }

    private static boolean isHexWord(String value) {
        if (value.isEmpty() || value.length() > 8) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (Character.digit(value.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return Long represent position in the write-ahead log stream
     */
    public long asLong() {
        return value;
    }

    /**
     * @return PostgreSQL JDBC driver representation of position in the write-ahead log stream
     */
    public LogSequenceNumber asLogSequenceNumber() {
        return LogSequenceNumber.valueOf(value);
    }

    /**
     * @return String represent position in the write-ahead log stream
     */
    public String asString() {
        return asLogSequenceNumber().asString();
    }

    /**
     * @return true if this LSN is not {@link #INVALID_LSN}
     */
    public boolean isValid() {
        return this.value != INVALID_LSN.value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value == ((Lsn) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "LSN{" + asString() + '}';
    }

    @Override
    public int compareTo(Lsn o) {
        return Long.compareUnsigned(value, o.value);
    }
}
