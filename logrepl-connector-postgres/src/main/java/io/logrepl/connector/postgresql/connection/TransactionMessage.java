/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql.connection;

import java.time.Instant;
import java.util.OptionalLong;

import io.logrepl.annotation.Immutable;

/**
 * Marks the begin or the commit of a transaction.
 */
@Immutable
public final class TransactionMessage implements ReplicationMessage {

    private final Type type;
    private final Lsn lsn;
    private final Instant commitTime;
    private final OptionalLong transactionId;

    private TransactionMessage(Type type, Lsn lsn, Instant commitTime, OptionalLong transactionId) {
        this.type = type;
        this.lsn = lsn;
        this.commitTime = commitTime;
        this.transactionId = transactionId;
    }

    /**
     * @param finalLsn the LSN of the transaction's commit record
     */
    public static TransactionMessage begin(Lsn finalLsn, Instant commitTime, long transactionId) {
        return new TransactionMessage(Type.BEGIN, finalLsn, commitTime, OptionalLong.of(transactionId));
    }

    /**
     * @param commitLsn the LSN of the transaction's commit record
     */
    public static TransactionMessage commit(Lsn commitLsn, Instant commitTime) {
        return new TransactionMessage(Type.COMMIT, commitLsn, commitTime, OptionalLong.empty());
    }

    @Override
    public Type type() {
        return type;
    }

    public Lsn lsn() {
        return lsn;
    }

    public Instant commitTime() {
        return commitTime;
    }

    /**
     * @return the transaction id; only present on begin messages
     */
    public OptionalLong transactionId() {
        return transactionId;
    }

    @Override
    public String toString() {
        return "TransactionMessage [type=" + type + ", lsn=" + lsn + ", commitTime=" + commitTime + ", transactionId=" + transactionId + "]";
    }
}
