/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql.connection;

import java.sql.SQLException;

import io.logrepl.LogreplException;

/**
 * Raised when creating or dropping a replication slot or publication fails on the server.
 */
public class EndpointException extends LogreplException {

    private static final long serialVersionUID = -3019771316541837719L;

    private final String operation;
    private final String objectName;

    public EndpointException(String operation, String objectName, SQLException cause) {
        super("Failed to " + operation + " \"" + objectName + "\": " + cause.getMessage(), cause);
        this.operation = operation;
        this.objectName = objectName;
    }

    /**
     * @return a description of the failed operation, e.g. {@code drop replication slot}
     */
    public String operation() {
        return operation;
    }

    public String objectName() {
        return objectName;
    }
}
