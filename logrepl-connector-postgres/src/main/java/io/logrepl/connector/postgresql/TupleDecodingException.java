/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql;

import io.logrepl.LogreplException;

/**
 * Raised when a tuple cannot be decoded against the current schema of its relation.
 */
public class TupleDecodingException extends LogreplException {

    private static final long serialVersionUID = -6512870381960212431L;

    public TupleDecodingException(String message) {
        super(message);
    }

    public TupleDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
