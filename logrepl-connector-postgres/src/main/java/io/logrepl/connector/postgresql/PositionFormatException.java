/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql;

import io.logrepl.LogreplException;

/**
 * Raised when a position token cannot be read.
 */
public class PositionFormatException extends LogreplException {

    private static final long serialVersionUID = 2751060128853113459L;

    public PositionFormatException(String message) {
        super(message);
    }

    public PositionFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
