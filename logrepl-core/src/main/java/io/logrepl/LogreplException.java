/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl;

/**
 * Base of all unchecked exceptions raised while capturing changes or managing replication endpoints.
 */
public class LogreplException extends RuntimeException {

    private static final long serialVersionUID = 4110862741036453180L;

    public LogreplException(String message) {
        super(message);
    }

    public LogreplException(Throwable cause) {
        super(cause);
    }

    public LogreplException(String message, Throwable cause) {
        super(message, cause);
    }
}
