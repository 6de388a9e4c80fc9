/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.pipeline;

import io.logrepl.LogreplException;

/**
 * Raised when a producer observes that its {@link io.logrepl.pipeline.source.spi.ChangeEventSourceContext context}
 * was cancelled. The cancellation cause is available as {@link #getCause()}.
 */
public class StreamCancelledException extends LogreplException {

    private static final long serialVersionUID = -1722539146412950017L;

    public StreamCancelledException(Throwable cause) {
        super("Change event streaming was cancelled: " + (cause != null ? cause.getMessage() : "no cause given"), cause);
    }
}
