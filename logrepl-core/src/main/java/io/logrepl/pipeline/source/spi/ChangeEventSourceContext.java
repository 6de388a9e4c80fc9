/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.pipeline.source.spi;

/**
 * Lets a change event source find out whether it should keep producing events.
 */
public interface ChangeEventSourceContext {

    /**
     * @return {@code true} as long as the source has not been cancelled
     */
    boolean isRunning();

    /**
     * The reason why the source was cancelled.
     *
     * @return the cause, or {@code null} while {@link #isRunning()} returns {@code true}
     */
    Throwable cancellationCause();
}
