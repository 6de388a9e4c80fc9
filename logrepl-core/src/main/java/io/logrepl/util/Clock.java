/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.util;

import java.time.Instant;

/**
 * An abstraction for a clock, so that time can be controlled in tests.
 */
@FunctionalInterface
public interface Clock {

    /**
     * The {@link Clock} backed by {@link System#currentTimeMillis()}.
     */
    Clock SYSTEM = System::currentTimeMillis;

    static Clock system() {
        return SYSTEM;
    }

    /**
     * Get the current time in milliseconds since the epoch.
     */
    long currentTimeInMillis();

    default Instant currentTimeAsInstant() {
        return Instant.ofEpochMilli(currentTimeInMillis());
    }
}
