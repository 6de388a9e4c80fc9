/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.pipeline.source;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import io.logrepl.annotation.ThreadSafe;
import io.logrepl.pipeline.source.spi.ChangeEventSourceContext;
import io.logrepl.util.Clock;

/**
 * A {@link ChangeEventSourceContext} that is cancelled explicitly, when its optional deadline passes, or when its
 * parent is cancelled. The first cause observed wins.
 */
@ThreadSafe
public final class CancellableContext implements ChangeEventSourceContext {

    private final ChangeEventSourceContext parent;
    private final Instant deadline;
    private final Clock clock;
    private final AtomicReference<Throwable> cause = new AtomicReference<>();

    private CancellableContext(ChangeEventSourceContext parent, Instant deadline, Clock clock) {
        this.parent = parent;
        this.deadline = deadline;
        this.clock = clock;
    }

    public static CancellableContext create() {
        return new CancellableContext(null, null, Clock.system());
    }

    /**
     * Create a context that is cancelled whenever the given parent is.
     */
    public static CancellableContext withParent(ChangeEventSourceContext parent) {
        return new CancellableContext(parent, null, Clock.system());
    }

    /**
     * Create a context that cancels itself once the timeout, measured with the given clock, has elapsed.
     */
    public static CancellableContext withTimeout(ChangeEventSourceContext parent, Duration timeout, Clock clock) {
        return new CancellableContext(parent, clock.currentTimeAsInstant().plus(timeout), clock);
    }

    /**
     * Cancel this context with a generic cause.
     */
    public void cancel() {
        cancel(new CancellationException("context cancelled"));
    }

    /**
     * Cancel this context. Has no effect if it was already cancelled.
     */
    public void cancel(Throwable cause) {
        this.cause.compareAndSet(null, cause);
    }

    @Override
    public boolean isRunning() {
        return cancellationCause() == null;
    }

    @Override
    public Throwable cancellationCause() {
        Throwable own = cause.get();
        if (own != null) {
            return own;
        }
        if (parent != null && !parent.isRunning()) {
            cause.compareAndSet(null, parent.cancellationCause());
            return cause.get();
        }
        if (deadline != null && !clock.currentTimeAsInstant().isBefore(deadline)) {
            cause.compareAndSet(null, new TimeoutException("context deadline exceeded"));
            return cause.get();
        }
        return null;
    }
}
