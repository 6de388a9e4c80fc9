/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.base;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.logrepl.annotation.ThreadSafe;
import io.logrepl.pipeline.StreamCancelledException;
import io.logrepl.pipeline.source.spi.ChangeEventSourceContext;
import io.logrepl.util.LoggingContext;
import io.logrepl.util.LoggingContext.PreviousContext;

/**
 * A bounded queue which serves as hand-over point between the thread reading the replication stream and the
 * thread consuming change records.
 * <p>
 * The queue applies back-pressure: once it holds {@code maxQueueSize} elements, {@link #enqueue(Object, ChangeEventSourceContext)}
 * blocks until a consumer has drained some of them. While blocked, the producer re-checks its context every
 * poll interval, so that a cancelled producer never leaves a half-delivered element behind.
 * <p>
 * If the producer fails, it should hand the exception to {@link #producerException(RuntimeException)} before stopping;
 * the next {@link #poll()} rethrows it on the consumer side.
 *
 * @param <T> the type of elements in this queue
 */
@ThreadSafe
public class ChangeEventQueue<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChangeEventQueue.class);

    private final Duration pollInterval;
    private final int maxBatchSize;
    private final int maxQueueSize;

    private final Lock lock;
    private final Condition isFull;
    private final Condition isNotFull;

    private final Queue<T> queue;
    private final Supplier<PreviousContext> loggingContextSupplier;

    private volatile RuntimeException producerException;

    private ChangeEventQueue(Duration pollInterval, int maxQueueSize, int maxBatchSize, Supplier<PreviousContext> loggingContextSupplier) {
        this.pollInterval = pollInterval;
        this.maxBatchSize = maxBatchSize;
        this.maxQueueSize = maxQueueSize;

        this.lock = new ReentrantLock();
        this.isFull = lock.newCondition();
        this.isNotFull = lock.newCondition();

        this.queue = new ArrayDeque<>(maxQueueSize);
        this.loggingContextSupplier = loggingContextSupplier;
    }

    public static class Builder<T> {

        private Duration pollInterval = Duration.ofMillis(500);
        private int maxQueueSize = 8192;
        private int maxBatchSize = 2048;
        private Supplier<PreviousContext> loggingContextSupplier = LoggingContext::current;

        public Builder<T> pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder<T> maxQueueSize(int maxQueueSize) {
            this.maxQueueSize = maxQueueSize;
            return this;
        }

        public Builder<T> maxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder<T> loggingContextSupplier(Supplier<PreviousContext> loggingContextSupplier) {
            this.loggingContextSupplier = loggingContextSupplier;
            return this;
        }

        public ChangeEventQueue<T> build() {
            if (maxBatchSize > maxQueueSize) {
                throw new IllegalArgumentException("Maximum batch size " + maxBatchSize + " must be lower than or equal to the maximum queue size " + maxQueueSize);
            }
            return new ChangeEventQueue<>(pollInterval, maxQueueSize, maxBatchSize, loggingContextSupplier);
        }
    }

    /**
     * Enqueues a record so that it can be obtained via {@link #poll()}. Blocks while the queue is full.
     * Cancellation of the context is checked before the record is offered and on every wake-up while waiting.
     *
     * @param record the record to be enqueued; may not be null
     * @param context the producer's context; may not be null
     * @throws StreamCancelledException if the context was cancelled before the record was accepted
     * @throws InterruptedException if this thread has been interrupted
     */
    public void enqueue(T record, ChangeEventSourceContext context) throws InterruptedException {
        Objects.requireNonNull(record, "record");

        if (Thread.interrupted()) {
            throw new InterruptedException();
        }

        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Enqueuing record '{}'", record);
        }

        lock.lock();
        try {
            while (true) {
                if (!context.isRunning()) {
                    throw new StreamCancelledException(context.cancellationCause());
                }
                if (queue.size() < maxQueueSize) {
                    break;
                }
                // signal poll() to drain queue
                isFull.signalAll();
                isNotFull.await(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
            }

            queue.add(record);

            if (queue.size() >= maxBatchSize) {
                isFull.signalAll();
            }
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Returns the next batch of elements from this queue. Waits up to the poll interval for a full batch and
     * returns whatever has arrived by then, possibly nothing.
     *
     * @throws InterruptedException if this thread has been interrupted while waiting
     */
    public List<T> poll() throws InterruptedException {
        PreviousContext previousContext = loggingContextSupplier.get();
        try {
            LOGGER.debug("polling records...");
            final long deadline = System.nanoTime() + pollInterval.toNanos();
            lock.lock();
            try {
                List<T> records = new ArrayList<>(Math.min(maxBatchSize, queue.size()));
                while (drainRecords(records, maxBatchSize - records.size()) < maxBatchSize) {
                    throwProducerExceptionIfPresent();

                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        break;
                    }
                    LOGGER.debug("no records available or batch size not reached yet, sleeping a bit...");
                    // signal enqueue() to add more records
                    isNotFull.signalAll();
                    isFull.awaitNanos(remaining);
                }
                isNotFull.signalAll();
                return records;
            }
            finally {
                lock.unlock();
            }
        }
        finally {
            previousContext.restore();
        }
    }

    private int drainRecords(List<T> records, int maxElements) {
        int recordsToDrain = Math.min(queue.size(), maxElements);
        for (int i = 0; i < recordsToDrain; i++) {
            records.add(queue.poll());
        }
        return records.size();
    }

    public void producerException(final RuntimeException producerException) {
        this.producerException = producerException;
    }

    private void throwProducerExceptionIfPresent() {
        if (producerException != null) {
            throw producerException;
        }
    }

    public int totalCapacity() {
        return maxQueueSize;
    }

    public int remainingCapacity() {
        lock.lock();
        try {
            return maxQueueSize - queue.size();
        }
        finally {
            lock.unlock();
        }
    }
}
