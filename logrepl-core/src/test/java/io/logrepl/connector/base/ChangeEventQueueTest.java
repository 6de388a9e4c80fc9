/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.base;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Test;

import io.logrepl.pipeline.StreamCancelledException;
import io.logrepl.pipeline.source.CancellableContext;
import io.logrepl.util.LoggingContext;

public class ChangeEventQueueTest {

    private static ChangeEventQueue<String> queue(int maxQueueSize, int maxBatchSize) {
        return new ChangeEventQueue.Builder<String>()
                .maxQueueSize(maxQueueSize)
                .maxBatchSize(maxBatchSize)
                .pollInterval(Duration.ofMillis(50))
                .loggingContextSupplier(() -> LoggingContext.forConnector("postgres", "test", "streaming"))
                .build();
    }

    @Test
    public void shouldRejectBatchLargerThanQueue() {
        assertThatThrownBy(() -> new ChangeEventQueue.Builder<String>().maxQueueSize(2).maxBatchSize(3).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldPollRecordsInArrivalOrder() throws InterruptedException {
        ChangeEventQueue<String> queue = queue(10, 2);
        CancellableContext context = CancellableContext.create();

        queue.enqueue("a", context);
        queue.enqueue("b", context);
        queue.enqueue("c", context);

        assertThat(queue.remainingCapacity()).isEqualTo(7);
        assertThat(queue.poll()).containsExactly("a", "b");
        assertThat(queue.poll()).containsExactly("c");
        assertThat(queue.poll()).isEmpty();
        assertThat(queue.remainingCapacity()).isEqualTo(queue.totalCapacity());
    }

    @Test
    public void shouldNotEnqueueWhenContextIsAlreadyCancelled() throws InterruptedException {
        ChangeEventQueue<String> queue = queue(10, 2);
        CancellableContext context = CancellableContext.create();
        IllegalStateException cause = new IllegalStateException("shutting down");
        context.cancel(cause);

        assertThatThrownBy(() -> queue.enqueue("a", context))
                .isInstanceOf(StreamCancelledException.class)
                .hasCause(cause);
        assertThat(queue.poll()).isEmpty();
    }

    @Test
    public void shouldUnblockFullQueueWhenCancelled() throws Exception {
        ChangeEventQueue<String> queue = queue(1, 1);
        CancellableContext context = CancellableContext.create();
        queue.enqueue("first", context);

        AtomicReference<Throwable> failure = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);
        Thread producer = new Thread(() -> {
            try {
                queue.enqueue("second", context);
            }
            catch (Throwable t) {
                failure.set(t);
            }
            finally {
                done.countDown();
            }
        });
        producer.start();

        assertThat(done.await(200, TimeUnit.MILLISECONDS)).isFalse();
        context.cancel();

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(failure.get()).isInstanceOf(StreamCancelledException.class);
        assertThat(queue.poll()).containsExactly("first");
    }

    @Test
    public void shouldBlockProducerUntilConsumerDrains() throws Exception {
        ChangeEventQueue<String> queue = queue(2, 2);
        CancellableContext context = CancellableContext.create();
        queue.enqueue("a", context);
        queue.enqueue("b", context);

        CountDownLatch done = new CountDownLatch(1);
        Thread producer = new Thread(() -> {
            try {
                queue.enqueue("c", context);
                done.countDown();
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        producer.start();

        assertThat(done.await(200, TimeUnit.MILLISECONDS)).isFalse();
        assertThat(queue.poll()).containsExactly("a", "b");
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(queue.poll()).containsExactly("c");
    }

    @Test
    public void shouldFailOnInterruptedProducer() {
        ChangeEventQueue<String> queue = queue(10, 2);
        Thread.currentThread().interrupt();

        assertThatThrownBy(() -> queue.enqueue("a", CancellableContext.create()))
                .isInstanceOf(InterruptedException.class);
        assertThat(Thread.currentThread().isInterrupted()).isFalse();
    }

    @Test
    public void shouldRethrowProducerExceptionOnPoll() {
        ChangeEventQueue<String> queue = queue(10, 2);
        queue.producerException(new IllegalStateException("decoding failed"));

        assertThatThrownBy(queue::poll)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("decoding failed");
    }

    @Test
    public void shouldHandOverAllRecordsBetweenThreads() throws InterruptedException {
        int total = 10_000;
        ChangeEventQueue<String> queue = queue(64, 16);
        CancellableContext context = CancellableContext.create();
        AtomicLong read = new AtomicLong();
        List<String> received = new ArrayList<>();

        Thread writer = new Thread(() -> {
            for (int i = 0; i < total; i++) {
                try {
                    queue.enqueue(String.valueOf(i), context);
                }
                catch (InterruptedException e) {
                    return;
                }
            }
        });
        writer.start();

        long deadline = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(10);
        while (read.get() < total && System.currentTimeMillis() < deadline) {
            List<String> batch = queue.poll();
            assertThat(batch.size()).isLessThanOrEqualTo(16);
            received.addAll(batch);
            read.addAndGet(batch.size());
        }
        writer.interrupt();

        assertThat(read.get()).isEqualTo(total);
        assertThat(received.get(0)).isEqualTo("0");
        assertThat(received.get(total - 1)).isEqualTo(String.valueOf(total - 1));
    }
}
