/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.taskpool.logging;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ordered, non-blocking delivery of {@link LogRecord}s from any number of producer
 * threads to a set of {@link LogSink}s.
 *
 * <p>Key Responsibilities:
 * <ul>
 *   <li><strong>Decoupling:</strong> producers only pay for a queue insertion; sink I/O
 *       happens on one dedicated daemon consumer thread</li>
 *   <li><strong>Ordering:</strong> the queue is a single total order across producers, and
 *       every sink receives records in exactly that order. Sinks are visited in the order
 *       they were registered</li>
 *   <li><strong>Isolation:</strong> a sink that throws is counted and reported through Log4j;
 *       delivery continues to the other sinks and the consumer loop keeps running</li>
 *   <li><strong>Shutdown:</strong> {@link #stop()} drains what is queued within a bounded
 *       grace period, closes the sinks and halts the consumer</li>
 * </ul>
 *
 * <p>{@link #enqueue(LogRecord)} never throws into the producer. Records offered after
 * {@link #stop()}, or while a bounded queue is full, are dropped and counted in
 * {@link #droppedCount()}.
 *
 * <p>The pipeline's own faults are written to Log4j rather than back into the pipeline,
 * so a failing sink cannot feed itself.
 */
public final class LogPipeline implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(LogPipeline.class);
    private static final long POLL_MILLIS = 50;
    private static final long DROP_WARNING_EVERY = 1000;

    private final String name;
    private final Duration stopGrace;
    private final BlockingQueue<Object> queue;
    private final CopyOnWriteArrayList<LogSink> sinks = new CopyOnWriteArrayList<>();
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicLong enqueued = new AtomicLong();
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong sinkErrors = new AtomicLong();
    private final Thread consumerThread;

    /**
     * Creates an unbounded pipeline with a five second stop grace period.
     *
     * @param name used for the consumer thread name and diagnostics
     */
    public LogPipeline(String name) {
        this(name, 0, Duration.ofSeconds(5));
    }

    /**
     * @param name used for the consumer thread name and diagnostics
     * @param capacity maximum queued records, or 0 for an unbounded queue
     * @param stopGrace how long {@link #stop()} waits for queued records to drain
     */
    public LogPipeline(String name, int capacity, Duration stopGrace) {
        this.name = Objects.requireNonNull(name, "name");
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0, got " + capacity);
        }
        this.stopGrace = Objects.requireNonNullElse(stopGrace, Duration.ofSeconds(5));
        this.queue = capacity == 0 ? new LinkedBlockingQueue<>() : new LinkedBlockingQueue<>(capacity);
        this.consumerThread = new Thread(this::consumeLoop, "LogPipeline-" + name);
        this.consumerThread.setDaemon(true);
        this.consumerThread.start();
    }

    /**
     * Adds a sink. It receives every record dequeued from now on, after all sinks that
     * were registered before it.
     *
     * @param sink the sink to add
     * @throws IllegalStateException if the pipeline has been stopped
     */
    public void registerSink(LogSink sink) {
        Objects.requireNonNull(sink, "sink");
        checkNotStopped();
        sinks.add(sink);
    }

    public void removeSink(LogSink sink) {
        sinks.remove(sink);
    }

    public List<LogSink> getSinks() {
        return new ArrayList<>(sinks);
    }

    /**
     * Appends a record to the queue without blocking.
     *
     * @param record the record to deliver
     * @return true if the record was queued, false if it was dropped
     */
    public boolean enqueue(LogRecord record) {
        if (record == null) {
            return false;
        }
        if (!accepting.get()) {
            dropped.incrementAndGet();
            return false;
        }
        if (queue.offer(record)) {
            enqueued.incrementAndGet();
            return true;
        }
        long drops = dropped.incrementAndGet();
        if (drops == 1 || drops % DROP_WARNING_EVERY == 0) {
            logger.warn("Log pipeline '{}' queue is full, dropping records ({} dropped so far)", name, drops);
        }
        return false;
    }

    /**
     * Creates and enqueues a record stamped with the calling thread.
     */
    public boolean log(Level level, String source, String message) {
        return enqueue(new LogRecord(level, source, message));
    }

    /**
     * Waits until every record enqueued before this call has been handed to the sinks.
     *
     * @param timeout maximum time to wait
     * @return true if the queue drained up to this point in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean flush(Duration timeout) throws InterruptedException {
        if (!accepting.get()) {
            return queue.isEmpty();
        }
        // convert saturates, so a huge timeout waits as long as it can instead of overflowing
        long nanos = TimeUnit.NANOSECONDS.convert(timeout);
        long start = System.nanoTime();
        FlushMarker marker = new FlushMarker();
        if (!queue.offer(marker, nanos, TimeUnit.NANOSECONDS)) {
            return false;
        }
        long remaining = nanos - (System.nanoTime() - start);
        return marker.reached.await(Math.max(0, remaining), TimeUnit.NANOSECONDS);
    }

    /**
     * Stops accepting records, drains the queue for at most the configured grace period,
     * closes every sink and halts the consumer thread. Idempotent.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        accepting.set(false);
        try {
            consumerThread.join(Math.max(1, stopGrace.toMillis()));
            if (consumerThread.isAlive()) {
                logger.warn("Log pipeline '{}' did not drain within {}ms, abandoning {} queued records",
                    name, stopGrace.toMillis(), queue.size());
                consumerThread.interrupt();
                consumerThread.join(POLL_MILLIS * 4);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            consumerThread.interrupt();
        }

        // Records that slipped in after the consumer exited are never delivered. They move
        // from the enqueued count to the dropped count so no record is counted in both.
        Object leftover;
        while ((leftover = queue.poll()) != null) {
            if (leftover instanceof FlushMarker) {
                ((FlushMarker) leftover).reached.countDown();
            } else {
                enqueued.decrementAndGet();
                dropped.incrementAndGet();
            }
        }

        for (LogSink sink : sinks) {
            try {
                sink.close();
            } catch (Exception e) {
                logger.warn("Error closing sink {} of log pipeline '{}': {}", sink, name, e.getMessage(), e);
            }
        }
        sinks.clear();
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return !stopped.get() && consumerThread.isAlive();
    }

    public String getName() {
        return name;
    }

    /**
     * Records accepted into the queue and not later abandoned by {@link #stop()}. Once the
     * pipeline has stopped this equals {@link #deliveredCount()}.
     */
    public long enqueuedCount() {
        return enqueued.get();
    }

    public long deliveredCount() {
        return delivered.get();
    }

    /**
     * Records rejected at the door plus records abandoned in the queue at stop. Disjoint from
     * {@link #enqueuedCount()}.
     */
    public long droppedCount() {
        return dropped.get();
    }

    public long sinkErrorCount() {
        return sinkErrors.get();
    }

    public int queuedCount() {
        return queue.size();
    }

    private void consumeLoop() {
        while (true) {
            Object item;
            try {
                item = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (item == null) {
                if (!accepting.get()) {
                    break;
                }
                continue;
            }
            if (item instanceof FlushMarker) {
                ((FlushMarker) item).reached.countDown();
                continue;
            }
            try {
                dispatch((LogRecord) item);
            } catch (Throwable t) {
                logger.error("Unexpected error in log pipeline '{}' consumer", name, t);
            }
        }
    }

    private void dispatch(LogRecord record) {
        for (LogSink sink : sinks) {
            try {
                sink.accept(record);
            } catch (Exception e) {
                sinkErrors.incrementAndGet();
                logger.warn("Error delivering record to sink {} of log pipeline '{}': {}",
                    sink, name, e.getMessage(), e);
            }
        }
        delivered.incrementAndGet();
    }

    private void checkNotStopped() {
        if (stopped.get()) {
            throw new IllegalStateException("LogPipeline '" + name + "' has been stopped");
        }
    }

    private static final class FlushMarker {
        final CountDownLatch reached = new CountDownLatch(1);
    }
}
