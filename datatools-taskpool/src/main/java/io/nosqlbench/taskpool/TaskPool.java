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

package io.nosqlbench.taskpool;

import io.nosqlbench.taskpool.errors.SubmissionRejectedException;
import io.nosqlbench.taskpool.errors.TaskCancelledException;
import io.nosqlbench.taskpool.logging.LogPipeline;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded worker pool that runs {@link TaskWork} submitted from a controlling thread,
 * tracks each submission through a {@link TaskHandle}, and reports task traffic through
 * its own {@link LogPipeline}.
 *
 * <p>Key Responsibilities:
 * <ul>
 *   <li><strong>Submission:</strong> {@link #submit} never blocks. At most
 *       {@code max_workers} tasks run at once; the rest wait in FIFO order</li>
 *   <li><strong>Cancellation:</strong> {@link #cancel(String)} cancels pending tasks outright
 *       and flags running ones. Running work is never interrupted; it exits early only if
 *       it polls {@link TaskContext#isCancellationRequested()}</li>
 *   <li><strong>Bookkeeping:</strong> a {@link CancellationRegistry} holds every pending and
 *       running task, and the finishing path removes each entry synchronously. A
 *       {@link Janitor} audits the registry on a fixed schedule</li>
 *   <li><strong>Reporting:</strong> {@link #poolInfo()}, {@link #health()},
 *       {@link #statistics()} and {@link #recentTasks()} return immutable snapshots</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> every method may be called from any thread. The
 * registry, the counters and the history are guarded by one lock, so a snapshot never mixes
 * values from before and after a transition. Handle callbacks run after that lock is released.
 *
 * <p>Usage:
 * <pre>{@code
 * try (TaskPool pool = new TaskPool("import", TaskPoolConfig.builder().withMaxWorkers(2).build())) {
 *     pool.getLogPipeline().registerSink(new ConsoleLogSink());
 *     TaskHandle<Long> handle = pool.submit("count rows", ctx -> countRows(ctx))
 *         .onCompleted(rows -> System.out.println(rows + " rows"));
 *     pool.waitForCompletion(Duration.ofMinutes(1));
 * }
 * }</pre>
 */
public final class TaskPool implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(TaskPool.class);
    static final String TASK_ID_PREFIX = "task_";

    private final String name;
    private final TaskPoolConfig config;
    private final LogPipeline pipeline;
    private final ThreadPoolExecutor workers;
    private final SubmissionTraceLimiter traceLimiter;
    private final Janitor janitor;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition idle = lock.newCondition();
    private final CancellationRegistry registry = new CancellationRegistry();
    private final ArrayDeque<TaskRecord> history = new ArrayDeque<>();
    private final AtomicBoolean shutdownStarted = new AtomicBoolean(false);

    // guarded by lock
    private boolean shutdown;
    private long submissionCounter;
    private int activeCount;
    private long completedTotal;
    private long failedTotal;
    private long cancelledTotal;
    private long totalRunNanos;
    private long maxRunNanos;
    private long timedRuns;

    public TaskPool(String name) {
        this(name, TaskPoolConfig.defaults());
    }

    /**
     * Creates the pool, its log pipeline and its janitor. Workers are started lazily as
     * tasks arrive.
     */
    public TaskPool(String name, TaskPoolConfig config) {
        this.name = Objects.requireNonNull(name, "name");
        this.config = Objects.requireNonNull(config, "config");
        this.pipeline = new LogPipeline(name, config.getLogQueueCapacity(), config.getLogStopGrace());
        this.traceLimiter = new SubmissionTraceLimiter(config.getTraceThrottleThreshold(), config.getTraceThrottleEvery());
        this.workers = new ThreadPoolExecutor(
            config.getMaxWorkers(), config.getMaxWorkers(),
            0L, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(),
            new WorkerThreadFactory(name));
        this.janitor = new Janitor(this, config.getJanitorInterval());
        logger.debug("Started task pool '{}' with {}", name, config);
    }

    /**
     * Submits work under its class name with the default advisory timeout.
     *
     * @see #submit(String, TaskWork, int)
     */
    public <T> TaskHandle<T> submit(TaskWork<T> work) {
        Objects.requireNonNull(work, "work");
        return submit(defaultName(work), work, config.getDefaultTaskTimeoutSeconds());
    }

    public <T> TaskHandle<T> submit(String taskName, TaskWork<T> work) {
        return submit(taskName, work, config.getDefaultTaskTimeoutSeconds());
    }

    /**
     * Registers a new pending task and queues it for a worker. Never blocks.
     *
     * @param taskName display name used in diagnostics and history
     * @param work the work function
     * @param timeoutSeconds advisory timeout, reported by the janitor when exceeded but never enforced
     * @return the handle of the new task, whose id is unique within this pool
     * @throws SubmissionRejectedException if the pool has been shut down
     */
    public <T> TaskHandle<T> submit(String taskName, TaskWork<T> work, int timeoutSeconds) {
        Objects.requireNonNull(taskName, "taskName");
        Objects.requireNonNull(work, "work");
        if (timeoutSeconds < 1) {
            throw new IllegalArgumentException("timeoutSeconds must be at least 1, got " + timeoutSeconds);
        }

        TaskHandle<T> handle;
        long number;
        int active;
        lock.lock();
        try {
            if (shutdown) {
                throw new SubmissionRejectedException(name);
            }
            number = ++submissionCounter;
            handle = new TaskHandle<>(TASK_ID_PREFIX + number, taskName, timeoutSeconds);
            registry.register(handle);
            active = activeCount;
        } finally {
            lock.unlock();
        }

        TaskRunner<T> runner = new TaskRunner<>(handle, work);
        handle.setDispatchToken(runner);
        try {
            workers.execute(runner);
        } catch (RejectedExecutionException e) {
            // Lost a race with shutdown; the task never runs.
            cancelPending(handle, "rejected by a stopping pool");
            return handle;
        }

        if (traceLimiter.shouldTrace(number, active)) {
            pipeline.log(Level.DEBUG, name, "Submitted task " + handle.getId() + " (" + taskName + "), "
                + active + " running");
        }
        return handle;
    }

    /**
     * Cancels a task by id.
     *
     * <p>A pending task moves straight to {@link TaskState#CANCELLED} and never runs. A
     * running task gets its cancellation flag set; whether and when it stops is up to the
     * work function.
     *
     * @return true if the task was pending or running, false if the id is unknown or the
     *     task already finished
     */
    public boolean cancel(String taskId) {
        if (taskId == null) {
            return false;
        }
        TaskHandle<?> cancelledPending = null;
        lock.lock();
        try {
            Optional<TaskHandle<?>> found = registry.lookup(taskId);
            if (found.isEmpty()) {
                return false;
            }
            TaskHandle<?> handle = found.get();
            if (handle.tryFinish(TaskState.PENDING, TaskState.CANCELLED, null, null)) {
                recordFinished(handle, null);
                cancelledPending = handle;
            } else if (handle.getState() == TaskState.RUNNING) {
                if (handle.requestCancel()) {
                    pipeline.log(Level.INFO, name, "Cancellation requested for running task " + taskId);
                }
                return true;
            } else {
                return false;
            }
        } finally {
            lock.unlock();
        }

        workers.remove(cancelledPending.getDispatchToken());
        pipeline.log(Level.INFO, name, "Cancelled pending task " + taskId + " (" + cancelledPending.getName() + ")");
        cancelledPending.publish();
        return true;
    }

    /**
     * Blocks until every pending and running task has finished, or the timeout elapses.
     *
     * @return true if no tasks remain
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean waitForCompletion(Duration timeout) throws InterruptedException {
        long nanos = TimeUnit.NANOSECONDS.convert(timeout);
        lock.lock();
        try {
            while (registry.size() > 0) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = idle.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the pool. Idempotent.
     *
     * <p>Rejects further submissions, cancels every pending task, flags every running task,
     * then waits up to {@code shutdown_grace_ms} for running tasks to exit. Workers are never
     * interrupted; tasks still running after the grace period are reported and left to
     * finish on their daemon threads. Finally stops the janitor and the log pipeline.
     */
    public void shutdown() {
        if (!shutdownStarted.compareAndSet(false, true)) {
            return;
        }
        List<TaskHandle<?>> tracked;
        lock.lock();
        try {
            shutdown = true;
            tracked = registry.liveHandles();
        } finally {
            lock.unlock();
        }

        pipeline.log(Level.INFO, name, "Shutting down, " + tracked.size() + " tasks still tracked");
        for (TaskHandle<?> handle : tracked) {
            cancel(handle.getId());
        }

        try {
            if (!waitForCompletion(config.getShutdownGrace())) {
                List<String> stragglers = new ArrayList<>();
                lock.lock();
                try {
                    for (TaskHandle<?> handle : registry.liveHandles()) {
                        stragglers.add(handle.getId());
                    }
                } finally {
                    lock.unlock();
                }
                logger.warn("Task pool '{}' shut down with {} tasks still running after {}ms: {}",
                    name, stragglers.size(), config.getShutdownGrace().toMillis(), stragglers);
                pipeline.log(Level.WARN, name, "Tasks still running at shutdown: " + stragglers);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for tasks of pool '{}' to finish", name);
        }

        workers.getQueue().clear();
        workers.shutdown();
        janitor.close();

        TaskStatistics stats = statistics();
        pipeline.log(Level.INFO, name, "Shutdown complete: " + stats);
        lock.lock();
        try {
            history.clear();
        } finally {
            lock.unlock();
        }
        pipeline.stop();
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isShutdown() {
        lock.lock();
        try {
            return shutdown;
        } finally {
            lock.unlock();
        }
    }

    public PoolInfo poolInfo() {
        lock.lock();
        try {
            int tracked = registry.size();
            return new PoolInfo(activeCount, config.getMaxWorkers(), Math.max(0, tracked - activeCount), tracked,
                submissionCounter, completedTotal, failedTotal, cancelledTotal);
        } finally {
            lock.unlock();
        }
    }

    public PoolHealth health() {
        Instant now = Instant.now();
        lock.lock();
        try {
            List<String> longRunning = new ArrayList<>();
            for (TaskHandle<?> handle : registry.liveHandles()) {
                if (handle.isOverdue(now)) {
                    longRunning.add(handle.getId());
                }
            }
            int queued = Math.max(0, registry.size() - activeCount);
            return PoolHealth.assess(activeCount, config.getMaxWorkers(), queued, config.getHealthBusyPercent(), longRunning);
        } finally {
            lock.unlock();
        }
    }

    public TaskStatistics statistics() {
        lock.lock();
        try {
            return new TaskStatistics(submissionCounter, completedTotal, failedTotal, cancelledTotal,
                totalRunNanos, maxRunNanos, timedRuns);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return records of the most recently finished tasks, oldest first
     */
    public List<TaskRecord> recentTasks() {
        lock.lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public TaskPoolConfig getConfig() {
        return config;
    }

    public LogPipeline getLogPipeline() {
        return pipeline;
    }

    /**
     * Removes stale registry entries. Called by the janitor.
     */
    List<CancellationRegistry.Anomaly> sweepRegistry() {
        lock.lock();
        try {
            List<CancellationRegistry.Anomaly> anomalies = registry.sweep();
            if (registry.size() == 0) {
                idle.signalAll();
            }
            return anomalies;
        } finally {
            lock.unlock();
        }
    }

    List<TaskHandle<?>> overdueTasks(Instant now) {
        lock.lock();
        try {
            List<TaskHandle<?>> overdue = new ArrayList<>();
            for (TaskHandle<?> handle : registry.liveHandles()) {
                if (handle.isOverdue(now)) {
                    overdue.add(handle);
                }
            }
            return overdue;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registers a handle without dispatching it, leaving an entry that only the janitor's
     * sweep will remove. This is the single test seam into the registry; tests observe
     * the result through {@link #poolInfo()}.
     */
    void registerForTest(TaskHandle<?> handle) {
        lock.lock();
        try {
            registry.register(handle);
        } finally {
            lock.unlock();
        }
    }

    private void cancelPending(TaskHandle<?> handle, String reason) {
        boolean cancelled;
        lock.lock();
        try {
            cancelled = handle.tryFinish(TaskState.PENDING, TaskState.CANCELLED, null, null);
            if (cancelled) {
                recordFinished(handle, null);
            }
        } finally {
            lock.unlock();
        }
        if (cancelled) {
            pipeline.log(Level.INFO, name, "Cancelled pending task " + handle.getId() + ": " + reason);
            handle.publish();
        }
    }

    /**
     * Registry removal, counters and history for a task that just reached a terminal state.
     * Caller holds the lock.
     */
    private void recordFinished(TaskHandle<?> handle, Throwable error) {
        registry.remove(handle.getId(), handle);
        switch (handle.getState()) {
            case COMPLETED:
                completedTotal++;
                break;
            case FAILED:
                failedTotal++;
                break;
            case CANCELLED:
                cancelledTotal++;
                break;
            default:
                throw new IllegalStateException("Task " + handle.getId() + " is not finished: " + handle.getState());
        }
        if (handle.getStartedAt().isPresent()) {
            long runNanos = handle.runDuration().toNanos();
            totalRunNanos += runNanos;
            maxRunNanos = Math.max(maxRunNanos, runNanos);
            timedRuns++;
        }
        if (config.getHistorySize() > 0) {
            if (history.size() >= config.getHistorySize()) {
                history.removeFirst();
            }
            history.addLast(TaskRecord.of(handle, error));
        }
        if (registry.size() == 0) {
            idle.signalAll();
        }
    }

    private static String defaultName(TaskWork<?> work) {
        Class<?> type = work.getClass();
        String simpleName = type.getSimpleName();
        if (type.isSynthetic() || simpleName.isEmpty() || simpleName.contains("$$Lambda")) {
            return "anonymous";
        }
        return simpleName;
    }

    /**
     * The queued unit handed to the worker executor; also the token used to pull a cancelled
     * pending task back out of the queue.
     */
    private final class TaskRunner<T> implements Runnable {
        private final TaskHandle<T> handle;
        private final TaskWork<T> work;

        TaskRunner(TaskHandle<T> handle, TaskWork<T> work) {
            this.handle = handle;
            this.work = work;
        }

        @Override
        public void run() {
            lock.lock();
            try {
                if (!handle.tryStart()) {
                    return;
                }
                activeCount++;
            } finally {
                lock.unlock();
            }

            TaskState terminal;
            T value = null;
            Throwable failure = null;
            try {
                value = work.run(new TaskContext(handle, pipeline, name));
                terminal = TaskState.COMPLETED;
            } catch (TaskCancelledException | CancellationException e) {
                if (handle.isCancelRequested()) {
                    terminal = TaskState.CANCELLED;
                } else {
                    terminal = TaskState.FAILED;
                    failure = e;
                }
            } catch (Throwable t) {
                terminal = TaskState.FAILED;
                failure = t;
            }
            finish(terminal, value, failure);
        }

        private void finish(TaskState terminal, T value, Throwable failure) {
            lock.lock();
            try {
                handle.tryFinish(TaskState.RUNNING, terminal, value, failure);
                activeCount--;
                recordFinished(handle, failure);
            } finally {
                lock.unlock();
            }

            String label = handle.getId() + " (" + handle.getName() + ")";
            switch (terminal) {
                case COMPLETED:
                    pipeline.log(Level.DEBUG, name, "Task " + label + " completed in " + handle.runDuration().toMillis() + "ms");
                    break;
                case FAILED:
                    pipeline.log(Level.WARN, name, "Task " + label + " failed: " + describe(failure));
                    break;
                default:
                    pipeline.log(Level.INFO, name, "Task " + label + " cancelled while running");
                    break;
            }
            handle.publish();
        }

        private String describe(Throwable failure) {
            String message = failure.getMessage();
            return failure.getClass().getSimpleName() + (message != null ? ": " + message : "");
        }

        @Override
        public String toString() {
            return "TaskRunner[" + handle.getId() + "]";
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger sequence = new AtomicInteger();

        WorkerThreadFactory(String poolName) {
            this.prefix = poolName + "-worker-";
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
