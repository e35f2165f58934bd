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

import io.nosqlbench.taskpool.errors.TaskCancelledException;
import io.nosqlbench.taskpool.errors.TaskFailedException;
import io.nosqlbench.taskpool.errors.TaskPoolException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Tracks one submitted unit of work through its lifecycle.
 *
 * <p>State changes are compare-and-set transitions along the edges allowed by
 * {@link TaskState#canTransitionTo(TaskState)}, so a handle moves forward exactly once into
 * a terminal state. The result or error is written once, together with that transition.
 *
 * <p>Callbacks ({@link #onCompleted}, {@link #onFailed}, {@link #onCancelled},
 * {@link #whenFinished}) fire exactly once. They run on the thread that finishes the task,
 * after the pool has released its lock and removed the task from its registry. A callback
 * registered after the task finished runs immediately on the registering thread.
 *
 * <p>The pool keeps only a weak reference to a handle. The strong reference lives with the
 * queued or executing work, and with whoever the handle was returned to.
 *
 * @param <T> the result type
 */
public final class TaskHandle<T> {

    private static final Logger logger = LogManager.getLogger(TaskHandle.class);

    private final String id;
    private final String name;
    private final int timeoutSeconds;
    private final Instant submittedAt;
    private final AtomicReference<TaskState> state = new AtomicReference<>(TaskState.PENDING);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final CompletableFuture<T> outcome = new CompletableFuture<>();
    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile T result;
    private volatile Throwable error;
    private volatile Runnable dispatchToken;

    TaskHandle(String id, String name, int timeoutSeconds) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.timeoutSeconds = timeoutSeconds;
        this.submittedAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public TaskState getState() {
        return state.get();
    }

    public boolean isDone() {
        return state.get().isTerminal();
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    /**
     * Advisory timeout. It is reported when exceeded but never enforced.
     */
    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Instant> getFinishedAt() {
        return Optional.ofNullable(finishedAt);
    }

    /**
     * Time spent running: up to now while running, up to the finish time once done, and
     * zero if the task never started.
     */
    public Duration runDuration() {
        Instant start = startedAt;
        if (start == null) {
            return Duration.ZERO;
        }
        Instant end = finishedAt;
        return Duration.between(start, end != null ? end : Instant.now());
    }

    /**
     * @return the result, present only once the task has been published as
     *     {@link TaskState#COMPLETED} with a non-null value
     */
    public Optional<T> getResult() {
        return outcome.isDone() && state.get() == TaskState.COMPLETED ? Optional.ofNullable(result) : Optional.empty();
    }

    /**
     * @return the throwable raised by the work function, present only when {@link TaskState#FAILED}
     */
    public Optional<Throwable> getError() {
        return outcome.isDone() && state.get() == TaskState.FAILED ? Optional.ofNullable(error) : Optional.empty();
    }

    /**
     * True while running past the advisory timeout.
     */
    public boolean isOverdue(Instant now) {
        Instant start = startedAt;
        return state.get() == TaskState.RUNNING
            && start != null
            && Duration.between(start, now).getSeconds() >= timeoutSeconds;
    }

    /**
     * Blocks until the task finishes.
     *
     * @return the task result
     * @throws TaskFailedException if the work function threw
     * @throws TaskCancelledException if the task was cancelled
     * @throws InterruptedException if interrupted while waiting
     */
    public T await() throws InterruptedException {
        try {
            return outcome.get();
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    /**
     * Blocks until the task finishes or the timeout elapses.
     *
     * @throws TimeoutException if the task is still unfinished after {@code timeout}
     */
    public T await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return outcome.get(TimeUnit.NANOSECONDS.convert(timeout), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    public TaskHandle<T> onCompleted(Consumer<? super T> callback) {
        Objects.requireNonNull(callback, "callback");
        outcome.whenComplete((value, failure) -> {
            if (failure == null) {
                runCallback("onCompleted", () -> callback.accept(value));
            }
        });
        return this;
    }

    /**
     * Registers a callback for {@link TaskState#FAILED}. It receives the throwable raised by
     * the work function, not a wrapper.
     */
    public TaskHandle<T> onFailed(Consumer<? super Throwable> callback) {
        Objects.requireNonNull(callback, "callback");
        outcome.whenComplete((value, failure) -> {
            if (failure instanceof TaskFailedException) {
                runCallback("onFailed", () -> callback.accept(failure.getCause()));
            }
        });
        return this;
    }

    public TaskHandle<T> onCancelled(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        outcome.whenComplete((value, failure) -> {
            if (failure instanceof TaskCancelledException) {
                runCallback("onCancelled", callback);
            }
        });
        return this;
    }

    /**
     * Registers a callback for any terminal state.
     */
    public TaskHandle<T> whenFinished(Consumer<? super TaskHandle<T>> callback) {
        Objects.requireNonNull(callback, "callback");
        outcome.whenComplete((value, failure) -> runCallback("whenFinished", () -> callback.accept(this)));
        return this;
    }

    boolean tryStart() {
        if (state.compareAndSet(TaskState.PENDING, TaskState.RUNNING)) {
            startedAt = Instant.now();
            return true;
        }
        return false;
    }

    /**
     * Moves the task from {@code expected} into a terminal state.
     *
     * @return false if the task was not in {@code expected}, which leaves it untouched
     */
    boolean tryFinish(TaskState expected, TaskState terminal, T value, Throwable failure) {
        if (!terminal.isTerminal() || !expected.canTransitionTo(terminal)) {
            throw new IllegalArgumentException("Illegal transition " + expected + " -> " + terminal);
        }
        if (!state.compareAndSet(expected, terminal)) {
            return false;
        }
        // Written before the future completes, so await() and callbacks see them.
        this.result = value;
        this.error = failure;
        this.finishedAt = Instant.now();
        return true;
    }

    /**
     * Sets the cancellation flag.
     *
     * @return true if this call set it, false if it was already set
     */
    boolean requestCancel() {
        return cancelRequested.compareAndSet(false, true);
    }

    /**
     * Completes the outcome future, releasing awaiting threads and firing callbacks.
     * Must be called once, after the terminal transition and outside any pool lock.
     */
    void publish() {
        switch (state.get()) {
            case COMPLETED:
                outcome.complete(result);
                break;
            case FAILED:
                outcome.completeExceptionally(new TaskFailedException(id, error));
                break;
            case CANCELLED:
                outcome.completeExceptionally(new TaskCancelledException(id));
                break;
            default:
                throw new IllegalStateException("Task " + id + " is not finished: " + state.get());
        }
    }

    void setDispatchToken(Runnable token) {
        this.dispatchToken = token;
    }

    Runnable getDispatchToken() {
        return dispatchToken;
    }

    private void runCallback(String kind, Runnable callback) {
        try {
            callback.run();
        } catch (Exception e) {
            logger.warn("{} callback of task {} threw: {}", kind, id, e.getMessage(), e);
        }
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof TaskPoolException) {
            return (TaskPoolException) cause;
        }
        return new IllegalStateException("Unexpected task outcome", cause);
    }

    @Override
    public String toString() {
        return "TaskHandle[" + id + " '" + name + "' " + state.get() + (cancelRequested.get() ? " cancel-requested" : "") + "]";
    }
}
