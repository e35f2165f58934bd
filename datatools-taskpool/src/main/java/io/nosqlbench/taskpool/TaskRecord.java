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

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * What the pool remembers about a finished task once its handle is gone.
 */
public final class TaskRecord {

    private final String id;
    private final String name;
    private final TaskState state;
    private final Instant submittedAt;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final Duration runDuration;
    private final String errorMessage;

    private TaskRecord(String id, String name, TaskState state, Instant submittedAt, Instant startedAt,
                       Instant finishedAt, Duration runDuration, String errorMessage) {
        this.id = id;
        this.name = name;
        this.state = state;
        this.submittedAt = submittedAt;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.runDuration = runDuration;
        this.errorMessage = errorMessage;
    }

    static TaskRecord of(TaskHandle<?> handle, Throwable error) {
        String message = null;
        if (error != null) {
            message = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
        }
        return new TaskRecord(handle.getId(), handle.getName(), handle.getState(), handle.getSubmittedAt(),
            handle.getStartedAt().orElse(null), handle.getFinishedAt().orElse(null), handle.runDuration(), message);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public TaskState getState() {
        return state;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    /**
     * Empty for tasks cancelled before they started.
     */
    public Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Instant> getFinishedAt() {
        return Optional.ofNullable(finishedAt);
    }

    public Duration getRunDuration() {
        return runDuration;
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    @Override
    public String toString() {
        return "TaskRecord[" + id + " '" + name + "' " + state + " " + runDuration.toMillis() + "ms"
            + (errorMessage != null ? " error=" + errorMessage : "") + "]";
    }
}
