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

package io.nosqlbench.taskpool.errors;

/**
 * Signals that a task ended because its cancellation was requested.
 *
 * <p>Work functions throw this (usually through
 * {@code TaskContext.throwIfCancellationRequested()}) to exit early once they observe the
 * cancellation flag. Callers waiting on a cancelled handle receive it from {@code await}.
 */
public class TaskCancelledException extends TaskPoolException {

    private final String taskId;

    public TaskCancelledException(String taskId) {
        super(ErrorCode.TASK_CANCELLED, "task " + taskId + " was cancelled");
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
