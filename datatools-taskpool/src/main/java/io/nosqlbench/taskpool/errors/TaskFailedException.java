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
 * Wraps the throwable raised by a task's work function. Stored on the task handle and
 * rethrown from {@code TaskHandle.await}; it never propagates into the pool itself.
 */
public class TaskFailedException extends TaskPoolException {

    private final String taskId;

    public TaskFailedException(String taskId, Throwable cause) {
        super(ErrorCode.TASK_FAILED, "task " + taskId + " failed: " + describe(cause), cause);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        String message = cause.getMessage();
        return message == null ? cause.getClass().getSimpleName() : cause.getClass().getSimpleName() + ": " + message;
    }
}
