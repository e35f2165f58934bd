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
import io.nosqlbench.taskpool.logging.LogPipeline;
import org.apache.logging.log4j.Level;

/**
 * The view a running work function has of its own task.
 *
 * <p>Created by the pool for each execution and passed to {@link TaskWork#run}. Log calls
 * go through the pool's {@link LogPipeline}, so they never block on sink I/O.
 */
public final class TaskContext {

    private final TaskHandle<?> handle;
    private final LogPipeline pipeline;
    private final String source;

    TaskContext(TaskHandle<?> handle, LogPipeline pipeline, String source) {
        this.handle = handle;
        this.pipeline = pipeline;
        this.source = source;
    }

    public String taskId() {
        return handle.getId();
    }

    public String taskName() {
        return handle.getName();
    }

    /**
     * @return true once {@code TaskPool.cancel} has been called for this task
     */
    public boolean isCancellationRequested() {
        return handle.isCancelRequested();
    }

    /**
     * Exits the work function with a {@link TaskCancelledException} if cancellation has
     * been requested. The task then ends in {@link TaskState#CANCELLED}.
     */
    public void throwIfCancellationRequested() {
        if (handle.isCancelRequested()) {
            throw new TaskCancelledException(handle.getId());
        }
    }

    /**
     * Publishes a progress message for this task at INFO level.
     */
    public void reportProgress(String message) {
        pipeline.log(Level.INFO, source, "Task " + handle.getId() + " (" + handle.getName() + ") progress: " + message);
    }

    public void log(Level level, String message) {
        pipeline.log(level, source, "Task " + handle.getId() + ": " + message);
    }
}
