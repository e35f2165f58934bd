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

package io.nosqlbench.taskpool.compat;

import io.nosqlbench.taskpool.TaskHandle;
import io.nosqlbench.taskpool.TaskPool;
import io.nosqlbench.taskpool.TaskWork;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Adapter for callers written against the older fire-and-forget thread manager.
 *
 * <p>Keeps no bookkeeping of its own: every call forwards to the wrapped {@link TaskPool},
 * so tasks started here show up in the pool's counters, history and registry like any
 * other submission.
 */
public final class LegacyThreadManager implements AutoCloseable {

    private final TaskPool pool;

    public LegacyThreadManager(TaskPool pool) {
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    /**
     * Runs {@code callable} on a pool worker.
     *
     * @throws io.nosqlbench.taskpool.errors.SubmissionRejectedException after {@link #cleanup()}
     */
    public <T> TaskHandle<T> runInThread(Callable<T> callable) {
        return pool.submit(TaskWork.of(callable));
    }

    public <T> TaskHandle<T> runInThread(String taskName, Callable<T> callable) {
        return pool.submit(taskName, TaskWork.of(callable));
    }

    public boolean cancel(String taskId) {
        return pool.cancel(taskId);
    }

    public void cleanup() {
        pool.shutdown();
    }

    public TaskPool getPool() {
        return pool;
    }

    @Override
    public void close() {
        cleanup();
    }
}
