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

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * A unit of work run by a {@link TaskPool} worker.
 *
 * <p>Arguments are captured by the implementation (usually a lambda), so the pool never
 * has to guess which submitted value is an argument and which is an option.
 *
 * <p>Cancellation is cooperative. Long-running work should check
 * {@link TaskContext#isCancellationRequested()} at safe points, or call
 * {@link TaskContext#throwIfCancellationRequested()}, and exit early. Work that never
 * checks simply runs to completion.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface TaskWork<T> {

    /**
     * Performs the work.
     *
     * @param context this task's identity, cancellation flag and logging hooks
     * @return the task result, may be null
     * @throws Exception any failure; it is captured on the task handle
     */
    T run(TaskContext context) throws Exception;

    /**
     * Adapts a {@link Callable} that does not need the task context.
     */
    static <T> TaskWork<T> of(Callable<T> callable) {
        Objects.requireNonNull(callable, "callable");
        return context -> callable.call();
    }

    /**
     * Adapts a {@link Runnable}; the task result is null.
     */
    static TaskWork<Void> of(Runnable runnable) {
        Objects.requireNonNull(runnable, "runnable");
        return context -> {
            runnable.run();
            return null;
        };
    }
}
