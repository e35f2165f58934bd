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

import java.util.Objects;

/**
 * A destination for {@link LogRecord}s delivered by a {@link LogPipeline}.
 *
 * <p>All calls happen on the pipeline's single consumer thread, in enqueue order, so an
 * implementation only needs to be thread-safe if it is also read from other threads
 * (a UI widget polling a buffer, for example). A sink may throw; the pipeline counts
 * and logs the failure and keeps delivering to the remaining sinks.
 *
 * <p>Sinks holding resources override {@link #close()}, which the pipeline calls once
 * after the last record has been delivered.
 */
@FunctionalInterface
public interface LogSink extends AutoCloseable {

    /**
     * Receives one record.
     *
     * @param record the record, never null
     */
    void accept(LogRecord record);

    @Override
    default void close() {
    }

    /**
     * Returns a view of this sink that drops records less specific than {@code minimum}.
     *
     * @param minimum the lowest level that still reaches this sink
     * @return a filtering sink delegating to this one
     */
    default LogSink atLevel(Level minimum) {
        Objects.requireNonNull(minimum, "minimum");
        LogSink delegate = this;
        return new LogSink() {
            @Override
            public void accept(LogRecord record) {
                if (record.getLevel().isMoreSpecificThan(minimum)) {
                    delegate.accept(record);
                }
            }

            @Override
            public void close() {
                delegate.close();
            }

            @Override
            public String toString() {
                return delegate + "@" + minimum;
            }
        };
    }
}
