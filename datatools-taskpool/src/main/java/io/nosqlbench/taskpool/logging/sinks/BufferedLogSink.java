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

package io.nosqlbench.taskpool.logging.sinks;

import io.nosqlbench.taskpool.logging.LogRecord;
import io.nosqlbench.taskpool.logging.LogSink;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Keeps the most recent records in memory for display in a UI widget.
 *
 * <p>The buffer holds at most {@code capacity} entries; older ones are evicted first.
 * A widget either polls {@link #snapshot()} or registers a listener, which is invoked on
 * the pipeline consumer thread and must hand the record over to its own UI thread.
 *
 * <p>Every access to the buffer holds the sink's monitor, so {@link #clear()} from a UI
 * thread cannot interleave with an eviction on the consumer thread. Listeners run outside it.
 */
public class BufferedLogSink implements LogSink {

    private final int capacity;
    // guarded by this
    private final Deque<LogRecord> entries = new ArrayDeque<>();
    private final CopyOnWriteArrayList<Consumer<LogRecord>> listeners = new CopyOnWriteArrayList<>();

    public BufferedLogSink() {
        this(1000);
    }

    public BufferedLogSink(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
    }

    public void addListener(Consumer<LogRecord> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(Consumer<LogRecord> listener) {
        listeners.remove(listener);
    }

    @Override
    public void accept(LogRecord record) {
        synchronized (this) {
            entries.addLast(record);
            if (entries.size() > capacity) {
                entries.pollFirst();
            }
        }
        for (Consumer<LogRecord> listener : listeners) {
            listener.accept(record);
        }
    }

    /**
     * Returns the buffered records, oldest first.
     */
    public synchronized List<LogRecord> snapshot() {
        return new ArrayList<>(entries);
    }

    /**
     * Returns the buffered records formatted for display, oldest first.
     */
    public List<String> formattedSnapshot() {
        List<String> lines = new ArrayList<>();
        for (LogRecord record : snapshot()) {
            lines.add(record.format());
        }
        return lines;
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public synchronized void clear() {
        entries.clear();
    }

    @Override
    public String toString() {
        return "BufferedLogSink[" + capacity + "]";
    }
}
