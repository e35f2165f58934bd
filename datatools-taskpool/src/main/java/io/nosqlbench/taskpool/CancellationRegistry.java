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

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Id-keyed lookup of in-flight tasks, used to cancel a task by id.
 *
 * <p>Entries hold {@link WeakReference}s, so the registry never keeps a handle alive on its
 * own. An entry exists exactly while its task is {@link TaskState#PENDING} or
 * {@link TaskState#RUNNING}: the finishing path removes it synchronously through
 * {@link #remove(String, TaskHandle)}, and {@link #sweep()} catches any entry that missed
 * that removal.
 *
 * <p>This class is not thread-safe. {@link TaskPool} calls it only while holding its own
 * lock, which is what keeps the registry and the pool counters consistent with each other.
 */
final class CancellationRegistry {

    private final Map<String, WeakReference<TaskHandle<?>>> entries = new LinkedHashMap<>();

    /**
     * @throws IllegalStateException if a live entry already uses the handle's id
     */
    void register(TaskHandle<?> handle) {
        Objects.requireNonNull(handle, "handle");
        WeakReference<TaskHandle<?>> existing = entries.get(handle.getId());
        if (existing != null && existing.get() != null) {
            throw new IllegalStateException("Task id already registered: " + handle.getId());
        }
        entries.put(handle.getId(), new WeakReference<>(handle));
    }

    /**
     * Removes the entry for {@code id} if it still refers to {@code handle}.
     *
     * @return true if this call removed it; false if it was already gone
     */
    boolean remove(String id, TaskHandle<?> handle) {
        WeakReference<TaskHandle<?>> ref = entries.get(id);
        if (ref == null || ref.get() != handle) {
            return false;
        }
        entries.remove(id);
        return true;
    }

    /**
     * @return the handle, or empty if the id is unknown, finished, or no longer reachable
     */
    Optional<TaskHandle<?>> lookup(String id) {
        WeakReference<TaskHandle<?>> ref = entries.get(id);
        return ref == null ? Optional.empty() : Optional.ofNullable(ref.get());
    }

    int size() {
        return entries.size();
    }

    /**
     * @return the reachable handles, in registration order
     */
    List<TaskHandle<?>> liveHandles() {
        List<TaskHandle<?>> handles = new ArrayList<>(entries.size());
        for (WeakReference<TaskHandle<?>> ref : entries.values()) {
            TaskHandle<?> handle = ref.get();
            if (handle != null) {
                handles.add(handle);
            }
        }
        return handles;
    }

    /**
     * Drops entries whose handle is no longer reachable or has already reached a terminal
     * state. Each such entry means a finished task skipped its own removal.
     *
     * @return one anomaly per dropped entry, empty when the registry was consistent
     */
    List<Anomaly> sweep() {
        List<Anomaly> anomalies = new ArrayList<>();
        Iterator<Map.Entry<String, WeakReference<TaskHandle<?>>>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, WeakReference<TaskHandle<?>>> entry = it.next();
            TaskHandle<?> handle = entry.getValue().get();
            if (handle == null) {
                it.remove();
                anomalies.add(new Anomaly(entry.getKey(), "handle is no longer reachable"));
            } else if (handle.isDone()) {
                it.remove();
                anomalies.add(new Anomaly(entry.getKey(), "handle already finished in state " + handle.getState()));
            }
        }
        return anomalies;
    }

    /**
     * A registry entry dropped by {@link #sweep()}.
     */
    static final class Anomaly {
        private final String taskId;
        private final String reason;

        Anomaly(String taskId, String reason) {
            this.taskId = taskId;
            this.reason = reason;
        }

        String getTaskId() {
            return taskId;
        }

        String getReason() {
            return reason;
        }

        @Override
        public String toString() {
            return taskId + ": " + reason;
        }
    }
}
