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

import java.util.List;

/**
 * Load and health summary of a {@link TaskPool}, suitable for a status bar.
 */
public final class PoolHealth {

    public enum Status {
        /** Load below the busy threshold. */
        HEALTHY,
        /** Load at or above the busy threshold. */
        BUSY,
        /** Every worker is busy and further work is queued. */
        OVERLOADED
    }

    private final int activeThreads;
    private final int maxThreads;
    private final int queuedTasks;
    private final double loadPercentage;
    private final Status status;
    private final List<String> longRunningTasks;

    PoolHealth(int activeThreads, int maxThreads, int queuedTasks, double loadPercentage,
               Status status, List<String> longRunningTasks) {
        this.activeThreads = activeThreads;
        this.maxThreads = maxThreads;
        this.queuedTasks = queuedTasks;
        this.loadPercentage = loadPercentage;
        this.status = status;
        this.longRunningTasks = List.copyOf(longRunningTasks);
    }

    static PoolHealth assess(int active, int max, int queued, int busyPercent, List<String> overdue) {
        double load = max > 0 ? (active * 100.0) / max : 0.0;
        Status status;
        if (active >= max && queued > 0) {
            status = Status.OVERLOADED;
        } else if (load >= busyPercent) {
            status = Status.BUSY;
        } else {
            status = Status.HEALTHY;
        }
        return new PoolHealth(active, max, queued, load, status, overdue);
    }

    public int getActiveThreads() {
        return activeThreads;
    }

    public int getMaxThreads() {
        return maxThreads;
    }

    public int getQueuedTasks() {
        return queuedTasks;
    }

    public double getLoadPercentage() {
        return loadPercentage;
    }

    public Status getStatus() {
        return status;
    }

    /**
     * Ids of running tasks that have exceeded their advisory timeout.
     */
    public List<String> getLongRunningTasks() {
        return longRunningTasks;
    }

    @Override
    public String toString() {
        return String.format("PoolHealth[%s, load=%.1f%% (%d/%d), queued=%d, longRunning=%s]",
            status, loadPercentage, activeThreads, maxThreads, queuedTasks, longRunningTasks);
    }
}
