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

/**
 * Immutable snapshot of a {@link TaskPool}'s counters, taken under the pool lock so the
 * values are consistent with each other.
 */
public final class PoolInfo {

    private final int activeCount;
    private final int maxWorkers;
    private final int queuedCount;
    private final int trackedCount;
    private final long submittedTotal;
    private final long completedTotal;
    private final long failedTotal;
    private final long cancelledTotal;

    PoolInfo(int activeCount, int maxWorkers, int queuedCount, int trackedCount,
             long submittedTotal, long completedTotal, long failedTotal, long cancelledTotal) {
        this.activeCount = activeCount;
        this.maxWorkers = maxWorkers;
        this.queuedCount = queuedCount;
        this.trackedCount = trackedCount;
        this.submittedTotal = submittedTotal;
        this.completedTotal = completedTotal;
        this.failedTotal = failedTotal;
        this.cancelledTotal = cancelledTotal;
    }

    /**
     * Tasks currently running on a worker.
     */
    public int getActiveCount() {
        return activeCount;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    /**
     * Tasks submitted but not yet started.
     */
    public int getQueuedCount() {
        return queuedCount;
    }

    /**
     * Entries in the cancellation registry, i.e. pending plus running tasks.
     */
    public int getTrackedCount() {
        return trackedCount;
    }

    public long getSubmittedTotal() {
        return submittedTotal;
    }

    public long getCompletedTotal() {
        return completedTotal;
    }

    public long getFailedTotal() {
        return failedTotal;
    }

    public long getCancelledTotal() {
        return cancelledTotal;
    }

    @Override
    public String toString() {
        return String.format(
            "PoolInfo[active=%d/%d, queued=%d, tracked=%d, submitted=%d, completed=%d, failed=%d, cancelled=%d]",
            activeCount, maxWorkers, queuedCount, trackedCount, submittedTotal, completedTotal, failedTotal, cancelledTotal);
    }
}
