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

import java.time.Duration;

/**
 * Performance counters of a {@link TaskPool}: totals by outcome and run times of finished
 * tasks. Instances are immutable snapshots; call {@link TaskPool#statistics()} again for
 * fresh values.
 */
public final class TaskStatistics {

    private final long submitted;
    private final long completed;
    private final long failed;
    private final long cancelled;
    private final long totalRunNanos;
    private final long maxRunNanos;
    private final long timedRuns;

    TaskStatistics(long submitted, long completed, long failed, long cancelled,
                   long totalRunNanos, long maxRunNanos, long timedRuns) {
        this.submitted = submitted;
        this.completed = completed;
        this.failed = failed;
        this.cancelled = cancelled;
        this.totalRunNanos = totalRunNanos;
        this.maxRunNanos = maxRunNanos;
        this.timedRuns = timedRuns;
    }

    /**
     * Returns the total number of tasks submitted to the pool.
     *
     * @return total submitted task count
     */
    public long getSubmitted() {
        return submitted;
    }

    /**
     * Returns the number of tasks that completed successfully.
     *
     * @return completed task count
     */
    public long getCompleted() {
        return completed;
    }

    /**
     * Returns the number of tasks whose work function threw.
     *
     * @return failed task count
     */
    public long getFailed() {
        return failed;
    }

    /**
     * Returns the number of tasks that were cancelled, before or during execution.
     *
     * @return cancelled task count
     */
    public long getCancelled() {
        return cancelled;
    }

    /**
     * Returns the number of tasks that have been submitted but not yet completed, failed, or cancelled.
     * This is calculated as: submitted - (completed + failed + cancelled).
     *
     * @return pending task count
     */
    public long getPending() {
        return submitted - completed - failed - cancelled;
    }

    /**
     * Mean run time of tasks that actually started and finished.
     */
    public Duration getAverageRunTime() {
        return timedRuns == 0 ? Duration.ZERO : Duration.ofNanos(totalRunNanos / timedRuns);
    }

    public Duration getMaxRunTime() {
        return Duration.ofNanos(maxRunNanos);
    }

    /**
     * Returns the completion rate as a fraction between 0.0 and 1.0.
     * Returns 0.0 if no tasks have been submitted.
     *
     * @return completion rate (0.0 to 1.0)
     */
    public double getCompletionRate() {
        return submitted > 0 ? (double) completed / submitted : 0.0;
    }

    /**
     * Returns the failure rate as a fraction between 0.0 and 1.0.
     * Returns 0.0 if no tasks have been submitted.
     *
     * @return failure rate (0.0 to 1.0)
     */
    public double getFailureRate() {
        return submitted > 0 ? (double) failed / submitted : 0.0;
    }

    /**
     * Returns true if all submitted tasks have finished (successfully, failed, or cancelled).
     *
     * @return true if no tasks are pending
     */
    public boolean isComplete() {
        return getPending() == 0;
    }

    @Override
    public String toString() {
        return String.format(
            "TaskStatistics[submitted=%d, completed=%d, failed=%d, cancelled=%d, pending=%d, completion=%.1f%%, avgRun=%dms, maxRun=%dms]",
            submitted, completed, failed, cancelled, getPending(), getCompletionRate() * 100,
            getAverageRunTime().toMillis(), getMaxRunTime().toMillis()
        );
    }
}
