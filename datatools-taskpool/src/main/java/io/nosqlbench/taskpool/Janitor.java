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

import io.nosqlbench.taskpool.errors.ErrorCode;
import io.nosqlbench.taskpool.logging.LogPipeline;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic auditor of a {@link TaskPool}, running on its own daemon thread independent of
 * task traffic.
 *
 * <p>Each tick:
 * <ol>
 *   <li>sweeps the cancellation registry, reporting every stale entry it drops as a
 *       registry inconsistency</li>
 *   <li>reports running tasks that have passed their advisory timeout, once per task</li>
 *   <li>emits the current {@link PoolInfo} at DEBUG</li>
 * </ol>
 *
 * <p>The janitor never cancels or otherwise changes a task. A tick with nothing to clean
 * only emits the pool snapshot.
 *
 * <p>This class is package-private and created only by {@link TaskPool}.
 */
final class Janitor implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(Janitor.class);
    private static final long MIN_INTERVAL_MILLIS = 10;

    private final TaskPool pool;
    private final LogPipeline pipeline;
    private final String source;
    private final long intervalMillis;
    private final AtomicBoolean running = new AtomicBoolean(true);
    // only touched by runOnce, which is confined to one thread at a time
    private final Set<String> reportedOverdue = new HashSet<>();
    private final Thread janitorThread;

    Janitor(TaskPool pool, Duration interval) {
        this.pool = pool;
        this.pipeline = pool.getLogPipeline();
        this.source = pool.getName() + "-janitor";
        this.intervalMillis = Math.max(interval.toMillis(), MIN_INTERVAL_MILLIS);
        this.janitorThread = new Thread(this::runLoop, source);
        this.janitorThread.setDaemon(true);
        this.janitorThread.start();
    }

    private void runLoop() {
        while (running.get()) {
            try {
                TimeUnit.MILLISECONDS.sleep(intervalMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (!running.get()) {
                break;
            }
            runOnce();
        }
    }

    /**
     * Performs one audit pass. Faults are logged and never escape, so the loop survives them.
     */
    synchronized void runOnce() {
        try {
            for (CancellationRegistry.Anomaly anomaly : pool.sweepRegistry()) {
                pipeline.log(Level.WARN, source, "[" + ErrorCode.REGISTRY_INCONSISTENCY.code()
                    + "] Dropped stale registry entry " + anomaly.getTaskId() + ": " + anomaly.getReason());
            }

            Instant now = Instant.now();
            List<TaskHandle<?>> overdue = pool.overdueTasks(now);
            Set<String> overdueIds = new HashSet<>();
            for (TaskHandle<?> handle : overdue) {
                overdueIds.add(handle.getId());
                if (reportedOverdue.add(handle.getId())) {
                    pipeline.log(Level.WARN, source, "Task " + handle.getId() + " (" + handle.getName()
                        + ") has been running for " + handle.runDuration().getSeconds()
                        + "s, past its advisory timeout of " + handle.getTimeoutSeconds() + "s");
                }
            }
            // Overdue tasks stay overdue until they finish, so this forgets only finished ones.
            reportedOverdue.retainAll(overdueIds);

            pipeline.log(Level.DEBUG, source, pool.poolInfo().toString());
        } catch (Throwable t) {
            logger.warn("Error during janitor pass of pool '{}': {}", pool.getName(), t.getMessage(), t);
        }
    }

    boolean isRunning() {
        return running.get() && janitorThread.isAlive();
    }

    /**
     * Stops the janitor thread. Idempotent.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            janitorThread.interrupt();
            try {
                janitorThread.join(500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
