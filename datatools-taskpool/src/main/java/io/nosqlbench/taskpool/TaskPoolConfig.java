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

import io.nosqlbench.taskpool.errors.TaskPoolConfigException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Settings of a {@link TaskPool}, fixed for the pool's lifetime.
 *
 * <p>Build one in code:
 * <pre>{@code
 * TaskPoolConfig config = TaskPoolConfig.builder()
 *     .withMaxWorkers(8)
 *     .withDefaultTaskTimeout(120)
 *     .build();
 * }</pre>
 *
 * <p>or load it from YAML, using the same snake_case keys as the rest of the tooling:
 * <pre>
 * max_workers: 8
 * default_task_timeout: 120
 * janitor_interval_ms: 30000
 * </pre>
 *
 * <p>Keys left out keep their defaults; unknown keys are logged and ignored.
 */
public final class TaskPoolConfig {

    private static final Logger logger = LogManager.getLogger(TaskPoolConfig.class);

    static final String MAX_WORKERS = "max_workers";
    static final String DEFAULT_TASK_TIMEOUT = "default_task_timeout";
    static final String JANITOR_INTERVAL_MS = "janitor_interval_ms";
    static final String SHUTDOWN_GRACE_MS = "shutdown_grace_ms";
    static final String LOG_QUEUE_CAPACITY = "log_queue_capacity";
    static final String LOG_STOP_GRACE_MS = "log_stop_grace_ms";
    static final String HISTORY_SIZE = "history_size";
    static final String HEALTH_BUSY_PERCENT = "health_busy_percent";
    static final String TRACE_THROTTLE_THRESHOLD = "trace_throttle_threshold";
    static final String TRACE_THROTTLE_EVERY = "trace_throttle_every";

    private static final Set<String> KNOWN_KEYS = Set.of(
        MAX_WORKERS, DEFAULT_TASK_TIMEOUT, JANITOR_INTERVAL_MS, SHUTDOWN_GRACE_MS, LOG_QUEUE_CAPACITY,
        LOG_STOP_GRACE_MS, HISTORY_SIZE, HEALTH_BUSY_PERCENT, TRACE_THROTTLE_THRESHOLD, TRACE_THROTTLE_EVERY);

    private final int maxWorkers;
    private final int defaultTaskTimeoutSeconds;
    private final Duration janitorInterval;
    private final Duration shutdownGrace;
    private final int logQueueCapacity;
    private final Duration logStopGrace;
    private final int historySize;
    private final int healthBusyPercent;
    private final int traceThrottleThreshold;
    private final int traceThrottleEvery;

    private TaskPoolConfig(Builder builder) {
        this.maxWorkers = builder.maxWorkers;
        this.defaultTaskTimeoutSeconds = builder.defaultTaskTimeoutSeconds;
        this.janitorInterval = builder.janitorInterval;
        this.shutdownGrace = builder.shutdownGrace;
        this.logQueueCapacity = builder.logQueueCapacity;
        this.logStopGrace = builder.logStopGrace;
        this.historySize = builder.historySize;
        this.healthBusyPercent = builder.healthBusyPercent;
        this.traceThrottleThreshold = builder.traceThrottleThreshold;
        this.traceThrottleEvery = builder.traceThrottleEvery;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TaskPoolConfig defaults() {
        return builder().build();
    }

    /**
     * Reads a YAML mapping from a file.
     *
     * @throws TaskPoolConfigException if the file cannot be read or holds invalid values
     */
    public static TaskPoolConfig fromYaml(Path path) {
        Load yaml = new Load(LoadSettings.builder().build());
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromYamlObject(yaml.loadFromReader(reader), path.toString());
        } catch (IOException | YamlEngineException e) {
            throw new TaskPoolConfigException("Unable to read task pool config " + path + ": " + e.getMessage(), e);
        }
    }

    public static TaskPoolConfig fromYamlString(String yamlText) {
        Load yaml = new Load(LoadSettings.builder().build());
        try {
            return fromYamlObject(yaml.loadFromString(yamlText), "inline yaml");
        } catch (YamlEngineException e) {
            throw new TaskPoolConfigException("Unable to parse task pool config: " + e.getMessage(), e);
        }
    }

    private static TaskPoolConfig fromYamlObject(Object loaded, String origin) {
        if (loaded == null) {
            return defaults();
        }
        if (!(loaded instanceof Map<?, ?>)) {
            throw new TaskPoolConfigException("Task pool config in " + origin + " must be a mapping, got "
                + loaded.getClass().getSimpleName());
        }
        Map<String, Object> cfgmap = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) loaded).entrySet()) {
            cfgmap.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return fromMap(cfgmap);
    }

    /**
     * Builds a config from already-parsed key/value pairs.
     *
     * @throws TaskPoolConfigException for malformed or out-of-range values
     */
    public static TaskPoolConfig fromMap(Map<String, Object> cfgmap) {
        Objects.requireNonNull(cfgmap, "cfgmap");
        for (String key : cfgmap.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                logger.warn("Ignoring unknown task pool config key '{}'", key);
            }
        }
        Builder builder = builder();
        try {
            if (cfgmap.containsKey(MAX_WORKERS)) {
                builder.withMaxWorkers(intValue(cfgmap, MAX_WORKERS));
            }
            if (cfgmap.containsKey(DEFAULT_TASK_TIMEOUT)) {
                builder.withDefaultTaskTimeout(intValue(cfgmap, DEFAULT_TASK_TIMEOUT));
            }
            if (cfgmap.containsKey(JANITOR_INTERVAL_MS)) {
                builder.withJanitorInterval(Duration.ofMillis(longValue(cfgmap, JANITOR_INTERVAL_MS)));
            }
            if (cfgmap.containsKey(SHUTDOWN_GRACE_MS)) {
                builder.withShutdownGrace(Duration.ofMillis(longValue(cfgmap, SHUTDOWN_GRACE_MS)));
            }
            if (cfgmap.containsKey(LOG_QUEUE_CAPACITY)) {
                builder.withLogQueueCapacity(intValue(cfgmap, LOG_QUEUE_CAPACITY));
            }
            if (cfgmap.containsKey(LOG_STOP_GRACE_MS)) {
                builder.withLogStopGrace(Duration.ofMillis(longValue(cfgmap, LOG_STOP_GRACE_MS)));
            }
            if (cfgmap.containsKey(HISTORY_SIZE)) {
                builder.withHistorySize(intValue(cfgmap, HISTORY_SIZE));
            }
            if (cfgmap.containsKey(HEALTH_BUSY_PERCENT)) {
                builder.withHealthBusyPercent(intValue(cfgmap, HEALTH_BUSY_PERCENT));
            }
            if (cfgmap.containsKey(TRACE_THROTTLE_THRESHOLD)) {
                builder.withTraceThrottle(intValue(cfgmap, TRACE_THROTTLE_THRESHOLD),
                    cfgmap.containsKey(TRACE_THROTTLE_EVERY) ? intValue(cfgmap, TRACE_THROTTLE_EVERY) : builder.traceThrottleEvery);
            } else if (cfgmap.containsKey(TRACE_THROTTLE_EVERY)) {
                builder.withTraceThrottle(builder.traceThrottleThreshold, intValue(cfgmap, TRACE_THROTTLE_EVERY));
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new TaskPoolConfigException(e.getMessage(), e);
        }
    }

    private static long longValue(Map<String, Object> cfgmap, String key) {
        Object value = cfgmap.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("'" + key + "' must be a whole number, got '" + value + "'");
            }
        }
        throw new IllegalArgumentException("'" + key + "' must be a whole number, got " + value);
    }

    private static int intValue(Map<String, Object> cfgmap, String key) {
        long value = longValue(cfgmap, key);
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new IllegalArgumentException("'" + key + "' is out of range: " + value);
        }
        return (int) value;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public int getDefaultTaskTimeoutSeconds() {
        return defaultTaskTimeoutSeconds;
    }

    public Duration getJanitorInterval() {
        return janitorInterval;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    /**
     * @return the log queue bound, 0 for unbounded
     */
    public int getLogQueueCapacity() {
        return logQueueCapacity;
    }

    public Duration getLogStopGrace() {
        return logStopGrace;
    }

    public int getHistorySize() {
        return historySize;
    }

    public int getHealthBusyPercent() {
        return healthBusyPercent;
    }

    public int getTraceThrottleThreshold() {
        return traceThrottleThreshold;
    }

    public int getTraceThrottleEvery() {
        return traceThrottleEvery;
    }

    @Override
    public String toString() {
        return "TaskPoolConfig[maxWorkers=" + maxWorkers
            + ", defaultTaskTimeout=" + defaultTaskTimeoutSeconds + "s"
            + ", janitorInterval=" + janitorInterval.toMillis() + "ms"
            + ", shutdownGrace=" + shutdownGrace.toMillis() + "ms"
            + ", logQueueCapacity=" + logQueueCapacity
            + ", historySize=" + historySize + "]";
    }

    public static final class Builder {
        private int maxWorkers = 4;
        private int defaultTaskTimeoutSeconds = 300;
        private Duration janitorInterval = Duration.ofSeconds(30);
        private Duration shutdownGrace = Duration.ofSeconds(10);
        private int logQueueCapacity = 0;
        private Duration logStopGrace = Duration.ofSeconds(5);
        private int historySize = 100;
        private int healthBusyPercent = 75;
        private int traceThrottleThreshold = 20;
        private int traceThrottleEvery = 5;

        Builder() {
        }

        public Builder withMaxWorkers(int maxWorkers) {
            if (maxWorkers < 1) {
                throw new IllegalArgumentException("max_workers must be at least 1, got " + maxWorkers);
            }
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder withDefaultTaskTimeout(int seconds) {
            if (seconds < 1) {
                throw new IllegalArgumentException("default_task_timeout must be at least 1 second, got " + seconds);
            }
            this.defaultTaskTimeoutSeconds = seconds;
            return this;
        }

        public Builder withJanitorInterval(Duration interval) {
            this.janitorInterval = positive(interval, JANITOR_INTERVAL_MS);
            return this;
        }

        public Builder withShutdownGrace(Duration grace) {
            this.shutdownGrace = nonNegative(grace, SHUTDOWN_GRACE_MS);
            return this;
        }

        public Builder withLogQueueCapacity(int capacity) {
            if (capacity < 0) {
                throw new IllegalArgumentException("log_queue_capacity must be >= 0, got " + capacity);
            }
            this.logQueueCapacity = capacity;
            return this;
        }

        public Builder withLogStopGrace(Duration grace) {
            this.logStopGrace = nonNegative(grace, LOG_STOP_GRACE_MS);
            return this;
        }

        public Builder withHistorySize(int historySize) {
            if (historySize < 0) {
                throw new IllegalArgumentException("history_size must be >= 0, got " + historySize);
            }
            this.historySize = historySize;
            return this;
        }

        public Builder withHealthBusyPercent(int percent) {
            if (percent < 1 || percent > 100) {
                throw new IllegalArgumentException("health_busy_percent must be within 1..100, got " + percent);
            }
            this.healthBusyPercent = percent;
            return this;
        }

        /**
         * Above {@code threshold} running tasks, only every {@code every}-th submission is traced.
         */
        public Builder withTraceThrottle(int threshold, int every) {
            if (threshold < 0) {
                throw new IllegalArgumentException("trace_throttle_threshold must be >= 0, got " + threshold);
            }
            if (every < 1) {
                throw new IllegalArgumentException("trace_throttle_every must be at least 1, got " + every);
            }
            this.traceThrottleThreshold = threshold;
            this.traceThrottleEvery = every;
            return this;
        }

        public TaskPoolConfig build() {
            return new TaskPoolConfig(this);
        }

        private static Duration positive(Duration value, String key) {
            Objects.requireNonNull(value, key);
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(key + " must be positive, got " + value.toMillis() + "ms");
            }
            return value;
        }

        private static Duration nonNegative(Duration value, String key) {
            Objects.requireNonNull(value, key);
            if (value.isNegative()) {
                throw new IllegalArgumentException(key + " must not be negative, got " + value.toMillis() + "ms");
            }
            return value;
        }
    }
}
