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
import io.nosqlbench.taskpool.errors.TaskPoolConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskPoolConfigTest {

    @Test
    void defaultsMatchDocumentedValues() {
        TaskPoolConfig config = TaskPoolConfig.defaults();
        assertEquals(4, config.getMaxWorkers());
        assertEquals(300, config.getDefaultTaskTimeoutSeconds());
        assertEquals(Duration.ofSeconds(30), config.getJanitorInterval());
        assertEquals(Duration.ofSeconds(10), config.getShutdownGrace());
        assertEquals(0, config.getLogQueueCapacity());
        assertEquals(Duration.ofSeconds(5), config.getLogStopGrace());
        assertEquals(100, config.getHistorySize());
        assertEquals(75, config.getHealthBusyPercent());
        assertEquals(20, config.getTraceThrottleThreshold());
        assertEquals(5, config.getTraceThrottleEvery());
    }

    @Test
    void loadsYamlString() {
        TaskPoolConfig config = TaskPoolConfig.fromYamlString(
            "max_workers: 8\n"
                + "default_task_timeout: 120\n"
                + "janitor_interval_ms: 500\n"
                + "log_queue_capacity: 2000\n"
                + "trace_throttle_every: 10\n");
        assertEquals(8, config.getMaxWorkers());
        assertEquals(120, config.getDefaultTaskTimeoutSeconds());
        assertEquals(Duration.ofMillis(500), config.getJanitorInterval());
        assertEquals(2000, config.getLogQueueCapacity());
        assertEquals(20, config.getTraceThrottleThreshold());
        assertEquals(10, config.getTraceThrottleEvery());
        assertEquals(100, config.getHistorySize());
    }

    @Test
    void loadsYamlFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("taskpool.yaml");
        Files.writeString(file, "max_workers: 2\nshutdown_grace_ms: 250\nhistory_size: 0\n", StandardCharsets.UTF_8);

        TaskPoolConfig config = TaskPoolConfig.fromYaml(file);
        assertEquals(2, config.getMaxWorkers());
        assertEquals(Duration.ofMillis(250), config.getShutdownGrace());
        assertEquals(0, config.getHistorySize());
    }

    @Test
    void emptyDocumentYieldsDefaults() {
        assertEquals(4, TaskPoolConfig.fromYamlString("").getMaxWorkers());
    }

    @Test
    void unknownKeysAreIgnored() {
        TaskPoolConfig config = TaskPoolConfig.fromMap(Map.of("max_workers", 3, "colour", "blue"));
        assertEquals(3, config.getMaxWorkers());
    }

    @Test
    void numericStringsAreAccepted() {
        assertEquals(6, TaskPoolConfig.fromMap(Map.of("max_workers", " 6 ")).getMaxWorkers());
    }

    @Test
    void invalidValuesRaiseConfigurationErrors() {
        TaskPoolConfigException zero = assertThrows(TaskPoolConfigException.class,
            () -> TaskPoolConfig.fromYamlString("max_workers: 0"));
        assertEquals(ErrorCode.CONFIGURATION, zero.getErrorCode());
        assertTrue(zero.getMessage().contains("max_workers"));

        assertThrows(TaskPoolConfigException.class, () -> TaskPoolConfig.fromYamlString("max_workers: lots"));
        assertThrows(TaskPoolConfigException.class, () -> TaskPoolConfig.fromYamlString("health_busy_percent: 120"));
        assertThrows(TaskPoolConfigException.class, () -> TaskPoolConfig.fromYamlString("- just\n- a list\n"));
        assertThrows(TaskPoolConfigException.class, () -> TaskPoolConfig.fromYamlString("max_workers: [unclosed"));
    }

    @Test
    void missingFileRaisesConfigurationError(@TempDir Path tempDir) {
        TaskPoolConfigException e = assertThrows(TaskPoolConfigException.class,
            () -> TaskPoolConfig.fromYaml(tempDir.resolve("absent.yaml")));
        assertNotNull(e.getCause());
    }

    @Test
    void builderValidatesArguments() {
        assertThrows(IllegalArgumentException.class, () -> TaskPoolConfig.builder().withMaxWorkers(0));
        assertThrows(IllegalArgumentException.class, () -> TaskPoolConfig.builder().withDefaultTaskTimeout(0));
        assertThrows(IllegalArgumentException.class, () -> TaskPoolConfig.builder().withJanitorInterval(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> TaskPoolConfig.builder().withShutdownGrace(Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class, () -> TaskPoolConfig.builder().withLogQueueCapacity(-1));
        assertThrows(IllegalArgumentException.class, () -> TaskPoolConfig.builder().withTraceThrottle(20, 0));
    }
}
