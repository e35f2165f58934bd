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

package io.nosqlbench.taskpool.compat;

import io.nosqlbench.taskpool.TaskHandle;
import io.nosqlbench.taskpool.TaskPool;
import io.nosqlbench.taskpool.TaskPoolConfig;
import io.nosqlbench.taskpool.errors.SubmissionRejectedException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class LegacyThreadManagerTest {

    @Test
    void runInThreadSubmitsThroughThePool() throws Exception {
        TaskPool pool = new TaskPool("legacy", TaskPoolConfig.builder().withMaxWorkers(2).build());
        try (LegacyThreadManager manager = new LegacyThreadManager(pool)) {
            TaskHandle<String> handle = manager.runInThread(() -> "hardware ok");
            TaskHandle<Integer> named = manager.runInThread("verify", () -> 7);

            assertEquals("hardware ok", handle.await(Duration.ofSeconds(2)));
            assertEquals(7, named.await(Duration.ofSeconds(2)));
            assertEquals("verify", named.getName());
            assertTrue(pool.waitForCompletion(Duration.ofSeconds(1)));
            assertEquals(2, pool.statistics().getSubmitted());
            assertEquals(2, pool.statistics().getCompleted());
            assertFalse(manager.cancel(handle.getId()));
        }
        assertTrue(pool.isShutdown());
    }

    @Test
    void cleanupShutsDownThePool() {
        TaskPool pool = new TaskPool("legacy-cleanup");
        LegacyThreadManager manager = new LegacyThreadManager(pool);
        manager.cleanup();
        manager.cleanup();
        assertSame(pool, manager.getPool());
        assertThrows(SubmissionRejectedException.class, () -> manager.runInThread(() -> "late"));
    }
}
