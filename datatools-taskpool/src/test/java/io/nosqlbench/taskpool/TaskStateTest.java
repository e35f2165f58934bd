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

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class TaskStateTest {

    @Test
    void terminalStatesHaveNoSuccessors() {
        for (TaskState terminal : EnumSet.of(TaskState.COMPLETED, TaskState.FAILED, TaskState.CANCELLED)) {
            assertTrue(terminal.isTerminal());
            for (TaskState next : TaskState.values()) {
                assertFalse(terminal.canTransitionTo(next), terminal + " -> " + next);
            }
        }
    }

    @Test
    void pendingCanStartOrBeCancelled() {
        assertTrue(TaskState.PENDING.canTransitionTo(TaskState.RUNNING));
        assertTrue(TaskState.PENDING.canTransitionTo(TaskState.CANCELLED));
        assertFalse(TaskState.PENDING.canTransitionTo(TaskState.COMPLETED));
        assertFalse(TaskState.PENDING.canTransitionTo(TaskState.FAILED));
    }

    @Test
    void runningEndsInAnyTerminalState() {
        assertTrue(TaskState.RUNNING.canTransitionTo(TaskState.COMPLETED));
        assertTrue(TaskState.RUNNING.canTransitionTo(TaskState.FAILED));
        assertTrue(TaskState.RUNNING.canTransitionTo(TaskState.CANCELLED));
        assertFalse(TaskState.RUNNING.canTransitionTo(TaskState.PENDING));
        assertFalse(TaskState.RUNNING.isTerminal());
    }
}
