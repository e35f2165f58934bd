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

import io.nosqlbench.taskpool.errors.TaskCancelledException;
import io.nosqlbench.taskpool.errors.TaskFailedException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TaskHandleTest {

    @Test
    void startsPendingWithSubmissionDetails() {
        TaskHandle<String> handle = new TaskHandle<>("task_1", "loader", 30);
        assertEquals("task_1", handle.getId());
        assertEquals("loader", handle.getName());
        assertEquals(30, handle.getTimeoutSeconds());
        assertEquals(TaskState.PENDING, handle.getState());
        assertFalse(handle.isDone());
        assertFalse(handle.isCancelRequested());
        assertNotNull(handle.getSubmittedAt());
        assertTrue(handle.getStartedAt().isEmpty());
        assertEquals(Duration.ZERO, handle.runDuration());
    }

    @Test
    void transitionsOnlyForward() {
        TaskHandle<String> handle = new TaskHandle<>("task_1", "t", 30);
        assertTrue(handle.tryStart());
        assertFalse(handle.tryStart());
        assertTrue(handle.getStartedAt().isPresent());

        assertFalse(handle.tryFinish(TaskState.PENDING, TaskState.CANCELLED, null, null));
        assertTrue(handle.tryFinish(TaskState.RUNNING, TaskState.COMPLETED, "ok", null));
        assertFalse(handle.tryFinish(TaskState.RUNNING, TaskState.FAILED, null, new RuntimeException()));
        assertEquals(TaskState.COMPLETED, handle.getState());
        assertTrue(handle.getFinishedAt().isPresent());
    }

    @Test
    void rejectsIllegalTransitions() {
        TaskHandle<String> handle = new TaskHandle<>("task_1", "t", 30);
        assertThrows(IllegalArgumentException.class,
            () -> handle.tryFinish(TaskState.PENDING, TaskState.COMPLETED, "x", null));
        assertThrows(IllegalArgumentException.class,
            () -> handle.tryFinish(TaskState.PENDING, TaskState.RUNNING, null, null));
        assertEquals(TaskState.PENDING, handle.getState());
    }

    @Test
    void resultIsVisibleOnlyAfterPublish() throws Exception {
        TaskHandle<String> handle = new TaskHandle<>("task_1", "t", 30);
        handle.tryStart();
        handle.tryFinish(TaskState.RUNNING, TaskState.COMPLETED, "value", null);
        assertTrue(handle.getResult().isEmpty());

        handle.publish();
        assertEquals("value", handle.getResult().orElseThrow());
        assertTrue(handle.getError().isEmpty());
        assertEquals("value", handle.await());
    }

    @Test
    void callbacksFireExactlyOncePerOutcome() {
        TaskHandle<String> handle = new TaskHandle<>("task_1", "t", 30);
        List<String> events = new ArrayList<>();
        handle.onCompleted(v -> events.add("completed:" + v))
            .onFailed(t -> events.add("failed"))
            .onCancelled(() -> events.add("cancelled"))
            .whenFinished(h -> events.add("finished:" + h.getState()));

        handle.tryStart();
        handle.tryFinish(TaskState.RUNNING, TaskState.COMPLETED, "v", null);
        handle.publish();
        handle.publish();

        assertThat(events).containsExactlyInAnyOrder("completed:v", "finished:COMPLETED");
    }

    @Test
    void failedCallbackReceivesTheOriginalThrowable() {
        TaskHandle<Object> handle = new TaskHandle<>("task_7", "t", 30);
        IllegalStateException boom = new IllegalStateException("boom");
        List<Throwable> seen = new ArrayList<>();
        handle.onFailed(seen::add);

        handle.tryStart();
        handle.tryFinish(TaskState.RUNNING, TaskState.FAILED, null, boom);
        handle.publish();

        assertEquals(List.of(boom), seen);
        assertSame(boom, handle.getError().orElseThrow());
        TaskFailedException e = assertThrows(TaskFailedException.class, handle::await);
        assertSame(boom, e.getCause());
        assertEquals("task_7", e.getTaskId());
    }

    @Test
    void cancelledHandleAwaitsWithCancellation() {
        TaskHandle<Object> handle = new TaskHandle<>("task_3", "t", 30);
        AtomicInteger cancelled = new AtomicInteger();
        handle.onCancelled(cancelled::incrementAndGet);
        assertTrue(handle.tryFinish(TaskState.PENDING, TaskState.CANCELLED, null, null));
        handle.publish();

        assertEquals(1, cancelled.get());
        assertThrows(TaskCancelledException.class, () -> handle.await(Duration.ofMillis(10)));
        assertTrue(handle.getStartedAt().isEmpty());
    }

    @Test
    void throwingCallbackDoesNotStopOthers() {
        TaskHandle<String> handle = new TaskHandle<>("task_1", "t", 30);
        AtomicInteger reached = new AtomicInteger();
        handle.onCompleted(v -> {
            throw new RuntimeException("bad callback");
        }).onCompleted(v -> reached.incrementAndGet());
        handle.tryStart();
        handle.tryFinish(TaskState.RUNNING, TaskState.COMPLETED, "v", null);
        assertDoesNotThrow(handle::publish);
        assertEquals(1, reached.get());
    }

    @Test
    void awaitTimesOutWhileUnfinished() {
        TaskHandle<String> handle = new TaskHandle<>("task_1", "t", 30);
        assertThrows(TimeoutException.class, () -> handle.await(Duration.ofMillis(20)));
    }

    @Test
    void cancellationFlagIsSetOnce() {
        TaskHandle<String> handle = new TaskHandle<>("task_1", "t", 30);
        assertTrue(handle.requestCancel());
        assertFalse(handle.requestCancel());
        assertTrue(handle.isCancelRequested());
    }

    @Test
    void overdueOnlyWhileRunningPastTimeout() {
        TaskHandle<String> handle = new TaskHandle<>("task_1", "t", 5);
        Instant later = Instant.now().plusSeconds(10);
        assertFalse(handle.isOverdue(later));
        handle.tryStart();
        assertFalse(handle.isOverdue(Instant.now()));
        assertTrue(handle.isOverdue(later));
        handle.tryFinish(TaskState.RUNNING, TaskState.COMPLETED, "v", null);
        assertFalse(handle.isOverdue(later));
    }
}
