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

package io.nosqlbench.taskpool.errors;

/**
 * Stable codes attached to every {@link TaskPoolException}. The codes are the
 * same ones written into diagnostic log records, so log searches and exception
 * handlers can match on a single value.
 */
public enum ErrorCode {
    /** Work was offered to a pool that has been shut down. */
    SUBMISSION_REJECTED("TASKPOOL_SUBMISSION_REJECTED"),
    /** The work function threw; the cause is kept on the task handle. */
    TASK_FAILED("TASKPOOL_TASK_FAILED"),
    /** The task ended in the cancelled state. */
    TASK_CANCELLED("TASKPOOL_TASK_CANCELLED"),
    /** A registered log sink threw while receiving a record. */
    SINK_ERROR("TASKPOOL_SINK_ERROR"),
    /** The janitor found a registry entry that should not exist. */
    REGISTRY_INCONSISTENCY("TASKPOOL_REGISTRY_INCONSISTENCY"),
    /** A configuration value was missing, malformed or out of range. */
    CONFIGURATION("TASKPOOL_CONFIGURATION");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
