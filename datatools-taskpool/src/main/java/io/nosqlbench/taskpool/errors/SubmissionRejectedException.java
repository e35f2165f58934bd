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
 * Thrown by {@code TaskPool.submit} once the pool has been shut down. This is the only
 * failure returned synchronously to a submitter.
 */
public class SubmissionRejectedException extends TaskPoolException {

    public SubmissionRejectedException(String poolName) {
        super(ErrorCode.SUBMISSION_REJECTED, "task pool '" + poolName + "' has been shut down");
    }
}
