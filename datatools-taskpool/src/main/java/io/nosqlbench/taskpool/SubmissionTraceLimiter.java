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
 * Decides whether a submission gets its routine debug trace. Under heavy load (more than
 * {@code threshold} tasks running) only every {@code every}-th submission is traced.
 * Warnings and errors never pass through here.
 */
final class SubmissionTraceLimiter {

    private final int threshold;
    private final int every;

    SubmissionTraceLimiter(int threshold, int every) {
        if (every < 1) {
            throw new IllegalArgumentException("every must be at least 1, got " + every);
        }
        this.threshold = threshold;
        this.every = every;
    }

    /**
     * @param submissionNumber 1-based sequence number of the submission
     * @param activeCount tasks running at submission time
     */
    boolean shouldTrace(long submissionNumber, int activeCount) {
        return activeCount <= threshold || submissionNumber % every == 0;
    }
}
