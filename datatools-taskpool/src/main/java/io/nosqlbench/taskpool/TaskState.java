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
 * Lifecycle states of a submitted task.
 *
 * <pre>
 * PENDING -&gt; RUNNING | CANCELLED
 * RUNNING -&gt; COMPLETED | FAILED | CANCELLED
 * </pre>
 *
 * <p>{@link #COMPLETED}, {@link #FAILED} and {@link #CANCELLED} are terminal; a task never
 * leaves a terminal state.
 */
public enum TaskState {
    /**
     * Submitted and waiting for a free worker.
     */
    PENDING("⏳"),

    /**
     * A worker is executing the work function.
     */
    RUNNING("🔄"),

    /**
     * The work function returned normally (terminal state).
     */
    COMPLETED("✅"),

    /**
     * The work function threw (terminal state).
     */
    FAILED("❌"),

    /**
     * Cancelled before it started, or exited early after observing a cancellation
     * request (terminal state).
     */
    CANCELLED("🚫");

    private final String glyph;

    TaskState(String glyph) {
        this.glyph = glyph;
    }

    /**
     * Returns the Unicode glyph associated with this state for display purposes.
     *
     * @return a Unicode emoji character representing this state
     */
    public String getGlyph() {
        return glyph;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * @param next the proposed next state
     * @return true if moving from this state to {@code next} is a legal transition
     */
    public boolean canTransitionTo(TaskState next) {
        switch (this) {
            case PENDING:
                return next == RUNNING || next == CANCELLED;
            case RUNNING:
                return next == COMPLETED || next == FAILED || next == CANCELLED;
            default:
                return false;
        }
    }
}
