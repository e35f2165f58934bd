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

package io.nosqlbench.taskpool.logging;

import org.apache.logging.log4j.Level;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * An immutable log event travelling through a {@link LogPipeline}. A record is created
 * on the producing thread, enqueued once, and consumed once by the pipeline's
 * consumer thread, which hands the same instance to every registered sink.
 *
 * <p>The {@link #getSourceThread() source thread} is captured at construction time so
 * sinks can show which worker produced the record even though delivery happens on
 * the consumer thread.
 */
public final class LogRecord {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss,SSS").withZone(ZoneId.systemDefault());

    private final Level level;
    private final String message;
    private final Instant timestamp;
    private final String sourceThread;
    private final String source;

    public LogRecord(Level level, String source, String message) {
        this(level, source, message, Instant.now(), Thread.currentThread().getName());
    }

    public LogRecord(Level level, String source, String message, Instant timestamp, String sourceThread) {
        this.level = Objects.requireNonNull(level, "level");
        this.source = Objects.requireNonNullElse(source, "");
        this.message = Objects.requireNonNullElse(message, "");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.sourceThread = Objects.requireNonNullElse(sourceThread, "unknown");
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getSourceThread() {
        return sourceThread;
    }

    /**
     * Name of the component that produced the record, for example the pool name.
     */
    public String getSource() {
        return source;
    }

    /**
     * Formats the record as {@code timestamp - source - LEVEL - message}.
     */
    public String format() {
        return TIMESTAMP_FORMAT.format(timestamp) + " - " + source + " - " + level.name() + " - " + message;
    }

    @Override
    public String toString() {
        return format();
    }
}
