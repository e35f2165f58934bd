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

package io.nosqlbench.taskpool.logging.sinks;

import io.nosqlbench.taskpool.logging.LogRecord;
import io.nosqlbench.taskpool.logging.LogSink;

import java.io.PrintStream;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Writes pipeline records to a {@link PrintStream}, one line per record.
 *
 * <p>With timestamps enabled the line is the record's full {@link LogRecord#format()}
 * form; without them it is {@code [LEVEL] source - message}, which is easier to read
 * in an interactive console.
 */
public class ConsoleLogSink implements LogSink {

    private static final DateTimeFormatter TIME_FORMAT =
        DateTimeFormatter.ofPattern("HH:mm:ss.SSS").withZone(ZoneId.systemDefault());

    private final PrintStream output;
    private final boolean showTimestamp;

    public ConsoleLogSink() {
        this(System.out, true);
    }

    public ConsoleLogSink(PrintStream output) {
        this(output, true);
    }

    public ConsoleLogSink(PrintStream output, boolean showTimestamp) {
        this.output = Objects.requireNonNull(output, "output");
        this.showTimestamp = showTimestamp;
    }

    @Override
    public void accept(LogRecord record) {
        String timestamp = showTimestamp ? "[" + TIME_FORMAT.format(record.getTimestamp()) + "] " : "";
        output.println(timestamp + String.format("[%-5s] %s - %s",
            record.getLevel().name(), record.getSource(), record.getMessage()));
    }

    @Override
    public void close() {
        output.flush();
    }

    @Override
    public String toString() {
        return "ConsoleLogSink";
    }
}
