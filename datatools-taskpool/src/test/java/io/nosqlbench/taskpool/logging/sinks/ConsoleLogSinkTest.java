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
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleLogSinkTest {

    @Test
    void printsOneLinePerRecord() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        ConsoleLogSink sink = new ConsoleLogSink(out, false);

        sink.accept(new LogRecord(Level.INFO, "pool", "first"));
        sink.accept(new LogRecord(Level.ERROR, "pool", "second"));
        sink.close();

        String[] lines = buffer.toString(StandardCharsets.UTF_8).split("\\R");
        assertArrayEquals(new String[]{"[INFO ] pool - first", "[ERROR] pool - second"}, lines);
    }

    @Test
    void timestampPrefixWhenEnabled() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ConsoleLogSink sink = new ConsoleLogSink(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        sink.accept(new LogRecord(Level.WARN, "janitor", "stale"));
        String line = buffer.toString(StandardCharsets.UTF_8).trim();
        assertTrue(line.matches("\\[\\d{2}:\\d{2}:\\d{2}\\.\\d{3}] \\[WARN ] janitor - stale"), line);
    }
}
