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

import io.nosqlbench.taskpool.logging.LogPipeline;
import io.nosqlbench.taskpool.logging.LogRecord;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class FileLogSinkTest {

    @Test
    void dailyFileIsNamedAfterToday(@TempDir Path tempDir) {
        Path logDir = tempDir.resolve("logs");
        FileLogSink sink = FileLogSink.daily(logDir);
        try {
            String today = LocalDate.now().format(DateTimeFormatter.ofPattern("yyyyMMdd"));
            assertEquals(logDir.resolve("app_" + today + ".log"), sink.getFile());
            assertTrue(Files.isDirectory(logDir));
        } finally {
            sink.close();
        }
    }

    @Test
    void appendsFormattedRecordsAndFlushesEach(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("app.log");
        FileLogSink sink = new FileLogSink(file);
        sink.accept(new LogRecord(Level.INFO, "pool", "first"));

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(1, lines.size(), "record is on disk before close");
        assertThat(lines.get(0)).endsWith(" - pool - INFO - first");

        sink.accept(new LogRecord(Level.ERROR, "pool", "second ✓"));
        sink.close();
        sink.close();
        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8))
            .hasSize(2)
            .last().asString().endsWith(" - pool - ERROR - second ✓");
        assertThrows(IllegalStateException.class, () -> sink.accept(new LogRecord(Level.INFO, "pool", "late")));
    }

    @Test
    void reopeningAppends(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("app.log");
        try (FileLogSink first = new FileLogSink(file)) {
            first.accept(new LogRecord(Level.INFO, "a", "one"));
        }
        try (FileLogSink second = new FileLogSink(file)) {
            second.accept(new LogRecord(Level.INFO, "b", "two"));
        }
        assertEquals(2, Files.readAllLines(file, StandardCharsets.UTF_8).size());
    }

    @Test
    void pipelineClosesFileOnStop(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("pipeline.log");
        FileLogSink sink = new FileLogSink(file);
        LogPipeline pipeline = new LogPipeline("file");
        pipeline.registerSink(sink);
        pipeline.log(Level.WARN, "pool", "written by the consumer");
        pipeline.stop();

        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8))
            .singleElement().asString().endsWith("written by the consumer");
        assertThrows(IllegalStateException.class, () -> sink.accept(new LogRecord(Level.INFO, "pool", "closed")));
    }
}
