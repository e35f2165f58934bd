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

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Appends formatted records to a UTF-8 text file, flushing after every record so the
 * file is current even if the process dies.
 *
 * <p>{@link #daily(Path)} names the file {@code app_yyyyMMdd.log} inside a log
 * directory, creating the directory when needed.
 */
public class FileLogSink implements LogSink {

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final Path file;
    private final BufferedWriter writer;
    private boolean closed;

    public FileLogSink(Path file) {
        this.file = Objects.requireNonNull(file, "file");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            this.writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to open log file " + file, e);
        }
    }

    /**
     * Opens today's log file in the given directory.
     *
     * @param logDirectory directory that holds the daily log files
     * @return a sink appending to {@code app_yyyyMMdd.log}
     */
    public static FileLogSink daily(Path logDirectory) {
        return new FileLogSink(logDirectory.resolve("app_" + LocalDate.now().format(DAY_FORMAT) + ".log"));
    }

    public Path getFile() {
        return file;
    }

    @Override
    public synchronized void accept(LogRecord record) {
        if (closed) {
            throw new IllegalStateException("FileLogSink for " + file + " is closed");
        }
        try {
            writer.write(record.format());
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write to log file " + file, e);
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to close log file " + file, e);
        }
    }

    @Override
    public String toString() {
        return "FileLogSink[" + file + "]";
    }
}
