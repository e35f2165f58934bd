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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Forwards pipeline records to Log4j 2, so applications that already route Log4j output
 * to files or aggregators see task traffic there too.
 *
 * <p>The record keeps its own level. The producing thread is included in the message
 * because Log4j will report the pipeline's consumer thread as the caller.
 */
public class LoggerLogSink implements LogSink {

    private final Logger logger;

    public LoggerLogSink() {
        this(LogManager.getLogger(LoggerLogSink.class));
    }

    public LoggerLogSink(String loggerName) {
        this(LogManager.getLogger(loggerName));
    }

    public LoggerLogSink(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    public void accept(LogRecord record) {
        if (logger.isEnabled(record.getLevel())) {
            logger.log(record.getLevel(), "[{}] {} - {}",
                record.getSourceThread(), record.getSource(), record.getMessage());
        }
    }

    @Override
    public String toString() {
        return "LoggerLogSink[" + logger.getName() + "]";
    }
}
