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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class LoggerLogSinkTest {

    private static final class CapturingAppender extends AbstractAppender {
        final List<LogEvent> events = new CopyOnWriteArrayList<>();

        CapturingAppender() {
            super("capture", null, null, true, Property.EMPTY_ARRAY);
        }

        @Override
        public void append(LogEvent event) {
            events.add(event.toImmutable());
        }
    }

    @Test
    void forwardsAtTheRecordLevelWithThreadAndSource() {
        Logger logger = (Logger) LogManager.getLogger("taskpool.test.forward");
        CapturingAppender appender = new CapturingAppender();
        appender.start();
        logger.addAppender(appender);
        logger.setLevel(Level.INFO);
        try {
            LoggerLogSink sink = new LoggerLogSink(logger);
            sink.accept(new LogRecord(Level.WARN, "pool", "slow task", java.time.Instant.now(), "worker-3"));
            sink.accept(new LogRecord(Level.DEBUG, "pool", "filtered out"));

            assertEquals(1, appender.events.size());
            LogEvent event = appender.events.get(0);
            assertEquals(Level.WARN, event.getLevel());
            assertEquals("[worker-3] pool - slow task", event.getMessage().getFormattedMessage());
        } finally {
            logger.removeAppender(appender);
            appender.stop();
        }
    }

    @Test
    void namedLoggerConstructor() {
        assertTrue(new LoggerLogSink("taskpool.test.named").toString().contains("taskpool.test.named"));
    }
}
