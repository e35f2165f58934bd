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
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class LogRecordTest {

    @Test
    void formatsAsTimestampSourceLevelMessage() {
        LogRecord record = new LogRecord(Level.WARN, "pool", "slow task", Instant.now(), "worker-1");
        String formatted = record.format();
        assertTrue(formatted.matches("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2},\\d{3} - pool - WARN - slow task"), formatted);
        assertEquals(formatted, record.toString());
    }

    @Test
    void nullTextFieldsBecomeEmpty() {
        LogRecord record = new LogRecord(Level.INFO, null, null);
        assertEquals("", record.getSource());
        assertEquals("", record.getMessage());
        assertEquals(Thread.currentThread().getName(), record.getSourceThread());
        assertThrows(NullPointerException.class, () -> new LogRecord(null, "s", "m"));
    }
}
