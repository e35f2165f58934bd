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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Test sink that keeps every record it receives.
 */
public class CollectingLogSink implements LogSink {

    private final List<LogRecord> records = new CopyOnWriteArrayList<>();
    private final AtomicInteger closeCount = new AtomicInteger();

    @Override
    public void accept(LogRecord record) {
        records.add(record);
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
    }

    public List<LogRecord> records() {
        return new ArrayList<>(records);
    }

    public List<String> messages() {
        List<String> messages = new ArrayList<>();
        for (LogRecord record : records) {
            messages.add(record.getMessage());
        }
        return messages;
    }

    public long count(Predicate<LogRecord> predicate) {
        return records.stream().filter(predicate).count();
    }

    public int closeCount() {
        return closeCount.get();
    }

    public void clear() {
        records.clear();
    }
}
