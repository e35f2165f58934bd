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

package io.nosqlbench.taskpool.errors;

import java.util.Objects;

/**
 * Base type for all exceptions raised by the task pool. Every instance carries an
 * {@link ErrorCode}; the message is prefixed with the code so it reads well in logs.
 */
public class TaskPoolException extends RuntimeException {

    private final ErrorCode errorCode;

    public TaskPoolException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public TaskPoolException(ErrorCode errorCode, String message, Throwable cause) {
        super(Objects.requireNonNull(errorCode, "errorCode").code() + ": " + message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
