/*
 * Copyright 2024 The Glue Python Client Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.gluepython.sdk.client.exception;

import java.time.Duration;
import lombok.Getter;

/**
 * A statement did not reach a terminal state within the configured timeout.
 *
 * <p>The statement may still be running remotely.
 */
@Getter
public class StatementTimeoutException extends GluePythonException {
    private final int statementId;
    private final Duration timeout;

    public StatementTimeoutException(int statementId, Duration timeout) {
        super(String.format("Timed out waiting for statement %d to complete after %s", statementId, timeout));
        this.statementId = statementId;
        this.timeout = timeout;
    }
}
