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

package io.gluepython.sdk.client.request;

import io.gluepython.sdk.client.exception.StatementFailedException;
import java.util.Locale;

/**
 * Statement execution state as reported by the session service.
 *
 * <p>Failures are exported as {@link StatementFailedException}.
 */
public enum StatementState {
    WAITING,
    RUNNING,
    CANCELLING,
    AVAILABLE,
    CANCELLED,
    ERROR,
    /**
     * A state this client does not know; polled like a running statement.
     */
    UNKNOWN;

    public boolean isTerminal() {
        return this == AVAILABLE || isFailure();
    }

    public boolean isFailure() {
        return this == CANCELLED || this == ERROR;
    }

    public static StatementState of(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
