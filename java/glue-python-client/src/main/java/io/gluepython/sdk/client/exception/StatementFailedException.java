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

import io.gluepython.sdk.client.request.StatementOutput;
import io.gluepython.sdk.client.request.StatementState;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * A statement reached a failed terminal state, or finished with an error output.
 */
@Getter
public class StatementFailedException extends GluePythonException {
    private final StatementState state;
    private final String errorName;
    private final String errorValue;
    private final List<String> traceback;

    private StatementFailedException(
            String message, StatementState state, String errorName, String errorValue, List<String> traceback) {
        super(message);
        this.state = state;
        this.errorName = errorName;
        this.errorValue = errorValue;
        this.traceback = traceback;
    }

    public static StatementFailedException ofState(StatementState state) {
        return new StatementFailedException(
                "Statement execution failed with state: " + state, state, null, null, Collections.emptyList());
    }

    public static StatementFailedException ofOutput(StatementOutput output) {
        final String errorName = nullToEmpty(output.getErrorName());
        final String errorValue = nullToEmpty(output.getErrorValue());
        final List<String> traceback = output.getTraceback();
        final String message = String.format(
                "Python model failed with error: %s%n%s%n%s", errorName, errorValue, String.join("", traceback));
        return new StatementFailedException(message, StatementState.AVAILABLE, errorName, errorValue, traceback);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
