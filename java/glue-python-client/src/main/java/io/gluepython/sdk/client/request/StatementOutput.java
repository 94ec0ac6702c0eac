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

import java.util.Collections;
import java.util.List;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;

@Builder
@Data
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class StatementOutput {
    private static final String ERROR_STATUS = "error";

    /**
     * Execution status of the code, {@code ok} or {@code error}.
     */
    private final String status;

    private final String errorName;

    private final String errorValue;

    private final List<String> traceback;

    /**
     * The {@code text/plain} rendering of the statement's result.
     */
    private final String data;

    private final Integer executionCount;

    public List<String> getTraceback() {
        return traceback == null ? Collections.emptyList() : traceback;
    }

    public boolean isError() {
        return ERROR_STATUS.equalsIgnoreCase(status);
    }

    public static StatementOutput empty() {
        return StatementOutput.builder().build();
    }
}
