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

package io.gluepython.sdk.client;

import io.gluepython.sdk.client.request.StatementHandle;
import io.gluepython.sdk.client.request.StatementOutput;
import io.gluepython.sdk.client.request.StatementRequest;
import io.gluepython.sdk.client.request.StatementResponse;
import io.gluepython.sdk.client.request.StatementState;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Scripted session: each submitted statement replays the next enqueued list of
 * poll responses, repeating the last one once the list is exhausted.
 */
@Getter
class FakeSessionClient implements SessionClient {
    static final String SESSION_ID = "test-session";

    private final Deque<List<StatementResponse>> scripts = new ArrayDeque<>();
    private final Map<Integer, Deque<StatementResponse>> polls = new HashMap<>();
    private final List<String> submittedCode = new ArrayList<>();
    private int openCount;
    private int closeCount;
    private int pollCount;

    FakeSessionClient enqueue(StatementResponse... responses) {
        scripts.add(Arrays.asList(responses));
        return this;
    }

    static StatementResponse response(StatementState state) {
        return StatementResponse.builder().state(state).build();
    }

    static StatementResponse available(StatementOutput output) {
        return StatementResponse.builder().state(StatementState.AVAILABLE).output(output).build();
    }

    static StatementResponse ok() {
        return available(StatementOutput.builder().status("ok").data("done").build());
    }

    @Override
    public String openSession() {
        openCount++;
        return SESSION_ID;
    }

    @Override
    public StatementHandle runStatement(StatementRequest request) {
        submittedCode.add(request.getCode());
        final int id = submittedCode.size();
        final List<StatementResponse> script = scripts.poll();
        if (script == null) {
            throw new IllegalStateException("no script for statement " + id);
        }
        polls.put(id, new ArrayDeque<>(script));
        return new StatementHandle(request.getSessionId(), id);
    }

    @Override
    public StatementResponse getStatement(StatementHandle handle) {
        pollCount++;
        final Deque<StatementResponse> remaining = polls.get(handle.getStatementId());
        return remaining.size() > 1 ? remaining.poll() : remaining.peek();
    }

    @Override
    public void close() {
        closeCount++;
    }
}
