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
import io.gluepython.sdk.client.request.StatementRequest;
import io.gluepython.sdk.client.request.StatementResponse;

/**
 * Connection to a remote interactive session that executes code statements.
 *
 * <p>Implementations are not thread-safe; one client serves one model run.
 */
public interface SessionClient extends AutoCloseable {
    /**
     * Acquires a session that is ready to run statements.
     *
     * @return the session id
     */
    String openSession();

    /**
     * Submits one code fragment. Returns as soon as the service accepted it.
     */
    StatementHandle runStatement(StatementRequest request);

    StatementResponse getStatement(StatementHandle handle);

    /**
     * Releases the session and the underlying connection.
     */
    @Override
    void close();
}
