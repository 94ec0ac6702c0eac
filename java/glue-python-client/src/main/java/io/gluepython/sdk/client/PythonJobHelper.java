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

/**
 * Executes the compiled code of a Python model.
 */
public interface PythonJobHelper {
    /**
     * Runs the model code and blocks until it finished.
     *
     * @param compiledCode the model's compiled Python code
     * @throws io.gluepython.sdk.client.exception.GluePythonException if the execution failed
     */
    void submit(String compiledCode);
}
