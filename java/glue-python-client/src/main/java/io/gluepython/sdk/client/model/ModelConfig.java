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

package io.gluepython.sdk.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.jackson.Jacksonized;

/**
 * The part of a model's {@code config} that Python execution reads.
 */
@Builder
@Data
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@Jacksonized
public class ModelConfig {
    /**
     * Packages to pip-install in the session before the model runs.
     */
    @JsonProperty("packages")
    private final List<String> packages;

    /**
     * Statement timeout in seconds.
     */
    @JsonProperty("timeout")
    private final Integer timeout;
}
