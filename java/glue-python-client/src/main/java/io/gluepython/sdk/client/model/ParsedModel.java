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
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.jackson.Jacksonized;

/**
 * The host tool's description of the model being run.
 *
 * <p>Only the keys read here are bound; the rest of the parsed model is ignored.
 */
@Builder
@Data
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@Jacksonized
public class ParsedModel {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @JsonProperty("alias")
    private final String alias;

    @JsonProperty("schema")
    private final String schema;

    @JsonProperty("config")
    private final ModelConfig config;

    /**
     * Binds a parsed model passed as a map.
     *
     * @throws IllegalArgumentException if the map cannot be bound, or lacks {@code alias} or {@code schema}
     */
    public static ParsedModel of(Map<String, ?> parsedModel) {
        if (parsedModel == null) {
            throw new IllegalArgumentException("parsed model is required");
        }
        final ParsedModel model = MAPPER.convertValue(parsedModel, ParsedModel.class);
        if (model.getAlias() == null) {
            throw new IllegalArgumentException("parsed model has no alias");
        }
        if (model.getSchema() == null) {
            throw new IllegalArgumentException("parsed model has no schema");
        }
        return model;
    }

    public ModelConfig getConfig() {
        return config != null ? config : ModelConfig.builder().build();
    }
}
