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

import io.gluepython.sdk.client.glue.GlueCredentials;
import io.gluepython.sdk.client.glue.GlueSessionClient;
import io.gluepython.sdk.client.model.ModelConfig;
import io.gluepython.sdk.client.model.ParsedModel;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import lombok.Getter;

/**
 * Runs Python models as statements in an AWS Glue interactive session.
 *
 * <p>Each {@link #submit(String)} acquires a session, installs the model's
 * packages in it, runs the model code and releases the session.
 */
public class GluePythonJobHelper implements PythonJobHelper {
    static final Duration POLL_INTERVAL = Duration.ofSeconds(10);

    @Getter
    private final String identifier;
    @Getter
    private final String schema;
    @Getter
    private final List<String> packages;
    @Getter
    private final Duration timeout;

    private final GlueCredentials credentials;
    private final Function<GlueCredentials, SessionClient> sessionFactory;
    private final StatementRunner runner;

    public GluePythonJobHelper(Map<String, ?> parsedModel, GlueCredentials credentials) {
        this(ParsedModel.of(parsedModel), credentials, GlueSessionClient::new, POLL_INTERVAL);
    }

    GluePythonJobHelper(
            ParsedModel model,
            GlueCredentials credentials,
            Function<GlueCredentials, SessionClient> sessionFactory,
            Duration pollInterval) {
        final ModelConfig config = model.getConfig();
        this.identifier = model.getAlias();
        this.schema = model.getSchema();
        this.packages = config.getPackages() != null ? config.getPackages() : Collections.emptyList();
        this.timeout = config.getTimeout() != null ? Duration.ofSeconds(config.getTimeout()) : RunnerConfig.DEFAULT_TIMEOUT;

        this.credentials = credentials;
        this.sessionFactory = sessionFactory;
        this.runner = new StatementRunner(RunnerConfig.builder()
                .timeout(timeout)
                .pollInterval(pollInterval)
                .build());
    }

    @Override
    public void submit(String compiledCode) {
        runner.run(() -> sessionFactory.apply(credentials), compiledCode, packages);
    }
}
