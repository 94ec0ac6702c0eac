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

package io.gluepython.sdk.client.glue;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.jackson.Jacksonized;

/**
 * Connection settings for AWS Glue interactive sessions.
 *
 * <p>Unset optional settings read as their defaults.
 */
@Builder
@Data
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@Jacksonized
public class GlueCredentials {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    static final String DEFAULT_GLUE_VERSION = "4.0";
    static final String DEFAULT_WORKER_TYPE = "G.1X";
    static final int DEFAULT_WORKERS = 5;
    static final int DEFAULT_IDLE_TIMEOUT_MINUTES = 10;
    static final int DEFAULT_PROVISIONING_TIMEOUT_SECONDS = 120;

    /**
     * AWS region of the Glue endpoint, e.g. {@code us-east-1}.
     */
    @JsonProperty("region")
    private final String region;

    /**
     * IAM role the session assumes.
     */
    @JsonProperty("role_arn")
    private final String roleArn;

    /**
     * Id of an existing session to reuse. A new session is created when unset
     * or when that session is no longer usable.
     */
    @JsonProperty("session_id")
    private final String sessionId;

    @JsonProperty("glue_version")
    private final String glueVersion;

    @JsonProperty("worker_type")
    private final String workerType;

    @JsonProperty("workers")
    private final Integer workers;

    /**
     * Minutes of inactivity after which Glue stops the session.
     */
    @JsonProperty("idle_timeout")
    private final Integer idleTimeout;

    @JsonProperty("session_provisioning_timeout_in_seconds")
    private final Integer sessionProvisioningTimeoutInSeconds;

    /**
     * Job arguments passed to new sessions, e.g. {@code --enable-glue-datacatalog}.
     */
    @JsonProperty("default_arguments")
    private final Map<String, String> defaultArguments;

    /**
     * Stop sessions this client created when it is closed. Otherwise they stay
     * up for reuse until their idle timeout.
     */
    @JsonProperty("stop_session_on_close")
    private final Boolean stopSessionOnClose;

    /**
     * Binds credentials from a profile map with snake_case keys.
     */
    public static GlueCredentials of(Map<String, ?> profile) {
        if (profile == null) {
            throw new IllegalArgumentException("credentials are required");
        }
        return MAPPER.convertValue(profile, GlueCredentials.class);
    }

    public String getGlueVersion() {
        return glueVersion != null ? glueVersion : DEFAULT_GLUE_VERSION;
    }

    public String getWorkerType() {
        return workerType != null ? workerType : DEFAULT_WORKER_TYPE;
    }

    public int getWorkers() {
        return workers != null ? workers : DEFAULT_WORKERS;
    }

    public int getIdleTimeout() {
        return idleTimeout != null ? idleTimeout : DEFAULT_IDLE_TIMEOUT_MINUTES;
    }

    public Duration getSessionProvisioningTimeout() {
        return Duration.ofSeconds(sessionProvisioningTimeoutInSeconds != null
                ? sessionProvisioningTimeoutInSeconds
                : DEFAULT_PROVISIONING_TIMEOUT_SECONDS);
    }

    public Map<String, String> getDefaultArguments() {
        return defaultArguments != null ? defaultArguments : Collections.emptyMap();
    }

    public boolean isStopSessionOnClose() {
        return stopSessionOnClose != null && stopSessionOnClose;
    }
}
