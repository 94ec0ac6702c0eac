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

import java.time.Duration;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;

/**
 * Configuration for the {@link StatementRunner}.
 */
@Builder
@Data
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class RunnerConfig {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofHours(1);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(10);

    /**
     * How long to wait for one statement to reach a terminal state.
     */
    private final Duration timeout;

    /**
     * Pause between two status polls of the same statement.
     */
    private final Duration pollInterval;

    public static class RunnerConfigBuilder {
        private Duration timeout = DEFAULT_TIMEOUT;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;

        public RunnerConfigBuilder timeoutSeconds(long seconds) {
            return timeout(Duration.ofSeconds(seconds));
        }

        public RunnerConfigBuilder pollIntervalSeconds(long seconds) {
            return pollInterval(Duration.ofSeconds(seconds));
        }

        public RunnerConfig build() {
            if (timeout == null || timeout.isNegative()) {
                throw new IllegalArgumentException("timeout must not be negative: " + timeout);
            }
            if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
                throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
            }
            return new RunnerConfig(timeout, pollInterval);
        }
    }
}
