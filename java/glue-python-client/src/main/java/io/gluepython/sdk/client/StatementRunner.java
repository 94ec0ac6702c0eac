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

import dev.failsafe.Failsafe;
import dev.failsafe.FailsafeException;
import dev.failsafe.RetryPolicy;
import dev.failsafe.RetryPolicyBuilder;
import io.gluepython.sdk.client.exception.GluePythonException;
import io.gluepython.sdk.client.exception.StatementFailedException;
import io.gluepython.sdk.client.exception.StatementTimeoutException;
import io.gluepython.sdk.client.helper.PackageInstaller;
import io.gluepython.sdk.client.request.StatementHandle;
import io.gluepython.sdk.client.request.StatementOutput;
import io.gluepython.sdk.client.request.StatementRequest;
import io.gluepython.sdk.client.request.StatementResponse;
import io.gluepython.sdk.client.scan.CodeAnnotationScanner;
import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs Python statements in a session one at a time and waits for each to finish.
 */
public class StatementRunner {
    private static final Logger log = LoggerFactory.getLogger(StatementRunner.class);

    @Getter
    private final RunnerConfig config;

    public StatementRunner(RunnerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Runs a model in a session: installs its packages, then executes its code.
     *
     * <p>The packages are those declared in {@code declaredPackages} together with
     * those declared inline in {@code mainCode}. A failed installation stops the run
     * before the model code is submitted. The session client is closed when this
     * method returns or throws.
     *
     * @param session          client for a session that is not open yet
     * @param mainCode         the compiled model code
     * @param declaredPackages packages from the model config, may be {@code null}
     * @throws GluePythonException if any statement fails, times out, or the session fails
     */
    public void run(SessionClient session, String mainCode, Collection<String> declaredPackages) {
        try (session) {
            final String sessionId = session.openSession();
            log.info("Using session: {}", sessionId);

            final Set<String> packages =
                    PackageInstaller.merge(declaredPackages, CodeAnnotationScanner.extractPackages(mainCode));
            if (!packages.isEmpty()) {
                log.info("Installing packages: {}", packages);
                final StatementHandle install = submit(session, sessionId, PackageInstaller.installStatement(packages));
                awaitCompletion(session, install);
            }

            final StatementHandle main = submit(session, sessionId, mainCode);
            awaitCompletion(session, main);
        } catch (RuntimeException e) {
            throw executionFailed(e);
        }
    }

    /**
     * Same as {@link #run(SessionClient, String, Collection)}, with a failure to
     * create the session client reported like any other session failure.
     */
    public void run(Supplier<? extends SessionClient> sessionFactory, String mainCode, Collection<String> declaredPackages) {
        final SessionClient session;
        try {
            session = sessionFactory.get();
        } catch (RuntimeException e) {
            throw executionFailed(e);
        }
        run(session, mainCode, declaredPackages);
    }

    /**
     * Sends one code fragment to the session. Submission failures are not retried.
     */
    public StatementHandle submit(SessionClient session, String sessionId, String code) {
        final StatementRequest request = StatementRequest.builder()
                .sessionId(sessionId)
                .code(code)
                .build();
        final StatementHandle handle = session.runStatement(request);
        log.debug("Submitted statement {} to session {}", handle.getStatementId(), sessionId);
        return handle;
    }

    /**
     * Polls the statement until it reaches a terminal state or the timeout elapses.
     *
     * @return the output of a statement that completed without error
     * @throws StatementFailedException  if the statement was cancelled, errored, or its output reports an error
     * @throws StatementTimeoutException if no terminal state was observed in time
     */
    public StatementOutput awaitCompletion(SessionClient session, StatementHandle handle) {
        final Duration timeout = config.getTimeout();
        if (timeout.isZero()) {
            throw new StatementTimeoutException(handle.getStatementId(), timeout);
        }

        final StatementResponse response;
        try {
            response = Failsafe.with(createStatementCompletionRetryPolicy(handle))
                    .get(() -> session.getStatement(handle));
        } catch (FailsafeException e) {
            if (e.getCause() instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new GluePythonException(
                        "Interrupted while waiting for statement " + handle.getStatementId(), e.getCause());
            }
            throw new GluePythonException(
                    "Failed waiting for statement " + handle.getStatementId(), e.getCause());
        }

        if (!response.getState().isTerminal()) {
            throw new StatementTimeoutException(handle.getStatementId(), timeout);
        }
        if (response.getState().isFailure()) {
            throw StatementFailedException.ofState(response.getState());
        }

        final StatementOutput output = response.getOutput() != null ? response.getOutput() : StatementOutput.empty();
        if (output.isError()) {
            log.debug("Statement {} output: {}", handle.getStatementId(), output);
            throw StatementFailedException.ofOutput(output);
        }
        log.debug("Statement {} completed successfully. Output: {}", handle.getStatementId(), output);
        return output;
    }

    private static GluePythonException executionFailed(RuntimeException e) {
        return new GluePythonException("Python model execution failed: " + e.getMessage(), e);
    }

    private RetryPolicy<StatementResponse> createStatementCompletionRetryPolicy(StatementHandle handle) {
        final Duration timeout = config.getTimeout();
        final Duration pollInterval = config.getPollInterval();

        final RetryPolicyBuilder<StatementResponse> builder = RetryPolicy.<StatementResponse>builder()
                // statement is not done; poll again
                .handleIf((response, failure) -> failure == null && !response.getState().isTerminal())
                // a failed status fetch ends the wait
                .abortOn(Throwable.class)
                .onRetry(event -> log.trace("Statement {} is {}, polling again (attempt {})",
                        handle.getStatementId(),
                        event.getLastResult().getState(),
                        event.getAttemptCount()));

        if (pollInterval.compareTo(timeout) < 0) {
            // max duration caps the last delay, so the loop never outlives the timeout by a whole interval
            return builder.withDelay(pollInterval)
                    .withMaxDuration(timeout)
                    .withMaxRetries(-1)
                    .build();
        }
        // the first pause would already reach the timeout
        return builder.withMaxRetries(0).build();
    }
}
