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

import dev.failsafe.Failsafe;
import dev.failsafe.FailsafeException;
import dev.failsafe.RetryPolicy;
import dev.failsafe.RetryPolicyBuilder;
import io.gluepython.sdk.client.SessionClient;
import io.gluepython.sdk.client.exception.GluePythonException;
import io.gluepython.sdk.client.exception.SessionException;
import io.gluepython.sdk.client.request.StatementHandle;
import io.gluepython.sdk.client.request.StatementOutput;
import io.gluepython.sdk.client.request.StatementRequest;
import io.gluepython.sdk.client.request.StatementResponse;
import io.gluepython.sdk.client.request.StatementState;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.glue.GlueClient;
import software.amazon.awssdk.services.glue.model.CreateSessionRequest;
import software.amazon.awssdk.services.glue.model.EntityNotFoundException;
import software.amazon.awssdk.services.glue.model.GetSessionRequest;
import software.amazon.awssdk.services.glue.model.GetStatementRequest;
import software.amazon.awssdk.services.glue.model.RunStatementRequest;
import software.amazon.awssdk.services.glue.model.Session;
import software.amazon.awssdk.services.glue.model.SessionCommand;
import software.amazon.awssdk.services.glue.model.SessionStatus;
import software.amazon.awssdk.services.glue.model.Statement;
import software.amazon.awssdk.services.glue.model.StopSessionRequest;

/**
 * {@link SessionClient} backed by AWS Glue interactive sessions.
 */
public class GlueSessionClient implements SessionClient {
    private static final Logger log = LoggerFactory.getLogger(GlueSessionClient.class);

    private static final String SESSION_COMMAND = "glueetl";
    private static final String PYTHON_VERSION = "3";
    private static final String SESSION_ID_PREFIX = "glue-python-";
    private static final Duration READINESS_POLL_INTERVAL = Duration.ofSeconds(2);

    private final GlueClient glue;
    private final GlueCredentials credentials;
    private final Duration readinessPollInterval;

    private String sessionId;
    private boolean createdSession;
    private boolean closed;

    public GlueSessionClient(GlueCredentials credentials) {
        this(GlueClient.builder()
                .region(Region.of(requireRegion(credentials)))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build(), credentials, READINESS_POLL_INTERVAL);
    }

    GlueSessionClient(GlueClient glue, GlueCredentials credentials, Duration readinessPollInterval) {
        this.glue = glue;
        this.credentials = credentials;
        this.readinessPollInterval = readinessPollInterval;
    }

    private static String requireRegion(GlueCredentials credentials) {
        if (credentials.getRegion() == null || credentials.getRegion().isBlank()) {
            throw new IllegalArgumentException("Glue credentials have no region");
        }
        return credentials.getRegion();
    }

    @Override
    public String openSession() {
        if (sessionId != null) {
            return sessionId;
        }

        final String configured = credentials.getSessionId();
        if (configured != null) {
            final Session existing = findSession(configured);
            if (existing != null && existing.status() == SessionStatus.READY) {
                log.debug("Reusing Glue session {}", configured);
                sessionId = configured;
                return sessionId;
            }
            if (existing != null && existing.status() == SessionStatus.PROVISIONING) {
                awaitReady(configured);
                sessionId = configured;
                return sessionId;
            }
            log.info("Glue session {} is {}, creating a new one",
                    configured, existing != null ? existing.statusAsString() : "gone");
        }

        final String created = createSession();
        createdSession = true;
        sessionId = created;
        awaitReady(created);
        return sessionId;
    }

    @Override
    public StatementHandle runStatement(StatementRequest request) {
        try {
            final Integer id = glue.runStatement(RunStatementRequest.builder()
                    .sessionId(request.getSessionId())
                    .code(request.getCode())
                    .build()).id();
            return new StatementHandle(request.getSessionId(), id);
        } catch (SdkException e) {
            throw SessionException.of(request.getSessionId(), "RunStatement", e);
        }
    }

    @Override
    public StatementResponse getStatement(StatementHandle handle) {
        final Statement statement;
        try {
            statement = glue.getStatement(GetStatementRequest.builder()
                    .sessionId(handle.getSessionId())
                    .id(handle.getStatementId())
                    .build()).statement();
        } catch (SdkException e) {
            throw SessionException.of(handle.getSessionId(), "GetStatement", e);
        }

        return StatementResponse.builder()
                .id(statement.id() != null ? statement.id() : handle.getStatementId())
                .state(StatementState.of(statement.stateAsString()))
                .output(toOutput(statement.output()))
                .progress(statement.progress() != null ? statement.progress() : 0.0)
                .build();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        try {
            if (createdSession && credentials.isStopSessionOnClose()) {
                log.info("Stopping Glue session {}", sessionId);
                glue.stopSession(StopSessionRequest.builder().id(sessionId).build());
            }
        } catch (SdkException e) {
            throw SessionException.of(sessionId, "StopSession", e);
        } finally {
            glue.close();
        }
    }

    private String createSession() {
        final String id = SESSION_ID_PREFIX + UUID.randomUUID();
        log.info("Creating Glue session {}", id);
        try {
            glue.createSession(CreateSessionRequest.builder()
                    .id(id)
                    .role(credentials.getRoleArn())
                    .command(SessionCommand.builder()
                            .name(SESSION_COMMAND)
                            .pythonVersion(PYTHON_VERSION)
                            .build())
                    .glueVersion(credentials.getGlueVersion())
                    .workerType(credentials.getWorkerType())
                    .numberOfWorkers(credentials.getWorkers())
                    .idleTimeout(credentials.getIdleTimeout())
                    .defaultArguments(credentials.getDefaultArguments())
                    .build());
        } catch (SdkException e) {
            throw SessionException.of(id, "CreateSession", e);
        }
        return id;
    }

    private Session findSession(String id) {
        try {
            return getSession(id);
        } catch (SessionException e) {
            if (e.getCause() instanceof EntityNotFoundException) {
                return null;
            }
            throw e;
        }
    }

    private Session getSession(String id) {
        try {
            return glue.getSession(GetSessionRequest.builder().id(id).build()).session();
        } catch (SdkException e) {
            throw SessionException.of(id, "GetSession", e);
        }
    }

    private void awaitReady(String id) {
        final Session session;
        try {
            session = Failsafe.with(createSessionReadinessRetryPolicy(id)).get(() -> getSession(id));
        } catch (FailsafeException e) {
            if (e.getCause() instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new GluePythonException("Failed waiting for Glue session " + id, e.getCause());
        }

        if (session.status() != SessionStatus.READY) {
            final String reason = session.errorMessage() != null ? ": " + session.errorMessage() : "";
            throw new SessionException(id, String.format(
                    "Glue session %s is %s, not READY%s", id, session.statusAsString(), reason));
        }
        log.debug("Glue session {} is ready", id);
    }

    private RetryPolicy<Session> createSessionReadinessRetryPolicy(String id) {
        final Duration timeout = credentials.getSessionProvisioningTimeout();

        final RetryPolicyBuilder<Session> builder = RetryPolicy.<Session>builder()
                // session is still starting; poll again
                .handleIf((session, failure) -> failure == null && session.status() == SessionStatus.PROVISIONING)
                .abortOn(Throwable.class)
                .onRetry(event -> log.debug("Waiting for Glue session {} to be ready", id));

        if (readinessPollInterval.compareTo(timeout) < 0) {
            return builder.withDelay(readinessPollInterval)
                    .withMaxDuration(timeout)
                    .withMaxRetries(-1)
                    .build();
        }
        return builder.withMaxRetries(0).build();
    }

    private static StatementOutput toOutput(software.amazon.awssdk.services.glue.model.StatementOutput output) {
        if (output == null) {
            return null;
        }
        return StatementOutput.builder()
                .status(output.statusAsString())
                .errorName(output.errorName())
                .errorValue(output.errorValue())
                .traceback(output.hasTraceback() ? output.traceback() : null)
                .data(output.data() != null ? output.data().textPlain() : null)
                .executionCount(output.executionCount())
                .build();
    }
}
