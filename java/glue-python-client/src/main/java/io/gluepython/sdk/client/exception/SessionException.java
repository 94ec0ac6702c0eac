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

package io.gluepython.sdk.client.exception;

import lombok.Getter;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkException;

/**
 * Exception from the session service: a failed API call, or a session that
 * could not be brought to a usable state.
 */
@Getter
public class SessionException extends GluePythonException {
    private final String sessionId;

    public SessionException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    private SessionException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }

    public static SessionException of(String sessionId, String operation, SdkException cause) {
        if (cause instanceof AwsServiceException) {
            final AwsServiceException serviceError = (AwsServiceException) cause;
            if (serviceError.awsErrorDetails() != null) {
                return new SessionException(sessionId, String.format("%s failed for session %s: %d %s: %s",
                        operation,
                        sessionId,
                        serviceError.statusCode(),
                        serviceError.awsErrorDetails().errorCode(),
                        serviceError.awsErrorDetails().errorMessage()), cause);
            }
        }
        return new SessionException(
                sessionId, String.format("%s failed for session %s: %s", operation, sessionId, cause.getMessage()), cause);
    }
}
