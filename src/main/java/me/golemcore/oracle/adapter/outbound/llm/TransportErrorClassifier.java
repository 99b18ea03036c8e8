package me.golemcore.oracle.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import feign.FeignException;
import me.golemcore.oracle.domain.model.TransportException;
import me.golemcore.oracle.domain.model.TransportFailureKind;

import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Classifies completion service failures by exception type, HTTP status and
 * message text, walking the cause chain.
 */
public final class TransportErrorClassifier {

    private static final int MAX_BODY_LENGTH = 500;

    private TransportErrorClassifier() {
    }

    /**
     * Wraps any failure of a completion call into a classified
     * {@link TransportException}.
     */
    public static TransportException toTransportException(Throwable throwable) {
        if (throwable instanceof TransportException transportException) {
            return transportException;
        }
        TransportFailureKind kind = classify(throwable);
        Integer status = null;
        String message = throwable != null ? throwable.getMessage() : null;
        FeignException feignException = findFeignException(throwable);
        if (feignException != null && feignException.status() > 0) {
            status = feignException.status();
            message = describeHttpStatus(status, responseBody(feignException));
        }
        if (message == null || message.isBlank()) {
            message = throwable != null ? throwable.getClass().getSimpleName() : "Unknown transport failure";
        }
        return new TransportException(kind, message, status, throwable);
    }

    public static TransportFailureKind classify(Throwable throwable) {
        if (throwable == null) {
            return TransportFailureKind.GENERIC_FAILURE;
        }
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            TransportFailureKind byType = classifyKnownThrowable(current);
            if (byType != TransportFailureKind.GENERIC_FAILURE) {
                return byType;
            }
            TransportFailureKind byMessage = classifyFromMessage(messageOf(current));
            if (byMessage != TransportFailureKind.GENERIC_FAILURE) {
                return byMessage;
            }
            current = current.getCause();
        }
        return TransportFailureKind.GENERIC_FAILURE;
    }

    public static TransportFailureKind classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return TransportFailureKind.GENERIC_FAILURE;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("maximum context length") || normalized.contains("context length")
                || normalized.contains("context_length")) {
            return TransportFailureKind.CONTEXT_LENGTH_EXCEEDED;
        }
        if (normalized.contains("rate limit") || normalized.contains("rate_limit")
                || normalized.contains("too many requests")) {
            return TransportFailureKind.RATE_LIMIT;
        }
        if (normalized.contains("read timed out") || normalized.contains("timed out")
                || normalized.contains("timeout")) {
            return TransportFailureKind.TIMEOUT;
        }
        if (normalized.contains("network") || normalized.contains("connection")
                || normalized.contains("failed to connect")) {
            return TransportFailureKind.CONNECTION_FAILURE;
        }
        return TransportFailureKind.GENERIC_FAILURE;
    }

    /**
     * Human-readable description of an HTTP failure, with the provider's error
     * text appended.
     */
    public static String describeHttpStatus(int status, String body) {
        String base = switch (status) {
            case 400 -> "Bad request: the completion service rejected the request format";
            case 401 -> "Authentication failed: check the API key";
            case 402 -> "Insufficient balance on the completion service account";
            case 403 -> "Access denied by the completion service";
            case 404 -> "Model or endpoint not found";
            case 408 -> "Request timed out on the completion service";
            case 422 -> "Invalid request parameters";
            case 429 -> "Rate limit reached, slow down requests";
            case 500 -> "Completion service internal error";
            case 502 -> "Bad gateway in front of the completion service";
            case 503 -> "Completion service unavailable or overloaded";
            case 504 -> "Gateway timeout waiting for the completion service";
            default -> "Completion service returned HTTP " + status;
        };
        if (body == null || body.isBlank()) {
            return base;
        }
        if (body.toLowerCase(Locale.ROOT).contains("insufficient tool messages")) {
            return "Tool execution protocol violation: every tool call needs a matching tool message ("
                    + truncate(body) + ")";
        }
        return base + ": " + truncate(body);
    }

    private static TransportFailureKind classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return TransportFailureKind.TIMEOUT;
        }
        if (throwable instanceof ConnectException
                || throwable instanceof UnknownHostException
                || throwable instanceof NoRouteToHostException
                || throwable instanceof SocketException) {
            return TransportFailureKind.CONNECTION_FAILURE;
        }
        if (throwable instanceof InterruptedIOException) {
            return TransportFailureKind.TIMEOUT;
        }
        if (throwable instanceof FeignException feignException) {
            return classifyHttpStatus(feignException);
        }
        return TransportFailureKind.GENERIC_FAILURE;
    }

    private static TransportFailureKind classifyHttpStatus(FeignException exception) {
        int status = exception.status();
        if (status == 429) {
            return TransportFailureKind.RATE_LIMIT;
        }
        if (status == 408 || status == 504) {
            return TransportFailureKind.TIMEOUT;
        }
        if (status == 400 || status == 413 || status == 422) {
            TransportFailureKind byBody = classifyFromMessage(responseBody(exception));
            if (byBody == TransportFailureKind.CONTEXT_LENGTH_EXCEEDED) {
                return byBody;
            }
        }
        return TransportFailureKind.GENERIC_FAILURE;
    }

    private static String messageOf(Throwable throwable) {
        if (throwable instanceof FeignException feignException) {
            String body = responseBody(feignException);
            return body != null ? throwable.getMessage() + " " + body : throwable.getMessage();
        }
        return throwable.getMessage();
    }

    private static FeignException findFeignException(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            if (current instanceof FeignException feignException) {
                return feignException;
            }
            current = current.getCause();
        }
        return null;
    }

    private static String responseBody(FeignException exception) {
        String body = exception.contentUTF8();
        return body == null || body.isBlank() ? null : body;
    }

    private static String truncate(String text) {
        return text.length() > MAX_BODY_LENGTH ? text.substring(0, MAX_BODY_LENGTH) + "..." : text;
    }
}
