package me.golemcore.oracle.domain.system.divination;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.oracle.domain.model.StepTerminationException;
import me.golemcore.oracle.domain.model.ToolExecutionException;
import me.golemcore.oracle.domain.model.ToolFailureType;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a tool invocation with a timeout and a bounded number of retries.
 *
 * <p>
 * Each attempt runs on the sandbox pool and is cancelled when it exceeds the
 * timeout. Failed attempts are retried after an exponential backoff
 * ({@code backoff * 2^attempt}). A {@link StepTerminationException} is never
 * retried and leaves unchanged; anything else surfaces as a
 * {@link ToolExecutionException} once the retries are used up.
 */
@Slf4j
public class ExecutionSandbox {

    private final ExecutorService executor;
    private final Duration retryBackoff;
    private final int maxMessageLength;

    public ExecutionSandbox(ExecutorService executor, Duration retryBackoff, int maxMessageLength) {
        this.executor = executor;
        this.retryBackoff = retryBackoff;
        this.maxMessageLength = maxMessageLength;
    }

    public <T> T execute(String label, Callable<T> action, int maxRetries, Duration timeout) {
        int attempt = 0;
        while (true) {
            attempt++;
            Throwable failure;
            Future<T> future = executor.submit(action);
            try {
                return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                failure = new TimeoutException(label + " timed out after " + timeout.toMillis() + " ms");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof StepTerminationException stepTermination) {
                    throw stepTermination;
                }
                failure = cause;
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new ToolExecutionException(ToolFailureType.TOOL_EXECUTION, label + " interrupted", attempt, e);
            }

            ToolFailureType type = classify(failure);
            String message = truncate(failure.getMessage() != null ? failure.getMessage()
                    : failure.getClass().getSimpleName());
            if (attempt > maxRetries) {
                log.error("[Sandbox] {} failed after {} attempts: {}", label, attempt, message);
                throw new ToolExecutionException(type, message, attempt, failure);
            }

            Duration delay = retryBackoff.multipliedBy(1L << attempt);
            log.warn("[Sandbox] {} failed ({}: {}), retry {}/{} in {} ms", label, type.label(), message, attempt,
                    maxRetries, delay.toMillis());
            pause(label, delay, attempt, failure);
        }
    }

    static ToolFailureType classify(Throwable failure) {
        if (failure instanceof TimeoutException) {
            return ToolFailureType.TIMEOUT;
        }
        if (failure instanceof JsonProcessingException) {
            return ToolFailureType.PARSE_ERROR;
        }
        String message = failure.getMessage() != null ? failure.getMessage().toLowerCase(Locale.ROOT) : "";
        if (message.contains("rate limit") || message.contains("rate_limit") || message.contains("429")) {
            return ToolFailureType.RATE_LIMIT;
        }
        if (message.contains("context length") || message.contains("maximum context")) {
            return ToolFailureType.CONTEXT_LENGTH;
        }
        if (failure instanceof IOException) {
            return ToolFailureType.NETWORK;
        }
        return ToolFailureType.TOOL_EXECUTION;
    }

    private void pause(String label, Duration delay, int attempt, Throwable failure) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ToolExecutionException interrupted = new ToolExecutionException(ToolFailureType.TOOL_EXECUTION,
                    label + " interrupted while waiting to retry", attempt, e);
            interrupted.addSuppressed(failure);
            throw interrupted;
        }
    }

    private String truncate(String message) {
        if (message.length() <= maxMessageLength) {
            return message;
        }
        return message.substring(0, maxMessageLength) + "...";
    }
}
