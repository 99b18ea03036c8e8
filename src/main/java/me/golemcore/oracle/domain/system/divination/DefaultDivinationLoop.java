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

import me.golemcore.oracle.domain.model.DivinationArtifacts;
import me.golemcore.oracle.domain.model.DivinationResult;
import me.golemcore.oracle.domain.model.InterruptMarker;
import me.golemcore.oracle.domain.model.LlmRequest;
import me.golemcore.oracle.domain.model.LlmResponse;
import me.golemcore.oracle.domain.model.Message;
import me.golemcore.oracle.domain.model.OracleStatus;
import me.golemcore.oracle.domain.model.ToolExecutionException;
import me.golemcore.oracle.domain.model.ToolResultRecord;
import me.golemcore.oracle.domain.model.TransportException;
import me.golemcore.oracle.infrastructure.config.OracleProperties;
import me.golemcore.oracle.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.function.DoubleSupplier;

/**
 * Divination loop orchestrator.
 *
 * <p>
 * One attempt: compose messages once, then per turn call the model, append the
 * assistant message, and either execute the requested tools (structured calls
 * first, fenced json blocks as fallback), inject the next reminder, or accept
 * the content as the answer. A tool result carrying an interruption marker
 * ends the attempt at once.
 *
 * <p>
 * When the shared sampling temperature drifts past the threshold between turns
 * the attempt is discarded and a new one starts from turn 1 with the same
 * session inputs, up to {@code maxRestarts} times.
 */
public class DefaultDivinationLoop implements DivinationLoop {

    private static final Logger log = LoggerFactory.getLogger(DefaultDivinationLoop.class);

    private final LlmPort llmPort;
    private final ToolCallNormalizer normalizer;
    private final ToolCallExecutor executor;
    private final DivinationMessageComposer composer;
    private final DoubleSupplier temperatureSource;
    private final OracleProperties.LoopProperties settings;

    public DefaultDivinationLoop(LlmPort llmPort, ToolCallNormalizer normalizer, ToolCallExecutor executor,
            DivinationMessageComposer composer, DoubleSupplier temperatureSource,
            OracleProperties.LoopProperties settings) {
        this.llmPort = llmPort;
        this.normalizer = normalizer;
        this.executor = executor;
        this.composer = composer;
        this.temperatureSource = temperatureSource;
        this.settings = settings;
    }

    @Override
    public DivinationResult divine(DivinationSession session) {
        int restarts = 0;
        while (true) {
            DivinationArtifacts artifacts = new DivinationArtifacts();
            List<ToolResultRecord> results = new ArrayList<>();
            boolean restartAllowed = restarts < settings.getMaxRestarts();
            DivinationAttempt attempt;
            try {
                attempt = attempt(session, artifacts, results, restartAllowed);
            } catch (ToolExecutionException e) {
                log.warn("[Divination] Session {} aborted by tool failure: {}", session.getSessionId(),
                        e.getMessage());
                return new DivinationResult.Failed(OracleStatus.TOOL_EXECUTION_FAILURE, e.getMessage(),
                        backtrace(e), artifacts, results);
            } catch (RuntimeException e) {
                log.error("[Divination] Session {} failed unexpectedly", session.getSessionId(), e);
                return new DivinationResult.Failed(OracleStatus.FAILURE, describe(e), backtrace(e), artifacts,
                        results);
            }

            if (attempt instanceof DivinationAttempt.Completed completed) {
                return completed.result();
            }
            DivinationAttempt.Restart restart = (DivinationAttempt.Restart) attempt;
            restarts++;
            session.resetReminders();
            log.info("[Divination] Restarting session {} ({}/{}): {}", session.getSessionId(), restarts,
                    settings.getMaxRestarts(), restart.reason());
        }
    }

    private DivinationAttempt attempt(DivinationSession session, DivinationArtifacts artifacts,
            List<ToolResultRecord> results, boolean restartAllowed) {
        List<Message> messages = composer.compose(session);
        int maxDepth = session.getMaxDepth() != null ? session.getMaxDepth() : settings.getMaxDepth();
        double initialTemperature = temperatureSource.getAsDouble();
        String lastContent = null;

        for (int turn = 1; turn <= maxDepth; turn++) {
            if (restartAllowed && session.getTemperatureOverride() == null) {
                double current = temperatureSource.getAsDouble();
                if (Math.abs(current - initialTemperature) > settings.getTemperatureDeltaThreshold()) {
                    return new DivinationAttempt.Restart(
                            "temperature changed from " + initialTemperature + " to " + current);
                }
            }

            LlmResponse response;
            try {
                response = callModel(session, messages);
            } catch (TransportException e) {
                log.warn("[Divination] Transport failure on turn {} ({}): {}", turn, e.getKind(), e.getMessage());
                return new DivinationAttempt.Completed(new DivinationResult.Failed(e.getKind().toStatus(),
                        e.getMessage(), backtrace(e), artifacts, results));
            }

            String content = response.getContent();
            lastContent = content;
            artifacts.addPrelude(content);
            artifacts.addReasoning(response.getReasoningContent());

            if (session.isReasoning()) {
                messages.add(Message.assistant(content));
                log.debug("[Divination] Reasoning answer accepted on turn {}", turn);
                return answered(content, artifacts, results, turn);
            }

            List<Message.ToolCall> calls = normalizer.normalizeAll(response.getRawToolCalls());
            boolean fallback = false;
            if (calls.isEmpty()) {
                calls = normalizer.extractFromContent(content);
                fallback = !calls.isEmpty();
                if (fallback) {
                    artifacts.getFallbackTools().addAll(calls);
                    log.debug("[Divination] Recovered {} fallback tool calls from content", calls.size());
                }
            }
            messages.add(Message.builder()
                    .role(Message.ROLE_ASSISTANT)
                    .content(content)
                    .toolCalls(calls.isEmpty() ? null : new ArrayList<>(calls))
                    .build());

            if (!calls.isEmpty()) {
                log.debug("[Divination] Turn {}: executing {} tool calls", turn, calls.size());
                Optional<InterruptMarker> marker = executor.executeBatch(calls, fallback, messages, results,
                        session);
                if (marker.isPresent()) {
                    return new DivinationAttempt.Completed(
                            new DivinationResult.Interrupted(marker.get(), artifacts, results, turn));
                }
                continue;
            }

            Optional<String> reminder = session.pollReminder();
            if (reminder.isPresent()) {
                log.debug("[Divination] Turn {}: injecting reminder, {} left", turn, session.remainingReminders());
                messages.add(Message.system(reminder.get()));
                continue;
            }
            return answered(content, artifacts, results, turn);
        }

        log.warn("[Divination] Session {} reached max depth {}", session.getSessionId(), maxDepth);
        return answered(lastContent, artifacts, results, maxDepth);
    }

    private LlmResponse callModel(DivinationSession session, List<Message> messages) {
        LlmRequest request = LlmRequest.builder()
                .messages(new ArrayList<>(messages))
                .tools(session.isReasoning() ? new ArrayList<>() : new ArrayList<>(session.getTools()))
                .reasoning(session.isReasoning())
                .temperature(session.getTemperatureOverride())
                .build();
        try {
            LlmResponse response = llmPort.chat(request).get();
            return response != null ? response : LlmResponse.builder().build();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TransportException transport) {
                throw transport;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(describe(cause), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Divination cancelled", e);
        }
    }

    private DivinationAttempt answered(String content, DivinationArtifacts artifacts, List<ToolResultRecord> results,
            int turns) {
        String answer = content == null || content.isBlank() ? settings.getEmptySentinel() : content;
        return new DivinationAttempt.Completed(new DivinationResult.Answered(answer, artifacts, results, turns));
    }

    private String backtrace(Throwable error) {
        StackTraceElement[] frames = error.getStackTrace();
        int limit = Math.min(frames.length, settings.getMaxBacktraceLines());
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < limit; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(frames[i]);
        }
        return sb.toString();
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
