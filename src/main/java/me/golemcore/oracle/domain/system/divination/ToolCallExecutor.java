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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.oracle.domain.model.InterruptMarker;
import me.golemcore.oracle.domain.model.Message;
import me.golemcore.oracle.domain.model.StepTerminationException;
import me.golemcore.oracle.domain.model.ToolResultRecord;
import me.golemcore.oracle.port.outbound.ToolDispatcher;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Executes normalized tool calls through the sandbox and appends a tool message
 * and a result record for each of them.
 *
 * <p>
 * Structured calls get the standard timeout, calls recovered from free text get
 * the shorter fallback timeout. Execution of a batch stops at the first result
 * that carries an interruption marker.
 */
@Slf4j
public class ToolCallExecutor {

    private final ExecutionSandbox sandbox;
    private final ObjectMapper objectMapper;
    private final int maxRetries;
    private final Duration standardTimeout;
    private final Duration fallbackTimeout;

    public ToolCallExecutor(ExecutionSandbox sandbox, ObjectMapper objectMapper, int maxRetries,
            Duration standardTimeout, Duration fallbackTimeout) {
        this.sandbox = sandbox;
        this.objectMapper = objectMapper;
        this.maxRetries = maxRetries;
        this.standardTimeout = standardTimeout;
        this.fallbackTimeout = fallbackTimeout;
    }

    public Optional<InterruptMarker> executeBatch(List<Message.ToolCall> calls, boolean fallback,
            List<Message> messages, List<ToolResultRecord> results, DivinationSession session) {
        for (Message.ToolCall call : calls) {
            Optional<InterruptMarker> marker = fallback
                    ? executeFallback(call, messages, results, session)
                    : executeStandard(call, messages, results, session);
            if (marker.isPresent()) {
                return marker;
            }
        }
        return Optional.empty();
    }

    public Optional<InterruptMarker> executeStandard(Message.ToolCall call, List<Message> messages,
            List<ToolResultRecord> results, DivinationSession session) {
        return execute(call, standardTimeout, messages, results, session);
    }

    public Optional<InterruptMarker> executeFallback(Message.ToolCall call, List<Message> messages,
            List<ToolResultRecord> results, DivinationSession session) {
        return execute(call, fallbackTimeout, messages, results, session);
    }

    private Optional<InterruptMarker> execute(Message.ToolCall call, Duration timeout, List<Message> messages,
            List<ToolResultRecord> results, DivinationSession session) {
        ToolDispatcher dispatcher = session.getDispatcher();
        if (dispatcher == null) {
            throw new IllegalStateException("No tool dispatcher configured for session " + session.getSessionId());
        }
        ToolDispatcher.Invocation invocation = new ToolDispatcher.Invocation(session.getSessionId(), results,
                session.getCallerContext());

        log.debug("[Tools] Executing {} ({})", call.getName(), call.getId());
        Object result;
        try {
            result = sandbox.execute(call.getName(),
                    () -> dispatcher.dispatch(call.getName(), call.getArguments(), invocation),
                    maxRetries, timeout);
        } catch (StepTerminationException e) {
            result = e.getMarker().raw();
        }

        messages.add(Message.tool(call.getId(), call.getName(), render(result)));
        results.add(new ToolResultRecord(call.getId(), call.getName(), result));

        Optional<InterruptMarker> marker = InterruptMarker.detect(result);
        marker.ifPresent(m -> log.info("[Tools] {} interrupted the divination: {}", call.getName(), m.kind()));
        return marker;
    }

    String render(Object result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.warn("[Tools] Failed to serialize tool result: {}", e.getMessage());
            return String.valueOf(result);
        }
    }
}
