package me.golemcore.oracle.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.oracle.domain.model.AssembledContext;
import me.golemcore.oracle.domain.model.Attachment;
import me.golemcore.oracle.domain.model.ConversationEntry;
import me.golemcore.oracle.domain.model.DivinationArtifacts;
import me.golemcore.oracle.domain.model.DivinationResult;
import me.golemcore.oracle.domain.model.OracleRequest;
import me.golemcore.oracle.domain.model.OracleResponse;
import me.golemcore.oracle.domain.model.OracleStatus;
import me.golemcore.oracle.domain.model.ToolCallRecord;
import me.golemcore.oracle.domain.model.ToolDefinition;
import me.golemcore.oracle.domain.model.ToolResultRecord;
import me.golemcore.oracle.domain.system.divination.DivinationLoop;
import me.golemcore.oracle.domain.system.divination.DivinationSession;
import me.golemcore.oracle.port.outbound.ToolDispatcher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Top-level caller of the divination loop.
 *
 * <p>
 * A consultation assembles the context, runs one divination, records the
 * exchange when asked to, and maps the loop outcome to an
 * {@link OracleResponse}. Nothing thrown below this service reaches the
 * caller: failures become a status tag plus a capped message, and stack traces
 * go to the log only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OracleService {

    private final ContextAssemblyService contextAssemblyService;
    private final ConversationHistoryService historyService;
    private final ToolPriorityRegistry priorityRegistry;
    private final DivinationLoop divinationLoop;
    private final Clock clock;

    public OracleResponse consult(OracleRequest request, List<ToolDefinition> tools, ToolDispatcher dispatcher) {
        return consult(UUID.randomUUID().toString(), request, tools, dispatcher);
    }

    public OracleResponse consult(String sessionId, OracleRequest request, List<ToolDefinition> tools,
            ToolDispatcher dispatcher) {
        Instant started = clock.instant();
        List<ToolDefinition> definitions = tools != null ? tools : List.of();
        priorityRegistry.registerAll(definitions);
        ArgumentCapture capture = new ArgumentCapture(dispatcher);

        DivinationResult result;
        try {
            AssembledContext context = contextAssemblyService.build(request);
            DivinationSession session = DivinationSession.builder()
                    .sessionId(sessionId)
                    .prompt(request.getPrompt())
                    .customMessages(request.getCustomMessages())
                    .context(context)
                    .tools(definitions)
                    .dispatcher(capture)
                    .reasoning(request.isReasoning())
                    .temperatureOverride(request.getTemperature())
                    .maxDepth(request.getMaxDepth())
                    .callerContext(request.getCallerContext())
                    .reminders(request.getReminders())
                    .build();
            log.info("[Oracle] Consulting session {} ({} mode, {} tools)", sessionId,
                    request.isReasoning() ? "reasoning" : "standard", definitions.size());
            result = divinationLoop.divine(session);
        } catch (RuntimeException e) {
            log.error("[Oracle] Consultation {} failed before the loop completed", sessionId, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            result = new DivinationResult.Failed(OracleStatus.FAILURE, message, null, new DivinationArtifacts(),
                    List.of());
        }

        double executionTime = Duration.between(started, clock.instant()).toMillis() / 1000.0;
        OracleResponse response = toResponse(result, executionTime);
        if (request.isRecord() && !(result instanceof DivinationResult.Interrupted)) {
            response.setEntryId(record(request, result, capture, executionTime));
        }
        log.info("[Oracle] Session {} finished: {} in {}s", sessionId, response.getStatusTag(), executionTime);
        return response;
    }

    private OracleResponse toResponse(DivinationResult result, double executionTime) {
        OracleResponse.OracleResponseBuilder builder = OracleResponse.builder()
                .artifacts(result.artifacts())
                .toolResults(new ArrayList<>(result.toolResults()))
                .executionTime(executionTime);

        if (result instanceof DivinationResult.Answered answered) {
            return builder.status(OracleStatus.SUCCESS)
                    .answer(answered.answer())
                    .message("Answered in " + answered.turns() + " turn(s)")
                    .build();
        }
        if (result instanceof DivinationResult.Interrupted interrupted) {
            return builder.status(OracleStatus.INTERRUPTED)
                    .interrupt(interrupted.marker())
                    .message(capMessage("Interrupted by tool: " + interrupted.marker().kind()))
                    .build();
        }
        DivinationResult.Failed failed = (DivinationResult.Failed) result;
        if (failed.backtrace() != null && !failed.backtrace().isBlank()) {
            log.debug("[Oracle] Failure backtrace:\n{}", failed.backtrace());
        }
        return builder.status(failed.status())
                .message(capMessage(failed.message()))
                .build();
    }

    private Long record(OracleRequest request, DivinationResult result, ArgumentCapture capture,
            double executionTime) {
        String answer;
        if (result instanceof DivinationResult.Answered answered) {
            answer = answered.answer();
        } else {
            answer = "Error: " + ((DivinationResult.Failed) result).message();
        }
        Attachment first = request.getAttachments() != null && !request.getAttachments().isEmpty()
                ? request.getAttachments().get(0)
                : null;

        ConversationEntry draft = ConversationEntry.builder()
                .prompt(request.getPrompt())
                .answer(answer)
                .tags(request.getTags() != null ? String.join(",", request.getTags()) : null)
                .file(first != null ? first.getFile() : null)
                .selection(first != null ? first.getSelection() : null)
                .executionTime(executionTime)
                .toolCalls(toToolCallRecords(result.toolResults(), capture))
                .build();
        try {
            return historyService.recordEntry(draft);
        } catch (RuntimeException e) {
            log.error("[Oracle] Failed to record conversation entry", e);
            return null;
        }
    }

    private List<ToolCallRecord> toToolCallRecords(List<ToolResultRecord> results, ArgumentCapture capture) {
        List<ToolCallRecord> records = new ArrayList<>(results.size());
        for (int i = 0; i < results.size(); i++) {
            ToolResultRecord result = results.get(i);
            Map<String, Object> args = capture.argumentsAt(i);
            records.add(ToolCallRecord.builder()
                    .request(ToolCallRecord.Request.builder()
                            .tool(result.name())
                            .args(args != null ? new LinkedHashMap<>(args) : new LinkedHashMap<>())
                            .build())
                    .result(result.result())
                    .build());
        }
        return records;
    }

    static String capMessage(String message) {
        if (message == null) {
            return null;
        }
        if (message.length() <= OracleResponse.MAX_MESSAGE_LENGTH) {
            return message;
        }
        return TextTruncationSupport.truncateEnd(message, OracleResponse.MAX_MESSAGE_LENGTH);
    }

    /**
     * Remembers the arguments of each dispatched call by its position in the
     * result list, so the recorded entry can show what every tool was asked.
     */
    private static final class ArgumentCapture implements ToolDispatcher {

        private final ToolDispatcher delegate;
        private final Map<Integer, Map<String, Object>> arguments = new ConcurrentHashMap<>();

        private ArgumentCapture(ToolDispatcher delegate) {
            this.delegate = delegate;
        }

        @Override
        public Object dispatch(String toolName, Map<String, Object> args, Invocation invocation) throws Exception {
            if (delegate == null) {
                throw new IllegalStateException("No tool dispatcher supplied for tool " + toolName);
            }
            if (args != null) {
                arguments.put(invocation.previousResults().size(), args);
            }
            return delegate.dispatch(toolName, args, invocation);
        }

        private Map<String, Object> argumentsAt(int index) {
            return arguments.get(index);
        }
    }
}
