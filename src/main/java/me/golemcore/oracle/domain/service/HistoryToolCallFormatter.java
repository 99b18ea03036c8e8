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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.oracle.domain.model.ToolCallRecord;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Renders the tool calls of a past exchange for inclusion in history. The
 * older the exchange, the less of each call survives: limits decay with
 * {@code exp(-index)} and grow with the tool's declared priority.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HistoryToolCallFormatter {

    public static final String BEGIN_MARKER = "=== BEGIN TOOL HISTORY ===";
    public static final String END_MARKER = "=== END TOOL HISTORY ===";
    static final String RESULT_OMITTED = " # result omitted";

    private static final int MIN_ARGS_LIMIT = 20;
    private static final int MIN_RESULT_LIMIT = 30;
    private static final double MOST_RECENT_BONUS = 1.5;

    private final ToolPriorityRegistry priorityRegistry;
    private final ObjectMapper objectMapper;

    /**
     * @param toolCalls
     *            calls of one history entry
     * @param index
     *            distance of the entry from the present, 0 for the most recent
     * @return the rendered block, or an empty string when there are no calls
     */
    public String format(List<ToolCallRecord> toolCalls, int index) {
        if (toolCalls == null || toolCalls.isEmpty()) {
            return "";
        }
        int count = toolCalls.size();
        double basePriority = Math.exp(-index) * 3;
        double density = Math.max(1.0, count / 5.0);

        StringBuilder sb = new StringBuilder(BEGIN_MARKER).append('\n');
        for (int i = 0; i < count; i++) {
            ToolCallRecord call = toolCalls.get(i);
            int priority = priorityRegistry.priorityOf(call.toolName());
            double positionFactor = index == 0 ? 1 + ((double) i / count) * 0.5 : 1;
            double combined = (basePriority + priority) * positionFactor / density;
            Limits limits = Limits.forPriority(priority, combined);
            if (index == 0) {
                limits = limits.scale(MOST_RECENT_BONUS);
            }
            appendCall(sb, call, limits);
        }
        sb.append(END_MARKER);
        return sb.toString();
    }

    private void appendCall(StringBuilder sb, ToolCallRecord call, Limits limits) {
        String name = call.toolName() != null ? call.toolName() : "unknown";
        sb.append("- ").append(name);
        Map<String, Object> args = call.getRequest() != null ? call.getRequest().getArgs() : null;
        if (limits.args() > MIN_ARGS_LIMIT && args != null && !args.isEmpty()) {
            sb.append(' ').append(TextTruncationSupport.truncateMiddle(toJson(args), limits.args()));
        }
        if (limits.result() > MIN_RESULT_LIMIT && call.getResult() != null) {
            sb.append("\n  => ").append(TextTruncationSupport.truncateMiddle(toJson(call.getResult()),
                    limits.result()));
        } else {
            sb.append(RESULT_OMITTED);
        }
        if (limits.content() > 0 && call.getContent() != null && !call.getContent().isBlank()) {
            sb.append("\n  ").append(TextTruncationSupport.truncateMiddle(call.getContent(), limits.content()));
        }
        sb.append('\n');
    }

    private String toJson(Object value) {
        if (value instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("[Context] Tool history value is not serializable: {}", e.getMessage());
            return String.valueOf(value);
        }
    }

    record Limits(int args, int result, int content) {

        static Limits forPriority(int priority, double combined) {
            if (priority == 1) {
                return floored(50, 25, 0, 50, 50, 25, combined);
            }
            if (priority >= 2 && priority <= 4) {
                return floored(100, 50, 200, 100, 100, 50, combined);
            }
            if (priority >= 5 && priority <= 9) {
                return floored(200, 100, 400, 200, 200, 100, combined);
            }
            if (priority >= 10) {
                return floored(500, 200, 1000, 400, 500, 200, combined);
            }
            return new Limits(50, 0, 100);
        }

        // each limit is the larger of its floor and the scaled priority
        private static Limits floored(int argsFloor, int argsRate, int resultFloor, int resultRate, int contentFloor,
                int contentRate, double combined) {
            return new Limits(Math.max(argsFloor, (int) (combined * argsRate)),
                    Math.max(resultFloor, (int) (combined * resultRate)),
                    Math.max(contentFloor, (int) (combined * contentRate)));
        }

        Limits scale(double factor) {
            return of(args * factor, result * factor, content * factor);
        }

        private static Limits of(double args, double result, double content) {
            return new Limits((int) args, (int) result, (int) content);
        }
    }
}
