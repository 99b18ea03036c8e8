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
import me.golemcore.oracle.domain.model.ToolCallRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shrinks tool calls before they are persisted. The length tier is chosen by
 * the declared priority of the tool that was called; nested maps get half of
 * their parent's limit and strings inside lists a third.
 */
@Component
@RequiredArgsConstructor
public class ToolCallStorageTruncator {

    static final int MINIMAL_LIMIT = 300;
    static final int STANDARD_LIMIT = 600;
    static final int GENEROUS_LIMIT = 1200;
    static final int FULL_LIMIT = 3000;

    private final ToolPriorityRegistry priorityRegistry;

    public List<ToolCallRecord> truncate(List<ToolCallRecord> toolCalls) {
        if (toolCalls == null || toolCalls.isEmpty()) {
            return new ArrayList<>();
        }
        List<ToolCallRecord> truncated = new ArrayList<>(toolCalls.size());
        for (ToolCallRecord call : toolCalls) {
            truncated.add(truncateCall(call));
        }
        return truncated;
    }

    ToolCallRecord truncateCall(ToolCallRecord call) {
        int limit = limitForPriority(priorityRegistry.priorityOf(call.toolName()));
        ToolCallRecord.Request request = call.getRequest();
        ToolCallRecord.Request truncatedRequest = null;
        if (request != null) {
            // args live one level below the request
            truncatedRequest = ToolCallRecord.Request.builder()
                    .tool(TextTruncationSupport.truncateEnd(request.getTool(), limit))
                    .args(truncateMap(request.getArgs(), limit / 2))
                    .build();
        }
        return ToolCallRecord.builder()
                .request(truncatedRequest)
                .result(truncateValue(call.getResult(), limit))
                .content(TextTruncationSupport.truncateEnd(call.getContent(), limit))
                .build();
    }

    static int limitForPriority(int priority) {
        if (priority <= 1) {
            return MINIMAL_LIMIT;
        }
        if (priority <= 4) {
            return STANDARD_LIMIT;
        }
        if (priority <= 9) {
            return GENEROUS_LIMIT;
        }
        return FULL_LIMIT;
    }

    static Object truncateValue(Object value, int limit) {
        if (value instanceof String text) {
            return TextTruncationSupport.truncateEnd(text, limit);
        }
        if (value instanceof Map<?, ?> map) {
            return truncateMap(map, limit);
        }
        if (value instanceof List<?> list) {
            return truncateList(list, limit / 3);
        }
        return value;
    }

    static Map<String, Object> truncateMap(Map<?, ?> map, int limit) {
        Map<String, Object> truncated = new LinkedHashMap<>();
        if (map == null) {
            return truncated;
        }
        map.forEach((key, value) -> {
            Object shrunk;
            if (value instanceof Map<?, ?> nested) {
                shrunk = truncateMap(nested, limit / 2);
            } else if (value instanceof List<?> list) {
                shrunk = truncateList(list, limit / 3);
            } else if (value instanceof String text) {
                shrunk = TextTruncationSupport.truncateEnd(text, limit);
            } else {
                shrunk = value;
            }
            truncated.put(String.valueOf(key), shrunk);
        });
        return truncated;
    }

    private static List<Object> truncateList(List<?> list, int limit) {
        List<Object> truncated = new ArrayList<>(list.size());
        for (Object element : list) {
            if (element instanceof String text) {
                truncated.add(TextTruncationSupport.truncateEnd(text, limit));
            } else if (element instanceof Map<?, ?> nested) {
                truncated.add(truncateMap(nested, limit));
            } else {
                truncated.add(element);
            }
        }
        return truncated;
    }
}
