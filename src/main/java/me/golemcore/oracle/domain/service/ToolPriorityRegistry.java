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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.oracle.domain.model.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Declared history priority of every tool seen by this process. Unknown tools
 * get {@link ToolDefinition#DEFAULT_HISTORY_PRIORITY}.
 */
@Component
@Slf4j
public class ToolPriorityRegistry {

    private final Map<String, Integer> priorities = new ConcurrentHashMap<>();

    public void registerAll(Collection<ToolDefinition> definitions) {
        if (definitions == null) {
            return;
        }
        for (ToolDefinition definition : definitions) {
            register(definition.getName(), definition.getHistoryPriority());
        }
    }

    public void register(String toolName, int priority) {
        if (toolName == null || toolName.isBlank()) {
            return;
        }
        Integer previous = priorities.put(toolName, priority);
        if (previous != null && previous != priority) {
            log.debug("[Tools] History priority of {} changed {} -> {}", toolName, previous, priority);
        }
    }

    public int priorityOf(String toolName) {
        if (toolName == null) {
            return ToolDefinition.DEFAULT_HISTORY_PRIORITY;
        }
        return priorities.getOrDefault(toolName, ToolDefinition.DEFAULT_HISTORY_PRIORITY);
    }
}
