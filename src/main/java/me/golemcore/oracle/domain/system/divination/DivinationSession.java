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

import lombok.Builder;
import lombok.Getter;
import me.golemcore.oracle.domain.model.AssembledContext;
import me.golemcore.oracle.domain.model.Message;
import me.golemcore.oracle.domain.model.ToolDefinition;
import me.golemcore.oracle.port.outbound.ToolDispatcher;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * State owned by one divination: its inputs, its mode and its reminder queue.
 * Sessions are never shared between loop runs.
 */
@Getter
public class DivinationSession {

    private final String sessionId;
    private final String prompt;
    private final List<Message> customMessages;
    private final AssembledContext context;
    private final List<ToolDefinition> tools;
    private final ToolDispatcher dispatcher;
    private final boolean reasoning;
    private final Double temperatureOverride;
    private final Integer maxDepth;
    private final Map<String, Object> callerContext;
    private final List<String> reminders;

    private final Deque<String> pendingReminders;

    @Builder
    private DivinationSession(String sessionId, String prompt, List<Message> customMessages,
            AssembledContext context, List<ToolDefinition> tools, ToolDispatcher dispatcher, boolean reasoning,
            Double temperatureOverride, Integer maxDepth, Map<String, Object> callerContext,
            List<String> reminders) {
        this.sessionId = sessionId != null ? sessionId : UUID.randomUUID().toString();
        this.prompt = prompt;
        this.customMessages = customMessages != null ? List.copyOf(customMessages) : List.of();
        this.context = context != null ? context : AssembledContext.empty();
        this.tools = tools != null ? List.copyOf(tools) : List.of();
        this.dispatcher = dispatcher;
        this.reasoning = reasoning;
        this.temperatureOverride = temperatureOverride;
        this.maxDepth = maxDepth;
        this.callerContext = callerContext != null ? new LinkedHashMap<>(callerContext) : new LinkedHashMap<>();
        this.reminders = reminders != null ? List.copyOf(reminders) : List.of();
        this.pendingReminders = new ArrayDeque<>(this.reminders);
    }

    /**
     * Takes the next reminder, if any is left.
     */
    public Optional<String> pollReminder() {
        return Optional.ofNullable(pendingReminders.pollFirst());
    }

    public int remainingReminders() {
        return pendingReminders.size();
    }

    /**
     * Puts every reminder back, for a restarted attempt.
     */
    void resetReminders() {
        pendingReminders.clear();
        pendingReminders.addAll(reminders);
    }

    boolean hasCustomMessages() {
        return !customMessages.isEmpty();
    }
}
