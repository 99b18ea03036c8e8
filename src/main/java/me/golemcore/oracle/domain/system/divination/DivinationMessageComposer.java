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
import me.golemcore.oracle.domain.model.ExtraContext;
import me.golemcore.oracle.domain.model.Message;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the initial message list of a divination attempt.
 *
 * <p>
 * Order: system prompt for the mode, history, manifest, extra context, the
 * one-shot briefing (standard mode only), then the user prompt or the caller's
 * custom messages. The list is rebuilt from the session for every attempt, so
 * a restarted attempt sends exactly what the first one sent.
 */
@Slf4j
public class DivinationMessageComposer {

    static final String CONTEXT_PREFIX = "Context: ";

    private final SystemPromptProvider promptProvider;
    private final ObjectMapper objectMapper;
    private final String briefing;

    public DivinationMessageComposer(SystemPromptProvider promptProvider, ObjectMapper objectMapper,
            String briefing) {
        this.promptProvider = promptProvider;
        this.objectMapper = objectMapper;
        this.briefing = briefing;
    }

    public List<Message> compose(DivinationSession session) {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system(promptProvider.promptFor(session.isReasoning())));
        messages.addAll(session.getContext().history());

        ExtraContext extra = session.getContext().extraContext();
        if (extra != null) {
            if (extra.getManifest() != null && !extra.getManifest().isBlank()) {
                messages.add(Message.system(extra.getManifest()));
            }
            renderContext(extra).ifPresent(text -> messages.add(Message.system(text)));
        }

        if (!session.isReasoning() && briefing != null && !briefing.isBlank()) {
            messages.add(Message.system(briefing));
        }

        if (session.hasCustomMessages()) {
            messages.addAll(session.getCustomMessages());
        } else {
            messages.add(Message.user(session.getPrompt() != null ? session.getPrompt() : ""));
        }
        return messages;
    }

    private Optional<String> renderContext(ExtraContext extra) {
        try {
            return Optional.of(CONTEXT_PREFIX + objectMapper.writeValueAsString(extra));
        } catch (JsonProcessingException e) {
            log.warn("[Context] Failed to serialize extra context: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
