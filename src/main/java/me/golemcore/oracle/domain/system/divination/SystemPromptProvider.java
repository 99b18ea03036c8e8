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

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads the standard and reasoning system prompts once, at construction.
 */
@Slf4j
public class SystemPromptProvider {

    static final String DEFAULT_SYSTEM_PROMPT = "You are the oracle, a careful software engineering assistant. "
            + "Use the available tools to inspect and change the project, then answer concisely.";
    static final String DEFAULT_REASONING_PROMPT = "You are the oracle in reasoning mode. No tools are available. "
            + "Think the problem through and give a complete, well-reasoned answer.";

    private final String systemPrompt;
    private final String reasoningPrompt;

    public SystemPromptProvider(ResourceLoader resourceLoader, String systemPromptPath, String reasoningPromptPath) {
        this.systemPrompt = load(resourceLoader, systemPromptPath, DEFAULT_SYSTEM_PROMPT);
        this.reasoningPrompt = load(resourceLoader, reasoningPromptPath, DEFAULT_REASONING_PROMPT);
    }

    public SystemPromptProvider(String systemPrompt, String reasoningPrompt) {
        this.systemPrompt = systemPrompt;
        this.reasoningPrompt = reasoningPrompt;
    }

    public String promptFor(boolean reasoning) {
        return reasoning ? reasoningPrompt : systemPrompt;
    }

    private static String load(ResourceLoader resourceLoader, String location, String fallback) {
        if (location == null || location.isBlank()) {
            return fallback;
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("[Divination] Prompt resource not found: {}, using built-in prompt", location);
            return fallback;
        }
        try {
            String text = resource.getContentAsString(StandardCharsets.UTF_8).strip();
            return text.isEmpty() ? fallback : text;
        } catch (IOException e) {
            log.warn("[Divination] Failed to read prompt {}: {}", location, e.getMessage());
            return fallback;
        }
    }
}
