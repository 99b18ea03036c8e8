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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.oracle.domain.service.AegisService;
import me.golemcore.oracle.infrastructure.config.OracleProperties;
import me.golemcore.oracle.port.outbound.LlmPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.util.concurrent.ExecutorService;

/** Spring wiring for the divination loop (domain orchestrator + ports). */
@Configuration
public class DivinationConfiguration {

    @Bean
    public ToolCallNormalizer toolCallNormalizer(ObjectMapper objectMapper) {
        return new ToolCallNormalizer(objectMapper);
    }

    @Bean
    public ExecutionSandbox executionSandbox(@Qualifier("toolSandboxExecutor") ExecutorService executor,
            OracleProperties properties) {
        OracleProperties.ToolsProperties tools = properties.getTools();
        return new ExecutionSandbox(executor, tools.getRetryBackoff(), tools.getMaxErrorMessageLength());
    }

    @Bean
    public ToolCallExecutor toolCallExecutor(ExecutionSandbox sandbox, ObjectMapper objectMapper,
            OracleProperties properties) {
        OracleProperties.ToolsProperties tools = properties.getTools();
        return new ToolCallExecutor(sandbox, objectMapper, tools.getMaxRetries(), tools.getStandardTimeout(),
                tools.getFallbackTimeout());
    }

    @Bean
    public SystemPromptProvider systemPromptProvider(ResourceLoader resourceLoader, OracleProperties properties) {
        OracleProperties.LoopProperties loop = properties.getLoop();
        return new SystemPromptProvider(resourceLoader, loop.getSystemPromptPath(), loop.getReasoningPromptPath());
    }

    @Bean
    public DivinationMessageComposer divinationMessageComposer(SystemPromptProvider promptProvider,
            ObjectMapper objectMapper, OracleProperties properties) {
        return new DivinationMessageComposer(promptProvider, objectMapper, properties.getLoop().getBriefing());
    }

    @Bean
    public DivinationLoop divinationLoop(LlmPort llmPort, ToolCallNormalizer normalizer, ToolCallExecutor executor,
            DivinationMessageComposer composer, AegisService aegisService, OracleProperties properties) {
        return new DefaultDivinationLoop(llmPort, normalizer, executor, composer, aegisService::currentTemperature,
                properties.getLoop());
    }
}
