package me.golemcore.oracle.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for the oracle, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code oracle.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - completion service, models and timeouts</li>
 * <li>{@link LoopProperties} - divination loop limits and prompts</li>
 * <li>{@link ToolsProperties} - execution sandbox retries and timeouts</li>
 * <li>{@link ContextProperties} - history and manifest budgets</li>
 * <li>{@link MemoryProperties} - notes, recall and task listing</li>
 * <li>{@link StorageProperties} - persistence location</li>
 * <li>{@link HttpProperties} - connection settings of the completion client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "oracle")
@Data
public class OracleProperties {

    private LlmProperties llm = new LlmProperties();
    private LoopProperties loop = new LoopProperties();
    private ToolsProperties tools = new ToolsProperties();
    private ContextProperties context = new ContextProperties();
    private MemoryProperties memory = new MemoryProperties();
    private StorageProperties storage = new StorageProperties();
    private WorkspaceProperties workspace = new WorkspaceProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class LlmProperties {
        private String apiUrl = "https://api.deepseek.com/v1";
        private String apiKey;
        private String model = "deepseek-chat";
        private String reasoningModel = "deepseek-reasoner";
        private String reasoningModelPattern = "reason";
        private int maxTokens = 8192;
        private int reasoningMaxTokens = 64000;
        private Duration requestTimeout = Duration.ofSeconds(300);
        private Duration reasoningRequestTimeout = Duration.ofSeconds(600);
    }

    @Data
    public static class LoopProperties {
        private int maxDepth = 80;
        private int maxRestarts = 3;
        private double temperatureDeltaThreshold = 0.2;
        private String emptySentinel = "<<empty>>";
        private String systemPromptPath = "classpath:prompts/system.md";
        private String reasoningPromptPath = "classpath:prompts/reasoning.md";
        private String briefing = "Before answering, check whether the request needs project files or tools. "
                + "Call tools through the structured tool interface; if you cannot, put each call in a ```json block.";
        private int maxBacktraceLines = 8;
    }

    @Data
    public static class ToolsProperties {
        private int maxRetries = 2;
        private Duration standardTimeout = Duration.ofMinutes(50);
        private Duration fallbackTimeout = Duration.ofSeconds(30);
        private Duration retryBackoff = Duration.ofSeconds(1);
        private int maxErrorMessageLength = 300;
        private int poolSize = 8;
    }

    @Data
    public static class ContextProperties {
        private int historyLimit = 7;
        private int maxHistoryTokens = 2200;
        private int maxSummaryTokens = 400;
        private int maxAegisNoteTokens = 500;
        private String manifestPath = "hermetic.manifest.md";
    }

    @Data
    public static class MemoryProperties {
        private int maxNoteContentLength = 500;
        private int recallLimit = 5;
        private int aegisRecallLimit = 8;
        private int taskListMaxTokens = 1111;
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore-oracle";
        private DirectoriesProperties directories = new DirectoriesProperties();
    }

    @Data
    public static class DirectoriesProperties {
        private String history = "history";
        private String notes = "notes";
        private String tasks = "tasks";
        private String aegis = "aegis";
    }

    @Data
    public static class WorkspaceProperties {
        private String projectRoot = ".";
        private int maxListedFiles = 500;
    }

    @Data
    public static class HttpProperties {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration writeTimeout = Duration.ofSeconds(60);
        private int maxIdleConnections = 5;
        private Duration keepAliveDuration = Duration.ofMinutes(5);
    }
}
