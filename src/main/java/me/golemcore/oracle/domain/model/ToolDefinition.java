package me.golemcore.oracle.domain.model;

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
import lombok.Data;

import java.util.Map;

/**
 * Defines a tool the model can call. Besides the JSON Schema for its input,
 * each tool declares a history priority that decides how much of its calls
 * survives storage truncation and history formatting.
 */
@Data
@Builder
public class ToolDefinition {

    public static final int DEFAULT_HISTORY_PRIORITY = 1;

    private String name;
    private String description;
    private Map<String, Object> inputSchema; // JSON Schema

    @Builder.Default
    private int historyPriority = DEFAULT_HISTORY_PRIORITY;

    /**
     * Creates a simple tool definition without input parameters.
     */
    public static ToolDefinition simple(String name, String description) {
        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .inputSchema(Map.of("type", "object", "properties", Map.of()))
                .build();
    }
}
