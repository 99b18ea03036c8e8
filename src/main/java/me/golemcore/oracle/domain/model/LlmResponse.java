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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parsed completion: textual content, raw tool-call entries exactly as the
 * provider sent them, and the optional reasoning trace.
 */
@Data
@Builder
public class LlmResponse {

    private String content;

    @Builder.Default
    private List<Map<String, Object>> rawToolCalls = new ArrayList<>();

    private String reasoningContent;
    private String model;
    private String finishReason;

    public boolean hasToolCalls() {
        return rawToolCalls != null && !rawToolCalls.isEmpty();
    }
}
