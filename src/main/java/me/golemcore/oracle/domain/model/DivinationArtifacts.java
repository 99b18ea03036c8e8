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

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Side products of a divination that are not the answer itself.
 */
@Data
public class DivinationArtifacts {

    /** Non-empty content of every turn, in order. */
    private final List<String> prelude = new ArrayList<>();

    private final List<String> reasoningContent = new ArrayList<>();

    /** Calls recovered from free text rather than the structured field. */
    private final List<Message.ToolCall> fallbackTools = new ArrayList<>();

    public void addPrelude(String content) {
        if (content != null && !content.isBlank()) {
            prelude.add(content);
        }
    }

    public void addReasoning(String reasoning) {
        if (reasoning != null && !reasoning.isBlank()) {
            reasoningContent.add(reasoning);
        }
    }
}
