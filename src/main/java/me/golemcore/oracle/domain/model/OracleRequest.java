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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a caller passes to one consultation.
 */
@Data
@Builder
public class OracleRequest {

    private String prompt;

    /** Pre-built messages sent instead of the prompt. */
    @Builder.Default
    private List<Message> customMessages = new ArrayList<>();

    @Builder.Default
    private List<Attachment> attachments = new ArrayList<>();

    @Builder.Default
    private HistorySelection history = HistorySelection.fetch();

    @Builder.Default
    private Map<String, String> environment = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> callerContext = new LinkedHashMap<>();

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    /** Reminders injected when the model stops without calling a tool. */
    @Builder.Default
    private List<String> reminders = new ArrayList<>();

    private boolean record;
    private boolean reasoning;
    private Double temperature;
    private Integer maxDepth;

    public boolean hasCustomMessages() {
        return customMessages != null && !customMessages.isEmpty();
    }
}
