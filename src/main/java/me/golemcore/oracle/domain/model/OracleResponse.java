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

/**
 * Caller-facing result of a consultation. Carries a status tag and a
 * length-capped message, never a stack trace.
 */
@Data
@Builder
public class OracleResponse {

    public static final int MAX_MESSAGE_LENGTH = 300;

    private OracleStatus status;
    private String message;
    private String answer;
    private InterruptMarker interrupt;
    private DivinationArtifacts artifacts;

    @Builder.Default
    private List<ToolResultRecord> toolResults = new ArrayList<>();

    private Long entryId;
    private double executionTime;

    public String getStatusTag() {
        return status != null ? status.tag() : null;
    }

    public boolean isSuccess() {
        return status == OracleStatus.SUCCESS;
    }

    public boolean isInterrupted() {
        return status == OracleStatus.INTERRUPTED;
    }
}
