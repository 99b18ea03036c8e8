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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A unit of multi-step work. Step results and step tool calls share the same
 * key space: the step number rendered as a string.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Task {

    private long id;
    private String title;
    private String plan;

    @Builder.Default
    private TaskStatus status = TaskStatus.PENDING;

    @Builder.Default
    private int currentStep = 1;

    @Builder.Default
    private WorkflowType workflowType = WorkflowType.FULL;

    private Long parentTaskId;

    @Builder.Default
    private Map<String, Object> stepResults = new LinkedHashMap<>();

    @JsonProperty("tool_calls_json")
    @Builder.Default
    private Map<String, List<ToolCallRecord>> stepToolCalls = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> subtaskResults = new LinkedHashMap<>();

    @Builder.Default
    private List<LogEntry> logs = new ArrayList<>();

    @Builder.Default
    private List<PlanUpdate> planUpdates = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;

    public static String stepKey(int step) {
        return Integer.toString(step);
    }

    @JsonIgnore
    public int getMaxSteps() {
        return workflowType != null ? workflowType.maxSteps() : WorkflowType.FULL.maxSteps();
    }

    @JsonIgnore
    public boolean isSubtask() {
        return parentTaskId != null;
    }

    /**
     * Timestamped free-text log line.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LogEntry {
        private Instant timestamp;
        private String message;
    }

    /**
     * Previous plan text kept when the plan is replaced.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class PlanUpdate {
        private Instant timestamp;
        private String previousPlan;
        private String reason;
    }
}
