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
 * Parameters of a task management action. Only the fields an action reads need
 * to be set.
 */
@Data
@Builder
public class TaskCommand {

    private Long id;
    private String title;
    private String plan;
    private WorkflowType workflowType;
    private Long parentTaskId;
    private TaskStatus status;
    private Integer currentStep;
    private String log;
    private Map<String, Object> stepResults;
    private String reason;
}
