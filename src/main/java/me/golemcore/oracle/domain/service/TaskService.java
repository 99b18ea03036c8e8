package me.golemcore.oracle.domain.service;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.oracle.domain.model.InterruptMarker;
import me.golemcore.oracle.domain.model.Task;
import me.golemcore.oracle.domain.model.TaskAction;
import me.golemcore.oracle.domain.model.TaskActionResult;
import me.golemcore.oracle.domain.model.TaskCommand;
import me.golemcore.oracle.domain.model.TaskStatus;
import me.golemcore.oracle.domain.model.ToolCallRecord;
import me.golemcore.oracle.domain.model.WorkflowType;
import me.golemcore.oracle.infrastructure.config.OracleProperties;
import me.golemcore.oracle.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Hierarchical multi-step tasks.
 *
 * <p>
 * {@link #manageTask} is the tool-facing entry point and reports validation
 * problems as failed {@link TaskActionResult}s. The typed methods throw
 * {@link IllegalArgumentException} instead.
 *
 * <p>
 * The current step never exceeds the maximum of the task's workflow type.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskService {

    private static final String TASKS_FILE = "tasks.json";
    private static final String TASK_NOT_FOUND = "Task not found: ";
    private static final TypeReference<List<Task>> TASK_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final OracleProperties properties;
    private final ToolCallStorageTruncator toolCallTruncator;
    private final Clock clock;

    private final AtomicReference<List<Task>> tasksCache = new AtomicReference<>();

    public TaskActionResult manageTask(TaskAction action, TaskCommand command) {
        try {
            return switch (action) {
                case CREATE -> TaskActionResult.success(createTask(command));
                case UPDATE -> TaskActionResult.success(updateTask(command));
                case ACTIVATE -> TaskActionResult.success(activateTask(requireId(command)));
                case UPDATE_PLAN -> TaskActionResult.success(updatePlan(requireId(command), command.getPlan(),
                        command.getReason()));
                case ADVANCE_STEP -> TaskActionResult.success(advanceStep(requireId(command)));
                case DELETE -> {
                    long id = requireId(command);
                    deleteTask(id);
                    yield TaskActionResult.success(id);
                }
                case LIST -> TaskActionResult.listed(listTasks(command != null ? command.getParentTaskId() : null));
            };
        } catch (IllegalArgumentException e) {
            log.debug("[Tasks] {} rejected: {}", action, e.getMessage());
            return TaskActionResult.failure(e.getMessage());
        }
    }

    public synchronized Task createTask(TaskCommand command) {
        if (command == null || command.getTitle() == null || command.getTitle().isBlank()) {
            throw new IllegalArgumentException("Task title is required");
        }
        List<Task> tasks = new ArrayList<>(cachedTasks());
        Long parentId = command.getParentTaskId();
        if (parentId != null && find(tasks, parentId).isEmpty()) {
            throw new IllegalArgumentException("Parent task not found: " + parentId);
        }

        Instant now = clock.instant();
        long nextId = tasks.stream().mapToLong(Task::getId).max().orElse(0) + 1;
        Task task = Task.builder()
                .id(nextId)
                .title(command.getTitle().trim())
                .plan(command.getPlan())
                .workflowType(command.getWorkflowType() != null ? command.getWorkflowType() : WorkflowType.FULL)
                .parentTaskId(parentId)
                .createdAt(now)
                .updatedAt(now)
                .build();
        appendLog(task, "Task created");
        tasks.add(task);
        saveTasks(tasks);
        log.info("[Tasks] Created task {} '{}' ({}, parent: {})", nextId, task.getTitle(),
                task.getWorkflowType().value(), parentId);
        return deepCopy(task);
    }

    public synchronized Task updateTask(TaskCommand command) {
        long id = requireId(command);
        return mutate(id, task -> {
            if (command.getTitle() != null && !command.getTitle().isBlank()) {
                task.setTitle(command.getTitle().trim());
            }
            if (command.getStatus() != null && command.getStatus() != task.getStatus()) {
                appendLog(task, "Status " + task.getStatus().value() + " -> " + command.getStatus().value());
                task.setStatus(command.getStatus());
            }
            if (command.getCurrentStep() != null) {
                task.setCurrentStep(checkStep(task, command.getCurrentStep()));
            }
            if (command.getStepResults() != null) {
                command.getStepResults().forEach((stepId, result) -> task.getStepResults()
                        .put(normalizeStepId(task, stepId), result));
            }
            if (command.getLog() != null && !command.getLog().isBlank()) {
                appendLog(task, command.getLog());
            }
        });
    }

    public synchronized Task activateTask(long id) {
        return mutate(id, task -> {
            if (task.getStatus().isTerminal()) {
                throw new IllegalArgumentException("Task " + id + " is " + task.getStatus().value());
            }
            task.setStatus(TaskStatus.ACTIVE);
            appendLog(task, "Task activated");
        });
    }

    public synchronized Task updatePlan(long id, String plan, String reason) {
        if (plan == null || plan.isBlank()) {
            throw new IllegalArgumentException("Plan text is required");
        }
        return mutate(id, task -> {
            task.getPlanUpdates().add(Task.PlanUpdate.builder()
                    .timestamp(clock.instant())
                    .previousPlan(task.getPlan())
                    .reason(reason)
                    .build());
            task.setPlan(plan);
            appendLog(task, reason != null ? "Plan updated: " + reason : "Plan updated");
        });
    }

    public synchronized Task advanceStep(long id) {
        return mutate(id, task -> {
            if (task.getCurrentStep() >= task.getMaxSteps()) {
                throw new IllegalArgumentException("Task " + id + " is already at its final step ("
                        + task.getMaxSteps() + ")");
            }
            task.setCurrentStep(task.getCurrentStep() + 1);
            appendLog(task, "Advanced to step " + task.getCurrentStep());
        });
    }

    /**
     * Removes a task together with its sub-tasks.
     */
    public synchronized void deleteTask(long id) {
        List<Task> tasks = new ArrayList<>(cachedTasks());
        if (find(tasks, id).isEmpty()) {
            throw new IllegalArgumentException(TASK_NOT_FOUND + id);
        }
        Set<Long> doomed = new HashSet<>();
        doomed.add(id);
        boolean grew = true;
        while (grew) {
            grew = false;
            for (Task task : tasks) {
                if (task.getParentTaskId() != null && doomed.contains(task.getParentTaskId())
                        && doomed.add(task.getId())) {
                    grew = true;
                }
            }
        }
        tasks.removeIf(task -> doomed.contains(task.getId()));
        saveTasks(tasks);
        log.info("[Tasks] Deleted task {} ({} removed in total)", id, doomed.size());
    }

    /**
     * Tasks newest first, optionally only the children of {@code parentId},
     * capped by the listing token budget.
     */
    public List<Task> listTasks(Long parentId) {
        int budget = properties.getMemory().getTaskListMaxTokens();
        List<Task> candidates = cachedTasks().stream()
                .filter(task -> parentId == null || parentId.equals(task.getParentTaskId()))
                .sorted(Comparator.comparing(Task::getCreatedAt,
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
                        .thenComparing(Task::getId, Comparator.<Long>reverseOrder()))
                .toList();
        List<Task> listed = new ArrayList<>();
        int total = 0;
        for (Task task : candidates) {
            int cost = TokenEstimationSupport.estimate(task.getTitle(), task.getPlan());
            if (total + cost > budget) {
                break;
            }
            total += cost;
            listed.add(deepCopy(task));
        }
        return listed;
    }

    public Optional<Task> getTask(long id) {
        return find(cachedTasks(), id).map(this::deepCopy);
    }

    public List<Task> getSubtasks(long parentId) {
        return cachedTasks().stream()
                .filter(task -> Objects.equals(task.getParentTaskId(), parentId))
                .sorted(Comparator.comparingLong(Task::getId))
                .map(this::deepCopy)
                .toList();
    }

    public synchronized Task updateSubtaskResults(long parentId, long subtaskId, Object result) {
        Task subtask = getTask(subtaskId).orElseThrow(() -> new IllegalArgumentException(TASK_NOT_FOUND + subtaskId));
        if (!Objects.equals(subtask.getParentTaskId(), parentId)) {
            throw new IllegalArgumentException("Task " + subtaskId + " is not a sub-task of " + parentId);
        }
        return mutate(parentId, task -> {
            task.getSubtaskResults().put(Long.toString(subtaskId), result);
            appendLog(task, "Recorded result of sub-task " + subtaskId);
        });
    }

    /**
     * Stores the result and tool calls of one step under the same step key.
     */
    public synchronized Task recordStepResult(long id, int step, Object result, List<ToolCallRecord> toolCalls) {
        return mutate(id, task -> {
            String key = Task.stepKey(checkStep(task, step));
            task.getStepResults().put(key, result);
            if (toolCalls != null && !toolCalls.isEmpty()) {
                task.getStepToolCalls().put(key, toolCallTruncator.truncate(toolCalls));
            }
        });
    }

    /**
     * Applies an interruption marker to the task's current step:
     * {@code step_completed} records the result and advances (completing the
     * task after its last step), {@code step_rejected} records the reason and
     * rewinds to {@code restart_from_step}.
     */
    public synchronized Task applyInterrupt(long id, InterruptMarker marker, List<ToolCallRecord> toolCalls) {
        Objects.requireNonNull(marker, "marker");
        Task current = getTask(id).orElseThrow(() -> new IllegalArgumentException(TASK_NOT_FOUND + id));
        int step = current.getCurrentStep();

        if (marker.isStepCompleted()) {
            recordStepResult(id, step, marker.result(), toolCalls);
            return mutate(id, task -> {
                if (task.getCurrentStep() < task.getMaxSteps()) {
                    task.setCurrentStep(task.getCurrentStep() + 1);
                    appendLog(task, "Step " + step + " completed");
                } else {
                    task.setStatus(TaskStatus.COMPLETED);
                    appendLog(task, "Step " + step + " completed, task completed");
                }
            });
        }
        if (marker.isStepRejected()) {
            Map<String, Object> rejection = new LinkedHashMap<>();
            rejection.put("rejected", true);
            rejection.put("reason", marker.reason());
            recordStepResult(id, step, rejection, toolCalls);
            return mutate(id, task -> {
                Integer restartFrom = marker.restartFromStep();
                int target = restartFrom != null ? Math.max(1, Math.min(restartFrom, step)) : step;
                task.setCurrentStep(target);
                appendLog(task, "Step " + step + " rejected, restarting from step " + target
                        + (marker.reason() != null ? ": " + marker.reason() : ""));
            });
        }
        throw new IllegalArgumentException("Unsupported interrupt kind: " + marker.kind());
    }

    /**
     * Detached copies of every task; changing them does not affect the store.
     */
    public List<Task> getTasks() {
        return cachedTasks().stream().map(this::deepCopy).toList();
    }

    private List<Task> cachedTasks() {
        List<Task> cached = tasksCache.get();
        if (cached == null) {
            synchronized (this) {
                cached = tasksCache.get();
                if (cached == null) {
                    cached = List.copyOf(loadTasks());
                    tasksCache.set(cached);
                }
            }
        }
        return cached;
    }

    private Task mutate(long id, Consumer<Task> change) {
        List<Task> tasks = new ArrayList<>(cachedTasks());
        for (int i = 0; i < tasks.size(); i++) {
            if (tasks.get(i).getId() == id) {
                Task copy = deepCopy(tasks.get(i));
                change.accept(copy);
                copy.setUpdatedAt(clock.instant());
                tasks.set(i, copy);
                saveTasks(tasks);
                return deepCopy(copy);
            }
        }
        throw new IllegalArgumentException(TASK_NOT_FOUND + id);
    }

    private static int checkStep(Task task, int step) {
        if (step < 1 || step > task.getMaxSteps()) {
            throw new IllegalArgumentException("Step " + step + " is outside 1.." + task.getMaxSteps()
                    + " for workflow " + task.getWorkflowType().value());
        }
        return step;
    }

    private static String normalizeStepId(Task task, String stepId) {
        try {
            return Task.stepKey(checkStep(task, Integer.parseInt(stepId.trim())));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Step identifier must be a step number: " + stepId, e);
        }
    }

    private void appendLog(Task task, String message) {
        task.getLogs().add(Task.LogEntry.builder().timestamp(clock.instant()).message(message).build());
    }

    private static long requireId(TaskCommand command) {
        if (command == null || command.getId() == null) {
            throw new IllegalArgumentException("Task id is required");
        }
        return command.getId();
    }

    private static Optional<Task> find(List<Task> tasks, long id) {
        return tasks.stream().filter(task -> task.getId() == id).findFirst();
    }

    private Task deepCopy(Task task) {
        return objectMapper.convertValue(task, Task.class);
    }

    private void saveTasks(List<Task> tasks) {
        try {
            String json = objectMapper.writeValueAsString(tasks);
            storagePort.writeAtomic(tasksDirectory(), TASKS_FILE, json, true).join();
            tasksCache.set(List.copyOf(tasks));
        } catch (IOException | RuntimeException e) {
            log.error("[Tasks] Failed to save tasks", e);
            throw new IllegalStateException("Failed to persist tasks", e);
        }
    }

    private List<Task> loadTasks() {
        try {
            String json = storagePort.readText(tasksDirectory(), TASKS_FILE).join();
            if (json != null && !json.isBlank()) {
                return new ArrayList<>(objectMapper.readValue(json, TASK_LIST_TYPE_REF));
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - fall back to empty task list
            log.debug("[Tasks] No tasks found or failed to parse: {}", e.getMessage());
        }
        return new ArrayList<>();
    }

    private String tasksDirectory() {
        return properties.getStorage().getDirectories().getTasks();
    }
}
