package me.golemcore.oracle.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Outcome of a task management action, shaped for tool callers: failures are
 * values rather than exceptions.
 */
@Data
@Builder
public class TaskActionResult {

    private boolean ok;
    private Long id;
    private String error;
    private Task task;
    private List<Task> tasks;

    public static TaskActionResult success(Task task) {
        return TaskActionResult.builder().ok(true).id(task.getId()).task(task).build();
    }

    public static TaskActionResult success(long id) {
        return TaskActionResult.builder().ok(true).id(id).build();
    }

    public static TaskActionResult listed(List<Task> tasks) {
        return TaskActionResult.builder().ok(true).tasks(tasks).build();
    }

    public static TaskActionResult failure(String error) {
        return TaskActionResult.builder().ok(false).error(error).build();
    }
}
