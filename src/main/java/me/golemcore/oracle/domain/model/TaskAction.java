package me.golemcore.oracle.domain.model;

import java.util.Locale;

/**
 * Actions accepted by the task management operation.
 */
public enum TaskAction {
    CREATE, UPDATE, ACTIVATE, UPDATE_PLAN, ADVANCE_STEP, DELETE, LIST;

    public static TaskAction fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Task action is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown task action: " + value, e);
        }
    }
}
