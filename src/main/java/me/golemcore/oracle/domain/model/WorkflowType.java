package me.golemcore.oracle.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Workflow templates bounding how many steps a task may run.
 */
public enum WorkflowType {
    SIMPLE(3), ANALYSIS(5), FULL(10);

    private final int maxSteps;

    WorkflowType(int maxSteps) {
        this.maxSteps = maxSteps;
    }

    public int maxSteps() {
        return maxSteps;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WorkflowType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return FULL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown workflow type: " + value, e);
        }
    }
}
