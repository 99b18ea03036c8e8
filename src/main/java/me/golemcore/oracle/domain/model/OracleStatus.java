package me.golemcore.oracle.domain.model;

/**
 * Terminal status of a consultation together with the short tag shown to
 * callers.
 */
public enum OracleStatus {
    SUCCESS("success"),
    INTERRUPTED("interrupted"),
    TIMEOUT("timeout"),
    CONNECTION_FAILURE("network_error"),
    RATE_LIMIT("rate_limit_error"),
    CONTEXT_LENGTH_EXCEEDED("context_length_error"),
    TOOL_EXECUTION_FAILURE("tool_execution_error"),
    FAILURE("failure");

    private final String tag;

    OracleStatus(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
