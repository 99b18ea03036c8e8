package me.golemcore.oracle.domain.model;

/**
 * Failure categories of a sandboxed tool invocation.
 */
public enum ToolFailureType {
    TIMEOUT("Timeout"),
    RATE_LIMIT("RateLimit"),
    NETWORK("Network"),
    CONTEXT_LENGTH("ContextLength"),
    PARSE_ERROR("ParseError"),
    TOOL_EXECUTION("ToolExecution");

    private final String label;

    ToolFailureType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
