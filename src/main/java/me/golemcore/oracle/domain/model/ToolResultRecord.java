package me.golemcore.oracle.domain.model;

/**
 * {@code {id, name, result}} entry appended for every executed tool call.
 */
public record ToolResultRecord(String id, String name, Object result) {
}
