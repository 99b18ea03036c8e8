package me.golemcore.oracle.domain.model;

import java.util.List;

/**
 * Terminal outcome of one divination. Callers switch on the variant instead of
 * probing the answer for a marker.
 */
public sealed interface DivinationResult
        permits DivinationResult.Answered, DivinationResult.Interrupted, DivinationResult.Failed {

    DivinationArtifacts artifacts();

    List<ToolResultRecord> toolResults();

    /**
     * The model produced a final answer, or the turn budget ran out.
     */
    record Answered(String answer, DivinationArtifacts artifacts, List<ToolResultRecord> toolResults,
            int turns) implements DivinationResult {
    }

    /**
     * A tool result carried an interruption marker.
     */
    record Interrupted(InterruptMarker marker, DivinationArtifacts artifacts, List<ToolResultRecord> toolResults,
            int turns) implements DivinationResult {
    }

    /**
     * Transport, tool or unexpected failure. The backtrace is for logs only.
     */
    record Failed(OracleStatus status, String message, String backtrace, DivinationArtifacts artifacts,
            List<ToolResultRecord> toolResults) implements DivinationResult {
    }
}
