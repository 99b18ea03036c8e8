package me.golemcore.oracle.port.outbound;

import me.golemcore.oracle.domain.model.ToolResultRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Caller-supplied executor of tools. The loop only inspects the returned value
 * for an interruption marker.
 */
@FunctionalInterface
public interface ToolDispatcher {

    Object dispatch(String toolName, Map<String, Object> arguments, Invocation invocation) throws Exception;

    /**
     * What a tool can see about the session it runs in.
     *
     * @param sessionId
     *            id of the divination session
     * @param previousResults
     *            results of the calls already executed in this divination
     * @param callerContext
     *            free-form context supplied by the caller
     */
    record Invocation(String sessionId, List<ToolResultRecord> previousResults, Map<String, Object> callerContext) {

        public Invocation {
            previousResults = previousResults != null ? List.copyOf(previousResults) : List.of();
            callerContext = callerContext != null
                    ? Collections.unmodifiableMap(new LinkedHashMap<>(callerContext))
                    : Map.of();
        }
    }
}
