package me.golemcore.oracle.domain.model;

import java.util.List;

/**
 * Output of context assembly: formatted history messages plus the resolved
 * extra context.
 */
public record AssembledContext(List<Message> history, ExtraContext extraContext) {

    public AssembledContext {
        history = history != null ? List.copyOf(history) : List.of();
    }

    public static AssembledContext empty() {
        return new AssembledContext(List.of(), ExtraContext.builder().build());
    }
}
