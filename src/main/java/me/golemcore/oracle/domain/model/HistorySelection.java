package me.golemcore.oracle.domain.model;

import java.util.List;

/**
 * Which history the context assembler should include: the stored history, none,
 * or an explicit list supplied by the caller (oldest first).
 */
public record HistorySelection(Mode mode, List<ConversationEntry> entries) {

    public enum Mode {
        FETCH, NONE, EXPLICIT
    }

    public HistorySelection {
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public static HistorySelection fetch() {
        return new HistorySelection(Mode.FETCH, List.of());
    }

    public static HistorySelection none() {
        return new HistorySelection(Mode.NONE, List.of());
    }

    public static HistorySelection of(List<ConversationEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return none();
        }
        return new HistorySelection(Mode.EXPLICIT, entries);
    }
}
