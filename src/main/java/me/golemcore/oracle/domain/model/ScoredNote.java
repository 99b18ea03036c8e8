package me.golemcore.oracle.domain.model;

/**
 * Recall hit with its relevance score.
 */
public record ScoredNote(Note note, int score) {
}
