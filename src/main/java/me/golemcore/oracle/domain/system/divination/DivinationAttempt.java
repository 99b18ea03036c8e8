package me.golemcore.oracle.domain.system.divination;

import me.golemcore.oracle.domain.model.DivinationResult;

/**
 * Outcome of a single attempt: either a terminal result or a request to start
 * over from turn 1.
 */
sealed interface DivinationAttempt permits DivinationAttempt.Completed, DivinationAttempt.Restart {

    record Completed(DivinationResult result) implements DivinationAttempt {
    }

    record Restart(String reason) implements DivinationAttempt {
    }
}
