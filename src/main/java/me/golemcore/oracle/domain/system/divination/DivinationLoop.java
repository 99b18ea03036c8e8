package me.golemcore.oracle.domain.system.divination;

import me.golemcore.oracle.domain.model.DivinationResult;

/**
 * Runs the model/tool state machine of one session until it answers, is
 * interrupted by a tool, fails, or runs out of turns.
 *
 * <p>
 * Implementations never let an exception cross this boundary; every outcome is
 * a {@link DivinationResult} variant.
 */
public interface DivinationLoop {

    DivinationResult divine(DivinationSession session);
}
