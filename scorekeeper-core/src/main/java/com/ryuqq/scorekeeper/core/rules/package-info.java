/**
 * Scoring rules package: inning progression, end-of-game evaluation and administrative correction.
 *
 * <ul>
 *   <li>{@link com.ryuqq.scorekeeper.core.rules.InningProgression} - start, score, outs and half-inning advancement</li>
 *   <li>{@link com.ryuqq.scorekeeper.core.rules.EndOfGameEvaluator} - whether a game may end as final</li>
 *   <li>{@link com.ryuqq.scorekeeper.core.rules.AdministrativeCorrection} - state overwrite that keeps structural invariants</li>
 * </ul>
 *
 * <p>All operations are synchronous and deterministic given the input state and payload.
 * A rejected operation throws before producing any state.</p>
 *
 * @since 1.0.0
 * @author Scorekeeper Team
 */
package com.ryuqq.scorekeeper.core.rules;
