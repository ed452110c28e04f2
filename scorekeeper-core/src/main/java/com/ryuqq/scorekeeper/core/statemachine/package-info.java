/**
 * Game status state machine package.
 *
 * <h2>Status Transition Rules</h2>
 * <pre>
 * scheduled   → warmup, in_progress, postponed, cancelled
 * warmup      → in_progress, postponed, cancelled
 * in_progress → final, suspended
 * postponed   → scheduled, cancelled
 * suspended   → in_progress, cancelled
 *
 * Forbidden:
 * - final → * (terminal status)
 * - cancelled → * (terminal status)
 * - Any edge not listed above
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * StatusTransition.canTransition(GameStatus.SCHEDULED, GameStatus.IN_PROGRESS); // true
 *
 * // This will throw RuleViolationException (InvalidTransition)
 * StatusTransition.validate(GameStatus.FINAL, GameStatus.IN_PROGRESS);
 * </pre>
 *
 * @since 1.0.0
 * @author Scorekeeper Team
 */
package com.ryuqq.scorekeeper.core.statemachine;
