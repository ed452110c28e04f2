/**
 * Game state model package containing invariant value types and the game state record.
 *
 * <h2>Invariant Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.scorekeeper.core.model.Outs} - Outs in a half-inning (0-3, rests at 0-2)</li>
 *   <li>{@link com.ryuqq.scorekeeper.core.model.Inning} - Inning number (1 or greater, unbounded)</li>
 *   <li>{@link com.ryuqq.scorekeeper.core.model.Runs} - Non-negative run count</li>
 *   <li>{@link com.ryuqq.scorekeeper.core.model.InningScores} - Per-inning runs for one side; totals are its sum</li>
 * </ul>
 *
 * <h2>Entity</h2>
 * <ul>
 *   <li>{@link com.ryuqq.scorekeeper.core.model.GameState} - Immutable snapshot of a game's live progress</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Every change produces a new instance; the old one is the previous-state snapshot</li>
 *   <li><strong>Validation:</strong> Constructors reject impossible states (negative runs, resting at 3 outs, ...)</li>
 *   <li><strong>Derived totals:</strong> Scores are always computed from the inning-score sequence</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Scorekeeper Team
 */
package com.ryuqq.scorekeeper.core.model;
