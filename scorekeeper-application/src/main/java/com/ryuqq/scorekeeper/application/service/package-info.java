/**
 * Scoring service facade.
 *
 * <p>{@link com.ryuqq.scorekeeper.application.service.GameScoringService} is the entry point for callers.
 * Each submission runs one load, apply, save and notify cycle against a single game:</p>
 *
 * <pre>
 * store.findById(gameId)          → NotFound if absent
 * controller.apply(state, action) → Invalid / Rejected on failure
 * store.save(newState, expected)  → Rejected(CONCURRENT_MODIFICATION) on a lost race
 * listeners.onActionCommitted()   → failures logged, never surfaced
 * </pre>
 *
 * <p>Nothing is written when any step before the save fails. The service performs no retry.</p>
 *
 * @see com.ryuqq.scorekeeper.core.spi.GameStateStore
 * @see com.ryuqq.scorekeeper.core.spi.ScoringEventListener
 * @author Scorekeeper Team
 * @since 1.0.0
 */
package com.ryuqq.scorekeeper.application.service;
