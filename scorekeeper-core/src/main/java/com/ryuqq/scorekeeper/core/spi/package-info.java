/**
 * Service Provider Interfaces for the collaborators around the scoring core.
 *
 * <ul>
 *   <li>{@link com.ryuqq.scorekeeper.core.spi.GameStateStore} - load-by-id and atomic compare-and-swap save</li>
 *   <li>{@link com.ryuqq.scorekeeper.core.spi.ScoringEventListener} - subscribers to committed action results</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Scorekeeper Team
 */
package com.ryuqq.scorekeeper.core.spi;
