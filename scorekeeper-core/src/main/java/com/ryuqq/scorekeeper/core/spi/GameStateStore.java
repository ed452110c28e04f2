package com.ryuqq.scorekeeper.core.spi;

import com.ryuqq.scorekeeper.core.model.GameId;
import com.ryuqq.scorekeeper.core.model.GameState;
import com.ryuqq.scorekeeper.core.model.GameStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent storage SPI for game state.
 *
 * <p>The scoring core never locks. Each action is one read-modify-write against a single game,
 * and this interface is the boundary where concurrent actions on the same game are serialized
 * through an optimistic compare-and-swap on {@code updatedAt}.</p>
 *
 * <p><strong>Compare-and-Swap Pattern:</strong></p>
 * <pre>
 * 1. GameState current = findById(id)               → snapshot with updatedAt = T1
 * 2. GameState next = controller.apply(current, ..) → next.updatedAt = T2
 * 3. save(next, T1)                                  → succeeds only if stored updatedAt is still T1
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Atomic save: the updatedAt check and the write must be a single atomic step
 *       (e.g. {@code UPDATE ... WHERE id = ? AND updated_at = ?})</li>
 *   <li>Thread-safe: all methods callable from multiple threads</li>
 *   <li>Actions on different games must not block each other</li>
 * </ul>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public interface GameStateStore {

    /**
     * Loads the current state of a game.
     *
     * @param gameId the game ID
     * @return the stored state, or empty if no such game exists
     * @throws IllegalArgumentException if gameId is null
     */
    Optional<GameState> findById(GameId gameId);

    /**
     * Registers a newly scheduled game.
     *
     * <p>Used by the scheduling collaborator; the scoring core never creates games.</p>
     *
     * @param state the initial state
     * @throws IllegalArgumentException if state is null
     * @throws IllegalStateException if a game with the same ID already exists
     */
    void insert(GameState state);

    /**
     * Atomically replaces a game's state if it has not changed since it was read.
     *
     * @param newState the state to store
     * @param expectedUpdatedAt the {@code updatedAt} of the state the change was computed from
     * @throws IllegalArgumentException if newState or expectedUpdatedAt is null
     * @throws IllegalStateException if the game does not exist
     * @throws StaleGameStateException if the stored {@code updatedAt} differs from expectedUpdatedAt
     */
    void save(GameState newState, Instant expectedUpdatedAt);

    /**
     * Lists games in the given status.
     *
     * @param status the status to filter by
     * @return matching games ordered by startedAt (games without startedAt last), may be empty
     * @throws IllegalArgumentException if status is null
     */
    List<GameState> findByStatus(GameStatus status);
}
