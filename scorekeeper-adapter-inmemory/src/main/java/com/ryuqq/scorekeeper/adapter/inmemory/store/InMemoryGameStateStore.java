package com.ryuqq.scorekeeper.adapter.inmemory.store;

import com.ryuqq.scorekeeper.core.model.GameId;
import com.ryuqq.scorekeeper.core.model.GameState;
import com.ryuqq.scorekeeper.core.model.GameStatus;
import com.ryuqq.scorekeeper.core.spi.GameStateStore;
import com.ryuqq.scorekeeper.core.spi.StaleGameStateException;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link GameStateStore} SPI for testing and reference purposes.
 *
 * <p>Game states are kept in a {@link ConcurrentHashMap}. {@link #save} performs its
 * {@code updatedAt} comparison inside {@link ConcurrentHashMap#compute}, so the check and the
 * write are atomic per game while different games never contend.</p>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>findById / insert / save:</strong> O(1)</li>
 *   <li><strong>findByStatus:</strong> O(N log N) - full scan, sorted by startedAt</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * GameStateStore store = new InMemoryGameStateStore();
 * store.insert(GameState.scheduled(GameId.of("game-1"), Instant.now()));
 *
 * GameState current = store.findById(GameId.of("game-1")).orElseThrow();
 * GameState next = controller.apply(current, StartAction.inProgress()).newState();
 * store.save(next, current.updatedAt());
 * </pre>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public class InMemoryGameStateStore implements GameStateStore {

    private static final Comparator<GameState> BY_STARTED_AT = Comparator
        .comparing(GameState::startedAt, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(state -> state.id().getValue());

    private final ConcurrentHashMap<GameId, GameState> games;

    /**
     * Creates a new InMemoryGameStateStore with empty storage.
     */
    public InMemoryGameStateStore() {
        this.games = new ConcurrentHashMap<>();
    }

    @Override
    public Optional<GameState> findById(GameId gameId) {
        if (gameId == null) {
            throw new IllegalArgumentException("gameId cannot be null");
        }
        return Optional.ofNullable(games.get(gameId));
    }

    @Override
    public void insert(GameState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        GameState existing = games.putIfAbsent(state.id(), state);
        if (existing != null) {
            throw new IllegalStateException("Game already exists: " + state.id());
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Compare and write happen inside a single {@code compute} call</li>
     *   <li>Exceptions thrown inside {@code compute} leave the mapping unchanged</li>
     * </ul>
     */
    @Override
    public void save(GameState newState, Instant expectedUpdatedAt) {
        if (newState == null) {
            throw new IllegalArgumentException("newState cannot be null");
        }
        if (expectedUpdatedAt == null) {
            throw new IllegalArgumentException("expectedUpdatedAt cannot be null");
        }

        games.compute(newState.id(), (id, stored) -> {
            if (stored == null) {
                throw new IllegalStateException("No game found for id: " + id);
            }
            if (!stored.updatedAt().equals(expectedUpdatedAt)) {
                throw new StaleGameStateException(id, expectedUpdatedAt, stored.updatedAt());
            }
            return newState;
        });
    }

    @Override
    public List<GameState> findByStatus(GameStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        return games.values().stream()
            .filter(state -> state.status() == status)
            .sorted(BY_STARTED_AT)
            .collect(Collectors.toList());
    }

    /**
     * Clears all stored data.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        games.clear();
    }

    /**
     * Returns the number of stored games.
     *
     * @return the game count
     */
    public int size() {
        return games.size();
    }
}
