package com.ryuqq.scorekeeper.testkit.contract;

import com.ryuqq.scorekeeper.core.model.GameId;
import com.ryuqq.scorekeeper.core.model.GameState;
import com.ryuqq.scorekeeper.core.model.GameStatus;
import com.ryuqq.scorekeeper.core.model.Inning;
import com.ryuqq.scorekeeper.core.model.InningHalf;
import com.ryuqq.scorekeeper.core.model.InningScores;
import com.ryuqq.scorekeeper.core.model.Outs;

import java.time.Instant;
import java.util.List;

/**
 * Factory methods for game states used across tests.
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public final class GameStateFixtures {

    public static final Instant EPOCH = Instant.parse("2026-04-04T17:05:00Z");

    // Utility class - prevent instantiation
    private GameStateFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static GameState scheduled(String id) {
        return GameState.scheduled(GameId.of(id), EPOCH);
    }

    /**
     * In-progress game at the given position.
     *
     * @param id game id
     * @param inning current inning
     * @param half current half
     * @param outs current outs (0-2)
     * @param home home inning scores
     * @param away away inning scores
     * @return in-progress state
     */
    public static GameState inProgress(String id, int inning, InningHalf half, int outs,
                                       List<Integer> home, List<Integer> away) {
        return new GameState(
            GameId.of(id),
            GameStatus.IN_PROGRESS,
            Inning.of(inning),
            half,
            Outs.of(outs),
            InningScores.of(home),
            InningScores.of(away),
            null,
            EPOCH,
            null,
            EPOCH
        );
    }

    public static GameState inProgress(String id, int inning, InningHalf half) {
        return inProgress(id, inning, half, 0, List.of(), List.of());
    }

    /**
     * Game in the given status at top 5, away leading 4-3 when started.
     *
     * @param id game id
     * @param status status
     * @return state in that status
     */
    public static GameState withStatus(String id, GameStatus status) {
        boolean started = status == GameStatus.IN_PROGRESS || status == GameStatus.SUSPENDED || status == GameStatus.FINAL;
        boolean ended = status == GameStatus.FINAL || status == GameStatus.SUSPENDED
            || status == GameStatus.CANCELLED || status == GameStatus.POSTPONED;
        return new GameState(
            GameId.of(id),
            status,
            started ? Inning.of(5) : null,
            started ? InningHalf.TOP : null,
            Outs.NONE,
            started ? InningScores.of(1, 0, 0, 2) : InningScores.empty(),
            started ? InningScores.of(0, 3, 0, 0, 1) : InningScores.empty(),
            null,
            started ? EPOCH : null,
            ended ? EPOCH.plusSeconds(3600) : null,
            EPOCH
        );
    }
}
