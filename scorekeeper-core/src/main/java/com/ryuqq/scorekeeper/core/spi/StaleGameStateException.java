package com.ryuqq.scorekeeper.core.spi;

import com.ryuqq.scorekeeper.core.model.GameId;

import java.time.Instant;

/**
 * 낙관적 동시성 검사 실패.
 *
 * <p>저장하려는 시점의 updatedAt이 읽어 온 시점과 다르면 다른 액션이 먼저 경기를 변경한 것입니다.
 * 호출자는 최신 상태를 다시 읽어 액션을 재시도할지 결정합니다.</p>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public class StaleGameStateException extends IllegalStateException {

    private final GameId gameId;

    public StaleGameStateException(GameId gameId, Instant expectedUpdatedAt, Instant actualUpdatedAt) {
        super(String.format("Game %s was modified concurrently (expected updatedAt: %s, actual: %s)",
            gameId == null ? null : gameId.getValue(), expectedUpdatedAt, actualUpdatedAt));
        this.gameId = gameId;
    }

    public GameId gameId() {
        return gameId;
    }
}
