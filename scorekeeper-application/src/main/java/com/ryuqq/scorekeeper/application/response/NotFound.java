package com.ryuqq.scorekeeper.application.response;

import com.ryuqq.scorekeeper.core.model.GameId;

/**
 * 대상 경기 없음.
 *
 * @param gameId 요청된 경기 ID
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public record NotFound(GameId gameId) implements ScoringResponse {

    public NotFound {
        if (gameId == null) {
            throw new IllegalArgumentException("gameId cannot be null");
        }
    }
}
