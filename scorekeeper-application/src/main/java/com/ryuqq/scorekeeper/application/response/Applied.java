package com.ryuqq.scorekeeper.application.response;

import com.ryuqq.scorekeeper.core.contract.ScoringActionResult;

/**
 * 적용 성공.
 *
 * @param result 액션 결과 (도메인 상태)
 * @param previousState 변경 전 상태 응답
 * @param newState 변경 후 상태 응답
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public record Applied(
    ScoringActionResult result,
    GameStateView previousState,
    GameStateView newState
) implements ScoringResponse {

    public Applied {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        if (previousState == null || newState == null) {
            throw new IllegalArgumentException("previousState and newState cannot be null");
        }
    }

    /**
     * 적용된 액션 이름 (예: "out").
     *
     * @return 액션 이름
     */
    public String action() {
        return result.action().wireName();
    }

    public boolean autoAdvanced() {
        return result.autoAdvanced();
    }
}
