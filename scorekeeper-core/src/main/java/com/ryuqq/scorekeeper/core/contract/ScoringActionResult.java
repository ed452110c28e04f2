package com.ryuqq.scorekeeper.core.contract;

import com.ryuqq.scorekeeper.core.model.GameState;

/**
 * 스코어링 액션 적용 결과.
 *
 * <p>previousState는 변경 전 스냅샷이며, 관찰/디버깅 용도로 한 단계 차이만 제공합니다.
 * 그 이전 이력은 보관하지 않습니다.</p>
 *
 * @param action 적용된 액션 종류
 * @param previousState 변경 전 상태
 * @param newState 변경 후 상태
 * @param autoAdvanced 3아웃으로 하프 이닝이 자동 진행되었는지 여부 (OUT 액션에서만 true 가능)
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public record ScoringActionResult(
    ScoringActionType action,
    GameState previousState,
    GameState newState,
    boolean autoAdvanced
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 null이거나 두 상태의 경기 ID가 다른 경우
     */
    public ScoringActionResult {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (previousState == null || newState == null) {
            throw new IllegalArgumentException("previousState and newState cannot be null");
        }
        if (!previousState.id().equals(newState.id())) {
            throw new IllegalArgumentException(
                "previousState and newState must belong to the same game ("
                    + previousState.id() + " vs " + newState.id() + ")");
        }
    }
}
