package com.ryuqq.scorekeeper.core.rules;

import com.ryuqq.scorekeeper.core.model.GameState;

/**
 * 이닝 진행 엔진의 계산 결과.
 *
 * @param state 새 상태
 * @param autoAdvanced 3아웃으로 하프 이닝이 자동 진행되었는지 여부
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public record Progression(GameState state, boolean autoAdvanced) {

    public Progression {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
    }

    public static Progression of(GameState state) {
        return new Progression(state, false);
    }
}
