package com.ryuqq.scorekeeper.core.contract;

import com.ryuqq.scorekeeper.core.model.GameStatus;

/**
 * 경기 시작 액션.
 *
 * @param status 목표 상태 (WARMUP 또는 IN_PROGRESS, null이면 IN_PROGRESS)
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public record StartAction(GameStatus status) implements ScoringAction {

    public static StartAction inProgress() {
        return new StartAction(GameStatus.IN_PROGRESS);
    }

    public static StartAction warmup() {
        return new StartAction(GameStatus.WARMUP);
    }

    /**
     * 기본값이 적용된 목표 상태.
     *
     * @return status, null이면 IN_PROGRESS
     */
    public GameStatus targetStatus() {
        return status != null ? status : GameStatus.IN_PROGRESS;
    }

    @Override
    public ScoringActionType type() {
        return ScoringActionType.START;
    }
}
