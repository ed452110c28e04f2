package com.ryuqq.scorekeeper.core.contract;

/**
 * 현재 하프 이닝 득점 기록 액션.
 *
 * @param runs 득점 (0 이상)
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public record ScoreAction(int runs) implements ScoringAction {

    public static ScoreAction of(int runs) {
        return new ScoreAction(runs);
    }

    @Override
    public ScoringActionType type() {
        return ScoringActionType.SCORE;
    }
}
