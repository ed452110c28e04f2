package com.ryuqq.scorekeeper.core.contract;

import com.ryuqq.scorekeeper.core.model.GameStatus;

/**
 * 경기 종료 액션.
 *
 * @param status 목표 상태 (FINAL, SUSPENDED, POSTPONED, CANCELLED 중 하나, null이면 FINAL)
 * @param notes 종료 사유 메모 (null 가능, 예: "우천 콜드")
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public record EndAction(GameStatus status, String notes) implements ScoringAction {

    public static EndAction asFinal() {
        return new EndAction(GameStatus.FINAL, null);
    }

    public static EndAction of(GameStatus status, String notes) {
        return new EndAction(status, notes);
    }

    public GameStatus targetStatus() {
        return status != null ? status : GameStatus.FINAL;
    }

    @Override
    public ScoringActionType type() {
        return ScoringActionType.END;
    }
}
