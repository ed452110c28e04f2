package com.ryuqq.scorekeeper.core.contract;

import com.ryuqq.scorekeeper.core.model.InningHalf;

/**
 * 하프 이닝 수동 진행 액션.
 *
 * <p>forceInning과 forceHalf를 함께 지정하면 해당 위치로 강제 이동합니다 (기록 정정용).
 * 둘 중 하나만 지정한 요청은 거부됩니다.</p>
 *
 * @param forceInning 강제 이동할 이닝 (null 가능)
 * @param forceHalf 강제 이동할 초/말 (null 가능)
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public record AdvanceAction(Integer forceInning, InningHalf forceHalf) implements ScoringAction {

    public static AdvanceAction next() {
        return new AdvanceAction(null, null);
    }

    public static AdvanceAction forceTo(int inning, InningHalf half) {
        return new AdvanceAction(inning, half);
    }

    public boolean isForced() {
        return forceInning != null && forceHalf != null;
    }

    /**
     * 강제 이동 필드가 한쪽만 지정되었는지 확인.
     *
     * @return 한쪽만 지정되었으면 true
     */
    public boolean isPartiallyForced() {
        return (forceInning == null) != (forceHalf == null);
    }

    @Override
    public ScoringActionType type() {
        return ScoringActionType.ADVANCE;
    }
}
