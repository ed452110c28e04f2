package com.ryuqq.scorekeeper.core.contract;

/**
 * 아웃 기록 액션.
 *
 * <p>병살(2), 삼중살(3)처럼 한 번에 여러 아웃을 기록할 수 있습니다.</p>
 *
 * @param count 아웃 수 (1~3, null이면 1)
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public record OutAction(Integer count) implements ScoringAction {

    public static OutAction single() {
        return new OutAction(1);
    }

    public static OutAction of(int count) {
        return new OutAction(count);
    }

    public int effectiveCount() {
        return count != null ? count : 1;
    }

    @Override
    public ScoringActionType type() {
        return ScoringActionType.OUT;
    }
}
