package com.ryuqq.scorekeeper.core.model;

/**
 * 경기 진행 위치 (이닝 + 초/말).
 *
 * @param inning 이닝
 * @param half 초/말
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public record HalfInning(Inning inning, InningHalf half) {

    /**
     * 경기 첫 위치 (1회 초).
     */
    public static final HalfInning OPENING = new HalfInning(Inning.FIRST, InningHalf.TOP);

    public HalfInning {
        if (inning == null || half == null) {
            throw new IllegalArgumentException("inning and half cannot be null (inning: " + inning + ", half: " + half + ")");
        }
    }

    public static HalfInning of(int inning, InningHalf half) {
        return new HalfInning(Inning.of(inning), half);
    }

    /**
     * 다음 하프 이닝.
     *
     * <p>초 → 같은 이닝의 말, 말 → 다음 이닝의 초. 정규 이닝 이후에도 제한 없이 이어집니다.</p>
     *
     * @return 다음 위치
     */
    public HalfInning next() {
        return half == InningHalf.TOP
            ? new HalfInning(inning, InningHalf.BOTTOM)
            : new HalfInning(inning.next(), InningHalf.TOP);
    }

    @Override
    public String toString() {
        return half.wireName() + " " + inning.number();
    }
}
