package com.ryuqq.scorekeeper.core.model;

/**
 * 이닝의 초/말 구분.
 *
 * <p>초(TOP)에는 원정팀이, 말(BOTTOM)에는 홈팀이 공격합니다.</p>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public enum InningHalf {

    /**
     * 초 (원정팀 공격).
     */
    TOP("top"),

    /**
     * 말 (홈팀 공격).
     */
    BOTTOM("bottom");

    private final String wireName;

    InningHalf(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 이 하프 이닝에 공격하는 팀.
     *
     * @return TOP이면 AWAY, BOTTOM이면 HOME
     */
    public TeamSide battingSide() {
        return this == TOP ? TeamSide.AWAY : TeamSide.HOME;
    }

    /**
     * 외부 표현("top", "bottom")으로부터 변환.
     *
     * @param wireName 외부 표현
     * @return 대응하는 InningHalf
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static InningHalf fromWireName(String wireName) {
        for (InningHalf half : values()) {
            if (half.wireName.equals(wireName)) {
                return half;
            }
        }
        throw new IllegalArgumentException("Unknown inning half: " + wireName);
    }
}
