package com.ryuqq.scorekeeper.core.model;

/**
 * 경기의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <pre>
 * SCHEDULED   → WARMUP, IN_PROGRESS, POSTPONED, CANCELLED
 * WARMUP      → IN_PROGRESS, POSTPONED, CANCELLED
 * IN_PROGRESS → FINAL, SUSPENDED
 * POSTPONED   → SCHEDULED, CANCELLED
 * SUSPENDED   → IN_PROGRESS, CANCELLED
 * FINAL, CANCELLED → (종료 상태, 나가는 전이 없음)
 * </pre>
 *
 * <p>허용 전이 표는 {@link com.ryuqq.scorekeeper.core.statemachine.StatusTransition}이
 * 유일하게 관리합니다.</p>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public enum GameStatus {

    /**
     * 예정됨 (스케줄링 협력자가 생성한 초기 상태).
     */
    SCHEDULED("scheduled"),

    /**
     * 경기 전 준비 중.
     */
    WARMUP("warmup"),

    /**
     * 진행 중. 득점/아웃/이닝 진행은 이 상태에서만 허용됩니다.
     */
    IN_PROGRESS("in_progress"),

    /**
     * 경기 종료 (종료 상태).
     */
    FINAL("final"),

    /**
     * 연기됨.
     */
    POSTPONED("postponed"),

    /**
     * 취소됨 (종료 상태).
     */
    CANCELLED("cancelled"),

    /**
     * 일시 중단됨 (재개 가능).
     */
    SUSPENDED("suspended");

    private final String wireName;

    GameStatus(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 외부 표현 (예: "in_progress").
     *
     * @return 외부 표현 문자열
     */
    public String wireName() {
        return wireName;
    }

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태(FINAL, CANCELLED)에서는 더 이상 다른 상태로 전이할 수 없습니다.</p>
     *
     * @return FINAL 또는 CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == FINAL || this == CANCELLED;
    }

    /**
     * 현재 이닝/하프 정보가 의미를 가지는 상태인지 확인.
     *
     * @return IN_PROGRESS 또는 SUSPENDED인 경우 true
     */
    public boolean hasLivePosition() {
        return this == IN_PROGRESS || this == SUSPENDED;
    }

    public static GameStatus fromWireName(String wireName) {
        for (GameStatus status : values()) {
            if (status.wireName.equals(wireName)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown game status: " + wireName);
    }
}
