package com.ryuqq.scorekeeper.core.error;

/**
 * 비즈니스 규칙 거부 사유.
 *
 * <p>각 값은 위반된 규칙 하나를 가리키며, 외부 응답의 {@code reason} 코드로 노출됩니다.
 * 거부는 모두 정상적인 결과이며 자동 재시도하지 않습니다.</p>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public enum RejectionReason {

    /**
     * 상태 전이 표에 없는 전이.
     */
    INVALID_TRANSITION("InvalidTransition"),

    /**
     * SCHEDULED, WARMUP, SUSPENDED 이외의 상태에서 시작 시도.
     */
    CANNOT_START("CannotStart"),

    /**
     * IN_PROGRESS가 아닌 경기에 득점/아웃/이닝 진행 시도.
     */
    CANNOT_SCORE("CannotScore"),

    /**
     * IN_PROGRESS가 아닌 경기의 종료 시도.
     */
    CAN_ONLY_END_IN_PROGRESS("CanOnlyEndInProgress"),

    /**
     * 아웃 합계가 3을 초과.
     */
    INVALID_OUT_COUNT("InvalidOutCount"),

    /**
     * forceInning/forceHalf 중 하나만 지정.
     */
    INCOMPLETE_FORCE_SPEC("IncompleteForceSpec"),

    /**
     * 정규 종료 조건 미충족 (동점 또는 조기 종료 불허).
     */
    REGULATION_NOT_COMPLETE("RegulationNotComplete"),

    /**
     * 최대 이닝을 넘어서는 진행.
     */
    INNING_LIMIT_REACHED("InningLimitReached"),

    /**
     * 득점 합계가 int 범위를 넘음.
     */
    SCORE_LIMIT_EXCEEDED("ScoreLimitExceeded"),

    /**
     * 저장 시점에 다른 액션이 먼저 경기 상태를 변경함 (낙관적 동시성 충돌).
     */
    CONCURRENT_MODIFICATION("ConcurrentModification");

    private final String code;

    RejectionReason(String code) {
        this.code = code;
    }

    /**
     * 외부 응답에 노출되는 사유 코드.
     *
     * @return 사유 코드 (예: "InvalidTransition")
     */
    public String code() {
        return code;
    }
}
