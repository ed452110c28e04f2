package com.ryuqq.scorekeeper.core.contract;

/**
 * 스코어링 액션 종류.
 *
 * <p>{@link #CORRECT}는 관리자 보정이며, 감사 로그에서 일반 플레이 액션과 구분됩니다.</p>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public enum ScoringActionType {
    START("start"),
    SCORE("score"),
    OUT("out"),
    ADVANCE("advance"),
    END("end"),
    CORRECT("correct");

    private final String wireName;

    ScoringActionType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 관리자 보정 액션인지 확인.
     *
     * @return CORRECT이면 true
     */
    public boolean isAdministrative() {
        return this == CORRECT;
    }
}
