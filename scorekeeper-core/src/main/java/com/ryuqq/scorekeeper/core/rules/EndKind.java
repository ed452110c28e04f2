package com.ryuqq.scorekeeper.core.rules;

/**
 * 허용된 경기 종료의 분류.
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public enum EndKind {

    /**
     * 정규 이닝 이후 말 공격 중 홈팀이 앞선 끝내기.
     */
    WALK_OFF,

    /**
     * 정규 이닝 이후 한 팀이 앞선 정규 종료.
     */
    REGULATION,

    /**
     * 정규 조건 전의 조기 종료 (콜드게임, 우천, 감독 재량).
     */
    EARLY
}
