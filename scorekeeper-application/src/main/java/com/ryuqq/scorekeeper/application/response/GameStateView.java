package com.ryuqq.scorekeeper.application.response;

import com.ryuqq.scorekeeper.core.config.ScoringRules;
import com.ryuqq.scorekeeper.core.model.GameState;

import java.time.Instant;
import java.util.List;

/**
 * 외부로 노출되는 경기 상태 응답.
 *
 * <p>상태/초말은 외부 표현("in_progress", "top")으로 변환되며, 진행 위치가 없는 경기는
 * currentInning, currentHalf가 null입니다.</p>
 *
 * @param id 경기 ID
 * @param status 경기 상태 (예: "in_progress")
 * @param homeScore 홈팀 총점
 * @param awayScore 원정팀 총점
 * @param currentInning 현재 이닝 (null 가능)
 * @param currentHalf 현재 초/말 ("top" 또는 "bottom", null 가능)
 * @param outs 현재 아웃
 * @param homeInningScores 홈팀 이닝별 득점
 * @param awayInningScores 원정팀 이닝별 득점
 * @param isExtraInnings 연장전 여부
 * @param startedAt 시작 시각 (null 가능)
 * @param endedAt 종료 시각 (null 가능)
 * @param updatedAt 마지막 변경 시각
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public record GameStateView(
    String id,
    String status,
    int homeScore,
    int awayScore,
    Integer currentInning,
    String currentHalf,
    int outs,
    List<Integer> homeInningScores,
    List<Integer> awayInningScores,
    boolean isExtraInnings,
    Instant startedAt,
    Instant endedAt,
    Instant updatedAt
) {

    /**
     * GameState로부터 응답 생성.
     *
     * @param state 경기 상태
     * @param rules 연장전 판정에 사용할 규칙
     * @return 응답
     * @throws IllegalArgumentException state 또는 rules가 null인 경우
     */
    public static GameStateView from(GameState state, ScoringRules rules) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (rules == null) {
            throw new IllegalArgumentException("rules cannot be null");
        }
        return new GameStateView(
            state.id().getValue(),
            state.status().wireName(),
            state.homeScore(),
            state.awayScore(),
            state.currentInning() == null ? null : state.currentInning().number(),
            state.currentHalf() == null ? null : state.currentHalf().wireName(),
            state.outs().count(),
            state.homeInningScores().asList(),
            state.awayInningScores().asList(),
            state.isExtraInnings(rules.regulationInnings()),
            state.startedAt(),
            state.endedAt(),
            state.updatedAt()
        );
    }
}
