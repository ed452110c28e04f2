package com.ryuqq.scorekeeper.core.contract;

/**
 * 경기 하나에 적용할 스코어링 액션 페이로드.
 *
 * <p>Sealed interface로 정의되어 여섯 가지 액션 외의 구현을 허용하지 않습니다.
 * 페이로드는 값만 담으며, 범위 검증은
 * {@link com.ryuqq.scorekeeper.core.validation.ActionPayloadValidator}가 필드별로 수행합니다.</p>
 *
 * <ul>
 *   <li>{@link StartAction}: 경기 시작 또는 재개</li>
 *   <li>{@link ScoreAction}: 현재 하프 이닝 득점 기록</li>
 *   <li>{@link OutAction}: 아웃 기록 (3아웃 시 자동 진행)</li>
 *   <li>{@link AdvanceAction}: 하프 이닝 수동 진행</li>
 *   <li>{@link EndAction}: 경기 종료/중단</li>
 *   <li>{@link CorrectAction}: 관리자 보정</li>
 * </ul>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public sealed interface ScoringAction
    permits StartAction, ScoreAction, OutAction, AdvanceAction, EndAction, CorrectAction {

    /**
     * 액션 종류.
     *
     * @return 액션 종류
     */
    ScoringActionType type();
}
