package com.ryuqq.scorekeeper.application.service;

import com.ryuqq.scorekeeper.application.response.GameStateView;
import com.ryuqq.scorekeeper.application.response.ScoringResponse;
import com.ryuqq.scorekeeper.core.contract.AdvanceAction;
import com.ryuqq.scorekeeper.core.contract.CorrectAction;
import com.ryuqq.scorekeeper.core.contract.EndAction;
import com.ryuqq.scorekeeper.core.contract.OutAction;
import com.ryuqq.scorekeeper.core.contract.ScoreAction;
import com.ryuqq.scorekeeper.core.contract.ScoringAction;
import com.ryuqq.scorekeeper.core.contract.StartAction;
import com.ryuqq.scorekeeper.core.model.GameId;

import java.util.List;
import java.util.Optional;

/**
 * 경기 스코어링 서비스.
 *
 * <p>경기 ID와 액션을 받아 저장소에서 상태를 읽고, 컨트롤러로 새 상태를 계산한 뒤
 * 낙관적 동시성 검사와 함께 저장하고, 구독자에게 결과를 전달합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ScoringResponse response = service.out(gameId, OutAction.of(2));
 *
 * if (response instanceof Applied applied) {
 *     // applied.newState(), applied.autoAdvanced()
 * } else if (response instanceof Rejected rejected) {
 *     // {valid: false, reason: rejected.reasonCode()}
 * }
 * </pre>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public interface GameScoringService {

    /**
     * 액션 제출.
     *
     * <p>규칙 위반, 검증 실패, 동시 변경은 예외가 아닌 응답으로 돌려줍니다.
     * 자동 재시도는 하지 않습니다.</p>
     *
     * @param gameId 대상 경기 ID
     * @param action 적용할 액션
     * @return 응답
     * @throws IllegalArgumentException gameId 또는 action이 null인 경우
     */
    ScoringResponse submit(GameId gameId, ScoringAction action);

    default ScoringResponse start(GameId gameId, StartAction action) {
        return submit(gameId, action);
    }

    default ScoringResponse score(GameId gameId, ScoreAction action) {
        return submit(gameId, action);
    }

    default ScoringResponse out(GameId gameId, OutAction action) {
        return submit(gameId, action);
    }

    default ScoringResponse advance(GameId gameId, AdvanceAction action) {
        return submit(gameId, action);
    }

    default ScoringResponse end(GameId gameId, EndAction action) {
        return submit(gameId, action);
    }

    default ScoringResponse correct(GameId gameId, CorrectAction action) {
        return submit(gameId, action);
    }

    /**
     * 경기 상태 조회.
     *
     * @param gameId 경기 ID
     * @return 상태 응답 (없으면 empty)
     */
    Optional<GameStateView> findState(GameId gameId);

    /**
     * 진행 중인 경기 목록.
     *
     * @return IN_PROGRESS 경기 (시작 시각 순)
     */
    List<GameStateView> liveGames();
}
