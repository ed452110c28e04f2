package com.ryuqq.scorekeeper.core.rules;

import com.ryuqq.scorekeeper.core.config.ScoringRules;
import com.ryuqq.scorekeeper.core.error.RejectionReason;
import com.ryuqq.scorekeeper.core.model.GameState;
import com.ryuqq.scorekeeper.core.model.GameStatus;
import com.ryuqq.scorekeeper.core.model.InningHalf;

/**
 * 경기 종료(FINAL) 가능 여부 판정기.
 *
 * <p><strong>판정 순서:</strong></p>
 * <ol>
 *   <li>IN_PROGRESS가 아니면 거부 ({@link RejectionReason#CAN_ONLY_END_IN_PROGRESS})</li>
 *   <li>동점이면 이닝과 무관하게 거부 ({@link RejectionReason#REGULATION_NOT_COMPLETE}),
 *       정규 이닝 이후라면 연장전으로 계속</li>
 *   <li>정규 이닝 이후 말 공격 중 홈팀 리드 → {@link EndKind#WALK_OFF}</li>
 *   <li>정규 이닝 이후 어느 팀이든 리드 → {@link EndKind#REGULATION}
 *       (requireCompletedTopHalf가 켜져 있으면 초 공격 중의 리드는 제외)</li>
 *   <li>그 외 리드 상태 → {@link EndKind#EARLY}, 단 earlyEndAllowed가 꺼져 있으면 거부</li>
 * </ol>
 *
 * <p>초 공격이 실제로 끝났는지는 추적하지 않습니다. 기본 설정에서는 9회 이후 초 공격 중
 * 원정팀이 앞서 있어도 정규 종료로 인정합니다.</p>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public final class EndOfGameEvaluator {

    private final ScoringRules rules;

    /**
     * 생성자.
     *
     * @param rules 스코어링 규칙
     * @throws IllegalArgumentException rules가 null인 경우
     */
    public EndOfGameEvaluator(ScoringRules rules) {
        if (rules == null) {
            throw new IllegalArgumentException("rules cannot be null");
        }
        this.rules = rules;
    }

    /**
     * 경기를 FINAL로 종료할 수 있는지 판정.
     *
     * @param state 현재 상태
     * @return 판정 결과
     * @throws IllegalArgumentException state가 null인 경우
     */
    public EndEvaluation canEnd(GameState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (state.status() != GameStatus.IN_PROGRESS) {
            return new EndEvaluation.Rejected(
                RejectionReason.CAN_ONLY_END_IN_PROGRESS,
                "Can only end games that are in progress (status: " + state.status().wireName() + ")"
            );
        }

        int inning = state.currentInning().number();
        boolean regulationReached = inning >= rules.regulationInnings();

        if (state.isTied()) {
            String message = regulationReached
                ? String.format("Game is tied %d-%d in inning %d; extra innings must continue",
                    state.homeScore(), state.awayScore(), inning)
                : String.format("Regulation not complete: tied %d-%d in inning %d",
                    state.homeScore(), state.awayScore(), inning);
            return new EndEvaluation.Rejected(RejectionReason.REGULATION_NOT_COMPLETE, message);
        }

        if (regulationReached) {
            boolean bottom = state.currentHalf() == InningHalf.BOTTOM;
            if (bottom && state.homeLeads()) {
                return new EndEvaluation.Allowed(EndKind.WALK_OFF);
            }
            if (bottom || !rules.requireCompletedTopHalf()) {
                return new EndEvaluation.Allowed(EndKind.REGULATION);
            }
            // 초 공격 중: 이전 이닝이 끝난 시점에 홈팀이 앞서 있던 경우만 정규 종료
            if (state.homeLeads() && inning > rules.regulationInnings()) {
                return new EndEvaluation.Allowed(EndKind.REGULATION);
            }
        }

        if (rules.earlyEndAllowed()) {
            return new EndEvaluation.Allowed(EndKind.EARLY);
        }
        return new EndEvaluation.Rejected(
            RejectionReason.REGULATION_NOT_COMPLETE,
            String.format("Regulation not complete: %s of inning %d (regulation is %d innings)",
                state.currentHalf().wireName(), inning, rules.regulationInnings())
        );
    }
}
