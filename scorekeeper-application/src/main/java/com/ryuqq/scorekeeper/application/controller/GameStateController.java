package com.ryuqq.scorekeeper.application.controller;

import com.ryuqq.scorekeeper.core.config.ScoringRules;
import com.ryuqq.scorekeeper.core.contract.AdvanceAction;
import com.ryuqq.scorekeeper.core.contract.CorrectAction;
import com.ryuqq.scorekeeper.core.contract.EndAction;
import com.ryuqq.scorekeeper.core.contract.OutAction;
import com.ryuqq.scorekeeper.core.contract.ScoreAction;
import com.ryuqq.scorekeeper.core.contract.ScoringAction;
import com.ryuqq.scorekeeper.core.contract.ScoringActionResult;
import com.ryuqq.scorekeeper.core.contract.StartAction;
import com.ryuqq.scorekeeper.core.error.PayloadValidationException;
import com.ryuqq.scorekeeper.core.error.RejectionReason;
import com.ryuqq.scorekeeper.core.error.RuleViolationException;
import com.ryuqq.scorekeeper.core.model.GameState;
import com.ryuqq.scorekeeper.core.model.GameStatus;
import com.ryuqq.scorekeeper.core.model.Runs;
import com.ryuqq.scorekeeper.core.rules.AdministrativeCorrection;
import com.ryuqq.scorekeeper.core.rules.EndEvaluation;
import com.ryuqq.scorekeeper.core.rules.EndKind;
import com.ryuqq.scorekeeper.core.rules.EndOfGameEvaluator;
import com.ryuqq.scorekeeper.core.rules.InningProgression;
import com.ryuqq.scorekeeper.core.rules.Progression;
import com.ryuqq.scorekeeper.core.statemachine.StatusTransition;
import com.ryuqq.scorekeeper.core.validation.ActionPayloadValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * 경기 상태 컨트롤러.
 *
 * <p>스코어링 액션 하나를 받아 검증 → 규칙 평가 → 새 상태 계산을 수행하는 단일 진입점입니다.
 * 인스턴스는 주입받은 설정과 시계 외에 어떤 가변 상태도 갖지 않으므로,
 * 서로 다른 경기에 대한 호출은 동시에 실행해도 안전합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. 페이로드 구조 검증 → 실패 시 PayloadValidationException
 * 2. 액션별 규칙 평가 및 새 상태 계산 → 실패 시 RuleViolationException
 * 3. updatedAt 기록 후 {action, previousState, newState, autoAdvanced} 반환
 * </pre>
 *
 * <p>새 updatedAt은 항상 이전 값보다 뒤입니다. 시계가 멈춰 있거나 되돌아가면
 * 이전 값에 1ns를 더해 기록합니다.</p>
 *
 * <p><strong>원자성:</strong> 입력 상태는 불변이며, 예외가 발생하면 어떤 결과도 반환되지 않습니다.</p>
 *
 * <p><strong>동시성:</strong> 같은 경기에 대한 동시 호출은 직렬화하지 않습니다.
 * 저장 경계의 낙관적 동시성 검사({@link com.ryuqq.scorekeeper.core.spi.GameStateStore#save})가 이를 담당합니다.</p>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public final class GameStateController {

    private static final Logger log = LoggerFactory.getLogger(GameStateController.class);
    private static final Marker AUDIT = MarkerFactory.getMarker("AUDIT");

    private final ScoringRules rules;
    private final ActionPayloadValidator validator;
    private final EndOfGameEvaluator endOfGameEvaluator;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param rules 스코어링 규칙
     * @param clock 시각 기준
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public GameStateController(ScoringRules rules, Clock clock) {
        if (rules == null) {
            throw new IllegalArgumentException("rules cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.rules = rules;
        this.validator = new ActionPayloadValidator(rules);
        this.endOfGameEvaluator = new EndOfGameEvaluator(rules);
        this.clock = clock;
    }

    /**
     * 액션 적용.
     *
     * @param current 현재 경기 상태
     * @param action 적용할 액션
     * @return 액션 결과
     * @throws IllegalArgumentException current 또는 action이 null인 경우
     * @throws PayloadValidationException 페이로드 구조 검증 실패 시
     * @throws RuleViolationException 비즈니스 규칙 위반 시
     */
    public ScoringActionResult apply(GameState current, ScoringAction action) {
        if (current == null) {
            throw new IllegalArgumentException("current cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }

        validator.validateOrThrow(action);

        Instant now = clock.instant();
        Progression progression = dispatch(current, action, now);
        GameState next = progression.state().withUpdatedAt(nextUpdatedAt(current, now));
        ScoringActionResult result = new ScoringActionResult(action.type(), current, next, progression.autoAdvanced());

        if (action.type().isAdministrative()) {
            log.warn(AUDIT, "Administrative correction applied to {}: {} → {}", current.id().getValue(), current, next);
        } else {
            log.info("{} applied to {}: status={}, inning={} {}, outs={}, score {}-{} (away-home){}",
                action.type().wireName(),
                next.id().getValue(),
                next.status().wireName(),
                next.currentHalf() == null ? "-" : next.currentHalf().wireName(),
                next.currentInning() == null ? "-" : next.currentInning().number(),
                next.outs().count(),
                next.awayScore(),
                next.homeScore(),
                result.autoAdvanced() ? " [auto-advanced]" : "");
        }
        return result;
    }

    private Progression dispatch(GameState current, ScoringAction action, Instant now) {
        if (action instanceof StartAction start) {
            return Progression.of(InningProgression.start(current, start.targetStatus(), now));
        }
        if (action instanceof ScoreAction score) {
            return Progression.of(InningProgression.recordScore(current, Runs.of(score.runs())));
        }
        if (action instanceof OutAction out) {
            return InningProgression.recordOuts(current, out.effectiveCount(), rules.maxInnings());
        }
        if (action instanceof AdvanceAction advance) {
            return Progression.of(InningProgression.advance(current, advance, rules.maxInnings()));
        }
        if (action instanceof EndAction end) {
            return Progression.of(end(current, end, now));
        }
        if (action instanceof CorrectAction correct) {
            return Progression.of(AdministrativeCorrection.apply(current, correct));
        }
        throw new IllegalArgumentException("Unsupported action: " + action.getClass().getName());
    }

    // 저장소의 compare-and-swap은 updatedAt이 매 변경마다 달라야 성립
    private static Instant nextUpdatedAt(GameState current, Instant now) {
        return now.isAfter(current.updatedAt()) ? now : current.updatedAt().plusNanos(1);
    }

    private GameState end(GameState current, EndAction action, Instant now) {
        if (current.status() != GameStatus.IN_PROGRESS) {
            throw new RuleViolationException(
                RejectionReason.CAN_ONLY_END_IN_PROGRESS,
                "Can only end games that are in progress (status: " + current.status().wireName() + ")",
                current
            );
        }
        GameStatus target = action.targetStatus();
        StatusTransition.validate(current, target);

        // 정규 종료 판정은 FINAL로 끝낼 때만 적용
        if (target == GameStatus.FINAL) {
            EndEvaluation evaluation = endOfGameEvaluator.canEnd(current);
            if (evaluation instanceof EndEvaluation.Rejected rejected) {
                throw new RuleViolationException(rejected.reason(), rejected.message(), current);
            }
            EndKind kind = ((EndEvaluation.Allowed) evaluation).kind();
            log.info("Game {} ending as final ({}) at {}-{} (away-home)",
                current.id().getValue(), kind, current.awayScore(), current.homeScore());
        }

        GameState ended = current.withLifecycle(target, current.startedAt(), now);
        return action.notes() != null ? ended.withNotes(action.notes()) : ended;
    }
}
