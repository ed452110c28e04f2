package com.ryuqq.scorekeeper.core.rules;

import com.ryuqq.scorekeeper.core.contract.AdvanceAction;
import com.ryuqq.scorekeeper.core.error.RejectionReason;
import com.ryuqq.scorekeeper.core.error.RuleViolationException;
import com.ryuqq.scorekeeper.core.model.GameState;
import com.ryuqq.scorekeeper.core.model.GameStatus;
import com.ryuqq.scorekeeper.core.model.HalfInning;
import com.ryuqq.scorekeeper.core.model.Inning;
import com.ryuqq.scorekeeper.core.model.InningHalf;
import com.ryuqq.scorekeeper.core.model.InningScores;
import com.ryuqq.scorekeeper.core.model.Outs;
import com.ryuqq.scorekeeper.core.model.Runs;
import com.ryuqq.scorekeeper.core.model.TeamSide;
import com.ryuqq.scorekeeper.core.statemachine.StatusTransition;

import java.time.Instant;

/**
 * 이닝 진행 엔진.
 *
 * <p>경기 상태와 액션 입력만으로 새 상태를 계산하는 순수 함수 모음입니다.
 * 입력 상태는 변경하지 않으며, 규칙 위반 시 {@link RuleViolationException}을 던지고
 * 아무 결과도 만들지 않습니다.</p>
 *
 * <p><strong>하프 이닝 진행 규칙 (자동/수동 공통):</strong></p>
 * <pre>
 * 초 → 같은 이닝의 말
 * 말 → 다음 이닝의 초
 * 진행 시 아웃 0으로 초기화, 공격 팀의 해당 이닝 득점 칸을 0으로 확보
 * </pre>
 *
 * <p>최대 이닝의 말에서는 더 진행할 수 없으며 {@link RejectionReason#INNING_LIMIT_REACHED}로 거부됩니다.</p>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public final class InningProgression {

    // Utility class - prevent instantiation
    private InningProgression() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 경기 시작 (또는 중단된 경기 재개).
     *
     * <p>SCHEDULED/WARMUP에서 IN_PROGRESS로 시작하면 1회 초, 0아웃, 빈 득점표로 초기화합니다.
     * SUSPENDED에서 재개하면 이닝/아웃/득점을 유지하고 endedAt만 지웁니다.
     * startedAt은 처음 IN_PROGRESS에 진입할 때 한 번만 기록됩니다.</p>
     *
     * @param state 현재 상태
     * @param target 목표 상태 (WARMUP 또는 IN_PROGRESS)
     * @param now 현재 시각
     * @return 새 상태
     * @throws RuleViolationException 시작할 수 없는 상태이거나 ({@link RejectionReason#CANNOT_START})
     *         전이 표에 없는 경우 ({@link RejectionReason#INVALID_TRANSITION})
     */
    public static GameState start(GameState state, GameStatus target, Instant now) {
        GameStatus current = state.status();
        switch (current) {
            case SCHEDULED, WARMUP, SUSPENDED -> {
                // 시작 가능
            }
            case IN_PROGRESS -> throw cannotStart(state, "Game is already in progress");
            case FINAL -> throw cannotStart(state, "Game has already ended");
            case CANCELLED -> throw cannotStart(state, "Game has been cancelled");
            default -> throw cannotStart(state, "Cannot start game with status '" + current.wireName() + "'");
        }
        StatusTransition.validate(state, target);

        if (target != GameStatus.IN_PROGRESS) {
            return state.withStatus(target);
        }

        Instant startedAt = state.startedAt() != null ? state.startedAt() : now;
        if (current == GameStatus.SUSPENDED) {
            return state.withLifecycle(GameStatus.IN_PROGRESS, startedAt, null);
        }

        HalfInning opening = HalfInning.OPENING;
        return state
            .withPosition(opening.inning(), opening.half(), Outs.NONE)
            .withInningScores(TeamSide.HOME, InningScores.empty())
            .withInningScores(TeamSide.AWAY, InningScores.empty())
            .withLifecycle(GameStatus.IN_PROGRESS, startedAt, null);
    }

    /**
     * 현재 하프 이닝에 득점 기록.
     *
     * <p>초에는 원정팀, 말에는 홈팀의 이닝별 득점에 더하며, 총점은 배열 합으로 다시 계산됩니다.
     * 아웃과 이닝은 변하지 않습니다.</p>
     *
     * @param state 현재 상태
     * @param runs 득점
     * @return 새 상태
     * @throws RuleViolationException IN_PROGRESS가 아니거나 ({@link RejectionReason#CANNOT_SCORE})
     *         총점이 int 범위를 넘는 경우 ({@link RejectionReason#SCORE_LIMIT_EXCEEDED})
     */
    public static GameState recordScore(GameState state, Runs runs) {
        requireInProgress(state);
        TeamSide batting = state.currentHalf().battingSide();
        InningScores scores = state.inningScoresOf(batting);
        if ((long) scores.total() + runs.value() > Integer.MAX_VALUE) {
            throw new RuleViolationException(
                RejectionReason.SCORE_LIMIT_EXCEEDED,
                String.format("Cannot add %d run(s) to a total of %d", runs.value(), scores.total()),
                state
            );
        }
        return state.withInningScores(batting, scores.addRuns(state.currentInning(), runs));
    }

    /**
     * 아웃 기록.
     *
     * <p>합계가 정확히 3이면 같은 계산 안에서 다음 하프 이닝으로 진행하고 아웃을 0으로 되돌립니다.</p>
     *
     * @param state 현재 상태
     * @param count 아웃 수 (1~3)
     * @param maxInnings 최대 이닝
     * @return 새 상태와 자동 진행 여부
     * @throws IllegalArgumentException count가 1~3 범위를 벗어난 경우
     * @throws RuleViolationException IN_PROGRESS가 아니거나 ({@link RejectionReason#CANNOT_SCORE})
     *         합계가 3을 넘거나 ({@link RejectionReason#INVALID_OUT_COUNT})
     *         최대 이닝을 넘어 진행하는 경우 ({@link RejectionReason#INNING_LIMIT_REACHED})
     */
    public static Progression recordOuts(GameState state, int count, int maxInnings) {
        if (count < 1 || count > Outs.MAX) {
            throw new IllegalArgumentException("count must be between 1 and " + Outs.MAX + " (current: " + count + ")");
        }
        requireInProgress(state);

        int total = state.outs().count() + count;
        if (total > Outs.MAX) {
            throw new RuleViolationException(
                RejectionReason.INVALID_OUT_COUNT,
                String.format("Cannot record %d out(s) with %d already recorded (max %d)",
                    count, state.outs().count(), Outs.MAX),
                state
            );
        }

        Outs outs = Outs.of(total);
        if (outs.isSide()) {
            return new Progression(closeHalfInning(state, maxInnings), true);
        }
        return Progression.of(state.withOuts(outs));
    }

    /**
     * 하프 이닝 수동 진행.
     *
     * <p>forceInning/forceHalf가 모두 있으면 해당 위치로 이동하고 (득점 칸은 건드리지 않음),
     * 둘 다 없으면 일반 진행 규칙을 따릅니다. 어느 경우든 아웃은 0이 됩니다.</p>
     *
     * @param state 현재 상태
     * @param action 진행 액션
     * @param maxInnings 최대 이닝
     * @return 새 상태
     * @throws RuleViolationException 강제 필드가 한쪽만 있거나 ({@link RejectionReason#INCOMPLETE_FORCE_SPEC})
     *         IN_PROGRESS가 아니거나 ({@link RejectionReason#CANNOT_SCORE})
     *         최대 이닝을 넘어 진행하는 경우 ({@link RejectionReason#INNING_LIMIT_REACHED})
     */
    public static GameState advance(GameState state, AdvanceAction action, int maxInnings) {
        if (action.isPartiallyForced()) {
            throw new RuleViolationException(
                RejectionReason.INCOMPLETE_FORCE_SPEC,
                "Both forceInning and forceHalf must be provided together, or neither",
                state
            );
        }
        requireInProgress(state);

        if (action.isForced()) {
            if (action.forceInning() > maxInnings) {
                throw inningLimit(state, maxInnings);
            }
            return state.withPosition(Inning.of(action.forceInning()), action.forceHalf(), Outs.NONE);
        }
        return closeHalfInning(state, maxInnings);
    }

    /**
     * 현재 위치의 다음 하프 이닝.
     *
     * @param state 현재 상태 (이닝/하프 필수)
     * @return 다음 위치
     */
    public static HalfInning nextHalfInning(GameState state) {
        return new HalfInning(state.currentInning(), state.currentHalf()).next();
    }

    private static GameState closeHalfInning(GameState state, int maxInnings) {
        if (state.currentHalf() == InningHalf.BOTTOM && state.currentInning().number() >= maxInnings) {
            throw inningLimit(state, maxInnings);
        }
        TeamSide batting = state.currentHalf().battingSide();
        InningScores settled = state.inningScoresOf(batting).ensureEntry(state.currentInning());
        HalfInning next = nextHalfInning(state);
        return state
            .withInningScores(batting, settled)
            .withPosition(next.inning(), next.half(), Outs.NONE);
    }

    private static void requireInProgress(GameState state) {
        if (state.status() != GameStatus.IN_PROGRESS) {
            throw new RuleViolationException(
                RejectionReason.CANNOT_SCORE,
                "Can only score games that are in progress (status: " + state.status().wireName() + ")",
                state
            );
        }
    }

    private static RuleViolationException inningLimit(GameState state, int maxInnings) {
        return new RuleViolationException(
            RejectionReason.INNING_LIMIT_REACHED,
            "Cannot advance past inning " + maxInnings + "; end or correct the game instead",
            state
        );
    }

    private static RuleViolationException cannotStart(GameState state, String message) {
        return new RuleViolationException(RejectionReason.CANNOT_START, message, state);
    }
}
