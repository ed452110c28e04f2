package com.ryuqq.scorekeeper.core.statemachine;

import com.ryuqq.scorekeeper.core.error.RejectionReason;
import com.ryuqq.scorekeeper.core.error.RuleViolationException;
import com.ryuqq.scorekeeper.core.model.GameState;
import com.ryuqq.scorekeeper.core.model.GameStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 경기 상태 전이 검증.
 *
 * <p>이 클래스의 전이 표가 경기 상태 전이의 유일한 기준입니다.
 * 관리자 보정(correct) 액션만 이 표를 거치지 않으며, 보정은 상태 자체를 바꾸지 않습니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>SCHEDULED → WARMUP, IN_PROGRESS, POSTPONED, CANCELLED</li>
 *   <li>WARMUP → IN_PROGRESS, POSTPONED, CANCELLED</li>
 *   <li>IN_PROGRESS → FINAL, SUSPENDED</li>
 *   <li>POSTPONED → SCHEDULED, CANCELLED</li>
 *   <li>SUSPENDED → IN_PROGRESS, CANCELLED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(FINAL, CANCELLED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>자기 자신으로의 전이 불가</li>
 * </ul>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public final class StatusTransition {

    private static final Map<GameStatus, Set<GameStatus>> ALLOWED = buildTable();

    // Utility class - prevent instantiation
    private StatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    private static Map<GameStatus, Set<GameStatus>> buildTable() {
        Map<GameStatus, Set<GameStatus>> table = new EnumMap<>(GameStatus.class);
        table.put(GameStatus.SCHEDULED, EnumSet.of(
            GameStatus.WARMUP, GameStatus.IN_PROGRESS, GameStatus.POSTPONED, GameStatus.CANCELLED));
        table.put(GameStatus.WARMUP, EnumSet.of(
            GameStatus.IN_PROGRESS, GameStatus.POSTPONED, GameStatus.CANCELLED));
        table.put(GameStatus.IN_PROGRESS, EnumSet.of(GameStatus.FINAL, GameStatus.SUSPENDED));
        table.put(GameStatus.FINAL, EnumSet.noneOf(GameStatus.class));
        table.put(GameStatus.POSTPONED, EnumSet.of(GameStatus.SCHEDULED, GameStatus.CANCELLED));
        table.put(GameStatus.CANCELLED, EnumSet.noneOf(GameStatus.class));
        table.put(GameStatus.SUSPENDED, EnumSet.of(GameStatus.IN_PROGRESS, GameStatus.CANCELLED));

        Map<GameStatus, Set<GameStatus>> frozen = new EnumMap<>(GameStatus.class);
        table.forEach((from, targets) -> frozen.put(from, Collections.unmodifiableSet(targets)));
        return Collections.unmodifiableMap(frozen);
    }

    /**
     * 전이가 표에 있는지 확인.
     *
     * @param current 현재 상태
     * @param proposed 제안된 상태
     * @return 허용된 전이이면 true
     * @throws IllegalArgumentException current 또는 proposed가 null인 경우
     */
    public static boolean canTransition(GameStatus current, GameStatus proposed) {
        if (current == null || proposed == null) {
            throw new IllegalArgumentException("Statuses cannot be null (current: " + current + ", proposed: " + proposed + ")");
        }
        return ALLOWED.get(current).contains(proposed);
    }

    /**
     * 전이가 유효한지 검증.
     *
     * @param current 현재 상태
     * @param proposed 제안된 상태
     * @throws IllegalArgumentException current 또는 proposed가 null인 경우
     * @throws RuleViolationException 표에 없는 전이인 경우 ({@link RejectionReason#INVALID_TRANSITION})
     */
    public static void validate(GameStatus current, GameStatus proposed) {
        if (!canTransition(current, proposed)) {
            throw new RuleViolationException(RejectionReason.INVALID_TRANSITION, describe(current, proposed));
        }
    }

    /**
     * 경기 상태 기준으로 전이가 유효한지 검증.
     *
     * <p>거부 시 예외에 현재 경기 상태를 함께 담습니다.</p>
     *
     * @param state 현재 경기 상태
     * @param proposed 제안된 상태
     * @throws IllegalArgumentException state 또는 proposed가 null인 경우
     * @throws RuleViolationException 표에 없는 전이인 경우 ({@link RejectionReason#INVALID_TRANSITION})
     */
    public static void validate(GameState state, GameStatus proposed) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (!canTransition(state.status(), proposed)) {
            throw new RuleViolationException(RejectionReason.INVALID_TRANSITION, describe(state.status(), proposed), state);
        }
    }

    private static String describe(GameStatus current, GameStatus proposed) {
        return current.isTerminal()
            ? String.format("Cannot transition from terminal status: %s → %s", current.wireName(), proposed.wireName())
            : String.format("Invalid status transition: %s → %s", current.wireName(), proposed.wireName());
    }

    /**
     * 현재 상태에서 허용되는 다음 상태들.
     *
     * @param current 현재 상태
     * @return 허용 대상 집합 (수정 불가, 종료 상태면 비어 있음)
     */
    public static Set<GameStatus> allowedTargets(GameStatus current) {
        if (current == null) {
            throw new IllegalArgumentException("current cannot be null");
        }
        return ALLOWED.get(current);
    }
}
