package com.ryuqq.scorekeeper.core.statemachine;

import com.ryuqq.scorekeeper.core.error.RejectionReason;
import com.ryuqq.scorekeeper.core.error.RuleViolationException;
import com.ryuqq.scorekeeper.core.model.GameId;
import com.ryuqq.scorekeeper.core.model.GameState;
import com.ryuqq.scorekeeper.core.model.GameStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;

import static com.ryuqq.scorekeeper.core.model.GameStatus.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StatusTransition 테스트.
 *
 * <ul>
 *   <li>전이 표에 있는 전이만 허용</li>
 *   <li>FINAL, CANCELLED에서는 어떤 전이도 불가</li>
 *   <li>자기 자신으로의 전이 불가</li>
 *   <li>거부 시 INVALID_TRANSITION</li>
 * </ul>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
class StatusTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void validate_ScheduledToWarmup_Succeeds() {
        assertDoesNotThrow(() -> StatusTransition.validate(SCHEDULED, WARMUP));
    }

    @Test
    void validate_WarmupToInProgress_Succeeds() {
        assertDoesNotThrow(() -> StatusTransition.validate(WARMUP, IN_PROGRESS));
    }

    @Test
    void validate_InProgressToFinalOrSuspended_Succeeds() {
        assertDoesNotThrow(() -> StatusTransition.validate(IN_PROGRESS, FINAL));
        assertDoesNotThrow(() -> StatusTransition.validate(IN_PROGRESS, SUSPENDED));
    }

    @Test
    void validate_PostponedBackToScheduled_Succeeds() {
        assertDoesNotThrow(() -> StatusTransition.validate(POSTPONED, SCHEDULED));
    }

    @Test
    void validate_SuspendedToInProgress_Succeeds() {
        assertDoesNotThrow(() -> StatusTransition.validate(SUSPENDED, IN_PROGRESS));
    }

    // ========== 잘못된 전이 테스트 ==========

    @Test
    void validate_FinalToInProgress_ThrowsInvalidTransition() {
        RuleViolationException exception = assertThrows(RuleViolationException.class,
            () -> StatusTransition.validate(FINAL, IN_PROGRESS));

        assertEquals(RejectionReason.INVALID_TRANSITION, exception.reason());
        assertTrue(exception.getMessage().contains("terminal"));
        assertTrue(exception.getMessage().contains("final → in_progress"));
    }

    @Test
    void validate_ScheduledToFinal_ThrowsInvalidTransition() {
        RuleViolationException exception = assertThrows(RuleViolationException.class,
            () -> StatusTransition.validate(SCHEDULED, FINAL));

        assertEquals(RejectionReason.INVALID_TRANSITION, exception.reason());
        assertEquals("Invalid status transition: scheduled → final", exception.getMessage());
    }

    @Test
    void validate_InProgressToPostponed_ThrowsInvalidTransition() {
        assertThrows(RuleViolationException.class,
            () -> StatusTransition.validate(IN_PROGRESS, POSTPONED));
        assertThrows(RuleViolationException.class,
            () -> StatusTransition.validate(IN_PROGRESS, CANCELLED));
    }

    @Test
    void canTransition_TerminalStatuses_HaveNoTargets() {
        for (GameStatus target : GameStatus.values()) {
            assertFalse(StatusTransition.canTransition(FINAL, target), "final → " + target);
            assertFalse(StatusTransition.canTransition(CANCELLED, target), "cancelled → " + target);
        }
        assertTrue(StatusTransition.allowedTargets(FINAL).isEmpty());
    }

    @Test
    void canTransition_SelfTransition_NeverAllowed() {
        for (GameStatus status : GameStatus.values()) {
            assertFalse(StatusTransition.canTransition(status, status), status + " → " + status);
        }
    }

    @Test
    void canTransition_NullStatus_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> StatusTransition.canTransition(null, FINAL));
        assertThrows(IllegalArgumentException.class, () -> StatusTransition.canTransition(SCHEDULED, null));
    }

    // ========== 전이 표 테스트 ==========

    @Test
    void allowedTargets_MatchesTable() {
        assertEquals(EnumSet.of(WARMUP, IN_PROGRESS, POSTPONED, CANCELLED), StatusTransition.allowedTargets(SCHEDULED));
        assertEquals(EnumSet.of(IN_PROGRESS, POSTPONED, CANCELLED), StatusTransition.allowedTargets(WARMUP));
        assertEquals(EnumSet.of(FINAL, SUSPENDED), StatusTransition.allowedTargets(IN_PROGRESS));
        assertEquals(EnumSet.of(SCHEDULED, CANCELLED), StatusTransition.allowedTargets(POSTPONED));
        assertEquals(EnumSet.of(IN_PROGRESS, CANCELLED), StatusTransition.allowedTargets(SUSPENDED));
    }

    @Test
    void allowedTargets_IsUnmodifiable() {
        assertThrows(UnsupportedOperationException.class,
            () -> StatusTransition.allowedTargets(SCHEDULED).add(FINAL));
    }

    @Test
    void validate_WithState_AttachesCurrentState() {
        GameState state = GameState.scheduled(GameId.of("g-1"), Instant.parse("2026-04-04T17:05:00Z"));

        RuleViolationException exception = assertThrows(RuleViolationException.class,
            () -> StatusTransition.validate(state, SUSPENDED));

        assertSame(state, exception.currentState());
    }
}
