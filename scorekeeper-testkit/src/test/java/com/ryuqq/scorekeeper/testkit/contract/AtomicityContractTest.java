package com.ryuqq.scorekeeper.testkit.contract;

import com.ryuqq.scorekeeper.application.response.ScoringResponse;
import com.ryuqq.scorekeeper.core.contract.AdvanceAction;
import com.ryuqq.scorekeeper.core.contract.CorrectAction;
import com.ryuqq.scorekeeper.core.contract.EndAction;
import com.ryuqq.scorekeeper.core.contract.OutAction;
import com.ryuqq.scorekeeper.core.contract.ScoreAction;
import com.ryuqq.scorekeeper.core.contract.ScoringActionResult;
import com.ryuqq.scorekeeper.core.contract.StartAction;
import com.ryuqq.scorekeeper.core.error.RejectionReason;
import com.ryuqq.scorekeeper.core.model.GameId;
import com.ryuqq.scorekeeper.core.model.GameState;
import com.ryuqq.scorekeeper.core.model.GameStatus;
import com.ryuqq.scorekeeper.core.model.InningHalf;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract test for action atomicity.
 *
 * <p>An action either produces a complete new state or leaves the stored state untouched.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Rule violation → stored state and updatedAt unchanged, nothing announced</li>
 *   <li>Payload error → stored state unchanged</li>
 *   <li>Successful action → one announcement carrying previous and new state</li>
 * </ul>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
class AtomicityContractTest extends AbstractScoringContractTest {

    @Test
    void testRejectedOut_LeavesStoredStateUntouched() {
        // Given
        GameId gameId = givenGame(GameStateFixtures.inProgress("atom-1", 4, InningHalf.TOP, 2, List.of(1), List.of(0, 2)));
        GameState before = stored(gameId);

        // When
        ScoringResponse response = service.out(gameId, OutAction.of(2));

        // Then
        assertRejected(response, RejectionReason.INVALID_OUT_COUNT);
        assertEquals(before, stored(gameId));
        assertEquals(0, announcements.size(), "Rejected actions must not be announced");
    }

    @Test
    void testRejectedEnd_LeavesStoredStateUntouched() {
        // Given: tied in the 8th
        GameId gameId = givenGame(GameStateFixtures.inProgress("atom-2", 8, InningHalf.TOP, 0, List.of(2), List.of(2)));
        GameState before = stored(gameId);

        // When
        ScoringResponse response = service.end(gameId, EndAction.asFinal());

        // Then
        assertRejected(response, RejectionReason.REGULATION_NOT_COMPLETE);
        assertEquals(before, stored(gameId));
        assertStatus(gameId, GameStatus.IN_PROGRESS);
    }

    @Test
    void testInvalidPayload_LeavesStoredStateUntouched() {
        // Given
        GameId gameId = givenGame(GameStateFixtures.inProgress("atom-3", 2, InningHalf.BOTTOM));
        GameState before = stored(gameId);

        // When
        ScoringResponse correct = service.correct(gameId, CorrectAction.builder().outs(3).build());
        ScoringResponse score = service.score(gameId, ScoreAction.of(-2));

        // Then
        assertTrue(correct.isInvalid());
        assertTrue(score.isInvalid());
        assertEquals(before, stored(gameId));
        assertEquals(0, announcements.size());
    }

    @Test
    void testRejectionsAcrossActions_NeverPartiallyApply() {
        // Given: a scheduled game cannot score, record outs, advance or end
        GameId gameId = givenScheduledGame("atom-4");
        GameState before = stored(gameId);

        // When & Then
        assertRejected(service.score(gameId, ScoreAction.of(1)), RejectionReason.CANNOT_SCORE);
        assertRejected(service.out(gameId, OutAction.single()), RejectionReason.CANNOT_SCORE);
        assertRejected(service.advance(gameId, AdvanceAction.next()), RejectionReason.CANNOT_SCORE);
        assertRejected(service.end(gameId, EndAction.asFinal()), RejectionReason.CAN_ONLY_END_IN_PROGRESS);
        assertEquals(before, stored(gameId));
    }

    @Test
    void testAppliedAction_IsAnnouncedOnceWithBothStates() {
        // Given
        GameId gameId = givenScheduledGame("atom-5");

        // When
        assertApplied(service.start(gameId, StartAction.inProgress()));

        // Then
        List<ScoringActionResult> results = announcements.drain();
        assertEquals(1, results.size());
        assertEquals(GameStatus.SCHEDULED, results.get(0).previousState().status());
        assertEquals(GameStatus.IN_PROGRESS, results.get(0).newState().status());
        assertEquals(stored(gameId), results.get(0).newState());
    }
}
