package com.ryuqq.scorekeeper.testkit.contract;

import com.ryuqq.scorekeeper.application.response.Applied;
import com.ryuqq.scorekeeper.application.response.Invalid;
import com.ryuqq.scorekeeper.application.response.ScoringResponse;
import com.ryuqq.scorekeeper.core.contract.AdvanceAction;
import com.ryuqq.scorekeeper.core.contract.CorrectAction;
import com.ryuqq.scorekeeper.core.contract.ScoreAction;
import com.ryuqq.scorekeeper.core.contract.ScoringActionType;
import com.ryuqq.scorekeeper.core.error.FieldError;
import com.ryuqq.scorekeeper.core.error.RejectionReason;
import com.ryuqq.scorekeeper.core.model.GameId;
import com.ryuqq.scorekeeper.core.model.GameState;
import com.ryuqq.scorekeeper.core.model.GameStatus;
import com.ryuqq.scorekeeper.core.model.InningHalf;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract test for administrative corrections.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Inconsistent total and inning scores → invalid, state unchanged</li>
 *   <li>Consistent correction applies regardless of status</li>
 *   <li>Correction never changes status</li>
 *   <li>Out-of-range inning or overflowing scores → invalid or rejected, never fatal</li>
 * </ul>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
class CorrectionContractTest extends AbstractScoringContractTest {

    @Test
    void testInconsistentSum_IsInvalidAndStateUnchanged() {
        // Given
        GameId gameId = givenGame(GameStateFixtures.inProgress("cor-1", 4, InningHalf.TOP, 1, List.of(1, 1, 1), List.of(0)));
        GameState before = stored(gameId);

        // When
        ScoringResponse response = service.correct(gameId, CorrectAction.builder()
            .homeScore(5)
            .homeInningScores(List.of(1, 2, 1))
            .build());

        // Then
        assertTrue(response.isInvalid());
        List<String> fields = ((Invalid) response).errors().stream()
            .map(FieldError::field)
            .collect(Collectors.toList());
        assertEquals(List.of("homeScore"), fields);
        assertEquals(before, stored(gameId));
    }

    @Test
    void testTotalOnlyMismatch_IsInvalid() {
        GameId gameId = givenGame(GameStateFixtures.inProgress("cor-2", 4, InningHalf.TOP, 1, List.of(1, 1, 1), List.of(0)));

        ScoringResponse response = service.correct(gameId, CorrectAction.builder().awayScore(2).build());

        assertTrue(response.isInvalid());
        assertEquals("awayScore", ((Invalid) response).errors().get(0).field());
    }

    @Test
    void testConsistentCorrection_AppliesOnFinalGame() {
        // Given
        GameId gameId = givenGame(GameStateFixtures.withStatus("cor-3", GameStatus.FINAL));
        GameState before = stored(gameId);

        // When
        Applied applied = assertApplied(service.correct(gameId, CorrectAction.builder()
            .homeScore(4)
            .homeInningScores(List.of(1, 2, 1))
            .notes("Scorer error in 2nd inning")
            .build()));

        // Then
        assertEquals(ScoringActionType.CORRECT.wireName(), applied.action());
        GameState after = stored(gameId);
        assertEquals(GameStatus.FINAL, after.status());
        assertEquals(before.endedAt(), after.endedAt());
        assertEquals(4, after.homeScore());
        assertEquals("Scorer error in 2nd inning", after.notes());
        assertScoresConsistent(after);
    }

    @Test
    void testCorrection_OnScheduledGame_SetsPosition() {
        GameId gameId = givenScheduledGame("cor-4");

        Applied applied = assertApplied(service.correct(gameId, CorrectAction.builder()
            .currentInning(2)
            .currentHalf(InningHalf.BOTTOM)
            .outs(1)
            .build()));

        assertEquals("scheduled", applied.newState().status());
        assertEquals(2, applied.newState().currentInning());
        assertEquals("bottom", applied.newState().currentHalf());
        assertEquals(1, applied.newState().outs());
    }

    @Test
    void testCorrection_IsAnnouncedLikeAnyOtherAction() {
        GameId gameId = givenGame(GameStateFixtures.inProgress("cor-5", 3, InningHalf.BOTTOM));

        assertApplied(service.correct(gameId, CorrectAction.builder().outs(2).build()));

        assertEquals(ScoringActionType.CORRECT, announcements.drain().get(0).action());
    }

    @Test
    void testInningBeyondMaximum_IsInvalidAndGameKeepsPlaying() {
        // Given
        GameId gameId = givenGame(GameStateFixtures.inProgress("cor-6", 3, InningHalf.TOP));
        GameState before = stored(gameId);

        // When
        ScoringResponse response = service.correct(gameId, CorrectAction.builder()
            .currentInning(Integer.MAX_VALUE)
            .currentHalf(InningHalf.BOTTOM)
            .build());

        // Then
        assertTrue(response.isInvalid());
        assertEquals("currentInning", ((Invalid) response).errors().get(0).field());
        assertEquals(before, stored(gameId));
        Applied advanced = assertApplied(service.advance(gameId, AdvanceAction.next()));
        assertEquals(3, advanced.newState().currentInning());
        assertEquals("bottom", advanced.newState().currentHalf());
    }

    @Test
    void testOverflowingInningScores_IsInvalid() {
        GameId gameId = givenGame(GameStateFixtures.inProgress("cor-7", 2, InningHalf.BOTTOM));

        ScoringResponse response = service.correct(gameId, CorrectAction.builder()
            .homeInningScores(List.of(Integer.MAX_VALUE, 1))
            .build());

        assertTrue(response.isInvalid());
        assertEquals("homeInningScores", ((Invalid) response).errors().get(0).field());
    }

    @Test
    void testScoreOnNearMaximumTotal_IsRejected() {
        // Given: a correction that leaves no headroom
        GameId gameId = givenGame(GameStateFixtures.inProgress("cor-8", 1, InningHalf.TOP));
        assertApplied(service.correct(gameId, CorrectAction.builder()
            .awayInningScores(List.of(Integer.MAX_VALUE))
            .build()));
        GameState before = stored(gameId);

        // When
        ScoringResponse response = service.score(gameId, ScoreAction.of(1));

        // Then
        assertRejected(response, RejectionReason.SCORE_LIMIT_EXCEEDED);
        assertEquals(before, stored(gameId));
        assertEquals(Integer.MAX_VALUE, stored(gameId).awayScore());
    }

    @Test
    void testAdvancePastMaximumInning_IsRejected() {
        GameId gameId = givenGame(GameStateFixtures.inProgress("cor-9", 99, InningHalf.BOTTOM));

        assertRejected(service.advance(gameId, AdvanceAction.next()), RejectionReason.INNING_LIMIT_REACHED);
        assertEquals(99, stored(gameId).currentInning().number());
    }
}
