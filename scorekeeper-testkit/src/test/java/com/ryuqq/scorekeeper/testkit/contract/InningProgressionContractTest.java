package com.ryuqq.scorekeeper.testkit.contract;

import com.ryuqq.scorekeeper.application.response.Applied;
import com.ryuqq.scorekeeper.core.contract.AdvanceAction;
import com.ryuqq.scorekeeper.core.contract.OutAction;
import com.ryuqq.scorekeeper.core.contract.ScoreAction;
import com.ryuqq.scorekeeper.core.contract.StartAction;
import com.ryuqq.scorekeeper.core.error.RejectionReason;
import com.ryuqq.scorekeeper.core.model.GameId;
import com.ryuqq.scorekeeper.core.model.GameState;
import com.ryuqq.scorekeeper.core.model.InningHalf;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract test for inning progression.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Three single outs advance the half-inning exactly once</li>
 *   <li>A three-out call from zero outs auto-advances immediately</li>
 *   <li>Inning totals always equal the sum of per-inning runs</li>
 *   <li>Partial force spec on advance is rejected and leaves state unchanged</li>
 * </ul>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
class InningProgressionContractTest extends AbstractScoringContractTest {

    @Test
    void testSingleOuts_AdvanceHalfInningExactlyOnce() {
        // Given: every half-inning position from top 1 through bottom 10
        GameId gameId = givenScheduledGame("inn-1");
        assertApplied(service.start(gameId, StartAction.inProgress()));

        for (int halves = 0; halves < 20; halves++) {
            GameState before = stored(gameId);

            // When
            Applied first = assertApplied(service.out(gameId, OutAction.single()));
            Applied second = assertApplied(service.out(gameId, OutAction.single()));
            Applied third = assertApplied(service.out(gameId, OutAction.single()));

            // Then
            assertFalse(first.autoAdvanced());
            assertFalse(second.autoAdvanced());
            assertTrue(third.autoAdvanced());
            GameState after = stored(gameId);
            assertEquals(0, after.outs().count());
            if (before.currentHalf() == InningHalf.TOP) {
                assertEquals(before.currentInning(), after.currentInning());
                assertEquals(InningHalf.BOTTOM, after.currentHalf());
            } else {
                assertEquals(before.currentInning().next(), after.currentInning());
                assertEquals(InningHalf.TOP, after.currentHalf());
            }
        }
    }

    @Test
    void testThreeOutsInOneCall_FromZero_AutoAdvances() {
        // Given
        GameId gameId = givenScheduledGame("inn-2");
        assertApplied(service.start(gameId, StartAction.inProgress()));

        // When
        Applied applied = assertApplied(service.out(gameId, OutAction.of(3)));

        // Then
        assertTrue(applied.autoAdvanced());
        assertEquals(1, applied.newState().currentInning());
        assertEquals("bottom", applied.newState().currentHalf());
        assertEquals(0, applied.newState().outs());
        assertEquals(List.of(0), applied.newState().awayInningScores());
    }

    @Test
    void testScoresStayConsistent_AfterEveryAction() {
        // Given
        GameId gameId = givenScheduledGame("inn-3");
        assertApplied(service.start(gameId, StartAction.inProgress()));

        // When: a short scripted game
        int[][] script = {{2, 0}, {0, 1}, {0, 0}, {3, 2}, {1, 0}};
        for (int[] halfInning : script) {
            for (int runs : halfInning) {
                if (runs > 0) {
                    Applied applied = assertApplied(service.score(gameId, ScoreAction.of(runs)));
                    assertEquals(applied.newState().homeScore(),
                        applied.newState().homeInningScores().stream().mapToInt(Integer::intValue).sum());
                    assertEquals(applied.newState().awayScore(),
                        applied.newState().awayInningScores().stream().mapToInt(Integer::intValue).sum());
                }
                assertApplied(service.out(gameId, OutAction.of(3)));
                assertScoresConsistent(stored(gameId));
            }
        }

        // Then
        GameState state = stored(gameId);
        assertEquals(List.of(2, 0, 0, 3, 1), state.awayInningScores().asList());
        assertEquals(List.of(0, 1, 0, 2, 0), state.homeInningScores().asList());
        assertEquals(6, state.awayScore());
        assertEquals(3, state.homeScore());
        assertEquals(6, state.currentInning().number());
    }

    @Test
    void testOutOverflow_IsRejected() {
        GameId gameId = givenGame(GameStateFixtures.inProgress("inn-4", 3, InningHalf.TOP, 1, List.of(), List.of()));

        assertRejected(service.out(gameId, OutAction.of(3)), RejectionReason.INVALID_OUT_COUNT);
        assertEquals(1, stored(gameId).outs().count());
    }

    @Test
    void testPartialForce_IsRejectedAndStateUnchanged() {
        // Given
        GameId gameId = givenGame(GameStateFixtures.inProgress("inn-5", 9, InningHalf.BOTTOM, 2, List.of(1), List.of(1)));
        GameState before = stored(gameId);

        // When
        assertRejected(service.advance(gameId, new AdvanceAction(10, null)), RejectionReason.INCOMPLETE_FORCE_SPEC);

        // Then
        assertEquals(before, stored(gameId));
    }

    @Test
    void testForcedAdvance_ToExtraInnings() {
        GameId gameId = givenGame(GameStateFixtures.inProgress("inn-6", 9, InningHalf.BOTTOM, 2, List.of(1), List.of(1)));

        Applied applied = assertApplied(service.advance(gameId, AdvanceAction.forceTo(10, InningHalf.TOP)));

        assertEquals(10, applied.newState().currentInning());
        assertTrue(applied.newState().isExtraInnings());
        assertEquals(0, applied.newState().outs());
    }
}
