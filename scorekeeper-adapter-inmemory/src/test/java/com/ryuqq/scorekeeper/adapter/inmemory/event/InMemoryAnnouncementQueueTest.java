package com.ryuqq.scorekeeper.adapter.inmemory.event;

import com.ryuqq.scorekeeper.core.contract.ScoringActionResult;
import com.ryuqq.scorekeeper.core.contract.ScoringActionType;
import com.ryuqq.scorekeeper.core.model.GameId;
import com.ryuqq.scorekeeper.core.model.GameState;
import com.ryuqq.scorekeeper.core.model.GameStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InMemoryAnnouncementQueue 테스트.
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
class InMemoryAnnouncementQueueTest {

    private static final Instant T0 = Instant.parse("2026-04-04T17:05:00Z");

    @Test
    void drain_ReturnsResultsInCommitOrderAndEmptiesQueue() {
        InMemoryAnnouncementQueue queue = new InMemoryAnnouncementQueue();
        GameState scheduled = GameState.scheduled(GameId.of("g-1"), T0);
        GameState warmup = scheduled.withStatus(GameStatus.WARMUP);
        ScoringActionResult first = new ScoringActionResult(ScoringActionType.START, scheduled, warmup, false);
        ScoringActionResult second = new ScoringActionResult(
            ScoringActionType.END, warmup, warmup.withStatus(GameStatus.POSTPONED), false);

        queue.onActionCommitted(first);
        queue.onActionCommitted(second);

        assertEquals(2, queue.size());
        assertEquals(List.of(first, second), queue.drain());
        assertEquals(0, queue.size());
        assertTrue(queue.drain().isEmpty());
    }

    @Test
    void onActionCommitted_NullResult_ThrowsIllegalArgument() {
        InMemoryAnnouncementQueue queue = new InMemoryAnnouncementQueue();

        assertThrows(IllegalArgumentException.class, () -> queue.onActionCommitted(null));
    }
}
