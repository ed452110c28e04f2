package com.ryuqq.scorekeeper.adapter.inmemory.event;

import com.ryuqq.scorekeeper.core.contract.ScoringActionResult;
import com.ryuqq.scorekeeper.core.spi.ScoringEventListener;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory subscriber that queues committed scoring results for announcement senders.
 *
 * <p>Email and chat senders are out of scope for the scoring core. This queue stands in for
 * their inbox: the scoring service enqueues every committed result and a sender drains them
 * in commit order.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryAnnouncementQueue queue = new InMemoryAnnouncementQueue();
 * GameScoringService service = new DefaultGameScoringService(store, controller, rules, List.of(queue));
 *
 * service.end(gameId, EndAction.asFinal());
 * List&lt;ScoringActionResult&gt; pending = queue.drain();
 * </pre>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public class InMemoryAnnouncementQueue implements ScoringEventListener {

    private final ConcurrentLinkedQueue<ScoringActionResult> pending;

    public InMemoryAnnouncementQueue() {
        this.pending = new ConcurrentLinkedQueue<>();
    }

    @Override
    public void onActionCommitted(ScoringActionResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        pending.add(result);
    }

    /**
     * Removes and returns all queued results in commit order.
     *
     * @return queued results (may be empty)
     */
    public List<ScoringActionResult> drain() {
        List<ScoringActionResult> drained = new ArrayList<>();
        ScoringActionResult next;
        while ((next = pending.poll()) != null) {
            drained.add(next);
        }
        return drained;
    }

    /**
     * Returns the number of queued results.
     *
     * @return queue size
     */
    public int size() {
        return pending.size();
    }

    /**
     * Clears all queued results.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        pending.clear();
    }
}
