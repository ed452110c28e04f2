package com.ryuqq.scorekeeper.testkit.contract;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Test clock that only moves when told to.
 *
 * <p>Every {@link #instant()} call advances the clock by a fixed tick so that consecutive
 * actions receive distinct {@code updatedAt} values.</p>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private final AtomicReference<Instant> now;
    private final Duration tick;
    private final ZoneId zone;

    public MutableClock(Instant start, Duration tick) {
        this(new AtomicReference<>(start), tick, ZoneOffset.UTC);
    }

    private MutableClock(AtomicReference<Instant> now, Duration tick, ZoneId zone) {
        if (now.get() == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        if (tick == null || tick.isNegative()) {
            throw new IllegalArgumentException("tick must be non-negative");
        }
        this.now = now;
        this.tick = tick;
        this.zone = zone;
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(now, tick, zone);
    }

    @Override
    public Instant instant() {
        return now.getAndUpdate(current -> current.plus(tick));
    }

    /**
     * Moves the clock forward without consuming a tick.
     *
     * @param duration amount to move
     */
    public void advance(Duration duration) {
        now.updateAndGet(current -> current.plus(duration));
    }

    /**
     * Returns the instant the next {@link #instant()} call will return.
     *
     * @return the upcoming instant
     */
    public Instant peek() {
        return now.get();
    }
}
