package com.ryuqq.scorekeeper.core.model;

/**
 * 득점 수 (0 이상).
 *
 * @param value 득점
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public record Runs(int value) {

    public static final Runs ZERO = new Runs(0);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 음수인 경우
     */
    public Runs {
        if (value < 0) {
            throw new IllegalArgumentException("Runs cannot be negative (current: " + value + ")");
        }
    }

    public static Runs of(int value) {
        return new Runs(value);
    }

    public Runs plus(Runs other) {
        return new Runs(Math.addExact(value, other.value));
    }
}
