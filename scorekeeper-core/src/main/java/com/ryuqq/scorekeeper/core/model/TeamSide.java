package com.ryuqq.scorekeeper.core.model;

/**
 * 홈/원정 구분.
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public enum TeamSide {
    HOME,
    AWAY
}
