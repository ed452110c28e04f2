package com.ryuqq.scorekeeper.core.rules;

import com.ryuqq.scorekeeper.core.error.RejectionReason;

/**
 * 경기 종료 가능 여부 판정 결과.
 *
 * <ul>
 *   <li>{@link Allowed}: 종료 가능 (종료 분류 포함)</li>
 *   <li>{@link Rejected}: 종료 불가 (사유 포함)</li>
 * </ul>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public sealed interface EndEvaluation permits EndEvaluation.Allowed, EndEvaluation.Rejected {

    /**
     * 종료 가능 여부.
     *
     * @return 종료 가능하면 true
     */
    boolean valid();

    /**
     * 종료 허용.
     *
     * @param kind 종료 분류
     */
    record Allowed(EndKind kind) implements EndEvaluation {

        public Allowed {
            if (kind == null) {
                throw new IllegalArgumentException("kind cannot be null");
            }
        }

        @Override
        public boolean valid() {
            return true;
        }
    }

    /**
     * 종료 거부.
     *
     * @param reason 거부 사유
     * @param message 상세 메시지
     */
    record Rejected(RejectionReason reason, String message) implements EndEvaluation {

        public Rejected {
            if (reason == null) {
                throw new IllegalArgumentException("reason cannot be null");
            }
            if (message == null || message.isBlank()) {
                throw new IllegalArgumentException("message cannot be null or blank");
            }
        }

        @Override
        public boolean valid() {
            return false;
        }
    }
}
