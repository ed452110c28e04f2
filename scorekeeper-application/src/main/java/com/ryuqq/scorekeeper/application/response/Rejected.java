package com.ryuqq.scorekeeper.application.response;

import com.ryuqq.scorekeeper.core.error.RejectionReason;

/**
 * 규칙 위반으로 거부됨 ({@code {valid: false, reason}}).
 *
 * @param reason 거부 사유
 * @param message 상세 메시지
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public record Rejected(RejectionReason reason, String message) implements ScoringResponse {

    public Rejected {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    public boolean valid() {
        return false;
    }

    /**
     * 외부 사유 코드 (예: "InvalidOutCount").
     *
     * @return 사유 코드
     */
    public String reasonCode() {
        return reason.code();
    }
}
