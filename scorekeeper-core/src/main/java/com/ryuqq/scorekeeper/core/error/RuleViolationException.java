package com.ryuqq.scorekeeper.core.error;

import com.ryuqq.scorekeeper.core.model.GameState;

/**
 * 비즈니스 규칙 위반으로 액션이 거부되었음을 나타내는 예외.
 *
 * <p>예외가 발생한 액션은 어떤 상태 변경도 남기지 않습니다.
 * {@link #currentState()}는 거부를 일으킨 상태이며, 상태 없이 판단되는 규칙
 * (예: 순수 전이 검증)에서는 null일 수 있습니다.</p>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public class RuleViolationException extends IllegalStateException {

    private final RejectionReason reason;
    private final transient GameState currentState;

    /**
     * 생성자.
     *
     * @param reason 거부 사유
     * @param message 상세 메시지
     * @param currentState 거부를 일으킨 상태 (null 가능)
     * @throws IllegalArgumentException reason이 null인 경우
     */
    public RuleViolationException(RejectionReason reason, String message, GameState currentState) {
        super(message);
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        this.reason = reason;
        this.currentState = currentState;
    }

    public RuleViolationException(RejectionReason reason, String message) {
        this(reason, message, null);
    }

    public RejectionReason reason() {
        return reason;
    }

    public GameState currentState() {
        return currentState;
    }
}
