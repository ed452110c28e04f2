package com.ryuqq.scorekeeper.core.error;

/**
 * 입력 필드 하나에 대한 구조 검증 오류.
 *
 * @param field 필드 경로 (예: "runs", "homeInningScores[2]")
 * @param message 오류 메시지
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public record FieldError(String field, String message) {

    public FieldError {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }
}
