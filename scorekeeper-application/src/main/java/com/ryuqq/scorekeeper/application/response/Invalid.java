package com.ryuqq.scorekeeper.application.response;

import com.ryuqq.scorekeeper.core.error.FieldError;

import java.util.List;

/**
 * 페이로드 구조 검증 실패.
 *
 * @param errors 필드 오류 목록 (1개 이상)
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public record Invalid(List<FieldError> errors) implements ScoringResponse {

    public Invalid {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("errors cannot be null or empty");
        }
        errors = List.copyOf(errors);
    }
}
