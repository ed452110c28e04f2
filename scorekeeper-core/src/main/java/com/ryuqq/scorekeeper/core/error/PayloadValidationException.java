package com.ryuqq.scorekeeper.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 액션 페이로드 구조 검증 실패.
 *
 * <p>범위를 벗어난 정수, 길이 초과 메모, 점수 합계 불일치처럼 규칙 평가 이전에
 * 잡히는 오류를 필드별로 모아 보고합니다. 상태는 변경되지 않습니다.</p>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public class PayloadValidationException extends IllegalArgumentException {

    private final List<FieldError> errors;

    /**
     * 생성자.
     *
     * @param errors 필드 오류 목록 (1개 이상)
     * @throws IllegalArgumentException errors가 null이거나 비어 있는 경우
     */
    public PayloadValidationException(List<FieldError> errors) {
        super(describe(errors));
        this.errors = List.copyOf(errors);
    }

    private static String describe(List<FieldError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("errors cannot be null or empty");
        }
        return errors.stream()
            .map(error -> error.field() + ": " + error.message())
            .collect(Collectors.joining("; ", "Invalid payload (", ")"));
    }

    public List<FieldError> errors() {
        return errors;
    }

    /**
     * 필드별로 묶은 오류 메시지.
     *
     * @return 필드 → 메시지 목록 (입력 순서 유지)
     */
    public Map<String, List<String>> errorsByField() {
        Map<String, List<String>> grouped = errors.stream()
            .collect(Collectors.groupingBy(
                FieldError::field,
                LinkedHashMap::new,
                Collectors.mapping(FieldError::message, Collectors.toList())
            ));
        return Collections.unmodifiableMap(grouped);
    }
}
