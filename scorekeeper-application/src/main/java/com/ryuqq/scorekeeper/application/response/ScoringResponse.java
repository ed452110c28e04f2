package com.ryuqq.scorekeeper.application.response;

/**
 * 스코어링 서비스 응답.
 *
 * <p>ScoringResponse는 네 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Applied}: 액션이 적용되고 저장됨</li>
 *   <li>{@link Rejected}: 비즈니스 규칙 위반 또는 동시 변경으로 거부됨</li>
 *   <li>{@link Invalid}: 페이로드 구조 검증 실패 (필드별 오류)</li>
 *   <li>{@link NotFound}: 대상 경기가 없음</li>
 * </ul>
 *
 * <p>거부는 모두 정상적인 결과입니다. 호출자가 입력을 고쳐 다시 보내거나
 * 관리자 보정(correct)으로 넘길지 결정합니다.</p>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public sealed interface ScoringResponse permits Applied, Rejected, Invalid, NotFound {

    /**
     * 액션이 적용되었는지 확인.
     *
     * @return 적용 여부
     */
    default boolean isApplied() {
        return this instanceof Applied;
    }

    default boolean isRejected() {
        return this instanceof Rejected;
    }

    default boolean isInvalid() {
        return this instanceof Invalid;
    }

    default boolean isNotFound() {
        return this instanceof NotFound;
    }
}
