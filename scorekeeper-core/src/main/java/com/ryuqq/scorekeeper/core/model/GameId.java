package com.ryuqq.scorekeeper.core.model;

/**
 * 경기의 전역 고유 식별자.
 *
 * <p>GameId는 스케줄링 협력자가 경기를 생성할 때 부여하며,
 * 이후 모든 스코어링 액션의 대상 경기를 지정하는 데 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public final class GameId {

    private final String value;

    private GameId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("GameId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("GameId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("GameId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * GameId 생성.
     *
     * @param value GameId 값
     * @return GameId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static GameId of(String value) {
        return new GameId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GameId gameId = (GameId) o;
        return value.equals(gameId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "GameId{" + value + '}';
    }
}
