package com.ryuqq.scorekeeper.core.model;

/**
 * 이닝 번호 (1 이상).
 *
 * <p>상한은 없습니다. 정규 이닝을 넘어서는 값은 연장전을 의미합니다.</p>
 *
 * @param number 이닝 번호 (1부터 시작)
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public record Inning(int number) {

    /**
     * 첫 번째 이닝.
     */
    public static final Inning FIRST = new Inning(1);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException number가 1 미만인 경우
     */
    public Inning {
        if (number < 1) {
            throw new IllegalArgumentException("Inning must be at least 1 (current: " + number + ")");
        }
    }

    public static Inning of(int number) {
        return new Inning(number);
    }

    /**
     * 다음 이닝.
     *
     * @return number + 1 이닝
     */
    public Inning next() {
        return new Inning(number + 1);
    }

    /**
     * 이닝 점수 배열에서의 위치 (0부터 시작).
     *
     * @return number - 1
     */
    public int index() {
        return number - 1;
    }

    /**
     * 주어진 정규 이닝 수를 넘어선 연장 이닝인지 확인.
     *
     * @param regulationInnings 정규 이닝 수 (보통 9)
     * @return number가 regulationInnings보다 크면 true
     */
    public boolean isExtra(int regulationInnings) {
        return number > regulationInnings;
    }
}
