package com.ryuqq.scorekeeper.core.model;

/**
 * 하프 이닝의 아웃 카운트 (0~3).
 *
 * <p>3은 하프 이닝 종료를 판정하는 순간에만 존재하는 값입니다.
 * 3아웃에 도달하면 같은 액션 안에서 다음 하프 이닝으로 넘어가고
 * 아웃은 0으로 초기화되므로, 저장된 {@link GameState}의 아웃은 항상 0~2입니다.</p>
 *
 * @param count 아웃 수
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public record Outs(int count) {

    /**
     * 하프 이닝 당 최대 아웃 수.
     */
    public static final int MAX = 3;

    public static final Outs NONE = new Outs(0);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException count가 0~3 범위를 벗어난 경우
     */
    public Outs {
        if (count < 0 || count > MAX) {
            throw new IllegalArgumentException("Outs must be between 0 and " + MAX + " (current: " + count + ")");
        }
    }

    public static Outs of(int count) {
        return new Outs(count);
    }

    /**
     * 아웃을 더한 결과를 계산.
     *
     * <p>합계가 3을 넘으면 {@link IllegalArgumentException}을 던지며, 값을 잘라내지 않습니다.</p>
     *
     * @param additional 추가할 아웃 수
     * @return 새 Outs
     * @throws IllegalArgumentException 합계가 0~3 범위를 벗어난 경우
     */
    public Outs plus(int additional) {
        return new Outs(count + additional);
    }

    /**
     * 3아웃(하프 이닝 종료)인지 확인.
     *
     * @return count == 3
     */
    public boolean isSide() {
        return count == MAX;
    }
}
