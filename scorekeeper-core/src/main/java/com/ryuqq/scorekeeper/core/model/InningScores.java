package com.ryuqq.scorekeeper.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 한 팀의 이닝별 득점 배열.
 *
 * <p>i번째 원소는 (i+1)회의 득점입니다. 아직 도달하지 않은 이닝은 원소가 없으며,
 * 빈 배열은 합계 0으로 취급합니다. 팀의 총점은 항상 이 배열의 합으로 계산되며
 * 총점을 직접 변경하는 경로는 없습니다.</p>
 *
 * <p><strong>불변성:</strong> 모든 변경 메서드는 새 인스턴스를 반환합니다.</p>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public final class InningScores {

    private static final InningScores EMPTY = new InningScores(List.of());

    private final List<Integer> runsByInning;
    private final int total;

    private InningScores(List<Integer> runsByInning) {
        long sum = 0;
        for (int i = 0; i < runsByInning.size(); i++) {
            Integer runs = runsByInning.get(i);
            if (runs == null) {
                throw new IllegalArgumentException("Inning score at index " + i + " cannot be null");
            }
            if (runs < 0) {
                throw new IllegalArgumentException("Inning score at index " + i + " cannot be negative (current: " + runs + ")");
            }
            sum += runs;
        }
        if (sum > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Inning score total cannot exceed " + Integer.MAX_VALUE + " (current: " + sum + ")");
        }
        this.runsByInning = Collections.unmodifiableList(new ArrayList<>(runsByInning));
        this.total = (int) sum;
    }

    public static InningScores empty() {
        return EMPTY;
    }

    /**
     * 이닝별 득점 목록으로부터 생성.
     *
     * @param runsByInning 이닝별 득점 (각 원소 0 이상)
     * @return InningScores 인스턴스
     * @throws IllegalArgumentException 목록이 null이거나 음수/null 원소를 포함하거나 합이 int 범위를 넘는 경우
     */
    public static InningScores of(List<Integer> runsByInning) {
        if (runsByInning == null) {
            throw new IllegalArgumentException("runsByInning cannot be null");
        }
        return runsByInning.isEmpty() ? EMPTY : new InningScores(runsByInning);
    }

    public static InningScores of(Integer... runsByInning) {
        if (runsByInning == null) {
            throw new IllegalArgumentException("runsByInning cannot be null");
        }
        return of(Arrays.asList(runsByInning));
    }

    /**
     * 해당 이닝에 득점을 더한 새 배열.
     *
     * <p>배열이 해당 이닝까지 도달하지 않았다면 0으로 채운 뒤 더합니다.</p>
     *
     * @param inning 득점한 이닝
     * @param runs 추가 득점
     * @return 새 InningScores
     */
    public InningScores addRuns(Inning inning, Runs runs) {
        List<Integer> next = paddedTo(inning);
        int index = inning.index();
        next.set(index, Math.addExact(next.get(index), runs.value()));
        return new InningScores(next);
    }

    /**
     * 해당 이닝의 원소가 존재하도록 0으로 채운 새 배열.
     *
     * @param inning 기록되어야 하는 이닝
     * @return 이미 원소가 있으면 this, 아니면 새 InningScores
     */
    public InningScores ensureEntry(Inning inning) {
        if (runsByInning.size() > inning.index()) {
            return this;
        }
        return new InningScores(paddedTo(inning));
    }

    private List<Integer> paddedTo(Inning inning) {
        List<Integer> next = new ArrayList<>(runsByInning);
        while (next.size() <= inning.index()) {
            next.add(0);
        }
        return next;
    }

    /**
     * 총점 (배열의 합).
     *
     * @return 총점
     */
    public int total() {
        return total;
    }

    public int size() {
        return runsByInning.size();
    }

    /**
     * 해당 이닝 득점. 아직 도달하지 않은 이닝은 0.
     *
     * @param inning 이닝
     * @return 득점
     */
    public int runsIn(Inning inning) {
        return inning.index() < runsByInning.size() ? runsByInning.get(inning.index()) : 0;
    }

    public List<Integer> asList() {
        return runsByInning;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InningScores that = (InningScores) o;
        return runsByInning.equals(that.runsByInning);
    }

    @Override
    public int hashCode() {
        return runsByInning.hashCode();
    }

    @Override
    public String toString() {
        return runsByInning.toString();
    }
}
