package com.ryuqq.scorekeeper.core.contract;

import com.ryuqq.scorekeeper.core.model.InningHalf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 관리자 보정 액션.
 *
 * <p>기록원 실수를 바로잡기 위한 상태 덮어쓰기입니다. 상태 전이 표와 이닝 진행 규칙을
 * 거치지 않지만, 아웃 범위, 음수 불가, 이닝별 득점 합계 일치 같은 구조적 불변식은 그대로 적용됩니다.
 * null 필드는 변경하지 않습니다.</p>
 *
 * @param currentInning 현재 이닝 (1 이상)
 * @param currentHalf 현재 초/말
 * @param outs 아웃 (0~2)
 * @param homeScore 홈팀 총점 (이닝별 득점 합과 같아야 함)
 * @param awayScore 원정팀 총점 (이닝별 득점 합과 같아야 함)
 * @param homeInningScores 홈팀 이닝별 득점
 * @param awayInningScores 원정팀 이닝별 득점
 * @param notes 메모
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public record CorrectAction(
    Integer currentInning,
    InningHalf currentHalf,
    Integer outs,
    Integer homeScore,
    Integer awayScore,
    List<Integer> homeInningScores,
    List<Integer> awayInningScores,
    String notes
) implements ScoringAction {

    /**
     * Compact Constructor.
     *
     * <p>목록 필드는 복사해서 보관합니다. null 원소도 그대로 보관하며 검증 단계에서 필드 오류로 보고됩니다.</p>
     */
    public CorrectAction {
        homeInningScores = copyOrNull(homeInningScores);
        awayInningScores = copyOrNull(awayInningScores);
    }

    private static List<Integer> copyOrNull(List<Integer> source) {
        return source == null ? null : Collections.unmodifiableList(new ArrayList<>(source));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public ScoringActionType type() {
        return ScoringActionType.CORRECT;
    }

    /**
     * 필요한 필드만 지정하기 위한 빌더.
     */
    public static final class Builder {
        private Integer currentInning;
        private InningHalf currentHalf;
        private Integer outs;
        private Integer homeScore;
        private Integer awayScore;
        private List<Integer> homeInningScores;
        private List<Integer> awayInningScores;
        private String notes;

        private Builder() {
        }

        public Builder currentInning(Integer currentInning) {
            this.currentInning = currentInning;
            return this;
        }

        public Builder currentHalf(InningHalf currentHalf) {
            this.currentHalf = currentHalf;
            return this;
        }

        public Builder outs(Integer outs) {
            this.outs = outs;
            return this;
        }

        public Builder homeScore(Integer homeScore) {
            this.homeScore = homeScore;
            return this;
        }

        public Builder awayScore(Integer awayScore) {
            this.awayScore = awayScore;
            return this;
        }

        public Builder homeInningScores(List<Integer> homeInningScores) {
            this.homeInningScores = homeInningScores;
            return this;
        }

        public Builder awayInningScores(List<Integer> awayInningScores) {
            this.awayInningScores = awayInningScores;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public CorrectAction build() {
            return new CorrectAction(currentInning, currentHalf, outs, homeScore, awayScore,
                homeInningScores, awayInningScores, notes);
        }
    }
}
