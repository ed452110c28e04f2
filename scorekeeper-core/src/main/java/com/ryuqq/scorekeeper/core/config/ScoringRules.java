package com.ryuqq.scorekeeper.core.config;

/**
 * 스코어링 규칙 설정 (불변 record).
 *
 * <p>이 record는 리그마다 달라질 수 있는 경기 규칙 값을 담고 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>regulationInnings: 정규 이닝 수 (기본 9)</li>
 *   <li>maxInnings: 페이로드로 지정하거나 진행할 수 있는 최대 이닝 (기본 99, regulationInnings 이상)</li>
 *   <li>maxRunsPerHalfInning: 득점 액션 한 번에 기록 가능한 최대 득점 (기본 99)</li>
 *   <li>maxNotesLength: 메모 최대 길이 (기본 500)</li>
 *   <li>earlyEndAllowed: 정규 조건 전 조기 종료(콜드게임, 우천 등) 허용 여부 (기본 true)</li>
 *   <li>requireCompletedTopHalf: 초 공격 중의 리드를 정규 승리로 인정하지 않음 (기본 false)</li>
 * </ul>
 *
 * <p><strong>requireCompletedTopHalf:</strong> 기본값(false)은 정규 이닝 이후 어느 팀이든
 * 앞서 있으면 정규 종료로 인정합니다. true로 설정하면 초 공격이 진행 중인 동안의 원정팀 리드는
 * 정규 종료가 아닌 조기 종료로 분류되며, earlyEndAllowed가 false이면 거부됩니다.</p>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 * @param regulationInnings 정규 이닝 수 (1 이상)
 * @param maxInnings 최대 이닝 (regulationInnings 이상)
 * @param maxRunsPerHalfInning 한 번에 기록 가능한 최대 득점 (1 이상)
 * @param maxNotesLength 메모 최대 길이 (1 이상)
 * @param earlyEndAllowed 조기 종료 허용 여부
 * @param requireCompletedTopHalf 초 공격 완료 요구 여부
 */
public record ScoringRules(
    int regulationInnings,
    int maxInnings,
    int maxRunsPerHalfInning,
    int maxNotesLength,
    boolean earlyEndAllowed,
    boolean requireCompletedTopHalf
) {

    public static final int STANDARD_INNINGS = 9;
    public static final int DEFAULT_MAX_INNINGS = 99;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: regulationInnings=9, maxInnings=99, maxRunsPerHalfInning=99, maxNotesLength=500,
     * earlyEndAllowed=true, requireCompletedTopHalf=false</p>
     */
    public ScoringRules() {
        this(STANDARD_INNINGS, DEFAULT_MAX_INNINGS, 99, 500, true, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ScoringRules {
        if (regulationInnings < 1) {
            throw new IllegalArgumentException(
                "regulationInnings must be positive (current: " + regulationInnings + ")"
            );
        }
        if (maxInnings < regulationInnings) {
            throw new IllegalArgumentException(
                "maxInnings must be at least regulationInnings (current: " + maxInnings
                    + ", regulationInnings: " + regulationInnings + ")"
            );
        }
        if (maxRunsPerHalfInning < 1) {
            throw new IllegalArgumentException(
                "maxRunsPerHalfInning must be positive (current: " + maxRunsPerHalfInning + ")"
            );
        }
        if (maxNotesLength < 1) {
            throw new IllegalArgumentException(
                "maxNotesLength must be positive (current: " + maxNotesLength + ")"
            );
        }
    }

    public ScoringRules withRegulationInnings(int regulationInnings) {
        return new ScoringRules(regulationInnings, maxInnings, maxRunsPerHalfInning, maxNotesLength,
            earlyEndAllowed, requireCompletedTopHalf);
    }

    public ScoringRules withMaxInnings(int maxInnings) {
        return new ScoringRules(regulationInnings, maxInnings, maxRunsPerHalfInning, maxNotesLength,
            earlyEndAllowed, requireCompletedTopHalf);
    }

    public ScoringRules withMaxRunsPerHalfInning(int maxRunsPerHalfInning) {
        return new ScoringRules(regulationInnings, maxInnings, maxRunsPerHalfInning, maxNotesLength,
            earlyEndAllowed, requireCompletedTopHalf);
    }

    public ScoringRules withMaxNotesLength(int maxNotesLength) {
        return new ScoringRules(regulationInnings, maxInnings, maxRunsPerHalfInning, maxNotesLength,
            earlyEndAllowed, requireCompletedTopHalf);
    }

    /**
     * earlyEndAllowed만 변경한 새 인스턴스 생성.
     *
     * @param earlyEndAllowed 조기 종료 허용 여부
     * @return 새 ScoringRules 인스턴스
     */
    public ScoringRules withEarlyEndAllowed(boolean earlyEndAllowed) {
        return new ScoringRules(regulationInnings, maxInnings, maxRunsPerHalfInning, maxNotesLength,
            earlyEndAllowed, requireCompletedTopHalf);
    }

    /**
     * requireCompletedTopHalf만 변경한 새 인스턴스 생성.
     *
     * @param requireCompletedTopHalf 초 공격 완료 요구 여부
     * @return 새 ScoringRules 인스턴스
     */
    public ScoringRules withRequireCompletedTopHalf(boolean requireCompletedTopHalf) {
        return new ScoringRules(regulationInnings, maxInnings, maxRunsPerHalfInning, maxNotesLength,
            earlyEndAllowed, requireCompletedTopHalf);
    }
}
