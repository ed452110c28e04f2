package com.ryuqq.scorekeeper.core.model;

import java.time.Instant;

/**
 * 경기 진행 상태 (불변 record).
 *
 * <p>스코어링 코어가 다루는 유일한 엔티티입니다. 모든 액션은 이 값을 입력으로 받아
 * 새 인스턴스를 만들어내며, 기존 인스턴스는 변경되지 않으므로 그대로 "이전 상태" 스냅샷이 됩니다.</p>
 *
 * <p><strong>불변식 (생성 시 검증):</strong></p>
 * <ul>
 *   <li>저장된 아웃은 0~2 (3아웃은 같은 액션 안에서 이닝 진행과 함께 0으로 초기화)</li>
 *   <li>currentInning과 currentHalf는 둘 다 있거나 둘 다 없음</li>
 *   <li>IN_PROGRESS, SUSPENDED 상태에서는 이닝/하프 필수</li>
 *   <li>총점은 이닝별 득점 배열의 합 ({@link #homeScore()}, {@link #awayScore()})</li>
 *   <li>IN_PROGRESS, SUSPENDED, FINAL 상태는 startedAt 필수</li>
 *   <li>FINAL, SUSPENDED 상태는 endedAt 필수, IN_PROGRESS 상태는 endedAt 없음</li>
 * </ul>
 *
 * @param id 경기 ID
 * @param status 경기 상태
 * @param currentInning 현재 이닝 (null 가능)
 * @param currentHalf 현재 초/말 (null 가능)
 * @param outs 현재 아웃 (0~2)
 * @param homeInningScores 홈팀 이닝별 득점
 * @param awayInningScores 원정팀 이닝별 득점
 * @param notes 메모 (null 가능)
 * @param startedAt 최초 IN_PROGRESS 진입 시각 (null 가능)
 * @param endedAt 종료/중단 시각 (null 가능)
 * @param updatedAt 마지막 변경 시각 (낙관적 동시성 검사에 사용)
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public record GameState(
    GameId id,
    GameStatus status,
    Inning currentInning,
    InningHalf currentHalf,
    Outs outs,
    InningScores homeInningScores,
    InningScores awayInningScores,
    String notes,
    Instant startedAt,
    Instant endedAt,
    Instant updatedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 불변식을 위반한 경우
     */
    public GameState {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (outs == null) {
            throw new IllegalArgumentException("outs cannot be null");
        }
        if (homeInningScores == null || awayInningScores == null) {
            throw new IllegalArgumentException("inning scores cannot be null");
        }
        if (updatedAt == null) {
            throw new IllegalArgumentException("updatedAt cannot be null");
        }
        if (outs.isSide()) {
            throw new IllegalArgumentException("outs cannot rest at " + Outs.MAX + "; the half-inning must advance");
        }
        if ((currentInning == null) != (currentHalf == null)) {
            throw new IllegalArgumentException(
                "currentInning and currentHalf must both be set or both be null (inning: "
                    + currentInning + ", half: " + currentHalf + ")");
        }
        if (status.hasLivePosition() && currentInning == null) {
            throw new IllegalArgumentException("status " + status + " requires currentInning and currentHalf");
        }
        if (startedAt == null
            && (status == GameStatus.IN_PROGRESS || status == GameStatus.SUSPENDED || status == GameStatus.FINAL)) {
            throw new IllegalArgumentException("status " + status + " requires startedAt");
        }
        if (endedAt == null && (status == GameStatus.FINAL || status == GameStatus.SUSPENDED)) {
            throw new IllegalArgumentException("status " + status + " requires endedAt");
        }
        if (endedAt != null && status == GameStatus.IN_PROGRESS) {
            throw new IllegalArgumentException("status IN_PROGRESS cannot carry endedAt");
        }
    }

    /**
     * 스케줄링 협력자가 생성하는 초기 상태.
     *
     * @param id 경기 ID
     * @param createdAt 생성 시각
     * @return SCHEDULED 상태의 GameState
     */
    public static GameState scheduled(GameId id, Instant createdAt) {
        return new GameState(id, GameStatus.SCHEDULED, null, null, Outs.NONE,
            InningScores.empty(), InningScores.empty(), null, null, null, createdAt);
    }

    public int homeScore() {
        return homeInningScores.total();
    }

    public int awayScore() {
        return awayInningScores.total();
    }

    public InningScores inningScoresOf(TeamSide side) {
        return side == TeamSide.HOME ? homeInningScores : awayInningScores;
    }

    public boolean homeLeads() {
        return homeScore() > awayScore();
    }

    public boolean awayLeads() {
        return awayScore() > homeScore();
    }

    public boolean isTied() {
        return homeScore() == awayScore();
    }

    /**
     * 연장전 여부.
     *
     * @param regulationInnings 정규 이닝 수
     * @return 현재 이닝이 정규 이닝을 넘었으면 true (이닝이 없으면 false)
     */
    public boolean isExtraInnings(int regulationInnings) {
        return currentInning != null && currentInning.isExtra(regulationInnings);
    }

    public GameState withStatus(GameStatus status) {
        return new GameState(id, status, currentInning, currentHalf, outs,
            homeInningScores, awayInningScores, notes, startedAt, endedAt, updatedAt);
    }

    public GameState withPosition(Inning inning, InningHalf half, Outs outs) {
        return new GameState(id, status, inning, half, outs,
            homeInningScores, awayInningScores, notes, startedAt, endedAt, updatedAt);
    }

    public GameState withOuts(Outs outs) {
        return new GameState(id, status, currentInning, currentHalf, outs,
            homeInningScores, awayInningScores, notes, startedAt, endedAt, updatedAt);
    }

    public GameState withInningScores(TeamSide side, InningScores scores) {
        return side == TeamSide.HOME
            ? new GameState(id, status, currentInning, currentHalf, outs,
                scores, awayInningScores, notes, startedAt, endedAt, updatedAt)
            : new GameState(id, status, currentInning, currentHalf, outs,
                homeInningScores, scores, notes, startedAt, endedAt, updatedAt);
    }

    public GameState withNotes(String notes) {
        return new GameState(id, status, currentInning, currentHalf, outs,
            homeInningScores, awayInningScores, notes, startedAt, endedAt, updatedAt);
    }

    /**
     * 상태와 시작/종료 시각을 함께 변경.
     *
     * <p>상태와 타임스탬프 불변식이 서로 얽혀 있으므로 한 번에 교체합니다.</p>
     *
     * @param status 새 상태
     * @param startedAt 새 시작 시각
     * @param endedAt 새 종료 시각
     * @return 새 GameState
     */
    public GameState withLifecycle(GameStatus status, Instant startedAt, Instant endedAt) {
        return new GameState(id, status, currentInning, currentHalf, outs,
            homeInningScores, awayInningScores, notes, startedAt, endedAt, updatedAt);
    }

    public GameState withUpdatedAt(Instant updatedAt) {
        return new GameState(id, status, currentInning, currentHalf, outs,
            homeInningScores, awayInningScores, notes, startedAt, endedAt, updatedAt);
    }
}
