package com.ryuqq.scorekeeper.core.validation;

import com.ryuqq.scorekeeper.core.config.ScoringRules;
import com.ryuqq.scorekeeper.core.contract.AdvanceAction;
import com.ryuqq.scorekeeper.core.contract.CorrectAction;
import com.ryuqq.scorekeeper.core.contract.EndAction;
import com.ryuqq.scorekeeper.core.contract.OutAction;
import com.ryuqq.scorekeeper.core.contract.ScoreAction;
import com.ryuqq.scorekeeper.core.contract.ScoringAction;
import com.ryuqq.scorekeeper.core.contract.StartAction;
import com.ryuqq.scorekeeper.core.error.FieldError;
import com.ryuqq.scorekeeper.core.error.PayloadValidationException;
import com.ryuqq.scorekeeper.core.model.GameStatus;
import com.ryuqq.scorekeeper.core.model.Outs;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 액션 페이로드 구조 검증기.
 *
 * <p>비즈니스 규칙을 평가하기 전에 값의 범위와 형식만 검사합니다.
 * 경기 상태를 보지 않으므로 어떤 상태에서든 같은 결과를 냅니다.
 * 발견된 오류는 모두 모아서 한 번에 보고합니다.</p>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public final class ActionPayloadValidator {

    private static final Set<GameStatus> START_TARGETS = EnumSet.of(GameStatus.WARMUP, GameStatus.IN_PROGRESS);
    private static final Set<GameStatus> END_TARGETS = EnumSet.of(
        GameStatus.FINAL, GameStatus.SUSPENDED, GameStatus.POSTPONED, GameStatus.CANCELLED);

    private final ScoringRules rules;

    /**
     * 생성자.
     *
     * @param rules 스코어링 규칙
     * @throws IllegalArgumentException rules가 null인 경우
     */
    public ActionPayloadValidator(ScoringRules rules) {
        if (rules == null) {
            throw new IllegalArgumentException("rules cannot be null");
        }
        this.rules = rules;
    }

    /**
     * 페이로드를 검증하고 오류 목록을 반환.
     *
     * @param action 검증할 액션
     * @return 필드 오류 목록 (유효하면 빈 목록)
     * @throws IllegalArgumentException action이 null인 경우
     */
    public List<FieldError> validate(ScoringAction action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        List<FieldError> errors = new ArrayList<>();

        if (action instanceof StartAction start) {
            if (start.status() != null && !START_TARGETS.contains(start.status())) {
                errors.add(new FieldError("status", "Start status must be one of: warmup, in_progress"));
            }
        } else if (action instanceof ScoreAction score) {
            checkRuns(errors, score.runs());
        } else if (action instanceof OutAction out) {
            Integer count = out.count();
            if (count != null && count < 1) {
                errors.add(new FieldError("count", "Must record at least 1 out"));
            } else if (count != null && count > Outs.MAX) {
                errors.add(new FieldError("count", "Cannot record more than " + Outs.MAX + " outs at once"));
            }
        } else if (action instanceof AdvanceAction advance) {
            checkInning(errors, "forceInning", advance.forceInning());
        } else if (action instanceof EndAction end) {
            if (end.status() != null && !END_TARGETS.contains(end.status())) {
                errors.add(new FieldError("status", "End status must be one of: final, suspended, postponed, cancelled"));
            }
            checkNotes(errors, end.notes());
        } else if (action instanceof CorrectAction correct) {
            checkCorrection(errors, correct);
        }

        return errors;
    }

    /**
     * 페이로드를 검증하고 오류가 있으면 예외를 던짐.
     *
     * @param action 검증할 액션
     * @throws PayloadValidationException 오류가 하나 이상인 경우
     */
    public void validateOrThrow(ScoringAction action) {
        List<FieldError> errors = validate(action);
        if (!errors.isEmpty()) {
            throw new PayloadValidationException(errors);
        }
    }

    private void checkRuns(List<FieldError> errors, int runs) {
        if (runs < 0) {
            errors.add(new FieldError("runs", "Runs cannot be negative"));
        } else if (runs > rules.maxRunsPerHalfInning()) {
            errors.add(new FieldError("runs", "Runs cannot exceed " + rules.maxRunsPerHalfInning() + " per half-inning"));
        }
    }

    private void checkInning(List<FieldError> errors, String field, Integer inning) {
        if (inning == null) {
            return;
        }
        if (inning < 1) {
            errors.add(new FieldError(field, "Inning must be at least 1"));
        } else if (inning > rules.maxInnings()) {
            errors.add(new FieldError(field, "Inning cannot exceed " + rules.maxInnings()));
        }
    }

    private void checkNotes(List<FieldError> errors, String notes) {
        if (notes != null && notes.length() > rules.maxNotesLength()) {
            errors.add(new FieldError("notes", "Notes cannot exceed " + rules.maxNotesLength() + " characters"));
        }
    }

    private void checkCorrection(List<FieldError> errors, CorrectAction correct) {
        checkInning(errors, "currentInning", correct.currentInning());
        // 3아웃은 저장 상태로 존재할 수 없음
        if (correct.outs() != null && (correct.outs() < 0 || correct.outs() >= Outs.MAX)) {
            errors.add(new FieldError("outs", "Outs must be between 0 and " + (Outs.MAX - 1)));
        }
        if (correct.homeScore() != null && correct.homeScore() < 0) {
            errors.add(new FieldError("homeScore", "Score cannot be negative"));
        }
        if (correct.awayScore() != null && correct.awayScore() < 0) {
            errors.add(new FieldError("awayScore", "Score cannot be negative"));
        }
        boolean homeEntriesValid = checkInningScores(errors, "homeInningScores", correct.homeInningScores());
        boolean awayEntriesValid = checkInningScores(errors, "awayInningScores", correct.awayInningScores());

        if (homeEntriesValid) {
            checkTotal(errors, "homeScore", correct.homeScore(), "homeInningScores", correct.homeInningScores());
        }
        if (awayEntriesValid) {
            checkTotal(errors, "awayScore", correct.awayScore(), "awayInningScores", correct.awayInningScores());
        }
        checkNotes(errors, correct.notes());
    }

    private boolean checkInningScores(List<FieldError> errors, String field, List<Integer> scores) {
        if (scores == null) {
            return true;
        }
        if (scores.size() > rules.maxInnings()) {
            errors.add(new FieldError(field, "Cannot hold more than " + rules.maxInnings() + " innings"));
            return false;
        }
        boolean valid = true;
        long sum = 0;
        for (int i = 0; i < scores.size(); i++) {
            Integer runs = scores.get(i);
            if (runs == null) {
                errors.add(new FieldError(field + "[" + i + "]", "Inning score is required"));
                valid = false;
            } else if (runs < 0) {
                errors.add(new FieldError(field + "[" + i + "]", "Inning score cannot be negative"));
                valid = false;
            } else {
                sum += runs;
            }
        }
        if (valid && sum > Integer.MAX_VALUE) {
            errors.add(new FieldError(field, "Sum of inning scores cannot exceed " + Integer.MAX_VALUE));
            valid = false;
        }
        return valid;
    }

    private void checkTotal(List<FieldError> errors, String totalField, Integer total,
                            String scoresField, List<Integer> scores) {
        if (total == null || scores == null || total < 0) {
            return;
        }
        long sum = scores.stream().mapToLong(Integer::longValue).sum();
        if (sum != total) {
            errors.add(new FieldError(totalField,
                String.format("%s (%d) must equal the sum of %s (%d)", totalField, total, scoresField, sum)));
        }
    }
}
