package com.ryuqq.scorekeeper.core.rules;

import com.ryuqq.scorekeeper.core.contract.CorrectAction;
import com.ryuqq.scorekeeper.core.error.FieldError;
import com.ryuqq.scorekeeper.core.error.PayloadValidationException;
import com.ryuqq.scorekeeper.core.model.GameState;
import com.ryuqq.scorekeeper.core.model.Inning;
import com.ryuqq.scorekeeper.core.model.InningHalf;
import com.ryuqq.scorekeeper.core.model.InningScores;
import com.ryuqq.scorekeeper.core.model.Outs;
import com.ryuqq.scorekeeper.core.model.TeamSide;

import java.util.ArrayList;
import java.util.List;

/**
 * 관리자 보정 적용.
 *
 * <p>상태 전이 표와 이닝 진행 규칙을 거치지 않고 지정된 필드를 덮어씁니다.
 * 경기 상태(status)와 시작/종료 시각은 바꾸지 않으므로 어떤 상태의 경기에도 적용할 수 있습니다.</p>
 *
 * <p><strong>구조적 불변식:</strong></p>
 * <ul>
 *   <li>총점만 지정하면 기존 이닝별 득점 합과 같아야 함 (총점 직접 변경 불가)</li>
 *   <li>이닝과 초/말 중 하나만 지정되어 상대값이 없으면 1회 / 초로 채움</li>
 *   <li>아웃은 0~2</li>
 * </ul>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public final class AdministrativeCorrection {

    // Utility class - prevent instantiation
    private AdministrativeCorrection() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 보정을 적용한 새 상태.
     *
     * <p>페이로드의 범위 검증은 이미 끝났다고 가정합니다.</p>
     *
     * @param state 현재 상태
     * @param correction 보정 내용
     * @return 새 상태
     * @throws PayloadValidationException 총점이 이닝별 득점 합과 맞지 않는 경우
     */
    public static GameState apply(GameState state, CorrectAction correction) {
        InningScores home = correction.homeInningScores() != null
            ? InningScores.of(correction.homeInningScores())
            : state.homeInningScores();
        InningScores away = correction.awayInningScores() != null
            ? InningScores.of(correction.awayInningScores())
            : state.awayInningScores();

        List<FieldError> errors = new ArrayList<>();
        checkTotal(errors, "homeScore", correction.homeScore(), home);
        checkTotal(errors, "awayScore", correction.awayScore(), away);
        if (!errors.isEmpty()) {
            throw new PayloadValidationException(errors);
        }

        Inning inning = correction.currentInning() != null
            ? Inning.of(correction.currentInning())
            : state.currentInning();
        InningHalf half = correction.currentHalf() != null
            ? correction.currentHalf()
            : state.currentHalf();
        if (inning != null && half == null) {
            half = InningHalf.TOP;
        } else if (inning == null && half != null) {
            inning = Inning.FIRST;
        }
        Outs outs = correction.outs() != null ? Outs.of(correction.outs()) : state.outs();

        GameState corrected = state
            .withPosition(inning, half, outs)
            .withInningScores(TeamSide.HOME, home)
            .withInningScores(TeamSide.AWAY, away);
        if (correction.notes() != null) {
            corrected = corrected.withNotes(correction.notes());
        }
        return corrected;
    }

    private static void checkTotal(List<FieldError> errors, String field, Integer total, InningScores scores) {
        if (total != null && total != scores.total()) {
            errors.add(new FieldError(field, String.format(
                "%s (%d) must equal the sum of the inning scores (%d)", field, total, scores.total())));
        }
    }
}
