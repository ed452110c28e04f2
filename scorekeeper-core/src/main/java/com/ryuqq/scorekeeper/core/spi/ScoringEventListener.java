package com.ryuqq.scorekeeper.core.spi;

import com.ryuqq.scorekeeper.core.contract.ScoringActionResult;

/**
 * 커밋된 스코어링 액션 구독자 SPI.
 *
 * <p>이메일/채팅 알림 발송 같은 협력자가 구현합니다. 스코어링 코어의 컨트롤러는 구독자를 호출하지 않으며,
 * 애플리케이션 서비스가 저장에 성공한 결과만 전달합니다. 구독자의 실패는 액션 결과에 영향을 주지 않습니다.</p>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ScoringEventListener {

    /**
     * 저장이 완료된 액션 결과 수신.
     *
     * @param result 액션 결과 (이전/새 상태 포함)
     */
    void onActionCommitted(ScoringActionResult result);
}
