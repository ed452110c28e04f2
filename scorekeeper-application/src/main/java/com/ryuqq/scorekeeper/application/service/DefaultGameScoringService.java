package com.ryuqq.scorekeeper.application.service;

import com.ryuqq.scorekeeper.application.controller.GameStateController;
import com.ryuqq.scorekeeper.application.response.Applied;
import com.ryuqq.scorekeeper.application.response.GameStateView;
import com.ryuqq.scorekeeper.application.response.Invalid;
import com.ryuqq.scorekeeper.application.response.NotFound;
import com.ryuqq.scorekeeper.application.response.Rejected;
import com.ryuqq.scorekeeper.application.response.ScoringResponse;
import com.ryuqq.scorekeeper.core.config.ScoringRules;
import com.ryuqq.scorekeeper.core.contract.ScoringAction;
import com.ryuqq.scorekeeper.core.contract.ScoringActionResult;
import com.ryuqq.scorekeeper.core.error.PayloadValidationException;
import com.ryuqq.scorekeeper.core.error.RejectionReason;
import com.ryuqq.scorekeeper.core.error.RuleViolationException;
import com.ryuqq.scorekeeper.core.model.GameId;
import com.ryuqq.scorekeeper.core.model.GameState;
import com.ryuqq.scorekeeper.core.model.GameStatus;
import com.ryuqq.scorekeeper.core.spi.GameStateStore;
import com.ryuqq.scorekeeper.core.spi.ScoringEventListener;
import com.ryuqq.scorekeeper.core.spi.StaleGameStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link GameScoringService} 기본 구현.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. store.findById(gameId) → 없으면 NotFound
 * 2. controller.apply(current, action)
 *    - PayloadValidationException → Invalid
 *    - RuleViolationException → Rejected (상태 변경 없음)
 * 3. store.save(newState, current.updatedAt())
 *    - StaleGameStateException → Rejected(CONCURRENT_MODIFICATION)
 * 4. 구독자에게 결과 전달 (구독자 실패는 로그만 남기고 계속)
 * 5. Applied 반환
 * </pre>
 *
 * <p>서비스 자체는 잠금을 사용하지 않으며, 같은 경기에 대한 동시 액션은 저장소의
 * compare-and-swap이 하나만 통과시킵니다.</p>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
public final class DefaultGameScoringService implements GameScoringService {

    private static final Logger log = LoggerFactory.getLogger(DefaultGameScoringService.class);

    private final GameStateStore store;
    private final GameStateController controller;
    private final ScoringRules rules;
    private final List<ScoringEventListener> listeners;

    /**
     * 생성자.
     *
     * @param store 경기 상태 저장소
     * @param controller 경기 상태 컨트롤러
     * @param rules 스코어링 규칙 (응답의 연장전 판정에 사용)
     * @param listeners 커밋된 결과 구독자 (빈 목록 가능)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultGameScoringService(GameStateStore store,
                                     GameStateController controller,
                                     ScoringRules rules,
                                     List<ScoringEventListener> listeners) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (controller == null) {
            throw new IllegalArgumentException("controller cannot be null");
        }
        if (rules == null) {
            throw new IllegalArgumentException("rules cannot be null");
        }
        if (listeners == null) {
            throw new IllegalArgumentException("listeners cannot be null");
        }
        this.store = store;
        this.controller = controller;
        this.rules = rules;
        this.listeners = List.copyOf(listeners);
    }

    @Override
    public ScoringResponse submit(GameId gameId, ScoringAction action) {
        if (gameId == null) {
            throw new IllegalArgumentException("gameId cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }

        Optional<GameState> loaded = store.findById(gameId);
        if (loaded.isEmpty()) {
            log.info("{} rejected: game {} not found", action.type().wireName(), gameId.getValue());
            return new NotFound(gameId);
        }
        GameState current = loaded.get();

        ScoringActionResult result;
        try {
            result = controller.apply(current, action);
            store.save(result.newState(), current.updatedAt());
        } catch (PayloadValidationException e) {
            log.info("{} on {} failed validation: {}", action.type().wireName(), gameId.getValue(), e.getMessage());
            return new Invalid(e.errors());
        } catch (StaleGameStateException e) {
            log.warn("{} on {} lost a concurrent update: {}", action.type().wireName(), gameId.getValue(), e.getMessage());
            return new Rejected(RejectionReason.CONCURRENT_MODIFICATION, e.getMessage());
        } catch (RuleViolationException e) {
            log.info("{} on {} rejected ({}): {}",
                action.type().wireName(), gameId.getValue(), e.reason().code(), e.getMessage());
            return new Rejected(e.reason(), e.getMessage());
        }

        notifyListeners(result);
        return new Applied(result, toView(result.previousState()), toView(result.newState()));
    }

    @Override
    public Optional<GameStateView> findState(GameId gameId) {
        if (gameId == null) {
            throw new IllegalArgumentException("gameId cannot be null");
        }
        return store.findById(gameId).map(this::toView);
    }

    @Override
    public List<GameStateView> liveGames() {
        return store.findByStatus(GameStatus.IN_PROGRESS).stream()
            .map(this::toView)
            .collect(Collectors.toList());
    }

    private void notifyListeners(ScoringActionResult result) {
        for (ScoringEventListener listener : listeners) {
            try {
                listener.onActionCommitted(result);
            } catch (RuntimeException e) {
                log.error("Listener {} failed for {} on {}",
                    listener.getClass().getName(), result.action().wireName(), result.newState().id(), e);
            }
        }
    }

    private GameStateView toView(GameState state) {
        return GameStateView.from(state, rules);
    }
}
