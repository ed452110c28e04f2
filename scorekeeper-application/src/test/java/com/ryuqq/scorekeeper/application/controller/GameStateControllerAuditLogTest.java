package com.ryuqq.scorekeeper.application.controller;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.ryuqq.scorekeeper.core.config.ScoringRules;
import com.ryuqq.scorekeeper.core.contract.CorrectAction;
import com.ryuqq.scorekeeper.core.contract.ScoreAction;
import com.ryuqq.scorekeeper.core.model.GameId;
import com.ryuqq.scorekeeper.core.model.GameState;
import com.ryuqq.scorekeeper.core.model.GameStatus;
import com.ryuqq.scorekeeper.core.model.Inning;
import com.ryuqq.scorekeeper.core.model.InningHalf;
import com.ryuqq.scorekeeper.core.model.Outs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 보정 액션 감사 로그 테스트.
 *
 * <p>관리자 보정은 AUDIT 마커와 WARN 레벨로, 일반 플레이 액션은 마커 없이 INFO로 남는지 검증합니다.</p>
 *
 * @author Scorekeeper Team
 * @since 1.0.0
 */
@DisplayName("GameStateController 감사 로그 테스트")
class GameStateControllerAuditLogTest {

    private static final Instant T0 = Instant.parse("2026-04-04T17:05:00Z");

    private GameStateController controller;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        controller = new GameStateController(new ScoringRules(), Clock.fixed(T0.plusSeconds(30), ZoneOffset.UTC));

        logger = (Logger) LoggerFactory.getLogger(GameStateController.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Test
    @DisplayName("보정은 AUDIT 마커가 붙은 WARN 로그를 남긴다")
    void 보정_감사_로그() {
        controller.apply(inProgress(), CorrectAction.builder().outs(1).build());

        List<ILoggingEvent> events = logAppender.list;
        assertThat(events).hasSize(1);
        ILoggingEvent event = events.get(0);
        assertThat(event.getLevel()).isEqualTo(Level.WARN);
        assertThat(event.getMarkerList()).extracting(Marker::getName).containsExactly("AUDIT");
        assertThat(event.getArgumentArray()[0]).isEqualTo("audit-1");
    }

    @Test
    @DisplayName("일반 플레이 액션은 마커 없이 INFO 로그를 남긴다")
    void 플레이_액션_로그() {
        controller.apply(inProgress(), ScoreAction.of(1));

        assertThat(logAppender.list)
            .filteredOn(event -> event.getLevel() == Level.INFO)
            .hasSize(1)
            .allSatisfy(event -> assertThat(event.getMarkerList()).isNullOrEmpty());
        assertThat(logAppender.list).noneMatch(event -> event.getLevel() == Level.WARN);
    }

    private static GameState inProgress() {
        return GameState.scheduled(GameId.of("audit-1"), T0)
            .withPosition(Inning.of(2), InningHalf.TOP, Outs.NONE)
            .withLifecycle(GameStatus.IN_PROGRESS, T0, null);
    }
}
