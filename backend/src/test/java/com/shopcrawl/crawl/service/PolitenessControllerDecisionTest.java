package com.shopcrawl.crawl.service;

import com.shopcrawl.config.CrawlerProperties;
import com.shopcrawl.crawl.model.BreakerState;
import com.shopcrawl.crawl.model.DomainState;
import com.shopcrawl.crawl.persistence.DomainStateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class PolitenessControllerDecisionTest {
    private static final Instant T0 = Instant.parse("2030-01-15T10:00:00Z");

    @Mock
    private DomainStateRepository repository;
    @Mock
    private TransactionTemplate transactionTemplate;

    private PolitenessController controller;

    @BeforeEach
    void setUp() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setPolitenessIntervalMs(1000);
        properties.setDomainConcurrencyCap(2);
        properties.setFailureThreshold(3);
        properties.setCooldownMs(60_000);
        controller = new PolitenessController(repository, properties, transactionTemplate, Clock.fixed(T0, ZoneOffset.UTC));
    }

    @Test
    void freshDomainIsAdmittedAndCountsInFlight() {
        DomainState admitted = controller.admit(DomainState.fresh("shop.example"), T0);

        assertThat(admitted).isNotNull();
        assertThat(admitted.inFlight()).isEqualTo(1);
        assertThat(admitted.lastDispatchAt()).isEqualTo(T0);
        assertThat(admitted.breakerState()).isEqualTo(BreakerState.CLOSED);
    }

    @Test
    void dispatchWithinIntervalIsRefused() {
        DomainState state = new DomainState("shop.example", T0, 0, 0, BreakerState.CLOSED, null);

        assertThat(controller.admit(state, T0.plusMillis(999))).isNull();
        assertThat(controller.admit(state, T0.plusMillis(1000))).isNotNull();
    }

    @Test
    void concurrencyCapIsEnforced() {
        DomainState state = new DomainState("shop.example", null, 2, 0, BreakerState.CLOSED, null);

        assertThat(controller.admit(state, T0)).isNull();
    }

    @Test
    void breakerTripsAtThresholdAndAdmitsOneProbeAfterCooldown() {
        DomainState state = new DomainState("shop.example", T0, 1, 0, BreakerState.CLOSED, null);
        state = controller.onFailure(state, T0);
        state = controller.onFailure(new DomainState("shop.example", T0, 1, state.consecutiveFailures(), state.breakerState(), null), T0);
        assertThat(state.breakerState()).isEqualTo(BreakerState.CLOSED);

        DomainState open = controller.onFailure(
            new DomainState("shop.example", T0, 1, state.consecutiveFailures(), state.breakerState(), null),
            T0
        );
        assertThat(open.breakerState()).isEqualTo(BreakerState.OPEN);
        assertThat(open.consecutiveFailures()).isEqualTo(3);
        assertThat(open.openUntil()).isEqualTo(T0.plusMillis(60_000));
        assertThat(open.inFlight()).isZero();

        assertThat(controller.admit(open, T0.plusMillis(59_999))).isNull();

        DomainState probe = controller.admit(open, T0.plusMillis(60_000));
        assertThat(probe).isNotNull();
        assertThat(probe.breakerState()).isEqualTo(BreakerState.HALF_OPEN);
        assertThat(probe.openUntil()).isNull();
        assertThat(controller.admit(probe, T0.plusMillis(120_000))).isNull();
    }

    @Test
    void probeOutcomeClosesOrReopens() {
        DomainState probe = new DomainState("shop.example", T0, 1, 3, BreakerState.HALF_OPEN, null);

        DomainState closed = controller.onSuccess(probe);
        assertThat(closed.breakerState()).isEqualTo(BreakerState.CLOSED);
        assertThat(closed.consecutiveFailures()).isZero();
        assertThat(closed.inFlight()).isZero();

        DomainState reopened = controller.onFailure(probe, T0.plusSeconds(5));
        assertThat(reopened.breakerState()).isEqualTo(BreakerState.OPEN);
        assertThat(reopened.openUntil()).isEqualTo(T0.plusSeconds(65));
    }

    @Test
    void successResetsFailureCount() {
        DomainState state = new DomainState("shop.example", T0, 1, 2, BreakerState.CLOSED, null);

        DomainState next = controller.onSuccess(state);

        assertThat(next.consecutiveFailures()).isZero();
        assertThat(next.breakerState()).isEqualTo(BreakerState.CLOSED);
    }

    @Test
    void abandonedProbeRearmsBreakerImmediately() {
        DomainState probe = new DomainState("shop.example", T0, 1, 3, BreakerState.HALF_OPEN, null);

        DomainState rearmed = controller.onAbandoned(probe, T0.plusSeconds(1));

        assertThat(rearmed.breakerState()).isEqualTo(BreakerState.OPEN);
        assertThat(rearmed.openUntil()).isEqualTo(T0.plusSeconds(1));
        assertThat(rearmed.consecutiveFailures()).isEqualTo(3);
        assertThat(controller.admit(rearmed, T0.plusSeconds(2))).isNotNull();
    }
}
