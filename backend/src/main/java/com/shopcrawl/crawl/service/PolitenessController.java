package com.shopcrawl.crawl.service;

import com.shopcrawl.config.CrawlerProperties;
import com.shopcrawl.crawl.model.BreakerState;
import com.shopcrawl.crawl.model.DomainState;
import com.shopcrawl.crawl.persistence.DomainStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Per-domain politeness gate: minimum spacing between dispatches, a concurrency cap and a
 * consecutive-failure circuit breaker. State lives in {@code domain_state} and is shared by
 * every worker in every process; each decision runs under a row lock on the domain.
 * <p>
 * Breaker: CLOSED trips to OPEN after {@code failureThreshold} consecutive failures. Once the
 * cooldown has elapsed the next admitted dispatch moves it to HALF_OPEN; that single probe
 * either closes it (success) or re-opens it (failure).
 */
@Service
public class PolitenessController {
    private static final Logger log = LoggerFactory.getLogger(PolitenessController.class);

    private final DomainStateRepository repository;
    private final CrawlerProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public PolitenessController(
        DomainStateRepository repository,
        CrawlerProperties properties,
        TransactionTemplate transactionTemplate,
        Clock clock
    ) {
        this.repository = repository;
        this.properties = properties;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    /**
     * Admits one dispatch to {@code domain} or refuses without blocking. On admission the
     * in-flight count and last-dispatch time are updated in the same transaction; when called
     * inside a caller's transaction the admission commits or rolls back with it.
     */
    public boolean admitDispatch(String domain) {
        return admitDispatch(domain, now());
    }

    /**
     * Admission stamped at {@code now}, so a lease taken in the same transaction starts at the
     * recorded dispatch time.
     */
    public boolean admitDispatch(String domain, Instant now) {
        return StoreGuard.call("dispatch admission", () -> {
            repository.insertIfAbsent(domain, now);
            Boolean admitted = transactionTemplate.execute(status -> {
                DomainState current = repository.findForUpdate(domain);
                if (current == null) {
                    return false;
                }
                DomainState next = admit(current, now);
                if (next == null) {
                    return false;
                }
                repository.update(next, now);
                if (current.breakerState() == BreakerState.OPEN) {
                    log.info("Circuit for {} half-open, dispatching probe", domain);
                }
                return true;
            });
            return Boolean.TRUE.equals(admitted);
        });
    }

    /**
     * A dispatch to {@code domain} finished. Every fetch failure, permanent or not, counts
     * against the breaker.
     */
    public void release(String domain, boolean success) {
        Instant now = now();
        StoreGuard.run("dispatch release", () -> transactionTemplate.executeWithoutResult(status -> {
            DomainState current = repository.findForUpdate(domain);
            if (current == null) {
                return;
            }
            DomainState next = success ? onSuccess(current) : onFailure(current, now);
            repository.update(next, now);
            if (next.breakerState() == BreakerState.OPEN && current.breakerState() != BreakerState.OPEN) {
                log.warn(
                    "Circuit for {} opened after {} consecutive failures, cooling down until {}",
                    domain,
                    next.consecutiveFailures(),
                    next.openUntil()
                );
            } else if (next.breakerState() == BreakerState.CLOSED && current.breakerState() == BreakerState.HALF_OPEN) {
                log.info("Circuit for {} closed after successful probe", domain);
            }
        }));
    }

    /**
     * Gives back an in-flight slot without counting a success or a failure. An abandoned
     * half-open probe re-arms the breaker so the next dispatch probes again.
     */
    public void releaseAbandoned(String domain) {
        Instant now = now();
        StoreGuard.run("dispatch release", () -> transactionTemplate.executeWithoutResult(status -> {
            DomainState current = repository.findForUpdate(domain);
            if (current == null) {
                return;
            }
            repository.update(onAbandoned(current, now), now);
        }));
    }

    public DomainState getState(String domain) {
        DomainState state = StoreGuard.call("domain state lookup", () -> repository.find(domain));
        return state == null ? DomainState.fresh(domain) : state;
    }

    /**
     * @return the admitted state, or null when dispatch must wait
     */
    DomainState admit(DomainState state, Instant now) {
        BreakerState breaker = state.breakerState();
        if (breaker == BreakerState.HALF_OPEN) {
            return null;
        }
        if (breaker == BreakerState.OPEN && state.openUntil() != null && now.isBefore(state.openUntil())) {
            return null;
        }
        if (state.inFlight() >= properties.getDomainConcurrencyCap()) {
            return null;
        }
        if (state.lastDispatchAt() != null) {
            long sinceLast = Duration.between(state.lastDispatchAt(), now).toMillis();
            if (sinceLast < properties.getPolitenessIntervalMs()) {
                return null;
            }
        }
        BreakerState nextBreaker = breaker == BreakerState.OPEN ? BreakerState.HALF_OPEN : breaker;
        return new DomainState(
            state.domain(),
            now,
            state.inFlight() + 1,
            state.consecutiveFailures(),
            nextBreaker,
            nextBreaker == BreakerState.HALF_OPEN ? null : state.openUntil()
        );
    }

    DomainState onSuccess(DomainState state) {
        BreakerState nextBreaker = state.breakerState() == BreakerState.HALF_OPEN
            ? BreakerState.CLOSED
            : state.breakerState();
        return new DomainState(
            state.domain(),
            state.lastDispatchAt(),
            Math.max(0, state.inFlight() - 1),
            0,
            nextBreaker,
            nextBreaker == BreakerState.CLOSED ? null : state.openUntil()
        );
    }

    DomainState onFailure(DomainState state, Instant now) {
        int failures = state.consecutiveFailures() + 1;
        BreakerState breaker = state.breakerState();
        boolean trip = breaker == BreakerState.HALF_OPEN
            || (breaker == BreakerState.CLOSED && failures >= properties.getFailureThreshold());
        if (trip) {
            return new DomainState(
                state.domain(),
                state.lastDispatchAt(),
                Math.max(0, state.inFlight() - 1),
                failures,
                BreakerState.OPEN,
                now.plusMillis(properties.getCooldownMs())
            );
        }
        return new DomainState(
            state.domain(),
            state.lastDispatchAt(),
            Math.max(0, state.inFlight() - 1),
            failures,
            breaker,
            state.openUntil()
        );
    }

    DomainState onAbandoned(DomainState state, Instant now) {
        if (state.breakerState() == BreakerState.HALF_OPEN) {
            return new DomainState(
                state.domain(),
                state.lastDispatchAt(),
                Math.max(0, state.inFlight() - 1),
                state.consecutiveFailures(),
                BreakerState.OPEN,
                now
            );
        }
        return new DomainState(
            state.domain(),
            state.lastDispatchAt(),
            Math.max(0, state.inFlight() - 1),
            state.consecutiveFailures(),
            state.breakerState(),
            state.openUntil()
        );
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }
}
