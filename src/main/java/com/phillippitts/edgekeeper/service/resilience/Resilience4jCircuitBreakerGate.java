package com.phillippitts.edgekeeper.service.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link CircuitBreakerGate} backed by a Resilience4j {@link CircuitBreaker}.
 *
 * <p>Behaviour:
 * <ul>
 *   <li>CLOSED opens after {@code failureThreshold} consecutive failures (count-based window of
 *       that size, 100% failure-rate threshold)</li>
 *   <li>OPEN rejects calls until {@code timeout} has elapsed, then admits probes (HALF_OPEN)</li>
 *   <li>HALF_OPEN closes after {@code successThreshold} successful probes; any probe failure
 *       reopens the circuit</li>
 * </ul>
 *
 * <p>Transitions out of OPEN are lazy: nothing happens until a caller asks. {@link #state()}
 * already reports HALF_OPEN once the wait has elapsed so that pollers (the flush loop) see the
 * circuit as ready for a probe.
 */
public class Resilience4jCircuitBreakerGate implements CircuitBreakerGate {

    private static final Logger LOG = LogManager.getLogger(Resilience4jCircuitBreakerGate.class);

    private final CircuitBreaker breaker;
    private final Duration timeout;
    private volatile Instant openedAt;

    public Resilience4jCircuitBreakerGate(String name, int failureThreshold, int successThreshold, Duration timeout) {
        if (failureThreshold <= 0 || successThreshold <= 0) {
            throw new IllegalArgumentException("Circuit thresholds must be positive");
        }
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(timeout)
                .permittedNumberOfCallsInHalfOpenState(successThreshold)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .recordExceptions(Throwable.class)
                .build();
        this.breaker = CircuitBreaker.of(name, config);
        this.breaker.getEventPublisher().onStateTransition(event -> {
            CircuitBreaker.State to = event.getStateTransition().getToState();
            if (to == CircuitBreaker.State.OPEN) {
                openedAt = Instant.now();
                LOG.warn("Circuit {} opened; retry after {}", name, timeout);
            } else {
                LOG.info("Circuit {} transitioned {}", name, event.getStateTransition());
            }
        });
    }

    @Override
    public boolean mayAttempt() {
        return breaker.tryAcquirePermission();
    }

    @Override
    public void recordSuccess() {
        breaker.onSuccess(0, TimeUnit.NANOSECONDS);
    }

    @Override
    public void recordFailure(Throwable error) {
        if (breaker.getState() == CircuitBreaker.State.HALF_OPEN) {
            // a failed probe reopens regardless of the half-open failure rate
            breaker.transitionToOpenState();
            return;
        }
        breaker.onError(0, TimeUnit.NANOSECONDS, error);
    }

    @Override
    public CircuitState state() {
        return switch (breaker.getState()) {
            case CLOSED -> CircuitState.CLOSED;
            case HALF_OPEN -> CircuitState.HALF_OPEN;
            case OPEN -> waitElapsed() ? CircuitState.HALF_OPEN : CircuitState.OPEN;
            default -> CircuitState.OPEN;
        };
    }

    private boolean waitElapsed() {
        Instant opened = openedAt;
        return opened != null && !Instant.now().isBefore(opened.plus(timeout));
    }
}
