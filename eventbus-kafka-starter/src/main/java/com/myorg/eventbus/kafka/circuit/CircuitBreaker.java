package com.myorg.eventbus.kafka.circuit;

import com.myorg.eventbus.kafka.exception.CircuitOpenException;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Three-state breaker in front of an asynchronous operation.
 *
 * <ul>
 *   <li>CLOSED: calls pass through, {@code failureThreshold} consecutive failures open the circuit.</li>
 *   <li>OPEN: calls fail fast with {@link CircuitOpenException} until {@code resetTimeout} has elapsed.</li>
 *   <li>HALF_OPEN: exactly one trial call is admitted; its outcome closes or re-opens the circuit.</li>
 * </ul>
 *
 * All transitions happen under one lock, callbacks run after the lock is released.
 * Outcomes of calls admitted in an earlier state (e.g. before a {@link #reset()}) are discarded.
 */
@Slf4j
public class CircuitBreaker {

    private final int failureThreshold;
    private final Duration resetTimeout;
    private final Clock clock;
    private final Runnable onOpen;
    private final Runnable onClose;
    private final Runnable onHalfOpen;

    private final Object lock = new Object();

    // guarded by lock
    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant nextAttemptAt;
    private boolean trialInFlight;
    private long generation;

    @Builder
    public CircuitBreaker(int failureThreshold,
                          Duration resetTimeout,
                          Clock clock,
                          Runnable onOpen,
                          Runnable onClose,
                          Runnable onHalfOpen) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, was " + failureThreshold);
        }
        this.failureThreshold = failureThreshold;
        this.resetTimeout = Objects.requireNonNull(resetTimeout, "resetTimeout");
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.onOpen = onOpen;
        this.onClose = onClose;
        this.onHalfOpen = onHalfOpen;
    }

    /**
     * Runs {@code call} if the circuit admits it. The returned future completes after the breaker
     * has recorded the outcome, so state observed right after completion is already up to date.
     * A rejected call never invokes {@code call}.
     */
    public <T> CompletableFuture<T> fire(Supplier<? extends CompletionStage<T>> call) {
        Objects.requireNonNull(call, "call");

        final long admittedIn;
        final boolean trial;
        boolean enteredHalfOpen = false;

        synchronized (lock) {
            if (state == CircuitState.OPEN) {
                if (clock.instant().isBefore(nextAttemptAt)) {
                    return CompletableFuture.failedFuture(new CircuitOpenException(nextAttemptAt));
                }
                transitionTo(CircuitState.HALF_OPEN);
                enteredHalfOpen = true;
            }
            if (state == CircuitState.HALF_OPEN) {
                if (trialInFlight) {
                    // chỉ cho 1 request thử
                    return CompletableFuture.failedFuture(new CircuitOpenException(nextAttemptAt));
                }
                trialInFlight = true;
                trial = true;
            } else {
                trial = false;
            }
            admittedIn = generation;
        }
        if (enteredHalfOpen) {
            log.info("Circuit breaker half-open, admitting a trial call");
            notify(onHalfOpen);
        }

        CompletionStage<T> stage;
        try {
            stage = call.get();
            if (stage == null) {
                throw new IllegalStateException("Guarded call returned no future");
            }
        } catch (RuntimeException e) {
            recordOutcome(admittedIn, trial, false);
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        stage.whenComplete((value, ex) -> {
            if (ex == null) {
                recordOutcome(admittedIn, trial, true);
                result.complete(value);
            } else {
                recordOutcome(admittedIn, trial, false);
                result.completeExceptionally(unwrap(ex));
            }
        });
        return result;
    }

    /** Forces CLOSED with a zero failure count. */
    public void reset() {
        boolean wasOpen;
        synchronized (lock) {
            wasOpen = state != CircuitState.CLOSED;
            transitionTo(CircuitState.CLOSED);
            failureCount = 0;
            nextAttemptAt = null;
        }
        if (wasOpen) {
            log.info("Circuit breaker reset to CLOSED");
            notify(onClose);
        }
    }

    public CircuitState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public int getFailureCount() {
        synchronized (lock) {
            return failureCount;
        }
    }

    /** Earliest instant a trial call is admitted; null unless the circuit has opened. */
    public Instant getNextAttemptAt() {
        synchronized (lock) {
            return nextAttemptAt;
        }
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getResetTimeout() {
        return resetTimeout;
    }

    private void recordOutcome(long admittedIn, boolean trial, boolean success) {
        CircuitState entered = null;
        int failures;
        synchronized (lock) {
            if (admittedIn != generation) {
                return; // stale outcome
            }
            if (trial) {
                trialInFlight = false;
            }
            if (success) {
                failureCount = 0;
                if (state != CircuitState.CLOSED) {
                    transitionTo(CircuitState.CLOSED);
                    nextAttemptAt = null;
                    entered = CircuitState.CLOSED;
                }
            } else {
                failureCount++;
                if (state == CircuitState.HALF_OPEN || failureCount >= failureThreshold) {
                    transitionTo(CircuitState.OPEN);
                    nextAttemptAt = clock.instant().plus(resetTimeout);
                    entered = CircuitState.OPEN;
                }
            }
            failures = failureCount;
        }
        if (entered == CircuitState.OPEN) {
            log.warn("Circuit breaker opened after {} consecutive failures, retry after {}", failures, resetTimeout);
            notify(onOpen);
        } else if (entered == CircuitState.CLOSED) {
            log.info("Circuit breaker closed");
            notify(onClose);
        }
    }

    private void transitionTo(CircuitState next) {
        state = next;
        trialInFlight = false;
        generation++;
    }

    private static void notify(Runnable callback) {
        if (callback == null) return;
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Circuit breaker callback failed: {}", e.toString(), e);
        }
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable t = ex;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
