package com.docrender.core.cancel;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal shared by the transformation pipeline and the render orchestrator.
 *
 * <p>A token is cancelled either explicitly via {@link #cancel()} or implicitly once its deadline
 * passes. Cancellation never interrupts running work; callers poll {@link #isCancelled()} between
 * steps and stop before starting the next one.
 *
 * <p>Child tokens created with {@link #withTimeout(Duration)} or {@link #withDeadline(Instant)}
 * observe the parent: cancelling the parent cancels every child, but cancelling a child leaves the
 * parent untouched.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * CancellationToken token = CancellationToken.create().withTimeout(Duration.ofSeconds(10));
 * orchestrator.render(token, document);
 * }</pre>
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(null, null, Clock.systemUTC(), false);

    private final CancellationToken parent;
    private final Instant deadline;
    private final Clock clock;
    private final boolean cancellable;
    private final AtomicReference<Throwable> cause = new AtomicReference<>();

    private CancellationToken(CancellationToken parent, Instant deadline, Clock clock, boolean cancellable) {
        this.parent = parent;
        this.deadline = deadline;
        this.clock = clock;
        this.cancellable = cancellable;
    }

    /**
     * Returns a token that is never cancelled.
     *
     * @return shared non-cancellable token
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Creates a new cancellable token without deadline.
     *
     * @return fresh token
     */
    public static CancellationToken create() {
        return new CancellationToken(null, null, Clock.systemUTC(), true);
    }

    /**
     * Creates a token that is already cancelled.
     *
     * @return cancelled token
     */
    public static CancellationToken cancelled() {
        CancellationToken token = create();
        token.cancel();
        return token;
    }

    /**
     * Derives a child token that expires after the given timeout.
     *
     * @param timeout time budget, must be positive
     * @return child token
     */
    public CancellationToken withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        return withDeadline(clock.instant().plus(timeout));
    }

    /**
     * Derives a child token that expires at the given instant.
     *
     * @param deadline absolute deadline
     * @return child token
     */
    public CancellationToken withDeadline(Instant deadline) {
        Objects.requireNonNull(deadline, "deadline must not be null");
        Instant effective = this.deadline != null && this.deadline.isBefore(deadline) ? this.deadline : deadline;
        return new CancellationToken(this, effective, clock, true);
    }

    /**
     * Cancels this token with a generic {@link CancellationException} cause.
     */
    public void cancel() {
        cancel(new CancellationException("operation cancelled"));
    }

    /**
     * Cancels this token with the given cause. The first cause wins.
     *
     * @param reason cancellation cause
     */
    public void cancel(Throwable reason) {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.none() cannot be cancelled");
        }
        cause.compareAndSet(null, Objects.requireNonNull(reason, "reason must not be null"));
    }

    /**
     * Returns whether this token, its parent, or its deadline has fired.
     *
     * @return true once cancelled
     */
    public boolean isCancelled() {
        return cause() != null;
    }

    /**
     * Returns the cancellation cause, or {@code null} while the token is still live.
     *
     * <p>Explicit cancellation yields a {@link CancellationException}; an expired deadline yields a
     * {@link TimeoutException}.
     *
     * @return cause or null
     */
    public Throwable cause() {
        Throwable own = cause.get();
        if (own != null) {
            return own;
        }
        if (parent != null) {
            Throwable inherited = parent.cause();
            if (inherited != null) {
                return inherited;
            }
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            cause.compareAndSet(null, new TimeoutException("deadline exceeded at " + deadline));
            return cause.get();
        }
        return null;
    }

    /**
     * Returns the deadline of this token, or {@code null} if it has none.
     *
     * @return deadline or null
     */
    public Instant deadline() {
        return deadline;
    }
}
