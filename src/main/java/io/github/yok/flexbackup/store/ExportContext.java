package io.github.yok.flexbackup.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Cooperative cancellation signal threaded through every store call of a backup run.
 *
 * <p>
 * A context is cancelled either explicitly via {@link #cancel()} or implicitly when its optional
 * deadline passes. Store implementations call {@link #checkCancelled()} before each statement and
 * on each scanned row, and may {@link #onCancel(Runnable) register} a hook that interrupts the
 * in-flight statement (e.g. {@code Statement.cancel()}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ExportContext {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private final List<Runnable> cancelHooks = new CopyOnWriteArrayList<>();

    private final Clock clock;

    // null means "no deadline"
    private final Instant deadline;

    private ExportContext(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    /**
     * Returns a context that is never cancelled unless {@link #cancel()} is called.
     *
     * @return new context without deadline
     */
    public static ExportContext background() {
        return new ExportContext(Clock.systemUTC(), null);
    }

    /**
     * Returns a context that is cancelled once {@code timeout} has elapsed.
     *
     * @param timeout maximum duration of the run; {@code null} or non-positive means no deadline
     * @return new context
     */
    public static ExportContext withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    static ExportContext withTimeout(Duration timeout, Clock clock) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return new ExportContext(clock, null);
        }
        return new ExportContext(clock, clock.instant().plus(timeout));
    }

    /**
     * Cancels the context and runs every registered hook once.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        log.info("Backup run cancelled");
        for (Runnable hook : cancelHooks) {
            hook.run();
        }
    }

    /**
     * Returns whether the context was cancelled or its deadline has passed.
     *
     * @return {@code true} when the run must stop
     */
    public boolean isCancelled() {
        if (cancelled.get()) {
            return true;
        }
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /**
     * Throws when the context is cancelled.
     *
     * @throws CancellationException if the run must stop
     */
    public void checkCancelled() {
        if (isCancelled()) {
            throw new CancellationException(
                    cancelled.get() ? "backup run cancelled" : "backup run deadline exceeded");
        }
    }

    /**
     * Returns the remaining time until the deadline, if one is set.
     *
     * @return remaining time (never negative), or empty when there is no deadline
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * Registers a hook that runs when the context is cancelled.
     *
     * @param hook action to run on cancellation
     * @return registration; closing it removes the hook
     */
    public Registration onCancel(Runnable hook) {
        cancelHooks.add(hook);
        return () -> cancelHooks.remove(hook);
    }

    /**
     * Handle returned by {@link #onCancel(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        @Override
        void close();
    }
}
