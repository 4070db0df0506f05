package com.di.skyflow.coordination;

import com.di.skyflow.common.Failure;
import com.di.skyflow.common.Result;
import com.di.skyflow.config.SkyFlowProperties;
import com.di.skyflow.util.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Named locks shared by every worker process, plus retry with exponential backoff.
 *
 * <pre>
 * try (ScopedLock lock = coordinator.withLock("stage:" + groupId, timeout)) {
 *     ...
 * }
 * </pre>
 *
 * <p>Locks are database leases, so they hold across processes and survive a crashed holder
 * only until the lease runs out. They are not reentrant.
 */
@Service
@Slf4j
public class ConcurrencyCoordinator {

    public static final String LOCK_TIMEOUT = "LOCK_TIMEOUT";

    private final LockRepository locks;
    private final MetricsCollector metrics;
    private final Clock clock;
    private final Sleeper sleeper;
    private final SkyFlowProperties.Lock lockCfg;
    private final RetryPolicy defaultPolicy;
    private final String nodeName;

    public ConcurrencyCoordinator(LockRepository locks,
                                  MetricsCollector metrics,
                                  Clock clock,
                                  Sleeper sleeper,
                                  SkyFlowProperties props) {
        this.locks = locks;
        this.metrics = metrics;
        this.clock = clock;
        this.sleeper = sleeper;
        this.lockCfg = props.getLock();
        SkyFlowProperties.Retry retry = props.getRetry();
        this.defaultPolicy = new RetryPolicy(retry.getMaxAttempts(), retry.getBaseDelay(), retry.getMaxDelay());
        this.nodeName = props.getWorker().getNodeName();
    }

    /* ==================================================================== */
    /* Locks                                                                 */
    /* ==================================================================== */

    /**
     * Blocks until the lock is held or {@code timeout} elapses.
     *
     * @throws LockTimeoutException if the lock stays taken for the whole timeout
     */
    public ScopedLock withLock(String key, Duration timeout) {
        String owner = nodeName + "/" + Thread.currentThread().getName();
        String token = UUID.randomUUID().toString();
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            if (locks.tryAcquire(key, owner, token, clock.instant(), clock.instant().plus(lockCfg.getLease()))) {
                log.debug("[LOCK] acquired '{}' owner={}", key, owner);
                return new ScopedLock(locks, clock, key, token, lockCfg.getLease());
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                metrics.recordLockTimeout();
                log.warn("[LOCK] timed out on '{}' after {} ms (held by {})",
                        key, timeout.toMillis(), locks.findOwner(key).orElse("?"));
                throw new LockTimeoutException(key, timeout);
            }
            try {
                sleeper.sleep(Duration.ofNanos(Math.min(remaining, lockCfg.getPollInterval().toNanos())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockTimeoutException(key, timeout);
            }
        }
    }

    public ScopedLock withLock(String key) {
        return withLock(key, lockCfg.getTimeout());
    }

    /**
     * True while some holder's lease on {@code key} is live. Does not take the lock.
     */
    public boolean isHeld(String key) {
        return locks.isHeld(key, clock.instant());
    }

    /**
     * Runs {@code work} under the lock. A lock timeout becomes a transient failure.
     */
    public <T> Result<T> callWithLock(String key, Duration timeout, Supplier<Result<T>> work) {
        try (ScopedLock ignored = withLock(key, timeout)) {
            return work.get();
        } catch (LockTimeoutException e) {
            return Result.transientFailure(LOCK_TIMEOUT, e.getMessage());
        }
    }

    public <T> Result<T> callWithLock(String key, Supplier<Result<T>> work) {
        return callWithLock(key, lockCfg.getTimeout(), work);
    }

    /* ==================================================================== */
    /* Retry                                                                 */
    /* ==================================================================== */

    /**
     * Calls {@code op} until it succeeds, fails non-transiently, or {@code maxAttempts} is
     * reached, waiting {@code baseDelay * 2^(n-1)} (capped) after the n-th transient failure.
     */
    public <T> RetryResult<T> retry(Supplier<Result<T>> op, int maxAttempts, Duration baseDelay) {
        return retry(op, new RetryPolicy(maxAttempts, baseDelay, defaultPolicy.maxDelay()));
    }

    public <T> RetryResult<T> retry(Supplier<Result<T>> op) {
        return retry(op, defaultPolicy);
    }

    public <T> RetryResult<T> retry(Supplier<Result<T>> op, RetryPolicy policy) {
        Result<T> last = null;
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            last = op.get();
            if (last.isSuccess()) {
                return new RetryResult<>(last, attempt);
            }
            Failure failure = last.getFailure();
            if (!failure.isRetryable()) {
                return new RetryResult<>(last, attempt);
            }
            if (attempt == policy.maxAttempts()) {
                log.warn("[RETRY] giving up after {} attempt(s): {}", attempt, failure.describe());
                return new RetryResult<>(last, attempt);
            }
            Duration delay = policy.delayAfter(attempt);
            log.info("[RETRY] attempt {}/{} failed ({}), retrying in {} ms",
                    attempt, policy.maxAttempts(), failure.describe(), delay.toMillis());
            metrics.recordRetry();
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new RetryResult<>(last, attempt);
            }
        }
        return new RetryResult<>(last, policy.maxAttempts());
    }

    public RetryPolicy getDefaultPolicy() {
        return defaultPolicy;
    }
}
