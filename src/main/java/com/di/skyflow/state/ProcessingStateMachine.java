package com.di.skyflow.state;

import com.di.skyflow.config.SkyFlowProperties;
import com.di.skyflow.group.GroupNotFoundException;
import com.di.skyflow.group.GroupState;
import com.di.skyflow.group.IllegalStateTransitionException;
import com.di.skyflow.group.ObservationGroup;
import com.di.skyflow.group.ObservationGroupRepository;
import com.di.skyflow.group.StaleGroupStateException;
import com.di.skyflow.group.StateTransitionRecord;
import com.di.skyflow.group.StateTransitionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Enforces the group lifecycle ({@link GroupState}) and persists every change together with
 * its audit row. Writes are compare-and-set on the group's row version, so two workers that
 * read the same snapshot cannot both move it.
 *
 * <p>Failure handling:
 * <ul>
 *   <li>{@link #recordFailure} moves the group to FAILED, stores the error and the stage that
 *       failed, and counts the attempt. Outputs of earlier stages stay in place.</li>
 *   <li>{@link #retry} sends a retryable group back to the failed stage while its retry
 *       budget lasts.</li>
 *   <li>{@link #requeue} is the operator override for groups that are out of budget or
 *       failed fatally.</li>
 * </ul>
 */
@Service
@Slf4j
public class ProcessingStateMachine {

    private final ObservationGroupRepository groups;
    private final StateTransitionRepository history;
    private final TransactionTemplate tx;
    private final Clock clock;
    private final int maxRetries;
    private final String nodeName;

    public ProcessingStateMachine(ObservationGroupRepository groups,
                                  StateTransitionRepository history,
                                  TransactionTemplate tx,
                                  Clock clock,
                                  SkyFlowProperties props) {
        this.groups = groups;
        this.history = history;
        this.tx = tx;
        this.clock = clock;
        this.maxRetries = props.getState().getMaxRetries();
        this.nodeName = props.getWorker().getNodeName();
    }

    /* ==================================================================== */
    /* Transitions                                                           */
    /* ==================================================================== */

    public ObservationGroup transition(String groupId, GroupState target) {
        return transition(groupId, target, TransitionContext.none());
    }

    public ObservationGroup transition(String groupId, GroupState target, TransitionContext ctx) {
        return transition(load(groupId), target, ctx);
    }

    /**
     * Moves the group from the state in {@code current} to {@code target}.
     *
     * @throws IllegalStateTransitionException if the lifecycle forbids the move
     * @throws StaleGroupStateException        if the stored group no longer matches {@code current}
     */
    public ObservationGroup transition(ObservationGroup current, GroupState target, TransitionContext ctx) {
        GroupState from = current.getState();
        if (from == target) {
            return current;
        }
        if (!from.canTransitionTo(target)) {
            throw new IllegalStateTransitionException(current.getGroupId(), from, target);
        }
        if (target == GroupState.FAILED) {
            throw new IllegalArgumentException("Use recordFailure to fail group " + current.getGroupId());
        }
        if (from == GroupState.FAILED && target != current.getFailedStage()) {
            throw new IllegalStateTransitionException(current.getGroupId(), from, target);
        }

        ObservationGroup next = current.toBuilder().build();
        next.setState(target);
        next.setUpdatedAt(clock.instant());
        applyContext(next, ctx);
        if (from == GroupState.FAILED) {
            next.setErrorMessage(null);
            next.setFailedStage(null);
            next.setRetryable(false);
        }

        persist(next, from, ctx.getReason());
        log.info("[STATE] group={} {} -> {}", current.getGroupId(), from, target);
        return reload(next);
    }

    /**
     * Marks the group FAILED. {@code failedStage} is the stage to resume at on retry.
     */
    public ObservationGroup recordFailure(String groupId, GroupState failedStage, String error, boolean retryable) {
        ObservationGroup current = load(groupId);
        GroupState from = current.getState();
        if (!from.canTransitionTo(GroupState.FAILED)) {
            throw new IllegalStateTransitionException(groupId, from, GroupState.FAILED);
        }
        if (!failedStage.isProcessing()) {
            throw new IllegalArgumentException("Failed stage must be a processing state, got " + failedStage);
        }

        ObservationGroup next = current.toBuilder().build();
        next.setState(GroupState.FAILED);
        next.setUpdatedAt(clock.instant());
        next.setErrorMessage(error);
        next.setFailedStage(failedStage);
        next.setRetryable(retryable);
        next.setRetryCount(current.getRetryCount() + 1);

        persist(next, from, "failed at " + failedStage + ": " + error);
        log.warn("[STATE] group={} FAILED at {} (attempt {}, retryable={}): {}",
                groupId, failedStage, next.getRetryCount(), retryable, error);
        return reload(next);
    }

    /**
     * Re-enters the failed stage if the failure was retryable and budget remains.
     *
     * @return the updated group, or empty if the group stays FAILED
     */
    public Optional<ObservationGroup> retry(String groupId) {
        ObservationGroup current = load(groupId);
        if (!canRetry(current)) {
            log.info("[STATE] group={} not retried (state={}, retryable={}, retryCount={}/{})",
                    groupId, current.getState(), current.isRetryable(), current.getRetryCount(), maxRetries);
            return Optional.empty();
        }
        return Optional.of(transition(current, current.getFailedStage(),
                TransitionContext.because("retry " + current.getRetryCount() + "/" + maxRetries)));
    }

    /**
     * Operator override: resets the retry budget and re-enters the failed stage regardless of
     * the failure kind.
     */
    public ObservationGroup requeue(String groupId, String reason) {
        ObservationGroup current = load(groupId);
        if (current.getState() != GroupState.FAILED || current.getFailedStage() == null) {
            throw new IllegalStateTransitionException(groupId, current.getState(),
                    current.getFailedStage() == null ? GroupState.PENDING : current.getFailedStage());
        }
        ObservationGroup reset = current.toBuilder().retryCount(0).build();
        return transition(reset, current.getFailedStage(), TransitionContext.because("requeued: " + reason));
    }

    public boolean canRetry(ObservationGroup g) {
        return g.getState() == GroupState.FAILED
                && g.isRetryable()
                && g.getFailedStage() != null
                && g.getRetryCount() < maxRetries;
    }

    /* ==================================================================== */
    /* Queries                                                               */
    /* ==================================================================== */

    public List<ObservationGroup> findRetryable(int limit) {
        return groups.findRetryable(maxRetries, limit);
    }

    public List<ObservationGroup> findStale(Duration threshold, int limit) {
        return groups.findStale(clock.instant().minus(threshold), limit);
    }

    public List<StateTransitionRecord> history(String groupId) {
        return history.findByGroup(groupId);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /* ==================================================================== */
    /* Internals                                                             */
    /* ==================================================================== */

    private ObservationGroup load(String groupId) {
        return groups.findById(groupId).orElseThrow(() -> new GroupNotFoundException(groupId));
    }

    private ObservationGroup reload(ObservationGroup written) {
        return groups.findById(written.getGroupId()).orElse(written);
    }

    private void persist(ObservationGroup next, GroupState from, String reason) {
        Instant now = next.getUpdatedAt();
        tx.executeWithoutResult(status -> {
            if (!groups.compareAndUpdate(next)) {
                throw new StaleGroupStateException(next.getGroupId(), next.getRowVersion());
            }
            history.append(new StateTransitionRecord(
                    null, next.getGroupId(), from, next.getState(), now, nodeName, reason));
        });
    }

    private static void applyContext(ObservationGroup g, TransitionContext ctx) {
        if (ctx.getOutputPath() != null) {
            g.setOutputPath(ctx.getOutputPath());
        }
        if (ctx.getImagePath() != null) {
            g.setImagePath(ctx.getImagePath());
        }
        if (ctx.getCalibrationState() != null) {
            g.setCalibrationState(ctx.getCalibrationState());
        }
        if (ctx.getCalibrationSets() != null) {
            g.setCalibrationSets(ctx.getCalibrationSets());
        }
        if (ctx.getCalibratorName() != null) {
            g.setCalibratorName(ctx.getCalibratorName());
        }
        if (ctx.getTransitMjd() != null) {
            g.setTransitMjd(ctx.getTransitMjd());
        }
    }
}
