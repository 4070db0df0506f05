package com.di.skyflow.orchestration;

import com.di.skyflow.collaborator.ConversionCollaborator;
import com.di.skyflow.collaborator.ImagingCollaborator;
import com.di.skyflow.common.Failure;
import com.di.skyflow.common.FailureKind;
import com.di.skyflow.common.Result;
import com.di.skyflow.config.SkyFlowProperties;
import com.di.skyflow.coordination.ConcurrencyCoordinator;
import com.di.skyflow.coordination.LockTimeoutException;
import com.di.skyflow.coordination.RetryResult;
import com.di.skyflow.coordination.ScopedLock;
import com.di.skyflow.group.CalibrationState;
import com.di.skyflow.group.GroupMember;
import com.di.skyflow.group.GroupState;
import com.di.skyflow.group.ObservationGroup;
import com.di.skyflow.group.ObservationGroupRepository;
import com.di.skyflow.group.StaleGroupStateException;
import com.di.skyflow.mosaic.MosaicGroup;
import com.di.skyflow.mosaic.MosaicService;
import com.di.skyflow.state.ProcessingStateMachine;
import com.di.skyflow.state.TransitionContext;
import com.di.skyflow.util.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Drives one group through its stages.
 *
 * <pre>
 * ┌──────────────────────────────────────────────────────────────────────┐
 * │  CONVERT    PENDING → CONVERTING   subbands → measurement set          │
 * │  CALIBRATE  CALIBRATING            solve+register | interpolate | none │
 * │  IMAGE      IMAGING                measurement set → image             │
 * │  MOSAIC     MOSAICKING             enroll tile, plan windows           │
 * │             → COMPLETED                                                │
 * └──────────────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <p>Each stage runs under the lock {@code stage:<group>}, whose lease is renewed before every
 * attempt. The lease must outlast one tool run plus the longest backoff; this is checked at
 * startup. Collaborator failures come back as
 * typed results and are classified here and only here:
 * <ul>
 *   <li>TRANSIENT: retried with backoff; when attempts run out the group fails retryably</li>
 *   <li>VALIDATION / FATAL: the group fails and waits for an operator</li>
 *   <li>no calibration available: the group continues uncalibrated (degraded)</li>
 * </ul>
 * A stage the group has already passed is never re-run: its recorded output is returned.
 */
@Service
@Slf4j
public class StageOrchestrator {

    /** The stage lease ran out and may now belong to another worker. */
    public static final String LEASE_LOST = "LEASE_LOST";

    private static final Set<CalibrationState> CALIBRATED =
            EnumSet.of(CalibrationState.SOLVED, CalibrationState.APPLIED, CalibrationState.INTERPOLATED);

    private final ObservationGroupRepository groups;
    private final ProcessingStateMachine stateMachine;
    private final ConcurrencyCoordinator coordinator;
    private final ConversionCollaborator converter;
    private final CalibrationStep calibrationStep;
    private final ImagingCollaborator imager;
    private final MosaicService mosaicService;
    private final MetricsCollector metrics;
    private final Duration lockTimeout;
    private final String nodeName;

    public StageOrchestrator(ObservationGroupRepository groups,
                             ProcessingStateMachine stateMachine,
                             ConcurrencyCoordinator coordinator,
                             ConversionCollaborator converter,
                             CalibrationStep calibrationStep,
                             ImagingCollaborator imager,
                             MosaicService mosaicService,
                             MetricsCollector metrics,
                             SkyFlowProperties props) {
        this.groups = groups;
        this.stateMachine = stateMachine;
        this.coordinator = coordinator;
        this.converter = converter;
        this.calibrationStep = calibrationStep;
        this.imager = imager;
        this.mosaicService = mosaicService;
        this.metrics = metrics;
        this.lockTimeout = props.getLock().getTimeout();
        this.nodeName = props.getWorker().getNodeName();
        checkLeaseCoversAttempt(props);
    }

    static String stageLockKey(String groupId) {
        return "stage:" + groupId;
    }

    /**
     * A lease shorter than one attempt plus its backoff can expire under a running stage and
     * let a second worker in.
     */
    private static void checkLeaseCoversAttempt(SkyFlowProperties props) {
        Duration lease = props.getLock().getLease();
        Duration attempt = props.getTools().getTimeout().plus(props.getRetry().getMaxDelay());
        if (lease.compareTo(attempt) <= 0) {
            throw new IllegalStateException("skyflow.lock.lease (" + lease
                    + ") must exceed skyflow.tools.timeout + skyflow.retry.max-delay (" + attempt + ")");
        }
    }

    /* ==================================================================== */
    /* Entry points                                                          */
    /* ==================================================================== */

    /**
     * Runs one stage for one group.
     */
    public StageResult runStage(String groupId, PipelineStage stage) {
        long started = System.nanoTime();
        StageResult result = doRunStage(groupId, stage);
        metrics.recordStage(stage.name(), result.getOutcome().name(), Duration.ofNanos(System.nanoTime() - started));
        return result;
    }

    /**
     * Runs the remaining stages in order until the group completes or a stage does not advance.
     */
    public List<StageResult> runToCompletion(String groupId) {
        List<StageResult> results = new ArrayList<>();
        while (true) {
            Optional<ObservationGroup> group = groups.findById(groupId);
            if (group.isEmpty()) {
                break;
            }
            PipelineStage stage = PipelineStage.forState(group.get().getState());
            if (stage == null) {
                break;
            }
            StageResult r = runStage(groupId, stage);
            results.add(r);
            if (!r.getOutcome().advanced()) {
                break;
            }
        }
        return results;
    }

    /**
     * Sends a failed group back to its failed stage (if its budget allows) and resumes it.
     */
    public List<StageResult> retryFailed(String groupId) {
        Optional<ObservationGroup> retried = stateMachine.retry(groupId);
        if (retried.isEmpty()) {
            return List.of();
        }
        return runToCompletion(groupId);
    }

    /**
     * True while some worker holds a live lease on the group's stage lock.
     */
    public boolean isStageActive(String groupId) {
        return coordinator.isHeld(stageLockKey(groupId));
    }

    /* ==================================================================== */
    /* Stage execution                                                       */
    /* ==================================================================== */

    private StageResult doRunStage(String groupId, PipelineStage stage) {
        Optional<ObservationGroup> found = groups.findById(groupId);
        if (found.isEmpty()) {
            return notReady(groupId, stage, null, "unknown group");
        }
        ObservationGroup group = found.get();
        Optional<StageResult> early = checkPreconditions(group, stage);
        if (early.isPresent()) {
            return early.get();
        }

        try (ScopedLock lock = coordinator.withLock(stageLockKey(groupId), lockTimeout)) {
            // re-read under the lock; another worker may have finished the stage meanwhile
            group = groups.findById(groupId).orElseThrow();
            early = checkPreconditions(group, stage);
            if (early.isPresent()) {
                return early.get();
            }
            if (group.getState() == GroupState.PENDING) {
                group = stateMachine.transition(group, GroupState.CONVERTING,
                        TransitionContext.because("claimed by " + nodeName));
            }
            return execute(group, stage, lock);
        } catch (LockTimeoutException e) {
            log.info("[STAGE] group={} stage={} busy: {}", groupId, stage, e.getMessage());
            return StageResult.builder()
                    .groupId(groupId).stage(stage).outcome(StageOutcome.FAILED_RETRYABLE)
                    .state(group.getState())
                    .failure(Failure.of(FailureKind.TRANSIENT, ConcurrencyCoordinator.LOCK_TIMEOUT, e.getMessage()))
                    .message("lock held by another worker")
                    .build();
        } catch (StaleGroupStateException e) {
            log.info("[STAGE] group={} stage={} lost race: {}", groupId, stage, e.getMessage());
            return notReady(groupId, stage, null, e.getMessage());
        }
    }

    private Optional<StageResult> checkPreconditions(ObservationGroup group, PipelineStage stage) {
        GroupState state = group.getState();
        boolean done = stage.isDoneIn(state)
                || (state == GroupState.FAILED && group.getFailedStage() != null
                    && group.getFailedStage().isPast(stage.activeState()));
        if (done) {
            return Optional.of(StageResult.builder()
                    .groupId(group.getGroupId()).stage(stage).outcome(StageOutcome.ALREADY_DONE)
                    .state(state).output(recordedOutput(group, stage))
                    .message("stage already completed")
                    .build());
        }
        if (!stage.canStartFrom(state)) {
            return Optional.of(notReady(group.getGroupId(), stage, state,
                    "group is " + state + (state == GroupState.FAILED ? " (retry or requeue first)" : "")));
        }
        return Optional.empty();
    }

    private StageResult execute(ObservationGroup group, PipelineStage stage, ScopedLock lock) {
        String groupId = group.getGroupId();
        log.info("[STAGE] group={} {} starting", groupId, stage);

        RetryResult<TransitionContext> attempt = coordinator.retry(() -> lock.renew()
                ? invoke(group, stage)
                : Result.<TransitionContext>fatal(LEASE_LOST, "lease on " + lock.getKey() + " expired before the attempt"));
        Result<TransitionContext> result = attempt.result();

        if (!result.isSuccess() && LEASE_LOST.equals(result.getFailure().getCode())) {
            // the group now belongs to whoever took the lease over; leave its state alone
            log.warn("[STAGE] group={} {} abandoned after {} attempt(s): {}",
                    groupId, stage, attempt.attempts(), result.getFailure().getMessage());
            return StageResult.builder()
                    .groupId(groupId).stage(stage).outcome(StageOutcome.FAILED_RETRYABLE)
                    .state(group.getState())
                    .failure(Failure.of(FailureKind.TRANSIENT, LEASE_LOST, result.getFailure().getMessage()))
                    .attempts(attempt.attempts())
                    .message("stage lease lost")
                    .build();
        }

        if (result.isSuccess()) {
            TransitionContext ctx = result.getData();
            ObservationGroup advanced = advance(group, stage, ctx);
            boolean degraded = stage == PipelineStage.CALIBRATE
                    && ctx.getCalibrationState() == CalibrationState.UNCALIBRATED;
            if (advanced.getState() == GroupState.COMPLETED) {
                metrics.recordGroupCompleted();
            }
            log.info("[STAGE] group={} {} {} after {} attempt(s) -> {}",
                    groupId, stage, degraded ? "degraded" : "done", attempt.attempts(), advanced.getState());
            return StageResult.builder()
                    .groupId(groupId).stage(stage)
                    .outcome(degraded ? StageOutcome.DEGRADED : StageOutcome.SUCCEEDED)
                    .state(advanced.getState())
                    .output(recordedOutput(advanced, stage))
                    .attempts(attempt.attempts())
                    .build();
        }

        Failure failure = result.getFailure();
        boolean retryable = failure.getKind() == FailureKind.TRANSIENT;
        ObservationGroup failed = stateMachine.recordFailure(groupId, stage.activeState(), failure.describe(), retryable);
        return StageResult.builder()
                .groupId(groupId).stage(stage)
                .outcome(retryable ? StageOutcome.FAILED_RETRYABLE : StageOutcome.FAILED_FATAL)
                .state(failed.getState())
                .failure(failure)
                .attempts(attempt.attempts())
                .message(retryable ? "transient failure persisted" : "non-retryable failure")
                .build();
    }

    /**
     * Moves the group past the stage. The stage lock keeps other workers out, so a version
     * conflict while the group is still in the stage's state comes from a side update such as
     * calibration invalidation by the mosaic planner; the move is re-applied on a fresh read.
     */
    private ObservationGroup advance(ObservationGroup group, PipelineStage stage, TransitionContext ctx) {
        try {
            return stateMachine.transition(group, stage.nextState(), ctx);
        } catch (StaleGroupStateException e) {
            ObservationGroup fresh = groups.findById(group.getGroupId()).orElseThrow(() -> e);
            if (fresh.getState() != stage.activeState()) {
                throw e;
            }
            log.debug("[STAGE] group={} updated during {}, re-applying transition", group.getGroupId(), stage);
            return stateMachine.transition(fresh, stage.nextState(), ctx);
        }
    }

    /**
     * Calls the stage's collaborator once and describes what to persist on success.
     */
    private Result<TransitionContext> invoke(ObservationGroup group, PipelineStage stage) {
        switch (stage) {
            case CONVERT: {
                List<String> paths = new ArrayList<>();
                for (GroupMember m : group.membersInOrder()) {
                    paths.add(m.getPath());
                }
                return converter.convert(group.getGroupId(), paths)
                        .map(ms -> TransitionContext.builder().outputPath(ms).reason("converted").build());
            }
            case CALIBRATE:
                return calibrationStep.calibrate(group).map(outcome -> TransitionContext.builder()
                        .calibrationState(outcome.state())
                        .calibrationSets(outcome.joinedSetNames())
                        .calibratorName(outcome.transit() == null ? null : outcome.transit().calibratorName())
                        .transitMjd(outcome.transit() == null ? null : outcome.transit().transitMjd())
                        .reason("calibration " + outcome.state())
                        .build());
            case IMAGE: {
                if (group.getOutputPath() == null) {
                    return Result.validation("MISSING_INPUT", "group " + group.getGroupId() + " has no converted output");
                }
                boolean calibrated = CALIBRATED.contains(group.getCalibrationState());
                return imager.image(group.getOutputPath(), calibrated)
                        .map(img -> TransitionContext.builder().imagePath(img)
                                .reason(calibrated ? "imaged" : "imaged uncalibrated").build());
            }
            case MOSAIC:
                return mosaicService.enrollTile(group).map(added -> {
                    planMosaicsQuietly(group.getGroupId());
                    return TransitionContext.because("enrolled in mosaic pool");
                });
            default:
                throw new IllegalArgumentException("Unknown stage " + stage);
        }
    }

    /** Mosaic planning problems belong to the mosaic, not to the group being completed. */
    private void planMosaicsQuietly(String groupId) {
        Result<List<MosaicGroup>> planned = mosaicService.planWindows();
        if (planned.isFailure()) {
            log.info("[STAGE] group={} mosaic planning deferred: {}", groupId, planned.getFailure().describe());
        }
    }

    private static String recordedOutput(ObservationGroup g, PipelineStage stage) {
        switch (stage) {
            case CONVERT:
                return g.getOutputPath();
            case CALIBRATE:
                return g.getCalibrationSets();
            default:
                return g.getImagePath();
        }
    }

    private static StageResult notReady(String groupId, PipelineStage stage, GroupState state, String message) {
        return StageResult.builder()
                .groupId(groupId).stage(stage).outcome(StageOutcome.NOT_READY)
                .state(state).message(message)
                .build();
    }
}
