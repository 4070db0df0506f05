package com.di.skyflow.orchestration;

import com.di.skyflow.calibration.CalTableKind;
import com.di.skyflow.calibration.CalibrationSet;
import com.di.skyflow.calibration.CalibrationTable;
import com.di.skyflow.calibration.RegistrationRequest;
import com.di.skyflow.collaborator.WeightedCalibration;
import com.di.skyflow.common.Result;
import com.di.skyflow.config.SkyFlowProperties;
import com.di.skyflow.coordination.ScopedLock;
import com.di.skyflow.group.CalibrationState;
import com.di.skyflow.group.GroupState;
import com.di.skyflow.group.ObservationGroup;
import com.di.skyflow.group.StateTransitionRecord;
import com.di.skyflow.support.SkyFlowFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StageOrchestrator Tests")
class StageOrchestratorTest {

    private static final String T0 = "2025-01-15T12:00:00";
    /** MJD of {@link #T0}. */
    private static final double T0_MJD = 60690.5;

    private SkyFlowFixture f;

    @AfterEach
    void tearDown() {
        if (f != null) {
            f.close();
        }
    }

    private String readyGroup() {
        f.arriveComplete(T0);
        return f.groupFormer.nextReadyGroup().orElseThrow().getGroupId();
    }

    private ObservationGroup group(String id) {
        return f.groups.findById(id).orElseThrow();
    }

    private void registerSet(String name, double start, double end) {
        Result<CalibrationSet> r = f.registry.register(RegistrationRequest.builder()
                .setName(name).validStart(start).validEnd(end)
                .table(CalibrationTable.of(CalTableKind.BP, "/cal/" + name + "_bpcal"))
                .table(CalibrationTable.of(CalTableKind.GP, "/cal/" + name + "_gpcal"))
                .build());
        assertTrue(r.isSuccess());
    }

    private static List<StageOutcome> outcomes(List<StageResult> results) {
        List<StageOutcome> outcomes = new ArrayList<>();
        for (StageResult r : results) {
            outcomes.add(r.getOutcome());
        }
        return outcomes;
    }

    // ============================================================================
    // End-to-end Tests
    // ============================================================================

    @Test
    @DisplayName("Should take a complete calibrated group from arrival to COMPLETED")
    void testRunToCompletion_HappyPath() {
        f = SkyFlowFixture.create();
        registerSet("nightly", T0_MJD - 0.5, T0_MJD + 0.5);
        String id = readyGroup();
        assertEquals(GroupState.PENDING, group(id).getState());

        List<StageResult> results = f.orchestrator.runToCompletion(id);

        assertEquals(List.of(StageOutcome.SUCCEEDED, StageOutcome.SUCCEEDED, StageOutcome.SUCCEEDED, StageOutcome.SUCCEEDED),
                outcomes(results));
        ObservationGroup done = group(id);
        assertEquals(GroupState.COMPLETED, done.getState());
        assertEquals(0, done.getRetryCount());
        assertEquals(CalibrationState.APPLIED, done.getCalibrationState());
        assertEquals("nightly", done.getCalibrationSets());
        assertEquals("/products/ms/" + id + ".ms", done.getOutputPath());
        assertEquals("/products/images/" + id + ".fits", done.getImagePath());
        assertEquals(List.of(true), f.stubs.imagedCalibrated);
        assertEquals(1, f.mosaics.findUnconsumedTiles().size());
        assertEquals(1.0, f.meterRegistry.counter("skyflow.groups.completed").count());

        List<StateTransitionRecord> history = f.stateMachine.history(id);
        assertEquals(6, history.size());
        assertEquals(GroupState.COMPLETED, history.get(5).toState());
    }

    @Test
    @DisplayName("Should continue uncalibrated when no calibration is in range")
    void testRunToCompletion_Uncalibrated() {
        f = SkyFlowFixture.create();
        registerSet("last_week", T0_MJD - 7.5, T0_MJD - 7.0);
        String id = readyGroup();

        List<StageResult> results = f.orchestrator.runToCompletion(id);

        assertEquals(StageOutcome.DEGRADED, results.get(1).getOutcome());
        assertEquals(GroupState.IMAGING, results.get(1).getState());
        ObservationGroup done = group(id);
        assertEquals(GroupState.COMPLETED, done.getState());
        assertEquals(CalibrationState.UNCALIBRATED, done.getCalibrationState());
        assertNull(done.getCalibrationSets());
        assertEquals(0, f.stubs.applyCalls.get());
        assertEquals(List.of(false), f.stubs.imagedCalibrated);
        assertEquals(1.0, f.meterRegistry.counter("skyflow.calibration.uncalibrated").count());
    }

    @Test
    @DisplayName("Should interpolate between the sets either side of the observation")
    void testRunToCompletion_Interpolated() {
        f = SkyFlowFixture.create();
        registerSet("before", T0_MJD - 0.5, T0_MJD - 0.1);
        registerSet("after", T0_MJD + 0.1, T0_MJD + 0.3);
        String id = readyGroup();

        f.orchestrator.runToCompletion(id);

        ObservationGroup done = group(id);
        assertEquals(CalibrationState.INTERPOLATED, done.getCalibrationState());
        assertEquals("before,after", done.getCalibrationSets());
        List<WeightedCalibration> applied = f.stubs.applied.get(0);
        assertEquals(2, applied.size());
        assertEquals(0.4, applied.get(0).weight(), 1e-6);
        assertEquals(0.6, applied.get(1).weight(), 1e-6);
        assertEquals(List.of("/cal/before_bpcal", "/cal/before_gpcal"), applied.get(0).tablePaths());
    }

    @Test
    @DisplayName("Should solve and register a transit-centred set for calibrator observations")
    void testRunToCompletion_CalibratorSolve() {
        f = SkyFlowFixture.create(props -> props.getCalibration().getCalibrators().add(calibrator(T0_MJD)));
        String id = readyGroup();

        f.orchestrator.runToCompletion(id);

        ObservationGroup done = group(id);
        assertEquals(GroupState.COMPLETED, done.getState());
        assertEquals(CalibrationState.SOLVED, done.getCalibrationState());
        assertEquals("3C286", done.getCalibratorName());
        assertEquals(T0_MJD, done.getTransitMjd(), 1e-9);

        String setName = "cal_3C286_" + id;
        assertEquals(setName, done.getCalibrationSets());
        CalibrationSet set = f.registry.findByName(setName).orElseThrow();
        assertEquals(T0_MJD - 0.5, set.getValidStart(), 1e-9);
        assertEquals(T0_MJD + 0.5, set.getValidEnd(), 1e-9);
        assertEquals("ant103", set.getReferenceAntenna());

        String ms = done.getOutputPath();
        WeightedCalibration applied = f.stubs.applied.get(0).get(0);
        assertEquals(1.0, applied.weight());
        assertEquals(List.of(ms + "_kcal", ms + "_bpcal", ms + "_gpcal"), applied.tablePaths());
        assertEquals(1, f.stubs.solveCalls.get());
    }

    @Test
    @DisplayName("Should fail fatally when the calibrator set for this group was retired")
    void testRunToCompletion_RetiredCalibratorSet() {
        f = SkyFlowFixture.create(props -> props.getCalibration().getCalibrators().add(calibrator(T0_MJD)));
        String id = readyGroup();
        registerSet("cal_3C286_" + id, T0_MJD - 0.5, T0_MJD + 0.5);
        f.registry.retire("cal_3C286_" + id, "bad solution");

        List<StageResult> results = f.orchestrator.runToCompletion(id);

        StageResult calibrate = results.get(results.size() - 1);
        assertEquals(StageOutcome.FAILED_FATAL, calibrate.getOutcome());
        assertEquals("CAL_SET_RETIRED", calibrate.getFailure().getCode());
        ObservationGroup failed = group(id);
        assertEquals(GroupState.FAILED, failed.getState());
        assertEquals(GroupState.CALIBRATING, failed.getFailedStage());
        assertFalse(failed.isRetryable());
        assertEquals(0, f.stubs.solveCalls.get());
    }

    // ============================================================================
    // Idempotency Tests
    // ============================================================================

    @Test
    @DisplayName("Should return stored output instead of re-running a finished stage")
    void testRunStage_AlreadyDone() {
        f = SkyFlowFixture.create();
        String id = readyGroup();

        StageResult first = f.orchestrator.runStage(id, PipelineStage.CONVERT);
        StageResult second = f.orchestrator.runStage(id, PipelineStage.CONVERT);

        assertEquals(StageOutcome.SUCCEEDED, first.getOutcome());
        assertEquals(StageOutcome.ALREADY_DONE, second.getOutcome());
        assertEquals(first.getOutput(), second.getOutput());
        assertEquals(1, f.stubs.convertCalls.get());
        assertEquals(GroupState.CALIBRATING, group(id).getState());
    }

    @Test
    @DisplayName("Should refuse stages the group is not ready for")
    void testRunStage_NotReady() {
        f = SkyFlowFixture.create();
        f.groupFormer.onFileArrival(SkyFlowFixture.subband(T0, 0));

        assertEquals(StageOutcome.NOT_READY, f.orchestrator.runStage(T0, PipelineStage.CONVERT).getOutcome());
        assertEquals(StageOutcome.NOT_READY, f.orchestrator.runStage("missing", PipelineStage.CONVERT).getOutcome());

        f.arriveComplete(T0);
        f.groupFormer.nextReadyGroup();
        assertEquals(StageOutcome.NOT_READY, f.orchestrator.runStage(T0, PipelineStage.IMAGE).getOutcome());
        assertEquals(0, f.stubs.imageCalls.get());
    }

    @Test
    @DisplayName("Should run a stage once when two workers race for it")
    void testRunStage_ConcurrentWorkers() throws Exception {
        f = SkyFlowFixture.create(props -> props.getLock().setTimeout(Duration.ofSeconds(5)));
        String id = readyGroup();

        ExecutorService pool = Executors.newFixedThreadPool(2);
        List<StageResult> results = new ArrayList<>();
        try {
            Future<StageResult> a = pool.submit(() -> f.orchestrator.runStage(id, PipelineStage.CONVERT));
            Future<StageResult> b = pool.submit(() -> f.orchestrator.runStage(id, PipelineStage.CONVERT));
            results.add(a.get(30, TimeUnit.SECONDS));
            results.add(b.get(30, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, f.stubs.convertCalls.get());
        assertEquals(1, outcomes(results).stream().filter(o -> o == StageOutcome.SUCCEEDED).count());
        assertEquals(GroupState.CALIBRATING, group(id).getState());
    }

    @Test
    @DisplayName("Should report a held stage lock as retryable without touching the group")
    void testRunStage_LockHeld() {
        f = SkyFlowFixture.create();
        String id = readyGroup();

        try (ScopedLock held = f.coordinator.withLock("stage:" + id)) {
            StageResult r = f.orchestrator.runStage(id, PipelineStage.CONVERT);
            assertEquals(StageOutcome.FAILED_RETRYABLE, r.getOutcome());
            assertEquals("LOCK_TIMEOUT", r.getFailure().getCode());
        }
        ObservationGroup g = group(id);
        assertEquals(GroupState.PENDING, g.getState());
        assertEquals(0, g.getRetryCount());
        assertEquals(0, f.stubs.convertCalls.get());
    }

    // ============================================================================
    // Lease Tests
    // ============================================================================

    private SkyFlowFixture shortLeaseFixture() {
        return SkyFlowFixture.create(props -> {
            props.getLock().setLease(Duration.ofSeconds(60));
            props.getTools().setTimeout(Duration.ofSeconds(30));
            props.getRetry().setMaxDelay(Duration.ofSeconds(5));
        });
    }

    private boolean otherWorkerTakesOver(String id) {
        return f.locks.tryAcquire("stage:" + id, "other-node/worker", "other-token",
                f.clock.instant(), f.clock.instant().plus(f.props.getLock().getLease()));
    }

    @Test
    @DisplayName("Should keep the stage lease while attempts run longer than the lease in total")
    void testRunStage_LeaseRenewedPerAttempt() {
        f = shortLeaseFixture();
        String id = readyGroup();
        List<Boolean> takeovers = new ArrayList<>();
        f.stubs.onConvert(() -> {
            f.clock.advance(Duration.ofSeconds(50));
            takeovers.add(otherWorkerTakesOver(id));
        });
        f.stubs.failConvert(Result.transientFailure("CONVERT_TIMEOUT", "busy"));

        StageResult r = f.orchestrator.runStage(id, PipelineStage.CONVERT);

        assertEquals(StageOutcome.SUCCEEDED, r.getOutcome());
        assertEquals(2, r.getAttempts());
        assertEquals(List.of(false, false), takeovers);
        assertEquals(GroupState.CALIBRATING, group(id).getState());
        assertFalse(f.coordinator.isHeld("stage:" + id));
    }

    @Test
    @DisplayName("Should abandon the stage without failing the group once its lease was taken over")
    void testRunStage_LeaseLost() {
        f = shortLeaseFixture();
        String id = readyGroup();
        f.stubs.onConvert(() -> {
            if (f.stubs.convertCalls.get() == 1) {
                f.clock.advance(Duration.ofMinutes(2));
                assertTrue(otherWorkerTakesOver(id));
            }
        });
        f.stubs.failConvert(Result.transientFailure("CONVERT_TIMEOUT", "busy"));

        StageResult r = f.orchestrator.runStage(id, PipelineStage.CONVERT);

        assertEquals(StageOutcome.FAILED_RETRYABLE, r.getOutcome());
        assertEquals(StageOrchestrator.LEASE_LOST, r.getFailure().getCode());
        assertEquals(1, f.stubs.convertCalls.get());
        ObservationGroup g = group(id);
        assertEquals(GroupState.CONVERTING, g.getState());
        assertEquals(0, g.getRetryCount());
        assertEquals("other-node/worker", f.locks.findOwner("stage:" + id).orElseThrow());
    }

    @Test
    @DisplayName("Should refuse a lease shorter than one tool run plus backoff")
    void testLeaseShorterThanAttempt_Rejected() {
        f = SkyFlowFixture.create();
        f.props.getLock().setLease(Duration.ofHours(4));

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new StageOrchestrator(f.groups, f.stateMachine, f.coordinator, f.stubs,
                        f.calibrationStep, f.stubs, f.mosaicService, f.metrics, f.props));
        assertTrue(ex.getMessage().contains("skyflow.lock.lease"));
    }

    // ============================================================================
    // Failure Classification Tests
    // ============================================================================

    @Test
    @DisplayName("Should absorb a transient failure with an in-place retry")
    void testRunStage_TransientThenSuccess() {
        f = SkyFlowFixture.create();
        String id = readyGroup();
        f.stubs.failConvert(Result.transientFailure("CONVERT_EXIT_75", "scratch busy"));

        StageResult r = f.orchestrator.runStage(id, PipelineStage.CONVERT);

        assertEquals(StageOutcome.SUCCEEDED, r.getOutcome());
        assertEquals(2, r.getAttempts());
        assertEquals(List.of(Duration.ofSeconds(1)), f.sleeper.getSleeps());
        assertEquals(0, group(id).getRetryCount());
    }

    @Test
    @DisplayName("Should fail retryably once transient attempts run out, then resume at that stage")
    void testRunStage_TransientExhaustedThenRetried() {
        f = SkyFlowFixture.create();
        String id = readyGroup();
        f.stubs.failConvert(
                Result.transientFailure("CONVERT_TIMEOUT", "1"),
                Result.transientFailure("CONVERT_TIMEOUT", "2"),
                Result.transientFailure("CONVERT_TIMEOUT", "3"));

        StageResult r = f.orchestrator.runStage(id, PipelineStage.CONVERT);

        assertEquals(StageOutcome.FAILED_RETRYABLE, r.getOutcome());
        assertEquals(3, r.getAttempts());
        ObservationGroup failed = group(id);
        assertEquals(GroupState.FAILED, failed.getState());
        assertEquals(GroupState.CONVERTING, failed.getFailedStage());
        assertTrue(failed.isRetryable());
        assertEquals(1, failed.getRetryCount());
        assertTrue(failed.getErrorMessage().contains("CONVERT_TIMEOUT"));

        List<StageResult> resumed = f.orchestrator.retryFailed(id);

        assertEquals(PipelineStage.CONVERT, resumed.get(0).getStage());
        assertEquals(GroupState.COMPLETED, group(id).getState());
        assertEquals(1, group(id).getRetryCount());
        assertEquals(4, f.stubs.convertCalls.get());
    }

    @Test
    @DisplayName("Should fail fatally without retrying and wait for an operator")
    void testRunStage_FatalNeedsRequeue() {
        f = SkyFlowFixture.create();
        String id = readyGroup();
        f.stubs.failImage(Result.fatal("IMAGE_EXIT_1", "corrupt visibilities"));

        List<StageResult> results = f.orchestrator.runToCompletion(id);

        StageResult image = results.get(results.size() - 1);
        assertEquals(PipelineStage.IMAGE, image.getStage());
        assertEquals(StageOutcome.FAILED_FATAL, image.getOutcome());
        assertEquals(1, image.getAttempts());
        assertFalse(group(id).isRetryable());
        assertTrue(f.orchestrator.retryFailed(id).isEmpty());

        StageResult convertAgain = f.orchestrator.runStage(id, PipelineStage.CONVERT);
        assertEquals(StageOutcome.ALREADY_DONE, convertAgain.getOutcome());
        assertEquals(StageOutcome.NOT_READY, f.orchestrator.runStage(id, PipelineStage.IMAGE).getOutcome());

        f.stateMachine.requeue(id, "visibilities repaired");
        f.orchestrator.runToCompletion(id);

        assertEquals(GroupState.COMPLETED, group(id).getState());
        assertEquals(1, f.stubs.convertCalls.get());
        assertEquals(2, f.stubs.imageCalls.get());
    }

    @Test
    @DisplayName("Should fail with a validation error when imaging has no converted output")
    void testRunStage_MissingInput() {
        f = SkyFlowFixture.create();
        String id = readyGroup();
        f.orchestrator.runStage(id, PipelineStage.CONVERT);
        f.orchestrator.runStage(id, PipelineStage.CALIBRATE);
        ObservationGroup imaging = group(id);
        imaging.setOutputPath(null);
        f.groups.compareAndUpdate(imaging);

        StageResult r = f.orchestrator.runStage(id, PipelineStage.IMAGE);

        assertEquals(StageOutcome.FAILED_FATAL, r.getOutcome());
        assertEquals("MISSING_INPUT", r.getFailure().getCode());
        assertEquals(0, f.stubs.imageCalls.get());
    }

    private static SkyFlowProperties.Calibrator calibrator(double transitMjd) {
        SkyFlowProperties.Calibrator c = new SkyFlowProperties.Calibrator();
        c.setName("3C286");
        c.setReferenceTransitMjd(transitMjd);
        c.setReferenceField("field0");
        c.setReferenceAntenna("ant103");
        return c;
    }
}
