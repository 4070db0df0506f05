package com.di.skyflow.orchestration;

import com.di.skyflow.calibration.CalibrationRegistry;
import com.di.skyflow.calibration.CalibrationSet;
import com.di.skyflow.calibration.CalibrationTable;
import com.di.skyflow.calibration.CalibratorSchedule;
import com.di.skyflow.calibration.CalibratorTransit;
import com.di.skyflow.calibration.InterpolationResult;
import com.di.skyflow.calibration.RegistrationRequest;
import com.di.skyflow.calibration.RegistryErrorCode;
import com.di.skyflow.calibration.ValidityWindow;
import com.di.skyflow.collaborator.CalibrationApplier;
import com.di.skyflow.collaborator.CalibrationSolver;
import com.di.skyflow.collaborator.WeightedCalibration;
import com.di.skyflow.common.Result;
import com.di.skyflow.coordination.ConcurrencyCoordinator;
import com.di.skyflow.group.CalibrationState;
import com.di.skyflow.group.ObservationGroup;
import com.di.skyflow.util.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Calibration policy for one group.
 *
 * <pre>
 * calibrator group  solve (under calsolve:&lt;group&gt;) → register transit-centred set → apply it
 * science group     interpolate between neighbours → else nearest single set
 *                   → else the active set covering the observation
 *                   → else continue uncalibrated (degraded, flagged for reprocessing)
 * </pre>
 */
@Component
@Slf4j
public class CalibrationStep {

    private final CalibrationRegistry registry;
    private final CalibratorSchedule schedule;
    private final CalibrationSolver solver;
    private final CalibrationApplier applier;
    private final ConcurrencyCoordinator coordinator;
    private final MetricsCollector metrics;

    public CalibrationStep(CalibrationRegistry registry,
                           CalibratorSchedule schedule,
                           CalibrationSolver solver,
                           CalibrationApplier applier,
                           ConcurrencyCoordinator coordinator,
                           MetricsCollector metrics) {
        this.registry = registry;
        this.schedule = schedule;
        this.solver = solver;
        this.applier = applier;
        this.coordinator = coordinator;
        this.metrics = metrics;
    }

    public Result<CalibrationOutcome> calibrate(ObservationGroup group) {
        if (group.getOutputPath() == null) {
            return Result.validation("MISSING_INPUT", "group " + group.getGroupId() + " has no converted output");
        }
        Optional<CalibratorTransit> transit = schedule.match(group.getObservedMjd());
        if (transit.isPresent()) {
            return coordinator.callWithLock("calsolve:" + group.getGroupId(),
                    () -> solveAndRegister(group, transit.get()));
        }
        return applyExisting(group);
    }

    // ------------------------------------------------------------------
    // Calibrator observations
    // ------------------------------------------------------------------

    private Result<CalibrationOutcome> solveAndRegister(ObservationGroup group, CalibratorTransit transit) {
        String setName = "cal_" + transit.calibratorName() + "_" + group.getGroupId();

        Optional<CalibrationSet> existing = registry.findByName(setName);
        CalibrationSet set;
        if (existing.isPresent()) {
            if (!existing.get().isActive()) {
                return Result.fatal("CAL_SET_RETIRED", "calibration set " + setName + " was retired; requeue with a new solve");
            }
            log.info("[CALIBRATE] group={} reusing registered set {}", group.getGroupId(), setName);
            set = existing.get();
        } else {
            log.info("[CALIBRATE] group={} observes {} (transit mjd={}); solving",
                    group.getGroupId(), transit.calibratorName(), transit.transitMjd());
            Result<List<CalibrationTable>> solved = solver.solve(
                    group.getOutputPath(), transit.referenceField(), transit.referenceAntenna());
            if (solved.isFailure()) {
                return Result.failure(solved.getFailure());
            }
            ValidityWindow window = registry.transitWindow(transit.transitMjd());
            Result<CalibrationSet> registered = registry.register(RegistrationRequest.builder()
                    .setName(setName)
                    .tables(solved.getData())
                    .validStart(window.start())
                    .validEnd(window.end())
                    .referenceField(transit.referenceField())
                    .referenceAntenna(transit.referenceAntenna())
                    .sourceObservation(group.getOutputPath())
                    .notes("solved from " + group.getGroupId() + " (" + transit.calibratorName() + " transit)")
                    .build());
            if (registered.isFailure()) {
                if (RegistryErrorCode.DUPLICATE_SET_NAME.equals(registered.failureCode())) {
                    // registered by a concurrent solve of the same group
                    Optional<CalibrationSet> raced = registry.findByName(setName);
                    if (raced.isEmpty()) {
                        return Result.failure(registered.getFailure());
                    }
                    set = raced.get();
                } else {
                    return Result.failure(registered.getFailure());
                }
            } else {
                set = registered.getData();
            }
        }

        Result<Void> applied = applier.apply(group.getOutputPath(),
                List.of(new WeightedCalibration(set.getSetName(), set.orderedTablePaths(), 1.0)));
        if (applied.isFailure()) {
            return Result.failure(applied.getFailure());
        }
        return Result.success(new CalibrationOutcome(CalibrationState.SOLVED,
                List.of(set.getSetName()), List.of(1.0), transit));
    }

    // ------------------------------------------------------------------
    // Science observations
    // ------------------------------------------------------------------

    private Result<CalibrationOutcome> applyExisting(ObservationGroup group) {
        double t = group.getObservedMjd();
        InterpolationResult interpolation = registry.interpolate(t);

        List<WeightedCalibration> toApply = new ArrayList<>();
        CalibrationState state;
        if (interpolation.interpolated()) {
            toApply.add(weighted(interpolation.before(), interpolation.weightBefore()));
            toApply.add(weighted(interpolation.after(), interpolation.weightAfter()));
            state = CalibrationState.INTERPOLATED;
        } else if (!interpolation.isEmpty()) {
            toApply.add(weighted(interpolation.single(), 1.0));
            state = CalibrationState.APPLIED;
        } else {
            Optional<CalibrationSet> covering = registry.lookupActive(t);
            if (covering.isEmpty()) {
                metrics.recordUncalibrated();
                log.warn("[CALIBRATE] group={} has no calibration within range of mjd {}; continuing uncalibrated",
                        group.getGroupId(), t);
                return Result.success(CalibrationOutcome.uncalibrated());
            }
            toApply.add(weighted(covering.get(), 1.0));
            state = CalibrationState.APPLIED;
        }

        Result<Void> applied = applier.apply(group.getOutputPath(), toApply);
        if (applied.isFailure()) {
            return Result.failure(applied.getFailure());
        }
        List<String> names = new ArrayList<>();
        List<Double> weights = new ArrayList<>();
        for (WeightedCalibration c : toApply) {
            names.add(c.setName());
            weights.add(c.weight());
        }
        log.info("[CALIBRATE] group={} {} ({}, offset {} h, quality {}) with {} weights={}", group.getGroupId(), state,
                interpolation.method(), String.format(Locale.ROOT, "%.2f", interpolation.timeOffsetHours()),
                String.format(Locale.ROOT, "%.2f", interpolation.qualityScore()), names, weights);
        return Result.success(new CalibrationOutcome(state, names, weights, null));
    }

    private static WeightedCalibration weighted(CalibrationSet set, double weight) {
        return new WeightedCalibration(set.getSetName(), set.orderedTablePaths(), weight);
    }
}
