package com.di.skyflow.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for ingestion, stage execution, calibration lookups, locking and mosaicking.
 */
@Slf4j
@Component
public class MetricsCollector {

    private final MeterRegistry meterRegistry;

    // Ingestion
    private final Counter arrivalsAccepted;
    private final Counter arrivalsDuplicate;
    private final Counter arrivalsRejected;
    private final Counter groupsCompleted;

    // Calibration
    private final Counter calibrationSetsRegistered;
    private final Counter uncalibratedGroups;

    // Coordination
    private final Counter lockTimeouts;
    private final Counter retryAttempts;

    // Mosaics
    private final Counter mosaicsPlanned;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.arrivalsAccepted = Counter.builder("skyflow.ingest.arrivals")
                .description("Subband files accepted into a group")
                .tag("outcome", "accepted")
                .register(meterRegistry);

        this.arrivalsDuplicate = Counter.builder("skyflow.ingest.arrivals")
                .description("Subband files ignored as re-ingested duplicates")
                .tag("outcome", "duplicate")
                .register(meterRegistry);

        this.arrivalsRejected = Counter.builder("skyflow.ingest.arrivals")
                .description("Subband files rejected (conflicting member or invalid index)")
                .tag("outcome", "rejected")
                .register(meterRegistry);

        this.groupsCompleted = Counter.builder("skyflow.groups.completed")
                .description("Observation groups that reached Completed")
                .register(meterRegistry);

        this.calibrationSetsRegistered = Counter.builder("skyflow.calibration.registered")
                .description("Calibration sets registered")
                .register(meterRegistry);

        this.uncalibratedGroups = Counter.builder("skyflow.calibration.uncalibrated")
                .description("Science groups imaged without calibration")
                .register(meterRegistry);

        this.lockTimeouts = Counter.builder("skyflow.lock.timeouts")
                .description("Lock acquisitions that timed out")
                .register(meterRegistry);

        this.retryAttempts = Counter.builder("skyflow.retry.attempts")
                .description("Retries performed after transient failures")
                .register(meterRegistry);

        this.mosaicsPlanned = Counter.builder("skyflow.mosaic.planned")
                .description("Mosaic groups formed")
                .register(meterRegistry);
    }

    public void recordArrivalAccepted() {
        arrivalsAccepted.increment();
    }

    public void recordArrivalDuplicate() {
        arrivalsDuplicate.increment();
    }

    public void recordArrivalRejected() {
        arrivalsRejected.increment();
    }

    public void recordGroupCompleted() {
        groupsCompleted.increment();
    }

    public void recordCalibrationRegistered() {
        calibrationSetsRegistered.increment();
    }

    public void recordUncalibrated() {
        uncalibratedGroups.increment();
    }

    public void recordLockTimeout() {
        lockTimeouts.increment();
    }

    public void recordRetry() {
        retryAttempts.increment();
    }

    public void recordMosaicPlanned() {
        mosaicsPlanned.increment();
    }

    /**
     * Records one stage execution, tagged by stage name and outcome.
     */
    public void recordStage(String stage, String outcome, Duration duration) {
        Timer.builder("skyflow.stage.duration")
                .description("Stage execution time")
                .tag("stage", stage)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .record(duration);
        log.debug("[METRICS] stage={} outcome={} durationMs={}", stage, outcome, duration.toMillis());
    }
}
