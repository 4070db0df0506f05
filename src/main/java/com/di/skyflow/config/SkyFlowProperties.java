package com.di.skyflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Single binding for all scheduler configuration.
 *
 * <pre>
 * skyflow:
 *   ingest:
 *     incoming-dir: /data/incoming
 *     expected-subbands: 16
 *     chunk-seconds: 300
 *     tolerance-seconds: 150
 *   state:
 *     max-retries: 3
 *   calibration:
 *     validity-hours: 12
 *     calibrators:
 *       - name: 3C286
 *         reference-transit-mjd: 60310.5417
 *   mosaic:
 *     ms-per-mosaic: 10
 *     overlap: 2
 *   retry:
 *     max-attempts: 3
 *     base-delay: 1s
 *   lock:
 *     timeout: 30s
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "skyflow")
public class SkyFlowProperties {

    private Ingest ingest = new Ingest();
    private State state = new State();
    private Calibration calibration = new Calibration();
    private Mosaic mosaic = new Mosaic();
    private Retry retry = new Retry();
    private Lock lock = new Lock();
    private Worker worker = new Worker();
    private Tools tools = new Tools();

    // ------------------------------------------------------------------ //
    // Group formation                                                     //
    // ------------------------------------------------------------------ //

    @Data
    public static class Ingest {
        /** Landing directory written by the correlator. */
        private String incomingDir = "/data/incoming";
        private boolean scanEnabled = false;
        private Duration scanInterval = Duration.ofSeconds(30);
        /** Number of subbands that make a complete observation. */
        private int expectedSubbands = 16;
        /** Width of one observation chunk. */
        private long chunkSeconds = 300;
        /** Half-width of the snapping window around a chunk boundary. Negative = half the chunk. */
        private long toleranceSeconds = -1;
        /** Offset of the chunk grid from UTC midnight. */
        private long gridOffsetSeconds = 0;

        public long effectiveToleranceSeconds() {
            return toleranceSeconds < 0 ? chunkSeconds / 2 : toleranceSeconds;
        }
    }

    // ------------------------------------------------------------------ //
    // State machine                                                       //
    // ------------------------------------------------------------------ //

    @Data
    public static class State {
        private int maxRetries = 3;
        /** In-flight groups untouched for longer than this, with no live stage lease, are resumed by the worker. */
        private Duration staleAfter = Duration.ofHours(2);
    }

    // ------------------------------------------------------------------ //
    // Calibration                                                         //
    // ------------------------------------------------------------------ //

    @Data
    public static class Calibration {
        /** Maximum distance from a set's reference time for interpolation. */
        private double validityHours = 12.0;
        /** Half window for bidirectional lookups. */
        private double lookupHalfWindowHours = 12.0;
        /** Half width of the validity window registered around a calibrator transit. */
        private double transitHalfWidthHours = 12.0;
        /** Bracketing sets closer together than this are not interpolated; the nearer one is used. */
        private double minInterpolationGapHours = 1.0;
        /** Interpolating across a wider gap than this is logged and reported as a warning. */
        private double interpolationGapWarningHours = 24.0;
        private boolean cacheEnabled = true;
        private Duration cacheTtl = Duration.ofMinutes(2);
        private long cacheMaxSize = 1000;
        private List<Calibrator> calibrators = new ArrayList<>();
    }

    @Data
    public static class Calibrator {
        private String name;
        /** Any known transit of the source, in MJD. */
        private double referenceTransitMjd;
        /** Sidereal day by default. */
        private double transitPeriodDays = 0.99726957;
        /** An observation within this distance of a transit is a calibrator observation. */
        private double matchHalfWidthMinutes = 2.5;
        private String referenceField;
        private String referenceAntenna;
    }

    // ------------------------------------------------------------------ //
    // Mosaicking                                                          //
    // ------------------------------------------------------------------ //

    @Data
    public static class Mosaic {
        private int msPerMosaic = 10;
        private int overlap = 2;
    }

    // ------------------------------------------------------------------ //
    // Coordination                                                        //
    // ------------------------------------------------------------------ //

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(60);
    }

    @Data
    public static class Lock {
        private Duration timeout = Duration.ofSeconds(30);
        /**
         * Lease length, renewed before each stage attempt. Must exceed tools.timeout plus
         * retry.max-delay; a crashed holder's lock is free after this.
         */
        private Duration lease = Duration.ofHours(6);
        private Duration pollInterval = Duration.ofMillis(250);
    }

    @Data
    public static class Worker {
        private boolean enabled = true;
        private int threads = 4;
        private Duration pollInterval = Duration.ofSeconds(10);
        private Duration retrySweepInterval = Duration.ofMinutes(5);
        private String nodeName = "skyflow-local";
    }

    // ------------------------------------------------------------------ //
    // External tools                                                      //
    // ------------------------------------------------------------------ //

    @Data
    public static class Tools {
        private String outputDir = "/data/products";
        private Duration timeout = Duration.ofHours(4);
        /** Exit codes meaning "try again later" (75 = EX_TEMPFAIL). */
        private List<Integer> transientExitCodes = new ArrayList<>(List.of(75));
        private String convertCommand = "";
        private String solveCommand = "";
        private String applyCommand = "";
        private String imageCommand = "";
        private String mosaicCommand = "";
    }
}
