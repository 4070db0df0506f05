package com.di.skyflow.mosaic;

import com.di.skyflow.collaborator.MosaicBuilder;
import com.di.skyflow.common.Result;
import com.di.skyflow.config.SkyFlowProperties;
import com.di.skyflow.coordination.ConcurrencyCoordinator;
import com.di.skyflow.coordination.RetryResult;
import com.di.skyflow.group.ObservationGroup;
import com.di.skyflow.group.ObservationGroupRepository;
import com.di.skyflow.util.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Maintains the tile pool, forms sliding mosaic windows and builds them.
 *
 * <pre>
 * enrollTile     imaged group → mosaic_tiles
 * planWindows    under "mosaic:planner": form every window the pool allows
 *                (reused overlap tiles get their calibration invalidated)
 * buildPending   PENDING → BUILDING → COMPLETED | FAILED
 * </pre>
 *
 * <p>A failed build is recorded on the mosaic; the observation groups stay COMPLETED.
 */
@Service
@Slf4j
public class MosaicService {

    static final String PLANNER_LOCK = "mosaic:planner";

    private final MosaicRepository mosaics;
    private final ObservationGroupRepository groups;
    private final ConcurrencyCoordinator coordinator;
    private final MosaicBuilder builder;
    private final TransactionTemplate tx;
    private final MetricsCollector metrics;
    private final Clock clock;
    private final MosaicWindowPlanner planner;

    public MosaicService(MosaicRepository mosaics,
                         ObservationGroupRepository groups,
                         ConcurrencyCoordinator coordinator,
                         MosaicBuilder builder,
                         TransactionTemplate tx,
                         MetricsCollector metrics,
                         Clock clock,
                         SkyFlowProperties props) {
        this.mosaics = mosaics;
        this.groups = groups;
        this.coordinator = coordinator;
        this.builder = builder;
        this.tx = tx;
        this.metrics = metrics;
        this.clock = clock;
        this.planner = new MosaicWindowPlanner(props.getMosaic().getMsPerMosaic(), props.getMosaic().getOverlap());
    }

    /* ==================================================================== */
    /* Tile pool                                                             */
    /* ==================================================================== */

    /**
     * Adds the group's image to the pool. Enrolling the same group again is a no-op.
     */
    public Result<Boolean> enrollTile(ObservationGroup group) {
        if (group.getImagePath() == null) {
            return Result.validation("NO_IMAGE", "group " + group.getGroupId() + " has no image to enroll");
        }
        boolean added = mosaics.insertTile(
                new MosaicTile(group.getGroupId(), group.getImagePath(), group.getObservedMjd()), clock.instant());
        if (added) {
            log.info("[MOSAIC] enrolled tile {} (mjd={})", group.getGroupId(), group.getObservedMjd());
        }
        return Result.success(added);
    }

    /* ==================================================================== */
    /* Planning                                                              */
    /* ==================================================================== */

    /**
     * Forms as many windows as the current pool allows.
     */
    public Result<List<MosaicGroup>> planWindows() {
        return coordinator.callWithLock(PLANNER_LOCK, () -> {
            List<MosaicGroup> formed = new ArrayList<>();
            Optional<MosaicGroup> next = planNextWindow();
            while (next.isPresent()) {
                formed.add(next.get());
                next = planNextWindow();
            }
            return Result.success(formed);
        });
    }

    /**
     * Forms the next window, if any. Callers must hold {@value #PLANNER_LOCK}.
     */
    Optional<MosaicGroup> planNextWindow() {
        List<MosaicTile> previous = mosaics.findLatestLive()
                .map(m -> mosaics.findTiles(m.getMemberGroupIds()))
                .orElse(List.of());
        Optional<MosaicWindow> window = planner.nextWindow(mosaics.findUnconsumedTiles(), previous);
        if (window.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(persistWindow(window.get()));
    }

    private MosaicGroup persistWindow(MosaicWindow window) {
        List<String> paths = new ArrayList<>();
        List<String> ids = new ArrayList<>();
        for (MosaicTile t : window.members()) {
            paths.add(t.imagePath());
            ids.add(t.groupId());
        }

        Optional<MosaicGroup> existing = mosaics.findOpenWithMembers(paths);
        if (existing.isPresent()) {
            log.info("[MOSAIC] window already planned as {}", existing.get().getMosaicId());
            mosaics.markConsumed(ids, existing.get().getMosaicId());
            return existing.get();
        }

        Instant now = clock.instant();
        MosaicGroup mosaic = MosaicGroup.builder()
                .mosaicId(mosaicId(paths, now))
                .members(paths)
                .memberGroupIds(ids)
                .overlapCount(window.reused().size())
                .windowEndMjd(window.members().get(window.members().size() - 1).observedMjd())
                .status(MosaicStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();

        List<String> reusedIds = new ArrayList<>();
        for (MosaicTile t : window.reused()) {
            reusedIds.add(t.groupId());
        }
        tx.executeWithoutResult(status -> {
            mosaics.insert(mosaic);
            mosaics.markConsumed(ids, mosaic.getMosaicId());
            groups.invalidateCalibration(reusedIds, now);
        });
        metrics.recordMosaicPlanned();
        log.info("[MOSAIC] planned {} with {} tiles ({} reused: {})",
                mosaic.getMosaicId(), paths.size(), reusedIds.size(), reusedIds);
        return mosaic;
    }

    /* ==================================================================== */
    /* Building                                                              */
    /* ==================================================================== */

    public List<Result<MosaicGroup>> buildPending() {
        List<Result<MosaicGroup>> results = new ArrayList<>();
        for (MosaicGroup m : mosaics.findByStatus(MosaicStatus.PENDING)) {
            results.add(build(m.getMosaicId()));
        }
        return results;
    }

    /**
     * Builds one pending mosaic. Members are handed to the builder in observation order.
     */
    public Result<MosaicGroup> build(String mosaicId) {
        Optional<MosaicGroup> found = mosaics.findById(mosaicId);
        if (found.isEmpty()) {
            return Result.validation("UNKNOWN_MOSAIC", "no mosaic " + mosaicId);
        }
        MosaicGroup mosaic = found.get();
        if (mosaic.getStatus() == MosaicStatus.COMPLETED) {
            return Result.success(mosaic);
        }
        if (!mosaics.compareAndSetStatus(mosaicId, MosaicStatus.PENDING, MosaicStatus.BUILDING, null, null, clock.instant())) {
            return Result.transientFailure("MOSAIC_BUSY", "mosaic " + mosaicId + " is not pending (" + mosaic.getStatus() + ")");
        }

        List<MosaicTile> tiles = new ArrayList<>(mosaics.findTiles(mosaic.getMemberGroupIds()));
        tiles.sort(MosaicTile.CHRONOLOGICAL);
        List<String> ordered = new ArrayList<>();
        for (MosaicTile t : tiles) {
            ordered.add(t.imagePath());
        }

        RetryResult<String> outcome = coordinator.retry(() -> builder.buildMosaic(mosaicId, ordered));
        Instant now = clock.instant();
        if (outcome.isSuccess()) {
            String path = outcome.result().getData();
            mosaics.compareAndSetStatus(mosaicId, MosaicStatus.BUILDING, MosaicStatus.COMPLETED, path, null, now);
            log.info("[MOSAIC] built {} -> {}", mosaicId, path);
        } else {
            String error = outcome.result().getFailure().describe();
            mosaics.compareAndSetStatus(mosaicId, MosaicStatus.BUILDING, MosaicStatus.FAILED, null, error, now);
            log.error("[MOSAIC] build of {} failed after {} attempt(s): {}", mosaicId, outcome.attempts(), error);
        }
        MosaicGroup updated = mosaics.findById(mosaicId).orElse(mosaic);
        return outcome.isSuccess() ? Result.success(updated) : Result.failure(outcome.result().getFailure());
    }

    /**
     * Operator action: puts a failed mosaic back to PENDING.
     */
    public boolean requeueFailed(String mosaicId) {
        return mosaics.compareAndSetStatus(mosaicId, MosaicStatus.FAILED, MosaicStatus.PENDING, null, null, clock.instant());
    }

    public Optional<MosaicGroup> findById(String mosaicId) {
        return mosaics.findById(mosaicId);
    }

    static String mosaicId(List<String> paths, Instant now) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            byte[] digest = sha.digest(String.join("|", paths).getBytes(StandardCharsets.UTF_8));
            long micros = ChronoUnit.MICROS.between(Instant.EPOCH, now);
            return "mosaic_" + HexFormat.of().formatHex(digest).substring(0, 12) + "_" + micros;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
