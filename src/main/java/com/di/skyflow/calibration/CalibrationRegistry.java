package com.di.skyflow.calibration;

import com.di.skyflow.common.Result;
import com.di.skyflow.config.SkyFlowProperties;
import com.di.skyflow.error.FailureCategory;
import com.di.skyflow.util.MetricsCollector;
import com.di.skyflow.util.TimeBase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Registers calibration sets and answers "which tables apply at time t".
 *
 * <pre>
 * register      validate window → warn on conflicting overlaps → insert → verify discoverable
 * lookupActive  active sets covering t, latest valid_start wins
 * interpolate   nearest set on each side of t (by midpoint) within the validity range,
 *               linearly weighted by distance; near pairs collapse to the nearer set
 * </pre>
 *
 * <p>Nothing here computes astronomy; transit times come from the caller.
 */
@Service
@Slf4j
public class CalibrationRegistry {

    private final ValidityStore store;
    private final MetricsCollector metrics;
    private final Clock clock;
    private final SkyFlowProperties.Calibration cfg;

    public CalibrationRegistry(ValidityStore store, MetricsCollector metrics, Clock clock, SkyFlowProperties props) {
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
        this.cfg = props.getCalibration();
    }

    /* ==================================================================== */
    /* Writes                                                                */
    /* ==================================================================== */

    /**
     * Registers a new active set. The store is left unchanged on any validation failure;
     * a set that cannot be found again after insert is retired before the failure is returned.
     */
    public Result<CalibrationSet> register(RegistrationRequest req) {
        ValidityWindow window = req.window();
        if (!window.isValid()) {
            log.warn("[CAL-REGISTRY] rejected {}: invalid window [{}, {}]",
                    req.getSetName(), req.getValidStart(), req.getValidEnd());
            return Result.validation(RegistryErrorCode.INVALID_WINDOW,
                    "valid_start must be before valid_end, got [" + req.getValidStart() + ", " + req.getValidEnd() + "]");
        }
        if (req.getSetName() == null || req.getSetName().isBlank()) {
            return Result.validation(RegistryErrorCode.INVALID_NAME, "set name is required");
        }
        if (req.getTables().isEmpty()) {
            return Result.validation(RegistryErrorCode.EMPTY_SET, "set " + req.getSetName() + " has no tables");
        }

        CalibrationSet set = CalibrationSet.builder()
                .setName(req.getSetName())
                .validStart(req.getValidStart())
                .validEnd(req.getValidEnd())
                .status(CalibrationStatus.ACTIVE)
                .referenceField(req.getReferenceField())
                .referenceAntenna(req.getReferenceAntenna())
                .sourceObservation(req.getSourceObservation())
                .createdAt(clock.instant())
                .notes(req.getNotes())
                .qualityMetrics(new LinkedHashMap<>(req.getQualityMetrics()))
                .tables(inApplyOrder(req.getTables()))
                .build();

        try {
            warnOnConflictingOverlaps(set);
            if (!store.insert(set)) {
                return Result.validation(RegistryErrorCode.DUPLICATE_SET_NAME,
                        "calibration set " + set.getSetName() + " already exists");
            }
            if (!isDiscoverable(set)) {
                store.retire(set.getSetName(), "discoverability check failed after registration", clock.instant());
                log.error("[CAL-REGISTRY] set {} not discoverable at midpoint {}; retired",
                        set.getSetName(), set.midpoint());
                return Result.fatal(RegistryErrorCode.DISCOVERABILITY_FAILED,
                        "set " + set.getSetName() + " was written but cannot be looked up");
            }
        } catch (DataAccessException e) {
            return Result.failure(FailureCategory.toFailure("REGISTRY", e));
        }

        metrics.recordCalibrationRegistered();
        log.info("[CAL-REGISTRY] registered {} window=[{}, {}] tables={}",
                set.getSetName(), set.getValidStart(), set.getValidEnd(), set.getTables().size());
        return Result.success(store.findByName(set.getSetName()).orElse(set));
    }

    /**
     * Retires a set. One-way; retiring twice is a no-op.
     */
    public Result<Boolean> retire(String setName, String reason) {
        try {
            if (store.findByName(setName).isEmpty()) {
                return Result.validation(RegistryErrorCode.UNKNOWN_SET, "no calibration set named " + setName);
            }
            boolean changed = store.retire(setName, reason, clock.instant());
            if (changed) {
                log.info("[CAL-REGISTRY] retired {}: {}", setName, reason);
            }
            return Result.success(changed);
        } catch (DataAccessException e) {
            return Result.failure(FailureCategory.toFailure("REGISTRY", e));
        }
    }

    /* ==================================================================== */
    /* Lookups                                                               */
    /* ==================================================================== */

    /**
     * The active set covering {@code t}. Overlaps resolve to the latest {@code valid_start},
     * then the latest creation time, then the set name.
     */
    public Optional<CalibrationSet> lookupActive(double t) {
        List<CalibrationSet> covering = new ArrayList<>(store.findActiveCovering(t));
        if (covering.isEmpty()) {
            return Optional.empty();
        }
        covering.sort(CalibrationSet.NEWEST_FIRST);
        CalibrationSet chosen = covering.get(0);
        for (CalibrationSet other : covering.subList(1, covering.size())) {
            if (chosen.conflictsWith(other)) {
                log.warn("[CAL-REGISTRY] overlapping sets at {} disagree: {} (refant={}, field={}) vs {} (refant={}, field={}); using {}",
                        t, chosen.getSetName(), chosen.getReferenceAntenna(), chosen.getReferenceField(),
                        other.getSetName(), other.getReferenceAntenna(), other.getReferenceField(),
                        chosen.getSetName());
            }
        }
        return Optional.of(chosen);
    }

    /** Ordered table paths of {@link #lookupActive(double)}; empty when nothing covers t. */
    public List<String> applyList(double t) {
        return lookupActive(t).map(CalibrationSet::orderedTablePaths).orElse(List.of());
    }

    /**
     * Nearest active set with midpoint at or before {@code t} and nearest with midpoint after
     * it, both within {@code maxHalfWindowHours}.
     */
    public BidirectionalLookup lookupBidirectional(double t, double maxHalfWindowHours) {
        double half = TimeBase.hoursToDays(maxHalfWindowHours);
        List<CalibrationSet> nearby = store.findActiveWithMidpointBetween(t - half, t + half);

        CalibrationSet before = null;
        CalibrationSet after = null;
        Comparator<CalibrationSet> byDistance = Comparator
                .comparingDouble((CalibrationSet s) -> Math.abs(s.midpoint() - t))
                .thenComparing(CalibrationSet.NEWEST_FIRST);
        for (CalibrationSet s : nearby) {
            if (s.midpoint() <= t) {
                if (before == null || byDistance.compare(s, before) < 0) {
                    before = s;
                }
            } else if (after == null || byDistance.compare(s, after) < 0) {
                after = s;
            }
        }
        return new BidirectionalLookup(Optional.ofNullable(before), Optional.ofNullable(after));
    }

    public BidirectionalLookup lookupBidirectional(double t) {
        return lookupBidirectional(t, cfg.getLookupHalfWindowHours());
    }

    /**
     * Linear interpolation between the nearest sets on either side of {@code t}:
     * {@code weight_before = (t_after - t) / (t_after - t_before)}.
     * <ul>
     *   <li>one side in range: that set alone with weight 1 ({@link SelectionMethod#EXTRAPOLATED})</li>
     *   <li>both sides closer together than {@code min-interpolation-gap-hours}: the nearer set
     *       alone ({@link SelectionMethod#SINGLE})</li>
     *   <li>a gap wider than {@code interpolation-gap-warning-hours} is still interpolated but
     *       carries a warning</li>
     * </ul>
     */
    public InterpolationResult interpolate(double t, double validityHours) {
        BidirectionalLookup around = lookupBidirectional(t, validityHours);
        if (around.isEmpty()) {
            return InterpolationResult.empty();
        }
        if (around.after().isEmpty()) {
            CalibrationSet only = around.before().get();
            double offset = offsetHours(only, t);
            return new InterpolationResult(only, null, 1.0, 0.0, SelectionMethod.EXTRAPOLATED,
                    offset, qualityScore(offset, validityHours), List.of());
        }
        if (around.before().isEmpty()) {
            CalibrationSet only = around.after().get();
            double offset = offsetHours(only, t);
            return new InterpolationResult(null, only, 0.0, 1.0, SelectionMethod.EXTRAPOLATED,
                    offset, qualityScore(offset, validityHours), List.of());
        }

        CalibrationSet before = around.before().get();
        CalibrationSet after = around.after().get();
        double gapHours = TimeBase.daysToHours(after.midpoint() - before.midpoint());
        if (gapHours < cfg.getMinInterpolationGapHours()) {
            boolean beforeNearer = offsetHours(before, t) <= offsetHours(after, t);
            CalibrationSet nearest = beforeNearer ? before : after;
            double offset = offsetHours(nearest, t);
            log.debug("[CAL-REGISTRY] {} and {} are {} h apart; using {} alone",
                    before.getSetName(), after.getSetName(), gapHours, nearest.getSetName());
            return new InterpolationResult(beforeNearer ? nearest : null, beforeNearer ? null : nearest,
                    beforeNearer ? 1.0 : 0.0, beforeNearer ? 0.0 : 1.0, SelectionMethod.SINGLE,
                    offset, qualityScore(offset, validityHours), List.of());
        }

        double span = after.midpoint() - before.midpoint();
        double weightBefore = (after.midpoint() - t) / span;
        weightBefore = Math.max(0.0, Math.min(1.0, weightBefore));
        List<String> warnings = new ArrayList<>();
        if (gapHours > cfg.getInterpolationGapWarningHours()) {
            warnings.add(String.format(Locale.ROOT, "Large calibration gap of %.1f h between %s and %s",
                    gapHours, before.getSetName(), after.getSetName()));
        }
        if (before.conflictsWith(after)) {
            warnings.add("Interpolating between " + before.getSetName() + " and " + after.getSetName()
                    + " with different reference antenna/field");
        }
        for (String warning : warnings) {
            log.warn("[CAL-REGISTRY] mjd {}: {}", t, warning);
        }
        double offset = Math.min(offsetHours(before, t), offsetHours(after, t));
        return new InterpolationResult(before, after, weightBefore, 1.0 - weightBefore, SelectionMethod.INTERPOLATED,
                offset, qualityScore(offset, validityHours), warnings);
    }

    public InterpolationResult interpolate(double t) {
        return interpolate(t, cfg.getValidityHours());
    }

    /** Validity window of {@code ±halfWidthHours} around a transit. */
    public ValidityWindow transitWindow(double transitMjd, double halfWidthHours) {
        return ValidityWindow.centeredOn(transitMjd, halfWidthHours);
    }

    public ValidityWindow transitWindow(double transitMjd) {
        return transitWindow(transitMjd, cfg.getTransitHalfWidthHours());
    }

    /** Active sets whose window intersects the given one. */
    public List<CalibrationSet> findOverlapping(ValidityWindow window) {
        return store.findActiveOverlapping(window.start(), window.end());
    }

    public Optional<CalibrationSet> findByName(String setName) {
        return store.findByName(setName);
    }

    public List<CalibrationSet> listAll() {
        return store.findAll();
    }

    /* ==================================================================== */
    /* Internals                                                             */
    /* ==================================================================== */

    private void warnOnConflictingOverlaps(CalibrationSet candidate) {
        for (CalibrationSet existing : store.findActiveOverlapping(candidate.getValidStart(), candidate.getValidEnd())) {
            if (candidate.conflictsWith(existing)) {
                log.warn("[CAL-REGISTRY] {} overlaps {} with different reference: refant {} vs {}, field {} vs {}",
                        candidate.getSetName(), existing.getSetName(),
                        candidate.getReferenceAntenna(), existing.getReferenceAntenna(),
                        candidate.getReferenceField(), existing.getReferenceField());
            } else {
                log.info("[CAL-REGISTRY] {} overlaps {}", candidate.getSetName(), existing.getSetName());
            }
        }
    }

    private boolean isDiscoverable(CalibrationSet set) {
        Optional<CalibrationSet> stored = store.findByName(set.getSetName());
        if (stored.isEmpty() || stored.get().getTables().size() != set.getTables().size()) {
            return false;
        }
        return store.findActiveCovering(set.midpoint()).stream()
                .filter(s -> s.getSetName().equals(set.getSetName()))
                .anyMatch(s -> s.orderedTablePaths().equals(set.orderedTablePaths()));
    }

    private static double offsetHours(CalibrationSet set, double t) {
        return TimeBase.daysToHours(Math.abs(set.midpoint() - t));
    }

    private static double qualityScore(double offsetHours, double validityHours) {
        if (validityHours <= 0) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, 1.0 - offsetHours / (2.0 * validityHours)));
    }

    /** Sorts by kind apply order (stable within a kind) and numbers the positions. */
    private static List<CalibrationTable> inApplyOrder(List<CalibrationTable> tables) {
        List<CalibrationTable> sorted = new ArrayList<>(tables);
        sorted.sort(Comparator.comparingInt(t -> t.getKind().getApplyOrder()));
        List<CalibrationTable> numbered = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            numbered.add(sorted.get(i).withOrderIndex(i));
        }
        return numbered;
    }
}
