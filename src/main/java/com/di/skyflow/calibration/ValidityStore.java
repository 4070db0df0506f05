package com.di.skyflow.calibration;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent store of calibration sets keyed by name and indexed by validity window.
 * Implementations must make each write atomic: a set and its tables appear together or not
 * at all.
 */
public interface ValidityStore {

    /**
     * @return {@code false} if a set with the same name already exists; nothing is written
     */
    boolean insert(CalibrationSet set);

    Optional<CalibrationSet> findByName(String setName);

    /** Active sets whose window contains {@code t}. */
    List<CalibrationSet> findActiveCovering(double t);

    /** Active sets whose window intersects {@code [start, end)}. */
    List<CalibrationSet> findActiveOverlapping(double start, double end);

    /** Active sets whose window midpoint lies in {@code [from, to]}. */
    List<CalibrationSet> findActiveWithMidpointBetween(double from, double to);

    /**
     * Marks the set retired and appends the reason to its notes.
     *
     * @return {@code true} if the set was active before the call
     */
    boolean retire(String setName, String reason, Instant retiredAt);

    List<CalibrationSet> findAll();
}
