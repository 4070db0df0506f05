package com.di.skyflow.calibration;

import com.di.skyflow.config.SkyFlowProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Cache in front of {@link JdbcValidityStore} for the hot read paths (by name, covering a
 * time). Every write through this store clears both caches; writes made by other processes
 * become visible once entries expire.
 * Disable with {@code skyflow.calibration.cache-enabled=false}.
 */
@Service
@Primary
@ConditionalOnProperty(name = "skyflow.calibration.cache-enabled", havingValue = "true", matchIfMissing = true)
public class CachingValidityStore implements ValidityStore {

    private final ValidityStore delegate;
    private final Cache<String, Optional<CalibrationSet>> byName;
    private final Cache<Double, List<CalibrationSet>> coveringByTime;

    @Autowired
    public CachingValidityStore(JdbcValidityStore delegate, SkyFlowProperties props) {
        this((ValidityStore) delegate, props.getCalibration());
    }

    CachingValidityStore(ValidityStore delegate, SkyFlowProperties.Calibration cfg) {
        this.delegate = delegate;
        this.byName = Caffeine.newBuilder()
                .maximumSize(cfg.getCacheMaxSize())
                .expireAfterWrite(cfg.getCacheTtl())
                .build();
        this.coveringByTime = Caffeine.newBuilder()
                .maximumSize(cfg.getCacheMaxSize())
                .expireAfterWrite(cfg.getCacheTtl())
                .build();
    }

    @Override
    public boolean insert(CalibrationSet set) {
        try {
            return delegate.insert(set);
        } finally {
            invalidateAll();
        }
    }

    @Override
    public boolean retire(String setName, String reason, Instant retiredAt) {
        try {
            return delegate.retire(setName, reason, retiredAt);
        } finally {
            invalidateAll();
        }
    }

    @Override
    public Optional<CalibrationSet> findByName(String setName) {
        if (setName == null || setName.isBlank()) {
            return Optional.empty();
        }
        return byName.get(setName, delegate::findByName);
    }

    @Override
    public List<CalibrationSet> findActiveCovering(double t) {
        return coveringByTime.get(t, delegate::findActiveCovering);
    }

    @Override
    public List<CalibrationSet> findActiveOverlapping(double start, double end) {
        return delegate.findActiveOverlapping(start, end);
    }

    @Override
    public List<CalibrationSet> findActiveWithMidpointBetween(double from, double to) {
        return delegate.findActiveWithMidpointBetween(from, to);
    }

    @Override
    public List<CalibrationSet> findAll() {
        return delegate.findAll();
    }

    public void invalidateAll() {
        byName.invalidateAll();
        coveringByTime.invalidateAll();
    }
}
