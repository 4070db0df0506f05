package com.di.skyflow.calibration;

import com.di.skyflow.config.SkyFlowProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether an observation time falls on a configured calibrator transit. Transits
 * repeat every {@code transitPeriodDays} (one sidereal day by default) from a known
 * reference transit.
 */
@Component
@Slf4j
public class CalibratorSchedule {

    private final List<SkyFlowProperties.Calibrator> calibrators;

    public CalibratorSchedule(SkyFlowProperties props) {
        this.calibrators = new ArrayList<>(props.getCalibration().getCalibrators());
        for (SkyFlowProperties.Calibrator c : calibrators) {
            if (c.getName() == null || c.getName().isBlank() || c.getTransitPeriodDays() <= 0) {
                throw new IllegalArgumentException("Invalid calibrator configuration: " + c);
            }
        }
        log.info("[CAL-SCHEDULE] {} calibrator(s) configured", calibrators.size());
    }

    /**
     * The calibrator whose nearest transit lies within its match window of {@code mjd};
     * if several match, the closest transit wins.
     */
    public Optional<CalibratorTransit> match(double mjd) {
        CalibratorTransit best = null;
        double bestDistance = Double.MAX_VALUE;
        for (SkyFlowProperties.Calibrator c : calibrators) {
            double transit = nearestTransit(c, mjd);
            double distance = Math.abs(transit - mjd);
            double window = c.getMatchHalfWidthMinutes() / (24.0 * 60.0);
            if (distance <= window && distance < bestDistance) {
                best = new CalibratorTransit(c.getName(), transit, c.getReferenceField(), c.getReferenceAntenna());
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
    }

    static double nearestTransit(SkyFlowProperties.Calibrator c, double mjd) {
        double period = c.getTransitPeriodDays();
        double cycles = Math.rint((mjd - c.getReferenceTransitMjd()) / period);
        return c.getReferenceTransitMjd() + cycles * period;
    }
}
