package com.di.skyflow.calibration;

import com.di.skyflow.config.SkyFlowProperties;
import com.di.skyflow.support.SkyFlowFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CalibratorSchedule Tests")
class CalibratorScheduleTest {

    private static final double REF = 60690.5;
    private static final double SIDEREAL = 0.99726957;
    private static final double MINUTE = 1.0 / 1440.0;

    private CalibratorSchedule schedule;

    @BeforeEach
    void setUp() {
        SkyFlowProperties props = SkyFlowFixture.testProperties();
        props.getCalibration().getCalibrators().add(calibrator("3C286", REF));
        props.getCalibration().getCalibrators().add(calibrator("3C48", REF + 0.25));
        schedule = new CalibratorSchedule(props);
    }

    private static SkyFlowProperties.Calibrator calibrator(String name, double transit) {
        SkyFlowProperties.Calibrator c = new SkyFlowProperties.Calibrator();
        c.setName(name);
        c.setReferenceTransitMjd(transit);
        c.setReferenceField("field0");
        c.setReferenceAntenna("ant103");
        return c;
    }

    @Test
    @DisplayName("Should match an observation near a later transit")
    void testMatch_LaterTransit() {
        double transit = REF + 3 * SIDEREAL;
        Optional<CalibratorTransit> match = schedule.match(transit + MINUTE);

        assertTrue(match.isPresent());
        assertEquals("3C286", match.get().calibratorName());
        assertEquals(transit, match.get().transitMjd(), 1e-9);
        assertEquals("ant103", match.get().referenceAntenna());
    }

    @Test
    @DisplayName("Should not match outside the match window")
    void testMatch_Outside() {
        assertTrue(schedule.match(REF + 5 * MINUTE).isEmpty());
        assertTrue(schedule.match(REF + 0.1).isEmpty());
    }

    @Test
    @DisplayName("Should pick the calibrator whose transit is closest")
    void testMatch_Second() {
        assertEquals("3C48", schedule.match(REF + 0.25 - MINUTE).orElseThrow().calibratorName());
    }

    @Test
    @DisplayName("Should reject calibrators without a name")
    void testInvalidConfiguration() {
        SkyFlowProperties props = SkyFlowFixture.testProperties();
        props.getCalibration().getCalibrators().add(calibrator(" ", REF));
        assertThrows(IllegalArgumentException.class, () -> new CalibratorSchedule(props));
    }
}
