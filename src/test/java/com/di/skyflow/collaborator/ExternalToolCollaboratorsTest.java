package com.di.skyflow.collaborator;

import com.di.skyflow.calibration.CalTableKind;
import com.di.skyflow.calibration.CalibrationTable;
import com.di.skyflow.common.Result;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExternalToolCollaborators Tests")
class ExternalToolCollaboratorsTest {

    @Test
    @DisplayName("Should read tables from kind-prefixed and bare lines")
    void testParseTables() {
        ToolOutput output = new ToolOutput(0, List.of(
                "solving bandpass...",
                "BP /cal/obs_bpcal",
                "2G /cal/obs_2gcal",
                "/cal/obs_kcal",
                ""));

        Result<List<CalibrationTable>> r = ExternalToolCollaborators.parseTables(output);

        assertTrue(r.isSuccess());
        List<CalibrationTable> tables = r.getData();
        assertEquals(3, tables.size());
        assertEquals(CalTableKind.BP, tables.get(0).getKind());
        assertEquals(CalTableKind.SHORT_GAIN, tables.get(1).getKind());
        assertEquals("/cal/obs_kcal", tables.get(2).getPath());
    }

    @Test
    @DisplayName("Should fail when the solver reports nothing usable")
    void testParseTables_None() {
        Result<List<CalibrationTable>> r = ExternalToolCollaborators.parseTables(new ToolOutput(0, List.of("done")));
        assertEquals("SOLVE_NO_TABLES", r.failureCode());
    }
}
