package com.di.skyflow.ingest;

import com.di.skyflow.group.GroupState;
import com.di.skyflow.support.SkyFlowFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IncomingDirectoryScanner Tests")
class IncomingDirectoryScannerTest {

    private static final String T0 = "2025-01-15T12:00:00";

    @TempDir
    Path dir;

    private SkyFlowFixture f;

    @AfterEach
    void tearDown() {
        f.close();
    }

    @Test
    @DisplayName("Should register files as they land across scans")
    void testScan_PicksUpNewFiles() throws IOException {
        f = SkyFlowFixture.create(p -> p.getIngest().setIncomingDir(dir.toString()));
        IncomingDirectoryScanner scanner = new IncomingDirectoryScanner(f.groupFormer, f.props);

        for (int i = 0; i < 8; i++) {
            Files.createFile(dir.resolve(String.format("%s_sb%02d.hdf5", T0, i)));
        }
        scanner.scan();
        assertEquals(GroupState.COLLECTING, f.groupFormer.findGroup(T0).orElseThrow().getState());
        assertTrue(f.groupFormer.nextReadyGroup().isEmpty());

        for (int i = 8; i < 16; i++) {
            Files.createFile(dir.resolve(String.format("%s_sb%02d.hdf5", T0, i)));
        }
        scanner.scan();

        assertEquals(16, f.groupFormer.findGroup(T0).orElseThrow().getMembers().size());
        assertTrue(f.groupFormer.nextReadyGroup().isPresent());
    }

    @Test
    @DisplayName("Should do nothing when the landing directory is missing")
    void testScan_MissingDirectory() {
        f = SkyFlowFixture.create(p -> p.getIngest().setIncomingDir(dir.resolve("absent").toString()));
        IncomingDirectoryScanner scanner = new IncomingDirectoryScanner(f.groupFormer, f.props);

        assertDoesNotThrow(scanner::scan);
        assertTrue(f.groupFormer.countByState().values().stream().allMatch(n -> n == 0));
    }
}
