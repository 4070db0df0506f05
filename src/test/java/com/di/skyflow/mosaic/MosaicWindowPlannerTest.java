package com.di.skyflow.mosaic;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MosaicWindowPlanner Tests")
class MosaicWindowPlannerTest {

    private final MosaicWindowPlanner planner = new MosaicWindowPlanner(10, 2);

    private static MosaicTile tile(int n) {
        return new MosaicTile(String.format("g%02d", n), String.format("/img/g%02d.fits", n), 60690.0 + n / 288.0);
    }

    private static List<MosaicTile> tiles(int from, int to) {
        List<MosaicTile> tiles = new ArrayList<>();
        for (int n = from; n <= to; n++) {
            tiles.add(tile(n));
        }
        return tiles;
    }

    private static List<String> ids(List<MosaicTile> tiles) {
        List<String> ids = new ArrayList<>();
        for (MosaicTile t : tiles) {
            ids.add(t.groupId());
        }
        return ids;
    }

    @Test
    @DisplayName("Should wait for a full first window")
    void testNextWindow_FirstNeedsFullWindow() {
        assertTrue(planner.nextWindow(tiles(1, 9), List.of()).isEmpty());

        MosaicWindow first = planner.nextWindow(tiles(1, 12), List.of()).orElseThrow();
        assertEquals(ids(tiles(1, 10)), ids(first.members()));
        assertTrue(first.reused().isEmpty());
        assertEquals(10, first.fresh().size());
    }

    @Test
    @DisplayName("Should slide by reusing the last overlap tiles of the previous window")
    void testNextWindow_Slides() {
        List<MosaicTile> previous = tiles(1, 10);

        assertTrue(planner.nextWindow(tiles(11, 17), previous).isEmpty(), "7 new tiles are not enough");

        MosaicWindow second = planner.nextWindow(tiles(11, 20), previous).orElseThrow();
        List<String> expected = new ArrayList<>(List.of("g09", "g10"));
        expected.addAll(ids(tiles(11, 18)));
        assertEquals(expected, ids(second.members()));
        assertEquals(List.of("g09", "g10"), ids(second.reused()));
        assertEquals(8, second.fresh().size());
    }

    @Test
    @DisplayName("Should return members in observation order whatever the input order")
    void testNextWindow_ChronologicalUnderPermutation() {
        List<MosaicTile> previous = tiles(1, 10);
        List<MosaicTile> fresh = tiles(11, 18);
        List<String> expected = ids(planner.nextWindow(fresh, previous).orElseThrow().members());

        Random random = new Random(7);
        for (int i = 0; i < 20; i++) {
            List<MosaicTile> shuffledPrevious = new ArrayList<>(previous);
            List<MosaicTile> shuffledFresh = new ArrayList<>(fresh);
            Collections.shuffle(shuffledPrevious, random);
            Collections.shuffle(shuffledFresh, random);
            Optional<MosaicWindow> w = planner.nextWindow(shuffledFresh, shuffledPrevious);
            assertEquals(expected, ids(w.orElseThrow().members()));
        }
    }

    @Test
    @DisplayName("Should not count previous members still in the pool as new")
    void testNextWindow_IgnoresReusedInPool() {
        List<MosaicTile> pool = tiles(9, 16);
        assertTrue(planner.nextWindow(pool, tiles(1, 10)).isEmpty());
    }

    @Test
    @DisplayName("Should validate the window shape")
    void testConstructor_Invalid() {
        assertThrows(IllegalArgumentException.class, () -> new MosaicWindowPlanner(0, 0));
        assertThrows(IllegalArgumentException.class, () -> new MosaicWindowPlanner(10, 10));
        assertThrows(IllegalArgumentException.class, () -> new MosaicWindowPlanner(10, -1));
        MosaicWindowPlanner noOverlap = new MosaicWindowPlanner(3, 0);
        assertEquals(ids(tiles(4, 6)), ids(noOverlap.nextWindow(tiles(4, 7), tiles(1, 3)).orElseThrow().members()));
    }
}
