package com.di.skyflow.mosaic;

import java.util.Comparator;

/**
 * An imaged observation group available to mosaics.
 */
public record MosaicTile(String groupId, String imagePath, double observedMjd) {

    public static final Comparator<MosaicTile> CHRONOLOGICAL = Comparator
            .comparingDouble(MosaicTile::observedMjd)
            .thenComparing(MosaicTile::groupId);
}
