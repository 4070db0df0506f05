package com.di.skyflow.mosaic;

import java.util.List;

/**
 * Planned members of the next mosaic.
 *
 * @param members chronological union of {@code reused} and {@code fresh}
 * @param reused  trailing tiles of the previous window
 * @param fresh   tiles not yet in any mosaic
 */
public record MosaicWindow(List<MosaicTile> members, List<MosaicTile> reused, List<MosaicTile> fresh) {
}
