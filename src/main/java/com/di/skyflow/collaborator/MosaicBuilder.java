package com.di.skyflow.collaborator;

import com.di.skyflow.common.Result;

import java.util.List;

/**
 * Combines chronologically ordered tile images into one mosaic.
 */
public interface MosaicBuilder {

    Result<String> buildMosaic(String mosaicId, List<String> orderedImages);
}
