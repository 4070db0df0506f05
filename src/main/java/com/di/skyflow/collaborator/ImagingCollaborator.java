package com.di.skyflow.collaborator;

import com.di.skyflow.common.Result;

/**
 * Produces an image from a (possibly calibrated) observation.
 */
public interface ImagingCollaborator {

    /**
     * @param calibrated false when the observation could not be calibrated
     * @return reference to the image product
     */
    Result<String> image(String observationRef, boolean calibrated);
}
