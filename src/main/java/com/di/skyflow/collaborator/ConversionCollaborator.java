package com.di.skyflow.collaborator;

import com.di.skyflow.common.Result;

import java.util.List;

/**
 * Merges the subband files of one group into a single measurement set.
 */
public interface ConversionCollaborator {

    /**
     * @param groupId      group being converted, for naming outputs
     * @param subbandPaths member files ordered by subband index
     * @return reference to the converted measurement set
     */
    Result<String> convert(String groupId, List<String> subbandPaths);
}
