package com.di.skyflow.group;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One subband file accepted into a group.
 */
@Value
@Builder
@AllArgsConstructor
public class GroupMember {
    int subbandIndex;
    String path;
    /** Content fingerprint when known; used to tell a re-ingest from a conflicting file. */
    String checksum;
    Instant arrivedAt;

    public boolean sameContentAs(String otherPath, String otherChecksum) {
        if (path.equals(otherPath)) {
            return true;
        }
        return checksum != null && checksum.equals(otherChecksum);
    }
}
