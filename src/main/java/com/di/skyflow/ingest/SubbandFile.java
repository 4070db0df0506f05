package com.di.skyflow.ingest;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A subband file as announced by the correlator: where it is, when it was observed and which
 * frequency slice it holds.
 */
@Value
@Builder
public class SubbandFile {
    String path;
    Instant observedAt;
    int subbandIndex;
    /** Optional content fingerprint. */
    String checksum;
}
