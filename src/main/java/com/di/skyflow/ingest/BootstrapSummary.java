package com.di.skyflow.ingest;

/**
 * Counts from registering a directory of files already on disk.
 */
public record BootstrapSummary(int scanned, int stored, int duplicates, int rejected, int unparseable) {
}
