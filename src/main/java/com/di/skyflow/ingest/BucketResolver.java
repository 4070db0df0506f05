package com.di.skyflow.ingest;

import com.di.skyflow.util.TimeBase;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Maps an observation timestamp to its bucket. Timestamps within {@code tolerance} of a chunk
 * boundary snap to it; anything farther off the grid keeps a bucket of its own.
 */
public class BucketResolver {

    private static final DateTimeFormatter BUCKET_ID =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss").withZone(ZoneOffset.UTC);

    private final long chunkSeconds;
    private final long toleranceSeconds;
    private final long gridOffsetSeconds;

    public BucketResolver(long chunkSeconds, long toleranceSeconds, long gridOffsetSeconds) {
        if (chunkSeconds <= 0) {
            throw new IllegalArgumentException("chunkSeconds must be positive, got " + chunkSeconds);
        }
        if (toleranceSeconds < 0) {
            throw new IllegalArgumentException("toleranceSeconds must not be negative, got " + toleranceSeconds);
        }
        this.chunkSeconds = chunkSeconds;
        this.toleranceSeconds = toleranceSeconds;
        this.gridOffsetSeconds = gridOffsetSeconds;
    }

    public Bucket resolve(Instant observedAt) {
        long seconds = observedAt.getEpochSecond();
        long relative = seconds - gridOffsetSeconds;
        long boundary = Math.floorDiv(relative + chunkSeconds / 2, chunkSeconds) * chunkSeconds + gridOffsetSeconds;
        boolean onGrid = Math.abs(seconds - boundary) <= toleranceSeconds;
        Instant start = Instant.ofEpochSecond(onGrid ? boundary : seconds);
        return new Bucket(BUCKET_ID.format(start), start, TimeBase.toMjd(start), onGrid);
    }

    /**
     * @param id     stable group id derived from the bucket start
     * @param onGrid false when the timestamp was beyond tolerance of every boundary
     */
    public record Bucket(String id, Instant start, double mjd, boolean onGrid) {
    }
}
