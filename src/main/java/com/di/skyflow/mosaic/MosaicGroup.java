package com.di.skyflow.mosaic;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * An ordered window of tiles combined into one mosaic. The first {@code overlapCount} members
 * are carried over from the previous window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MosaicGroup {
    private String mosaicId;
    /** Tile image paths in observation order. */
    @Builder.Default
    private List<String> members = new ArrayList<>();
    /** Observation group ids, parallel to {@link #members}. */
    @Builder.Default
    private List<String> memberGroupIds = new ArrayList<>();
    private int overlapCount;
    /** Observation time of the last member. */
    private double windowEndMjd;
    private MosaicStatus status;
    private String mosaicPath;
    private String errorMessage;
    private Instant createdAt;
    private Instant updatedAt;
}
