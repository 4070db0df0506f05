package com.di.skyflow.mosaic;

public enum MosaicStatus {
    PENDING,
    BUILDING,
    COMPLETED,
    FAILED
}
