package com.di.skyflow.ingest;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses correlator output names of the form {@code 2025-01-15T12:30:00_sb07.hdf5}.
 * Timestamps are UTC.
 */
public final class SubbandFilenameParser {

    public static final Pattern FILENAME = Pattern.compile(
            "(?<timestamp>\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2})_sb(?<index>\\d{2})\\.hdf5$");

    /** Glob for directory listings. */
    public static final String GLOB = "*_sb??.hdf5";

    private SubbandFilenameParser() {
    }

    public static Optional<SubbandFile> parse(Path file) {
        if (file == null || file.getFileName() == null) {
            return Optional.empty();
        }
        Matcher m = FILENAME.matcher(file.getFileName().toString());
        if (!m.matches()) {
            return Optional.empty();
        }
        try {
            LocalDateTime ts = LocalDateTime.parse(m.group("timestamp"));
            return Optional.of(SubbandFile.builder()
                    .path(file.toString())
                    .observedAt(ts.toInstant(ZoneOffset.UTC))
                    .subbandIndex(Integer.parseInt(m.group("index")))
                    .build());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static Optional<SubbandFile> parse(String path) {
        return path == null ? Optional.empty() : parse(Path.of(path));
    }
}
