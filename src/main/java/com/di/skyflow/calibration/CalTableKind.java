package com.di.skyflow.calibration;

import java.util.Locale;
import java.util.Optional;

/**
 * Solution table kinds and the order in which they are applied.
 */
public enum CalTableKind {

    K("K", 10, "_kcal"),
    BA("BA", 20, "_bacal"),
    BP("BP", 30, "_bpcal"),
    GA("GA", 40, "_gacal"),
    GP("GP", 50, "_gpcal"),
    SHORT_GAIN("2G", 60, "_2gcal"),
    FLUX("FLUX", 70, "_fluxcal", "_flux.cal");

    private final String code;
    private final int applyOrder;
    private final String[] suffixes;

    CalTableKind(String code, int applyOrder, String... suffixes) {
        this.code = code;
        this.applyOrder = applyOrder;
        this.suffixes = suffixes;
    }

    public String getCode() {
        return code;
    }

    public int getApplyOrder() {
        return applyOrder;
    }

    public static CalTableKind fromCode(String code) {
        for (CalTableKind k : values()) {
            if (k.code.equalsIgnoreCase(code) || k.name().equalsIgnoreCase(code)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown calibration table kind: " + code);
    }

    /**
     * Detects the kind from a table path such as {@code /cal/2025-01-15_0834_bpcal}.
     */
    public static Optional<CalTableKind> fromPath(String path) {
        if (path == null) {
            return Optional.empty();
        }
        String lower = path.toLowerCase(Locale.ROOT);
        while (lower.endsWith("/")) {
            lower = lower.substring(0, lower.length() - 1);
        }
        for (CalTableKind k : values()) {
            for (String suffix : k.suffixes) {
                if (lower.endsWith(suffix)) {
                    return Optional.of(k);
                }
            }
        }
        return Optional.empty();
    }
}
