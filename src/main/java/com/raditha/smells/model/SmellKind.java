package com.raditha.smells.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The six smells the engine detects. Declaration order is the tie-break order
 * for findings on the same line.
 */
public enum SmellKind {
    LONG_METHOD("LongMethod"),
    GOD_CLASS("GodClass"),
    DUPLICATED_CODE("DuplicatedCode"),
    LARGE_PARAMETER_LIST("LargeParameterList"),
    MAGIC_NUMBERS("MagicNumbers"),
    FEATURE_ENVY("FeatureEnvy");

    private final String displayName;

    SmellKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Name used in configuration files, CLI filters and reports.
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Look up by display name ("LongMethod") or constant name ("LONG_METHOD"),
     * ignoring case.
     */
    public static Optional<SmellKind> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(k -> k.displayName.equalsIgnoreCase(trimmed) || k.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }

    @Override
    public String toString() {
        return displayName;
    }
}
