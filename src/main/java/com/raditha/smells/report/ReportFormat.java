package com.raditha.smells.report;

import java.util.Arrays;
import java.util.Optional;

/**
 * Output format of the report file.
 */
public enum ReportFormat {
    JSON("json"),
    TXT("txt");

    private final String extension;

    ReportFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public static Optional<ReportFormat> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(f -> f.extension.equalsIgnoreCase(name.trim()))
                .findFirst();
    }
}
