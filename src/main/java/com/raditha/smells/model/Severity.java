package com.raditha.smells.model;

/**
 * Severity of a finding.
 */
public enum Severity {
    HIGH,
    MEDIUM,
    LOW;

    public String label() {
        return name().toLowerCase();
    }
}
