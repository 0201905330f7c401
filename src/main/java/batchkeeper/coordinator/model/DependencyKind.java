package batchkeeper.coordinator.model;

import java.util.Locale;

/**
 * Condition a predecessor has to meet before its dependent may run.
 */
public enum DependencyKind {
    /** Predecessor completed successfully */
    AFTER_OK,
    /** Predecessor failed for good */
    AFTER_FAIL,
    /** Predecessor reached any terminal state */
    AFTER_ANY;

    /** Lower-case name used in exports and config, e.g. {@code after_ok}. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DependencyKind fromWireName(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
