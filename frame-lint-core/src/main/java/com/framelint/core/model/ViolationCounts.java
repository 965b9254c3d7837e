package com.framelint.core.model;

import java.util.Collection;

/**
 * Number of violations per severity.
 *
 * @param critical CRITICAL violations
 * @param major MAJOR violations
 * @param minor MINOR violations
 * @param info INFO violations
 */
public record ViolationCounts(
    int critical,
    int major,
    int minor,
    int info
) {
    /**
     * Compact constructor with validation.
     */
    public ViolationCounts {
        if (critical < 0 || major < 0 || minor < 0 || info < 0) {
            throw new IllegalArgumentException("violation counts must be >= 0");
        }
    }

    /**
     * No violations at all.
     *
     * @return zero counts
     */
    public static ViolationCounts none() {
        return new ViolationCounts(0, 0, 0, 0);
    }

    /**
     * Counts the given violations by severity.
     *
     * @param violations violations to count
     * @return counts
     */
    public static ViolationCounts of(Collection<Violation> violations) {
        int critical = 0;
        int major = 0;
        int minor = 0;
        int info = 0;
        for (Violation violation : violations) {
            switch (violation.severity()) {
                case CRITICAL -> critical++;
                case MAJOR -> major++;
                case MINOR -> minor++;
                case INFO -> info++;
            }
        }
        return new ViolationCounts(critical, major, minor, info);
    }

    /**
     * Total over all severities.
     *
     * @return total count
     */
    public int total() {
        return critical + major + minor + info;
    }

    /**
     * Count for one severity.
     *
     * @param severity severity
     * @return count for that severity
     */
    public int countOf(Severity severity) {
        return switch (severity) {
            case CRITICAL -> critical;
            case MAJOR -> major;
            case MINOR -> minor;
            case INFO -> info;
        };
    }
}
