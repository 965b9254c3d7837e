package com.framelint.core.model;

/**
 * Severity class of a rule violation.
 *
 * <p>Drives the penalty a violation contributes to its category score.</p>
 *
 * @since 1.0.0
 */
public enum Severity {
    /**
     * Critical - the frame cannot be translated into responsive code.
     */
    CRITICAL,

    /**
     * Major - the frame translates, but will break on some viewport sizes.
     */
    MAJOR,

    /**
     * Minor - naming, reuse or polish issue.
     */
    MINOR,

    /**
     * Informational - recommended improvement, no penalty.
     */
    INFO
}
