package com.framelint.core.model;

/**
 * Grouping of rules used for weighted scoring.
 *
 * @since 1.0.0
 */
public enum RuleCategory {
    /** Layout structure: auto-layout, positioning, nesting. */
    LAYOUT,
    /** Size settings: fixed, hug and fill. */
    SIZE,
    /** Behaviour on narrow viewports: wrap, minimum widths. */
    RESPONSIVE,
    /** Layer naming. */
    SEMANTIC,
    /** Reuse through components and instances. */
    COMPONENT
}
