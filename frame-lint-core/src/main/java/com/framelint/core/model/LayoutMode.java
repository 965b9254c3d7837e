package com.framelint.core.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/**
 * Auto-layout direction of a container node.
 *
 * <p>Only {@link #NONE} means "no auto layout"; every other constant, including
 * {@link #OTHER}, counts as auto layout.</p>
 */
public enum LayoutMode {
    NONE,
    HORIZONTAL,
    VERTICAL,
    GRID,
    /** A layout mode this version does not know */
    @JsonEnumDefaultValue
    OTHER
}
