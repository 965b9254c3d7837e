package com.framelint.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Resizing constraints of a node relative to its parent.
 *
 * <p>Values are kept as the design tool reports them: {@code LEFT}, {@code RIGHT},
 * {@code CENTER}, {@code LEFT_RIGHT}, {@code SCALE} horizontally and {@code TOP},
 * {@code BOTTOM}, {@code CENTER}, {@code TOP_BOTTOM}, {@code SCALE} vertically.</p>
 *
 * @param horizontal horizontal constraint, may be null
 * @param vertical vertical constraint, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LayoutConstraints(
    String horizontal,
    String vertical
) {
    /** Constraint value for proportional, scale-based positioning. */
    public static final String SCALE = "SCALE";

    /**
     * Whether either axis scales proportionally with the parent.
     *
     * @return true if horizontal or vertical is {@code SCALE}
     */
    public boolean usesScale() {
        return SCALE.equalsIgnoreCase(horizontal) || SCALE.equalsIgnoreCase(vertical);
    }
}
