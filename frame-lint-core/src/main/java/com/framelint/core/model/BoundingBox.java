package com.framelint.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Absolute position and size of a node on the canvas, in pixels.
 *
 * @param x left edge
 * @param y top edge
 * @param width width
 * @param height height
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BoundingBox(
    double x,
    double y,
    double width,
    double height
) {
    /**
     * Formats the rounded size as shown to designers, e.g. {@code 320px × 48px}.
     *
     * @return rounded size string
     */
    public String formatSize() {
        return Math.round(width) + "px × " + Math.round(height) + "px";
    }
}
