package com.framelint.core.model;

/**
 * Sizing behaviour of an auto-layout node along one axis.
 *
 * <p>{@link #AUTO} is what design tools present as "hug contents".</p>
 */
public enum AxisSizingMode {
    FIXED,
    AUTO
}
