package com.framelint.core.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/**
 * Kind of a design node, as reported by the design tool.
 *
 * <p>Node kinds outside the modelled set (ellipses, lines, sections, boolean
 * operations, ...) are read as {@link #OTHER}; no rule targets them.</p>
 */
public enum NodeType {
    DOCUMENT,
    CANVAS,
    FRAME,
    GROUP,
    VECTOR,
    RECTANGLE,
    TEXT,
    COMPONENT,
    INSTANCE,
    @JsonEnumDefaultValue
    OTHER;

    /**
     * Whether this kind is a reusable component definition or a placed instance of one.
     *
     * @return true for {@link #COMPONENT} and {@link #INSTANCE}
     */
    public boolean isComponentLike() {
        return this == COMPONENT || this == INSTANCE;
    }
}
