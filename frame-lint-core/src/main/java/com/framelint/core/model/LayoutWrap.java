package com.framelint.core.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/**
 * Whether overflowing children of an auto-layout node reflow onto new lines.
 */
public enum LayoutWrap {
    @JsonEnumDefaultValue
    NO_WRAP,
    WRAP
}
