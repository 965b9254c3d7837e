package com.framelint.core.rule;

/**
 * Ids of the baseline rules.
 */
public final class RuleIds {

    public static final String AUTO_LAYOUT_REQUIRED = "AUTO_LAYOUT_REQUIRED";
    public static final String ABSOLUTE_POSITIONING = "ABSOLUTE_POSITIONING";
    public static final String FIXED_SIZE_DETECTED = "FIXED_SIZE_DETECTED";
    public static final String WRAP_OFF = "WRAP_OFF";
    public static final String NON_SEMANTIC_NAME = "NON_SEMANTIC_NAME";
    public static final String DEPTH_TOO_DEEP = "DEPTH_TOO_DEEP";
    public static final String HUG_FILL_VIOLATION = "HUG_FILL_VIOLATION";
    public static final String MIN_WIDTH_MISSING = "MIN_WIDTH_MISSING";
    public static final String COMPONENT_NOT_USED = "COMPONENT_NOT_USED";
    public static final String LAYER_ABUSE = "LAYER_ABUSE";

    private RuleIds() {
        throw new AssertionError("Utility class should not be instantiated");
    }
}
