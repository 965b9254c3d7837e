package com.framelint.core.rule.base;

import com.framelint.core.model.AxisSizingMode;
import com.framelint.core.model.DesignNode;
import com.framelint.core.model.LayoutWrap;
import com.framelint.core.model.NodeType;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Shared predicates over design nodes and layer names.
 *
 * <p>Pure functions of their arguments. Name checks run against fixed, pre-compiled
 * pattern tables.</p>
 *
 * @since 1.0.0
 */
public final class NodePredicates {

    /** Names that follow a semantic role or kebab-case convention. */
    public static final List<Pattern> SEMANTIC_NAME_PATTERNS = List.of(
        Pattern.compile("^(header|footer|nav|section|article|aside|main)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^(hero|banner|card|modal|dialog|overlay)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^(button|input|form|select|checkbox|radio)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^(list|item|grid|row|column|cell)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^[a-z][a-zA-Z0-9]*(-[a-z][a-zA-Z0-9]*)*$")
    );

    /** Default names the design tool assigns; these are never semantic. */
    public static final List<Pattern> NON_SEMANTIC_NAME_PATTERNS = List.of(
        Pattern.compile("^Frame\\s+\\d+$", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^Group\\s+\\d+$", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^Rectangle\\s+\\d+$", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^Component\\s+\\d+$", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^(未|無|名|title)$", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
    );

    /** Numbered default name, used by the coarse semantic-name statistic. */
    public static final Pattern DEFAULT_LAYER_NAME =
        Pattern.compile("^(Frame|Group|Rectangle|Component)\\s+\\d+$", Pattern.CASE_INSENSITIVE);

    /** Layers that usually deserve to become components. */
    public static final List<Pattern> REUSABLE_NAME_PATTERNS = List.of(
        Pattern.compile("button", Pattern.CASE_INSENSITIVE),
        Pattern.compile("btn", Pattern.CASE_INSENSITIVE),
        Pattern.compile("card", Pattern.CASE_INSENSITIVE),
        Pattern.compile("item", Pattern.CASE_INSENSITIVE),
        Pattern.compile("tag", Pattern.CASE_INSENSITIVE),
        Pattern.compile("badge", Pattern.CASE_INSENSITIVE),
        Pattern.compile("chip", Pattern.CASE_INSENSITIVE)
    );

    /** Interactive elements that shrink badly without a minimum width. */
    public static final Pattern INTERACTIVE_NAME = Pattern.compile("button|btn|card|input|select", Pattern.CASE_INSENSITIVE);

    /** Children above which a single container counts as layer abuse. */
    public static final int MAX_DIRECT_CHILDREN = 50;

    private NodePredicates() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    public static boolean isFrame(DesignNode node) {
        return node.type() == NodeType.FRAME;
    }

    public static boolean isComponent(DesignNode node) {
        return node.type().isComponentLike();
    }

    public static boolean hasAutoLayout(DesignNode node) {
        return node.hasAutoLayout();
    }

    /**
     * Checks a layer name against the naming tables.
     *
     * <p>Default names are rejected first; otherwise the name must match at least one
     * semantic pattern.</p>
     *
     * @param name layer name
     * @return true if the name is semantic
     */
    public static boolean isSemanticName(String name) {
        if (name == null) {
            return false;
        }
        for (Pattern pattern : NON_SEMANTIC_NAME_PATTERNS) {
            if (pattern.matcher(name).find()) {
                return false;
            }
        }
        for (Pattern pattern : SEMANTIC_NAME_PATTERNS) {
            if (pattern.matcher(name).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether the name is a numbered design-tool default such as "Frame 12".
     *
     * @param name layer name
     * @return true for a default name
     */
    public static boolean isDefaultLayerName(String name) {
        return name != null && DEFAULT_LAYER_NAME.matcher(name).find();
    }

    /**
     * A node without auto-layout is absolutely positioned; so is one whose constraints
     * scale with the parent.
     *
     * @param node node to test
     * @return true if the node relies on absolute positioning
     */
    public static boolean hasAbsolutePositioning(DesignNode node) {
        if (!node.hasAutoLayout()) {
            return true;
        }
        return node.constraints() != null && node.constraints().usesScale();
    }

    /**
     * Fixed on either auto-layout axis, or an explicit bounding box with no auto-layout.
     *
     * @param node node to test
     * @return true if the node has a fixed size
     */
    public static boolean hasFixedSize(DesignNode node) {
        if (node.hasAutoLayout()
                && (node.primaryAxisSizingMode() == AxisSizingMode.FIXED
                    || node.counterAxisSizingMode() == AxisSizingMode.FIXED)) {
            return true;
        }
        return node.absoluteBoundingBox() != null && !node.hasAutoLayout();
    }

    public static boolean hasWrapEnabled(DesignNode node) {
        return node.layoutWrap() == LayoutWrap.WRAP;
    }

    /**
     * A minimum width is present when set explicitly, or when an auto-layout node hugs
     * its content across the counter axis.
     *
     * @param node node to test
     * @return true if the node cannot shrink below its content
     */
    public static boolean hasMinWidth(DesignNode node) {
        if (node.minWidth() != null && node.minWidth() > 0) {
            return true;
        }
        return node.hasAutoLayout() && node.counterAxisSizingMode() == AxisSizingMode.AUTO;
    }

    public static boolean hasLayerAbuse(DesignNode node) {
        return node.childCount() > MAX_DIRECT_CHILDREN;
    }

    public static boolean isInteractiveName(String name) {
        return name != null && INTERACTIVE_NAME.matcher(name).find();
    }

    /**
     * Whether a non-component node looks like a reusable element.
     *
     * @param node node to test
     * @return true if the node should be turned into a component
     */
    public static boolean shouldBeComponent(DesignNode node) {
        if (isComponent(node)) {
            return false;
        }
        for (Pattern pattern : REUSABLE_NAME_PATTERNS) {
            if (pattern.matcher(node.name()).find()) {
                return true;
            }
        }
        return false;
    }
}
