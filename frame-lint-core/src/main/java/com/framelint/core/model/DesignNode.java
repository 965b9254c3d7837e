package com.framelint.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A node of a design document tree.
 *
 * <p>The tree is strictly owned top-down: a node holds its children, never its parent.
 * Ancestry is derived on demand by {@code com.framelint.core.engine.TreeIndex}.
 * Field names follow the design tool's file export, so nodes deserialize directly from
 * its JSON.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * DesignNode hero = DesignNode.builder("1:2", "section-hero", NodeType.FRAME)
 *     .layoutMode(LayoutMode.VERTICAL)
 *     .children(title, subtitle)
 *     .build();
 * }</pre>
 *
 * @param id node id, unique within a document
 * @param name layer name
 * @param type node kind
 * @param children ordered child nodes (never null)
 * @param layoutMode auto-layout direction ({@link LayoutMode#NONE} when unset)
 * @param layoutWrap wrap behaviour ({@link LayoutWrap#NO_WRAP} when unset)
 * @param primaryAxisSizingMode sizing along the layout direction, null when unset
 * @param counterAxisSizingMode sizing across the layout direction, null when unset
 * @param itemSpacing gap between children along the primary axis
 * @param counterAxisSpacing gap between wrapped lines
 * @param paddingLeft left padding
 * @param paddingRight right padding
 * @param paddingTop top padding
 * @param paddingBottom bottom padding
 * @param minWidth explicit minimum width
 * @param maxWidth explicit maximum width
 * @param absoluteBoundingBox absolute position and size, null when not reported
 * @param constraints resizing constraints, null when not reported
 * @param visible whether the layer is visible (true when unset)
 * @param locked whether the layer is locked (false when unset)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DesignNode(
    String id,
    String name,
    NodeType type,
    List<DesignNode> children,
    LayoutMode layoutMode,
    LayoutWrap layoutWrap,
    AxisSizingMode primaryAxisSizingMode,
    AxisSizingMode counterAxisSizingMode,
    Double itemSpacing,
    Double counterAxisSpacing,
    Double paddingLeft,
    Double paddingRight,
    Double paddingTop,
    Double paddingBottom,
    Double minWidth,
    Double maxWidth,
    BoundingBox absoluteBoundingBox,
    LayoutConstraints constraints,
    Boolean visible,
    Boolean locked
) {
    /**
     * Compact constructor with validation and defaults.
     */
    public DesignNode {
        Objects.requireNonNull(id, "id must not be null");
        if (name == null) {
            name = "";
        }
        if (type == null) {
            type = NodeType.OTHER;
        }
        children = children == null ? List.of() : List.copyOf(children);
        if (layoutMode == null) {
            layoutMode = LayoutMode.NONE;
        }
        if (layoutWrap == null) {
            layoutWrap = LayoutWrap.NO_WRAP;
        }
        if (visible == null) {
            visible = Boolean.TRUE;
        }
        if (locked == null) {
            locked = Boolean.FALSE;
        }
    }

    /**
     * Starts a builder for a node.
     *
     * @param id node id
     * @param name layer name
     * @param type node kind
     * @return new builder
     */
    public static Builder builder(String id, String name, NodeType type) {
        return new Builder(id, name, type);
    }

    /**
     * Whether an auto-layout direction is set.
     *
     * @return true unless layout mode is {@link LayoutMode#NONE}
     */
    public boolean hasAutoLayout() {
        return layoutMode != LayoutMode.NONE;
    }

    /**
     * Number of direct children.
     *
     * @return child count
     */
    public int childCount() {
        return children.size();
    }

    /**
     * Fluent builder for {@link DesignNode}. Unset attributes take the record defaults.
     */
    public static final class Builder {
        private final String id;
        private final String name;
        private final NodeType type;
        private final List<DesignNode> children = new ArrayList<>();
        private LayoutMode layoutMode;
        private LayoutWrap layoutWrap;
        private AxisSizingMode primaryAxisSizingMode;
        private AxisSizingMode counterAxisSizingMode;
        private Double itemSpacing;
        private Double counterAxisSpacing;
        private Double paddingLeft;
        private Double paddingRight;
        private Double paddingTop;
        private Double paddingBottom;
        private Double minWidth;
        private Double maxWidth;
        private BoundingBox absoluteBoundingBox;
        private LayoutConstraints constraints;
        private Boolean visible;
        private Boolean locked;

        private Builder(String id, String name, NodeType type) {
            this.id = id;
            this.name = name;
            this.type = type;
        }

        public Builder children(DesignNode... nodes) {
            children.addAll(Arrays.asList(nodes));
            return this;
        }

        public Builder children(List<DesignNode> nodes) {
            children.addAll(nodes);
            return this;
        }

        public Builder layoutMode(LayoutMode layoutMode) {
            this.layoutMode = layoutMode;
            return this;
        }

        public Builder layoutWrap(LayoutWrap layoutWrap) {
            this.layoutWrap = layoutWrap;
            return this;
        }

        public Builder primaryAxisSizingMode(AxisSizingMode mode) {
            this.primaryAxisSizingMode = mode;
            return this;
        }

        public Builder counterAxisSizingMode(AxisSizingMode mode) {
            this.counterAxisSizingMode = mode;
            return this;
        }

        public Builder itemSpacing(double itemSpacing) {
            this.itemSpacing = itemSpacing;
            return this;
        }

        public Builder counterAxisSpacing(double counterAxisSpacing) {
            this.counterAxisSpacing = counterAxisSpacing;
            return this;
        }

        public Builder padding(double top, double right, double bottom, double left) {
            this.paddingTop = top;
            this.paddingRight = right;
            this.paddingBottom = bottom;
            this.paddingLeft = left;
            return this;
        }

        public Builder minWidth(double minWidth) {
            this.minWidth = minWidth;
            return this;
        }

        public Builder maxWidth(double maxWidth) {
            this.maxWidth = maxWidth;
            return this;
        }

        public Builder absoluteBoundingBox(BoundingBox box) {
            this.absoluteBoundingBox = box;
            return this;
        }

        public Builder constraints(LayoutConstraints constraints) {
            this.constraints = constraints;
            return this;
        }

        public Builder visible(boolean visible) {
            this.visible = visible;
            return this;
        }

        public Builder locked(boolean locked) {
            this.locked = locked;
            return this;
        }

        public DesignNode build() {
            return new DesignNode(
                id, name, type, children,
                layoutMode, layoutWrap, primaryAxisSizingMode, counterAxisSizingMode,
                itemSpacing, counterAxisSpacing,
                paddingLeft, paddingRight, paddingTop, paddingBottom,
                minWidth, maxWidth,
                absoluteBoundingBox, constraints,
                visible, locked
            );
        }
    }
}
