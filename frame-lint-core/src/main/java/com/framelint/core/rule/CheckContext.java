package com.framelint.core.rule;

import com.framelint.core.model.DesignNode;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-node evaluation context, built fresh for every node visited.
 *
 * @param depth number of edges between the node and the root (capped, see
 *              {@code TreeIndex#MAX_DEPTH_STEPS})
 * @param parentNode direct parent of the node, null for the root
 * @param rootNode root of the analysed tree
 * @param allNodes every node of the tree in pre-order
 */
public record CheckContext(
    int depth,
    DesignNode parentNode,
    DesignNode rootNode,
    List<DesignNode> allNodes
) {
    /**
     * Compact constructor with validation.
     */
    public CheckContext {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be >= 0");
        }
        Objects.requireNonNull(rootNode, "rootNode must not be null");
        allNodes = allNodes == null ? List.of(rootNode) : allNodes;
    }

    /**
     * Parent of the node under check.
     *
     * @return the parent, or empty for the root
     */
    public Optional<DesignNode> parent() {
        return Optional.ofNullable(parentNode);
    }
}
