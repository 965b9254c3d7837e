package com.framelint.core.engine;

import com.framelint.core.model.DesignNode;
import com.framelint.core.rule.CheckContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Flattened view of a design tree with a precomputed child-to-parent index.
 *
 * <p>Built once per analysis. Parent lookup is constant time; depth follows the parent
 * index and is capped at {@value #MAX_DEPTH_STEPS} steps. The input tree is never
 * modified.</p>
 *
 * <p>Node ids are expected to be unique. A node whose id was already visited is skipped
 * together with its subtree, which also keeps a malformed (cyclic) input from looping.</p>
 */
public final class TreeIndex {

    /** Upper bound on parent steps when computing a depth. */
    public static final int MAX_DEPTH_STEPS = 100;

    private static final Logger log = LoggerFactory.getLogger(TreeIndex.class);

    private final DesignNode root;
    private final List<DesignNode> nodes;
    private final Map<String, DesignNode> parentsById;

    private TreeIndex(DesignNode root, List<DesignNode> nodes, Map<String, DesignNode> parentsById) {
        this.root = root;
        this.nodes = List.copyOf(nodes);
        this.parentsById = Map.copyOf(parentsById);
    }

    /**
     * Flattens a tree depth-first in pre-order, root first, children in order.
     *
     * @param root tree root
     * @return every node once
     */
    public static List<DesignNode> flatten(DesignNode root) {
        return build(root).nodes();
    }

    /**
     * Flattens a tree and indexes each node's parent.
     *
     * @param root tree root
     * @return the index
     */
    public static TreeIndex build(DesignNode root) {
        Objects.requireNonNull(root, "root must not be null");

        List<DesignNode> nodes = new ArrayList<>();
        Map<String, DesignNode> parents = new HashMap<>();
        Set<String> visited = new HashSet<>();

        Deque<Visit> stack = new ArrayDeque<>();
        stack.push(new Visit(root, null));
        while (!stack.isEmpty()) {
            Visit visit = stack.pop();
            DesignNode node = visit.node();
            if (!visited.add(node.id())) {
                log.warn("Node id {} ({}) appears more than once; skipping repeated subtree", node.id(), node.name());
                continue;
            }
            nodes.add(node);
            if (visit.parent() != null) {
                parents.put(node.id(), visit.parent());
            }
            List<DesignNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Visit(children.get(i), node));
            }
        }

        log.debug("Indexed {} nodes under root {}", nodes.size(), root.id());
        return new TreeIndex(root, nodes, parents);
    }

    public DesignNode root() {
        return root;
    }

    /**
     * All nodes in pre-order.
     *
     * @return flattened nodes
     */
    public List<DesignNode> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Finds the parent of a node.
     *
     * @param node node to look up
     * @return the parent, or empty for the root or a node outside this tree
     */
    public Optional<DesignNode> resolveParent(DesignNode node) {
        return Optional.ofNullable(parentsById.get(node.id()));
    }

    /**
     * Counts the parent steps from a node up to the root.
     *
     * @param node node to measure
     * @return 0 for the root, at most {@link #MAX_DEPTH_STEPS}
     */
    public int computeDepth(DesignNode node) {
        int depth = 0;
        DesignNode parent = parentsById.get(node.id());
        while (parent != null) {
            if (depth == MAX_DEPTH_STEPS) {
                log.warn("Depth of node {} exceeds {} levels; capping", node.id(), MAX_DEPTH_STEPS);
                return MAX_DEPTH_STEPS;
            }
            depth++;
            parent = parentsById.get(parent.id());
        }
        return depth;
    }

    /**
     * Builds the evaluation context of one node.
     *
     * @param node node about to be checked
     * @return fresh context
     */
    public CheckContext contextFor(DesignNode node) {
        return new CheckContext(
            computeDepth(node),
            resolveParent(node).orElse(null),
            root,
            nodes
        );
    }

    private record Visit(DesignNode node, DesignNode parent) {}
}
