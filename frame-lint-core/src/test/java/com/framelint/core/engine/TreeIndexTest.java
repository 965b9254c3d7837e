package com.framelint.core.engine;

import com.framelint.core.model.DesignNode;
import com.framelint.core.model.NodeType;
import com.framelint.core.rule.CheckContext;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.framelint.core.DesignTrees.autoFrame;
import static com.framelint.core.DesignTrees.text;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TreeIndex}.
 */
class TreeIndexTest {

    private final DesignNode leafA = text("a");
    private final DesignNode leafB = text("b");
    private final DesignNode inner = autoFrame("inner", "card").children(leafA, leafB).build();
    private final DesignNode sibling = text("c");
    private final DesignNode root = autoFrame("root", "page").children(inner, sibling).build();

    @Test
    void flatten_returnsPreOrderWithRootFirst() {
        assertThat(TreeIndex.flatten(root))
            .extracting(DesignNode::id)
            .containsExactly("root", "inner", "a", "b", "c");
    }

    @Test
    void flatten_singleNode_returnsOnlyRoot() {
        assertThat(TreeIndex.flatten(leafA)).containsExactly(leafA);
    }

    @Test
    void flatten_repeatedId_skipsRepeatedSubtree() {
        DesignNode repeated = autoFrame("inner", "copy").children(text("x")).build();
        DesignNode malformed = autoFrame("root", "page").children(inner, repeated).build();

        assertThat(TreeIndex.flatten(malformed))
            .extracting(DesignNode::id)
            .containsExactly("root", "inner", "a", "b");
    }

    @Test
    void resolveParent_returnsDirectParentOrEmptyForRoot() {
        TreeIndex index = TreeIndex.build(root);

        assertThat(index.resolveParent(leafB)).contains(inner);
        assertThat(index.resolveParent(inner)).contains(root);
        assertThat(index.resolveParent(root)).isEmpty();
    }

    @Test
    void resolveParent_nodeOutsideTree_returnsEmpty() {
        assertThat(TreeIndex.build(root).resolveParent(text("elsewhere"))).isEmpty();
    }

    @Test
    void computeDepth_countsEdgesToRoot() {
        TreeIndex index = TreeIndex.build(root);

        assertThat(index.computeDepth(root)).isZero();
        assertThat(index.computeDepth(inner)).isEqualTo(1);
        assertThat(index.computeDepth(leafA)).isEqualTo(2);
    }

    @Test
    void computeDepth_veryDeepChain_isCapped() {
        DesignNode node = text("leaf");
        for (int i = 0; i < 150; i++) {
            node = DesignNode.builder("g" + i, "group", NodeType.GROUP).children(node).build();
        }
        TreeIndex index = TreeIndex.build(node);

        DesignNode leaf = index.nodes().get(index.size() - 1);

        assertThat(leaf.id()).isEqualTo("leaf");
        assertThat(index.computeDepth(leaf)).isEqualTo(TreeIndex.MAX_DEPTH_STEPS);
    }

    @Test
    void flatten_deepChain_doesNotOverflowStack() {
        DesignNode node = text("leaf");
        for (int i = 0; i < 20_000; i++) {
            node = DesignNode.builder("g" + i, "group", NodeType.GROUP).children(node).build();
        }

        assertThat(TreeIndex.flatten(node)).hasSize(20_001);
    }

    @Test
    void contextFor_carriesParentDepthAndAllNodes() {
        TreeIndex index = TreeIndex.build(root);

        CheckContext context = index.contextFor(leafA);

        assertThat(context.depth()).isEqualTo(2);
        assertThat(context.parent()).contains(inner);
        assertThat(context.rootNode()).isSameAs(root);
        assertThat(context.allNodes()).hasSize(5);
    }

    @Test
    void build_doesNotModifyInput() {
        List<DesignNode> childrenBefore = root.children();

        TreeIndex.build(root);

        assertThat(root.children()).isSameAs(childrenBefore);
        assertThat(inner.children()).containsExactly(leafA, leafB);
    }
}
