package com.jpexs.decompiler.comb.graph;

import static com.google.common.truth.Truth.assertThat;
import static com.jpexs.decompiler.comb.GraphFixtures.importGraph;
import static com.jpexs.decompiler.comb.GraphFixtures.node;

import com.jpexs.decompiler.comb.GraphFixtures;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DominatorTreeTest {

    @Test
    public void dominatorsOfDiamond() {
        FlowGraph graph = importGraph(GraphFixtures.DIAMOND);
        BlockNode a = node(graph, "A");
        BlockNode b = node(graph, "B");
        BlockNode d = node(graph, "D");

        DominatorTree tree = DominatorTree.dominators(graph);

        assertThat(tree.getImmediateDominator(a)).isNull();
        assertThat(tree.getImmediateDominator(b)).isEqualTo(a);
        assertThat(tree.getImmediateDominator(d)).isEqualTo(a);
        assertThat(tree.dominates(a, d)).isTrue();
        assertThat(tree.dominates(b, d)).isFalse();
        assertThat(tree.dominates(d, d)).isTrue();
    }

    @Test
    public void postDominatorsOfDiamond() {
        FlowGraph graph = importGraph(GraphFixtures.DIAMOND);
        BlockNode a = node(graph, "A");
        BlockNode c = node(graph, "C");
        BlockNode d = node(graph, "D");

        DominatorTree tree = DominatorTree.postDominators(graph, false);

        assertThat(tree.getImmediateDominator(a)).isEqualTo(d);
        assertThat(tree.getImmediateDominator(c)).isEqualTo(d);
        assertThat(tree.getImmediateDominator(d)).isNull();
        assertThat(tree.dominates(d, a)).isTrue();
    }

    @Test
    public void inlinedEdgesCanBeIgnored() {
        FlowGraph graph = importGraph("digraph { A -> B; A -> C }");
        BlockNode a = node(graph, "A");
        BlockNode b = node(graph, "B");
        BlockNode c = node(graph, "C");
        a.getEdgeInfo(b).setInlined(true);

        assertThat(DominatorTree.postDominators(graph, false).getImmediateDominator(a)).isNull();
        assertThat(DominatorTree.postDominators(graph, true).getImmediateDominator(a)).isEqualTo(c);
    }

    @Test
    public void unreachableNodesAreNotDominated() {
        FlowGraph graph = importGraph(GraphFixtures.SEQUENCE);
        BlockNode orphan = graph.addEmptyNode("orphan");

        DominatorTree tree = DominatorTree.dominators(graph);

        assertThat(tree.isReachable(orphan)).isFalse();
        assertThat(tree.dominates(graph.getEntryNode(), orphan)).isFalse();
        assertThat(tree.isReachable(node(graph, "C"))).isTrue();
    }
}
