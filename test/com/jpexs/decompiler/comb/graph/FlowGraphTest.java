package com.jpexs.decompiler.comb.graph;

import static com.google.common.truth.Truth.assertThat;
import static com.jpexs.decompiler.comb.GraphFixtures.importGraph;
import static com.jpexs.decompiler.comb.GraphFixtures.node;

import com.google.common.collect.ImmutableList;
import com.jpexs.decompiler.comb.GraphFixtures;
import com.jpexs.decompiler.comb.cfg.BasicBlock;
import com.jpexs.decompiler.comb.cfg.BlockEdge;
import com.jpexs.decompiler.comb.cfg.ControlFlowGraph;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Set;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class FlowGraphTest {

    @Test
    public void importPutsDirectLegLast() {
        ControlFlowGraph cfg = new ControlFlowGraph("f", 0);
        BasicBlock a = cfg.addBlock(new BasicBlock(0, "A"));
        cfg.addBlock(new BasicBlock(1, "B"));
        cfg.addBlock(new BasicBlock(2, "C"));
        a.addSuccessor(new BlockEdge(1, true, Collections.emptyList()));
        a.addSuccessor(new BlockEdge(2, false, Collections.emptyList()));

        FlowGraph graph = FlowGraph.fromControlFlowGraph(cfg);

        BlockNode entry = graph.getEntryNode();
        assertThat(entry.getName()).isEqualTo("A");
        assertThat(entry.getSuccessor(0).getName()).isEqualTo("C");
        assertThat(entry.getSuccessor(1).getName()).isEqualTo("B");
    }

    @Test
    public void importMergesParallelEdges() {
        ControlFlowGraph cfg = new ControlFlowGraph("f", 0);
        BasicBlock a = cfg.addBlock(new BasicBlock(0, "A"));
        cfg.addBlock(new BasicBlock(1, "B"));
        a.addSuccessor(new BlockEdge(1, false, ImmutableList.of(1L)));
        a.addSuccessor(new BlockEdge(1, false, ImmutableList.of(2L)));

        FlowGraph graph = FlowGraph.fromControlFlowGraph(cfg);

        BlockNode entry = graph.getEntryNode();
        assertThat(entry.successorCount()).isEqualTo(1);
        assertThat(entry.getEdgeInfo(entry.getSuccessor(0)).getLabels()).containsExactly(1L, 2L);
    }

    @Test
    public void importPrependsEntryWhenEntryIsLoopHead() {
        FlowGraph graph = importGraph("digraph { A -> B; B -> A; B -> C }");

        BlockNode entry = graph.getEntryNode();
        assertThat(entry.isEmpty()).isTrue();
        assertThat(entry.getSuccessors()).containsExactly(node(graph, "A"));
    }

    @Test
    public void importDropsUnreachableBlocks() {
        FlowGraph graph = importGraph("digraph { A -> B; X -> B }");

        assertThat(graph.size()).isEqualTo(2);
        assertThat(graph.getEntryNode().getName()).isEqualTo("A");
    }

    @Test
    public void importOfEmptyFunctionHasNoEntry() {
        FlowGraph graph = FlowGraph.fromControlFlowGraph(new ControlFlowGraph("empty", 0));

        assertThat(graph.getEntryNode()).isNull();
        assertThat(graph.size()).isEqualTo(0);
        assertThat(graph.isDag()).isTrue();
    }

    @Test
    public void moveEdgeTargetKeepsPositionAndLabels() {
        FlowGraph graph = importGraph("digraph { A -> B [cases=\"1\"]; A -> C; B; C; }");
        BlockNode a = node(graph, "A");
        BlockNode b = node(graph, "B");
        BlockNode replacement = graph.addEmptyNode("replacement");

        graph.moveEdgeTarget(a, b, replacement);

        assertThat(a.getSuccessors()).containsExactly(replacement, node(graph, "C")).inOrder();
        assertThat(a.getEdgeInfo(replacement).getLabels()).containsExactly(1L);
        assertThat(b.getPredecessors()).isEmpty();
        assertThat(replacement.getPredecessors()).containsExactly(a);
    }

    @Test
    public void moveEdgeTargetMergesWithExistingEdge() {
        FlowGraph graph = importGraph("digraph { A -> B [cases=\"1\"]; A -> C [cases=\"2\"] }");
        BlockNode a = node(graph, "A");
        BlockNode c = node(graph, "C");

        graph.moveEdgeTarget(a, node(graph, "B"), c);

        assertThat(a.getSuccessors()).containsExactly(c);
        assertThat(a.getEdgeInfo(c).getLabels()).containsExactly(1L, 2L);
        assertThat(c.getPredecessors()).containsExactly(a);
    }

    @Test
    public void backedgesOfSelfLoop() {
        FlowGraph graph = importGraph(GraphFixtures.SELF_LOOP);
        BlockNode b = node(graph, "B");

        Set<Edge> backedges = graph.getBackedges();

        assertThat(backedges).containsExactly(new Edge(b, b));
        assertThat(graph.isDag()).isFalse();
        assertThat(importGraph(GraphFixtures.DIAMOND).isDag()).isTrue();
    }

    @Test
    public void reversePostOrderOfDiamond() {
        FlowGraph graph = importGraph(GraphFixtures.DIAMOND);

        List<BlockNode> order = graph.reversePostOrder();

        assertThat(order).containsExactly(node(graph, "A"), node(graph, "C"), node(graph, "B"), node(graph, "D")).inOrder();
    }

    @Test
    public void removeNotReachablesReturnsRemovedNodes() {
        FlowGraph graph = importGraph(GraphFixtures.SEQUENCE);
        BlockNode orphan = graph.addEmptyNode("orphan");
        graph.addPlainEdge(orphan, node(graph, "C"));

        Set<BlockNode> removed = graph.removeNotReachables();

        assertThat(removed).containsExactly(orphan);
        assertThat(graph.containsNode(orphan)).isFalse();
        assertThat(node(graph, "C").getPredecessors()).containsExactly(node(graph, "B"));
    }

    @Test
    public void cloneOfCollapsedNodeCopiesNestedGraph() {
        FlowGraph graph = importGraph(GraphFixtures.SEQUENCE);
        FlowGraph nested = graph.createNestedGraph("region 1");
        BlockNode inner = nested.addBreakNode();
        nested.setEntryNode(inner);
        BlockNode collapsed = graph.addCollapsedNode(nested);

        BlockNode clone = graph.cloneNode(collapsed, "clone");

        assertThat(clone.isCollapsed()).isTrue();
        assertThat(clone.getCollapsedGraph()).isNotSameInstanceAs(nested);
        assertThat(clone.getCollapsedGraph().size()).isEqualTo(1);
        assertThat(clone.getCollapsedGraph().getEntryNode().isBreak()).isTrue();
        assertThat(clone.getId()).isNotEqualTo(collapsed.getId());
    }

    @Test
    public void insertBulkNodesEndsLeavingEdgesInBreaks() {
        FlowGraph graph = importGraph(GraphFixtures.SELF_LOOP);
        BlockNode b = node(graph, "B");
        FlowGraph nested = graph.createNestedGraph("region 1");

        nested.insertBulkNodes(ImmutableList.of(b), b, new HashMap<>());
        nested.connectContinueNode();

        BlockNode entry = nested.getEntryNode();
        assertThat(entry.getName()).isEqualTo("B");
        assertThat(entry.successorCount()).isEqualTo(2);
        assertThat(entry.getSuccessor(0).isContinue()).isTrue();
        assertThat(entry.getSuccessor(1).isBreak()).isTrue();
        assertThat(nested.isDag()).isTrue();
    }

    @Test
    public void weightOfCollapsedNodeSumsNestedCode() {
        FlowGraph graph = importGraph("digraph { A [weight=4]; B [weight=2]; A -> B }");
        FlowGraph nested = graph.createNestedGraph("region 1");
        nested.insertBulkNodes(graph.getNodes(), graph.getEntryNode(), new HashMap<>());

        BlockNode collapsed = graph.addCollapsedNode(nested);

        assertThat(collapsed.getWeight()).isEqualTo(6);
        assertThat(graph.addSetNode(0, 1).getWeight()).isEqualTo(0);
    }
}
