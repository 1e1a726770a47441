package com.jpexs.decompiler.comb.ast;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.jpexs.decompiler.comb.cfg.BasicBlock;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AstTreeTest {

    private final BasicBlock a = new BasicBlock(0, "A");
    private final BasicBlock b = new BasicBlock(1, "B");
    private final BasicBlock c = new BasicBlock(2, "C");

    private AstTree sampleTree() {
        AstTree tree = new AstTree();
        IfNode condition = tree.addNode(new IfNode(b, tree.addCondExpr(new AtomicNode(b)), null, null, null));
        ContinueNode continueNode = tree.addNode(new ContinueNode());
        continueNode.addComputationIfNode(condition);
        SequenceNode thenBranch = tree.addNode(new SequenceNode(ImmutableList.of(
                tree.addNode(new CodeNode(c, null)), continueNode)));
        ScsNode loop = tree.addNode(new ScsNode(thenBranch, null));
        loop.setWhile(condition);
        tree.setRoot(tree.addNode(new SequenceNode(ImmutableList.of(
                tree.addNode(new CodeNode(a, null)), loop))));
        return tree;
    }

    @Test
    public void idsAreDense() {
        AstTree tree = sampleTree();

        List<AstNode> nodes = tree.getNodes();
        for (int i = 0; i < nodes.size(); i++) {
            assertThat(nodes.get(i).getId()).isEqualTo(i);
        }
        assertThat(tree.size()).isEqualTo(nodes.size());
    }

    @Test
    public void copyIsEqualButShared() {
        AstTree original = sampleTree();
        AstTree copy = new AstTree();
        copy.addNode(new CodeNode(a, null));

        copy.setRoot(copy.copyFrom(original));

        assertThat(copy.isEqual(original)).isTrue();
        assertThat(copy.size()).isEqualTo(original.size() + 1);

        Set<AstNode> originalNodes = Collections.newSetFromMap(new IdentityHashMap<>());
        originalNodes.addAll(original.getNodes());
        for (AstNode node : copy.reachableNodes()) {
            assertThat(originalNodes.contains(node)).isFalse();
        }
    }

    @Test
    public void copyRedirectsInternalPointers() {
        AstTree original = sampleTree();
        AstTree copy = new AstTree();

        copy.setRoot(copy.copyFrom(original));

        ScsNode loop = (ScsNode) ((SequenceNode) copy.getRoot()).getNodeN(1);
        ContinueNode continueNode = (ContinueNode) ((SequenceNode) loop.getBody()).getNodeN(1);
        assertThat(continueNode.getComputationIf()).isSameInstanceAs(loop.getRelatedCondition());
        assertThat(copy.getNodes()).contains(loop.getRelatedCondition());
        assertThat(original.getNodes()).doesNotContain(loop.getRelatedCondition());
        assertThat(copy.getCondExprs()).contains(loop.getRelatedCondition().getCondition());
    }

    @Test
    public void reachableNodesArePreOrder() {
        AstTree tree = sampleTree();

        List<AstNode> reachable = tree.reachableNodes();

        assertThat(reachable.get(0)).isSameInstanceAs(tree.getRoot());
        assertThat(reachable.get(1).getBlock()).isEqualTo(a);
        assertThat(reachable.get(2).getKind()).isEqualTo(AstNode.Kind.SCS);
        assertThat(reachable).hasSize(6);
    }

    @Test
    public void structuralEquality() {
        AstTree tree = new AstTree();
        CodeNode first = tree.addNode(new CodeNode(a, null));
        CodeNode second = tree.addNode(new CodeNode(a, null));
        CodeNode other = tree.addNode(new CodeNode(b, null));

        assertThat(first.isEqual(second)).isTrue();
        assertThat(first.isEqual(other)).isFalse();
        assertThat(first.isEqual(null)).isFalse();
        assertThat(new BreakNode().isEqual(new SwitchBreakNode())).isFalse();
    }
}
