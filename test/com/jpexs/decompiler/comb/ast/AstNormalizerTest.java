package com.jpexs.decompiler.comb.ast;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.jpexs.decompiler.comb.cfg.BasicBlock;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AstNormalizerTest {

    private final BasicBlock a = new BasicBlock(0, "A");
    private final BasicBlock b = new BasicBlock(1, "B");
    private final BasicBlock c = new BasicBlock(2, "C");
    private final BasicBlock heavy = new BasicBlock(3, "H", 5);

    private AstTree tree;
    private AstNormalizer normalizer;

    @Before
    public void setUp() {
        tree = new AstTree();
        normalizer = new AstNormalizer(1);
    }

    private CodeNode code(BasicBlock block) {
        return tree.addNode(new CodeNode(block, null));
    }

    private IfNode ifNode(BasicBlock block, AstNode thenBranch, AstNode elseBranch) {
        return tree.addNode(new IfNode(block, tree.addCondExpr(new AtomicNode(block)), thenBranch, elseBranch, null));
    }

    private SequenceNode sequence(AstNode... nodes) {
        return tree.addNode(new SequenceNode(ImmutableList.copyOf(nodes)));
    }

    private AstNode normalizeRoot(AstNode... nodes) {
        tree.setRoot(sequence(nodes));
        normalizer.normalize(tree);
        return tree.getRoot();
    }

    @Test
    public void nestedSequencesAreFlattened() {
        SequenceNode root = (SequenceNode) normalizeRoot(sequence(code(a), sequence(code(b))), code(c));

        assertThat(root.length()).isEqualTo(3);
        assertThat(root.getNodeN(1).getBlock()).isEqualTo(b);
    }

    @Test
    public void statementsAfterBreakAreDropped() {
        ScsNode loop = tree.addNode(new ScsNode(sequence(sequence(code(a), tree.addNode(new BreakNode()), code(b))), null));

        normalizeRoot(loop, code(c));

        SequenceNode body = (SequenceNode) loop.getBody();
        assertThat(body.length()).isEqualTo(2);
        assertThat(body.getNodeN(1)).isInstanceOf(BreakNode.class);
        assertThat(loop.getLoopType()).isEqualTo(ScsNode.LoopType.STANDARD);
    }

    @Test
    public void statementsAfterTerminatingIfAreDropped() {
        IfNode condition = ifNode(a, tree.addNode(new BreakNode()), tree.addNode(new ContinueNode()));
        ScsNode loop = tree.addNode(new ScsNode(sequence(code(b), condition, code(c)), null));

        normalizeRoot(loop);

        // the trailing if turns the loop into a do-while over B and A
        assertThat(loop.isDoWhile()).isTrue();
        SequenceNode body = (SequenceNode) loop.getBody();
        assertThat(body.length()).isEqualTo(2);
        assertThat(body.getNodeN(1).getBlock()).isEqualTo(a);
    }

    @Test
    public void emptyThenIsSwappedWithElse() {
        IfNode condition = ifNode(a, null, code(b));

        normalizeRoot(condition);

        assertThat(condition.getThen().getBlock()).isEqualTo(b);
        assertThat(condition.getElse()).isNull();
        assertThat(condition.getCondition()).isInstanceOf(NotNode.class);
        assertThat(condition.getCondition().toString()).isEqualTo("!A");
    }

    @Test
    public void ifWithoutBranchesBecomesCode() {
        SequenceNode root = (SequenceNode) normalizeRoot(ifNode(a, null, null), code(b));

        assertThat(root.getNodeN(0)).isInstanceOf(CodeNode.class);
        assertThat(root.getNodeN(0).getBlock()).isEqualTo(a);
    }

    @Test
    public void nestedIfsBecomeAnd() {
        IfNode outer = ifNode(a, ifNode(b, code(c), null), null);

        normalizeRoot(outer);

        assertThat(outer.getCondition()).isInstanceOf(AndNode.class);
        assertThat(outer.getCondition().toString()).isEqualTo("(A && B)");
        assertThat(outer.getThen().getBlock()).isEqualTo(c);
    }

    @Test
    public void nestedIfsWithSameElseBecomeAnd() {
        IfNode outer = ifNode(a, ifNode(b, code(c), tree.addNode(new BreakNode())), tree.addNode(new BreakNode()));

        normalizeRoot(outer);

        assertThat(outer.getCondition()).isInstanceOf(AndNode.class);
        assertThat(outer.getThen().getBlock()).isEqualTo(c);
        assertThat(outer.getElse()).isInstanceOf(BreakNode.class);
    }

    @Test
    public void heavyInnerBlockIsNotMerged() {
        IfNode outer = ifNode(a, ifNode(heavy, code(c), null), null);

        normalizeRoot(outer);

        assertThat(outer.getCondition()).isInstanceOf(AtomicNode.class);
        assertThat(outer.getThen()).isInstanceOf(IfNode.class);
    }

    @Test
    public void weightLimitIsConfigurable() {
        normalizer = new AstNormalizer(5);
        IfNode outer = ifNode(a, ifNode(heavy, code(c), null), null);

        normalizeRoot(outer);

        assertThat(outer.getCondition()).isInstanceOf(AndNode.class);
    }

    @Test
    public void elseIfWithSameThenBecomesOr() {
        IfNode outer = ifNode(a, code(c), ifNode(b, code(c), code(a)));

        normalizeRoot(outer);

        assertThat(outer.getCondition()).isInstanceOf(OrNode.class);
        assertThat(outer.getCondition().toString()).isEqualTo("(A || B)");
        assertThat(outer.getThen().getBlock()).isEqualTo(c);
        assertThat(outer.getElse().getBlock()).isEqualTo(a);
    }

    @Test
    public void elseIfWithDifferentThenStays() {
        IfNode outer = ifNode(a, code(c), ifNode(b, code(b), null));

        normalizeRoot(outer);

        assertThat(outer.getCondition()).isInstanceOf(AtomicNode.class);
        assertThat(outer.getElse()).isInstanceOf(IfNode.class);
    }

    @Test
    public void trailingConditionalContinueMakesDoWhile() {
        ScsNode loop = tree.addNode(new ScsNode(sequence(code(a),
                ifNode(b, tree.addNode(new ContinueNode()), tree.addNode(new BreakNode()))), null));

        normalizeRoot(loop, code(c));

        assertThat(loop.isDoWhile()).isTrue();
        assertThat(loop.getRelatedCondition().getCondition().toString()).isEqualTo("B");
        SequenceNode body = (SequenceNode) loop.getBody();
        assertThat(body.length()).isEqualTo(2);
        assertThat(body.getNodeN(1)).isInstanceOf(CodeNode.class);
        assertThat(body.getNodeN(1).getBlock()).isEqualTo(b);
        assertThat(loop.toString()).contains("} while (B);");
    }

    @Test
    public void breakFirstConditionIsNegatedForDoWhile() {
        ScsNode loop = tree.addNode(new ScsNode(
                ifNode(b, tree.addNode(new BreakNode()), tree.addNode(new ContinueNode())), null));

        normalizeRoot(loop);

        assertThat(loop.isDoWhile()).isTrue();
        assertThat(loop.getRelatedCondition().getCondition().toString()).isEqualTo("!B");
        assertThat(loop.getBody()).isInstanceOf(CodeNode.class);
    }

    @Test
    public void otherContinuePreventsDoWhile() {
        ScsNode loop = tree.addNode(new ScsNode(sequence(
                ifNode(a, tree.addNode(new ContinueNode()), null),
                code(c),
                ifNode(b, tree.addNode(new ContinueNode()), tree.addNode(new BreakNode()))), null));

        normalizeRoot(loop);

        assertThat(loop.isDoWhile()).isFalse();
    }

    @Test
    public void leadingConditionalBreakMakesWhile() {
        ContinueNode continueNode = tree.addNode(new ContinueNode());
        IfNode condition = ifNode(a, tree.addNode(new BreakNode()), null);
        ScsNode loop = tree.addNode(new ScsNode(sequence(condition, code(b), continueNode), null));

        normalizeRoot(loop);

        assertThat(loop.isWhile()).isTrue();
        assertThat(loop.getRelatedCondition()).isSameInstanceAs(condition);
        assertThat(condition.getCondition().toString()).isEqualTo("!A");
        SequenceNode body = (SequenceNode) loop.getBody();
        assertThat(body.length()).isEqualTo(2);
        assertThat(body.getNodeN(0).getBlock()).isEqualTo(b);
        assertThat(continueNode.getComputationIf()).isSameInstanceAs(condition);
        assertThat(continueNode.isImplicit()).isTrue();
        assertThat(loop.toString()).startsWith("while (!A) {");
    }

    @Test
    public void continuingBranchOfWhileConditionOpensTheBody() {
        IfNode condition = ifNode(a, code(c), tree.addNode(new BreakNode()));
        ScsNode loop = tree.addNode(new ScsNode(sequence(condition, code(b)), null));

        normalizeRoot(loop);

        assertThat(loop.isWhile()).isTrue();
        assertThat(condition.getCondition().toString()).isEqualTo("A");
        SequenceNode body = (SequenceNode) loop.getBody();
        assertThat(body.getNodeN(0).getBlock()).isEqualTo(c);
        assertThat(body.getNodeN(1).getBlock()).isEqualTo(b);
    }

    @Test
    public void trailingContinuesOfStandardLoopAreImplicit() {
        ContinueNode thenContinue = tree.addNode(new ContinueNode());
        BreakNode elseBreak = tree.addNode(new BreakNode());
        ScsNode loop = tree.addNode(new ScsNode(sequence(code(a), ifNode(b,
                sequence(code(c), thenContinue), elseBreak)), null));

        normalizeRoot(loop);

        assertThat(loop.getLoopType()).isEqualTo(ScsNode.LoopType.STANDARD);
        assertThat(thenContinue.isImplicit()).isTrue();
        assertThat(loop.toString()).doesNotContain("continue;");
    }

    @Test
    public void loopBreakInsideSwitchIsMarked() {
        BreakNode loopBreak = tree.addNode(new BreakNode());
        SwitchNode switchNode = tree.addNode(SwitchNode.onBlock(a, null));
        switchNode.addCase(ImmutableList.of(1L), sequence(code(b), loopBreak));
        switchNode.setDefault(sequence(code(c), tree.addNode(new SwitchBreakNode())));
        ContinueNode continueNode = tree.addNode(new ContinueNode());
        ScsNode loop = tree.addNode(new ScsNode(sequence(switchNode, continueNode), null));

        normalizeRoot(loop);

        assertThat(loopBreak.isBreakFromWithinSwitch()).isTrue();
        assertThat(switchNode.needsLoopBreakDispatcher()).isTrue();
        assertThat(continueNode.isImplicit()).isTrue();
        assertThat(loop.toString()).contains("if (loop_break) {");
    }

    @Test
    public void switchBreakAloneNeedsNoDispatcher() {
        SwitchNode switchNode = tree.addNode(SwitchNode.onBlock(a, null));
        switchNode.addCase(ImmutableList.of(1L), sequence(code(b), tree.addNode(new SwitchBreakNode())));
        ScsNode loop = tree.addNode(new ScsNode(sequence(switchNode, tree.addNode(new BreakNode())), null));

        normalizeRoot(loop);

        assertThat(switchNode.needsLoopBreakDispatcher()).isFalse();
    }

    @Test
    public void breakOfInnerLoopDoesNotMarkOuterSwitch() {
        BreakNode innerBreak = tree.addNode(new BreakNode());
        ScsNode inner = tree.addNode(new ScsNode(sequence(code(c), innerBreak), null));
        SwitchNode switchNode = tree.addNode(SwitchNode.onBlock(a, null));
        switchNode.addCase(ImmutableList.of(1L), sequence(inner, tree.addNode(new SwitchBreakNode())));
        ScsNode outer = tree.addNode(new ScsNode(sequence(switchNode, tree.addNode(new BreakNode())), null));

        normalizeRoot(outer);

        assertThat(innerBreak.isBreakFromWithinSwitch()).isFalse();
        assertThat(switchNode.needsLoopBreakDispatcher()).isFalse();
    }

    @Test
    public void terminatesChecksEveryPath() {
        BreakNode breakNode = tree.addNode(new BreakNode());
        assertThat(AstNormalizer.terminates(breakNode, true)).isTrue();
        assertThat(AstNormalizer.terminates(ifNode(a, breakNode, null), true)).isFalse();
        assertThat(AstNormalizer.terminates(ifNode(a, breakNode, tree.addNode(new ContinueNode())), true)).isTrue();
        assertThat(AstNormalizer.terminates(tree.addNode(new SwitchBreakNode()), false)).isFalse();

        SwitchNode switchNode = tree.addNode(SwitchNode.onBlock(a, null));
        switchNode.addCase(ImmutableList.of(1L), tree.addNode(new ContinueNode()));
        assertThat(AstNormalizer.terminates(switchNode, true)).isFalse();
        switchNode.setDefault(tree.addNode(new BreakNode()));
        assertThat(AstNormalizer.terminates(switchNode, true)).isTrue();
    }
}
