package com.jpexs.decompiler.comb.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simplifies a freshly built AST: flattens sequences, drops unreachable
 * statements, combines nested conditions, recognizes while and do-while loops
 * and marks the breaks and continues that need special handling when printed.
 *
 * @author JPEXS
 */
public class AstNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(AstNormalizer.class);

    private final int shortCircuitMaxWeight;

    /**
     * Creates a normalizer.
     *
     * @param shortCircuitMaxWeight maximum weight of a block whose condition
     * may be merged into the condition of an enclosing if
     */
    public AstNormalizer(int shortCircuitMaxWeight) {
        this.shortCircuitMaxWeight = shortCircuitMaxWeight;
    }

    public void normalize(AstTree tree) {
        tree.setRoot(simplify(tree, tree.getRoot(), true));
        shortCircuit(tree, tree.getRoot());
        classifyLoops(tree, tree.getRoot());
        tree.setRoot(simplify(tree, tree.getRoot(), true));
        markImplicitContinues(tree.getRoot());
        markSwitchBreaks(tree.getRoot(), new ArrayDeque<>());
        if (logger.isDebugEnabled()) {
            logger.debug("Normalized AST:\n{}", tree);
        }
    }

    static List<AstNode> elements(AstNode node) {
        List<AstNode> result = new ArrayList<>();
        if (node instanceof SequenceNode) {
            result.addAll(((SequenceNode) node).getNodes());
        } else if (node != null) {
            result.add(node);
        }
        return result;
    }

    private static AstNode fromElements(AstTree tree, List<AstNode> items, boolean forceSequence) {
        if (items.size() == 1 && !forceSequence) {
            return items.get(0);
        }
        if (items.isEmpty() && !forceSequence) {
            return null;
        }
        return tree.addNode(new SequenceNode(items));
    }

    /**
     * Checks whether every path through the node ends in a jump.
     *
     * @param node the node
     * @param switchBreakTerminates whether leaving the enclosing switch counts
     * @return true when control never falls through the node
     */
    static boolean terminates(AstNode node, boolean switchBreakTerminates) {
        if (node == null) {
            return false;
        }
        switch (node.getKind()) {
            case BREAK:
            case CONTINUE:
                return true;
            case SWITCH_BREAK:
                return switchBreakTerminates;
            case SEQUENCE:
                List<AstNode> items = ((SequenceNode) node).getNodes();
                return !items.isEmpty() && terminates(items.get(items.size() - 1), switchBreakTerminates);
            case IF:
                IfNode ifNode = (IfNode) node;
                return terminates(ifNode.getThen(), switchBreakTerminates) && terminates(ifNode.getElse(), switchBreakTerminates);
            case SWITCH:
                SwitchNode switchNode = (SwitchNode) node;
                if (switchNode.getDefault() == null || !terminates(switchNode.getDefault(), false)) {
                    return false;
                }
                for (SwitchNode.Case switchCase : switchNode.getCases()) {
                    if (!terminates(switchCase.getBody(), false)) {
                        return false;
                    }
                }
                return true;
            default:
                return false;
        }
    }

    private static ExprNode negate(AstTree tree, ExprNode condition) {
        if (condition instanceof NotNode) {
            return ((NotNode) condition).getChild();
        }
        return tree.addCondExpr(new NotNode(condition));
    }

    /**
     * Flattens nested sequences, drops statements following a jump and
     * collapses one-element sequences, bottom-up.
     */
    AstNode simplify(AstTree tree, AstNode node, boolean forceSequence) {
        if (node == null) {
            return forceSequence ? tree.addNode(new SequenceNode(Collections.emptyList())) : null;
        }
        AstNode result = node;
        switch (node.getKind()) {
            case SEQUENCE:
                List<AstNode> items = new ArrayList<>();
                for (AstNode item : ((SequenceNode) node).getNodes()) {
                    AstNode simplified = simplify(tree, item, false);
                    if (simplified != null) {
                        items.addAll(elements(simplified));
                    }
                }
                for (int i = 0; i < items.size() - 1; i++) {
                    if (terminates(items.get(i), true)) {
                        items.subList(i + 1, items.size()).clear();
                        break;
                    }
                }
                return fromElements(tree, items, forceSequence);
            case IF:
                IfNode ifNode = (IfNode) node;
                ifNode.setThen(simplify(tree, ifNode.getThen(), false));
                ifNode.setElse(simplify(tree, ifNode.getElse(), false));
                if (ifNode.getThen() == null && ifNode.getElse() != null) {
                    ifNode.swapBranches();
                    ifNode.setCondition(negate(tree, ifNode.getCondition()));
                }
                if (ifNode.getThen() == null && ifNode.getCondition() instanceof AtomicNode) {
                    result = tree.addNode(new CodeNode(ifNode.getBlock(), null));
                }
                break;
            case SCS:
                ScsNode scs = (ScsNode) node;
                AstNode body = simplify(tree, scs.getBody(), false);
                scs.setBody(body == null ? tree.addNode(new SequenceNode(Collections.emptyList())) : body);
                break;
            case SWITCH:
                SwitchNode switchNode = (SwitchNode) node;
                for (SwitchNode.Case switchCase : switchNode.getCases()) {
                    switchCase.setBody(simplify(tree, switchCase.getBody(), false));
                }
                switchNode.setDefault(simplify(tree, switchNode.getDefault(), false));
                break;
            default:
                break;
        }
        if (forceSequence) {
            return tree.addNode(new SequenceNode(Collections.singletonList(result)));
        }
        return result;
    }

    /**
     * Merges nested ifs into short-circuit conditions, bottom-up. Only inner
     * blocks light enough to be part of a condition are merged.
     */
    void shortCircuit(AstTree tree, AstNode node) {
        if (node == null) {
            return;
        }
        for (AstNode child : node.getChildren()) {
            shortCircuit(tree, child);
        }
        if (!(node instanceof IfNode)) {
            return;
        }
        IfNode outer = (IfNode) node;
        boolean changed = true;
        while (changed) {
            changed = false;
            if (outer.getThen() instanceof IfNode && isLight(outer.getThen())) {
                IfNode inner = (IfNode) outer.getThen();
                if (outer.getElse() == null && inner.getElse() == null) {
                    // if (a) { if (b) { x } }
                    outer.setCondition(tree.addCondExpr(new AndNode(outer.getCondition(), inner.getCondition())));
                    outer.setThen(inner.getThen());
                    changed = true;
                } else if (outer.getElse() != null && outer.getElse().isEqual(inner.getElse())) {
                    // if (a) { if (b) { x } else { y } } else { y }
                    outer.setCondition(tree.addCondExpr(new AndNode(outer.getCondition(), inner.getCondition())));
                    outer.setThen(inner.getThen());
                    changed = true;
                }
            }
            if (!changed && outer.getElse() instanceof IfNode && isLight(outer.getElse())) {
                IfNode inner = (IfNode) outer.getElse();
                if (outer.getThen() != null && outer.getThen().isEqual(inner.getThen())) {
                    // if (a) { x } else { if (b) { x } else { y } }
                    outer.setCondition(tree.addCondExpr(new OrNode(outer.getCondition(), inner.getCondition())));
                    outer.setElse(inner.getElse());
                    changed = true;
                }
            }
        }
    }

    private boolean isLight(AstNode node) {
        return node.getBlock() != null && node.getBlock().getWeight() <= shortCircuitMaxWeight;
    }

    /**
     * Recognizes do-while and while loops, inner loops first.
     */
    void classifyLoops(AstTree tree, AstNode node) {
        if (node == null) {
            return;
        }
        for (AstNode child : node.getChildren()) {
            classifyLoops(tree, child);
        }
        if (node instanceof ScsNode) {
            ScsNode scs = (ScsNode) node;
            if (!tryDoWhile(tree, scs)) {
                tryWhile(tree, scs);
            }
        }
    }

    private boolean tryDoWhile(AstTree tree, ScsNode scs) {
        List<AstNode> body = elements(scs.getBody());
        if (body.isEmpty() || !(body.get(body.size() - 1) instanceof IfNode)) {
            return false;
        }
        IfNode condition = (IfNode) body.get(body.size() - 1);
        AstNode thenBranch = condition.getThen();
        AstNode elseBranch = condition.getElse();
        boolean continueBreak = thenBranch instanceof ContinueNode && elseBranch instanceof BreakNode;
        boolean breakContinue = thenBranch instanceof BreakNode && elseBranch instanceof ContinueNode;
        if (!continueBreak && !breakContinue) {
            return false;
        }
        List<ContinueNode> continues = new ArrayList<>();
        for (int i = 0; i < body.size() - 1; i++) {
            collectLoopContinues(body.get(i), continues);
        }
        if (!continues.isEmpty()) {
            return false;
        }
        if (breakContinue) {
            condition.swapBranches();
            condition.setCondition(negate(tree, condition.getCondition()));
        }
        scs.setDoWhile(condition);
        body.set(body.size() - 1, tree.addNode(new CodeNode(condition.getBlock(), null)));
        scs.setBody(fromElements(tree, body, false));
        return true;
    }

    private boolean tryWhile(AstTree tree, ScsNode scs) {
        List<AstNode> body = elements(scs.getBody());
        if (body.isEmpty() || !(body.get(0) instanceof IfNode)) {
            return false;
        }
        IfNode condition = (IfNode) body.get(0);
        if (condition.getThen() instanceof BreakNode) {
            condition.swapBranches();
            condition.setCondition(negate(tree, condition.getCondition()));
        }
        if (!(condition.getElse() instanceof BreakNode)) {
            return false;
        }
        List<AstNode> newBody = elements(condition.getThen());
        newBody.addAll(body.subList(1, body.size()));
        condition.setThen(null);
        condition.setElse(null);
        scs.setWhile(condition);
        scs.setBody(newBody.isEmpty() ? tree.addNode(new SequenceNode(Collections.emptyList())) : fromElements(tree, newBody, false));

        List<ContinueNode> continues = new ArrayList<>();
        collectLoopContinues(scs.getBody(), continues);
        for (ContinueNode continueNode : continues) {
            continueNode.addComputationIfNode(condition);
        }
        return true;
    }

    /**
     * Collects continue nodes belonging to the loop being examined, not
     * descending into nested loops.
     */
    private static void collectLoopContinues(AstNode node, List<ContinueNode> result) {
        if (node == null || node instanceof ScsNode) {
            return;
        }
        if (node instanceof ContinueNode) {
            result.add((ContinueNode) node);
            return;
        }
        for (AstNode child : node.getChildren()) {
            collectLoopContinues(child, result);
        }
    }

    /**
     * Marks continues at the very end of standard and while loop bodies.
     */
    void markImplicitContinues(AstNode node) {
        if (node == null) {
            return;
        }
        for (AstNode child : node.getChildren()) {
            markImplicitContinues(child);
        }
        if (node instanceof ScsNode && !((ScsNode) node).isDoWhile()) {
            markTrailingContinue(((ScsNode) node).getBody());
        }
    }

    private static void markTrailingContinue(AstNode node) {
        if (node instanceof ContinueNode) {
            ((ContinueNode) node).setImplicit(true);
        } else if (node instanceof SequenceNode) {
            List<AstNode> items = ((SequenceNode) node).getNodes();
            if (!items.isEmpty()) {
                markTrailingContinue(items.get(items.size() - 1));
            }
        } else if (node instanceof IfNode) {
            markTrailingContinue(((IfNode) node).getThen());
            markTrailingContinue(((IfNode) node).getElse());
        }
    }

    /**
     * Marks loop breaks nested in switches of the same loop and the switches
     * they have to pass.
     *
     * @param node current node
     * @param switches switches entered since the innermost loop
     */
    void markSwitchBreaks(AstNode node, Deque<SwitchNode> switches) {
        if (node == null) {
            return;
        }
        if (node instanceof BreakNode) {
            if (!switches.isEmpty()) {
                ((BreakNode) node).setBreakFromWithinSwitch(true);
                for (SwitchNode switchNode : switches) {
                    switchNode.setNeedsLoopBreakDispatcher(true);
                }
            }
            return;
        }
        if (node instanceof ScsNode) {
            markSwitchBreaks(((ScsNode) node).getBody(), new ArrayDeque<>());
            return;
        }
        if (node instanceof SwitchNode) {
            switches.push((SwitchNode) node);
            for (AstNode child : node.getChildren()) {
                markSwitchBreaks(child, switches);
            }
            switches.pop();
            return;
        }
        for (AstNode child : node.getChildren()) {
            markSwitchBreaks(child, switches);
        }
    }
}
