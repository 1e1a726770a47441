package com.jpexs.decompiler.comb.ast;

import com.google.common.base.Verify;
import com.jpexs.decompiler.comb.graph.BlockNode;
import com.jpexs.decompiler.comb.graph.DominatorTree;
import com.jpexs.decompiler.comb.graph.EdgeInfo;
import com.jpexs.decompiler.comb.graph.FlowGraph;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the AST of an acyclic flow graph whose loops have been collapsed.
 * <p>
 * Every conditional construct extends up to the immediate post-dominator of
 * its node, which becomes the successor of the construct. Nodes reachable
 * along several paths before that point are emitted once per path. Each
 * collapsed region is built once and copied wherever it occurs.
 *
 * @author JPEXS
 */
public class AstBuilder {

    private static final Logger logger = LoggerFactory.getLogger(AstBuilder.class);

    private final Map<FlowGraph, AstTree> regionTrees = new IdentityHashMap<>();
    private int tentativeUntangles;
    private int performedUntangles;

    /**
     * Builds the AST of a graph and, recursively, of all its collapsed regions.
     *
     * @param graph acyclic graph
     * @return the tree, whose root is always a sequence
     */
    public AstTree build(FlowGraph graph) {
        AstTree tree = regionTrees.get(graph);
        if (tree != null) {
            return tree;
        }
        tree = new AstTree();
        if (graph.getEntryNode() == null) {
            tree.setRoot(tree.addNode(new SequenceNode(Collections.emptyList())));
            regionTrees.put(graph, tree);
            return tree;
        }

        markInlinedEdges(graph);
        DominatorTree postDominatorTree = DominatorTree.postDominators(graph, true);
        countUntangles(graph, postDominatorTree);

        RegionTranslation translation = new RegionTranslation(tree, postDominatorTree);
        AstNode first = translation.translate(graph.getEntryNode(), null);
        tree.setRoot(createSequences(tree, first, true));
        regionTrees.put(graph, tree);
        if (logger.isDebugEnabled()) {
            logger.debug("AST of {} {}:\n{}", graph.getFunctionName(), graph.getRegionName(), tree);
        }
        return tree;
    }

    /**
     * Gets the number of conditional nodes whose branches do not reconverge.
     */
    public int getTentativeUntangles() {
        return tentativeUntangles;
    }

    /**
     * Gets the number of conditional nodes whose branches do not reconverge
     * but share nodes, which therefore got duplicated.
     */
    public int getPerformedUntangles() {
        return performedUntangles;
    }

    /**
     * Marks edges (n, s) where n is the only predecessor of s and s dominates
     * everything reachable from it. Such a successor never reconverges with
     * the rest of the graph.
     *
     * @param graph acyclic graph
     */
    public static void markInlinedEdges(FlowGraph graph) {
        DominatorTree dominatorTree = DominatorTree.dominators(graph);
        for (BlockNode node : graph.getNodes()) {
            for (BlockNode succ : node.getSuccessors()) {
                EdgeInfo info = node.getEdgeInfo(succ);
                if (succ.predecessorCount() != 1) {
                    info.setInlined(false);
                    continue;
                }
                boolean dominatesAll = true;
                for (BlockNode reachable : graph.getReachableNodes(succ)) {
                    if (!dominatorTree.dominates(succ, reachable)) {
                        dominatesAll = false;
                        break;
                    }
                }
                info.setInlined(dominatesAll);
            }
        }
    }

    private void countUntangles(FlowGraph graph, DominatorTree postDominatorTree) {
        for (BlockNode node : graph.getNodes()) {
            List<BlockNode> branches = new ArrayList<>();
            for (BlockNode succ : node.getSuccessors()) {
                if (!node.getEdgeInfo(succ).isInlined()) {
                    branches.add(succ);
                }
            }
            if (branches.size() < 2 || postDominatorTree.getImmediateDominator(node) != null) {
                continue;
            }
            tentativeUntangles++;
            if (branchesShareNodes(graph, branches)) {
                performedUntangles++;
            }
        }
    }

    private static boolean branchesShareNodes(FlowGraph graph, List<BlockNode> branches) {
        List<Set<BlockNode>> reachableSets = new ArrayList<>();
        for (BlockNode branch : branches) {
            reachableSets.add(graph.getReachableNodes(branch));
        }
        for (int i = 0; i < reachableSets.size(); i++) {
            for (int j = i + 1; j < reachableSets.size(); j++) {
                if (!Collections.disjoint(reachableSets.get(i), reachableSets.get(j))) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Translation of one region graph into chained AST nodes.
     */
    private class RegionTranslation {

        private final AstTree tree;
        private final DominatorTree postDominatorTree;

        RegionTranslation(AstTree tree, DominatorTree postDominatorTree) {
            this.tree = tree;
            this.postDominatorTree = postDominatorTree;
        }

        AstNode translate(BlockNode node, BlockNode stop) {
            if (node == null || node == stop) {
                return null;
            }
            switch (node.getType()) {
                case EMPTY:
                    Verify.verify(node.successorCount() <= 1, "Empty node %s has %s successors", node, node.successorCount());
                    return node.successorCount() == 0 ? null : translate(node.getSuccessor(0), stop);
                case BREAK:
                    Verify.verify(node.successorCount() == 0, "Break node %s has successors", node);
                    return tree.addNode(new BreakNode());
                case CONTINUE:
                    Verify.verify(node.successorCount() == 0, "Continue node %s has successors", node);
                    return tree.addNode(new ContinueNode());
                case SET:
                    return tree.addNode(new SetNode(node.getStateVariable(), node.getStateValue(), translateSingle(node, stop)));
                case COLLAPSED:
                    AstTree regionTree = build(node.getCollapsedGraph());
                    AstNode body = tree.copyFrom(regionTree);
                    return tree.addNode(new ScsNode(body, translateSingle(node, stop)));
                case DISPATCHER:
                    return translateSwitch(node, stop);
                default:
                    if (node.successorCount() <= 1) {
                        return tree.addNode(new CodeNode(node.getBlock(), translateSingle(node, stop)));
                    }
                    if (node.successorCount() == 2 && !hasLabels(node)) {
                        return translateIf(node, stop);
                    }
                    return translateSwitch(node, stop);
            }
        }

        private AstNode translateSingle(BlockNode node, BlockNode stop) {
            Verify.verify(node.successorCount() <= 1, "Node %s has %s successors", node, node.successorCount());
            return node.successorCount() == 0 ? null : translate(node.getSuccessor(0), stop);
        }

        private boolean hasLabels(BlockNode node) {
            for (BlockNode succ : node.getSuccessors()) {
                if (node.getEdgeInfo(succ).hasLabels()) {
                    return true;
                }
            }
            return false;
        }

        private AstNode translateIf(BlockNode node, BlockNode stop) {
            BlockNode postDominator = postDominatorTree.getImmediateDominator(node);
            BlockNode branchStop = postDominator != null ? postDominator : stop;
            AstNode thenBranch = translate(node.getSuccessor(0), branchStop);
            AstNode elseBranch = translate(node.getSuccessor(1), branchStop);
            AstNode successor = postDominator != null ? translate(postDominator, stop) : null;
            ExprNode condition = tree.addCondExpr(new AtomicNode(node.getBlock()));
            return tree.addNode(new IfNode(node.getBlock(), condition, thenBranch, elseBranch, successor));
        }

        private AstNode translateSwitch(BlockNode node, BlockNode stop) {
            BlockNode postDominator = postDominatorTree.getImmediateDominator(node);
            BlockNode branchStop = postDominator != null ? postDominator : stop;
            SwitchNode switchNode = node.isDispatcher()
                    ? SwitchNode.onStateVariable(node.getStateVariable(), null)
                    : SwitchNode.onBlock(node.getBlock(), null);
            for (BlockNode succ : node.getSuccessors()) {
                AstNode body = appendSwitchBreak(translate(succ, branchStop));
                EdgeInfo info = node.getEdgeInfo(succ);
                if (info.hasLabels()) {
                    switchNode.addCase(info.getLabels(), body);
                } else {
                    Verify.verify(switchNode.getDefault() == null, "Switch %s has more than one default", node);
                    switchNode.setDefault(body);
                }
            }
            switchNode.setSuccessor(postDominator != null ? translate(postDominator, stop) : null);
            return tree.addNode(switchNode);
        }

        private AstNode appendSwitchBreak(AstNode chain) {
            if (chain == null) {
                return tree.addNode(new SwitchBreakNode());
            }
            AstNode last = chain;
            while (last.getSuccessor() != null) {
                last = last.getSuccessor();
            }
            if (!last.isJump()) {
                last.setSuccessor(tree.addNode(new SwitchBreakNode()));
            }
            return chain;
        }
    }

    /**
     * Turns successor chains into sequences, recursively. Chains of one node
     * stay bare unless a sequence is forced.
     */
    static AstNode createSequences(AstTree tree, AstNode head, boolean forceSequence) {
        List<AstNode> items = new ArrayList<>();
        AstNode node = head;
        while (node != null) {
            AstNode next = node.getSuccessor();
            node.setSuccessor(null);
            createChildSequences(tree, node);
            if (node instanceof SequenceNode) {
                items.addAll(((SequenceNode) node).getNodes());
            } else {
                items.add(node);
            }
            node = next;
        }
        if (items.size() == 1 && !forceSequence) {
            return items.get(0);
        }
        if (items.isEmpty() && !forceSequence) {
            return null;
        }
        return tree.addNode(new SequenceNode(items));
    }

    private static void createChildSequences(AstTree tree, AstNode node) {
        switch (node.getKind()) {
            case IF:
                IfNode ifNode = (IfNode) node;
                ifNode.setThen(createSequences(tree, ifNode.getThen(), false));
                ifNode.setElse(createSequences(tree, ifNode.getElse(), false));
                break;
            case SCS:
                ScsNode scs = (ScsNode) node;
                scs.setBody(createSequences(tree, scs.getBody(), false));
                break;
            case SWITCH:
                SwitchNode switchNode = (SwitchNode) node;
                for (SwitchNode.Case switchCase : switchNode.getCases()) {
                    switchCase.setBody(createSequences(tree, switchCase.getBody(), false));
                }
                switchNode.setDefault(createSequences(tree, switchNode.getDefault(), false));
                break;
            case SEQUENCE:
                for (AstNode item : ((SequenceNode) node).getNodes()) {
                    createChildSequences(tree, item);
                }
                break;
            default:
                break;
        }
    }
}
