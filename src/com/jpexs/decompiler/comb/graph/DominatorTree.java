package com.jpexs.decompiler.comb.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dominator or post-dominator tree of a flow graph.
 * <p>
 * Both trees are rooted in a virtual node: the forward tree in a virtual
 * source above the entry, the post-dominator tree in a virtual sink below
 * every exit. The virtual node is reported as {@code null}.
 * Uses the iterative algorithm of Cooper, Harvey and Kennedy.
 *
 * @author JPEXS
 */
public class DominatorTree {

    private static final int VIRTUAL = 0;
    private static final int UNDEFINED = -1;

    private final Map<BlockNode, Integer> indices = new HashMap<>();
    private final List<BlockNode> nodes = new ArrayList<>();
    private int[] idom;

    private DominatorTree() {
        nodes.add(null);
    }

    /**
     * Computes the dominator tree of a graph.
     *
     * @param graph the graph
     * @return dominator tree
     */
    public static DominatorTree dominators(FlowGraph graph) {
        DominatorTree tree = new DominatorTree();
        List<BlockNode> graphNodes = graph.getNodes();
        tree.index(graphNodes);
        int n = tree.nodes.size();
        List<List<Integer>> succs = emptyAdjacency(n);
        List<List<Integer>> preds = emptyAdjacency(n);
        if (graph.getEntryNode() != null) {
            link(succs, preds, VIRTUAL, tree.indices.get(graph.getEntryNode()));
        }
        for (BlockNode node : graphNodes) {
            for (BlockNode succ : node.getSuccessors()) {
                link(succs, preds, tree.indices.get(node), tree.indices.get(succ));
            }
        }
        tree.compute(succs, preds);
        return tree;
    }

    /**
     * Computes the post-dominator tree of an acyclic graph.
     *
     * @param graph the graph
     * @param ignoreInlined whether inlined edges are left out; a node whose
     * successors are all inlined is then treated as an exit
     * @return post-dominator tree
     */
    public static DominatorTree postDominators(FlowGraph graph, boolean ignoreInlined) {
        DominatorTree tree = new DominatorTree();
        List<BlockNode> graphNodes = graph.getNodes();
        tree.index(graphNodes);
        int n = tree.nodes.size();
        List<List<Integer>> succs = emptyAdjacency(n);
        List<List<Integer>> preds = emptyAdjacency(n);
        for (BlockNode node : graphNodes) {
            boolean exit = true;
            for (BlockNode succ : node.getSuccessors()) {
                if (ignoreInlined && node.getEdgeInfo(succ).isInlined()) {
                    continue;
                }
                exit = false;
                // reversed edge
                link(succs, preds, tree.indices.get(succ), tree.indices.get(node));
            }
            if (exit) {
                link(succs, preds, VIRTUAL, tree.indices.get(node));
            }
        }
        tree.compute(succs, preds);
        return tree;
    }

    private void index(List<BlockNode> graphNodes) {
        for (BlockNode node : graphNodes) {
            indices.put(node, nodes.size());
            nodes.add(node);
        }
    }

    private static List<List<Integer>> emptyAdjacency(int n) {
        List<List<Integer>> result = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            result.add(new ArrayList<>());
        }
        return result;
    }

    private static void link(List<List<Integer>> succs, List<List<Integer>> preds, int from, int to) {
        succs.get(from).add(to);
        preds.get(to).add(from);
    }

    private void compute(List<List<Integer>> succs, List<List<Integer>> preds) {
        int n = nodes.size();

        // Reverse post order from the virtual root
        int[] rpoNumber = new int[n];
        Arrays.fill(rpoNumber, UNDEFINED);
        List<Integer> postOrder = new ArrayList<>();
        boolean[] visited = new boolean[n];
        Deque<int[]> stack = new ArrayDeque<>();
        visited[VIRTUAL] = true;
        stack.push(new int[]{VIRTUAL, 0});
        while (!stack.isEmpty()) {
            int[] top = stack.peek();
            List<Integer> nodeSuccs = succs.get(top[0]);
            if (top[1] < nodeSuccs.size()) {
                int succ = nodeSuccs.get(top[1]++);
                if (!visited[succ]) {
                    visited[succ] = true;
                    stack.push(new int[]{succ, 0});
                }
            } else {
                stack.pop();
                postOrder.add(top[0]);
            }
        }
        int[] rpo = new int[postOrder.size()];
        for (int i = 0; i < rpo.length; i++) {
            rpo[i] = postOrder.get(postOrder.size() - 1 - i);
            rpoNumber[rpo[i]] = i;
        }

        idom = new int[n];
        Arrays.fill(idom, UNDEFINED);
        idom[VIRTUAL] = VIRTUAL;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = 1; i < rpo.length; i++) {
                int b = rpo[i];
                int newIdom = UNDEFINED;
                for (int p : preds.get(b)) {
                    if (idom[p] == UNDEFINED) {
                        continue;
                    }
                    newIdom = newIdom == UNDEFINED ? p : intersect(p, newIdom, rpoNumber);
                }
                if (newIdom != UNDEFINED && idom[b] != newIdom) {
                    idom[b] = newIdom;
                    changed = true;
                }
            }
        }
    }

    private int intersect(int b1, int b2, int[] rpoNumber) {
        int finger1 = b1;
        int finger2 = b2;
        while (finger1 != finger2) {
            while (rpoNumber[finger1] > rpoNumber[finger2]) {
                finger1 = idom[finger1];
            }
            while (rpoNumber[finger2] > rpoNumber[finger1]) {
                finger2 = idom[finger2];
            }
        }
        return finger1;
    }

    /**
     * Gets the immediate (post)dominator.
     *
     * @param node the node
     * @return immediate dominator, null when it is the virtual root or the
     * node is not reachable from it
     */
    public BlockNode getImmediateDominator(BlockNode node) {
        Integer index = indices.get(node);
        if (index == null || idom[index] == UNDEFINED) {
            return null;
        }
        return nodes.get(idom[index]);
    }

    /**
     * Checks whether {@code a} (post)dominates {@code b}. Every node dominates itself.
     */
    public boolean dominates(BlockNode a, BlockNode b) {
        Integer ia = indices.get(a);
        Integer ib = indices.get(b);
        if (ia == null || ib == null || idom[ib] == UNDEFINED) {
            return false;
        }
        int current = ib;
        while (true) {
            if (current == ia) {
                return true;
            }
            if (current == VIRTUAL) {
                return false;
            }
            current = idom[current];
        }
    }

    public boolean isReachable(BlockNode node) {
        Integer index = indices.get(node);
        return index != null && idom[index] != UNDEFINED;
    }
}
