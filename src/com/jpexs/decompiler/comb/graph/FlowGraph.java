package com.jpexs.decompiler.comb.graph;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.jpexs.decompiler.comb.cfg.BasicBlock;
import com.jpexs.decompiler.comb.cfg.BlockEdge;
import com.jpexs.decompiler.comb.cfg.ControlFlowGraph;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutable directed graph of {@link BlockNode}s with a single entry.
 * <p>
 * A function is restructured in a root graph; every collapsed region owns a
 * nested graph. All graphs of one function share node id and state variable
 * counters, so node ids are unique within the function.
 *
 * @author JPEXS
 */
public class FlowGraph {

    private static final Logger logger = LoggerFactory.getLogger(FlowGraph.class);

    private static class Counters {
        final AtomicInteger nodeIds = new AtomicInteger(0);
        final AtomicInteger stateVariables = new AtomicInteger(0);
    }

    private final Counters counters;
    private final String functionName;
    private final String regionName;
    private final Set<BlockNode> nodes = new LinkedHashSet<>();
    private BlockNode entryNode;

    public FlowGraph(String functionName) {
        this(functionName, "root", new Counters());
    }

    private FlowGraph(String functionName, String regionName, Counters counters) {
        this.functionName = functionName;
        this.regionName = regionName;
        this.counters = counters;
    }

    /**
     * Creates an empty graph sharing counters with this one.
     *
     * @param regionName name of the region the graph will hold
     * @return the new graph
     */
    public FlowGraph createNestedGraph(String regionName) {
        return new FlowGraph(functionName, regionName, counters);
    }

    /**
     * Imports the blocks reachable from the entry of a lifted function.
     * <p>
     * Two-way branches are ordered so that the leg not marked as direct comes
     * first. Parallel edges are merged. When the entry block has predecessors,
     * an empty entry node is prepended.
     *
     * @param cfg the lifted function
     * @return the flow graph, without entry for an empty function body
     * @throws IllegalArgumentException when the input is malformed
     */
    public static FlowGraph fromControlFlowGraph(ControlFlowGraph cfg) {
        cfg.validate();
        FlowGraph graph = new FlowGraph(cfg.getFunctionName());
        if (cfg.isEmpty()) {
            return graph;
        }

        // Discover reachable blocks in depth first order
        Map<Long, BlockNode> nodeMap = new LinkedHashMap<>();
        Deque<BasicBlock> stack = new ArrayDeque<>();
        stack.push(cfg.getEntryBlock());
        while (!stack.isEmpty()) {
            BasicBlock block = stack.pop();
            if (nodeMap.containsKey(block.getAddress())) {
                continue;
            }
            nodeMap.put(block.getAddress(), graph.addCodeNode(block));
            List<BlockEdge> edges = block.getSuccessors();
            for (int i = edges.size() - 1; i >= 0; i--) {
                BasicBlock target = cfg.getBlock(edges.get(i).getTargetAddress());
                if (!nodeMap.containsKey(target.getAddress())) {
                    stack.push(target);
                }
            }
        }

        for (BlockNode node : nodeMap.values()) {
            for (BlockEdge edge : orderBranchLegs(node.getBlock().getSuccessors())) {
                graph.addEdge(node, nodeMap.get(edge.getTargetAddress()), new EdgeInfo(edge.getCaseValues()));
            }
        }

        BlockNode entry = nodeMap.get(cfg.getEntryAddress());
        if (entry.predecessorCount() > 0) {
            BlockNode syntheticEntry = graph.addEmptyNode("entry");
            graph.addPlainEdge(syntheticEntry, entry);
            entry = syntheticEntry;
        }
        graph.setEntryNode(entry);

        if (logger.isDebugEnabled()) {
            int unreachable = cfg.getBlocks().size() - nodeMap.size();
            logger.debug("Imported function {}: {} blocks, {} unreachable blocks dropped",
                    cfg.getFunctionName(), nodeMap.size(), unreachable);
        }
        return graph;
    }

    private static List<BlockEdge> orderBranchLegs(List<BlockEdge> edges) {
        if (edges.size() != 2
                || edges.get(0).getTargetAddress() == edges.get(1).getTargetAddress()
                || !edges.get(0).getCaseValues().isEmpty()
                || !edges.get(1).getCaseValues().isEmpty()) {
            return edges;
        }
        if (edges.get(0).isDirect() && !edges.get(1).isDirect()) {
            List<BlockEdge> result = new ArrayList<>(edges);
            Collections.reverse(result);
            return result;
        }
        return edges;
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getRegionName() {
        return regionName;
    }

    public BlockNode getEntryNode() {
        return entryNode;
    }

    public void setEntryNode(BlockNode entryNode) {
        Preconditions.checkArgument(entryNode == null || entryNode.getParent() == this, "Entry node %s is not part of the graph", entryNode);
        this.entryNode = entryNode;
    }

    /**
     * Gets a snapshot of the nodes, in insertion order.
     *
     * @return list of nodes
     */
    public List<BlockNode> getNodes() {
        return new ArrayList<>(nodes);
    }

    public int size() {
        return nodes.size();
    }

    public boolean containsNode(BlockNode node) {
        return nodes.contains(node) && node.getParent() == this;
    }

    public int allocateStateVariable() {
        return counters.stateVariables.getAndIncrement();
    }

    private BlockNode createNode(BlockNode.Type type, String name, BasicBlock block, FlowGraph collapsedGraph,
            int stateVariable, long stateValue) {
        BlockNode node = new BlockNode(this, counters.nodeIds.getAndIncrement(), type, name, block,
                collapsedGraph, stateVariable, stateValue);
        nodes.add(node);
        return node;
    }

    public BlockNode addCodeNode(BasicBlock block) {
        return createNode(BlockNode.Type.CODE, block.getName(), block, null, -1, 0);
    }

    public BlockNode addEmptyNode(String name) {
        return createNode(BlockNode.Type.EMPTY, name, null, null, -1, 0);
    }

    public BlockNode addBreakNode() {
        return createNode(BlockNode.Type.BREAK, "break", null, null, -1, 0);
    }

    public BlockNode addContinueNode() {
        return createNode(BlockNode.Type.CONTINUE, "continue", null, null, -1, 0);
    }

    public BlockNode addSetNode(int stateVariable, long value) {
        return createNode(BlockNode.Type.SET, "set state_var_" + stateVariable + " = " + value, null, null, stateVariable, value);
    }

    /**
     * Adds a dispatcher node with a freshly allocated state variable.
     *
     * @param name display name
     * @return the dispatcher
     */
    public BlockNode addDispatcher(String name) {
        return createNode(BlockNode.Type.DISPATCHER, name, null, null, allocateStateVariable(), 0);
    }

    public BlockNode addCollapsedNode(FlowGraph collapsedGraph) {
        return createNode(BlockNode.Type.COLLAPSED, "collapsed " + collapsedGraph.getRegionName(), null, collapsedGraph, -1, 0);
    }

    /**
     * Adds a copy of a node, without edges. A collapsed node gets a deep copy
     * of its nested graph.
     *
     * @param original node to copy, may belong to another graph of the function
     * @param name name of the copy
     * @return the copy
     */
    public BlockNode cloneNode(BlockNode original, String name) {
        FlowGraph collapsed = original.isCollapsed() ? original.getCollapsedGraph().copy() : null;
        return createNode(original.getType(), name, original.getBlock(), collapsed,
                original.getStateVariable(), original.getStateValue());
    }

    /**
     * Removes a node together with all its edges.
     *
     * @param node the node
     */
    public void removeNode(BlockNode node) {
        checkOwned(node);
        for (BlockNode succ : new ArrayList<>(node.succs)) {
            removeEdge(node, succ);
        }
        for (BlockNode pred : new ArrayList<>(node.preds)) {
            removeEdge(pred, node);
        }
        nodes.remove(node);
        if (entryNode == node) {
            entryNode = null;
        }
    }

    private void checkOwned(BlockNode node) {
        Verify.verify(node.getParent() == this && nodes.contains(node), "Node %s is not part of graph %s", node, regionName);
    }

    /**
     * Adds an edge. When the edge already exists, the labels are merged into it.
     */
    public void addEdge(BlockNode from, BlockNode to, EdgeInfo info) {
        checkOwned(from);
        checkOwned(to);
        int index = from.succs.indexOf(to);
        if (index != -1) {
            from.succInfos.get(index).addLabels(info.getLabels());
            return;
        }
        from.succs.add(to);
        from.succInfos.add(info);
        to.preds.add(from);
    }

    public void addPlainEdge(BlockNode from, BlockNode to) {
        addEdge(from, to, new EdgeInfo());
    }

    /**
     * Removes an edge.
     *
     * @return data of the removed edge
     */
    public EdgeInfo removeEdge(BlockNode from, BlockNode to) {
        int index = from.succs.indexOf(to);
        Verify.verify(index != -1, "No edge %s -> %s", from, to);
        EdgeInfo info = from.succInfos.remove(index);
        from.succs.remove(index);
        to.preds.remove(from);
        return info;
    }

    /**
     * Redirects an edge to a new target, keeping its data and its position
     * among the successors of the source. When the source already has an edge
     * to the new target, the two edges are merged.
     */
    public void moveEdgeTarget(BlockNode from, BlockNode oldTo, BlockNode newTo) {
        checkOwned(newTo);
        int index = from.succs.indexOf(oldTo);
        Verify.verify(index != -1, "No edge %s -> %s", from, oldTo);
        oldTo.preds.remove(from);
        int existing = from.succs.indexOf(newTo);
        if (existing != -1) {
            from.succInfos.get(existing).addLabels(from.succInfos.get(index).getLabels());
            from.succs.remove(index);
            from.succInfos.remove(index);
            return;
        }
        from.succs.set(index, newTo);
        newTo.preds.add(from);
    }

    /**
     * Copies the given nodes of another graph into this one and makes the copy
     * of the head the entry. Edges between copied nodes are preserved, edges
     * leaving the set end in fresh BREAK nodes.
     *
     * @param regionNodes nodes to copy
     * @param head node becoming the entry
     * @param substitution receives the mapping from original to copy
     */
    public void insertBulkNodes(Collection<BlockNode> regionNodes, BlockNode head, Map<BlockNode, BlockNode> substitution) {
        Preconditions.checkArgument(regionNodes.contains(head), "Head %s is not among the copied nodes", head);
        List<BlockNode> ordered = new ArrayList<>(regionNodes);
        ordered.sort(BlockNode.BY_ID);
        for (BlockNode node : ordered) {
            substitution.put(node, cloneNode(node, node.getName()));
        }
        for (BlockNode node : ordered) {
            BlockNode copy = substitution.get(node);
            for (int i = 0; i < node.succs.size(); i++) {
                BlockNode succ = node.succs.get(i);
                EdgeInfo info = node.succInfos.get(i).copy();
                BlockNode target = substitution.get(succ);
                if (target == null) {
                    target = addBreakNode();
                }
                addEdge(copy, target, info);
            }
        }
        setEntryNode(substitution.get(head));
    }

    /**
     * Replaces every edge entering the entry node by an edge to a fresh
     * CONTINUE node.
     */
    public void connectContinueNode() {
        for (BlockNode pred : new ArrayList<>(entryNode.preds)) {
            BlockNode continueNode = addContinueNode();
            moveEdgeTarget(pred, entryNode, continueNode);
        }
    }

    /**
     * Deep copy of the graph, sharing the function counters.
     *
     * @return the copy
     */
    public FlowGraph copy() {
        FlowGraph result = new FlowGraph(functionName, regionName, counters);
        Map<BlockNode, BlockNode> substitution = new HashMap<>();
        for (BlockNode node : nodes) {
            substitution.put(node, result.cloneNode(node, node.getName()));
        }
        for (BlockNode node : nodes) {
            for (int i = 0; i < node.succs.size(); i++) {
                result.addEdge(substitution.get(node), substitution.get(node.succs.get(i)), node.succInfos.get(i).copy());
            }
        }
        result.entryNode = substitution.get(entryNode);
        return result;
    }

    /**
     * Gets all nodes reachable from the given node.
     */
    public Set<BlockNode> getReachableNodes(BlockNode start) {
        Set<BlockNode> reachable = new LinkedHashSet<>();
        Queue<BlockNode> queue = new LinkedList<>();
        queue.add(start);
        reachable.add(start);

        while (!queue.isEmpty()) {
            BlockNode current = queue.poll();
            for (BlockNode succ : current.succs) {
                if (!reachable.contains(succ)) {
                    reachable.add(succ);
                    queue.add(succ);
                }
            }
        }

        return reachable;
    }

    /**
     * Removes every node not reachable from the entry.
     *
     * @return removed nodes
     */
    public Set<BlockNode> removeNotReachables() {
        Set<BlockNode> removed = new TreeSet<>(BlockNode.BY_ID);
        if (entryNode == null) {
            return removed;
        }
        Set<BlockNode> reachable = getReachableNodes(entryNode);
        for (BlockNode node : getNodes()) {
            if (!reachable.contains(node)) {
                removed.add(node);
            }
        }
        for (BlockNode node : removed) {
            removeNode(node);
        }
        return removed;
    }

    /**
     * Computes the reverse post order of the nodes reachable from the entry.
     *
     * @return nodes in reverse post order
     */
    public List<BlockNode> reversePostOrder() {
        List<BlockNode> postOrder = new ArrayList<>();
        if (entryNode == null) {
            return postOrder;
        }
        Set<BlockNode> visited = new HashSet<>();
        Deque<BlockNode> nodeStack = new ArrayDeque<>();
        Deque<Integer> indexStack = new ArrayDeque<>();
        visited.add(entryNode);
        nodeStack.push(entryNode);
        indexStack.push(0);
        while (!nodeStack.isEmpty()) {
            BlockNode node = nodeStack.peek();
            int index = indexStack.pop();
            if (index < node.succs.size()) {
                indexStack.push(index + 1);
                BlockNode succ = node.succs.get(index);
                if (visited.add(succ)) {
                    nodeStack.push(succ);
                    indexStack.push(0);
                }
            } else {
                nodeStack.pop();
                postOrder.add(node);
            }
        }
        Collections.reverse(postOrder);
        return postOrder;
    }

    /**
     * Finds retreating edges with a depth first search: an edge is retreating
     * when its target has been started but not yet finished.
     *
     * @return retreating edges in discovery order
     */
    public Set<Edge> getBackedges() {
        Set<Edge> backedges = new LinkedHashSet<>();
        if (entryNode == null) {
            return backedges;
        }
        Map<BlockNode, Integer> start = new HashMap<>();
        Map<BlockNode, Integer> finish = new HashMap<>();
        int time = 0;
        Deque<BlockNode> nodeStack = new ArrayDeque<>();
        Deque<Integer> indexStack = new ArrayDeque<>();
        start.put(entryNode, time++);
        nodeStack.push(entryNode);
        indexStack.push(0);
        while (!nodeStack.isEmpty()) {
            BlockNode node = nodeStack.peek();
            int index = indexStack.pop();
            if (index < node.succs.size()) {
                indexStack.push(index + 1);
                BlockNode succ = node.succs.get(index);
                if (!start.containsKey(succ)) {
                    start.put(succ, time++);
                    nodeStack.push(succ);
                    indexStack.push(0);
                } else if (!finish.containsKey(succ)) {
                    backedges.add(new Edge(node, succ));
                }
            } else {
                nodeStack.pop();
                finish.put(node, time++);
            }
        }
        return backedges;
    }

    public boolean isDag() {
        return getBackedges().isEmpty();
    }

    /**
     * Generates a Graphviz/DOT representation of this graph level.
     *
     * @return DOT format string
     */
    public String toGraphviz() {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph \"").append(functionName).append(' ').append(regionName).append("\" {\n");

        for (BlockNode node : nodes) {
            sb.append("  ").append(dotId(node)).append(" [label=\"").append(node.getName().replace("\"", "\\\""))
                    .append("\" shape=").append(dotShape(node));
            if (node == entryNode) {
                sb.append(" style=bold");
            }
            sb.append("];\n");
        }
        for (BlockNode node : nodes) {
            for (int i = 0; i < node.succs.size(); i++) {
                sb.append("  ").append(dotId(node)).append("->").append(dotId(node.succs.get(i)));
                EdgeInfo info = node.succInfos.get(i);
                if (info.hasLabels() || info.isInlined()) {
                    sb.append(" [label=\"").append(info).append("\"]");
                }
                sb.append(";\n");
            }
        }

        sb.append("}");
        return sb.toString();
    }

    private static String dotId(BlockNode node) {
        return "n" + node.getId();
    }

    private static String dotShape(BlockNode node) {
        switch (node.getType()) {
            case COLLAPSED:
                return "box3d";
            case DISPATCHER:
                return "diamond";
            case SET:
                return "note";
            case BREAK:
            case CONTINUE:
                return "ellipse";
            case EMPTY:
                return "point";
            default:
                return "box";
        }
    }

    @Override
    public String toString() {
        return functionName + " " + regionName + nodes;
    }
}
