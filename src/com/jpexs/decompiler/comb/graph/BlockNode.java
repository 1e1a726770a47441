package com.jpexs.decompiler.comb.graph;

import com.jpexs.decompiler.comb.cfg.BasicBlock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Node of the flow graph being restructured.
 * <p>
 * Successor links are ordered and carry an {@link EdgeInfo}. For a two-way
 * CODE node the first successor is the branch taken when the condition holds.
 *
 * @author JPEXS
 */
public class BlockNode {

    public enum Type {
        /** Lifted basic block. */
        CODE,
        /** Artificial node without code. */
        EMPTY,
        /** Leaves the enclosing loop. */
        BREAK,
        /** Jumps to the head of the enclosing loop. */
        CONTINUE,
        /** Assigns a value to a state variable. */
        SET,
        /** Stands for a whole collapsed region. */
        COLLAPSED,
        /** Switch over a state variable. */
        DISPATCHER
    }

    public static final Comparator<BlockNode> BY_ID = Comparator.comparingInt(BlockNode::getId);

    private final int id;
    private final Type type;
    private final FlowGraph parent;
    private String name;
    private final BasicBlock block;             // CODE only
    private final FlowGraph collapsedGraph;     // COLLAPSED only
    private final int stateVariable;            // SET and DISPATCHER
    private final long stateValue;              // SET only

    final List<BlockNode> succs = new ArrayList<>();
    final List<EdgeInfo> succInfos = new ArrayList<>();
    final List<BlockNode> preds = new ArrayList<>();

    BlockNode(FlowGraph parent, int id, Type type, String name, BasicBlock block,
            FlowGraph collapsedGraph, int stateVariable, long stateValue) {
        this.parent = parent;
        this.id = id;
        this.type = type;
        this.name = name;
        this.block = block;
        this.collapsedGraph = collapsedGraph;
        this.stateVariable = stateVariable;
        this.stateValue = stateValue;
    }

    public int getId() {
        return id;
    }

    public Type getType() {
        return type;
    }

    public FlowGraph getParent() {
        return parent;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public BasicBlock getBlock() {
        return block;
    }

    public FlowGraph getCollapsedGraph() {
        return collapsedGraph;
    }

    public int getStateVariable() {
        return stateVariable;
    }

    public long getStateValue() {
        return stateValue;
    }

    public boolean isCode() {
        return type == Type.CODE;
    }

    public boolean isEmpty() {
        return type == Type.EMPTY;
    }

    public boolean isBreak() {
        return type == Type.BREAK;
    }

    public boolean isContinue() {
        return type == Type.CONTINUE;
    }

    public boolean isSet() {
        return type == Type.SET;
    }

    public boolean isCollapsed() {
        return type == Type.COLLAPSED;
    }

    public boolean isDispatcher() {
        return type == Type.DISPATCHER;
    }

    public List<BlockNode> getSuccessors() {
        return Collections.unmodifiableList(succs);
    }

    public List<BlockNode> getPredecessors() {
        return Collections.unmodifiableList(preds);
    }

    public int successorCount() {
        return succs.size();
    }

    public int predecessorCount() {
        return preds.size();
    }

    public BlockNode getSuccessor(int index) {
        return succs.get(index);
    }

    public boolean hasSuccessor(BlockNode node) {
        return succs.contains(node);
    }

    public boolean hasPredecessor(BlockNode node) {
        return preds.contains(node);
    }

    /**
     * Gets the data of the edge to given successor.
     *
     * @param successor the successor
     * @return edge info, null when there is no such edge
     */
    public EdgeInfo getEdgeInfo(BlockNode successor) {
        int index = succs.indexOf(successor);
        return index == -1 ? null : succInfos.get(index);
    }

    public List<Edge> getOutgoingEdges() {
        List<Edge> result = new ArrayList<>();
        for (BlockNode succ : succs) {
            result.add(new Edge(this, succ));
        }
        return result;
    }

    /**
     * Gets weight of the node: instruction count of a CODE node, sum of the
     * nested nodes of a COLLAPSED node, zero for artificial nodes.
     *
     * @return weight
     */
    public int getWeight() {
        switch (type) {
            case CODE:
                return block.getWeight();
            case COLLAPSED:
                int weight = 0;
                for (BlockNode node : collapsedGraph.getNodes()) {
                    weight += node.getWeight();
                }
                return weight;
            default:
                return 0;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BlockNode node = (BlockNode) o;
        return id == node.id;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return name;
    }
}
