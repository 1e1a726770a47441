package com.jpexs.decompiler.comb.region;

import com.jpexs.decompiler.comb.graph.BlockNode;
import com.jpexs.decompiler.comb.graph.Edge;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Set of nodes of the root graph forming a strongly connected region.
 * The region does not own its nodes.
 *
 * @author JPEXS
 */
public class MetaRegion {

    private final int index;
    private final TreeSet<BlockNode> nodes = new TreeSet<>(BlockNode.BY_ID);
    private final boolean scs;
    private MetaRegion parentRegion; // null for top level regions

    public MetaRegion(int index, Collection<BlockNode> nodes, boolean scs) {
        this.index = index;
        this.nodes.addAll(nodes);
        this.scs = scs;
    }

    public int getIndex() {
        return index;
    }

    public SortedSet<BlockNode> getNodes() {
        return Collections.unmodifiableSortedSet(nodes);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isScs() {
        return scs;
    }

    public MetaRegion getParentRegion() {
        return parentRegion;
    }

    public void setParentRegion(MetaRegion parentRegion) {
        this.parentRegion = parentRegion;
    }

    public boolean containsNode(BlockNode node) {
        return nodes.contains(node);
    }

    public void insertNode(BlockNode node) {
        nodes.add(node);
    }

    public void removeNode(BlockNode node) {
        nodes.remove(node);
    }

    public void removeNodes(Collection<BlockNode> removed) {
        nodes.removeAll(removed);
    }

    /**
     * Gets the nodes outside of the region reached by an edge from inside.
     *
     * @return successors, ordered by node id
     */
    public Set<BlockNode> getSuccessors() {
        Set<BlockNode> successors = new TreeSet<>(BlockNode.BY_ID);
        for (BlockNode node : nodes) {
            for (BlockNode succ : node.getSuccessors()) {
                if (!nodes.contains(succ)) {
                    successors.add(succ);
                }
            }
        }
        return successors;
    }

    public Set<Edge> getOutEdges() {
        Set<Edge> edges = new LinkedHashSet<>();
        for (BlockNode node : nodes) {
            for (BlockNode succ : node.getSuccessors()) {
                if (!nodes.contains(succ)) {
                    edges.add(new Edge(node, succ));
                }
            }
        }
        return edges;
    }

    public Set<Edge> getInEdges() {
        Set<Edge> edges = new LinkedHashSet<>();
        for (BlockNode node : nodes) {
            for (BlockNode pred : node.getPredecessors()) {
                if (!nodes.contains(pred)) {
                    edges.add(new Edge(pred, node));
                }
            }
        }
        return edges;
    }

    public boolean intersectsWith(MetaRegion other) {
        for (BlockNode node : other.nodes) {
            if (nodes.contains(node)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks whether this region is a proper subset of the other.
     */
    public boolean isSubSet(MetaRegion other) {
        return other.nodes.size() > nodes.size() && other.nodes.containsAll(nodes);
    }

    /**
     * Checks whether this region is a proper superset of the other.
     */
    public boolean isSuperSet(MetaRegion other) {
        return other.isSubSet(this);
    }

    public boolean nodesEquality(MetaRegion other) {
        return nodes.equals(other.nodes);
    }

    public void mergeWith(MetaRegion other) {
        nodes.addAll(other.nodes);
    }

    /**
     * Updates the region after another region has been collapsed: when the
     * region contained any of the removed nodes, the nodes that replaced them
     * are added.
     *
     * @param removed nodes of the collapsed region
     * @param collapsed the collapsed node
     * @param exitDispatcher exit dispatcher of the collapsed region, may be null
     * @param defaultEntrySets default entry SET nodes of the collapsed region
     * @param outlinedNodes outlined copies created for the collapsed region
     */
    public void updateNodes(Collection<BlockNode> removed, BlockNode collapsed, BlockNode exitDispatcher,
            Collection<BlockNode> defaultEntrySets, Collection<BlockNode> outlinedNodes) {
        boolean affected = false;
        for (BlockNode node : removed) {
            if (nodes.remove(node)) {
                affected = true;
            }
        }
        if (!affected) {
            return;
        }
        nodes.add(collapsed);
        if (exitDispatcher != null) {
            nodes.add(exitDispatcher);
        }
        nodes.addAll(defaultEntrySets);
        nodes.addAll(outlinedNodes);
    }

    @Override
    public String toString() {
        return "MetaRegion{index=" + index
                + ", scs=" + scs
                + ", parent=" + (parentRegion == null ? "root" : parentRegion.index)
                + ", nodes=" + nodes + "}";
    }
}
