package com.jpexs.decompiler.comb.graph;

import java.util.Objects;

/**
 * Edge from one BlockNode to another.
 * Descriptor only, the edge data lives in the source node.
 *
 * @author JPEXS
 */
public final class Edge {

    private final BlockNode from;
    private final BlockNode to;

    public Edge(BlockNode from, BlockNode to) {
        this.from = from;
        this.to = to;
    }

    public BlockNode getFrom() {
        return from;
    }

    public BlockNode getTo() {
        return to;
    }

    public EdgeInfo getInfo() {
        return from.getEdgeInfo(to);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Edge edge = (Edge) o;
        return from.equals(edge.from) && to.equals(edge.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to);
    }

    @Override
    public String toString() {
        return "" + from + " -> " + to;
    }
}
