package com.jpexs.decompiler.comb.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Data attached to an edge of the flow graph.
 *
 * @author JPEXS
 */
public class EdgeInfo {

    private final TreeSet<Long> labels = new TreeSet<>(); // case values or dispatcher state values
    private boolean inlined;                              // target is reachable only through this edge

    public EdgeInfo() {
    }

    public EdgeInfo(Collection<Long> labels) {
        this.labels.addAll(labels);
    }

    public static EdgeInfo labeled(long label) {
        return new EdgeInfo(Collections.singleton(label));
    }

    public SortedSet<Long> getLabels() {
        return Collections.unmodifiableSortedSet(labels);
    }

    public boolean hasLabels() {
        return !labels.isEmpty();
    }

    void addLabels(Collection<Long> other) {
        labels.addAll(other);
    }

    public boolean isInlined() {
        return inlined;
    }

    public void setInlined(boolean inlined) {
        this.inlined = inlined;
    }

    public EdgeInfo copy() {
        EdgeInfo result = new EdgeInfo(labels);
        result.inlined = inlined;
        return result;
    }

    @Override
    public String toString() {
        if (labels.isEmpty() && !inlined) {
            return "";
        }
        return labels + (inlined ? " inlined" : "");
    }
}
