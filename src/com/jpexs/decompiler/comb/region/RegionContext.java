package com.jpexs.decompiler.comb.region;

import com.jpexs.decompiler.comb.graph.BlockNode;
import com.jpexs.decompiler.comb.graph.Edge;
import com.jpexs.decompiler.comb.graph.FlowGraph;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * State shared by the region normalizer and the region collapser while the
 * regions of one function are processed: the root graph, the backedges not yet
 * consumed, the regions in processing order and the reverse post order of the
 * root graph computed before any rewriting.
 *
 * @author JPEXS
 */
public class RegionContext {

    private final FlowGraph graph;
    private final Set<Edge> backedges;
    private final List<MetaRegion> regions;
    private final List<BlockNode> reversePostOrder;

    public RegionContext(FlowGraph graph, Set<Edge> backedges, List<MetaRegion> regions) {
        this.graph = graph;
        this.backedges = new LinkedHashSet<>(backedges);
        this.regions = new ArrayList<>(regions);
        this.reversePostOrder = graph.reversePostOrder();
    }

    public FlowGraph getGraph() {
        return graph;
    }

    public Set<Edge> getBackedges() {
        return backedges;
    }

    /**
     * Gets the regions in bottom-up processing order.
     */
    public List<MetaRegion> getRegions() {
        return Collections.unmodifiableList(regions);
    }

    public List<BlockNode> getReversePostOrder() {
        return Collections.unmodifiableList(reversePostOrder);
    }

    public int reversePostOrderIndex(BlockNode node) {
        return reversePostOrder.indexOf(node);
    }

    public boolean isInAnyRegion(BlockNode node) {
        for (MetaRegion region : regions) {
            if (region.containsNode(node)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Replaces the nodes of a collapsed region in the reverse post order by the
     * collapsed node, placed where the first of them was.
     */
    void replaceInReversePostOrder(Collection<BlockNode> removed, BlockNode collapsed) {
        int position = -1;
        for (int i = 0; i < reversePostOrder.size(); i++) {
            if (removed.contains(reversePostOrder.get(i))) {
                position = i;
                break;
            }
        }
        reversePostOrder.removeAll(removed);
        if (position != -1) {
            reversePostOrder.add(Math.min(position, reversePostOrder.size()), collapsed);
        }
    }

    /**
     * Forgets nodes deleted from the root graph.
     */
    void purge(Collection<BlockNode> removed) {
        if (removed.isEmpty()) {
            return;
        }
        for (MetaRegion region : regions) {
            region.removeNodes(removed);
        }
        reversePostOrder.removeAll(removed);
        for (Iterator<Edge> it = backedges.iterator(); it.hasNext();) {
            Edge edge = it.next();
            if (removed.contains(edge.getFrom()) || removed.contains(edge.getTo())) {
                it.remove();
            }
        }
    }
}
