package com.jpexs.decompiler.comb.region;

import com.google.common.base.Verify;
import com.jpexs.decompiler.comb.graph.BlockNode;
import com.jpexs.decompiler.comb.graph.Edge;
import com.jpexs.decompiler.comb.graph.FlowGraph;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces a normalized region of the root graph by a single COLLAPSED node
 * owning a nested graph with the region's nodes.
 *
 * @author JPEXS
 */
public final class RegionCollapser {

    private static final Logger logger = LoggerFactory.getLogger(RegionCollapser.class);

    private RegionCollapser() {
    }

    /**
     * Collapses a normalized region.
     * <p>
     * In the nested graph the head is the entry, edges back to the head end in
     * CONTINUE nodes and edges leaving the region end in BREAK nodes.
     *
     * @param context state of the function being restructured
     * @param normalized the normalized region
     * @return the collapsed node
     * @throws com.google.common.base.VerifyException when the region is entered
     * elsewhere than in its head or the nested graph is not acyclic
     */
    public static BlockNode collapse(RegionContext context, NormalizedRegion normalized) {
        FlowGraph graph = context.getGraph();
        MetaRegion region = normalized.region;
        BlockNode head = normalized.head;
        Set<BlockNode> regionNodes = new TreeSet<>(BlockNode.BY_ID);
        regionNodes.addAll(region.getNodes());

        for (Edge backedge : context.getBackedges()) {
            Verify.verify(!regionNodes.contains(backedge.getFrom()) && !regionNodes.contains(backedge.getTo()),
                    "Backedge %s touches region %s being collapsed", backedge, region.getIndex());
        }

        FlowGraph nested = graph.createNestedGraph("region " + region.getIndex());
        Map<BlockNode, BlockNode> substitution = new HashMap<>();
        nested.insertBulkNodes(regionNodes, head, substitution);
        nested.connectContinueNode();

        BlockNode collapsed = graph.addCollapsedNode(nested);
        for (Edge inEdge : region.getInEdges()) {
            Verify.verify(inEdge.getTo() == head, "Region %s entered at %s instead of its head %s",
                    region.getIndex(), inEdge.getTo(), head);
            graph.moveEdgeTarget(inEdge.getFrom(), head, collapsed);
        }
        if (regionNodes.contains(graph.getEntryNode())) {
            Verify.verify(graph.getEntryNode() == head, "Graph entry %s is inside region %s but not its head",
                    graph.getEntryNode(), region.getIndex());
            graph.setEntryNode(collapsed);
        }

        if (normalized.exitDispatcher != null) {
            graph.addPlainEdge(collapsed, normalized.exitDispatcher);
        } else if (normalized.exitSuccessor != null) {
            graph.addPlainEdge(collapsed, normalized.exitSuccessor);
        }

        context.replaceInReversePostOrder(regionNodes, collapsed);
        for (BlockNode node : regionNodes) {
            graph.removeNode(node);
        }
        for (MetaRegion other : context.getRegions()) {
            if (other != region) {
                other.updateNodes(regionNodes, collapsed, normalized.exitDispatcher,
                        normalized.defaultEntrySets, normalized.outlinedNodes);
            }
        }

        nested.removeNotReachables();
        context.purge(graph.removeNotReachables());

        Verify.verify(nested.isDag(), "Nested graph of region %s is not acyclic", region.getIndex());
        if (logger.isDebugEnabled()) {
            logger.debug("Region {} collapsed into {} ({} nodes)", region.getIndex(), collapsed, nested.size());
        }
        return collapsed;
    }

    /**
     * Checks the root graph once every region has been collapsed.
     *
     * @param context state of the function being restructured
     * @throws com.google.common.base.VerifyException when the root graph is not acyclic
     */
    public static void verifyAcyclic(RegionContext context) {
        FlowGraph graph = context.getGraph();
        Verify.verify(graph.isDag(), "Root graph of %s is not acyclic after collapsing, backedges %s",
                graph.getFunctionName(), graph.getBackedges());
    }
}
