package com.jpexs.decompiler.comb.region;

import com.google.common.base.Verify;
import com.jpexs.decompiler.comb.graph.BlockNode;
import com.jpexs.decompiler.comb.graph.DominatorTree;
import com.jpexs.decompiler.comb.graph.Edge;
import com.jpexs.decompiler.comb.graph.FlowGraph;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds retreating edges of the root graph and builds the initial strongly
 * connected regions around them.
 *
 * @author JPEXS
 */
public final class RegionDetector {

    private static final Logger logger = LoggerFactory.getLogger(RegionDetector.class);

    private RegionDetector() {
    }

    /**
     * Places an EMPTY node on every retreating edge, so that every backedge
     * starts in a node of its own.
     *
     * @param graph the root graph
     * @return the backedges of the rewritten graph, each starting in a dummy
     */
    public static Set<Edge> insertBackedgeDummies(FlowGraph graph) {
        Set<Edge> retreatings = graph.getBackedges();
        Set<BlockNode> dummies = new HashSet<>();
        for (Edge edge : retreatings) {
            BlockNode dummy = graph.addEmptyNode("backedge dummy " + edge.getFrom() + " -> " + edge.getTo());
            graph.moveEdgeTarget(edge.getFrom(), edge.getTo(), dummy);
            graph.addPlainEdge(dummy, edge.getTo());
            dummies.add(dummy);
        }

        Set<Edge> backedges = graph.getBackedges();
        Verify.verify(backedges.size() == retreatings.size(),
                "Found %s backedges after inserting dummies, expected %s", backedges.size(), retreatings.size());
        for (Edge backedge : backedges) {
            Verify.verify(dummies.contains(backedge.getFrom()), "Backedge %s does not start in a dummy", backedge);
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Function {}: backedges {}", graph.getFunctionName(), backedges);
        }
        return backedges;
    }

    /**
     * Creates one SCS region per backedge.
     * <p>
     * When the backedge target dominates its source, the region is the natural
     * loop: the target plus every node reaching the source without passing the
     * target. Otherwise the region is every node reachable from the target that
     * also reaches the source, not counting the backedge itself. Regions are then
     * completed with the regions of backedges targeting any of their non-head
     * nodes, until a fixed point is reached.
     *
     * @param graph the root graph
     * @param backedges backedges starting in dummies
     * @return region of each backedge, in backedge order, indices starting at 1
     */
    public static Map<Edge, MetaRegion> createMetaRegions(FlowGraph graph, Set<Edge> backedges) {
        DominatorTree dominatorTree = DominatorTree.dominators(graph);
        Map<Edge, Set<BlockNode>> regionNodes = new LinkedHashMap<>();
        Map<BlockNode, Set<BlockNode>> additionalScsNodes = new HashMap<>();

        for (Edge backedge : backedges) {
            BlockNode target = backedge.getTo();
            BlockNode source = backedge.getFrom();
            Set<BlockNode> nodes;
            if (dominatorTree.dominates(target, source)) {
                nodes = reachingNodes(source, target, backedge);
                nodes.add(target);
            } else {
                nodes = reachableNodes(target, backedge);
                nodes.retainAll(reachingNodes(source, null, backedge));
            }
            regionNodes.put(backedge, nodes);
            additionalScsNodes.computeIfAbsent(target, k -> new TreeSet<>(BlockNode.BY_ID)).addAll(nodes);
        }

        // Absorb the regions of nested heads
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Map.Entry<Edge, Set<BlockNode>> entry : regionNodes.entrySet()) {
                BlockNode head = entry.getKey().getTo();
                Set<BlockNode> nodes = entry.getValue();
                for (BlockNode node : new ArrayList<>(nodes)) {
                    Set<BlockNode> additional = additionalScsNodes.get(node);
                    if (node != head && additional != null && !nodes.containsAll(additional)) {
                        nodes.addAll(additional);
                        additionalScsNodes.get(head).addAll(additional);
                        changed = true;
                    }
                }
            }
        }

        Map<Edge, MetaRegion> regions = new LinkedHashMap<>();
        int index = 1;
        for (Map.Entry<Edge, Set<BlockNode>> entry : regionNodes.entrySet()) {
            MetaRegion region = new MetaRegion(index++, entry.getValue(), true);
            regions.put(entry.getKey(), region);
            if (logger.isDebugEnabled()) {
                logger.debug("Backedge {} forms {}", entry.getKey(), region);
            }
        }
        return regions;
    }

    /**
     * Nodes reachable from start without following the excluded edge.
     */
    private static Set<BlockNode> reachableNodes(BlockNode start, Edge excluded) {
        Set<BlockNode> result = new TreeSet<>(BlockNode.BY_ID);
        Deque<BlockNode> stack = new ArrayDeque<>();
        result.add(start);
        stack.push(start);
        while (!stack.isEmpty()) {
            BlockNode node = stack.pop();
            for (BlockNode succ : node.getSuccessors()) {
                if (node == excluded.getFrom() && succ == excluded.getTo()) {
                    continue;
                }
                if (result.add(succ)) {
                    stack.push(succ);
                }
            }
        }
        return result;
    }

    /**
     * Nodes reaching the sink without following the excluded edge. The walk does
     * not continue past the barrier node, when given.
     */
    private static Set<BlockNode> reachingNodes(BlockNode sink, BlockNode barrier, Edge excluded) {
        Set<BlockNode> result = new TreeSet<>(BlockNode.BY_ID);
        Deque<BlockNode> stack = new ArrayDeque<>();
        result.add(sink);
        stack.push(sink);
        while (!stack.isEmpty()) {
            BlockNode node = stack.pop();
            if (node == barrier) {
                continue;
            }
            for (BlockNode pred : node.getPredecessors()) {
                if (pred == excluded.getFrom() && node == excluded.getTo()) {
                    continue;
                }
                if (result.add(pred)) {
                    stack.push(pred);
                }
            }
        }
        return result;
    }
}
