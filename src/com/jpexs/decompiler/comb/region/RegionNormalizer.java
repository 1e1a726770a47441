package com.jpexs.decompiler.comb.region;

import com.google.common.base.Verify;
import com.jpexs.decompiler.comb.graph.BlockNode;
import com.jpexs.decompiler.comb.graph.DominatorTree;
import com.jpexs.decompiler.comb.graph.Edge;
import com.jpexs.decompiler.comb.graph.EdgeInfo;
import com.jpexs.decompiler.comb.graph.FlowGraph;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the initial regions into a properly nested family and rewrites each
 * region so that it has a single entry and a single exit.
 *
 * @author JPEXS
 */
public final class RegionNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(RegionNormalizer.class);

    private RegionNormalizer() {
    }

    /**
     * Merges, checks and orders the regions.
     *
     * @param backedgeRegions region of each backedge
     * @param backedges all backedges of the root graph
     * @return regions in bottom-up processing order
     */
    public static List<MetaRegion> prepareRegions(Map<Edge, MetaRegion> backedgeRegions, Set<Edge> backedges) {
        List<MetaRegion> regions = simplifyAbnormalRetreating(backedgeRegions);
        regions = simplifyScs(regions);
        checkMetaregionConsistency(regions, backedges);
        return orderRegions(regions);
    }

    /**
     * Merges every region containing exactly one endpoint of a backedge with
     * the region of that backedge, until no such region remains.
     *
     * @param backedgeRegions region of each backedge
     * @return the remaining regions
     */
    public static List<MetaRegion> simplifyAbnormalRetreating(Map<Edge, MetaRegion> backedgeRegions) {
        Map<Edge, MetaRegion> owner = new LinkedHashMap<>(backedgeRegions);
        Set<MetaRegion> live = new LinkedHashSet<>(backedgeRegions.values());
        boolean merged = true;
        while (merged) {
            merged = false;
            search:
            for (MetaRegion region : live) {
                for (Map.Entry<Edge, MetaRegion> entry : owner.entrySet()) {
                    Edge backedge = entry.getKey();
                    boolean hasSource = region.containsNode(backedge.getFrom());
                    boolean hasTarget = region.containsNode(backedge.getTo());
                    if (hasSource == hasTarget) {
                        continue;
                    }
                    MetaRegion other = entry.getValue();
                    Verify.verify(other != region && live.contains(other),
                            "Backedge %s is not owned by a live region", backedge);
                    int liveBefore = live.size();
                    region.mergeWith(other);
                    live.remove(other);
                    for (Map.Entry<Edge, MetaRegion> ownerEntry : owner.entrySet()) {
                        if (ownerEntry.getValue() == other) {
                            ownerEntry.setValue(region);
                        }
                    }
                    Verify.verify(live.size() < liveBefore, "Abnormal retreating merge made no progress");
                    if (logger.isDebugEnabled()) {
                        logger.debug("Region {} absorbs region {} because of backedge {}", region.getIndex(), other.getIndex(), backedge);
                    }
                    merged = true;
                    break search;
                }
            }
        }
        return new ArrayList<>(live);
    }

    /**
     * Merges regions that overlap without one containing the other, and regions
     * with equal node sets, until the family is properly nested.
     *
     * @param regions the regions
     * @return the remaining regions
     */
    public static List<MetaRegion> simplifyScs(List<MetaRegion> regions) {
        List<MetaRegion> result = new ArrayList<>(regions);
        while (mergeScsStep(result)) {
            // repeat until nothing overlaps
        }
        return result;
    }

    private static boolean mergeScsStep(List<MetaRegion> regions) {
        for (int i = 0; i < regions.size(); i++) {
            MetaRegion region1 = regions.get(i);
            for (int j = i + 1; j < regions.size(); j++) {
                MetaRegion region2 = regions.get(j);
                boolean included = region1.isSubSet(region2) || region2.isSubSet(region1);
                boolean equivalent = region1.nodesEquality(region2);
                if (region1.intersectsWith(region2) && (!included || equivalent)) {
                    int sizeBefore = regions.size();
                    region1.mergeWith(region2);
                    regions.remove(j);
                    Verify.verify(regions.size() < sizeBefore, "Region merge made no progress");
                    if (logger.isDebugEnabled()) {
                        logger.debug("Region {} merged with overlapping region {}", region1.getIndex(), region2.getIndex());
                    }
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Checks that every region contains either both endpoints of a backedge or none.
     *
     * @throws com.google.common.base.VerifyException on violation
     */
    public static void checkMetaregionConsistency(Collection<MetaRegion> regions, Collection<Edge> backedges) {
        for (MetaRegion region : regions) {
            for (Edge backedge : backedges) {
                Verify.verify(region.containsNode(backedge.getFrom()) == region.containsNode(backedge.getTo()),
                        "Region %s contains only one endpoint of backedge %s", region.getIndex(), backedge);
            }
        }
    }

    /**
     * Sorts the regions by size, links every region to its smallest enclosing
     * region and returns them so that children always precede their parents.
     *
     * @param regions properly nested regions
     * @return regions in processing order
     */
    public static List<MetaRegion> orderRegions(List<MetaRegion> regions) {
        List<MetaRegion> sorted = new ArrayList<>(regions);
        sorted.sort(Comparator.comparingInt(MetaRegion::size));
        for (MetaRegion region : sorted) {
            region.setParentRegion(null);
            for (MetaRegion candidate : sorted) {
                if (region.isSubSet(candidate)) {
                    region.setParentRegion(candidate);
                    break;
                }
            }
        }
        List<MetaRegion> ordered = applyPartialOrder(sorted);
        Collections.reverse(ordered);
        return ordered;
    }

    /**
     * Lists the regions so that every parent precedes its children.
     */
    static List<MetaRegion> applyPartialOrder(List<MetaRegion> regions) {
        List<MetaRegion> ordered = new ArrayList<>();
        Set<MetaRegion> processed = new HashSet<>();
        while (ordered.size() != regions.size()) {
            boolean progress = false;
            for (MetaRegion region : regions) {
                if (processed.contains(region)) {
                    continue;
                }
                MetaRegion parent = region.getParentRegion();
                if (parent == null || processed.contains(parent)) {
                    ordered.add(region);
                    processed.add(region);
                    progress = true;
                }
            }
            Verify.verify(progress, "Region parent relation is not a tree");
        }
        return ordered;
    }

    /**
     * Rewrites a region to a single entry and a single exit: elects the head,
     * adds an entry dispatcher when several nodes are targets of retreating
     * edges, absorbs dominated successors, outlines the nodes entered from
     * outside, and adds an exit dispatcher when several successors remain.
     *
     * @param context state of the function being restructured
     * @param region the region
     * @return the result, null when the region has no retreating edge left
     */
    public static NormalizedRegion normalize(RegionContext context, MetaRegion region) {
        FlowGraph graph = context.getGraph();

        Set<Edge> retreatings = new LinkedHashSet<>();
        for (Edge backedge : context.getBackedges()) {
            if (region.containsNode(backedge.getFrom())) {
                Verify.verify(region.containsNode(backedge.getTo()), "Backedge %s leaves region %s", backedge, region.getIndex());
                retreatings.add(backedge);
            }
        }
        if (retreatings.isEmpty()) {
            logger.debug("Region {} has no retreating edge left", region.getIndex());
            return null;
        }
        context.getBackedges().removeAll(retreatings);

        // Retreating targets in reverse post order, the first one is the head
        List<BlockNode> retreatingTargets = new ArrayList<>();
        for (BlockNode node : context.getReversePostOrder()) {
            if (region.containsNode(node)) {
                for (Edge retreating : retreatings) {
                    if (retreating.getTo() == node) {
                        retreatingTargets.add(node);
                        break;
                    }
                }
            }
        }
        Verify.verify(!retreatingTargets.isEmpty(), "No retreating target of region %s in reverse post order", region.getIndex());
        BlockNode head = retreatingTargets.get(0);
        BlockNode entryDispatcher = null;
        List<BlockNode> defaultEntrySets = new ArrayList<>();

        if (retreatingTargets.size() > 1) {
            entryDispatcher = createEntryDispatcher(graph, region, retreatings, retreatingTargets, defaultEntrySets);
            head = entryDispatcher;
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Region {}: head {}, retreating targets {}", region.getIndex(), head, retreatingTargets);
        }

        refineSuccessors(context, region, head);

        List<BlockNode> outlinedNodes = outline(graph, region, head);

        // Backedge dummies leading to the same target count as one successor
        Map<BlockNode, BlockNode> representatives = new LinkedHashMap<>();
        Map<BlockNode, BlockNode> dummyOfTarget = new TreeMap<>(BlockNode.BY_ID);
        Set<BlockNode> deduplicated = new TreeSet<>(BlockNode.BY_ID);
        Set<Edge> backedges = context.getBackedges();
        for (BlockNode successor : region.getSuccessors()) {
            BlockNode representative = successor;
            if (successor.isEmpty() && successor.successorCount() == 1
                    && backedges.contains(new Edge(successor, successor.getSuccessor(0)))) {
                representative = dummyOfTarget.computeIfAbsent(successor.getSuccessor(0), target -> successor);
            }
            representatives.put(successor, representative);
            deduplicated.add(representative);
        }

        BlockNode exitDispatcher = null;
        BlockNode exitSuccessor = null;
        if (deduplicated.size() > 1) {
            exitDispatcher = graph.addDispatcher("exit dispatcher " + region.getIndex());
            Map<BlockNode, Long> exitIds = new LinkedHashMap<>();
            long id = 0;
            for (BlockNode successor : deduplicated) {
                exitIds.put(successor, id);
                graph.addEdge(exitDispatcher, successor, EdgeInfo.labeled(id));
                id++;
            }
            for (Edge outEdge : region.getOutEdges()) {
                BlockNode set = graph.addSetNode(exitDispatcher.getStateVariable(), exitIds.get(representatives.get(outEdge.getTo())));
                region.insertNode(set);
                graph.moveEdgeTarget(outEdge.getFrom(), outEdge.getTo(), set);
                graph.addPlainEdge(set, outEdge.getTo());
            }
            if (logger.isDebugEnabled()) {
                logger.debug("Region {}: exit dispatcher over {}", region.getIndex(), deduplicated);
            }
        } else if (!deduplicated.isEmpty()) {
            exitSuccessor = deduplicated.iterator().next();
        }

        return new NormalizedRegion(region, head, entryDispatcher, exitDispatcher, exitSuccessor, defaultEntrySets, outlinedNodes);
    }

    private static BlockNode createEntryDispatcher(FlowGraph graph, MetaRegion region, Set<Edge> retreatings,
            List<BlockNode> retreatingTargets, List<BlockNode> defaultEntrySets) {
        BlockNode firstCandidate = retreatingTargets.get(0);
        BlockNode dispatcher = graph.addDispatcher("entry dispatcher " + region.getIndex());
        region.insertNode(dispatcher);

        Map<BlockNode, Long> ids = new LinkedHashMap<>();
        long id = 0;
        for (BlockNode target : retreatingTargets) {
            ids.put(target, id);
            graph.addEdge(dispatcher, target, EdgeInfo.labeled(id));
            id++;
        }

        Set<BlockNode> ownSets = new HashSet<>();
        for (Edge retreating : retreatings) {
            BlockNode set = graph.addSetNode(dispatcher.getStateVariable(), ids.get(retreating.getTo()));
            region.insertNode(set);
            ownSets.add(set);
            graph.moveEdgeTarget(retreating.getFrom(), retreating.getTo(), set);
            graph.addPlainEdge(set, dispatcher);
        }

        for (BlockNode pred : new ArrayList<>(firstCandidate.getPredecessors())) {
            if (!region.containsNode(pred)) {
                graph.moveEdgeTarget(pred, firstCandidate, dispatcher);
            }
        }

        // Entering from outside selects the first candidate
        for (BlockNode pred : new ArrayList<>(dispatcher.getPredecessors())) {
            if (!ownSets.contains(pred)) {
                BlockNode set = graph.addSetNode(dispatcher.getStateVariable(), ids.get(firstCandidate));
                graph.moveEdgeTarget(pred, dispatcher, set);
                graph.addPlainEdge(set, dispatcher);
                defaultEntrySets.add(set);
            }
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Region {}: entry dispatcher over {}", region.getIndex(), ids);
        }
        return dispatcher;
    }

    /**
     * Absorbs successors dominated by the head and reached only through one
     * edge leaving the region, as long as more than one successor remains.
     */
    static void refineSuccessors(RegionContext context, MetaRegion region, BlockNode head) {
        FlowGraph graph = context.getGraph();
        int iterationCap = graph.size();
        int iteration = 0;
        Set<BlockNode> successors = region.getSuccessors();
        boolean changed = true;
        while (successors.size() > 1 && changed) {
            Verify.verify(iteration++ < iterationCap,
                    "Successor refinement of region %s did not converge in %s iterations", region.getIndex(), iterationCap);
            changed = false;

            Map<BlockNode, Edge> frontiers = new LinkedHashMap<>();
            for (Edge outEdge : region.getOutEdges()) {
                BlockNode frontier = graph.addEmptyNode("frontier");
                graph.moveEdgeTarget(outEdge.getFrom(), outEdge.getTo(), frontier);
                graph.addPlainEdge(frontier, outEdge.getTo());
                frontiers.put(frontier, outEdge);
            }

            DominatorTree dominatorTree = DominatorTree.dominators(graph);
            for (BlockNode frontier : frontiers.keySet()) {
                for (BlockNode successor : successors) {
                    if (!region.containsNode(successor)
                            && dominatorTree.dominates(head, successor)
                            && dominatorTree.dominates(frontier, successor)
                            && !context.isInAnyRegion(successor)) {
                        region.insertNode(successor);
                        changed = true;
                        if (logger.isDebugEnabled()) {
                            logger.debug("Region {} absorbs successor {}", region.getIndex(), successor);
                        }
                    }
                }
            }

            for (Map.Entry<BlockNode, Edge> entry : frontiers.entrySet()) {
                Edge original = entry.getValue();
                graph.moveEdgeTarget(original.getFrom(), entry.getKey(), original.getTo());
                graph.removeNode(entry.getKey());
            }
            successors = region.getSuccessors();
        }
    }

    /**
     * Copies every non-head node entered from outside of the region, so that
     * the region is entered only through its head. Copies that turn out
     * unreachable are purged later.
     *
     * @return the copies
     */
    static List<BlockNode> outline(FlowGraph graph, MetaRegion region, BlockNode head) {
        Map<BlockNode, BlockNode> clonedMap = new LinkedHashMap<>();
        for (BlockNode node : region.getNodes()) {
            if (node != head) {
                clonedMap.put(node, graph.cloneNode(node, node.getName() + " outlined"));
            }
        }

        for (Map.Entry<BlockNode, BlockNode> entry : clonedMap.entrySet()) {
            BlockNode node = entry.getKey();
            BlockNode clone = entry.getValue();
            for (BlockNode succ : node.getSuccessors()) {
                EdgeInfo info = node.getEdgeInfo(succ).copy();
                BlockNode target = clonedMap.get(succ);
                graph.addEdge(clone, target != null ? target : succ, info);
            }
        }

        Set<BlockNode> clones = new HashSet<>(clonedMap.values());
        for (Map.Entry<BlockNode, BlockNode> entry : clonedMap.entrySet()) {
            BlockNode node = entry.getKey();
            for (BlockNode pred : new ArrayList<>(node.getPredecessors())) {
                if (!region.containsNode(pred) && !clones.contains(pred)) {
                    graph.moveEdgeTarget(pred, node, entry.getValue());
                    if (logger.isDebugEnabled()) {
                        logger.debug("Region {}: {} entered from {} is outlined", region.getIndex(), node, pred);
                    }
                }
            }
        }
        return new ArrayList<>(clonedMap.values());
    }
}
