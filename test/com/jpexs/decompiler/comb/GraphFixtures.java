package com.jpexs.decompiler.comb;

import com.jpexs.decompiler.comb.cfg.GraphvizReader;
import com.jpexs.decompiler.comb.graph.BlockNode;
import com.jpexs.decompiler.comb.graph.Edge;
import com.jpexs.decompiler.comb.graph.FlowGraph;
import com.jpexs.decompiler.comb.region.MetaRegion;
import com.jpexs.decompiler.comb.region.RegionContext;
import com.jpexs.decompiler.comb.region.RegionDetector;
import com.jpexs.decompiler.comb.region.RegionNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Graphs shared by the tests.
 *
 * @author JPEXS
 */
public final class GraphFixtures {

    public static final String SEQUENCE = "digraph sequence {\n"
            + "  A -> B;\n"
            + "  B -> C;\n"
            + "}";

    public static final String DIAMOND = "digraph diamond {\n"
            + "  A -> B;\n"
            + "  A -> C;\n"
            + "  B -> D;\n"
            + "  C -> D;\n"
            + "}";

    public static final String SELF_LOOP = "digraph self_loop {\n"
            + "  A -> B;\n"
            + "  B -> B;\n"
            + "  B -> C;\n"
            + "}";

    /**
     * Loop entered both at A and at C.
     */
    public static final String IRREDUCIBLE = "digraph irreducible {\n"
            + "  E -> A;\n"
            + "  E -> C;\n"
            + "  A -> B;\n"
            + "  B -> C;\n"
            + "  B -> A;\n"
            + "  C -> B;\n"
            + "  C -> X;\n"
            + "}";

    /**
     * Loop over the switch H, left from the switch to X and from B to Y.
     */
    public static final String TWO_EXITS = "digraph two_exits {\n"
            + "  E -> H;\n"
            + "  E -> Y;\n"
            + "  H -> A [cases=\"1\"];\n"
            + "  H -> X [cases=\"2\"];\n"
            + "  H -> B;\n"
            + "  A -> H;\n"
            + "  B -> Y;\n"
            + "  B -> H;\n"
            + "  Y -> X;\n"
            + "}";

    public static final String NESTED_LOOPS = "digraph nested_loops {\n"
            + "  A -> B;\n"
            + "  B -> C;\n"
            + "  C -> C;\n"
            + "  C -> D;\n"
            + "  D -> B;\n"
            + "  D -> E;\n"
            + "}";

    public static final String WHILE_LOOP = "digraph while_loop {\n"
            + "  A -> H;\n"
            + "  H -> B;\n"
            + "  H -> X;\n"
            + "  B -> H;\n"
            + "}";

    private GraphFixtures() {
    }

    public static FlowGraph importGraph(String dot) {
        return FlowGraph.fromControlFlowGraph(GraphvizReader.read(dot));
    }

    public static BlockNode node(FlowGraph graph, String name) {
        for (BlockNode node : graph.getNodes()) {
            if (node.getName().equals(name)) {
                return node;
            }
        }
        throw new AssertionError("No node " + name + " in " + graph);
    }

    public static List<BlockNode> nodesOfType(FlowGraph graph, BlockNode.Type type) {
        List<BlockNode> result = new ArrayList<>();
        for (BlockNode node : graph.getNodes()) {
            if (node.getType() == type) {
                result.add(node);
            }
        }
        return result;
    }

    /**
     * Runs region detection and merging on an imported graph.
     */
    public static RegionContext prepareRegions(FlowGraph graph) {
        Set<Edge> backedges = RegionDetector.insertBackedgeDummies(graph);
        Map<Edge, MetaRegion> backedgeRegions = RegionDetector.createMetaRegions(graph, backedges);
        List<MetaRegion> regions = RegionNormalizer.prepareRegions(backedgeRegions, backedges);
        return new RegionContext(graph, backedges, regions);
    }

    /**
     * Lists a graph and all graphs nested in its collapsed nodes.
     */
    public static List<FlowGraph> allGraphs(FlowGraph graph) {
        List<FlowGraph> result = new ArrayList<>();
        result.add(graph);
        for (BlockNode node : graph.getNodes()) {
            if (node.isCollapsed()) {
                result.addAll(allGraphs(node.getCollapsedGraph()));
            }
        }
        return result;
    }
}
