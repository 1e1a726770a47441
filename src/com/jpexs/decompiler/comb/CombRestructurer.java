package com.jpexs.decompiler.comb;

import com.google.common.base.Preconditions;
import com.google.common.base.VerifyException;
import com.jpexs.decompiler.comb.ast.AstBuilder;
import com.jpexs.decompiler.comb.ast.AstNode;
import com.jpexs.decompiler.comb.ast.AstNormalizer;
import com.jpexs.decompiler.comb.ast.AstTree;
import com.jpexs.decompiler.comb.ast.ContinueNode;
import com.jpexs.decompiler.comb.ast.ExprNode;
import com.jpexs.decompiler.comb.ast.IfNode;
import com.jpexs.decompiler.comb.ast.ScsNode;
import com.jpexs.decompiler.comb.ast.SwitchNode;
import com.jpexs.decompiler.comb.cfg.BasicBlock;
import com.jpexs.decompiler.comb.cfg.ControlFlowGraph;
import com.jpexs.decompiler.comb.graph.BlockNode;
import com.jpexs.decompiler.comb.graph.Edge;
import com.jpexs.decompiler.comb.graph.FlowGraph;
import com.jpexs.decompiler.comb.region.MetaRegion;
import com.jpexs.decompiler.comb.region.NormalizedRegion;
import com.jpexs.decompiler.comb.region.RegionCollapser;
import com.jpexs.decompiler.comb.region.RegionContext;
import com.jpexs.decompiler.comb.region.RegionDetector;
import com.jpexs.decompiler.comb.region.RegionNormalizer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the control flow graph of a function into a structured AST.
 * <p>
 * Every loop is first isolated as a region with a single entry and a single
 * exit, introducing dispatchers on a state variable where the loop has several
 * entries or exits. Regions are collapsed into single nodes, innermost first,
 * leaving acyclic graphs from which the AST is built by duplicating code
 * instead of using gotos.
 * <p>
 * Instances hold only immutable options and may be shared between threads.
 *
 * @author JPEXS
 */
public class CombRestructurer {

    private static final Logger logger = LoggerFactory.getLogger(CombRestructurer.class);

    private final StructuringOptions options;

    public CombRestructurer() {
        this(StructuringOptions.defaults());
    }

    public CombRestructurer(StructuringOptions options) {
        this.options = Preconditions.checkNotNull(options, "options");
    }

    public StructuringOptions getOptions() {
        return options;
    }

    /**
     * Outcome of restructuring several functions.
     */
    public static class BatchResult {

        private final Map<String, RestructureResult> results = new LinkedHashMap<>();
        private final Map<String, RuntimeException> failures = new LinkedHashMap<>();

        public Map<String, RestructureResult> getResults() {
            return Collections.unmodifiableMap(results);
        }

        public Map<String, RuntimeException> getFailures() {
            return Collections.unmodifiableMap(failures);
        }
    }

    /**
     * Restructures every function independently. A function that fails is
     * logged and reported, the remaining ones are still processed.
     *
     * @param functions the functions
     * @return results and failures, by function name
     */
    public BatchResult restructureAll(List<ControlFlowGraph> functions) {
        BatchResult batch = new BatchResult();
        for (ControlFlowGraph function : functions) {
            String name = function.getFunctionName();
            if (options.getTargetFunction() != null && !options.getTargetFunction().equals(name)) {
                continue;
            }
            try {
                batch.results.put(name, restructure(function));
            } catch (IllegalArgumentException ex) {
                logger.warn("Skipping malformed function {}: {}", name, ex.getMessage());
                batch.failures.put(name, ex);
            } catch (RuntimeException ex) {
                logger.error("Skipping function {}", name, ex);
                batch.failures.put(name, ex);
            }
        }
        logger.info("Restructured {} functions, {} failed", batch.results.size(), batch.failures.size());
        return batch;
    }

    /**
     * Restructures one function.
     *
     * @param function the lifted function
     * @return the structured result
     * @throws IllegalArgumentException when the input is malformed
     * @throws RestructuringException when an internal invariant breaks
     * @throws UncheckedIOException when metrics or debug graphs cannot be written
     */
    public RestructureResult restructure(ControlFlowGraph function) {
        String name = function.getFunctionName();
        FlowGraph graph = FlowGraph.fromControlFlowGraph(function);
        try {
            return restructure(name, graph);
        } catch (VerifyException ex) {
            throw new RestructuringException(name, ex.getMessage(), ex);
        }
    }

    private RestructureResult restructure(String name, FlowGraph graph) {
        long initialWeight = 0;
        for (BlockNode node : graph.getNodes()) {
            initialWeight += node.getWeight();
        }
        dumpGraph(name, "0-input.dot", graph.toGraphviz());

        if (graph.getEntryNode() != null) {
            Set<Edge> backedges = RegionDetector.insertBackedgeDummies(graph);
            Map<Edge, MetaRegion> backedgeRegions = RegionDetector.createMetaRegions(graph, backedges);
            List<MetaRegion> regions = RegionNormalizer.prepareRegions(backedgeRegions, backedges);
            RegionContext context = new RegionContext(graph, backedges, regions);
            for (MetaRegion region : regions) {
                NormalizedRegion normalized = RegionNormalizer.normalize(context, region);
                if (normalized == null) {
                    logger.debug("Region {} has no retreating edge left, skipped", region.getIndex());
                    continue;
                }
                RegionCollapser.collapse(context, normalized);
            }
            RegionCollapser.verifyAcyclic(context);
        }
        dumpGraph(name, "1-collapsed.dot", graph.toGraphviz());

        AstBuilder builder = new AstBuilder();
        AstTree ast = builder.build(graph);
        new AstNormalizer(options.getShortCircuitMaxWeight()).normalize(ast);
        dumpGraph(name, "2-ast.dot", ast.toGraphviz(name));

        Map<BasicBlock, Integer> duplicates = new LinkedHashMap<>();
        long astWeight = 0;
        for (AstNode node : ast.reachableNodes()) {
            for (BasicBlock block : carriedBlocks(node)) {
                duplicates.merge(block, 1, Integer::sum);
            }
            astWeight += weight(node);
        }
        int duplications = 0;
        for (int count : duplicates.values()) {
            duplications += count - 1;
        }
        double percentage = initialWeight == 0 ? 0.0 : (double) astWeight / initialWeight;
        RestructureMetrics metrics = new RestructureMetrics(name, duplications, percentage,
                builder.getTentativeUntangles(), builder.getPerformedUntangles(), initialWeight);
        if (options.getMetricsOutputDir() != null) {
            new MetricsWriter(options.getMetricsOutputDir()).write(metrics);
        }
        logger.debug("Function {} restructured: {}", name, metrics);
        return new RestructureResult(name, ast, graph, duplicates, metrics);
    }

    /**
     * Lists the input blocks whose code an AST node emits.
     */
    static List<BasicBlock> carriedBlocks(AstNode node) {
        List<BasicBlock> result = new ArrayList<>();
        switch (node.getKind()) {
            case CODE:
                result.add(node.getBlock());
                break;
            case IF:
                collectDistinct(((IfNode) node).getCondition(), result);
                break;
            case SWITCH:
                if (!((SwitchNode) node).isDispatcher()) {
                    result.add(node.getBlock());
                }
                break;
            case SCS:
                ScsNode scs = (ScsNode) node;
                if (scs.isWhile()) {
                    collectDistinct(scs.getRelatedCondition().getCondition(), result);
                } else if (scs.isDoWhile()) {
                    // the condition block itself stays in the body as code
                    collectDistinct(scs.getRelatedCondition().getCondition(), result);
                    result.remove(scs.getRelatedCondition().getBlock());
                }
                break;
            default:
                break;
        }
        return result;
    }

    private static void collectDistinct(ExprNode condition, List<BasicBlock> result) {
        List<BasicBlock> blocks = new ArrayList<>();
        condition.collectBlocks(blocks);
        for (BasicBlock block : blocks) {
            if (!result.contains(block)) {
                result.add(block);
            }
        }
    }

    /**
     * Weight of the code a node prints, not counting its children.
     */
    static long weight(AstNode node) {
        switch (node.getKind()) {
            case CODE:
            case IF:
                long sum = 0;
                for (BasicBlock block : carriedBlocks(node)) {
                    sum += block.getWeight();
                }
                return sum;
            case SWITCH:
                return ((SwitchNode) node).isDispatcher() ? 1 : node.getBlock().getWeight();
            case SCS:
                long loopWeight = 1;
                for (BasicBlock block : carriedBlocks(node)) {
                    loopWeight += block.getWeight();
                }
                return loopWeight;
            case CONTINUE:
                return ((ContinueNode) node).isImplicit() ? 0 : 1;
            case SET:
            case BREAK:
            case SWITCH_BREAK:
                return 1;
            default:
                return 0;
        }
    }

    private void dumpGraph(String function, String fileName, String dot) {
        Path dir = options.getDebugGraphsDir();
        if (dir == null) {
            return;
        }
        Path file = dir.resolve(function).resolve(fileName);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, dot, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot write debug graph " + file, ex);
        }
    }
}
