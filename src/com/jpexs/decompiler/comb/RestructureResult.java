package com.jpexs.decompiler.comb;

import com.jpexs.decompiler.comb.ast.AstTree;
import com.jpexs.decompiler.comb.cfg.BasicBlock;
import com.jpexs.decompiler.comb.graph.FlowGraph;
import java.util.Collections;
import java.util.Map;

/**
 * Outcome of restructuring one function.
 *
 * @author JPEXS
 */
public class RestructureResult {

    private final String functionName;
    private final AstTree ast;
    private final FlowGraph graph;
    private final Map<BasicBlock, Integer> duplicates;
    private final RestructureMetrics metrics;

    public RestructureResult(String functionName, AstTree ast, FlowGraph graph,
            Map<BasicBlock, Integer> duplicates, RestructureMetrics metrics) {
        this.functionName = functionName;
        this.ast = ast;
        this.graph = graph;
        this.duplicates = Collections.unmodifiableMap(duplicates);
        this.metrics = metrics;
    }

    public String getFunctionName() {
        return functionName;
    }

    public AstTree getAst() {
        return ast;
    }

    /**
     * Gets the acyclic root graph left after collapsing every region.
     */
    public FlowGraph getGraph() {
        return graph;
    }

    /**
     * Gets the number of AST nodes carrying each input block.
     */
    public Map<BasicBlock, Integer> getDuplicates() {
        return duplicates;
    }

    public int getDuplicateCount(BasicBlock block) {
        return duplicates.getOrDefault(block, 0);
    }

    /**
     * Gets the number of extra copies of blocks, summed over all blocks.
     */
    public int getDuplications() {
        return metrics.getDuplications();
    }

    public RestructureMetrics getMetrics() {
        return metrics;
    }

    @Override
    public String toString() {
        return "function " + functionName + " {\n" + ast.getRoot().toString("    ") + "}\n";
    }
}
