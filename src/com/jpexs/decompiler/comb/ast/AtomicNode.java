package com.jpexs.decompiler.comb.ast;

import com.jpexs.decompiler.comb.cfg.BasicBlock;
import java.util.List;
import java.util.Map;

/**
 * Branch condition computed by a single block.
 *
 * @author JPEXS
 */
public class AtomicNode extends ExprNode {

    private final BasicBlock block;

    public AtomicNode(BasicBlock block) {
        super(Kind.ATOMIC);
        this.block = block;
    }

    public BasicBlock getBlock() {
        return block;
    }

    @Override
    ExprNode copy() {
        return new AtomicNode(block);
    }

    @Override
    void updatePointers(Map<ExprNode, ExprNode> substitution) {
    }

    @Override
    public void collectBlocks(List<BasicBlock> result) {
        result.add(block);
    }

    @Override
    public boolean isEqual(ExprNode other) {
        return other instanceof AtomicNode && ((AtomicNode) other).block.equals(block);
    }

    @Override
    public String toString() {
        return block.getName();
    }
}
