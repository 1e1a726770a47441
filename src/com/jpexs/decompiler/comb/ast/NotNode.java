package com.jpexs.decompiler.comb.ast;

import com.jpexs.decompiler.comb.cfg.BasicBlock;
import java.util.List;
import java.util.Map;

/**
 * Negated condition.
 *
 * @author JPEXS
 */
public class NotNode extends ExprNode {

    private ExprNode child;

    public NotNode(ExprNode child) {
        super(Kind.NOT);
        this.child = child;
    }

    public ExprNode getChild() {
        return child;
    }

    @Override
    ExprNode copy() {
        return new NotNode(child);
    }

    @Override
    void updatePointers(Map<ExprNode, ExprNode> substitution) {
        child = substitute(substitution, child);
    }

    @Override
    public void collectBlocks(List<BasicBlock> result) {
        child.collectBlocks(result);
    }

    @Override
    public boolean isEqual(ExprNode other) {
        return other instanceof NotNode && child.isEqual(((NotNode) other).child);
    }

    @Override
    public String toString() {
        return "!" + child;
    }
}
