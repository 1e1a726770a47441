package com.jpexs.decompiler.comb.ast;

import com.jpexs.decompiler.comb.cfg.BasicBlock;
import java.util.List;
import java.util.Map;

/**
 * Short-circuit combination of two conditions.
 *
 * @author JPEXS
 */
public abstract class BinaryExprNode extends ExprNode {

    private ExprNode left;
    private ExprNode right;

    protected BinaryExprNode(Kind kind, ExprNode left, ExprNode right) {
        super(kind);
        this.left = left;
        this.right = right;
    }

    public ExprNode getLeft() {
        return left;
    }

    public ExprNode getRight() {
        return right;
    }

    protected abstract String getOperator();

    @Override
    void updatePointers(Map<ExprNode, ExprNode> substitution) {
        left = substitute(substitution, left);
        right = substitute(substitution, right);
    }

    @Override
    public void collectBlocks(List<BasicBlock> result) {
        left.collectBlocks(result);
        right.collectBlocks(result);
    }

    @Override
    public boolean isEqual(ExprNode other) {
        if (other == null || other.getKind() != getKind()) {
            return false;
        }
        BinaryExprNode binary = (BinaryExprNode) other;
        return left.isEqual(binary.left) && right.isEqual(binary.right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + getOperator() + " " + right + ")";
    }
}
