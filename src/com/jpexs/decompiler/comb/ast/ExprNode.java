package com.jpexs.decompiler.comb.ast;

import com.jpexs.decompiler.comb.cfg.BasicBlock;
import java.util.List;
import java.util.Map;

/**
 * Condition expression of an if node, owned by the expression arena of an {@link AstTree}.
 *
 * @author JPEXS
 */
public abstract class ExprNode {

    public enum Kind {
        ATOMIC, NOT, AND, OR
    }

    private final Kind kind;

    protected ExprNode(Kind kind) {
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Creates a copy pointing to the same children.
     */
    abstract ExprNode copy();

    /**
     * Redirects the children to their copies.
     */
    abstract void updatePointers(Map<ExprNode, ExprNode> substitution);

    /**
     * Collects the blocks whose branch conditions the expression combines.
     *
     * @param result receives the blocks, in evaluation order
     */
    public abstract void collectBlocks(List<BasicBlock> result);

    /**
     * Compares structure and referenced blocks.
     */
    public abstract boolean isEqual(ExprNode other);

    static ExprNode substitute(Map<ExprNode, ExprNode> substitution, ExprNode expr) {
        if (expr == null) {
            return null;
        }
        ExprNode result = substitution.get(expr);
        return result == null ? expr : result;
    }
}
