package com.jpexs.decompiler.comb.ast;

/**
 * Conditional or of two conditions.
 *
 * @author JPEXS
 */
public class OrNode extends BinaryExprNode {

    public OrNode(ExprNode left, ExprNode right) {
        super(Kind.OR, left, right);
    }

    @Override
    ExprNode copy() {
        return new OrNode(getLeft(), getRight());
    }

    @Override
    protected String getOperator() {
        return "||";
    }
}
