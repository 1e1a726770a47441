package com.jpexs.decompiler.comb.ast;

/**
 * Conditional and of two conditions.
 *
 * @author JPEXS
 */
public class AndNode extends BinaryExprNode {

    public AndNode(ExprNode left, ExprNode right) {
        super(Kind.AND, left, right);
    }

    @Override
    ExprNode copy() {
        return new AndNode(getLeft(), getRight());
    }

    @Override
    protected String getOperator() {
        return "&&";
    }
}
