package com.jpexs.decompiler.comb.ast;

import java.util.Map;

/**
 * Jumps to the head of the innermost enclosing loop.
 *
 * @author JPEXS
 */
public class ContinueNode extends AstNode {

    private IfNode computationIf;
    private boolean implicit;

    public ContinueNode() {
        super(Kind.CONTINUE, null);
    }

    /**
     * Gets the loop condition to evaluate before continuing a while loop.
     *
     * @return the if node of the loop condition, or null
     */
    public IfNode getComputationIf() {
        return computationIf;
    }

    public void addComputationIfNode(IfNode computationIf) {
        this.computationIf = computationIf;
    }

    /**
     * Checks whether the continue is the last statement of its loop body and
     * therefore need not be printed.
     *
     * @return true when implicit
     */
    public boolean isImplicit() {
        return implicit;
    }

    public void setImplicit(boolean implicit) {
        this.implicit = implicit;
    }

    @Override
    public boolean isJump() {
        return true;
    }

    @Override
    AstNode copy() {
        ContinueNode result = new ContinueNode();
        result.computationIf = computationIf;
        result.implicit = implicit;
        result.setSuccessor(getSuccessor());
        return result;
    }

    @Override
    void updatePointers(Map<AstNode, AstNode> nodes, Map<ExprNode, ExprNode> exprs) {
        super.updatePointers(nodes, exprs);
        if (computationIf != null) {
            computationIf = (IfNode) substitute(nodes, computationIf);
        }
    }

    @Override
    public boolean isEqual(AstNode other) {
        return other instanceof ContinueNode;
    }

    @Override
    public String toString(String indent) {
        if (implicit) {
            return "";
        }
        return indent + "continue;\n";
    }
}
