package com.jpexs.decompiler.comb.ast;

import com.jpexs.decompiler.comb.cfg.BasicBlock;
import java.util.List;
import java.util.Map;

/**
 * Two-way branch on the condition computed by a block.
 *
 * @author JPEXS
 */
public class IfNode extends AstNode {

    private final BasicBlock block;
    private ExprNode condition;
    private AstNode thenBranch;
    private AstNode elseBranch;

    /**
     * Creates a new if node.
     *
     * @param block block computing the condition
     * @param condition the condition expression
     * @param thenBranch executed when the condition holds, may be null
     * @param elseBranch executed otherwise, may be null
     * @param successor node executed afterwards, may be null
     */
    public IfNode(BasicBlock block, ExprNode condition, AstNode thenBranch, AstNode elseBranch, AstNode successor) {
        super(Kind.IF, successor);
        this.block = block;
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    @Override
    public BasicBlock getBlock() {
        return block;
    }

    public ExprNode getCondition() {
        return condition;
    }

    public void setCondition(ExprNode condition) {
        this.condition = condition;
    }

    public AstNode getThen() {
        return thenBranch;
    }

    public void setThen(AstNode thenBranch) {
        this.thenBranch = thenBranch;
    }

    public AstNode getElse() {
        return elseBranch;
    }

    public void setElse(AstNode elseBranch) {
        this.elseBranch = elseBranch;
    }

    /**
     * Swaps the branches. The caller is responsible for negating the condition.
     */
    public void swapBranches() {
        AstNode tmp = thenBranch;
        thenBranch = elseBranch;
        elseBranch = tmp;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = super.getChildren();
        if (thenBranch != null) {
            children.add(thenBranch);
        }
        if (elseBranch != null) {
            children.add(elseBranch);
        }
        return children;
    }

    @Override
    AstNode copy() {
        return new IfNode(block, condition, thenBranch, elseBranch, getSuccessor());
    }

    @Override
    void updatePointers(Map<AstNode, AstNode> nodes, Map<ExprNode, ExprNode> exprs) {
        super.updatePointers(nodes, exprs);
        thenBranch = substitute(nodes, thenBranch);
        elseBranch = substitute(nodes, elseBranch);
        condition = ExprNode.substitute(exprs, condition);
    }

    @Override
    public boolean isEqual(AstNode other) {
        if (!(other instanceof IfNode)) {
            return false;
        }
        IfNode ifNode = (IfNode) other;
        return ifNode.block.equals(block)
                && ifNode.condition.isEqual(condition)
                && areEqual(thenBranch, ifNode.thenBranch)
                && areEqual(elseBranch, ifNode.elseBranch);
    }

    @Override
    public String toString(String indent) {
        StringBuilder sb = new StringBuilder();
        sb.append(indent).append("if (").append(condition).append(") {\n");
        sb.append(childToString(thenBranch, indent + "    "));
        String elseCode = elseBranch == null ? "" : elseBranch.toString(indent + "    ");
        if (!elseCode.isEmpty()) {
            sb.append(indent).append("} else {\n");
            sb.append(elseCode);
        }
        sb.append(indent).append("}\n");
        return sb.toString();
    }
}
