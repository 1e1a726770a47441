package com.jpexs.decompiler.comb.ast;

import java.util.List;
import java.util.Map;

/**
 * Loop built from a collapsed strongly connected region.
 *
 * @author JPEXS
 */
public class ScsNode extends AstNode {

    public enum LoopType {
        /** Infinite loop left by breaks. */
        STANDARD,
        /** Condition tested before the body. */
        WHILE,
        /** Condition tested after the body. */
        DO_WHILE
    }

    private AstNode body;
    private LoopType loopType = LoopType.STANDARD;
    private IfNode relatedCondition;

    public ScsNode(AstNode body, AstNode successor) {
        super(Kind.SCS, successor);
        this.body = body;
    }

    public AstNode getBody() {
        return body;
    }

    public void setBody(AstNode body) {
        this.body = body;
    }

    public LoopType getLoopType() {
        return loopType;
    }

    /**
     * Gets the if node whose condition controls the loop.
     *
     * @return the related condition, null for a standard loop
     */
    public IfNode getRelatedCondition() {
        return relatedCondition;
    }

    public boolean isWhile() {
        return loopType == LoopType.WHILE;
    }

    public boolean isDoWhile() {
        return loopType == LoopType.DO_WHILE;
    }

    public void setWhile(IfNode condition) {
        loopType = LoopType.WHILE;
        relatedCondition = condition;
    }

    public void setDoWhile(IfNode condition) {
        loopType = LoopType.DO_WHILE;
        relatedCondition = condition;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = super.getChildren();
        if (body != null) {
            children.add(body);
        }
        return children;
    }

    @Override
    AstNode copy() {
        ScsNode result = new ScsNode(body, getSuccessor());
        result.loopType = loopType;
        result.relatedCondition = relatedCondition;
        return result;
    }

    @Override
    void updatePointers(Map<AstNode, AstNode> nodes, Map<ExprNode, ExprNode> exprs) {
        super.updatePointers(nodes, exprs);
        body = substitute(nodes, body);
        if (relatedCondition != null) {
            relatedCondition = (IfNode) substitute(nodes, relatedCondition);
        }
    }

    @Override
    public boolean isEqual(AstNode other) {
        if (!(other instanceof ScsNode)) {
            return false;
        }
        ScsNode scs = (ScsNode) other;
        if (scs.loopType != loopType) {
            return false;
        }
        if (relatedCondition != null && !relatedCondition.getCondition().isEqual(scs.relatedCondition.getCondition())) {
            return false;
        }
        return areEqual(body, scs.body);
    }

    @Override
    public String toString(String indent) {
        StringBuilder sb = new StringBuilder();
        switch (loopType) {
            case WHILE:
                sb.append(indent).append("while (").append(relatedCondition.getCondition()).append(") {\n");
                sb.append(childToString(body, indent + "    "));
                sb.append(indent).append("}\n");
                break;
            case DO_WHILE:
                sb.append(indent).append("do {\n");
                sb.append(childToString(body, indent + "    "));
                sb.append(indent).append("} while (").append(relatedCondition.getCondition()).append(");\n");
                break;
            default:
                sb.append(indent).append("while (true) {\n");
                sb.append(childToString(body, indent + "    "));
                sb.append(indent).append("}\n");
                break;
        }
        return sb.toString();
    }
}
