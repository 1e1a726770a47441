package com.jpexs.decompiler.comb.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Nodes executed one after another.
 *
 * @author JPEXS
 */
public class SequenceNode extends AstNode {

    private final List<AstNode> nodes = new ArrayList<>();

    public SequenceNode(List<AstNode> nodes) {
        super(Kind.SEQUENCE, null);
        this.nodes.addAll(nodes);
    }

    /**
     * Gets the mutable list of nodes.
     *
     * @return nodes in execution order
     */
    public List<AstNode> getNodes() {
        return nodes;
    }

    public void addNode(AstNode node) {
        nodes.add(node);
    }

    public int length() {
        return nodes.size();
    }

    public AstNode getNodeN(int index) {
        return nodes.get(index);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(nodes);
    }

    @Override
    AstNode copy() {
        SequenceNode result = new SequenceNode(nodes);
        result.setSuccessor(getSuccessor());
        return result;
    }

    @Override
    void updatePointers(Map<AstNode, AstNode> substitution, Map<ExprNode, ExprNode> exprs) {
        super.updatePointers(substitution, exprs);
        for (int i = 0; i < nodes.size(); i++) {
            nodes.set(i, substitute(substitution, nodes.get(i)));
        }
    }

    @Override
    public boolean isEqual(AstNode other) {
        if (!(other instanceof SequenceNode)) {
            return false;
        }
        SequenceNode sequence = (SequenceNode) other;
        if (sequence.nodes.size() != nodes.size()) {
            return false;
        }
        for (int i = 0; i < nodes.size(); i++) {
            if (!nodes.get(i).isEqual(sequence.nodes.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString(String indent) {
        StringBuilder sb = new StringBuilder();
        for (AstNode node : nodes) {
            sb.append(node.toString(indent));
        }
        return sb.toString();
    }
}
