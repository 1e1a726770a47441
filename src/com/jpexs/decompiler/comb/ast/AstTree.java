package com.jpexs.decompiler.comb.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Arena owning the nodes and condition expressions of one AST.
 * Node ids are dense and assigned when a node is added.
 *
 * @author JPEXS
 */
public class AstTree {

    private final List<AstNode> nodes = new ArrayList<>();
    private final List<ExprNode> condExprs = new ArrayList<>();
    private AstNode root;

    public <T extends AstNode> T addNode(T node) {
        node.setId(nodes.size());
        nodes.add(node);
        return node;
    }

    public <T extends ExprNode> T addCondExpr(T expr) {
        condExprs.add(expr);
        return expr;
    }

    public AstNode getRoot() {
        return root;
    }

    public void setRoot(AstNode root) {
        this.root = root;
    }

    /**
     * Gets every node ever added, including nodes detached by normalization.
     */
    public List<AstNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int size() {
        return nodes.size();
    }

    public List<ExprNode> getCondExprs() {
        return Collections.unmodifiableList(condExprs);
    }

    /**
     * Copies all nodes and expressions of another tree into this one. Every
     * internal pointer of the copies is redirected to the corresponding copy.
     * The other tree is left untouched.
     *
     * @param other tree to copy
     * @return copy of the other tree's root
     */
    public AstNode copyFrom(AstTree other) {
        Map<AstNode, AstNode> nodeSubstitution = new HashMap<>();
        Map<ExprNode, ExprNode> exprSubstitution = new HashMap<>();
        for (ExprNode expr : other.condExprs) {
            exprSubstitution.put(expr, addCondExpr(expr.copy()));
        }
        for (ExprNode expr : exprSubstitution.values()) {
            expr.updatePointers(exprSubstitution);
        }
        List<AstNode> copies = new ArrayList<>();
        for (AstNode node : other.nodes) {
            AstNode copy = addNode(node.copy());
            nodeSubstitution.put(node, copy);
            copies.add(copy);
        }
        for (AstNode copy : copies) {
            copy.updatePointers(nodeSubstitution, exprSubstitution);
        }
        return other.root == null ? null : nodeSubstitution.get(other.root);
    }

    /**
     * Lists the nodes reachable from the root in pre-order, following children
     * and successors.
     *
     * @return reachable nodes
     */
    public List<AstNode> reachableNodes() {
        List<AstNode> result = new ArrayList<>();
        if (root == null) {
            return result;
        }
        Deque<AstNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            AstNode node = stack.pop();
            result.add(node);
            if (node.getSuccessor() != null) {
                stack.push(node.getSuccessor());
            }
            List<AstNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    public boolean isEqual(AstTree other) {
        return AstNode.areEqual(root, other.root);
    }

    /**
     * Generates a Graphviz/DOT representation of the reachable nodes.
     *
     * @param name graph name
     * @return DOT format string
     */
    public String toGraphviz(String name) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph \"").append(name).append("\" {\n");
        for (AstNode node : reachableNodes()) {
            sb.append("  n").append(node.getId()).append(" [label=\"").append(dotLabel(node)).append("\" shape=")
                    .append(node.getKind() == AstNode.Kind.IF || node.getKind() == AstNode.Kind.SWITCH ? "diamond" : "box")
                    .append("];\n");
        }
        for (AstNode node : reachableNodes()) {
            for (AstNode child : node.getChildren()) {
                sb.append("  n").append(node.getId()).append("->n").append(child.getId()).append(";\n");
            }
            if (node.getSuccessor() != null) {
                sb.append("  n").append(node.getId()).append("->n").append(node.getSuccessor().getId())
                        .append(" [style=dashed];\n");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private static String dotLabel(AstNode node) {
        switch (node.getKind()) {
            case CODE:
                return node.getBlock().getName();
            case IF:
                return "if " + ((IfNode) node).getCondition();
            case SCS:
                return ((ScsNode) node).getLoopType().toString().toLowerCase();
            case SWITCH:
                SwitchNode switchNode = (SwitchNode) node;
                return "switch " + (switchNode.isDispatcher() ? "state_var_" + switchNode.getStateVariable() : switchNode.getBlock().getName());
            case SET:
                return "state_var_" + ((SetNode) node).getStateVariable() + " = " + ((SetNode) node).getValue();
            default:
                return node.getKind().toString().toLowerCase();
        }
    }

    @Override
    public String toString() {
        return root == null ? "" : root.toString("");
    }
}
