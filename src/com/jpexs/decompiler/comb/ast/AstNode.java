package com.jpexs.decompiler.comb.ast;

import com.google.common.base.Verify;
import com.jpexs.decompiler.comb.cfg.BasicBlock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Base class for all nodes of the structured AST.
 * <p>
 * While the AST is built, nodes executed one after another are chained
 * through {@link #getSuccessor()}. Once the chains are turned into
 * {@link SequenceNode}s, the successor of every node is null.
 *
 * @author JPEXS
 */
public abstract class AstNode {

    public enum Kind {
        CODE, BREAK, CONTINUE, IF, SCS, SEQUENCE, SWITCH, SWITCH_BREAK, SET
    }

    private final Kind kind;
    private int id = -1;
    private AstNode successor;

    protected AstNode(Kind kind, AstNode successor) {
        this.kind = kind;
        this.successor = successor;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Gets the id of the node within its tree.
     *
     * @return the id, -1 when the node was not added to a tree
     */
    public int getId() {
        return id;
    }

    void setId(int id) {
        this.id = id;
    }

    public AstNode getSuccessor() {
        return successor;
    }

    public void setSuccessor(AstNode successor) {
        this.successor = successor;
    }

    /**
     * Gets the block whose code this node carries.
     *
     * @return the block, or null for purely structural nodes
     */
    public BasicBlock getBlock() {
        return null;
    }

    /**
     * Gets the nested nodes, in execution order. Null slots are skipped and
     * the successor is not included.
     *
     * @return list of children
     */
    public List<AstNode> getChildren() {
        return new ArrayList<>();
    }

    /**
     * Checks whether the node ends the execution of its enclosing sequence
     * (break, continue, switch break).
     */
    public boolean isJump() {
        return false;
    }

    /**
     * Creates a copy pointing to the same children and expressions.
     */
    abstract AstNode copy();

    /**
     * Redirects children, successor and expressions to their copies.
     */
    void updatePointers(Map<AstNode, AstNode> nodes, Map<ExprNode, ExprNode> exprs) {
        successor = substitute(nodes, successor);
    }

    /**
     * Structural comparison: same kinds, same blocks and equal children.
     * Ids and successors are not compared.
     *
     * @param other node to compare with, may be null
     * @return true when equal
     */
    public abstract boolean isEqual(AstNode other);

    /**
     * Generates pseudocode of the node.
     *
     * @param indent the indentation to use
     * @return pseudocode
     */
    public abstract String toString(String indent);

    @Override
    public String toString() {
        return toString("");
    }

    static AstNode substitute(Map<AstNode, AstNode> nodes, AstNode node) {
        if (node == null) {
            return null;
        }
        AstNode result = nodes.get(node);
        Verify.verify(result != null, "Node %s has no copy", node.getId());
        return result;
    }

    static boolean areEqual(AstNode a, AstNode b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.isEqual(b);
    }

    static String childToString(AstNode node, String indent) {
        return node == null ? "" : node.toString(indent);
    }
}
