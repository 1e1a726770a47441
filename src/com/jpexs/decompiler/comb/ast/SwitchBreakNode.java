package com.jpexs.decompiler.comb.ast;

/**
 * Leaves the innermost enclosing switch.
 *
 * @author JPEXS
 */
public class SwitchBreakNode extends AstNode {

    public SwitchBreakNode() {
        super(Kind.SWITCH_BREAK, null);
    }

    @Override
    public boolean isJump() {
        return true;
    }

    @Override
    AstNode copy() {
        SwitchBreakNode result = new SwitchBreakNode();
        result.setSuccessor(getSuccessor());
        return result;
    }

    @Override
    public boolean isEqual(AstNode other) {
        return other instanceof SwitchBreakNode;
    }

    @Override
    public String toString(String indent) {
        return indent + "break;\n";
    }
}
