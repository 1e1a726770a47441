package com.jpexs.decompiler.comb.ast;

/**
 * Leaves the innermost enclosing loop.
 *
 * @author JPEXS
 */
public class BreakNode extends AstNode {

    private boolean breakFromWithinSwitch;

    public BreakNode() {
        super(Kind.BREAK, null);
    }

    /**
     * Checks whether the break sits inside a switch of the loop it leaves, so
     * that a plain break would only leave the switch.
     *
     * @return true when inside a switch
     */
    public boolean isBreakFromWithinSwitch() {
        return breakFromWithinSwitch;
    }

    public void setBreakFromWithinSwitch(boolean breakFromWithinSwitch) {
        this.breakFromWithinSwitch = breakFromWithinSwitch;
    }

    @Override
    public boolean isJump() {
        return true;
    }

    @Override
    AstNode copy() {
        BreakNode result = new BreakNode();
        result.breakFromWithinSwitch = breakFromWithinSwitch;
        result.setSuccessor(getSuccessor());
        return result;
    }

    @Override
    public boolean isEqual(AstNode other) {
        return other instanceof BreakNode;
    }

    @Override
    public String toString(String indent) {
        if (breakFromWithinSwitch) {
            return indent + "loop_break = true;\n" + indent + "break;\n";
        }
        return indent + "break;\n";
    }
}
