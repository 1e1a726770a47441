package com.jpexs.decompiler.comb.ast;

/**
 * Assigns a value to a state variable read by a dispatcher switch.
 *
 * @author JPEXS
 */
public class SetNode extends AstNode {

    private final int stateVariable;
    private final long value;

    public SetNode(int stateVariable, long value, AstNode successor) {
        super(Kind.SET, successor);
        this.stateVariable = stateVariable;
        this.value = value;
    }

    public int getStateVariable() {
        return stateVariable;
    }

    public long getValue() {
        return value;
    }

    @Override
    AstNode copy() {
        return new SetNode(stateVariable, value, getSuccessor());
    }

    @Override
    public boolean isEqual(AstNode other) {
        if (!(other instanceof SetNode)) {
            return false;
        }
        SetNode set = (SetNode) other;
        return set.stateVariable == stateVariable && set.value == value;
    }

    @Override
    public String toString(String indent) {
        return indent + "state_var_" + stateVariable + " = " + value + ";\n";
    }
}
