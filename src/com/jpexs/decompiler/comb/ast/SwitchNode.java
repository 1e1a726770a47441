package com.jpexs.decompiler.comb.ast;

import com.google.common.collect.ImmutableSortedSet;
import com.jpexs.decompiler.comb.cfg.BasicBlock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Multi-way branch, either on the value computed by a block or on a state
 * variable assigned by {@link SetNode}s.
 *
 * @author JPEXS
 */
public class SwitchNode extends AstNode {

    /**
     * Case of a switch: the values selecting it and its body.
     */
    public static class Case {

        private final ImmutableSortedSet<Long> labels;
        private AstNode body;

        public Case(Collection<Long> labels, AstNode body) {
            this.labels = ImmutableSortedSet.copyOf(labels);
            this.body = body;
        }

        public ImmutableSortedSet<Long> getLabels() {
            return labels;
        }

        public AstNode getBody() {
            return body;
        }

        public void setBody(AstNode body) {
            this.body = body;
        }
    }

    private final BasicBlock block;        // null when switching on a state variable
    private final int stateVariable;       // -1 when switching on a block
    private final List<Case> cases = new ArrayList<>();
    private AstNode defaultCase;
    private boolean needsStateVariable;
    private boolean needsLoopBreakDispatcher;

    private SwitchNode(BasicBlock block, int stateVariable, AstNode successor) {
        super(Kind.SWITCH, successor);
        this.block = block;
        this.stateVariable = stateVariable;
    }

    /**
     * Creates a switch on the value computed by a block.
     */
    public static SwitchNode onBlock(BasicBlock block, AstNode successor) {
        return new SwitchNode(block, -1, successor);
    }

    /**
     * Creates a switch on a state variable. Such a switch needs the variable to be declared.
     */
    public static SwitchNode onStateVariable(int stateVariable, AstNode successor) {
        SwitchNode result = new SwitchNode(null, stateVariable, successor);
        result.needsStateVariable = true;
        return result;
    }

    @Override
    public BasicBlock getBlock() {
        return block;
    }

    public int getStateVariable() {
        return stateVariable;
    }

    public boolean isDispatcher() {
        return block == null;
    }

    public List<Case> getCases() {
        return Collections.unmodifiableList(cases);
    }

    public void addCase(Collection<Long> labels, AstNode body) {
        cases.add(new Case(labels, body));
    }

    public AstNode getDefault() {
        return defaultCase;
    }

    public void setDefault(AstNode defaultCase) {
        this.defaultCase = defaultCase;
    }

    public boolean needsStateVariable() {
        return needsStateVariable;
    }

    /**
     * Checks whether a case leaves the enclosing loop, so that the switch must
     * be followed by a check of the loop break flag.
     *
     * @return true when the check is needed
     */
    public boolean needsLoopBreakDispatcher() {
        return needsLoopBreakDispatcher;
    }

    public void setNeedsLoopBreakDispatcher(boolean needsLoopBreakDispatcher) {
        this.needsLoopBreakDispatcher = needsLoopBreakDispatcher;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = super.getChildren();
        for (Case switchCase : cases) {
            if (switchCase.body != null) {
                children.add(switchCase.body);
            }
        }
        if (defaultCase != null) {
            children.add(defaultCase);
        }
        return children;
    }

    @Override
    AstNode copy() {
        SwitchNode result = new SwitchNode(block, stateVariable, getSuccessor());
        for (Case switchCase : cases) {
            result.cases.add(new Case(switchCase.labels, switchCase.body));
        }
        result.defaultCase = defaultCase;
        result.needsStateVariable = needsStateVariable;
        result.needsLoopBreakDispatcher = needsLoopBreakDispatcher;
        return result;
    }

    @Override
    void updatePointers(Map<AstNode, AstNode> nodes, Map<ExprNode, ExprNode> exprs) {
        super.updatePointers(nodes, exprs);
        for (Case switchCase : cases) {
            switchCase.body = substitute(nodes, switchCase.body);
        }
        defaultCase = substitute(nodes, defaultCase);
    }

    @Override
    public boolean isEqual(AstNode other) {
        if (!(other instanceof SwitchNode)) {
            return false;
        }
        SwitchNode switchNode = (SwitchNode) other;
        if (block == null ? switchNode.block != null : !block.equals(switchNode.block)) {
            return false;
        }
        if (switchNode.stateVariable != stateVariable) {
            return false;
        }
        if (switchNode.cases.size() != cases.size() || !areEqual(defaultCase, switchNode.defaultCase)) {
            return false;
        }
        for (int i = 0; i < cases.size(); i++) {
            Case case1 = cases.get(i);
            Case case2 = switchNode.cases.get(i);
            if (!case1.labels.equals(case2.labels) || !areEqual(case1.body, case2.body)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString(String indent) {
        StringBuilder sb = new StringBuilder();
        String subject = block != null ? block.getName() : "state_var_" + stateVariable;
        sb.append(indent).append("switch (").append(subject).append(") {\n");
        for (Case switchCase : cases) {
            for (Long label : switchCase.labels) {
                sb.append(indent).append("    case ").append(label).append(":\n");
            }
            sb.append(childToString(switchCase.body, indent + "        "));
        }
        if (defaultCase != null) {
            sb.append(indent).append("    default:\n");
            sb.append(defaultCase.toString(indent + "        "));
        }
        sb.append(indent).append("}\n");
        if (needsLoopBreakDispatcher) {
            sb.append(indent).append("if (loop_break) {\n");
            sb.append(indent).append("    break;\n");
            sb.append(indent).append("}\n");
        }
        return sb.toString();
    }
}
