package com.jpexs.decompiler.comb.ast;

import com.jpexs.decompiler.comb.cfg.BasicBlock;

/**
 * Straight-line code of a basic block.
 *
 * @author JPEXS
 */
public class CodeNode extends AstNode {

    private final BasicBlock block;

    public CodeNode(BasicBlock block, AstNode successor) {
        super(Kind.CODE, successor);
        this.block = block;
    }

    @Override
    public BasicBlock getBlock() {
        return block;
    }

    @Override
    AstNode copy() {
        return new CodeNode(block, getSuccessor());
    }

    @Override
    public boolean isEqual(AstNode other) {
        return other instanceof CodeNode && ((CodeNode) other).block.equals(block);
    }

    @Override
    public String toString(String indent) {
        return indent + block.getName() + ";\n";
    }
}
