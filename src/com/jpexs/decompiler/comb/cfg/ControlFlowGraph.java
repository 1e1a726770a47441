package com.jpexs.decompiler.comb.cfg;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Control flow graph of a single lifted function.
 *
 * @author JPEXS
 */
public class ControlFlowGraph {

    private final String functionName;
    private final long entryAddress;
    private final Map<Long, BasicBlock> blocks = new LinkedHashMap<>();

    public ControlFlowGraph(String functionName, long entryAddress) {
        this.functionName = Preconditions.checkNotNull(functionName, "functionName");
        this.entryAddress = entryAddress;
    }

    /**
     * Adds a block to the function.
     *
     * @param block the block
     * @return the block, for chaining edge creation
     * @throws IllegalArgumentException when a block with the same address exists
     */
    public BasicBlock addBlock(BasicBlock block) {
        Preconditions.checkArgument(!blocks.containsKey(block.getAddress()),
                "Duplicate block address 0x%s in function %s", Long.toHexString(block.getAddress()), functionName);
        blocks.put(block.getAddress(), block);
        return block;
    }

    public String getFunctionName() {
        return functionName;
    }

    public long getEntryAddress() {
        return entryAddress;
    }

    /**
     * Gets the entry block.
     *
     * @return the entry block, null for an empty function body
     */
    public BasicBlock getEntryBlock() {
        return blocks.get(entryAddress);
    }

    public BasicBlock getBlock(long address) {
        return blocks.get(address);
    }

    public List<BasicBlock> getBlocks() {
        return Collections.unmodifiableList(new ArrayList<>(blocks.values()));
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    /**
     * Checks the contract the lifter has to fulfill: the entry exists, every
     * edge points to a block of this function and a multi-way branch has at
     * most one leg without case values.
     *
     * @throws IllegalArgumentException on violation
     */
    public void validate() {
        if (blocks.isEmpty()) {
            return;
        }
        Preconditions.checkArgument(blocks.containsKey(entryAddress),
                "Entry block 0x%s of function %s does not exist", Long.toHexString(entryAddress), functionName);
        for (BasicBlock block : blocks.values()) {
            for (BlockEdge edge : block.getSuccessors()) {
                Preconditions.checkArgument(blocks.containsKey(edge.getTargetAddress()),
                        "Block %s of function %s jumps to unknown address 0x%s",
                        block, functionName, Long.toHexString(edge.getTargetAddress()));
            }
            if (block.getSuccessors().size() >= 3) {
                int unlabeled = 0;
                for (BlockEdge edge : block.getSuccessors()) {
                    if (edge.getCaseValues().isEmpty()) {
                        unlabeled++;
                    }
                }
                Preconditions.checkArgument(unlabeled <= 1,
                        "Block %s of function %s has %s successors without case values",
                        block, functionName, unlabeled);
            }
        }
    }

    @Override
    public String toString() {
        return functionName + blocks.values();
    }
}
