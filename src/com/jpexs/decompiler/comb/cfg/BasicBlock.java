package com.jpexs.decompiler.comb.cfg;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Basic block of a lifted function, as handed over by the lifter.
 *
 * @author JPEXS
 */
public class BasicBlock {

    private final long address;
    private final String name;
    private final int weight;
    private final List<BlockEdge> successors = new ArrayList<>();

    public BasicBlock(long address, String name, int weight) {
        Preconditions.checkArgument(weight >= 1, "Block %s has weight %s, expected at least 1", name, weight);
        this.address = address;
        this.name = name == null ? String.format("bb_0x%x", address) : name;
        this.weight = weight;
    }

    public BasicBlock(long address, String name) {
        this(address, name, 1);
    }

    public long getAddress() {
        return address;
    }

    public String getName() {
        return name;
    }

    /**
     * Gets the instruction count of the block.
     *
     * @return weight, at least 1
     */
    public int getWeight() {
        return weight;
    }

    public List<BlockEdge> getSuccessors() {
        return Collections.unmodifiableList(successors);
    }

    public BasicBlock addSuccessor(BlockEdge edge) {
        successors.add(edge);
        return this;
    }

    public BasicBlock addSuccessor(BasicBlock target) {
        return addSuccessor(new BlockEdge(target.getAddress()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BasicBlock block = (BasicBlock) o;
        return address == block.address;
    }

    @Override
    public int hashCode() {
        return Objects.hash(address);
    }

    @Override
    public String toString() {
        return name;
    }
}
