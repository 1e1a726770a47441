package com.jpexs.decompiler.comb.cfg;

import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;

/**
 * Edge from a basic block to one of its successors.
 *
 * @author JPEXS
 */
public class BlockEdge {

    private final long targetAddress;
    private final boolean direct;                    // unconditional or fallthrough leg
    private final ImmutableSortedSet<Long> caseValues; // values selecting this edge of a multi-way branch

    public BlockEdge(long targetAddress) {
        this(targetAddress, false, ImmutableSortedSet.of());
    }

    public BlockEdge(long targetAddress, boolean direct, Collection<Long> caseValues) {
        this.targetAddress = targetAddress;
        this.direct = direct;
        this.caseValues = ImmutableSortedSet.copyOf(caseValues);
    }

    public long getTargetAddress() {
        return targetAddress;
    }

    public boolean isDirect() {
        return direct;
    }

    public ImmutableSortedSet<Long> getCaseValues() {
        return caseValues;
    }

    @Override
    public String toString() {
        return String.format("-> 0x%x%s%s", targetAddress, direct ? " direct" : "", caseValues.isEmpty() ? "" : " " + caseValues);
    }
}
