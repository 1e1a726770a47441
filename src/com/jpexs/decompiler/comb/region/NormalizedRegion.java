package com.jpexs.decompiler.comb.region;

import com.jpexs.decompiler.comb.graph.BlockNode;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of normalizing one region to a single entry and a single exit.
 *
 * @author JPEXS
 */
public class NormalizedRegion {

    public final MetaRegion region;
    public final BlockNode head;                   // original head or the entry dispatcher
    public final BlockNode entryDispatcher;        // null when a single retreating target exists
    public final BlockNode exitDispatcher;         // null when at most one successor exists
    public final BlockNode exitSuccessor;          // unique successor when there is no exit dispatcher, may be null
    public final List<BlockNode> defaultEntrySets;
    public final List<BlockNode> outlinedNodes;

    public NormalizedRegion(MetaRegion region, BlockNode head, BlockNode entryDispatcher, BlockNode exitDispatcher,
            BlockNode exitSuccessor, List<BlockNode> defaultEntrySets, List<BlockNode> outlinedNodes) {
        this.region = region;
        this.head = head;
        this.entryDispatcher = entryDispatcher;
        this.exitDispatcher = exitDispatcher;
        this.exitSuccessor = exitSuccessor;
        this.defaultEntrySets = Collections.unmodifiableList(defaultEntrySets);
        this.outlinedNodes = Collections.unmodifiableList(outlinedNodes);
    }

    public boolean isNewHeadNeeded() {
        return entryDispatcher != null;
    }

    public boolean isNewExitNeeded() {
        return exitDispatcher != null;
    }

    @Override
    public String toString() {
        return "NormalizedRegion{index=" + region.getIndex()
                + ", head=" + head
                + ", newHead=" + isNewHeadNeeded()
                + ", newExit=" + isNewExitNeeded()
                + ", outlined=" + outlinedNodes + "}";
    }
}
