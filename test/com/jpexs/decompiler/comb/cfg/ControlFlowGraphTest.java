package com.jpexs.decompiler.comb.cfg;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ControlFlowGraphTest {

    @Test
    public void defaultBlockNameIsDerivedFromAddress() {
        assertThat(new BasicBlock(0x401000L, null).getName()).isEqualTo("bb_0x401000");
    }

    @Test
    public void rejectsDuplicateAddresses() {
        ControlFlowGraph cfg = new ControlFlowGraph("f", 0);
        cfg.addBlock(new BasicBlock(0, "A"));

        assertThrows(IllegalArgumentException.class, () -> cfg.addBlock(new BasicBlock(0, "B")));
    }

    @Test
    public void validateRejectsMissingEntry() {
        ControlFlowGraph cfg = new ControlFlowGraph("f", 5);
        cfg.addBlock(new BasicBlock(0, "A"));

        assertThrows(IllegalArgumentException.class, cfg::validate);
    }

    @Test
    public void validateRejectsDanglingEdge() {
        ControlFlowGraph cfg = new ControlFlowGraph("f", 0);
        cfg.addBlock(new BasicBlock(0, "A")).addSuccessor(new BlockEdge(8));

        assertThrows(IllegalArgumentException.class, cfg::validate);
    }

    @Test
    public void validateRejectsSeveralLegsWithoutCases() {
        ControlFlowGraph cfg = new ControlFlowGraph("three", 0);
        cfg.addBlock(new BasicBlock(0, "A"))
                .addSuccessor(new BlockEdge(0x10))
                .addSuccessor(new BlockEdge(0x20))
                .addSuccessor(new BlockEdge(0x30));
        cfg.addBlock(new BasicBlock(0x10, "B"));
        cfg.addBlock(new BasicBlock(0x20, "C"));
        cfg.addBlock(new BasicBlock(0x30, "D"));

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, cfg::validate);
        assertThat(ex).hasMessageThat().contains("without case values");
    }

    @Test
    public void validateAcceptsSwitchWithOneDefault() {
        ControlFlowGraph cfg = new ControlFlowGraph("switch", 0);
        cfg.addBlock(new BasicBlock(0, "A"))
                .addSuccessor(new BlockEdge(0x10, true, ImmutableList.of(1L)))
                .addSuccessor(new BlockEdge(0x20, true, ImmutableList.of(2L)))
                .addSuccessor(new BlockEdge(0x30));
        cfg.addBlock(new BasicBlock(0x10, "B"));
        cfg.addBlock(new BasicBlock(0x20, "C"));
        cfg.addBlock(new BasicBlock(0x30, "D"));

        cfg.validate();
        assertThat(cfg.getBlock(0).getSuccessors()).hasSize(3);
    }

    @Test
    public void emptyFunctionIsValid() {
        ControlFlowGraph cfg = new ControlFlowGraph("f", 0);

        cfg.validate();
        assertThat(cfg.isEmpty()).isTrue();
        assertThat(cfg.getEntryBlock()).isNull();
    }
}
