package com.jpexs.decompiler.comb;

import static com.google.common.truth.Truth.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class MainTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private Path writeDot(String fileName, String dot) throws Exception {
        Path file = folder.getRoot().toPath().resolve(fileName);
        Files.writeString(file, dot, StandardCharsets.UTF_8);
        return file;
    }

    private String output() {
        return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void printsPseudocodeNamedAfterFile() throws Exception {
        Path file = writeDot("loop.dot", GraphFixtures.SELF_LOOP);

        int status = Main.run(Collections.singletonList(file), StructuringOptions.defaults(), out);

        assertThat(status).isEqualTo(0);
        assertThat(output()).contains("===== loop =====");
        assertThat(output()).contains("function loop {");
        assertThat(output()).contains("do {");
        assertThat(output()).contains("duplications: 0");
    }

    @Test
    public void missingFileFailsButOthersArePrinted() throws Exception {
        Path file = writeDot("diamond.dot", GraphFixtures.DIAMOND);
        Path missing = folder.getRoot().toPath().resolve("missing.dot");

        int status = Main.run(Arrays.asList(missing, file), StructuringOptions.defaults(), out);

        assertThat(status).isEqualTo(1);
        assertThat(output()).contains("===== diamond =====");
        assertThat(output()).doesNotContain("===== missing =====");
    }

    @Test
    public void malformedFunctionIsReported() throws Exception {
        Path file = writeDot("bad.dot", "digraph bad {\n  A -> B [cases=\"x\"];\n}");

        int status = Main.run(Collections.singletonList(file), StructuringOptions.defaults(), out);

        assertThat(status).isEqualTo(1);
    }
}
