package com.jpexs.decompiler.comb;

import com.jpexs.decompiler.comb.cfg.ControlFlowGraph;
import com.jpexs.decompiler.comb.cfg.GraphvizReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point. Each argument is a Graphviz file holding the
 * control flow graph of one function; the structured pseudocode of every
 * function is printed. Options are read from system properties.
 *
 * @author JPEXS
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length == 0) {
            System.err.println("Usage: java " + Main.class.getName() + " <file.dot>...");
            System.exit(2);
        }
        List<Path> files = new ArrayList<>();
        for (String arg : args) {
            files.add(Paths.get(arg));
        }
        StructuringOptions options = StructuringOptions.fromProperties(System.getProperties());
        System.exit(run(files, options, System.out));
    }

    /**
     * Restructures the functions stored in the given files.
     *
     * @param files Graphviz files
     * @param options structuring options
     * @param out stream receiving the pseudocode
     * @return 0 when every function was restructured, 1 otherwise
     */
    public static int run(List<Path> files, StructuringOptions options, PrintStream out) {
        List<ControlFlowGraph> functions = new ArrayList<>();
        int unreadable = 0;
        for (Path file : files) {
            String fileName = file.getFileName().toString();
            String functionName = fileName.endsWith(".dot") ? fileName.substring(0, fileName.length() - 4) : fileName;
            try {
                functions.add(GraphvizReader.read(functionName, Files.readString(file, StandardCharsets.UTF_8)));
            } catch (IOException | IllegalArgumentException ex) {
                logger.error("Cannot read {}: {}", file, ex.getMessage());
                unreadable++;
            }
        }

        CombRestructurer.BatchResult batch = new CombRestructurer(options).restructureAll(functions);
        for (RestructureResult result : batch.getResults().values()) {
            out.println("===== " + result.getFunctionName() + " =====");
            out.print(result);
            out.println("duplications: " + result.getDuplications());
            out.println();
        }
        for (Map.Entry<String, RuntimeException> failure : batch.getFailures().entrySet()) {
            out.println("===== " + failure.getKey() + " =====");
            out.println("failed: " + failure.getValue().getMessage());
            out.println();
        }
        return unreadable == 0 && batch.getFailures().isEmpty() ? 0 : 1;
    }
}
