package com.jpexs.decompiler.comb.cfg;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a function CFG from Graphviz/DOT format.
 * <p>
 * Supported node attributes: {@code weight}, {@code address}, {@code entry}.
 * Supported edge attributes: {@code cases} (comma separated case values),
 * {@code direct}. The first node encountered becomes the entry node unless a
 * node is marked with {@code entry=true}. Chained edges like {@code a->b->c}
 * are supported, edge attributes apply to every edge of the chain.
 *
 * @author JPEXS
 */
public final class GraphvizReader {

    private GraphvizReader() {
    }

    private static class NodeDecl {
        final String name;
        final Map<String, String> attributes = new LinkedHashMap<>();
        final List<EdgeDecl> edges = new ArrayList<>();

        NodeDecl(String name) {
            this.name = name;
        }
    }

    private static class EdgeDecl {
        final NodeDecl target;
        final Map<String, String> attributes;

        EdgeDecl(NodeDecl target, Map<String, String> attributes) {
            this.target = target;
            this.attributes = attributes;
        }
    }

    /**
     * Parses a DOT string. The graph name, if any, becomes the function name.
     *
     * @param dot the DOT format string
     * @return the parsed control flow graph
     * @throws IllegalArgumentException when no nodes are found or an attribute is malformed
     */
    public static ControlFlowGraph read(String dot) {
        return read(null, dot);
    }

    /**
     * Parses a DOT string.
     *
     * @param functionName name of the function, null to take the graph name
     * @param dot the DOT format string
     * @return the parsed control flow graph
     * @throws IllegalArgumentException when no nodes are found or an attribute is malformed
     */
    public static ControlFlowGraph read(String functionName, String dot) {
        Map<String, NodeDecl> nodes = new LinkedHashMap<>();

        // Remove "digraph name {" and "}" wrapper
        String content = dot.trim();
        String graphName = "function";
        if (content.startsWith("digraph")) {
            int start = content.indexOf('{');
            int end = content.lastIndexOf('}');
            if (start != -1 && end != -1) {
                String declaredName = unquote(content.substring("digraph".length(), start).trim());
                if (!declaredName.isEmpty()) {
                    graphName = declaredName;
                }
                content = content.substring(start + 1, end);
            }
        }

        String[] statements = content.split("[;\n]");
        for (String statement : statements) {
            statement = statement.trim();
            if (statement.isEmpty() || statement.startsWith("//")) continue;

            Map<String, String> attributes = new LinkedHashMap<>();
            int bracketStart = statement.indexOf('[');
            int bracketEnd = statement.lastIndexOf(']');
            if (bracketStart != -1 && bracketEnd > bracketStart) {
                parseAttributes(statement.substring(bracketStart + 1, bracketEnd).trim(), attributes);
                statement = statement.substring(0, bracketStart).trim();
            }
            if (statement.equals("node") || statement.equals("edge") || statement.equals("graph")) {
                continue;
            }

            if (statement.contains("->")) {
                // Chained edges: a->b->c
                String[] parts = statement.split("->");
                for (int i = 0; i < parts.length - 1; i++) {
                    NodeDecl from = getOrCreate(nodes, unquote(parts[i].trim()));
                    NodeDecl to = getOrCreate(nodes, unquote(parts[i + 1].trim()));
                    from.edges.add(new EdgeDecl(to, attributes));
                }
            } else {
                NodeDecl node = getOrCreate(nodes, unquote(statement));
                node.attributes.putAll(attributes);
            }
        }

        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("No nodes found in DOT string");
        }

        return toControlFlowGraph(functionName == null ? graphName : functionName, nodes);
    }

    private static ControlFlowGraph toControlFlowGraph(String functionName, Map<String, NodeDecl> nodes) {
        Set<Long> usedAddresses = new HashSet<>();
        for (NodeDecl node : nodes.values()) {
            String address = node.attributes.get("address");
            if (address != null) {
                usedAddresses.add(parseNumber(node.name, "address", address));
            }
        }

        Map<NodeDecl, BasicBlock> blocks = new LinkedHashMap<>();
        NodeDecl entry = nodes.values().iterator().next();
        long nextAddress = 0;
        for (NodeDecl node : nodes.values()) {
            long address;
            String explicitAddress = node.attributes.get("address");
            if (explicitAddress != null) {
                address = parseNumber(node.name, "address", explicitAddress);
            } else {
                while (usedAddresses.contains(nextAddress)) {
                    nextAddress++;
                }
                address = nextAddress;
                usedAddresses.add(address);
            }
            String weight = node.attributes.get("weight");
            int weightValue = weight == null ? 1 : (int) parseNumber(node.name, "weight", weight);
            blocks.put(node, new BasicBlock(address, node.name, weightValue));
            if (Boolean.parseBoolean(node.attributes.get("entry"))) {
                entry = node;
            }
        }

        ControlFlowGraph graph = new ControlFlowGraph(functionName, blocks.get(entry).getAddress());
        for (BasicBlock block : blocks.values()) {
            graph.addBlock(block);
        }
        for (Map.Entry<NodeDecl, BasicBlock> entryDecl : blocks.entrySet()) {
            for (EdgeDecl edge : entryDecl.getKey().edges) {
                List<Long> cases = new ArrayList<>();
                String casesStr = edge.attributes.get("cases");
                if (casesStr != null && !casesStr.isBlank()) {
                    for (String value : casesStr.split(",")) {
                        cases.add(parseNumber(entryDecl.getKey().name, "cases", value.trim()));
                    }
                }
                boolean direct = Boolean.parseBoolean(edge.attributes.get("direct"));
                entryDecl.getValue().addSuccessor(new BlockEdge(blocks.get(edge.target).getAddress(), direct, cases));
            }
        }
        return graph;
    }

    private static NodeDecl getOrCreate(Map<String, NodeDecl> nodes, String name) {
        NodeDecl node = nodes.get(name);
        if (node == null) {
            node = new NodeDecl(name);
            nodes.put(name, node);
        }
        return node;
    }

    private static long parseNumber(String nodeName, String key, String value) {
        try {
            return Long.decode(value);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid " + key + " value \"" + value + "\" on " + nodeName, ex);
        }
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    /**
     * Parses DOT attribute string.
     * Handles both quoted and unquoted keys and values.
     * Format: key1=value1 "key2"=value2 key3="value3" "key4"="value 4"
     */
    private static void parseAttributes(String attributesStr, Map<String, String> attributes) {
        int pos = 0;
        int len = attributesStr.length();

        while (pos < len) {
            while (pos < len && (Character.isWhitespace(attributesStr.charAt(pos)) || attributesStr.charAt(pos) == ',')) {
                pos++;
            }
            if (pos >= len) break;

            String key;
            if (attributesStr.charAt(pos) == '"') {
                int endQuote = attributesStr.indexOf('"', pos + 1);
                if (endQuote == -1) break;
                key = attributesStr.substring(pos + 1, endQuote);
                pos = endQuote + 1;
            } else {
                int start = pos;
                while (pos < len && isIdentifierChar(attributesStr.charAt(pos))) {
                    pos++;
                }
                if (pos == start) break;
                key = attributesStr.substring(start, pos);
            }

            while (pos < len && Character.isWhitespace(attributesStr.charAt(pos))) {
                pos++;
            }
            if (pos >= len || attributesStr.charAt(pos) != '=') {
                break;
            }
            pos++;
            while (pos < len && Character.isWhitespace(attributesStr.charAt(pos))) {
                pos++;
            }
            if (pos >= len) break;

            String value;
            if (attributesStr.charAt(pos) == '"') {
                int endQuote = attributesStr.indexOf('"', pos + 1);
                if (endQuote == -1) break;
                value = attributesStr.substring(pos + 1, endQuote);
                pos = endQuote + 1;
            } else {
                int start = pos;
                while (pos < len && isIdentifierChar(attributesStr.charAt(pos))) {
                    pos++;
                }
                if (pos == start) break;
                value = attributesStr.substring(start, pos);
            }

            attributes.put(key, value);
        }
    }

    /**
     * Checks if a character is valid in an unquoted DOT identifier.
     */
    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }
}
