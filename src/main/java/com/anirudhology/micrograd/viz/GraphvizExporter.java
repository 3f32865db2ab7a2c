package com.anirudhology.micrograd.viz;

import com.anirudhology.micrograd.autograd.Backpropagation;
import com.anirudhology.micrograd.autograd.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Renders the graph reachable from a node as Graphviz DOT text.
 * <p>
 * Nodes are boxes showing data and gradient. Each edge goes from an operand to the node
 * it produced and is labelled with that node's operation. Render with
 * {@code dot -Tsvg graph.dot -o graph.svg}.
 */
public final class GraphvizExporter {

    private static final Logger LOG = LoggerFactory.getLogger(GraphvizExporter.class);

    private GraphvizExporter() {
    }

    public static String toDot(Value root) {
        final StringBuilder sb = new StringBuilder(1024);
        sb.append("digraph {\n");
        sb.append("    rankdir=\"LR\"\n");
        sb.append("    node [shape=box]\n");

        // Operands always precede their consumers, so output is stable for a given graph
        final List<Value> nodes = Backpropagation.topologicalOrder(root);
        for (Value value : nodes) {
            sb.append("    ").append(nodeName(value)).append(" [label=\"").append(nodeLabel(value)).append("\"]\n");
        }
        for (Value value : nodes) {
            for (Value operand : value.getOperands()) {
                sb.append("    ").append(nodeName(operand)).append(" -> ").append(nodeName(value))
                        .append(" [label=\"").append(escape(value.getOperation())).append("\"]\n");
            }
        }
        return sb.append("}\n").toString();
    }

    public static void write(Value root, Path path) {
        try {
            Files.writeString(path, toDot(root));
            LOG.info("Wrote graph to: {}", path.toAbsolutePath());
        } catch (IOException e) {
            LOG.error("Error writing graph file due to: {}", e.getMessage());
            throw new UncheckedIOException("Failed to write graph file " + path, e);
        }
    }

    private static String nodeName(Value value) {
        return "n" + value.getId();
    }

    private static String nodeLabel(Value value) {
        final String numbers = String.format(Locale.ROOT, "data=%.4f grad=%.4f", value.getData(), value.getGradient());
        if (value.getLabel().isEmpty()) {
            return numbers;
        }
        return escape(value.getLabel()) + " | " + numbers;
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
