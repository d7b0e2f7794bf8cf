package render;

import graph.FlowNode;
import graph.NodeRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain text table of a graph's nodes, one row per node.
 */
public final class NodeTable {

    private NodeTable() {
    }

    public static String format(NodeRegistry registry) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%4s %20s %12s %8s", "id", "label", "type", "preds"));
        for (FlowNode node : registry.nodes()) {
            List<String> preds = new ArrayList<>();
            for (Integer pred : node.getPredecessors()) {
                preds.add(String.valueOf(pred));
            }
            sb.append('\n').append(String.format("%4d %20s %12s %8s",
                    node.getId(),
                    MermaidRenderer.escape(node.getLabel()),
                    node.getType(),
                    String.join(",", preds)));
        }
        return sb.toString();
    }
}
