package render;

import graph.ControlFlowGraph;
import graph.DataFlowGraph;
import graph.FlowNode;
import graph.NodeRegistry;
import graph.NodeType;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes graphs as Mermaid flowchart text.
 *
 * Output is a pure function of the graph: node lines in ascending id order, then edge
 * lines per node in predecessor insertion order.
 */
public class MermaidRenderer {
    private static final String HEADER = "flowchart TD";
    private static final String INDENT = "    ";

    private final RenderOptions options;

    public MermaidRenderer() {
        this(RenderOptions.defaults());
    }

    public MermaidRenderer(RenderOptions options) {
        this.options = options;
    }

    public String render(ControlFlowGraph cfg) {
        NodeRegistry registry = cfg.getRegistry();
        List<String> lines = new ArrayList<>();
        lines.add(HEADER);

        List<FlowNode> visible = new ArrayList<>();
        for (FlowNode node : registry.nodes()) {
            if (isVisible(node)) {
                visible.add(node);
            }
        }

        for (FlowNode node : visible) {
            lines.add(INDENT + shape(node, "p"));
        }

        for (FlowNode node : visible) {
            for (FlowNode pred : registry.predecessorsOf(node)) {
                // the edge label comes from the direct predecessor even when it is skipped
                NodeType edgeType = pred.getType();
                FlowNode source = pred;
                if (!options.isIncludeHidden()) {
                    while (source.isHidden() && !source.getPredecessors().isEmpty()) {
                        source = registry.get(source.getPredecessors().iterator().next());
                    }
                }
                if (!isVisible(source)) {
                    continue;
                }
                lines.add(INDENT + edge("p" + source.getId(), "p" + node.getId(), edgeType));
            }
        }

        return String.join("\n", lines);
    }

    public String render(DataFlowGraph dfg) {
        List<String> lines = new ArrayList<>();
        lines.add(HEADER);

        renderBody(dfg, "main", null, "", lines);
        renderMethods(dfg, "", lines);

        return String.join("\n", lines);
    }

    private void renderMethods(DataFlowGraph dfg, String parentPrefix, List<String> lines) {
        int i = 1;
        for (Map.Entry<String, DataFlowGraph> method : dfg.getMethods().entrySet()) {
            String blockId = parentPrefix + "f" + i;
            String prefix = blockId + "_";
            renderBody(method.getValue(), blockId, method.getKey(), prefix, lines);
            renderMethods(method.getValue(), prefix, lines);
            i++;
        }
    }

    private void renderBody(DataFlowGraph dfg, String blockId, String title, String prefix, List<String> lines) {
        NodeRegistry registry = dfg.getRegistry();
        lines.add(INDENT + "subgraph " + blockId + (title == null ? "" : " [\"" + escape(title) + "\"]"));

        Set<FlowNode> inputs = new LinkedHashSet<>(dfg.inputNodes());
        Set<FlowNode> outputs = new LinkedHashSet<>(dfg.resolveOutputs());
        outputs.removeAll(inputs);

        if (!inputs.isEmpty()) {
            lines.add(INDENT + "subgraph " + prefix + "inputs [\" \"]");
            for (FlowNode node : inputs) {
                lines.add(INDENT + shape(node, prefix + "v"));
            }
            lines.add(INDENT + "end");
        }

        for (FlowNode node : registry.nodes()) {
            if (!inputs.contains(node) && !outputs.contains(node)) {
                lines.add(INDENT + shape(node, prefix + "v"));
            }
        }

        if (!outputs.isEmpty()) {
            lines.add(INDENT + "subgraph " + prefix + "outputs [\" \"]");
            for (FlowNode node : outputs) {
                lines.add(INDENT + shape(node, prefix + "v"));
            }
            lines.add(INDENT + "end");
        }

        for (FlowNode node : registry.nodes()) {
            for (FlowNode pred : registry.predecessorsOf(node)) {
                lines.add(INDENT + edge(prefix + "v" + pred.getId(), prefix + "v" + node.getId(), pred.getType()));
            }
        }

        lines.add(INDENT + "end");
    }

    private boolean isVisible(FlowNode node) {
        if (!options.isIncludeHidden() && node.isHidden()) {
            return false;
        }
        if (!options.isIncludeStartStop()
                && (node.getType() == NodeType.START || node.getType() == NodeType.STOP)) {
            return false;
        }
        return true;
    }

    static String shape(FlowNode node, String idPrefix) {
        String id = idPrefix + node.getId();
        String label = escape(node.getLabel());
        switch (node.getType()) {
            case START:
            case STOP:
            case DEFINITION:
                return id + "(((\"" + label + "\")))";
            case IF:
                return id + "{\"" + label + "\"}";
            default:
                return id + "(\"" + label + "\")";
        }
    }

    static String edge(String from, String to, NodeType predecessorType) {
        switch (predecessorType) {
            case IF_TRUE:
                return from + " -->|True| " + to;
            case IF_FALSE:
                return from + " -->|False| " + to;
            default:
                return from + " --> " + to;
        }
    }

    static String escape(String label) {
        if (label.isEmpty()) {
            return " ";
        }
        return label
                .replace("\r", "")
                .replace("\"", "\\\"")
                .replace("\n", "\\n");
    }
}
