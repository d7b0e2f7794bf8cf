package graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Control flow graph of one source unit: a single path from a {@code START} node to a
 * {@code STOP} node. Definitions share the id space and hang off the point where they
 * were declared.
 */
public class ControlFlowGraph {
    private final NodeRegistry registry = new NodeRegistry();
    private final Map<String, Integer> definitions = new LinkedHashMap<>();

    public NodeRegistry getRegistry() {
        return registry;
    }

    public void addDefinition(String qualifiedName, FlowNode node) {
        if (registry.isSealed()) {
            throw new IllegalStateException("Graph is sealed");
        }
        definitions.put(qualifiedName, node.getId());
    }

    /** Qualified definition name to its DEFINITION node id, in declaration order. */
    public Map<String, Integer> getDefinitions() {
        return Collections.unmodifiableMap(definitions);
    }

    public FlowNode start() {
        return findSentinel(NodeType.START);
    }

    public FlowNode stop() {
        return findSentinel(NodeType.STOP);
    }

    public void seal() {
        registry.seal();
    }

    private FlowNode findSentinel(NodeType type) {
        for (FlowNode node : registry.nodes()) {
            if (node.getType() == type) {
                return node;
            }
        }
        throw new IllegalStateException("Graph has no " + type + " node");
    }
}
