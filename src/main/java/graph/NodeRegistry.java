package graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Owns every node of one graph. Ids are handed out as {@code 0..n-1} in creation order
 * and are never reused.
 */
public class NodeRegistry {
    private final List<FlowNode> nodes = new ArrayList<>();
    private boolean sealed = false;

    /**
     * Creates and registers a node.
     *
     * @param label        display text, empty for a hidden node
     * @param type         semantic role
     * @param predecessors ids of already registered nodes
     * @return the new node
     */
    public FlowNode add(String label, NodeType type, Set<Integer> predecessors) {
        checkOpen();
        for (Integer pred : predecessors) {
            requireKnown(pred);
        }
        FlowNode node = new FlowNode(nodes.size(), label, type, predecessors);
        nodes.add(node);
        return node;
    }

    public FlowNode get(int id) {
        requireKnown(id);
        return nodes.get(id);
    }

    public int size() {
        return nodes.size();
    }

    /** All nodes in ascending id order. */
    public List<FlowNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<FlowNode> predecessorsOf(FlowNode node) {
        List<FlowNode> result = new ArrayList<>();
        for (Integer pred : node.getPredecessors()) {
            result.add(get(pred));
        }
        return result;
    }

    public void addPredecessors(int id, Set<Integer> predecessors) {
        checkOpen();
        FlowNode node = get(id);
        Set<Integer> accepted = new LinkedHashSet<>();
        for (Integer pred : predecessors) {
            requireKnown(pred);
            // edges only point backwards in creation order
            if (pred >= id) {
                throw new IllegalArgumentException("Predecessor " + pred + " is not older than node " + id);
            }
            accepted.add(pred);
        }
        node.addPredecessors(accepted);
    }

    public boolean isSealed() {
        return sealed;
    }

    void seal() {
        sealed = true;
    }

    private void checkOpen() {
        if (sealed) {
            throw new IllegalStateException("Graph is sealed; nodes can no longer be changed");
        }
    }

    private void requireKnown(Integer id) {
        if (id == null || id < 0 || id >= nodes.size()) {
            throw new IllegalArgumentException("Unknown node id: " + id);
        }
    }
}
