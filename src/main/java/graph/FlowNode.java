package graph;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A vertex of a control flow or data flow graph.
 *
 * Predecessors are kept as ids into the owning {@link NodeRegistry}, in insertion order.
 */
public class FlowNode {
    private final int id;
    private final String label;
    private final NodeType type;
    private final Set<Integer> predecessors = new LinkedHashSet<>();

    FlowNode(int id, String label, NodeType type, Set<Integer> predecessors) {
        this.id = id;
        this.label = label == null ? "" : label;
        this.type = Objects.requireNonNull(type, "type");
        this.predecessors.addAll(predecessors);
    }

    public int getId() { return id; }
    public String getLabel() { return label; }
    public NodeType getType() { return type; }

    public Set<Integer> getPredecessors() {
        return Collections.unmodifiableSet(predecessors);
    }

    // Hidden nodes are synthetic branch markers.
    public boolean isHidden() {
        return label.isEmpty();
    }

    void addPredecessors(Set<Integer> ids) {
        predecessors.addAll(ids);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FlowNode)) return false;
        FlowNode other = (FlowNode) obj;
        return id == other.id && type == other.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type);
    }

    @Override
    public String toString() {
        return id + ":\"" + (label.isEmpty() ? type.name() : label) + "\"";
    }
}
