package graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Data flow graph of one lexical unit (a script or one method body).
 *
 * Nested method definitions are kept as independent sub-graphs with their own id space.
 */
public class DataFlowGraph {
    private final NodeRegistry registry = new NodeRegistry();
    private final Map<String, Integer> inputs = new LinkedHashMap<>();
    private final Set<String> outputs = new LinkedHashSet<>();
    private final Map<String, DataFlowGraph> methods = new LinkedHashMap<>();
    private Map<String, Integer> finalBindings = Collections.emptyMap();

    public NodeRegistry getRegistry() {
        return registry;
    }

    public void addInput(String name, FlowNode placeholder) {
        checkOpen();
        inputs.put(name, placeholder.getId());
    }

    public void addOutput(String name) {
        checkOpen();
        outputs.add(name);
    }

    public void addMethod(String qualifiedName, DataFlowGraph subgraph) {
        checkOpen();
        if (!subgraph.isSealed()) {
            throw new IllegalArgumentException("Sub-graph " + qualifiedName + " must be built before it is attached");
        }
        methods.put(qualifiedName, subgraph);
    }

    /** Parameter name to placeholder node id, in declaration order. */
    public Map<String, Integer> getInputs() {
        return Collections.unmodifiableMap(inputs);
    }

    /** Names returned by the unit, in order of first appearance. */
    public Set<String> getOutputs() {
        return Collections.unmodifiableSet(outputs);
    }

    public Map<String, DataFlowGraph> getMethods() {
        return Collections.unmodifiableMap(methods);
    }

    public List<FlowNode> inputNodes() {
        List<FlowNode> result = new ArrayList<>();
        for (Integer id : inputs.values()) {
            result.add(registry.get(id));
        }
        return result;
    }

    /**
     * Resolves returned names against the bindings left when the build finished.
     * Names that were only bound in an inner scope resolve to nothing.
     */
    public List<FlowNode> resolveOutputs() {
        Set<Integer> ids = new LinkedHashSet<>();
        for (String name : outputs) {
            Integer id = finalBindings.get(name);
            if (id != null) {
                ids.add(id);
            }
        }
        List<FlowNode> result = new ArrayList<>();
        for (Integer id : ids) {
            result.add(registry.get(id));
        }
        return result;
    }

    public boolean isSealed() {
        return registry.isSealed();
    }

    /**
     * Freezes the graph.
     *
     * @param rootBindings bindings of the outermost scope at the end of the build
     */
    public void seal(Map<String, Integer> rootBindings) {
        checkOpen();
        this.finalBindings = Collections.unmodifiableMap(new LinkedHashMap<>(rootBindings));
        registry.seal();
    }

    private void checkOpen() {
        if (registry.isSealed()) {
            throw new IllegalStateException("Graph is sealed");
        }
    }
}
