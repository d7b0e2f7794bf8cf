package render;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import graph.ControlFlowGraph;
import graph.DataFlowGraph;
import graph.FlowNode;
import graph.NodeRegistry;

import java.util.Map;

/**
 * Serialises built graphs to JSON for tools that do not read Mermaid.
 */
public class GraphJsonExporter {
    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public String toJson(ControlFlowGraph cfg) {
        JsonObject root = new JsonObject();
        root.addProperty("kind", "cfg");
        root.add("nodes", nodes(cfg.getRegistry()));

        JsonObject definitions = new JsonObject();
        for (Map.Entry<String, Integer> definition : cfg.getDefinitions().entrySet()) {
            definitions.addProperty(definition.getKey(), definition.getValue());
        }
        root.add("definitions", definitions);
        return gson.toJson(root);
    }

    public String toJson(DataFlowGraph dfg) {
        JsonObject root = dataFlow(dfg);
        root.addProperty("kind", "dfg");
        return gson.toJson(root);
    }

    private JsonObject dataFlow(DataFlowGraph dfg) {
        JsonObject object = new JsonObject();
        object.add("nodes", nodes(dfg.getRegistry()));

        JsonObject inputs = new JsonObject();
        for (Map.Entry<String, Integer> input : dfg.getInputs().entrySet()) {
            inputs.addProperty(input.getKey(), input.getValue());
        }
        object.add("inputs", inputs);

        JsonArray outputs = new JsonArray();
        for (FlowNode node : dfg.resolveOutputs()) {
            outputs.add(node.getId());
        }
        object.add("outputs", outputs);

        JsonObject methods = new JsonObject();
        for (Map.Entry<String, DataFlowGraph> method : dfg.getMethods().entrySet()) {
            methods.add(method.getKey(), dataFlow(method.getValue()));
        }
        object.add("methods", methods);
        return object;
    }

    private static JsonArray nodes(NodeRegistry registry) {
        JsonArray array = new JsonArray();
        for (FlowNode node : registry.nodes()) {
            JsonObject object = new JsonObject();
            object.addProperty("id", node.getId());
            object.addProperty("label", node.getLabel());
            object.addProperty("type", node.getType().name());
            JsonArray preds = new JsonArray();
            for (Integer pred : node.getPredecessors()) {
                preds.add(pred);
            }
            object.add("predecessors", preds);
            array.add(object);
        }
        return array;
    }
}
