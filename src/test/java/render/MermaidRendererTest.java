package render;

import graph.ControlFlowGraph;
import graph.DataFlowGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import parsing.SourceParseException;
import parsing.SourceParser;
import sanalysis.ControlFlowGraphBuilder;
import sanalysis.DataFlowGraphBuilder;

import static org.junit.jupiter.api.Assertions.*;

class MermaidRendererTest {

    private static final String IF_ELSE = "if (x > 0) { y = 1; } else { y = 2; }";

    private SourceParser parser;

    @BeforeEach
    void setUp() {
        parser = new SourceParser();
    }

    private ControlFlowGraph cfg(String source) throws SourceParseException {
        return new ControlFlowGraphBuilder().build(parser.parse(source));
    }

    private DataFlowGraph dfg(String source) throws SourceParseException {
        return new DataFlowGraphBuilder().build(parser.parse(source));
    }

    @Test
    void testRenderControlFlowWithBranches() throws SourceParseException {
        String expected = String.join("\n",
                "flowchart TD",
                "    p0(((\"start\")))",
                "    p1{\"x > 0\"}",
                "    p2(\" \")",
                "    p3(\"y = 1\")",
                "    p4(\" \")",
                "    p5(\"y = 2\")",
                "    p6(((\"stop\")))",
                "    p0 --> p1",
                "    p1 --> p2",
                "    p2 -->|True| p3",
                "    p1 --> p4",
                "    p4 -->|False| p5",
                "    p3 --> p6",
                "    p5 --> p6");

        assertEquals(expected, new MermaidRenderer().render(cfg(IF_ELSE)));
    }

    @Test
    void testHiddenNodesAreBypassed() throws SourceParseException {
        String text = new MermaidRenderer(new RenderOptions(false, true)).render(cfg(IF_ELSE));

        assertFalse(text.contains("p2("));
        assertFalse(text.contains("p4("));
        assertTrue(text.contains("    p1 -->|True| p3"));
        assertTrue(text.contains("    p1 -->|False| p5"));
        assertFalse(text.contains("p1 --> p2"));
    }

    @Test
    void testExcludeStartStop() throws SourceParseException {
        String text = new MermaidRenderer(new RenderOptions(true, false)).render(cfg("a = 1;"));

        assertEquals("flowchart TD\n    p1(\"a = 1\")", text);
    }

    @Test
    void testDefinitionsUseCircleShape() throws SourceParseException {
        String text = new MermaidRenderer().render(cfg("class A { void m() { run(); } }"));

        assertTrue(text.contains("    p1(((\"class A\")))"));
        assertTrue(text.contains("    p2(((\"A.m\")))"));
        assertTrue(text.contains("    p2 --> p3"));
    }

    @Test
    void testLabelsAreEscaped() throws SourceParseException {
        String text = new MermaidRenderer().render(cfg("s = \"hi\";"));

        assertTrue(text.contains("    p1(\"s = \\\"hi\\\"\")"), text);
    }

    @Test
    void testEscape() {
        assertEquals(" ", MermaidRenderer.escape(""));
        assertEquals("a\\nb", MermaidRenderer.escape("a\r\nb"));
        assertEquals("say \\\"x\\\"", MermaidRenderer.escape("say \"x\""));
    }

    @Test
    void testRenderDataFlow() throws SourceParseException {
        String expected = String.join("\n",
                "flowchart TD",
                "    subgraph main",
                "    v0(\"x\")",
                "    v1(\"x + 1\")",
                "    v2(\"z\")",
                "    v0 --> v1",
                "    v1 --> v2",
                "    end");

        assertEquals(expected, new MermaidRenderer().render(dfg("z = x + 1;")));
    }

    @Test
    void testRenderDataFlowWithMethod() throws SourceParseException {
        String source = "class Calc {\n" +
                "    int add(int a, int b) {\n" +
                "        int s = a + b;\n" +
                "        return s;\n" +
                "    }\n" +
                "}";
        String expected = String.join("\n",
                "flowchart TD",
                "    subgraph main",
                "    v0(\"Calc\")",
                "    end",
                "    subgraph f1 [\"Calc.add\"]",
                "    subgraph f1_inputs [\" \"]",
                "    f1_v0(\"a\")",
                "    f1_v1(\"b\")",
                "    end",
                "    f1_v2(\"+\")",
                "    subgraph f1_outputs [\" \"]",
                "    f1_v3(\"s\")",
                "    end",
                "    f1_v0 --> f1_v2",
                "    f1_v1 --> f1_v2",
                "    f1_v2 --> f1_v3",
                "    end");

        assertEquals(expected, new MermaidRenderer().render(dfg(source)));
    }

    @Test
    void testRenderingIsRepeatable() throws SourceParseException {
        DataFlowGraph graph = dfg("a = b + c;\nif (a > 0) { d = a; } else { d = -a; }");
        MermaidRenderer renderer = new MermaidRenderer();

        assertEquals(renderer.render(graph), renderer.render(graph));
    }
}
