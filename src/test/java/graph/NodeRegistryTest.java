package graph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NodeRegistryTest {

    private NodeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new NodeRegistry();
    }

    @Test
    void testIdsFollowCreationOrder() {
        FlowNode a = registry.add("a", NodeType.NAME, Collections.emptySet());
        FlowNode b = registry.add("b", NodeType.NAME, Set.of(a.getId()));
        FlowNode c = registry.add("", NodeType.IF_TRUE, Set.of(b.getId()));

        assertEquals(0, a.getId());
        assertEquals(1, b.getId());
        assertEquals(2, c.getId());
        assertEquals(3, registry.size());
        assertSame(b, registry.get(1));
    }

    @Test
    void testPredecessorsResolveToNodes() {
        FlowNode a = registry.add("a", NodeType.NAME, Collections.emptySet());
        FlowNode b = registry.add("b", NodeType.NAME, Collections.emptySet());
        FlowNode op = registry.add("+", NodeType.OP, Set.of(a.getId(), b.getId()));

        List<FlowNode> preds = registry.predecessorsOf(op);
        assertEquals(2, preds.size());
        assertTrue(preds.contains(a));
        assertTrue(preds.contains(b));
    }

    @Test
    void testUnknownPredecessorIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> registry.add("x", NodeType.NAME, Set.of(5)));
    }

    @Test
    void testLaterPredecessorIsRejected() {
        FlowNode a = registry.add("a", NodeType.NAME, Collections.emptySet());
        FlowNode b = registry.add("b", NodeType.NAME, Collections.emptySet());

        assertThrows(IllegalArgumentException.class,
                () -> registry.addPredecessors(a.getId(), Set.of(b.getId())));

        registry.addPredecessors(b.getId(), Set.of(a.getId()));
        assertEquals(Set.of(a.getId()), b.getPredecessors());
    }

    @Test
    void testSealedRegistryRejectsNewNodes() {
        registry.add("a", NodeType.NAME, Collections.emptySet());
        registry.seal();

        assertTrue(registry.isSealed());
        assertThrows(IllegalStateException.class,
                () -> registry.add("b", NodeType.NAME, Collections.emptySet()));
    }

    @Test
    void testHiddenNodeHasEmptyLabel() {
        FlowNode marker = registry.add("", NodeType.IF_FALSE, Collections.emptySet());
        FlowNode named = registry.add(null, NodeType.STATEMENT, Collections.emptySet());

        assertTrue(marker.isHidden());
        assertTrue(named.isHidden(), "A null label is stored as empty");
        assertFalse(NodeType.CONSTANT.isControlFlow());
        assertTrue(NodeType.IF_FALSE.isControlFlow());
    }
}
