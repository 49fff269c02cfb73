package com.dataflow.graphcom.engine;

import com.dataflow.graphcom.api.ComputationException;
import com.dataflow.graphcom.api.ConfigurationException;
import com.dataflow.graphcom.api.Node;
import com.dataflow.graphcom.api.StructuralException;
import com.dataflow.graphcom.node.ComputeNode;
import com.dataflow.graphcom.node.IdGenerator;
import com.dataflow.graphcom.node.InputNode;
import com.dataflow.graphcom.node.NodeId;
import org.junit.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class GraphTest {

    private static <T> ComputeNode<T> relay(Node<T> source) {
        return new ComputeNode<>(Map.of("source", source), (prev, in) -> {
            @SuppressWarnings("unchecked")
            T v = (T) in.get("source");
            return v;
        });
    }

    @Test
    public void testEmptyGraph() {
        Graph g = Graph.empty();
        assertEquals(0, g.size());
        assertTrue(g.labels().isEmpty());
        assertTrue(g.inputIds().isEmpty());
    }

    @Test
    public void testAddRegistersHiddenSources() {
        InputNode<Integer> in = new InputNode<>();
        ComputeNode<Integer> a = relay(in);
        ComputeNode<Integer> b = relay(a);

        Graph g = Graph.empty().add("b", b);

        assertEquals(3, g.size());
        assertEquals(Map.of("b", b.id()), g.labels());
        assertSame(in, g.node(in.id()));
        assertNull(g.labelOf(a.id()));
        assertEquals("b", g.labelOf(b.id()));
        assertEquals(Set.of(a.id()), g.sourcesOf(b.id()));
        assertEquals(Set.of(b.id()), g.dependantsOf(a.id()));
        assertEquals(Set.of(in.id()), g.inputIds());
    }

    @Test
    public void testAddLeavesOriginalGraphUntouched() {
        InputNode<Integer> in = new InputNode<>();
        ComputeNode<Integer> a = relay(in);
        ComputeNode<Integer> b = relay(in);

        Graph g1 = Graph.empty().add("in", in).add("a", a);
        Graph g2 = g1.add("b", b);

        assertEquals(2, g1.size());
        assertEquals(Set.of(a.id()), g1.dependantsOf(in.id()));
        assertFalse(g1.hasLabel("b"));

        assertEquals(3, g2.size());
        assertEquals(Set.of(a.id(), b.id()), g2.dependantsOf(in.id()));
    }

    @Test
    public void testSharedSourcesDeduplicatedRegardlessOfOrder() {
        InputNode<Integer> in = new InputNode<>();
        ComputeNode<Integer> c = relay(in);
        ComputeNode<Integer> c1 = relay(c);
        ComputeNode<Integer> c2 = relay(c);

        Map<String, Node<?>> forward = new LinkedHashMap<>();
        forward.put("c1", c1);
        forward.put("c2", c2);
        forward.put("in", in);
        Map<String, Node<?>> backward = new LinkedHashMap<>();
        backward.put("in", in);
        backward.put("c2", c2);
        backward.put("c1", c1);

        Graph g1 = Graph.of(forward);
        Graph g2 = Graph.of(backward);

        assertEquals(4, g1.size());
        assertEquals(g1.labels(), g2.labels());
        assertEquals(g1.nodes().keySet(), g2.nodes().keySet());
        for (NodeId id : g1.nodes().keySet()) {
            assertEquals(g1.sourcesOf(id), g2.sourcesOf(id));
            assertEquals(g1.dependantsOf(id), g2.dependantsOf(id));
        }
        assertEquals(Set.of(c1.id(), c2.id()), g1.dependantsOf(c.id()));
    }

    @Test(expected = ConfigurationException.class)
    public void testDuplicateLabelRejected() {
        Graph.empty().add("x", new InputNode<>()).add("x", new InputNode<>());
    }

    @Test
    public void testSameNodeUnderTwoLabels() {
        InputNode<Integer> in = new InputNode<>();
        Graph g = Graph.empty().add("a", in).add("b", in);
        assertEquals(1, g.size());
        assertEquals(Set.of("a", "b"), g.labelsOf(in.id()));
        assertEquals("a", g.labelOf(in.id()));
    }

    @Test
    public void testIdentityCollisionRejected() {
        IdGenerator first = IdGenerator.sequential();
        IdGenerator second = IdGenerator.sequential();
        InputNode<Integer> a = new InputNode<>(first);
        InputNode<Integer> impostor = new InputNode<>(second);
        assertEquals(a.id(), impostor.id());

        Graph g = Graph.empty().add("a", a);
        try {
            g.add("b", impostor);
            fail("Expected StructuralException");
        } catch (StructuralException e) {
            assertTrue(e.getMessage().contains("two distinct nodes"));
        }
        // The graph the failed add started from is still valid
        assertEquals(1, g.size());
        assertFalse(g.hasLabel("b"));
    }

    @Test(expected = StructuralException.class)
    public void testIdentityCollisionThroughHiddenSource() {
        IdGenerator ids = IdGenerator.sequential();
        InputNode<Integer> in = new InputNode<>(ids); // #1
        ComputeNode<Integer> clash = new ComputeNode<>(IdGenerator.sequential(), Map.of("in", in),
                (prev, v) -> 0); // also #1
        Graph.of(Map.of("clash", clash));
    }

    @Test(expected = ConfigurationException.class)
    public void testUnsupportedNodeTypeRejected() {
        Node<Object> custom = new Node<>() {
            private final NodeId id = IdGenerator.global().next();

            @Override
            public NodeId id() {
                return id;
            }

            @Override
            public Map<String, Node<?>> sources() {
                return Map.of();
            }
        };
        Graph.empty().add("custom", custom);
    }

    @Test
    public void testCheckAcyclicAcceptsDiamond() {
        NodeId a = new NodeId(1), b = new NodeId(2), c = new NodeId(3), d = new NodeId(4);
        Map<NodeId, Set<NodeId>> adjacency = new HashMap<>();
        adjacency.put(d, Set.of(b, c));
        adjacency.put(b, Set.of(a));
        adjacency.put(c, Set.of(a));
        adjacency.put(a, Set.of());
        Graph.checkAcyclic(adjacency, d);
    }

    @Test
    public void testCheckAcyclicDetectsCycle() {
        NodeId a = new NodeId(1), b = new NodeId(2), c = new NodeId(3);
        Map<NodeId, Set<NodeId>> adjacency = new HashMap<>();
        adjacency.put(a, Set.of(b));
        adjacency.put(b, Set.of(c));
        adjacency.put(c, Set.of(a));
        try {
            Graph.checkAcyclic(adjacency, a);
            fail("Expected StructuralException");
        } catch (StructuralException e) {
            assertTrue(e.getMessage().contains("Cycle detected"));
        }
    }

    @Test(expected = StructuralException.class)
    public void testCheckAcyclicDetectsSelfLoop() {
        NodeId a = new NodeId(1);
        Graph.checkAcyclic(Map.of(a, Set.of(a)), a);
    }

    @Test
    public void testInputIdsForValidatesLabels() {
        InputNode<Integer> in = new InputNode<>();
        ComputeNode<Integer> out = relay(in);
        Graph g = Graph.of(Map.of("in", in, "out", out));

        assertEquals(Set.of(in.id()), g.inputIdsFor(Set.of("in")));
        try {
            g.inputIdsFor(Set.of("out"));
            fail("Compute label must be rejected");
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage().contains("out"));
        }
        try {
            g.inputIdsFor(Set.of("missing"));
            fail("Unknown label must be rejected");
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage().contains("Unknown label"));
        }
    }

    @Test
    public void testDeepHiddenChain() {
        final int depth = 100_000;
        InputNode<Integer> in = new InputNode<>();
        ComputeNode<Integer> bottom = new ComputeNode<>(Map.of("in", in), (prev, v) -> {
            if ((Integer) v.get("in") < 0)
                throw new IllegalArgumentException("negative");
            return (Integer) v.get("in");
        });
        ComputeNode<Integer> top = bottom;
        for (int i = 0; i < depth; i++)
            top = relay(top);

        Graph g = Graph.of(Map.of("in", in, "top", top));
        assertEquals(depth + 2, g.size());
        assertEquals(Set.of(in.id(), top.id()), Set.copyOf(g.labels().values()));

        GraphContext ctx = new GraphContext(g).process(Map.of("in", 7));
        assertEquals(Integer.valueOf(7), ctx.value("top"));
        try {
            ctx.process(Map.of("in", -1));
            fail("Expected ComputationException");
        } catch (ComputationException e) {
            assertEquals(bottom.id(), e.nodeId());
            List<String> path = e.paths().iterator().next();
            assertEquals(1, e.paths().size());
            assertEquals(depth + 1, path.size());
            assertEquals("top", path.get(0));
        }
    }

    @Test(expected = StructuralException.class)
    public void testCheckAcyclicDetectsLongCycle() {
        Map<NodeId, Set<NodeId>> adjacency = new HashMap<>();
        int n = 100_000;
        for (int i = 0; i < n; i++)
            adjacency.put(new NodeId(i), Set.of(new NodeId((i + 1) % n)));
        Graph.checkAcyclic(adjacency, new NodeId(0));
    }
}
