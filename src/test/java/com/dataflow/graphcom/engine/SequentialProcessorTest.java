package com.dataflow.graphcom.engine;

import com.dataflow.graphcom.node.ComputeNode;
import com.dataflow.graphcom.node.InputNode;
import com.dataflow.graphcom.node.NodeId;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class SequentialProcessorTest {

    private final List<String> trace = Collections.synchronizedList(new ArrayList<>());
    private InputNode<Integer> in;
    private ComputeNode<Integer> l;
    private ComputeNode<Integer> r;
    private ComputeNode<Integer> d;
    private Graph graph;
    private SequentialProcessor processor;

    @Before
    public void setUp() {
        in = new InputNode<>();
        l = new ComputeNode<>(Map.of("in", in), (prev, v) -> {
            trace.add("l");
            return (Integer) v.get("in") + 1;
        });
        r = new ComputeNode<>(Map.of("in", in), (prev, v) -> {
            trace.add("r");
            return (Integer) v.get("in") * 2;
        });
        d = new ComputeNode<>(Map.of("l", l, "r", r), (prev, v) -> {
            trace.add("d");
            return (Integer) v.get("l") + (Integer) v.get("r");
        });
        graph = Graph.of(Map.of("in", in, "d", d));
        processor = new SequentialProcessor();
    }

    @Test
    public void testCompileFlattensLevels() {
        Schedule schedule = processor.compile(graph, Set.of(in.id()));
        assertEquals(1, schedule.stages().size());
        assertEquals(List.of(l.id(), r.id(), d.id()), schedule.order());
        assertEquals(3, schedule.nodeCount());
    }

    @Test
    public void testExecuteRunsInOrder() {
        Schedule schedule = processor.compile(graph, Set.of(in.id()));
        Map<NodeId, Object> out = processor.execute(graph, schedule, Map.of(), Map.of(in.id(), 5));

        assertEquals(List.of("l", "r", "d"), trace);
        assertEquals(6, out.get(l.id()));
        assertEquals(10, out.get(r.id()));
        assertEquals(16, out.get(d.id()));
        assertFalse(out.containsKey(in.id()));
    }

    @Test
    public void testExecuteDoesNotModifyPreviousValues() {
        Schedule schedule = processor.compile(graph, Set.of(in.id()));
        Map<NodeId, Object> previous = Map.of(d.id(), 1);
        Map<NodeId, Object> out = processor.execute(graph, schedule, previous, Map.of(in.id(), 1));
        assertEquals(Map.of(d.id(), 1), previous);
        assertEquals(6, out.get(d.id()));
    }

    @Test
    public void testPreviousValuePassedToHandler() {
        ComputeNode<Integer> count = new ComputeNode<>(Map.of("in", in), (prev, v) -> prev == null ? 1 : prev + 1);
        Graph g = Graph.of(Map.of("count", count));
        Schedule schedule = processor.compile(g, Set.of(in.id()));

        Map<NodeId, Object> values = Map.of();
        for (int i = 0; i < 3; i++)
            values = processor.execute(g, schedule, values, Map.of(in.id(), 0));
        assertEquals(3, values.get(count.id()));
    }

    @Test
    public void testFailureAttributedToNode() {
        ComputeNode<Integer> bad = new ComputeNode<>(Map.of("l", l), (prev, v) -> {
            throw new IllegalArgumentException("bad value " + v.get("l"));
        });
        Graph g = graph.add("bad", bad);
        Schedule schedule = processor.compile(g, Set.of(in.id()));
        try {
            processor.execute(g, schedule, Map.of(), Map.of(in.id(), 1));
            fail("Expected NodeFailureException");
        } catch (NodeFailureException e) {
            assertEquals(bad.id(), e.nodeId());
            assertTrue(e.getCause() instanceof IllegalArgumentException);
            assertTrue(e.getMessage().contains("bad value 2"));
        }
    }

    @Test
    public void testEmptyScheduleReturnsValues() {
        Map<NodeId, Object> previous = Map.of(d.id(), 7);
        Map<NodeId, Object> out = processor.execute(graph, processor.compile(graph, Set.of()), previous, Map.of());
        assertEquals(previous, out);
        assertTrue(trace.isEmpty());
    }
}
