package com.dataflow.graphcom.fn;

import com.dataflow.graphcom.engine.Graph;
import com.dataflow.graphcom.engine.GraphContext;
import com.dataflow.graphcom.node.ComputeNode;
import com.dataflow.graphcom.node.InputNode;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import static org.junit.Assert.*;

public class WindowsTest {

    @Test
    public void testLatestKeepsNewestValues() {
        InputNode<String> in = new InputNode<>();
        ComputeNode<List<String>> last3 = Windows.latest(in, 3);
        GraphContext ctx = new GraphContext(Graph.of(Map.of("in", in, "last3", last3)));

        ctx = ctx.process(Map.of("in", "a")).process(Map.of("in", "b"));
        assertEquals(List.of("a", "b"), ctx.value("last3"));
        ctx = ctx.process(Map.of("in", "c")).process(Map.of("in", "d"));
        assertEquals(List.of("b", "c", "d"), ctx.value("last3"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLatestRejectsEmptyWindow() {
        Windows.latest(new InputNode<Integer>(), 0);
    }

    @Test
    public void testMeanOfEmptyCollectionIsNull() {
        InputNode<List<Integer>> in = new InputNode<>();
        ComputeNode<Double> mean = Windows.mean(in);
        GraphContext ctx = new GraphContext(Graph.of(Map.of("in", in, "mean", mean)));

        assertNull(ctx.process(Map.of("in", List.of())).value("mean"));
        assertEquals(2.5, ctx.process(Map.of("in", List.of(1, 2, 3, 4))).<Double>value("mean"), 1e-9);
    }

    @Test
    public void testRunningSumIgnoresAbsentInput() {
        InputNode<Double> x = new InputNode<>();
        InputNode<Double> other = new InputNode<>();
        ComputeNode<Double> sum = Windows.runningSum(x);
        ComputeNode<String> both = new ComputeNode<>(Map.of("sum", sum, "other", other),
                (prev, v) -> v.get("sum") + "/" + v.get("other"));
        GraphContext ctx = new GraphContext(Graph.of(Map.of("x", x, "other", other, "sum", sum, "both", both)));

        ctx = ctx.process(Map.of("x", 1.5)).process(Map.of("x", 2.0));
        assertEquals(3.5, ctx.<Double>value("sum"), 0.0);
        assertEquals("3.5/4.0", ctx.process(Map.of("other", 4.0)).value("both"));
    }

    @Test
    public void testTimeseriesKeepsGreatestKeys() {
        InputNode<Map<Integer, String>> in = new InputNode<>();
        ComputeNode<SortedMap<Integer, String>> series = Windows.timeseries(in, 3);
        GraphContext ctx = new GraphContext(Graph.of(Map.of("in", in, "series", series)));

        ctx = ctx.process(Map.of("in", Map.of(3, "c", 1, "a")));
        ctx = ctx.process(Map.of("in", Map.of(2, "b", 5, "e")));

        SortedMap<Integer, String> expected = new TreeMap<>(Map.of(2, "b", 3, "c", 5, "e"));
        assertEquals(expected, ctx.value("series"));
    }

    @Test
    public void testMovingAverageOnlyForBatchKeys() {
        InputNode<Map<Integer, Integer>> in = new InputNode<>();
        ComputeNode<SortedMap<Integer, Integer>> series = Windows.timeseries(in, 10);
        ComputeNode<SortedMap<Integer, Double>> avg = Windows.movingAverage(series, in, 2);
        GraphContext ctx = new GraphContext(Graph.of(Map.of("in", in, "avg", avg)));

        ctx = ctx.process(Map.of("in", Map.of(1, 10)));
        assertTrue(ctx.<SortedMap<Integer, Double>>value("avg").isEmpty());

        ctx = ctx.process(Map.of("in", Map.of(2, 20, 3, 40)));
        assertEquals(new TreeMap<>(Map.of(2, 15.0, 3, 30.0)), ctx.value("avg"));

        // a late point recomputes only its own key
        ctx = ctx.process(Map.of("in", Map.of(0, 0)));
        assertEquals(new TreeMap<>(Map.of(2, 15.0, 3, 30.0)), ctx.value("avg"));
    }
}
