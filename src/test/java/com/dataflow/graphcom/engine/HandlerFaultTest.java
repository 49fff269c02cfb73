package com.dataflow.graphcom.engine;

import com.dataflow.graphcom.api.ComputationException;
import com.dataflow.graphcom.api.Handler;
import com.dataflow.graphcom.api.Processor;
import com.dataflow.graphcom.node.ComputeNode;
import com.dataflow.graphcom.node.InputNode;
import lombok.SneakyThrows;
import org.junit.After;
import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

/**
 * Faults that are not runtime exceptions still surface as attributed
 * {@link ComputationException}s, identically for both processors.
 */
public class HandlerFaultTest {

    private final ParallelProcessor parallel = new ParallelProcessor(2);

    @After
    public void tearDown() {
        parallel.close();
    }

    @SneakyThrows
    private static Integer readDevice(Object in) {
        throw new IOException("device gone: " + in);
    }

    /** in -> (ok, bad) -> hidden relay -> out; ok and bad share a level. */
    private static GraphContext context(Handler<Integer> bad, Processor processor) {
        InputNode<Integer> in = new InputNode<>();
        ComputeNode<Integer> ok = new ComputeNode<>(Map.of("in", in), (prev, v) -> (Integer) v.get("in"));
        ComputeNode<Integer> faulty = new ComputeNode<>(Map.of("in", in), bad);
        ComputeNode<Integer> relay = new ComputeNode<>(Map.of("source", faulty), (prev, v) -> 0);
        ComputeNode<Integer> out = new ComputeNode<>(Map.of("ok", ok, "relay", relay), (prev, v) -> 0);
        return new GraphContext(Graph.of(Map.of("in", in, "ok", ok, "out", out)), processor);
    }

    private static void assertAttributed(GraphContext ctx, Class<? extends Throwable> causeType) {
        List<ComputationException> reported = new ArrayList<>();
        GraphContext listened = ctx.withListener(new com.dataflow.graphcom.api.ProcessListener() {
            @Override
            public void onProcessStart(long epoch, Set<String> inputLabels) {
            }

            @Override
            public void onProcessEnd(long epoch, int nodesProcessed, boolean compiled) {
            }

            @Override
            public void onProcessError(long epoch, ComputationException error) {
                reported.add(error);
            }
        });
        try {
            listened.process(Map.of("in", 1));
            fail("Expected ComputationException");
        } catch (ComputationException e) {
            assertTrue(causeType.isInstance(e.getCause()));
            assertEquals(Set.of(List.of("out", "relay", "source")), e.paths());
            assertEquals(List.of(e), reported);
        }
        assertTrue(ctx.values().isEmpty());
    }

    @Test
    public void testUndeclaredCheckedExceptionSequential() {
        assertAttributed(context((prev, v) -> readDevice(v.get("in")), new SequentialProcessor()), IOException.class);
    }

    @Test
    public void testUndeclaredCheckedExceptionParallel() {
        assertAttributed(context((prev, v) -> readDevice(v.get("in")), parallel), IOException.class);
    }

    @Test
    public void testErrorSequential() {
        assertAttributed(context((prev, v) -> {
            throw new AssertionError("invariant broken");
        }, new SequentialProcessor()), AssertionError.class);
    }

    @Test
    public void testErrorParallel() {
        assertAttributed(context((prev, v) -> {
            throw new AssertionError("invariant broken");
        }, parallel), AssertionError.class);
    }
}
