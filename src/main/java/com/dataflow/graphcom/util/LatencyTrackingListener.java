package com.dataflow.graphcom.util;

import com.dataflow.graphcom.api.ComputationException;
import com.dataflow.graphcom.api.ProcessListener;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

/**
 * Per input shape statistics of processing calls.
 *
 * <p>
 * A context compiles one schedule per set of input labels, so the cost of a
 * call depends on which labels the batch carries and on whether that schedule
 * was already cached. Calls are therefore grouped by their label set, and the
 * first (compiling) call of a shape is kept apart from the cached ones:
 * <ul>
 * <li><b>Compile:</b> number and total latency of calls that compiled their
 * schedule.</li>
 * <li><b>Cached:</b> average and worst latency of calls that reused it.</li>
 * <li><b>Workload:</b> compute nodes recomputed per call.</li>
 * <li><b>Failures:</b> calls aborted by a handler; logged with their label
 * paths through an {@link ErrorRateLimiter}.</li>
 * </ul>
 *
 * <p>
 * Not thread-safe: attach one instance per processing thread.
 */
@Log4j2
public final class LatencyTrackingListener implements ProcessListener {
    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private final Map<Set<String>, ShapeStats> shapes = new LinkedHashMap<>();
    private Set<String> currentShape = Set.of();
    private long startNanos;

    @Override
    public void onProcessStart(long epoch, Set<String> inputLabels) {
        currentShape = inputLabels;
        startNanos = System.nanoTime();
    }

    @Override
    public void onProcessEnd(long epoch, int nodesProcessed, boolean compiled) {
        long elapsed = System.nanoTime() - startNanos;
        shapes.computeIfAbsent(currentShape, k -> new ShapeStats()).record(elapsed, nodesProcessed, compiled);
    }

    @Override
    public void onProcessError(long epoch, ComputationException error) {
        shapes.computeIfAbsent(currentShape, k -> new ShapeStats()).failures++;
        errLimiter.log(String.format("Processing of %s failed at epoch %d, node %s, paths %s", currentShape,
                epoch, error.nodeId(), error.paths()), error.getCause());
    }

    /** Label sets seen so far, in order of first appearance. */
    public Set<Set<String>> shapes() {
        return Collections.unmodifiableSet(shapes.keySet());
    }

    /** Statistics of one label set, or null if it was never processed. */
    public ShapeStats stats(Set<String> inputLabels) {
        return shapes.get(inputLabels);
    }

    public long totalCalls() {
        long n = 0;
        for (ShapeStats s : shapes.values())
            n += s.calls();
        return n;
    }

    public long totalFailures() {
        long n = 0;
        for (ShapeStats s : shapes.values())
            n += s.failures;
        return n;
    }

    /** Calls that had to compile their schedule. */
    public long totalCompilations() {
        long n = 0;
        for (ShapeStats s : shapes.values())
            n += s.compiledCalls;
        return n;
    }

    public void reset() {
        shapes.clear();
    }

    /** One row per label set, in order of first appearance. */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-24s | %8s | %8s | %10s | %12s | %12s | %12s%n", "Inputs", "Calls", "Failures",
                "Nodes/call", "Compile (us)", "Cached (us)", "Max cached"));
        sb.append("-".repeat(104)).append('\n');
        for (Map.Entry<Set<String>, ShapeStats> e : shapes.entrySet()) {
            List<String> labels = new ArrayList<>(e.getKey());
            labels.sort(null);
            ShapeStats s = e.getValue();
            sb.append(String.format("%-24s | %8d | %8d | %10.1f | %12.2f | %12.2f | %12.2f%n",
                    String.join(",", labels), s.calls(), s.failures, s.avgNodesPerCall(),
                    s.compileLatencyNanos / 1000.0, s.avgCachedLatencyNanos() / 1000.0,
                    s.maxCachedLatencyNanos / 1000.0));
        }
        return sb.toString();
    }

    /** Counters of the calls made with one set of input labels. */
    @Getter
    public static final class ShapeStats {
        private long compiledCalls, cachedCalls, failures;
        private long compileLatencyNanos, cachedLatencyNanos, maxCachedLatencyNanos;
        private long nodesProcessed;

        private void record(long elapsedNanos, int nodes, boolean compiled) {
            nodesProcessed += nodes;
            if (compiled) {
                compiledCalls++;
                compileLatencyNanos += elapsedNanos;
            } else {
                cachedCalls++;
                cachedLatencyNanos += elapsedNanos;
                maxCachedLatencyNanos = Math.max(maxCachedLatencyNanos, elapsedNanos);
            }
        }

        /** Successful calls. */
        public long calls() {
            return compiledCalls + cachedCalls;
        }

        public double avgNodesPerCall() {
            return calls() > 0 ? (double) nodesProcessed / calls() : 0;
        }

        public double avgCachedLatencyNanos() {
            return cachedCalls > 0 ? (double) cachedLatencyNanos / cachedCalls : 0;
        }
    }
}
