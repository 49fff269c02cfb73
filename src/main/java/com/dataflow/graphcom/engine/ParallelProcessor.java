package com.dataflow.graphcom.engine;

import com.dataflow.graphcom.node.NodeId;
import com.lmax.disruptor.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Processor that runs the nodes of each topological level concurrently.
 *
 * Compile:
 * The schedule keeps one stage per level.
 *
 * Execute (per level, in order):
 * 1. Snapshot: the values as they stand before the level starts. Nodes of the
 * same level have no edge between them, so none of them needs another's new
 * value.
 * 2. Fan out: one task per node, evaluated against the snapshot.
 * 3. Join: wait for every task of the level. This barrier is what guarantees a
 * source is complete before any dependant starts.
 * 4. Merge: the level's results go into the running values, which the next
 * level snapshots.
 * A level with a single node runs on the calling thread.
 *
 * Failure:
 * The first failing task cancels the rest of its level and the call fails. The
 * running values are discarded; results of the partial level are never
 * surfaced.
 *
 * Threads:
 * Either a fixed pool of daemon threads owned by this processor (release it
 * with {@link #close()}), or a caller-supplied executor that this processor
 * never shuts down.
 */
public final class ParallelProcessor extends AbstractProcessor implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(ParallelProcessor.class);

    private final ExecutorService executor;
    private final boolean ownsExecutor;

    /** Uses a pool with one thread per available processor. */
    public ParallelProcessor() {
        this(Runtime.getRuntime().availableProcessors());
    }

    public ParallelProcessor(int parallelism) {
        if (parallelism < 1)
            throw new IllegalArgumentException("Parallelism must be >= 1");
        this.executor = Executors.newFixedThreadPool(parallelism, DaemonThreadFactory.INSTANCE);
        this.ownsExecutor = true;
        log.debug("Started parallel processor with {} threads", parallelism);
    }

    /** Runs levels on {@code executor}; the caller keeps ownership of it. */
    public ParallelProcessor(ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownsExecutor = false;
    }

    @Override
    public Schedule compile(Graph graph, Set<NodeId> inputIds) {
        return Schedule.leveled(TopologicalLeveler.processingLevels(graph, inputIds));
    }

    @Override
    public Map<NodeId, Object> execute(Graph graph, Schedule schedule, Map<NodeId, Object> values,
            Map<NodeId, Object> inputs) {
        final Map<NodeId, Object> running = new HashMap<>(values);
        for (List<NodeId> level : schedule.stages()) {
            if (level.size() == 1) {
                NodeId id = level.get(0);
                running.put(id, evaluate(graph, id, running, inputs));
            } else {
                running.putAll(executeLevel(graph, level, Collections.unmodifiableMap(running), inputs));
            }
        }
        return running;
    }

    private Map<NodeId, Object> executeLevel(Graph graph, List<NodeId> level, Map<NodeId, Object> snapshot,
            Map<NodeId, Object> inputs) {
        CompletionService<LevelResult> completion = new ExecutorCompletionService<>(executor);
        List<Future<LevelResult>> futures = new ArrayList<>(level.size());
        try {
            for (NodeId id : level)
                futures.add(completion.submit(() -> new LevelResult(id, evaluate(graph, id, snapshot, inputs))));

            Map<NodeId, Object> results = new HashMap<>(level.size() * 2);
            for (int i = 0; i < level.size(); i++) {
                LevelResult r = completion.take().get();
                results.put(r.id(), r.value());
            }
            return results;
        } catch (ExecutionException e) {
            // evaluate() wraps every handler fault, so the cause is a NodeFailureException
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re)
                throw re;
            if (cause instanceof Error err)
                throw err;
            throw new IllegalStateException("Level task failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for level " + level, e);
        } finally {
            // No-op for completed tasks; aborts siblings of a failed one.
            for (Future<LevelResult> f : futures)
                f.cancel(true);
        }
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
            log.debug("Parallel processor pool shut down");
        }
    }

    @Override
    public String toString() {
        return "ParallelProcessor";
    }

    private record LevelResult(NodeId id, Object value) {
    }
}
