package com.dataflow.graphcom.api;

import java.util.Set;

/**
 * Observability interface for monitoring processing calls.
 *
 * Implementations are attached to a context with
 * {@link com.dataflow.graphcom.engine.GraphContext#withListener(ProcessListener)}
 * and travel with every context derived from it. This is the hook for:
 *
 * - Profiling: measuring how long each call takes.
 * - Diagnostics: logging failed calls with their label paths.
 * - Metrics: counting calls and the number of nodes each call recomputes.
 *
 * Callbacks run synchronously on the thread that calls
 * {@code process}. Keep them cheap; anything slow here adds directly to the
 * latency of every call.
 */
public interface ProcessListener {

    /**
     * Called before the schedule of a call is resolved.
     *
     * @param epoch       The epoch the call will produce if it succeeds.
     * @param inputLabels Labels supplied in the batch.
     */
    void onProcessStart(long epoch, Set<String> inputLabels);

    /**
     * Called after a call completed successfully.
     *
     * @param epoch          The epoch of the new context.
     * @param nodesProcessed Number of compute nodes the schedule ran.
     * @param compiled       True if the schedule for this set of input labels
     *                       was compiled by this call rather than found in the
     *                       context's cache.
     */
    void onProcessEnd(long epoch, int nodesProcessed, boolean compiled);

    /**
     * Called when a handler failed. The exception is thrown to the caller
     * right after this returns.
     *
     * @param epoch The epoch the call would have produced.
     * @param error The attributed failure.
     */
    void onProcessError(long epoch, ComputationException error);
}
