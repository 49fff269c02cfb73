package com.dataflow.graphcom.wiring;

import com.dataflow.graphcom.api.ComputationException;
import com.dataflow.graphcom.api.ConfigurationException;
import com.dataflow.graphcom.engine.GraphContext;
import com.lmax.disruptor.EventHandler;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Disruptor EventHandler that turns a stream of {@link InputEvent}s into
 * processing calls.
 *
 * Runs on the single consumer thread of the ring buffer. Every event adds its
 * value to the pending batch; a later value for the same label replaces the
 * earlier one. The batch is processed when:
 * - endOfBatch is true (the ring buffer has no more events ready), or
 * - the event explicitly requests it ({@link InputEvent#isBatchEnd()}).
 *
 * A burst of events therefore costs one {@code process} call.
 *
 * The current context is published through a volatile field, so any thread
 * may read {@link #context()} and get a complete context value.
 *
 * Failure:
 * A batch that fails (unknown label, handler fault, processor fault) is logged
 * and dropped; the context stays at the last successful batch and the consumer
 * keeps running.
 */
public final class ContextPublisher implements EventHandler<InputEvent> {
    private static final Logger log = LogManager.getLogger(ContextPublisher.class);

    private final Map<String, Object> pending = new LinkedHashMap<>();
    private volatile GraphContext context;
    private long batches, failures;

    private PostProcessCallback postProcess;
    private FailureCallback onFailure;

    public ContextPublisher(GraphContext initial) {
        this.context = Objects.requireNonNull(initial, "initial");
    }

    /**
     * Sets a callback invoked on the consumer thread after every successful
     * batch.
     */
    public void setPostProcessCallback(PostProcessCallback cb) {
        this.postProcess = cb;
    }

    /** Sets a callback invoked on the consumer thread after a failed batch. */
    public void setFailureCallback(FailureCallback cb) {
        this.onFailure = cb;
    }

    @Override
    public void onEvent(InputEvent event, long sequence, boolean endOfBatch) {
        if (event.label() == null) {
            log.error("Received event without label: sequence={} seqId={}", sequence, event.sequenceId());
        } else {
            pending.put(event.label(), event.value());
        }
        boolean flush = event.isBatchEnd() || endOfBatch;
        event.clear();
        if (flush)
            flush();
    }

    /** Processes the pending batch, if any. */
    public void flush() {
        if (pending.isEmpty())
            return;
        Map<String, Object> batch = new HashMap<>(pending);
        pending.clear();
        try {
            GraphContext next = context.process(batch);
            context = next;
            batches++;
            if (postProcess != null)
                postProcess.onProcessed(next);
        } catch (ComputationException e) {
            failures++;
            log.error("Batch {} failed at paths {}: {}", batch.keySet(), e.paths(), e.getCause().getMessage(), e);
            if (onFailure != null)
                onFailure.onFailure(batch, e);
        } catch (ConfigurationException e) {
            failures++;
            log.error("Batch {} rejected: {}", batch.keySet(), e.getMessage());
            if (onFailure != null)
                onFailure.onFailure(batch, e);
        } catch (RuntimeException e) {
            // Processor or executor fault; not rethrown so the consumer thread survives
            failures++;
            log.error("Batch {} aborted: {}", batch.keySet(), e.getMessage(), e);
            if (onFailure != null)
                onFailure.onFailure(batch, e);
        }
    }

    /** The context after the last successful batch. */
    public GraphContext context() {
        return context;
    }

    public long batchesProcessed() {
        return batches;
    }

    public long batchesFailed() {
        return failures;
    }

    /**
     * Callback interface for post-processing actions.
     */
    @FunctionalInterface
    public interface PostProcessCallback {
        /**
         * Called after a batch was processed.
         *
         * @param context The new context.
         */
        void onProcessed(GraphContext context);
    }

    /**
     * Callback interface for rejected or failed batches.
     */
    @FunctionalInterface
    public interface FailureCallback {
        /**
         * @param batch The dropped batch.
         * @param error Why it was dropped.
         */
        void onFailure(Map<String, Object> batch, RuntimeException error);
    }
}
