package com.dataflow.graphcom.wiring;

import com.dataflow.graphcom.engine.GraphContext;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A running LMAX Disruptor feeding a {@link ContextPublisher}.
 *
 * Producers on any thread call {@link #publish}; the single consumer thread
 * coalesces bursts into batches and processes them. {@link #close()} drains
 * the ring buffer and stops the consumer.
 */
public final class InputRingBuffer implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(InputRingBuffer.class);

    private final Disruptor<InputEvent> disruptor;
    private final RingBuffer<InputEvent> ringBuffer;
    private final ContextPublisher publisher;

    private InputRingBuffer(Disruptor<InputEvent> disruptor, ContextPublisher publisher) {
        this.disruptor = disruptor;
        this.publisher = publisher;
        this.ringBuffer = disruptor.start();
    }

    /** Starts with a blocking wait strategy and multiple producers. */
    public static InputRingBuffer start(GraphContext initial, int bufferSize) {
        return start(new ContextPublisher(initial), bufferSize, ProducerType.MULTI, new BlockingWaitStrategy());
    }

    /**
     * Starts the consumer thread.
     *
     * @param publisher    Handler that owns the context.
     * @param bufferSize   Ring size; must be a power of 2.
     * @param producerType SINGLE if only one thread ever publishes.
     * @param waitStrategy Consumer wait strategy.
     */
    public static InputRingBuffer start(ContextPublisher publisher, int bufferSize, ProducerType producerType,
            WaitStrategy waitStrategy) {
        Disruptor<InputEvent> disruptor = new Disruptor<>(
                InputEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                producerType,
                waitStrategy);
        disruptor.handleEventsWith(publisher);
        log.debug("Starting input ring buffer: size={} producer={}", bufferSize, producerType);
        return new InputRingBuffer(disruptor, publisher);
    }

    /**
     * Publishes one input value.
     *
     * @param label    Input label.
     * @param value    Value.
     * @param batchEnd Process the batch right after this value.
     */
    public void publish(String label, Object value, boolean batchEnd) {
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).set(label, value, batchEnd, sequence);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    public ContextPublisher publisher() {
        return publisher;
    }

    /** The context after the last batch the consumer completed. */
    public GraphContext context() {
        return publisher.context();
    }

    /** Waits until every published event is handled, then stops the consumer. */
    @Override
    public void close() {
        disruptor.shutdown();
        log.debug("Input ring buffer stopped after {} batches ({} failed)", publisher.batchesProcessed(),
                publisher.batchesFailed());
    }
}
