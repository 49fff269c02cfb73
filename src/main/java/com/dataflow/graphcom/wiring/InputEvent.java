package com.dataflow.graphcom.wiring;

/**
 * A mutable holder for one input value, used within the LMAX Disruptor
 * RingBuffer.
 *
 * Pattern: Flyweight / Mutable Event
 *
 * Instances are pre-allocated when the ring buffer is built and reused for
 * every publication. The consumer collects the events of a burst into one
 * input batch.
 *
 * Fields:
 * - label: The input label the value is for.
 * - value: The payload.
 * - batchEnd: Forces processing right after this event, even if more events
 * are waiting.
 * - sequenceId: Producer-side correlation id, for logging.
 */
public final class InputEvent {
    private String label;
    private Object value;
    private boolean batchEnd;
    private long sequenceId;

    /**
     * Configures the event.
     *
     * @param label    Target input label.
     * @param value    The value.
     * @param batchEnd If true, the batch is processed after this event.
     * @param seqId    The sequence ID (for correlation/logging).
     */
    public void set(String label, Object value, boolean batchEnd, long seqId) {
        this.label = label;
        this.value = value;
        this.batchEnd = batchEnd;
        this.sequenceId = seqId;
    }

    public String label() {
        return label;
    }

    public Object value() {
        return value;
    }

    public boolean isBatchEnd() {
        return batchEnd;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        label = null;
        value = null;
        batchEnd = false;
        sequenceId = 0;
    }
}
