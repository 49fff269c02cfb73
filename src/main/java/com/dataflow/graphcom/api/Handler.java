package com.dataflow.graphcom.api;

import java.util.Map;

/**
 * Computation of a compute node.
 *
 * <p>
 * Receives the node's previous value ({@code null} on the first call) and the
 * current value of each source, keyed by the label the node declared for that
 * source. An input source that was not supplied in the current batch maps to
 * {@code null}.
 *
 * <p>
 * Handlers must be pure with respect to the engine: everything they need is
 * passed in explicitly and the result is the node's new value.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code (prev, in) -> (prev == null ? 0 : prev) + (Integer) in.get("input")}</li>
 * <li>{@code (prev, in) -> in.get("source")}</li>
 * </ul>
 *
 * @param <T> The type of value produced.
 */
@FunctionalInterface
public interface Handler<T> {
    /**
     * Computes the new value.
     *
     * @param previous The value produced by the previous call, or null.
     * @param sources  Current source values keyed by source label.
     * @return The new value of the node.
     */
    T compute(T previous, Map<String, Object> sources);
}
