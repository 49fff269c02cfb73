package com.dataflow.graphcom.api;

/**
 * Graph assembly would break the structure of the graph: a cycle, or a
 * distinct node reusing an identity that is already registered.
 *
 * <p>
 * The graph being assembled must be discarded. Graph values that existed
 * before the failing {@code add} are unaffected.
 */
public class StructuralException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public StructuralException(String message) {
        super(message);
    }
}
