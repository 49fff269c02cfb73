package com.dataflow.graphcom.api;

/**
 * Caller misuse that is detected before any handler runs: an empty source
 * set, a duplicate or unknown label, or a label naming the wrong kind of node.
 */
public class ConfigurationException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }
}
