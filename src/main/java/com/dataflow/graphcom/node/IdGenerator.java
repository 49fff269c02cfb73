package com.dataflow.graphcom.node;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of node identities.
 *
 * <p>
 * {@link #global()} is shared by the whole process and is what the default
 * node constructors use, so identities never repeat. Tests that want
 * predictable identities create their own {@link #sequential()} generator and
 * pass it to the node constructors. Identities from two different sequential
 * generators can collide; the graph rejects such a collision when two
 * distinct nodes end up in the same graph.
 */
@FunctionalInterface
public interface IdGenerator {

    /** Returns a fresh identity. */
    NodeId next();

    /** The process-wide generator. */
    static IdGenerator global() {
        return Global.INSTANCE;
    }

    /** A new generator counting up from 1. */
    static IdGenerator sequential() {
        return sequential(1);
    }

    /** A new generator counting up from {@code start}. */
    static IdGenerator sequential(long start) {
        AtomicLong counter = new AtomicLong(start);
        return () -> new NodeId(counter.getAndIncrement());
    }

    final class Global {
        private static final IdGenerator INSTANCE = sequential();

        private Global() {
        }
    }
}
