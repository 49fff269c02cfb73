package com.dataflow.graphcom.util;

import com.dataflow.graphcom.api.ComputationException;
import com.dataflow.graphcom.api.ProcessListener;

import java.util.Arrays;
import java.util.Set;

/**
 * Fans callbacks out to several {@link ProcessListener} instances, in the order
 * they were added.
 */
public class CompositeProcessListener implements ProcessListener {
    private ProcessListener[] listeners = new ProcessListener[0];

    public CompositeProcessListener(ProcessListener... listeners) {
        for (ProcessListener l : listeners)
            add(l);
    }

    public CompositeProcessListener add(ProcessListener listener) {
        ProcessListener[] old = listeners;
        ProcessListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    @Override
    public void onProcessStart(long epoch, Set<String> inputLabels) {
        for (ProcessListener l : listeners)
            l.onProcessStart(epoch, inputLabels);
    }

    @Override
    public void onProcessEnd(long epoch, int nodesProcessed, boolean compiled) {
        for (ProcessListener l : listeners)
            l.onProcessEnd(epoch, nodesProcessed, compiled);
    }

    @Override
    public void onProcessError(long epoch, ComputationException error) {
        for (ProcessListener l : listeners)
            l.onProcessError(epoch, error);
    }
}
