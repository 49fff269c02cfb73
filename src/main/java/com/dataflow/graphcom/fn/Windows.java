package com.dataflow.graphcom.fn;

import com.dataflow.graphcom.api.Node;
import com.dataflow.graphcom.node.ComputeNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Compute-node factories for rolling aggregates over an input stream.
 *
 * <p>
 * Every node returned here keeps its state in its own value (the previous
 * value passed to the handler), so the same node works in any number of
 * contexts and branches. Values are immutable collections.
 *
 * <p>
 * A node whose input is absent from a batch keeps its previous value.
 */
public final class Windows {

    private Windows() {
    }

    /** Running total of a numeric input. */
    public static ComputeNode<Double> runningSum(Node<? extends Number> input) {
        return new ComputeNode<>(Map.of("input", input), (prev, in) -> {
            Number x = (Number) in.get("input");
            if (x == null)
                return prev;
            return (prev == null ? 0.0 : prev) + x.doubleValue();
        });
    }

    /**
     * The last {@code size} values of {@code input}, oldest first.
     *
     * @throws IllegalArgumentException if {@code size < 1}.
     */
    public static <T> ComputeNode<List<T>> latest(Node<T> input, int size) {
        if (size < 1)
            throw new IllegalArgumentException("Size must be >= 1");
        return new ComputeNode<>(Map.of("input", input), (prev, in) -> {
            @SuppressWarnings("unchecked")
            T x = (T) in.get("input");
            if (x == null)
                return prev;
            List<T> window = new ArrayList<>(size);
            if (prev != null)
                window.addAll(prev.subList(Math.max(0, prev.size() - size + 1), prev.size()));
            window.add(x);
            return Collections.unmodifiableList(window);
        });
    }

    /** Arithmetic mean of a collection of numbers; null while the collection is empty. */
    public static ComputeNode<Double> mean(Node<? extends Collection<? extends Number>> source) {
        return new ComputeNode<>(Map.of("source", source), (prev, in) -> {
            Collection<?> values = (Collection<?>) in.get("source");
            if (values == null || values.isEmpty())
                return null;
            double sum = 0.0;
            for (Object v : values)
                sum += ((Number) v).doubleValue();
            return sum / values.size();
        });
    }

    /**
     * Accumulates keyed values (e.g. timestamp to price) into a sorted map that
     * keeps the {@code maxSize} greatest keys.
     */
    public static <K extends Comparable<? super K>, V> ComputeNode<SortedMap<K, V>> timeseries(
            Node<? extends Map<K, V>> input, int maxSize) {
        if (maxSize < 1)
            throw new IllegalArgumentException("Max size must be >= 1");
        return new ComputeNode<>(Map.of("input", input), (prev, in) -> {
            @SuppressWarnings("unchecked")
            Map<K, V> batch = (Map<K, V>) in.get("input");
            if (batch == null)
                return prev;
            TreeMap<K, V> series = prev == null ? new TreeMap<>() : new TreeMap<>(prev);
            series.putAll(batch);
            while (series.size() > maxSize)
                series.pollFirstEntry();
            return Collections.unmodifiableSortedMap(series);
        });
    }

    /**
     * Moving average of {@code source} over {@code period} points, computed only
     * for the keys present in the current {@code input} batch. A key with fewer
     * than {@code period} points at or before it gets no average.
     */
    public static <K extends Comparable<? super K>> ComputeNode<SortedMap<K, Double>> movingAverage(
            Node<? extends SortedMap<K, ? extends Number>> source, Node<? extends Map<K, ?>> input, int period) {
        if (period < 1)
            throw new IllegalArgumentException("Period must be >= 1");
        return new ComputeNode<>(Map.<String, Node<?>>of("source", source, "input", input), (prev, in) -> {
            @SuppressWarnings("unchecked")
            SortedMap<K, ? extends Number> series = (SortedMap<K, ? extends Number>) in.get("source");
            Map<?, ?> batch = (Map<?, ?>) in.get("input");
            if (series == null || batch == null)
                return prev;
            TreeMap<K, Double> averages = prev == null ? new TreeMap<>() : new TreeMap<>(prev);
            TreeMap<K, Number> all = new TreeMap<>(series);
            for (Object key : batch.keySet()) {
                @SuppressWarnings("unchecked")
                K k = (K) key;
                List<Number> tail = new ArrayList<>(all.headMap(k, true).values());
                if (tail.size() < period)
                    continue;
                double sum = 0.0;
                for (Number v : tail.subList(tail.size() - period, tail.size()))
                    sum += v.doubleValue();
                averages.put(k, sum / period);
            }
            return Collections.unmodifiableSortedMap(averages);
        });
    }
}
