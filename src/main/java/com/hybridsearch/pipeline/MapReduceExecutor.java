package com.hybridsearch.pipeline;

import com.hybridsearch.exception.MapReduceException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.BiConsumer;

/**
 * Runs a map, shuffle and reduce job over an in-memory input on a shared worker pool.
 * <p>
 * Each map task owns a contiguous slice of the input and buffers its output by reduce
 * partition, so tasks never share mutable state. The shuffle starts only after every map task
 * has finished. Reduce output is returned ordered by key, which makes results independent of
 * thread scheduling.
 */
@Slf4j
public class MapReduceExecutor {

    @FunctionalInterface
    public interface Mapper<I, K, V> {
        void map(I record, BiConsumer<K, V> emit);
    }

    @FunctionalInterface
    public interface Reducer<K, V, R> {
        R reduce(K key, List<V> values);
    }

    private record KeyValue<K, V>(K key, V value) {}

    private final ExecutorService executor;
    private final int partitions;

    public MapReduceExecutor(ExecutorService executor, int partitions) {
        if (partitions < 1) {
            throw new IllegalArgumentException("At least one partition is required, got " + partitions);
        }
        this.executor = executor;
        this.partitions = partitions;
    }

    public int partitions() {
        return partitions;
    }

    public <I, K extends Comparable<? super K>, V, R> List<R> run(
        String job,
        List<I> input,
        Mapper<I, K, V> mapper,
        Reducer<K, V, R> reducer
    ) {
        long started = System.nanoTime();

        List<Future<List<List<KeyValue<K, V>>>>> mapTasks = new ArrayList<>();
        for (List<I> split : split(input)) {
            mapTasks.add(executor.submit(() -> mapSplit(split, mapper)));
        }
        List<List<List<KeyValue<K, V>>>> mapOutputs = await(job, "map", mapTasks);

        List<SortedMap<K, List<V>>> groups = shuffle(mapOutputs);

        List<Future<List<KeyValue<K, R>>>> reduceTasks = new ArrayList<>();
        for (SortedMap<K, List<V>> group : groups) {
            reduceTasks.add(executor.submit(() -> reduceGroup(group, reducer)));
        }
        List<List<KeyValue<K, R>>> reduceOutputs = await(job, "reduce", reduceTasks);

        List<KeyValue<K, R>> merged = new ArrayList<>();
        reduceOutputs.forEach(merged::addAll);
        merged.sort((a, b) -> a.key().compareTo(b.key()));

        log.debug("Job '{}': {} input records, {} map tasks, {} keys in {} ms",
            job, input.size(), mapTasks.size(), merged.size(), (System.nanoTime() - started) / 1_000_000);

        return merged.stream().map(KeyValue::value).toList();
    }

    private <I> List<List<I>> split(List<I> input) {
        if (input.isEmpty()) {
            return List.of();
        }
        int splits = Math.min(partitions, input.size());
        int size = (input.size() + splits - 1) / splits;

        List<List<I>> result = new ArrayList<>(splits);
        for (int from = 0; from < input.size(); from += size) {
            result.add(input.subList(from, Math.min(from + size, input.size())));
        }
        return result;
    }

    private <I, K, V> List<List<KeyValue<K, V>>> mapSplit(List<I> split, Mapper<I, K, V> mapper) {
        List<List<KeyValue<K, V>>> buckets = new ArrayList<>(partitions);
        for (int i = 0; i < partitions; i++) {
            buckets.add(new ArrayList<>());
        }
        BiConsumer<K, V> emit = (key, value) ->
            buckets.get(partitionOf(key)).add(new KeyValue<>(key, value));

        for (I record : split) {
            mapper.map(record, emit);
        }
        return buckets;
    }

    private <K extends Comparable<? super K>, V> List<SortedMap<K, List<V>>> shuffle(
        List<List<List<KeyValue<K, V>>>> mapOutputs
    ) {
        List<SortedMap<K, List<V>>> groups = new ArrayList<>(partitions);
        for (int partition = 0; partition < partitions; partition++) {
            SortedMap<K, List<V>> group = new TreeMap<>();
            for (List<List<KeyValue<K, V>>> mapOutput : mapOutputs) {
                for (KeyValue<K, V> kv : mapOutput.get(partition)) {
                    group.computeIfAbsent(kv.key(), k -> new ArrayList<>()).add(kv.value());
                }
            }
            groups.add(group);
        }
        return groups;
    }

    private <K, V, R> List<KeyValue<K, R>> reduceGroup(SortedMap<K, List<V>> group, Reducer<K, V, R> reducer) {
        List<KeyValue<K, R>> output = new ArrayList<>(group.size());
        for (Map.Entry<K, List<V>> entry : group.entrySet()) {
            output.add(new KeyValue<>(entry.getKey(), reducer.reduce(entry.getKey(), entry.getValue())));
        }
        return output;
    }

    private int partitionOf(Object key) {
        return Math.floorMod(key.hashCode(), partitions);
    }

    private <T> List<T> await(String job, String phase, List<Future<T>> tasks) {
        List<T> results = new ArrayList<>(tasks.size());
        try {
            for (Future<T> task : tasks) {
                results.add(task.get());
            }
            return results;
        } catch (ExecutionException e) {
            tasks.forEach(task -> task.cancel(true));
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new MapReduceException(job, phase + " task failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            tasks.forEach(task -> task.cancel(true));
            Thread.currentThread().interrupt();
            throw new MapReduceException(job, "interrupted during " + phase, e);
        }
    }
}
