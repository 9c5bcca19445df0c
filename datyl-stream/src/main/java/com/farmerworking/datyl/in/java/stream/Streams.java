package com.farmerworking.datyl.in.java.stream;

import com.farmerworking.datyl.in.java.api.KeyValue;
import com.farmerworking.datyl.in.java.api.SortedStream;
import com.farmerworking.datyl.in.java.file.LineSource;
import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

public class Streams {
    private Streams() {
    }

    public static DataFileStream dataFile(LineSource source) {
        return new DataFileStream(source);
    }

    public static <K, V> UniqueStream<K, V> unique(SortedStream<K, V> stream) {
        return new UniqueStream<>(stream);
    }

    public static <K, V> FoldedStream<K, V> fold(SortedStream<K, V> stream) {
        return new FoldedStream<>(stream);
    }

    public static <K, V> SortedStream<K, List<V>> merge(Comparator<? super K> comparator,
                                                        List<? extends SortedStream<K, ? extends V>> streams) {
        if (streams.isEmpty()) {
            return new EmptyStream<>(comparator);
        }
        return new MultiStream<K, V, List<V>>(comparator, ArrayList::new, streams);
    }

    @SafeVarargs
    public static <K, V> SortedStream<K, List<V>> merge(SortedStream<K, V>... streams) {
        Preconditions.checkArgument(streams.length > 0, "merge needs at least one stream");
        return merge(streams[0].comparator(), Arrays.asList(streams));
    }

    public static <K, L, R> ComparisonStream<K, L, R> compare(SortedStream<K, L> left, SortedStream<K, R> right) {
        return left.diffAgainst(right);
    }

    // Drain a stream through each(), so its filters apply.
    public static <K, V> List<KeyValue<K, V>> toList(SortedStream<K, V> stream) {
        List<KeyValue<K, V>> result = new ArrayList<>();
        stream.each((key, value) -> result.add(KeyValue.of(key, value)));
        return result;
    }
}
