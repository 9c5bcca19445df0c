package com.farmerworking.datyl.in.java.stream;

import com.farmerworking.datyl.in.java.api.KeyValue;
import com.farmerworking.datyl.in.java.api.SortedStream;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;

/**
 * Merges any number of sorted streams. Each pull returns the smallest key
 * present on any input together with a container holding that key's value
 * from every input carrying it, in input order. Inputs whose head is larger
 * get it pushed back, so at most one pair per input is held at any time.
 *
 * @param <C> the container the merged values are appended to
 */
public class MultiStream<K, V, C extends Collection<V>> extends AbstractSortedStream<K, C> {
    private final List<SortedStream<K, ? extends V>> streams;
    private final Supplier<C> containerFactory;

    public MultiStream(Comparator<? super K> comparator,
                       Supplier<C> containerFactory,
                       List<? extends SortedStream<K, ? extends V>> streams) {
        super(comparator);
        Preconditions.checkNotNull(streams, "streams");
        Preconditions.checkArgument(!streams.isEmpty(), "a multi stream needs at least one input stream");
        this.containerFactory = Preconditions.checkNotNull(containerFactory, "containerFactory");
        this.streams = ImmutableList.copyOf(streams);
    }

    // Values are collected in an ArrayList, ordered by the first stream's comparator.
    public static <K, V> MultiStream<K, V, List<V>> of(List<? extends SortedStream<K, ? extends V>> streams) {
        Preconditions.checkArgument(!streams.isEmpty(), "a multi stream needs at least one input stream");
        return new MultiStream<K, V, List<V>>(streams.get(0).comparator(), ArrayList::new, streams);
    }

    public List<SortedStream<K, ? extends V>> getStreams() {
        return streams;
    }

    @Override
    protected KeyValue<K, C> read() {
        List<Score<K, V>> scorecard = new ArrayList<>(streams.size());
        for (SortedStream<K, ? extends V> stream : streams) {
            KeyValue<K, ? extends V> keyValue = stream.pull();
            if (keyValue != null) {
                scorecard.add(new Score<>(stream, keyValue.getKey(), keyValue.getValue()));
            }
        }

        if (scorecard.isEmpty()) {
            return null;
        }

        K smallest = scorecard.get(0).key;
        for (Score<K, V> score : scorecard) {
            if (comparator.compare(score.key, smallest) < 0) {
                smallest = score.key;
            }
        }

        C values = containerFactory.get();
        for (Score<K, V> score : scorecard) {
            if (comparator.compare(score.key, smallest) == 0) {
                values.add(score.value);
            } else {
                score.stream.pushback();
            }
        }
        return KeyValue.of(smallest, values);
    }

    @Override
    protected boolean isSourceExhausted() {
        for (SortedStream<K, ? extends V> stream : streams) {
            if (!stream.atEnd()) {
                return false;
            }
        }
        return true;
    }

    @Override
    protected void rewindSource() {
        for (SortedStream<K, ? extends V> stream : streams) {
            stream.rewind();
        }
    }

    @Override
    public String toString() {
        List<String> names = new ArrayList<>();
        for (SortedStream<K, ? extends V> stream : streams) {
            names.add(stream.toString());
        }
        return String.format("%s wrapping %s", getClass().getSimpleName(), String.join(", ", names));
    }

    private static class Score<K, V> {
        private final SortedStream<K, ? extends V> stream;
        private final K key;
        private final V value;

        Score(SortedStream<K, ? extends V> stream, K key, V value) {
            this.stream = stream;
            this.key = key;
            this.value = value;
        }
    }
}
