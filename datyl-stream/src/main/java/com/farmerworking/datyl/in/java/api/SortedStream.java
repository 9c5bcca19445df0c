package com.farmerworking.datyl.in.java.api;

import com.farmerworking.datyl.in.java.stream.ComparisonStream;

import java.util.Comparator;
import java.util.List;
import java.util.function.BiConsumer;

// A pull-based sequence of key/value pairs whose keys never decrease under
// comparator(). A stream is driven by a single consumer; it does no locking.
public interface SortedStream<K, V> {
    // Return the next key/value pair, or null when none is available.
    // A pair pushed back by pushback() is returned first.
    KeyValue<K, V> pull();

    // Re-deliver the pair returned by the last pull() on the next pull().
    // Only one level is kept: pushing back twice without an intervening
    // pull() throws a StreamException with a usage error status, as does
    // pushing back before anything was pulled.
    void pushback();

    boolean isPushbackPending();

    // True iff no pair is pending and the underlying source is exhausted.
    boolean atEnd();

    // Reposition to the first pair and drop any pending pushback.
    // Throws a StreamException when the source can not be repositioned.
    SortedStream<K, V> rewind();

    Comparator<? super K> comparator();

    // Consulted by each(), in order; pull() ignores them. Mutable.
    List<StreamFilter<K, V>> filters();

    SortedStream<K, V> addFilter(StreamFilter<K, V> filter);

    // Consume the stream, handing every pair accepted by all filters to visitor.
    void each(BiConsumer<? super K, ? super V> visitor);

    // Walk this stream (left) against other (right) key by key.
    <W> ComparisonStream<K, V, W> diffAgainst(SortedStream<K, W> other);
}
