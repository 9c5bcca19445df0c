package com.farmerworking.datyl.in.java.stream;

import com.farmerworking.datyl.in.java.api.KeyValue;
import com.farmerworking.datyl.in.java.api.SortedStream;
import com.google.common.base.Preconditions;

// Drops pairs whose key equals the key of the pair before it, so the first
// pair of every run of equal keys wins. The inner stream must be sorted.
public class UniqueStream<K, V> extends AbstractSortedStream<K, V> {
    private final SortedStream<K, V> stream;

    public UniqueStream(SortedStream<K, V> stream) {
        super(Preconditions.checkNotNull(stream, "stream").comparator());
        this.stream = stream;
    }

    @Override
    protected KeyValue<K, V> read() {
        KeyValue<K, V> upcoming = stream.pull();
        if (upcoming == null) {
            return null;
        }

        while (true) {
            KeyValue<K, V> next = stream.pull();
            if (next == null) {
                return upcoming;
            }

            if (comparator.compare(next.getKey(), upcoming.getKey()) != 0) {
                stream.pushback();
                return upcoming;
            }
        }
    }

    @Override
    protected boolean isSourceExhausted() {
        return stream.atEnd();
    }

    @Override
    protected void rewindSource() {
        stream.rewind();
    }

    @Override
    public String toString() {
        return String.format("%s wrapping %s", getClass().getSimpleName(), stream);
    }
}
