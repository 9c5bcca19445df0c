package com.farmerworking.datyl.in.java.stream;

import com.farmerworking.datyl.in.java.api.KeyValue;
import com.farmerworking.datyl.in.java.api.SortedStream;
import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;

// Folds the values of each run of equal keys into one list, in stream order.
// Every value is a list, a singleton for a key seen once.
public class FoldedStream<K, V> extends AbstractSortedStream<K, List<V>> {
    private final SortedStream<K, V> stream;

    public FoldedStream(SortedStream<K, V> stream) {
        super(Preconditions.checkNotNull(stream, "stream").comparator());
        this.stream = stream;
    }

    @Override
    protected KeyValue<K, List<V>> read() {
        KeyValue<K, V> upcoming = stream.pull();
        if (upcoming == null) {
            return null;
        }
        List<V> values = new ArrayList<>();
        values.add(upcoming.getValue());

        while (true) {
            KeyValue<K, V> next = stream.pull();
            if (next == null) {
                return KeyValue.of(upcoming.getKey(), values);
            }

            if (comparator.compare(next.getKey(), upcoming.getKey()) == 0) {
                values.add(next.getValue());
            } else {
                stream.pushback();
                return KeyValue.of(upcoming.getKey(), values);
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
        return String.format("%s folding %s", getClass().getSimpleName(), stream);
    }
}
