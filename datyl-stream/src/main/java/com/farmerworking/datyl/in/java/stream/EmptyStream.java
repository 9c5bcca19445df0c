package com.farmerworking.datyl.in.java.stream;

import com.farmerworking.datyl.in.java.api.KeyValue;

import java.util.Comparator;

public class EmptyStream<K, V> extends AbstractSortedStream<K, V> {
    public EmptyStream(Comparator<? super K> comparator) {
        super(comparator);
    }

    @Override
    protected KeyValue<K, V> read() {
        return null;
    }

    @Override
    protected boolean isSourceExhausted() {
        return true;
    }

    @Override
    protected void rewindSource() {
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
